package com.agentweave.engine;

import com.agentweave.workflow.config.OrchestratorConfig;
import com.agentweave.workflow.error.SynthesisException;
import com.agentweave.workflow.model.AgentResult;
import com.agentweave.workflow.model.SubTask;

import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/** Pattern with a fixed decomposition; synthesis joins successful outputs in order. */
final class FixedPlanOrchestrator extends BaseOrchestrator {

    private final Supplier<List<SubTask>> plan;
    volatile List<AgentResult> synthesizedOver;

    FixedPlanOrchestrator(Supplier<List<SubTask>> plan, OrchestratorConfig config, OrchestratorServices services) {
        super("fixed", config, services);
        this.plan = plan;
    }

    @Override
    public List<SubTask> decompose(String task, RunContext run) {
        return plan.get();
    }

    @Override
    public String synthesize(List<AgentResult> results, RunContext run) {
        synthesizedOver = results;
        List<AgentResult> ok = results.stream().filter(AgentResult::isSuccess).toList();
        if (ok.isEmpty()) throw new SynthesisException("No successful results to synthesize");
        return ok.stream().map(AgentResult::getOutput).collect(Collectors.joining("|"));
    }
}

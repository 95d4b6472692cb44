package com.agentweave.patterns;

import com.agentweave.engine.BaseOrchestrator;
import com.agentweave.engine.OrchestratorServices;
import com.agentweave.engine.RunContext;
import com.agentweave.workflow.config.OrchestratorConfig;
import com.agentweave.workflow.config.StepDefinition;
import com.agentweave.workflow.error.ConfigurationException;
import com.agentweave.workflow.model.AgentResult;
import com.agentweave.workflow.model.SubTask;

import java.util.List;

/**
 * Staged pipeline: the configured steps run one at a time in order, each seeing its
 * predecessor's result. Runs with a concurrency of 1 whatever {@code parallelExecution} says.
 */
public final class SequentialOrchestrator extends BaseOrchestrator {

    public static final String NAME = "sequential";
    static final String STEP_PREFIX = "step_";

    private final SynthesisFunction aggregator;

    public SequentialOrchestrator(OrchestratorConfig config, OrchestratorServices services) {
        this(config, services, null);
    }

    /**
     * @param aggregator replaces the labelled step concatenation; may be null
     * @throws ConfigurationException when no steps are configured
     */
    public SequentialOrchestrator(OrchestratorConfig config, OrchestratorServices services, SynthesisFunction aggregator) {
        super(NAME, config, services);
        if (this.config.getSteps().isEmpty()) {
            throw new ConfigurationException("Sequential workflow requires at least one step");
        }
        this.aggregator = aggregator;
    }

    @Override
    public List<SubTask> decompose(String task, RunContext run) {
        return StepChain.chain(config.getSteps(), STEP_PREFIX);
    }

    @Override
    public String synthesize(List<AgentResult> results, RunContext run) {
        if (aggregator != null) return aggregator.synthesize(results, run);
        return StepChain.render(config.getSteps(), STEP_PREFIX, results);
    }

    @Override
    protected int concurrency(RunContext run) {
        return 1;
    }

    public List<StepDefinition> getSteps() {
        return config.getSteps();
    }
}

package com.agentweave.patterns;

import com.agentweave.engine.BaseOrchestrator;
import com.agentweave.engine.OrchestratorServices;
import com.agentweave.engine.RunContext;
import com.agentweave.workflow.config.OrchestratorConfig;
import com.agentweave.workflow.config.StepDefinition;
import com.agentweave.workflow.error.ConfigurationException;
import com.agentweave.workflow.error.DecompositionException;
import com.agentweave.workflow.event.WorkflowEventType;
import com.agentweave.workflow.model.AgentResult;
import com.agentweave.workflow.model.SubTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Runs exactly one of several named branches. The branch is chosen by the
 * {@link ConditionEvaluator} when one is supplied, else by the configured {@code condition},
 * else by the context value under {@code conditionKey}; an unmatched value falls back to
 * {@code defaultBranch}. The selected branch's steps are chained like a sequential workflow;
 * the other branches are never executed.
 */
public final class ConditionalOrchestrator extends BaseOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ConditionalOrchestrator.class);

    public static final String NAME = "conditional";
    public static final String METADATA_SELECTED_BRANCH = "selected_branch";

    private final ConditionEvaluator evaluator;
    private final SynthesisFunction aggregator;

    public ConditionalOrchestrator(OrchestratorConfig config, OrchestratorServices services) {
        this(config, services, null, null);
    }

    /**
     * @param evaluator  computes the branch name from the context; may be null
     * @param aggregator replaces the labelled step concatenation; may be null
     * @throws ConfigurationException on an empty branch map, an empty branch or an unknown default branch
     */
    public ConditionalOrchestrator(OrchestratorConfig config, OrchestratorServices services,
                                   ConditionEvaluator evaluator, SynthesisFunction aggregator) {
        super(NAME, config, services);
        validateBranches(this.config);
        this.evaluator = evaluator;
        this.aggregator = aggregator;
    }

    private static void validateBranches(OrchestratorConfig config) {
        Map<String, List<StepDefinition>> branches = config.getBranches();
        if (branches.isEmpty()) {
            throw new ConfigurationException("Conditional workflow requires at least one branch");
        }
        branches.forEach((name, steps) -> {
            if (steps.isEmpty()) throw new ConfigurationException("Branch '" + name + "' has no steps");
        });
        if (config.getDefaultBranch() != null && !branches.containsKey(config.getDefaultBranch())) {
            throw new ConfigurationException("Default branch '" + config.getDefaultBranch()
                    + "' is not one of " + branches.keySet());
        }
    }

    @Override
    public List<SubTask> decompose(String task, RunContext run) {
        String value = conditionValue(task, run);
        String branch = config.getBranches().containsKey(value) ? value : config.getDefaultBranch();
        if (branch == null) {
            throw new DecompositionException("No branch matches condition '" + value
                    + "' and no default branch is configured (branches: " + config.getBranches().keySet() + ")");
        }
        log.info("Branch selected | taskId={} | condition={} | branch={} | fallback={}",
                run.getTaskId(), value, branch, !branch.equals(value));
        run.putMetadata(METADATA_SELECTED_BRANCH, branch);
        run.emit(WorkflowEventType.BRANCH_SELECTED, payload("branch", branch, "condition", value));
        return StepChain.chain(config.getBranches().get(branch), prefix(branch));
    }

    private String conditionValue(String task, RunContext run) {
        if (evaluator != null) return evaluator.evaluate(run.getContext(), task);
        if (config.getCondition() != null) return config.getCondition();
        Object v = run.getContext().get(config.getConditionKey());
        return v != null ? v.toString() : null;
    }

    @Override
    public String synthesize(List<AgentResult> results, RunContext run) {
        if (aggregator != null) return aggregator.synthesize(results, run);
        String branch = (String) run.getMetadata().get(METADATA_SELECTED_BRANCH);
        return StepChain.render(config.getBranches().get(branch), prefix(branch), results);
    }

    private static String prefix(String branch) {
        return branch + "_step_";
    }
}

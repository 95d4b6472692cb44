package com.agentweave.patterns;

import com.agentweave.workflow.model.AgentResult;

import java.util.List;

/** Decides whether an iterative run has converged after a pass. */
@FunctionalInterface
public interface IterationPredicate {

    boolean test(String synthesis, List<AgentResult> passResults, int pass);

    /** Converged once a pass has every subtask succeed and a non-blank synthesis. */
    static IterationPredicate allSucceeded() {
        return (synthesis, results, pass) -> synthesis != null && !synthesis.isBlank()
                && !results.isEmpty() && results.stream().allMatch(AgentResult::isSuccess);
    }

    static IterationPredicate never() {
        return (synthesis, results, pass) -> false;
    }
}

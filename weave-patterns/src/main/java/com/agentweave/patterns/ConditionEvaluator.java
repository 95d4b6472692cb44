package com.agentweave.patterns;

import java.util.Map;

/** Computes the branch name for a conditional run from the run context and task. */
@FunctionalInterface
public interface ConditionEvaluator {

    String evaluate(Map<String, Object> context, String task);
}

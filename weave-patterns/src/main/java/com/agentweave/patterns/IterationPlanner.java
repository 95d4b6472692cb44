package com.agentweave.patterns;

import com.agentweave.engine.RunContext;
import com.agentweave.workflow.model.SubTask;

import java.util.List;

/**
 * Plans one refinement pass. Ids only need to be unique within the pass; the iterative
 * pattern prefixes them per pass.
 */
@FunctionalInterface
public interface IterationPlanner {

    /**
     * @param previousSynthesis synthesis of the previous pass; null on the first pass
     * @param pass              1-based pass number
     */
    List<SubTask> plan(String task, String previousSynthesis, int pass, RunContext run);
}

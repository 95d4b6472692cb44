package com.agentweave.patterns;

import com.agentweave.engine.RunContext;
import com.agentweave.workflow.model.SubTask;

import java.util.List;

/** Produces the subtasks for a task, replacing a pattern's built-in decomposition. */
@FunctionalInterface
public interface TaskPlanner {

    List<SubTask> plan(String task, RunContext run);
}

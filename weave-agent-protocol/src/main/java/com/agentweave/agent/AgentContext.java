package com.agentweave.agent;

import com.agentweave.workflow.model.AgentResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What an executor sees besides the subtask itself: the run's task text, title and
 * context bag, and the results of the subtask's declared dependencies (in dependency
 * declaration order).
 */
public final class AgentContext {

    private final String taskId;
    private final String task;
    private final String title;
    private final Map<String, Object> runContext;
    private final List<AgentResult> dependencyResults;

    public AgentContext(String taskId, String task, String title, Map<String, Object> runContext,
                        List<AgentResult> dependencyResults) {
        this.taskId = taskId;
        this.task = task != null ? task : "";
        this.title = title;
        this.runContext = runContext != null ? Collections.unmodifiableMap(new LinkedHashMap<>(runContext)) : Map.of();
        this.dependencyResults = dependencyResults != null ? List.copyOf(dependencyResults) : List.of();
    }

    public String getTaskId() {
        return taskId;
    }

    public String getTask() {
        return task;
    }

    public String getTitle() {
        return title;
    }

    public Map<String, Object> getRunContext() {
        return runContext;
    }

    public List<AgentResult> getDependencyResults() {
        return dependencyResults;
    }

    /** Output of the named dependency, or null when it is not a dependency or produced no output. */
    public String dependencyOutput(String subtaskId) {
        for (AgentResult r : dependencyResults) {
            if (r.getAgentId().equals(subtaskId)) {
                return r.isSuccess() ? r.getOutput() : null;
            }
        }
        return null;
    }
}

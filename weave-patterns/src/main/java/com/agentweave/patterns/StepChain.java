package com.agentweave.patterns;

import com.agentweave.workflow.config.StepDefinition;
import com.agentweave.workflow.model.AgentResult;
import com.agentweave.workflow.model.SubTask;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Turns an ordered list of step definitions into chained subtasks ({@code <prefix>1},
 * {@code <prefix>2}, ...), each depending on its predecessor, and renders their results as
 * {@code ## Step n: name} sections. Shared by the sequential and conditional patterns.
 */
final class StepChain {

    private StepChain() {
    }

    static List<SubTask> chain(List<StepDefinition> steps, String prefix) {
        List<SubTask> out = new ArrayList<>(steps.size());
        String previous = null;
        for (int i = 0; i < steps.size(); i++) {
            SubTask t = steps.get(i).toSubTask(prefix + (i + 1));
            if (previous != null) t = t.withAdditionalDependencies(Set.of(previous));
            out.add(t);
            previous = t.getId();
        }
        return out;
    }

    static String render(List<StepDefinition> steps, String prefix, List<AgentResult> results) {
        Map<String, AgentResult> byId = results.stream()
                .collect(Collectors.toMap(AgentResult::getAgentId, Function.identity(), (a, b) -> a));
        List<String> sections = new ArrayList<>(steps.size());
        for (int i = 0; i < steps.size(); i++) {
            AgentResult r = byId.get(prefix + (i + 1));
            if (r == null) continue;
            String header = "## Step " + (i + 1) + ": " + steps.get(i).getName();
            if (r.isSuccess()) {
                sections.add(header + "\n\n" + r.getOutput().strip());
            } else {
                sections.add(header + " (" + r.getStatus().toValue() + ")\n\n_" + r.getError() + "_");
            }
        }
        return String.join("\n\n", sections);
    }
}

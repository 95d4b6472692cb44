package com.agentweave.patterns;

import com.agentweave.workflow.model.AgentResult;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Single responsibility: join agent outputs into one labelled text block, in the order given.
 * <pre>
 * ### label-a
 *
 * output a
 *
 * ### label-b
 *
 * output b
 * </pre>
 */
public final class OutputCombiner {

    private OutputCombiner() {
    }

    public static String combine(List<AgentResult> results, Function<AgentResult, String> label) {
        if (results == null || results.isEmpty()) return "";
        return results.stream()
                .map(r -> section(labelOf(r, label), r.getOutput()))
                .collect(Collectors.joining("\n\n"));
    }

    public static String combineTexts(List<String> labels, List<String> texts) {
        List<String> sections = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            String label = i < labels.size() ? labels.get(i) : "Part " + (i + 1);
            sections.add(section(label, texts.get(i)));
        }
        return String.join("\n\n", sections);
    }

    public static List<AgentResult> successes(List<AgentResult> results) {
        return results.stream().filter(AgentResult::isSuccess).toList();
    }

    private static String labelOf(AgentResult r, Function<AgentResult, String> label) {
        String l = label != null ? label.apply(r) : null;
        return l != null && !l.isBlank() ? l.trim() : r.getAgentId();
    }

    private static String section(String label, String text) {
        return "### " + label + "\n\n" + (text != null ? text.strip() : "");
    }
}

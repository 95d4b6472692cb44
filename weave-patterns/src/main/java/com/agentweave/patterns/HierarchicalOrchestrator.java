package com.agentweave.patterns;

import com.agentweave.engine.BaseOrchestrator;
import com.agentweave.engine.OrchestratorServices;
import com.agentweave.engine.RunContext;
import com.agentweave.workflow.config.OrchestratorConfig;
import com.agentweave.workflow.error.SynthesisException;
import com.agentweave.workflow.model.AgentResult;
import com.agentweave.workflow.model.AgentType;
import com.agentweave.workflow.model.SubTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Multi-tier research: independent tier-1 workers, one tier-2 synthesizer per group of
 * {@code groupSize} successful tier-1 results, then a single tier-3 executive synthesis when
 * more than one tier-2 output exists.
 * <p>
 * Tier-2 and tier-3 calls go through the run's bounded scheduler but are not part of the
 * run's agent results; their cost and tokens are.
 */
public final class HierarchicalOrchestrator extends BaseOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(HierarchicalOrchestrator.class);

    public static final String NAME = "hierarchical";
    public static final int DEFAULT_AGENTS = 8;

    static final List<String> DEFAULT_PERSPECTIVES = List.of(
            "background and history",
            "current state",
            "key actors and stakeholders",
            "evidence and data",
            "challenges and risks",
            "opportunities",
            "controversies and debates",
            "future outlook");

    private final TaskPlanner planner;

    public HierarchicalOrchestrator(OrchestratorConfig config, OrchestratorServices services) {
        this(config, services, null);
    }

    /** @param planner replaces the perspective-based tier-1 decomposition; may be null */
    public HierarchicalOrchestrator(OrchestratorConfig config, OrchestratorServices services, TaskPlanner planner) {
        super(NAME, config, services);
        this.planner = planner;
    }

    @Override
    public List<SubTask> decompose(String task, RunContext run) {
        if (planner != null) return planner.plan(task, run);
        int count = config.numAgentsOr(DEFAULT_AGENTS);
        List<String> perspectives = config.getPerspectives().isEmpty() ? DEFAULT_PERSPECTIVES : config.getPerspectives();
        List<SubTask> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String perspective = perspectives.get(i % perspectives.size());
            out.add(SubTask.builder("tier1_" + (i + 1))
                    .description("Research the following from the perspective of " + perspective + ".\n\n" + task)
                    .agentType(AgentType.WORKER)
                    .specialization(perspective)
                    .contextValue("tier", 1)
                    .contextValue("perspective", perspective)
                    .build());
        }
        return out;
    }

    @Override
    public String synthesize(List<AgentResult> results, RunContext run) {
        List<AgentResult> tier1 = OutputCombiner.successes(results);
        run.putMetadata("tier1_success_count", tier1.size());
        if (tier1.isEmpty()) {
            throw new SynthesisException("No successful tier-1 results to synthesize (" + results.size() + " attempted)");
        }

        List<String> labels = new ArrayList<>();
        List<String> texts = new ArrayList<>();
        if (config.isEnableTier2Synthesis()) {
            List<SubTask> calls = tier2Calls(tier1, run);
            List<AgentResult> tier2 = runAuxiliary(run, calls);
            if (run.isCancelled()) return null;
            for (AgentResult r : tier2) {
                if (r.isSuccess()) {
                    labels.add("Group " + (labels.size() + 1));
                    texts.add(r.getOutput());
                } else {
                    log.warn("Tier-2 group dropped | taskId={} | id={} | error={}", run.getTaskId(), r.getAgentId(), r.getError());
                    run.addWarning("Tier-2 synthesis " + r.getAgentId() + " failed: " + r.getError());
                }
            }
            run.putMetadata("tier2_synthesis_count", calls.size());
            if (texts.isEmpty()) {
                throw new SynthesisException("Every tier-2 synthesis call failed (" + calls.size() + " groups)");
            }
        } else {
            for (AgentResult r : tier1) {
                labels.add(labelOf(r));
                texts.add(r.getOutput());
            }
            run.putMetadata("tier2_synthesis_count", 0);
        }

        if (texts.size() == 1) {
            run.putMetadata("tier3_synthesis", false);
            return texts.get(0);
        }
        String combined = OutputCombiner.combineTexts(labels, texts);
        if (!config.isEnableTier3Synthesis()) {
            run.putMetadata("tier3_synthesis", false);
            return combined;
        }
        SubTask executive = SubTask.builder("tier3_executive")
                .description("Write an executive synthesis of the following research summaries on: "
                        + run.getTitle() + "\n\n" + combined)
                .agentType(AgentType.EXECUTIVE)
                .contextValue("tier", 3)
                .contextValue("source_count", texts.size())
                .build();
        AgentResult result = callAuxiliary(run, executive);
        if (run.isCancelled()) return null;
        if (!result.isSuccess()) {
            throw new SynthesisException("Tier-3 executive synthesis failed: " + result.getError());
        }
        run.putMetadata("tier3_synthesis", true);
        return result.getOutput();
    }

    private List<SubTask> tier2Calls(List<AgentResult> tier1, RunContext run) {
        int groupSize = config.getGroupSize();
        List<SubTask> calls = new ArrayList<>();
        for (int start = 0; start < tier1.size(); start += groupSize) {
            List<AgentResult> group = tier1.subList(start, Math.min(start + groupSize, tier1.size()));
            int n = calls.size() + 1;
            calls.add(SubTask.builder("tier2_" + n)
                    .description("Synthesize the following research findings on: " + run.getTitle() + "\n\n"
                            + OutputCombiner.combine(group, HierarchicalOrchestrator::labelOf))
                    .agentType(AgentType.SYNTHESIZER)
                    .contextValue("tier", 2)
                    .contextValue("source_ids", group.stream().map(AgentResult::getAgentId).toList())
                    .build());
        }
        log.debug("Tier-2 grouping | taskId={} | tier1={} | groupSize={} | groups={}",
                run.getTaskId(), tier1.size(), groupSize, calls.size());
        return calls;
    }

    private static String labelOf(AgentResult r) {
        return "Finding " + r.getAgentId();
    }
}

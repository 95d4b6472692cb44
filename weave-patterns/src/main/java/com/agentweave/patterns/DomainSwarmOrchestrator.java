package com.agentweave.patterns;

import com.agentweave.engine.BaseOrchestrator;
import com.agentweave.engine.OrchestratorServices;
import com.agentweave.engine.RunContext;
import com.agentweave.workflow.config.OrchestratorConfig;
import com.agentweave.workflow.error.DecompositionException;
import com.agentweave.workflow.error.SynthesisException;
import com.agentweave.workflow.model.AgentResult;
import com.agentweave.workflow.model.AgentType;
import com.agentweave.workflow.model.SubTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parallel domain swarm: one independent subtask per search domain, then one
 * combine-and-summarize call over every successful result.
 * <p>
 * Domains come from the context key {@value #CONTEXT_DOMAINS} or the configured list when
 * given; otherwise they are derived from keywords in the task text and padded with the default
 * domains. {@code allowedAgentTypes} filters both.
 */
public final class DomainSwarmOrchestrator extends BaseOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DomainSwarmOrchestrator.class);

    public static final String NAME = "swarm";
    public static final int DEFAULT_AGENTS = 5;
    public static final String CONTEXT_DOMAINS = "domains";

    public DomainSwarmOrchestrator(OrchestratorConfig config, OrchestratorServices services) {
        super(NAME, config, services);
    }

    @Override
    public List<SubTask> decompose(String task, RunContext run) {
        List<AgentType> domains = selectDomains(task, run);
        if (domains.isEmpty()) {
            throw new DecompositionException("No search domains available for the swarm (allowed: "
                    + (config.getAllowedAgentTypes().isEmpty() ? "all" : config.getAllowedAgentTypes()) + ")");
        }
        log.info("Swarm domains selected | taskId={} | domains={}", run.getTaskId(), domains);
        List<SubTask> out = new ArrayList<>(domains.size());
        for (AgentType domain : domains) {
            out.add(SubTask.builder("swarm_" + domain.toValue())
                    .description("Search and report on " + DomainKeywords.focus(domain) + " for the following task.\n\n" + task)
                    .agentType(domain)
                    .specialization(domain.toValue())
                    .contextValue("domain", domain.toValue())
                    .build());
        }
        return out;
    }

    List<AgentType> selectDomains(String task, RunContext run) {
        List<AgentType> explicit = explicitDomains(run);
        Set<AgentType> selected = new LinkedHashSet<>();
        if (!explicit.isEmpty()) {
            explicit.stream().filter(AgentType::isDomain).filter(this::allowed).forEach(selected::add);
            List<AgentType> out = new ArrayList<>(selected);
            return config.getNumAgents() != null ? truncate(out, config.getNumAgents()) : out;
        }
        int count = config.numAgentsOr(DEFAULT_AGENTS);
        DomainKeywords.match(task).stream().filter(this::allowed).forEach(selected::add);
        for (AgentType fallback : DomainKeywords.DEFAULT_DOMAINS) {
            if (selected.size() >= count) break;
            if (allowed(fallback)) selected.add(fallback);
        }
        return truncate(new ArrayList<>(selected), count);
    }

    private List<AgentType> explicitDomains(RunContext run) {
        Object fromContext = run.getContext().get(CONTEXT_DOMAINS);
        List<AgentType> out = new ArrayList<>();
        if (fromContext instanceof Collection<?> values) {
            for (Object v : values) {
                if (v != null) out.add(v instanceof AgentType t ? t : AgentType.fromValue(v.toString()));
            }
        } else if (fromContext instanceof String csv && !csv.isBlank()) {
            for (String v : csv.split(",")) {
                if (!v.isBlank()) out.add(AgentType.fromValue(v));
            }
        }
        return out.isEmpty() ? config.getDomains() : out;
    }

    private boolean allowed(AgentType type) {
        return config.getAllowedAgentTypes().isEmpty() || config.getAllowedAgentTypes().contains(type);
    }

    private static List<AgentType> truncate(List<AgentType> domains, int max) {
        return domains.size() > max ? new ArrayList<>(domains.subList(0, max)) : domains;
    }

    @Override
    public String synthesize(List<AgentResult> results, RunContext run) {
        List<AgentResult> ok = OutputCombiner.successes(results);
        if (ok.isEmpty()) {
            throw new SynthesisException("No domain agent succeeded (" + results.size() + " attempted)");
        }
        String combined = OutputCombiner.combine(ok, r -> r.getAgentType() != null ? r.getAgentType().toValue() : null);
        if (!config.isSummarize()) return combined;
        SubTask summary = SubTask.builder("swarm_summary")
                .description("Combine and summarize the following domain findings into one report on: "
                        + run.getTitle() + "\n\n" + combined)
                .agentType(AgentType.SYNTHESIZER)
                .contextValue("source_count", ok.size())
                .build();
        AgentResult result = callAuxiliary(run, summary);
        if (run.isCancelled()) return null;
        if (!result.isSuccess()) {
            throw new SynthesisException("Swarm summary failed: " + result.getError());
        }
        return result.getOutput();
    }
}

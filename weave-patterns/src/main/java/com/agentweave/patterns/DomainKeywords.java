package com.agentweave.patterns;

import com.agentweave.workflow.model.AgentType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Keyword table used by the swarm pattern to derive search domains from the task text. */
final class DomainKeywords {

    static final List<AgentType> DOMAIN_TYPES = List.of(
            AgentType.TEXT, AgentType.IMAGE, AgentType.VIDEO, AgentType.NEWS, AgentType.ACADEMIC,
            AgentType.SOCIAL, AgentType.PRODUCT, AgentType.TECHNICAL, AgentType.GENERAL);

    static final List<AgentType> DEFAULT_DOMAINS = List.of(
            AgentType.TEXT, AgentType.GENERAL, AgentType.NEWS, AgentType.ACADEMIC, AgentType.TECHNICAL);

    private static final Map<AgentType, List<String>> KEYWORDS;

    static {
        Map<AgentType, List<String>> m = new EnumMap<>(AgentType.class);
        m.put(AgentType.TEXT, List.of("article", "text", "document", "write", "explain", "summary"));
        m.put(AgentType.IMAGE, List.of("image", "photo", "picture", "visual", "diagram", "illustration"));
        m.put(AgentType.VIDEO, List.of("video", "youtube", "clip", "footage", "tutorial", "lecture"));
        m.put(AgentType.NEWS, List.of("news", "latest", "recent", "today", "breaking", "current events"));
        m.put(AgentType.ACADEMIC, List.of("research", "study", "paper", "journal", "academic", "scientific"));
        m.put(AgentType.SOCIAL, List.of("social", "twitter", "reddit", "opinion", "community", "trending"));
        m.put(AgentType.PRODUCT, List.of("product", "buy", "price", "review", "compare", "shopping"));
        m.put(AgentType.TECHNICAL, List.of("code", "api", "software", "technical", "documentation", "programming"));
        m.put(AgentType.GENERAL, List.of("overview", "general", "background", "what is", "history"));
        KEYWORDS = Collections.unmodifiableMap(m);
    }

    private DomainKeywords() {
    }

    /** Domains whose keywords occur in the task, in {@link #DOMAIN_TYPES} order. */
    static List<AgentType> match(String task) {
        List<AgentType> out = new ArrayList<>();
        if (task == null || task.isBlank()) return out;
        String text = task.toLowerCase(Locale.ROOT);
        for (AgentType type : DOMAIN_TYPES) {
            for (String keyword : KEYWORDS.get(type)) {
                if (text.contains(keyword)) {
                    out.add(type);
                    break;
                }
            }
        }
        return out;
    }

    static String focus(AgentType type) {
        return switch (type) {
            case TEXT -> "written sources and reference text";
            case IMAGE -> "images and visual material";
            case VIDEO -> "video content";
            case NEWS -> "recent news coverage";
            case ACADEMIC -> "academic and scientific literature";
            case SOCIAL -> "social media and community discussion";
            case PRODUCT -> "products, pricing and reviews";
            case TECHNICAL -> "technical documentation and code";
            default -> "general background";
        };
    }
}

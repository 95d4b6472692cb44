package com.agentweave.agent;

import java.util.List;

/**
 * Renders the final synthesis into documents (markdown, pdf, ...). Rendering is outside the
 * engine; implementations return references (paths or URLs) to what they produced.
 */
@FunctionalInterface
public interface DocumentGenerator {

    /**
     * @param text    final synthesis text
     * @param formats requested formats, e.g. {@code ["markdown", "pdf"]}
     * @return artifact references, one or more per format; never null
     * @throws Exception on rendering failure; the engine records it as a warning
     */
    List<String> generate(String text, List<String> formats) throws Exception;
}

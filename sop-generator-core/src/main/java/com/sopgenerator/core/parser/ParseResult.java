package com.sopgenerator.core.parser;

import com.sopgenerator.core.model.PipelineWarning;
import com.sopgenerator.core.model.ProcessGraph;

import java.util.List;
import java.util.Objects;

/**
 * Result of parsing a diagram.
 *
 * @param graph parsed process graph
 * @param warnings recoverable issues found while parsing
 */
public record ParseResult(
    ProcessGraph graph,
    List<PipelineWarning> warnings
) {
    /**
     * Compact constructor with validation.
     */
    public ParseResult {
        Objects.requireNonNull(graph, "graph must not be null");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Returns true if the parser reported warnings.
     *
     * @return true when warnings are present
     */
    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}

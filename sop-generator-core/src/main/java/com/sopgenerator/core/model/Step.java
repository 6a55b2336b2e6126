package com.sopgenerator.core.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One ordered unit of the linearized procedure.
 *
 * <p>The position of a step in the sequence is the document's core contract: steps are
 * rendered exactly in ordinal order, and nested branches are expressed through {@code depth}.
 *
 * @param ordinal 1-based position in the step sequence
 * @param ref printed reference ("3", "3A") or empty for marker rows
 * @param kind step kind
 * @param depth branch nesting level, 0 for the main sequence
 * @param branchLabel label of the branch this step heads, or null
 * @param parallel whether this step heads a parallel branch
 * @param elementIds ids of the diagram elements the step originates from
 * @param paragraphs narrative paragraphs in display order
 * @param laneName name of the performing lane, or null
 * @param raci RACI assignment of the performing lane
 * @param sla service level of the step, or null
 */
public record Step(
    int ordinal,
    String ref,
    StepKind kind,
    int depth,
    String branchLabel,
    boolean parallel,
    List<String> elementIds,
    List<Paragraph> paragraphs,
    String laneName,
    Raci raci,
    String sla
) {
    /**
     * Compact constructor with validation.
     */
    public Step {
        Objects.requireNonNull(kind, "kind must not be null");
        if (ordinal < 1) {
            throw new IllegalArgumentException("ordinal must be positive: " + ordinal);
        }
        if (depth < 0) {
            throw new IllegalArgumentException("depth must not be negative: " + depth);
        }
        if (ref == null) {
            ref = "";
        }
        elementIds = elementIds == null ? List.of() : List.copyOf(elementIds);
        paragraphs = paragraphs == null ? List.of() : List.copyOf(paragraphs);
        if (raci == null) {
            raci = Raci.notApplicable();
        }
    }

    /**
     * Returns the first title paragraph, or the first paragraph when there is no title.
     *
     * @return heading text, empty if the step has no paragraphs
     */
    public String title() {
        return paragraphs.stream()
            .filter(p -> p.role() == ParagraphRole.TITLE)
            .findFirst()
            .or(() -> paragraphs.stream().findFirst())
            .map(Paragraph::text)
            .orElse("");
    }

    /**
     * Returns the whole narrative as plain text, one paragraph per line.
     *
     * @return narrative text
     */
    public String text() {
        return paragraphs.stream()
            .map(Paragraph::text)
            .collect(Collectors.joining("\n"));
    }
}

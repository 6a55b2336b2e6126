package com.sopgenerator.core.model;

import java.util.Objects;

/**
 * Directed edge between two diagram elements.
 *
 * @param id flow identifier
 * @param sourceId source element id
 * @param targetId target element id
 * @param conditionLabel flow name, used as the branch condition (nullable)
 * @param documentation explanation of the condition (nullable)
 * @param documentOrder position of the flow in the source markup
 */
public record SequenceFlow(
    String id,
    String sourceId,
    String targetId,
    String conditionLabel,
    String documentation,
    int documentOrder
) {
    /**
     * Compact constructor with validation.
     */
    public SequenceFlow {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(targetId, "targetId must not be null");
        if (conditionLabel != null && conditionLabel.isBlank()) {
            conditionLabel = null;
        }
    }

    /**
     * Returns true if the flow carries a condition label.
     *
     * @return true when labeled
     */
    public boolean hasConditionLabel() {
        return conditionLabel != null;
    }
}

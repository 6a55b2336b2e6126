package com.sopgenerator.core.model;

import java.util.Objects;

/**
 * Flow node of a process diagram.
 *
 * @param id unique identifier within the diagram
 * @param kind resolved element kind
 * @param label display label, whitespace collapsed (empty when unnamed)
 * @param laneId owning lane id, or null when the element is not in a lane
 * @param sourceTag local name of the XML element the node was read from
 * @param documentation untyped documentation text, or null
 * @param sla service level taken from the element or its enclosing SLA group, or null
 * @param eventType event trigger ({@link EventType#NONE} for non-events)
 * @param attachedToId activity a boundary event is attached to, or null
 * @param interrupting whether a boundary event cancels the activity
 * @param documentOrder position of the element in the source markup
 */
public record DiagramElement(
    String id,
    ElementKind kind,
    String label,
    String laneId,
    String sourceTag,
    String documentation,
    String sla,
    EventType eventType,
    String attachedToId,
    boolean interrupting,
    int documentOrder
) {
    /**
     * Compact constructor with validation.
     */
    public DiagramElement {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (label == null) {
            label = "";
        }
        if (sourceTag == null) {
            sourceTag = "";
        }
        if (eventType == null) {
            eventType = EventType.NONE;
        }
    }

    /**
     * Convenience constructor for plain nodes without documentation or event details.
     *
     * @param id element id
     * @param kind element kind
     * @param label display label
     * @param laneId lane id or null
     * @param documentOrder position in the source markup
     */
    public DiagramElement(String id, ElementKind kind, String label, String laneId, int documentOrder) {
        this(id, kind, label, laneId, null, null, null, EventType.NONE, null, true, documentOrder);
    }

    /**
     * Returns true if the element carries a non-blank label.
     *
     * @return true when labeled
     */
    public boolean hasLabel() {
        return !label.isBlank();
    }

    /**
     * Returns a copy of this element with the given SLA.
     *
     * @param newSla SLA text
     * @return element with SLA set
     */
    public DiagramElement withSla(String newSla) {
        return new DiagramElement(id, kind, label, laneId, sourceTag, documentation, newSla,
            eventType, attachedToId, interrupting, documentOrder);
    }
}

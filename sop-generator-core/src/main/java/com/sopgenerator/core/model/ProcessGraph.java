package com.sopgenerator.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable graph of one parsed process diagram.
 *
 * <p>Elements, flows and lanes are stored as flat lists addressed by id. Adjacency is derived
 * once at construction time and kept in a {@link GraphIndex}; nothing in the graph is ever
 * mutated after it is built, so later pipeline stages may read it freely.
 *
 * @param processId id of the process element
 * @param elements flow nodes in document order
 * @param flows sequence flows in document order
 * @param lanes lanes in document order
 * @param metadata document metadata declared in the diagram
 * @param index derived lookup tables
 */
public record ProcessGraph(
    String processId,
    List<DiagramElement> elements,
    List<SequenceFlow> flows,
    List<Lane> lanes,
    DiagramMetadata metadata,
    GraphIndex index
) {
    /**
     * Compact constructor with validation. The index is derived when not supplied.
     */
    public ProcessGraph {
        Objects.requireNonNull(processId, "processId must not be null");
        elements = elements == null ? List.of() : List.copyOf(elements);
        flows = flows == null ? List.of() : List.copyOf(flows);
        lanes = lanes == null ? List.of() : List.copyOf(lanes);
        if (metadata == null) {
            metadata = DiagramMetadata.empty();
        }
        if (index == null) {
            index = GraphIndex.build(elements, flows, lanes);
        }
    }

    /**
     * Creates a graph and derives its index.
     *
     * @param processId process id
     * @param elements flow nodes
     * @param flows sequence flows
     * @param lanes lanes
     * @param metadata declared metadata
     * @return new graph
     */
    public static ProcessGraph of(String processId, List<DiagramElement> elements, List<SequenceFlow> flows,
                                  List<Lane> lanes, DiagramMetadata metadata) {
        return new ProcessGraph(processId, elements, flows, lanes, metadata, null);
    }

    /**
     * Looks up an element.
     *
     * @param id element id
     * @return the element, if present
     */
    public Optional<DiagramElement> element(String id) {
        return Optional.ofNullable(index.elementsById().get(id));
    }

    /**
     * Returns an element that is known to exist.
     *
     * @param id element id
     * @return the element
     * @throws IllegalArgumentException if no element has this id
     */
    public DiagramElement requireElement(String id) {
        return element(id).orElseThrow(() -> new IllegalArgumentException("Unknown element: " + id));
    }

    /**
     * Returns the outgoing flows of an element in document order.
     *
     * @param id element id
     * @return outgoing flows, empty for unknown ids
     */
    public List<SequenceFlow> outgoing(String id) {
        return index.outgoing().getOrDefault(id, List.of());
    }

    /**
     * Returns the incoming flows of an element in document order.
     *
     * @param id element id
     * @return incoming flows, empty for unknown ids
     */
    public List<SequenceFlow> incoming(String id) {
        return index.incoming().getOrDefault(id, List.of());
    }

    /**
     * Returns the lane an element belongs to.
     *
     * @param elementId element id
     * @return lane, if the element is grouped
     */
    public Optional<Lane> laneOf(String elementId) {
        return element(elementId)
            .map(DiagramElement::laneId)
            .map(laneId -> index.lanesById().get(laneId));
    }

    /**
     * Returns all elements of the given kind in document order.
     *
     * @param kind element kind
     * @return matching elements
     */
    public List<DiagramElement> elementsOfKind(ElementKind kind) {
        return elements.stream()
            .filter(element -> element.kind() == kind)
            .toList();
    }

    /**
     * Returns the boundary events attached to an activity, in document order.
     *
     * @param activityId activity id
     * @return attached boundary events
     */
    public List<DiagramElement> boundaryEventsOf(String activityId) {
        return elements.stream()
            .filter(element -> element.kind() == ElementKind.BOUNDARY_EVENT)
            .filter(element -> activityId.equals(element.attachedToId()))
            .toList();
    }
}

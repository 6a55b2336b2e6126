package com.sopgenerator.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lookup tables derived from the flat element, flow and lane lists of a {@link ProcessGraph}.
 *
 * @param elementsById elements keyed by id, in document order
 * @param outgoing outgoing flows per element id, in document order
 * @param incoming incoming flows per element id, in document order
 * @param lanesById lanes keyed by id
 */
public record GraphIndex(
    Map<String, DiagramElement> elementsById,
    Map<String, List<SequenceFlow>> outgoing,
    Map<String, List<SequenceFlow>> incoming,
    Map<String, Lane> lanesById
) {
    public GraphIndex {
        elementsById = elementsById == null ? Map.of() : elementsById;
        outgoing = outgoing == null ? Map.of() : outgoing;
        incoming = incoming == null ? Map.of() : incoming;
        lanesById = lanesById == null ? Map.of() : lanesById;
    }

    /**
     * Builds the index.
     *
     * @param elements diagram elements
     * @param flows sequence flows
     * @param lanes lanes
     * @return index over the given lists
     * @throws IllegalArgumentException if an id is duplicated or a flow endpoint is unknown
     */
    public static GraphIndex build(List<DiagramElement> elements, List<SequenceFlow> flows, List<Lane> lanes) {
        Map<String, DiagramElement> byId = new LinkedHashMap<>();
        for (DiagramElement element : elements) {
            if (byId.putIfAbsent(element.id(), element) != null) {
                throw new IllegalArgumentException("Duplicate element id: " + element.id());
            }
        }

        Map<String, List<SequenceFlow>> out = new LinkedHashMap<>();
        Map<String, List<SequenceFlow>> in = new LinkedHashMap<>();
        byId.keySet().forEach(id -> {
            out.put(id, new ArrayList<>());
            in.put(id, new ArrayList<>());
        });

        List<SequenceFlow> ordered = new ArrayList<>(flows);
        ordered.sort(Comparator.comparingInt(SequenceFlow::documentOrder));
        for (SequenceFlow flow : ordered) {
            if (!byId.containsKey(flow.sourceId()) || !byId.containsKey(flow.targetId())) {
                throw new IllegalArgumentException("Flow " + flow.id() + " references unknown element");
            }
            out.get(flow.sourceId()).add(flow);
            in.get(flow.targetId()).add(flow);
        }

        Map<String, Lane> laneIndex = new LinkedHashMap<>();
        lanes.forEach(lane -> laneIndex.put(lane.id(), lane));

        return new GraphIndex(
            Collections.unmodifiableMap(byId),
            freeze(out),
            freeze(in),
            Collections.unmodifiableMap(laneIndex)
        );
    }

    private static Map<String, List<SequenceFlow>> freeze(Map<String, List<SequenceFlow>> source) {
        Map<String, List<SequenceFlow>> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, List.copyOf(value)));
        return Collections.unmodifiableMap(copy);
    }
}

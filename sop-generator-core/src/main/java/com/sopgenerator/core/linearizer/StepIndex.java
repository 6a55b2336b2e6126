package com.sopgenerator.core.linearizer;

import com.sopgenerator.core.model.DiagramElement;
import com.sopgenerator.core.model.ElementKind;
import com.sopgenerator.core.model.ProcessGraph;
import com.sopgenerator.core.model.SequenceFlow;
import com.sopgenerator.core.model.StepKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Drafts of one linearization run and the element-to-draft mapping used to resolve
 * "Step N" references.
 */
final class StepIndex {

    final List<StepDraft> drafts = new ArrayList<>();
    final Map<String, StepDraft> byElement = new HashMap<>();
    /** Input number of every start event, in walk order. */
    final Map<String, Integer> inputNumbers = new LinkedHashMap<>();

    StepDraft draftOf(String elementId) {
        return byElement.get(elementId);
    }

    /**
     * Walks flows backwards from an element to the nearest activity that already has a step.
     *
     * @return the activity draft, or null when none precedes the element
     */
    StepDraft precedingActivity(ProcessGraph graph, String elementId) {
        Deque<String> queue = new ArrayDeque<>();
        Set<String> seen = new HashSet<>();
        enqueuePredecessors(graph, elementId, queue, seen);
        while (!queue.isEmpty()) {
            String id = queue.poll();
            StepDraft draft = byElement.get(id);
            if (draft != null && draft.kind == StepKind.ACTIVITY && id.equals(draft.element.id())) {
                return draft;
            }
            enqueuePredecessors(graph, id, queue, seen);
        }
        return null;
    }

    /**
     * Describes where the work flowing out of an element comes from: "Step 3" for the nearest
     * numbered activity, "Input 2" for a start event.
     *
     * @return source description, or null when nothing numbered precedes the element
     */
    String sourceLabel(ProcessGraph graph, String elementId) {
        Deque<String> queue = new ArrayDeque<>();
        Set<String> seen = new HashSet<>();
        queue.add(elementId);
        seen.add(elementId);
        while (!queue.isEmpty()) {
            String id = queue.poll();
            StepDraft draft = byElement.get(id);
            DiagramElement element = graph.requireElement(id);
            if (draft != null && draft.kind == StepKind.ACTIVITY && id.equals(draft.element.id())) {
                return "Step " + draft.ref;
            }
            if (element.kind() == ElementKind.START_EVENT && inputNumbers.containsKey(id)) {
                return "Input " + inputNumbers.get(id);
            }
            enqueuePredecessors(graph, id, queue, seen);
        }
        return null;
    }

    private static void enqueuePredecessors(ProcessGraph graph, String id, Deque<String> queue, Set<String> seen) {
        for (SequenceFlow flow : graph.incoming(id)) {
            if (seen.add(flow.sourceId())) {
                queue.add(flow.sourceId());
            }
        }
        graph.element(id)
            .filter(element -> element.kind() == ElementKind.BOUNDARY_EVENT)
            .map(DiagramElement::attachedToId)
            .filter(seen::add)
            .ifPresent(queue::add);
    }
}

package com.sopgenerator.core.linearizer;

import com.sopgenerator.core.exception.DiagramStructureException;
import com.sopgenerator.core.exception.PipelineStage;
import com.sopgenerator.core.model.DiagramElement;
import com.sopgenerator.core.model.ElementKind;
import com.sopgenerator.core.model.PipelineWarning;
import com.sopgenerator.core.model.ProcessGraph;
import com.sopgenerator.core.model.SequenceFlow;
import com.sopgenerator.core.model.Step;
import com.sopgenerator.core.model.StepKind;
import com.sopgenerator.core.model.WarningType;
import com.sopgenerator.core.util.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Turns a {@link ProcessGraph} into an ordered sequence of procedure {@link Step}s.
 *
 * <p>The graph is walked depth-first from every start event in document order. Traversal
 * rules:
 * <ul>
 *   <li>activities are numbered in the order they are emitted</li>
 *   <li>a split (gateway or activity with several outgoing flows) emits a marker step and one
 *       labeled branch per flow; branches are emitted one after another, never interleaved</li>
 *   <li>each branch stops at the split's merge point, which is then emitted once at the
 *       split's depth</li>
 *   <li>a flow back into the current path becomes a {@link StepKind#LOOP} marker, a flow into
 *       an element emitted elsewhere becomes a {@link StepKind#JUMP} marker</li>
 *   <li>boundary events open exception branches right after their activity</li>
 *   <li>gateways with a single outgoing flow are folded into the next emitted step</li>
 * </ul>
 *
 * <p>Every element is emitted at most once and every flow is followed at most once, so the
 * work is linear in the size of the graph apart from the merge point searches. Traversal
 * state lives in a per-call object; the linearizer itself is stateless and thread safe.
 */
public class StepLinearizer {

    private static final Logger log = LoggerFactory.getLogger(StepLinearizer.class);

    private final LinearizerOptions options;
    private final MergePointFinder mergePointFinder = new MergePointFinder();

    public StepLinearizer() {
        this(LinearizerOptions.defaults());
    }

    public StepLinearizer(LinearizerOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /**
     * Linearizes a process graph.
     *
     * @param graph parsed process graph
     * @return ordered steps with warnings
     * @throws DiagramStructureException if the graph has no start event
     */
    public Linearization linearize(ProcessGraph graph) {
        Objects.requireNonNull(graph, "graph must not be null");

        List<DiagramElement> starts = graph.elementsOfKind(ElementKind.START_EVENT);
        if (starts.isEmpty()) {
            throw new DiagramStructureException(PipelineStage.LINEARIZE, null,
                "No start event found in process '" + graph.processId() + "'");
        }

        Traversal traversal = new Traversal(graph);
        for (DiagramElement start : starts) {
            traversal.walkFromStart(start);
        }

        List<PipelineWarning> warnings = new ArrayList<>(traversal.warnings);
        for (DiagramElement element : graph.elements()) {
            if (!traversal.emitted.contains(element.id())) {
                warnings.add(new PipelineWarning(WarningType.UNREACHABLE_ELEMENT, element.id(),
                    "Element '" + displayName(element) + "' (" + element.kind() + ") is not reachable from any start event"));
            }
        }

        List<Step> steps = new NarrativeComposer(graph, options, traversal.index).compose();
        log.info("Linearized process '{}' into {} steps ({} warnings)", graph.processId(), steps.size(), warnings.size());
        return new Linearization(steps, warnings);
    }

    private static String displayName(DiagramElement element) {
        return element.hasLabel() ? element.label() : element.id();
    }

    /**
     * State of one linearization run.
     */
    private final class Traversal {

        private final ProcessGraph graph;
        private final StepIndex index = new StepIndex();
        private final Set<String> emitted = new HashSet<>();
        private final List<String> pending = new ArrayList<>();
        private final List<PipelineWarning> warnings = new ArrayList<>();
        private int activityCounter;

        private Traversal(ProcessGraph graph) {
            this.graph = graph;
        }

        void walkFromStart(DiagramElement start) {
            index.inputNumbers.put(start.id(), index.inputNumbers.size() + 1);
            if (emitted.contains(start.id())) {
                return;
            }
            log.debug("Walking from start event '{}'", start.id());
            walk(start.id(), 0, new HashSet<>(), Set.of());
            flushPending();
        }

        /**
         * Follows a chain of elements.
         *
         * @return the stop element the walk ended at, or null if it ended otherwise
         */
        private String walk(String id, int depth, Set<String> path, Set<String> stopAt) {
            String current = id;
            while (current != null) {
                if (stopAt.contains(current)) {
                    return current;
                }
                if (path.contains(current)) {
                    marker(StepKind.LOOP, current, depth);
                    return null;
                }
                if (emitted.contains(current)) {
                    marker(StepKind.JUMP, current, depth);
                    return null;
                }
                emitted.add(current);
                path.add(current);
                current = visit(graph.requireElement(current), depth, path, stopAt);
            }
            return null;
        }

        /**
         * Emits the step(s) of one element.
         *
         * @return next element on the same chain, or null
         */
        private String visit(DiagramElement element, int depth, Set<String> path, Set<String> stopAt) {
            switch (element.kind()) {
                case START_EVENT -> elementDraft(StepKind.START, element, depth);
                case TASK -> {
                    StepDraft draft = elementDraft(StepKind.ACTIVITY, element, depth);
                    draft.ref = String.valueOf(++activityCounter);
                    exceptionBranches(element, draft, depth, path, stopAt);
                }
                case SUB_PROCESS -> {
                    StepDraft draft = elementDraft(StepKind.SUB_PROCESS, element, depth);
                    exceptionBranches(element, draft, depth, path, stopAt);
                }
                case INTERMEDIATE_EVENT, BOUNDARY_EVENT -> elementDraft(StepKind.WAIT, element, depth);
                case END_EVENT -> elementDraft(StepKind.END, element, depth);
                case EXCLUSIVE_GATEWAY, INCLUSIVE_GATEWAY, PARALLEL_GATEWAY -> {
                    return gateway(element, depth, path, stopAt);
                }
                case UNSUPPORTED -> elementDraft(StepKind.UNSUPPORTED, element, depth);
            }
            return next(element, depth, path, stopAt);
        }

        private String next(DiagramElement element, int depth, Set<String> path, Set<String> stopAt) {
            List<SequenceFlow> outs = orderedOutgoing(element.id());
            if (outs.isEmpty()) {
                return null;
            }
            if (outs.size() == 1) {
                return outs.get(0).targetId();
            }
            // several flows leaving a non-gateway run in parallel
            StepDraft own = index.draftOf(element.id());
            StepDraft marker = newDraft(StepKind.PARALLEL, depth);
            marker.parallel = true;
            marker.anchor = own != null && own.kind == StepKind.ACTIVITY ? own : null;
            marker.baseRef = marker.anchor == null ? "" : marker.anchor.ref;
            return branches(element.id(), outs, marker, depth, path, stopAt);
        }

        private String gateway(DiagramElement gateway, int depth, Set<String> path, Set<String> stopAt) {
            List<SequenceFlow> outs = orderedOutgoing(gateway.id());
            if (outs.size() <= 1) {
                pending.add(gateway.id());
                return outs.isEmpty() ? null : outs.get(0).targetId();
            }

            boolean parallel = gateway.kind() == ElementKind.PARALLEL_GATEWAY;
            StepDraft marker = elementDraft(parallel ? StepKind.PARALLEL : StepKind.DECISION, gateway, depth);
            marker.parallel = parallel;
            marker.inclusive = gateway.kind() == ElementKind.INCLUSIVE_GATEWAY;
            marker.anchor = index.precedingActivity(graph, gateway.id());
            marker.baseRef = marker.anchor == null ? "" : marker.anchor.ref;
            return branches(gateway.id(), outs, marker, depth, path, stopAt);
        }

        /**
         * Emits one branch per outgoing flow of a split.
         *
         * @return merge point where the walk resumes, or null
         */
        private String branches(String splitId, List<SequenceFlow> outs, StepDraft marker, int depth,
                                Set<String> path, Set<String> stopAt) {
            List<String> targets = outs.stream().map(SequenceFlow::targetId).toList();
            Optional<String> merge = mergePointFinder.find(graph, splitId, targets, path);
            merge.ifPresent(id -> log.debug("Split '{}' merges at '{}'", splitId, id));

            Set<String> branchStop = new HashSet<>(stopAt);
            merge.ifPresent(branchStop::add);

            for (int i = 0; i < outs.size(); i++) {
                SequenceFlow flow = outs.get(i);
                StepDraft header = newDraft(StepKind.BRANCH, depth + 1);
                header.flow = flow;
                header.parallel = marker.parallel;
                header.inclusive = marker.inclusive;
                header.anchor = marker.anchor;
                header.branchLabel = branchLabel(flow, i, marker.parallel);
                if (!marker.parallel) {
                    header.caseLetter = TextUtils.letter(i);
                    header.ref = marker.baseRef + header.caseLetter;
                }
                runBranch(flow.targetId(), depth + 1, path, branchStop);
            }
            return merge.orElse(null);
        }

        private void exceptionBranches(DiagramElement activity, StepDraft activityDraft, int depth,
                                       Set<String> path, Set<String> stopAt) {
            List<String> normalTargets = orderedOutgoing(activity.id()).stream()
                .map(SequenceFlow::targetId)
                .toList();

            for (DiagramElement boundary : graph.boundaryEventsOf(activity.id())) {
                if (!emitted.add(boundary.id())) {
                    continue;
                }
                StepDraft header = newDraft(StepKind.BRANCH, depth + 1);
                header.element = boundary;
                header.elementIds.add(boundary.id());
                header.anchor = activityDraft.kind == StepKind.ACTIVITY ? activityDraft : null;
                header.branchLabel = "Exception: " + (boundary.hasLabel()
                    ? boundary.label()
                    : boundary.eventType().name().toLowerCase() + " event");
                index.byElement.put(boundary.id(), header);

                List<SequenceFlow> outs = orderedOutgoing(boundary.id());
                List<String> targets = Stream.concat(normalTargets.stream(), outs.stream().map(SequenceFlow::targetId))
                    .toList();
                Optional<String> merge = normalTargets.isEmpty() || outs.isEmpty()
                    ? Optional.empty()
                    : mergePointFinder.find(graph, activity.id(), targets, path);

                Set<String> branchStop = new HashSet<>(stopAt);
                merge.ifPresent(branchStop::add);
                for (SequenceFlow flow : outs) {
                    runBranch(flow.targetId(), depth + 1, path, branchStop);
                }
            }
        }

        private void runBranch(String firstId, int depth, Set<String> path, Set<String> stopAt) {
            String stoppedAt = walk(firstId, depth, new HashSet<>(path), stopAt);
            flushPending();
            if (stoppedAt != null) {
                StepDraft last = index.drafts.get(index.drafts.size() - 1);
                last.continueTo = stoppedAt;
            }
        }

        private String branchLabel(SequenceFlow flow, int position, boolean parallel) {
            if (flow.hasConditionLabel()) {
                return flow.conditionLabel();
            }
            if (parallel) {
                return "Path " + (position + 1);
            }
            warnings.add(new PipelineWarning(WarningType.UNLABELED_CONDITION, flow.id(),
                "Flow from '" + flow.sourceId() + "' has no condition label; numbered as Option " + (position + 1)));
            return "Option " + (position + 1);
        }

        private List<SequenceFlow> orderedOutgoing(String id) {
            List<SequenceFlow> outs = graph.outgoing(id);
            if (options.branchOrder() == BranchOrder.DOCUMENT || outs.size() < 2) {
                return outs;
            }
            List<SequenceFlow> sorted = new ArrayList<>(outs);
            sorted.sort(Comparator
                .comparing((SequenceFlow f) -> !f.hasConditionLabel())
                .thenComparing(f -> f.hasConditionLabel() ? f.conditionLabel() : "")
                .thenComparingInt(SequenceFlow::documentOrder));
            return sorted;
        }

        private StepDraft elementDraft(StepKind kind, DiagramElement element, int depth) {
            StepDraft draft = newDraft(kind, depth);
            draft.element = element;
            for (String id : pending) {
                draft.elementIds.add(id);
                index.byElement.put(id, draft);
            }
            pending.clear();
            draft.elementIds.add(element.id());
            index.byElement.put(element.id(), draft);
            return draft;
        }

        private void marker(StepKind kind, String targetId, int depth) {
            StepDraft draft = newDraft(kind, depth);
            draft.targetId = targetId;
        }

        private StepDraft newDraft(StepKind kind, int depth) {
            StepDraft draft = new StepDraft(kind, depth, index.drafts.size());
            index.drafts.add(draft);
            return draft;
        }

        /**
         * Attaches pass-through gateways left at the end of a chain to the last element step.
         */
        private void flushPending() {
            if (pending.isEmpty()) {
                return;
            }
            StepDraft owner = null;
            for (int i = index.drafts.size() - 1; i >= 0 && owner == null; i--) {
                if (index.drafts.get(i).element != null) {
                    owner = index.drafts.get(i);
                }
            }
            if (owner == null) {
                owner = index.drafts.get(index.drafts.size() - 1);
            }
            for (String id : pending) {
                owner.elementIds.add(id);
                index.byElement.put(id, owner);
            }
            pending.clear();
        }
    }
}

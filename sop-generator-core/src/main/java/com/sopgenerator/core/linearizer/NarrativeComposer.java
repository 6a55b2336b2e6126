package com.sopgenerator.core.linearizer;

import com.sopgenerator.core.model.DiagramElement;
import com.sopgenerator.core.model.ElementKind;
import com.sopgenerator.core.model.EventType;
import com.sopgenerator.core.model.Lane;
import com.sopgenerator.core.model.Paragraph;
import com.sopgenerator.core.model.ProcessGraph;
import com.sopgenerator.core.model.Raci;
import com.sopgenerator.core.model.SequenceFlow;
import com.sopgenerator.core.model.Step;
import com.sopgenerator.core.model.StepKind;
import com.sopgenerator.core.util.TextUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Writes the Guideline V2 wording of every step once the traversal has numbered all activities.
 *
 * <p>Sentence patterns:
 * <ul>
 *   <li>activity: "The {lane} shall {action}."</li>
 *   <li>join input: "Step Input: Step 2 and Step 3" ({@code and/or} after inclusive joins)</li>
 *   <li>interrupting boundary: "If {condition}, stop the activity and proceed to Step 4."</li>
 *   <li>non-interrupting boundary: "If {condition}, proceed to Step 4 and complete the activity,
 *       then proceed to Step 2."</li>
 *   <li>routing: "Proceed to Step 4", "Return to Step 1", "Process Ends (Request closed)"</li>
 * </ul>
 */
class NarrativeComposer {

    static final String DEFAULT_END_NAME = "Process Complete";

    private final ProcessGraph graph;
    private final LinearizerOptions options;
    private final StepIndex index;

    NarrativeComposer(ProcessGraph graph, LinearizerOptions options, StepIndex index) {
        this.graph = graph;
        this.options = options;
        this.index = index;
    }

    List<Step> compose() {
        List<Step> steps = new ArrayList<>(index.drafts.size());
        for (StepDraft draft : index.drafts) {
            List<Paragraph> paragraphs = new ArrayList<>(paragraphs(draft));
            boolean terminal = draft.kind == StepKind.LOOP || draft.kind == StepKind.JUMP || draft.kind == StepKind.END;
            if (draft.continueTo != null && !terminal) {
                paragraphs.add(Paragraph.routing(route(draft.continueTo, false, true)));
            }

            DiagramElement performer = performer(draft);
            Optional<Lane> lane = performer == null ? Optional.empty() : graph.laneOf(performer.id());
            String laneName = lane.map(Lane::name).filter(name -> !name.isBlank()).orElse(null);
            Raci raci = lane.map(Lane::raci).orElse(Raci.notApplicable());
            String sla = draft.element != null && draft.element.kind().isActivity() ? draft.element.sla() : null;

            steps.add(new Step(draft.index + 1, draft.ref, draft.kind, draft.depth, draft.branchLabel,
                draft.parallel, draft.elementIds, paragraphs, laneName, raci, sla));
        }
        return steps;
    }

    private List<Paragraph> paragraphs(StepDraft draft) {
        DiagramElement element = draft.element;
        return switch (draft.kind) {
            case START -> List.of(Paragraph.title(headline(draft)));
            case ACTIVITY -> activity(element);
            case SUB_PROCESS -> withDocumentation(headline(draft), element,
                "The " + actor(element) + " shall complete the "
                    + (element.hasLabel() ? element.label() + " process." : "sub-process."));
            case WAIT -> withDocumentation(headline(draft), element, null);
            case DECISION -> List.of(
                Paragraph.title(headline(draft)),
                Paragraph.body(draft.inclusive
                    ? "One or more of the following cases apply:"
                    : "Exactly one of the following cases applies:"));
            case PARALLEL -> List.of(
                Paragraph.title(headline(draft)),
                Paragraph.body("Proceed simultaneously with the following paths:"));
            case BRANCH -> branch(draft);
            case LOOP -> List.of(Paragraph.routing(route(draft.targetId, true, true)));
            case JUMP -> List.of(Paragraph.routing(route(draft.targetId, false, true)));
            case END -> List.of(Paragraph.routing("Process Ends (" + endName(element) + ")"));
            case UNSUPPORTED -> List.of(
                Paragraph.title(headline(draft)),
                Paragraph.body("Unsupported diagram element <" + element.sourceTag()
                    + ">; describe this step manually."));
        };
    }

    private List<Paragraph> activity(DiagramElement task) {
        List<Paragraph> paragraphs = new ArrayList<>();
        String title = activityTitle(task);
        paragraphs.add(Paragraph.title(title));
        stepInput(task).ifPresent(text -> paragraphs.add(Paragraph.body(text)));

        List<String> lines = lines(task.documentation());
        String action = lines.isEmpty() ? TextUtils.toSentenceCase(title) : lines.get(0);
        paragraphs.add(Paragraph.body(sentence(actor(task), action)));
        lines.stream().skip(1).map(Paragraph::body).forEach(paragraphs::add);

        for (DiagramElement boundary : graph.boundaryEventsOf(task.id())) {
            boundaryText(task, boundary).map(Paragraph::body).ifPresent(paragraphs::add);
        }
        return paragraphs;
    }

    private List<Paragraph> branch(StepDraft draft) {
        List<Paragraph> paragraphs = new ArrayList<>();
        if (draft.element != null) {
            paragraphs.add(Paragraph.title(draft.branchLabel));
            lines(draft.element.documentation()).stream().map(Paragraph::body).forEach(paragraphs::add);
        } else if (draft.parallel) {
            paragraphs.add(Paragraph.title("Simultaneously: " + draft.branchLabel));
        } else {
            paragraphs.add(Paragraph.title("Case " + draft.caseLetter + ": " + draft.branchLabel));
            lines(draft.flow.documentation()).stream().map(Paragraph::body).forEach(paragraphs::add);
        }
        return paragraphs;
    }

    private List<Paragraph> withDocumentation(String title, DiagramElement element, String fallback) {
        List<Paragraph> paragraphs = new ArrayList<>();
        paragraphs.add(Paragraph.title(title));
        List<String> lines = lines(element.documentation());
        if (lines.isEmpty() && fallback != null) {
            paragraphs.add(Paragraph.body(fallback));
        }
        lines.stream().map(Paragraph::body).forEach(paragraphs::add);
        return paragraphs;
    }

    /**
     * Short heading of a step, also used when another step refers to it.
     */
    private String headline(StepDraft draft) {
        DiagramElement element = draft.element;
        return switch (draft.kind) {
            case START -> "Input " + index.inputNumbers.getOrDefault(element.id(), 1) + ": " + startName(element);
            case ACTIVITY -> activityTitle(element);
            case SUB_PROCESS -> element.hasLabel() ? "Start " + element.label() + " Process" : "Start Sub-Process";
            case WAIT -> "Wait for " + (element.hasLabel()
                ? element.label()
                : element.eventType().name().toLowerCase() + " event");
            case DECISION -> element.hasLabel() ? element.label() : "Decision";
            case PARALLEL -> element != null && element.hasLabel() ? element.label() : "Parallel Paths";
            case BRANCH -> draft.branchLabel;
            case END -> "Process Ends (" + endName(element) + ")";
            case UNSUPPORTED -> element.hasLabel() ? element.label() : "<" + element.sourceTag() + ">";
            case LOOP, JUMP -> "";
        };
    }

    /**
     * Describes where the procedure continues at a given element.
     *
     * @param elementId target element
     * @param back whether the flow goes back to an earlier step
     * @param capitalized whether the phrase starts a sentence
     */
    String route(String elementId, boolean back, boolean capitalized) {
        String verb = back ? "return to" : "proceed to";
        StepDraft target = index.draftOf(elementId);
        String phrase;
        if (target == null) {
            phrase = verb + " \"" + graph.element(elementId).map(DiagramElement::label).orElse(elementId) + "\"";
        } else {
            phrase = switch (target.kind) {
                case END -> capitalized
                    ? "Process Ends (" + endName(target.element) + ")"
                    : "end the process (" + endName(target.element) + ")";
                case ACTIVITY -> verb + " Step " + target.ref;
                case START -> verb + " the start of the process";
                case DECISION, PARALLEL -> target.baseRef.isEmpty()
                    ? verb + " \"" + headline(target) + "\""
                    : verb + " the " + (target.kind == StepKind.DECISION ? "decision" : "parallel split")
                        + " after Step " + target.baseRef;
                default -> verb + " \"" + headline(target) + "\"";
            };
        }
        return capitalized ? capitalize(phrase) : phrase;
    }

    private Optional<String> boundaryText(DiagramElement task, DiagramElement boundary) {
        List<SequenceFlow> outs = graph.outgoing(boundary.id());
        if (outs.isEmpty()) {
            return Optional.empty();
        }
        String target = route(outs.get(0).targetId(), false, false);

        String condition;
        if (boundary.eventType() == EventType.TIMER) {
            condition = "performing the activity took more than "
                + (boundary.hasLabel() ? boundary.label() : "the allowed time");
        } else {
            condition = (boundary.hasLabel()
                ? boundary.label()
                : "a " + boundary.eventType().name().toLowerCase() + " event occurs")
                + " during performing the activity";
        }

        if (boundary.interrupting()) {
            return Optional.of("If " + condition + ", stop the activity and " + target + ".");
        }
        String normalNext = graph.outgoing(task.id()).stream()
            .findFirst()
            .map(flow -> ", then " + route(flow.targetId(), false, false))
            .orElse("");
        return Optional.of("If " + condition + ", " + target + " and complete the activity" + normalNext + ".");
    }

    /**
     * Lists the steps feeding an activity through a parallel or inclusive join, or through
     * several flows one of which comes straight from a start event.
     */
    private Optional<String> stepInput(DiagramElement task) {
        List<SequenceFlow> incoming = graph.incoming(task.id());
        List<SequenceFlow> sources;
        String connector;
        boolean needsInput;

        if (incoming.size() == 1 && isJoin(incoming.get(0).sourceId())) {
            DiagramElement join = graph.requireElement(incoming.get(0).sourceId());
            sources = graph.incoming(join.id());
            connector = join.kind() == ElementKind.PARALLEL_GATEWAY ? " and " : " and/or ";
            needsInput = false;
        } else if (incoming.size() > 1) {
            sources = incoming;
            connector = " or ";
            needsInput = true;
        } else {
            return Optional.empty();
        }

        Set<String> labels = new LinkedHashSet<>();
        for (SequenceFlow flow : sources) {
            String label = index.sourceLabel(graph, flow.sourceId());
            if (label != null) {
                labels.add(label);
            }
        }
        boolean hasInput = labels.stream().anyMatch(label -> label.startsWith("Input "));
        if (labels.size() < 2 || (needsInput && !hasInput)) {
            return Optional.empty();
        }
        return Optional.of("Step Input: " + String.join(connector, labels));
    }

    private boolean isJoin(String elementId) {
        DiagramElement element = graph.requireElement(elementId);
        return (element.kind() == ElementKind.PARALLEL_GATEWAY || element.kind() == ElementKind.INCLUSIVE_GATEWAY)
            && graph.incoming(elementId).size() > 1;
    }

    private DiagramElement performer(StepDraft draft) {
        if (draft.kind.isRouting()) {
            return draft.anchor == null ? null : draft.anchor.element;
        }
        return draft.element;
    }

    private String actor(DiagramElement element) {
        return graph.laneOf(element.id())
            .map(Lane::name)
            .filter(name -> !name.isBlank())
            .orElse(options.unassignedLane());
    }

    static String sentence(String actor, String action) {
        String text = action.strip();
        String lower = text.toLowerCase();
        if (lower.startsWith("the ")) {
            return TextUtils.ensurePeriod(text);
        }
        if (lower.startsWith("shall ")) {
            return TextUtils.ensurePeriod("The " + actor + " " + text);
        }
        return TextUtils.ensurePeriod("The " + actor + " shall " + TextUtils.decapitalize(text));
    }

    private String activityTitle(DiagramElement task) {
        String title = TextUtils.stripStepNumber(task.label());
        return title.isEmpty() ? "[Unnamed activity]" : title;
    }

    private String startName(DiagramElement start) {
        if (start.hasLabel()) {
            return start.label();
        }
        return graph.outgoing(start.id()).stream()
            .map(SequenceFlow::conditionLabel)
            .filter(Objects::nonNull)
            .findFirst()
            .orElse("Process Start");
    }

    private static String endName(DiagramElement end) {
        return end != null && end.hasLabel() ? end.label() : DEFAULT_END_NAME;
    }

    private static List<String> lines(String documentation) {
        if (TextUtils.isBlank(documentation)) {
            return List.of();
        }
        return Arrays.stream(documentation.split("\\R"))
            .map(String::strip)
            .filter(line -> !line.isEmpty())
            .toList();
    }

    private static String capitalize(String text) {
        return text.isEmpty() ? text : Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }
}

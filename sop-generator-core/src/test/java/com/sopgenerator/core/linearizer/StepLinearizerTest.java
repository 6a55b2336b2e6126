package com.sopgenerator.core.linearizer;

import com.sopgenerator.core.DiagramFixtures;
import com.sopgenerator.core.exception.DiagramStructureException;
import com.sopgenerator.core.exception.PipelineStage;
import com.sopgenerator.core.model.DiagramElement;
import com.sopgenerator.core.model.Paragraph;
import com.sopgenerator.core.model.ParagraphRole;
import com.sopgenerator.core.model.ProcessGraph;
import com.sopgenerator.core.model.Step;
import com.sopgenerator.core.model.StepKind;
import com.sopgenerator.core.model.WarningType;
import com.sopgenerator.core.parser.BpmnDiagramParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link StepLinearizer}.
 */
class StepLinearizerTest {

    private BpmnDiagramParser parser;
    private StepLinearizer linearizer;

    @BeforeEach
    void setUp() {
        parser = new BpmnDiagramParser();
        linearizer = new StepLinearizer();
    }

    private ProcessGraph graph(String fixture) {
        return parser.parse(DiagramFixtures.load(fixture)).graph();
    }

    private ProcessGraph inline(String processContent) {
        return parser.parse(DiagramFixtures.process(processContent)).graph();
    }

    @Test
    @DisplayName("Should emit decision branches one after another with lettered references")
    void linearize_decision_emitsBranchesInOrder() {
        Linearization result = linearizer.linearize(graph(DiagramFixtures.PURCHASE_APPROVAL));

        assertThat(result.steps()).extracting(Step::kind).containsExactly(
            StepKind.START, StepKind.ACTIVITY, StepKind.DECISION,
            StepKind.BRANCH, StepKind.ACTIVITY, StepKind.END,
            StepKind.BRANCH, StepKind.END);
        assertThat(result.steps()).extracting(Step::ref)
            .containsExactly("", "1", "", "1A", "2", "", "1B", "");
        assertThat(result.steps()).extracting(Step::depth)
            .containsExactly(0, 0, 0, 1, 1, 1, 1, 1);
        assertThat(result.steps()).extracting(Step::ordinal)
            .containsExactly(1, 2, 3, 4, 5, 6, 7, 8);
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    @DisplayName("Should write Guideline V2 sentences for activities, decisions and ends")
    void linearize_decision_composesNarrative() {
        List<Step> steps = linearizer.linearize(graph(DiagramFixtures.PURCHASE_APPROVAL)).steps();

        assertThat(steps.get(0).title()).isEqualTo("Input 1: Purchase Need Identified");

        Step submit = steps.get(1);
        assertThat(submit.title()).isEqualTo("Submit PR");
        assertThat(submit.paragraphs()).extracting(Paragraph::role).containsExactly(ParagraphRole.TITLE, ParagraphRole.BODY);
        assertThat(submit.paragraphs().get(1).text()).isEqualTo("The Requester shall fill in the PR form in the ERP system.");
        assertThat(submit.laneName()).isEqualTo("Requester");
        assertThat(submit.sla()).isEqualTo("1 day");

        assertThat(steps.get(2).text()).isEqualTo("Request approved?\nExactly one of the following cases applies:");
        assertThat(steps.get(3).title()).isEqualTo("Case A: Yes");
        assertThat(steps.get(4).paragraphs().get(1).text()).isEqualTo("The Approver shall release purchase order.");
        assertThat(steps.get(5).text()).isEqualTo("Process Ends (Order Released)");
        assertThat(steps.get(6).title()).isEqualTo("Case B: No");
        assertThat(steps.get(7).text()).isEqualTo("Process Ends (Request Rejected)");
    }

    @Test
    @DisplayName("Should carry the RACI assignment of the performing lane")
    void linearize_laneWithRaci_assignsRaciToSteps() {
        List<Step> steps = linearizer.linearize(graph(DiagramFixtures.PURCHASE_APPROVAL)).steps();

        Step approve = steps.get(4);
        assertThat(approve.laneName()).isEqualTo("Approver");
        assertThat(approve.raci().responsible()).isEqualTo("Finance Manager");
        assertThat(approve.raci().accountable()).isEqualTo("CFO");
        assertThat(steps.get(1).raci().responsible()).isEqualTo("N/A");
    }

    @Test
    @DisplayName("Should turn a flow back into the current path into a loop marker")
    void linearize_cycle_emitsLoopMarker() {
        List<Step> steps = linearizer.linearize(graph(DiagramFixtures.REWORK_LOOP)).steps();

        assertThat(steps).extracting(Step::kind).containsExactly(
            StepKind.START, StepKind.ACTIVITY, StepKind.ACTIVITY, StepKind.DECISION,
            StepKind.BRANCH, StepKind.END, StepKind.BRANCH, StepKind.LOOP);
        assertThat(steps.get(4).ref()).isEqualTo("2A");
        assertThat(steps.get(6).ref()).isEqualTo("2B");
        assertThat(steps.get(7).text()).isEqualTo("Return to Step 1");
    }

    @Test
    @DisplayName("Should emit parallel paths and continue once at the join")
    void linearize_parallelSplit_resumesAtJoin() {
        List<Step> steps = linearizer.linearize(graph(DiagramFixtures.PARALLEL_ONBOARDING)).steps();

        assertThat(steps).extracting(Step::kind).containsExactly(
            StepKind.START, StepKind.PARALLEL,
            StepKind.BRANCH, StepKind.ACTIVITY,
            StepKind.BRANCH, StepKind.ACTIVITY,
            StepKind.ACTIVITY, StepKind.END);
        assertThat(steps.get(1).title()).isEqualTo("Parallel Paths");
        assertThat(steps.get(2).title()).isEqualTo("Simultaneously: Path 1");
        assertThat(steps.get(2).parallel()).isTrue();
        assertThat(steps.get(3).text()).endsWith("Proceed to Step 3");
        assertThat(steps.get(5).laneName()).isEqualTo("IT Support");

        Step welcome = steps.get(6);
        assertThat(welcome.ref()).isEqualTo("3");
        assertThat(welcome.depth()).isZero();
        assertThat(welcome.elementIds()).containsExactly("Join", "Task_Welcome");
        assertThat(welcome.text()).contains("Step Input: Step 1 and Step 2");
    }

    @Test
    @DisplayName("Should report elements no start event reaches")
    void linearize_unreachableElement_warns() {
        Linearization result = linearizer.linearize(graph(DiagramFixtures.UNREACHABLE_TASK));

        assertThat(result.unreachableElementIds()).containsExactly("Task_Orphan");
        assertThat(result.steps()).extracting(Step::kind)
            .containsExactly(StepKind.START, StepKind.ACTIVITY, StepKind.END);
        assertThat(result.steps().get(0).title()).isEqualTo("Input 1: Process Start");
        assertThat(result.steps().get(1).text()).contains("The [LANE UNREADABLE] shall record invoice.");
        assertThat(result.steps().get(2).text()).isEqualTo("Process Ends (Process Complete)");
    }

    @Test
    @DisplayName("Should name the configured actor for elements outside any lane")
    void linearize_customUnassignedLane_usesConfiguredActor() {
        StepLinearizer custom = new StepLinearizer(new LinearizerOptions(BranchOrder.DOCUMENT, "Process Owner"));

        List<Step> steps = custom.linearize(graph(DiagramFixtures.UNREACHABLE_TASK)).steps();

        assertThat(steps.get(1).text()).contains("The Process Owner shall record invoice.");
    }

    @Test
    @DisplayName("Should cover every reachable element exactly once")
    void linearize_reachableElements_appearOnce() {
        for (String fixture : List.of(DiagramFixtures.PURCHASE_APPROVAL, DiagramFixtures.REWORK_LOOP,
                DiagramFixtures.PARALLEL_ONBOARDING, DiagramFixtures.UNREACHABLE_TASK)) {
            ProcessGraph graph = graph(fixture);
            Linearization result = linearizer.linearize(graph);

            List<String> covered = result.steps().stream().flatMap(s -> s.elementIds().stream()).toList();
            Set<String> expected = new HashSet<>();
            graph.elements().stream().map(DiagramElement::id).forEach(expected::add);
            result.unreachableElementIds().forEach(expected::remove);

            assertThat(covered).as(fixture).doesNotHaveDuplicates();
            assertThat(covered).as(fixture).containsExactlyInAnyOrderElementsOf(expected);
        }
    }

    @Test
    @DisplayName("Should produce identical output for identical input")
    void linearize_sameGraphTwice_isDeterministic() {
        ProcessGraph graph = graph(DiagramFixtures.PARALLEL_ONBOARDING);

        assertThat(linearizer.linearize(graph)).isEqualTo(linearizer.linearize(graph));
    }

    @Test
    @DisplayName("Should number unlabeled conditions positionally and warn")
    void linearize_unlabeledCondition_warnsAndNumbers() {
        ProcessGraph graph = inline("""
                <bpmn:startEvent id="Start_1" />
                <bpmn:exclusiveGateway id="Gw_1" name="Route" />
                <bpmn:endEvent id="End_A" name="A" />
                <bpmn:endEvent id="End_B" name="B" />
                <bpmn:sequenceFlow id="Flow_1" sourceRef="Start_1" targetRef="Gw_1" />
                <bpmn:sequenceFlow id="Flow_A" sourceRef="Gw_1" targetRef="End_A" />
                <bpmn:sequenceFlow id="Flow_B" name="Other" sourceRef="Gw_1" targetRef="End_B" />
            """);

        Linearization result = linearizer.linearize(graph);

        assertThat(result.steps().get(2).title()).isEqualTo("Case A: Option 1");
        assertThat(result.steps().get(4).title()).isEqualTo("Case B: Other");
        assertThat(result.warnings())
            .singleElement()
            .satisfies(w -> {
                assertThat(w.type()).isEqualTo(WarningType.UNLABELED_CONDITION);
                assertThat(w.elementId()).isEqualTo("Flow_A");
            });
    }

    @Test
    @DisplayName("Should order labeled branches alphabetically when configured")
    void linearize_labelBranchOrder_sortsBranches() {
        ProcessGraph graph = inline("""
                <bpmn:startEvent id="Start_1" />
                <bpmn:exclusiveGateway id="Gw_1" />
                <bpmn:endEvent id="End_Z" />
                <bpmn:endEvent id="End_A" />
                <bpmn:sequenceFlow id="Flow_1" sourceRef="Start_1" targetRef="Gw_1" />
                <bpmn:sequenceFlow id="Flow_Z" name="Zulu" sourceRef="Gw_1" targetRef="End_Z" />
                <bpmn:sequenceFlow id="Flow_A" name="Alpha" sourceRef="Gw_1" targetRef="End_A" />
            """);

        StepLinearizer byLabel = new StepLinearizer(new LinearizerOptions(BranchOrder.LABEL, null));

        assertThat(byLabel.linearize(graph).steps()).extracting(Step::branchLabel)
            .filteredOn(label -> label != null)
            .containsExactly("Alpha", "Zulu");
        assertThat(linearizer.linearize(graph).steps()).extracting(Step::branchLabel)
            .filteredOn(label -> label != null)
            .containsExactly("Zulu", "Alpha");
    }

    @Test
    @DisplayName("Should open an exception branch for an interrupting boundary event")
    void linearize_boundaryEvent_emitsExceptionBranch() {
        ProcessGraph graph = inline("""
                <bpmn:startEvent id="Start_1" />
                <bpmn:task id="Task_1" name="Check Stock" />
                <bpmn:boundaryEvent id="Error_1" name="Item discontinued" attachedToRef="Task_1">
                  <bpmn:errorEventDefinition id="ErrorDef_1" />
                </bpmn:boundaryEvent>
                <bpmn:task id="Task_2" name="Ship Order" />
                <bpmn:endEvent id="End_1" name="Order Shipped" />
                <bpmn:endEvent id="End_2" name="Order Cancelled" />
                <bpmn:sequenceFlow id="Flow_1" sourceRef="Start_1" targetRef="Task_1" />
                <bpmn:sequenceFlow id="Flow_2" sourceRef="Task_1" targetRef="Task_2" />
                <bpmn:sequenceFlow id="Flow_3" sourceRef="Task_2" targetRef="End_1" />
                <bpmn:sequenceFlow id="Flow_4" sourceRef="Error_1" targetRef="End_2" />
            """);

        List<Step> steps = linearizer.linearize(graph).steps();

        assertThat(steps).extracting(Step::kind).containsExactly(
            StepKind.START, StepKind.ACTIVITY, StepKind.BRANCH, StepKind.END, StepKind.ACTIVITY, StepKind.END);
        assertThat(steps.get(1).text())
            .contains("If Item discontinued during performing the activity, stop the activity and end the process (Order Cancelled).");
        assertThat(steps.get(2).title()).isEqualTo("Exception: Item discontinued");
        assertThat(steps.get(2).depth()).isEqualTo(1);
        assertThat(steps.get(4).ref()).isEqualTo("2");
    }

    @Test
    @DisplayName("Should fail when the process has no start event")
    void linearize_noStartEvent_throwsStructureException() {
        ProcessGraph graph = inline("""
                <bpmn:task id="Task_1" name="Orphan" />
            """);

        assertThatThrownBy(() -> linearizer.linearize(graph))
            .isInstanceOf(DiagramStructureException.class)
            .hasMessageContaining("No start event")
            .satisfies(e -> assertThat(((DiagramStructureException) e).getStage()).isEqualTo(PipelineStage.LINEARIZE));
    }
}

package com.sopgenerator.core.parser;

import com.sopgenerator.core.DiagramFixtures;
import com.sopgenerator.core.exception.DiagramStructureException;
import com.sopgenerator.core.exception.MalformedDiagramException;
import com.sopgenerator.core.exception.PipelineStage;
import com.sopgenerator.core.model.DiagramElement;
import com.sopgenerator.core.model.ElementKind;
import com.sopgenerator.core.model.EventType;
import com.sopgenerator.core.model.Lane;
import com.sopgenerator.core.model.ProcessGraph;
import com.sopgenerator.core.model.SequenceFlow;
import com.sopgenerator.core.model.WarningType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link BpmnDiagramParser}.
 */
class BpmnDiagramParserTest {

    private BpmnDiagramParser parser;

    @BeforeEach
    void setUp() {
        parser = new BpmnDiagramParser();
    }

    @Test
    @DisplayName("Should read elements, flows and lanes of the participant's process")
    void parse_purchaseApproval_readsGraph() {
        ParseResult result = parser.parse(DiagramFixtures.load(DiagramFixtures.PURCHASE_APPROVAL));
        ProcessGraph graph = result.graph();

        assertThat(result.warnings()).isEmpty();
        assertThat(graph.processId()).isEqualTo("Process_PA");
        assertThat(graph.elements())
            .extracting(DiagramElement::id)
            .containsExactly("Start_1", "Task_Submit", "Gateway_Approved", "Task_Approve", "End_Approved", "End_Rejected");
        assertThat(graph.flows())
            .extracting(SequenceFlow::id)
            .containsExactly("Flow_1", "Flow_2", "Flow_Yes", "Flow_No", "Flow_3");
        assertThat(graph.lanes()).extracting(Lane::name).containsExactly("Requester", "Approver");
    }

    @Test
    @DisplayName("Should resolve element kinds, lanes, documentation and SLA")
    void parse_purchaseApproval_readsElementDetails() {
        ProcessGraph graph = parser.parse(DiagramFixtures.load(DiagramFixtures.PURCHASE_APPROVAL)).graph();

        DiagramElement submit = graph.requireElement("Task_Submit");
        assertThat(submit.kind()).isEqualTo(ElementKind.TASK);
        assertThat(submit.label()).isEqualTo("Submit PR");
        assertThat(submit.laneId()).isEqualTo("Lane_Requester");
        assertThat(submit.documentation()).isEqualTo("Fill in the PR form in the ERP system.");
        assertThat(submit.sla()).isEqualTo("1 day");

        assertThat(graph.requireElement("Gateway_Approved").kind()).isEqualTo(ElementKind.EXCLUSIVE_GATEWAY);
        assertThat(graph.outgoing("Gateway_Approved"))
            .extracting(SequenceFlow::conditionLabel)
            .containsExactly("Yes", "No");
        assertThat(graph.laneOf("Task_Approve")).map(Lane::name).contains("Approver");
    }

    @Test
    @DisplayName("Should read RACI documentation of lanes, defaulting missing roles to N/A")
    void parse_laneDocumentation_readsRaci() {
        ProcessGraph graph = parser.parse(DiagramFixtures.load(DiagramFixtures.PURCHASE_APPROVAL)).graph();

        Lane approver = graph.lanes().get(1);
        assertThat(approver.raci().responsible()).isEqualTo("Finance Manager");
        assertThat(approver.raci().accountable()).isEqualTo("CFO");
        assertThat(approver.raci().consulted()).isEqualTo("N/A");
        assertThat(approver.raci().informed()).isEqualTo("N/A");
    }

    @Test
    @DisplayName("Should read participant name, scope, version tag and declared abbreviations")
    void parse_purchaseApproval_readsMetadata() {
        ProcessGraph graph = parser.parse(DiagramFixtures.load(DiagramFixtures.PURCHASE_APPROVAL)).graph();

        assertThat(graph.metadata().participantName()).isEqualTo("Purchase Approval");
        assertThat(graph.metadata().processName()).isEqualTo("Purchase Approval Process");
        assertThat(graph.metadata().scope()).isEqualTo("All purchase requests raised by employees.");
        assertThat(graph.metadata().processCode()).isEqualTo("PRC-001");
        assertThat(graph.metadata().abbreviations())
            .singleElement()
            .satisfies(a -> {
                assertThat(a.term()).isEqualTo("PR");
                assertThat(a.definition()).isEqualTo("Purchase Request");
            });
        assertThat(graph.metadata().purpose()).isNull();
    }

    @Test
    @DisplayName("Should keep unknown flow nodes as unsupported elements and warn")
    void parse_unknownElement_passesThroughWithWarning() {
        String markup = DiagramFixtures.process("""
                <bpmn:startEvent id="Start_1" />
                <bpmn:complexGateway id="Complex_1" name="Complex" />
                <bpmn:sequenceFlow id="Flow_1" sourceRef="Start_1" targetRef="Complex_1" />
            """);

        ParseResult result = parser.parse(markup);

        assertThat(result.graph().requireElement("Complex_1").kind()).isEqualTo(ElementKind.UNSUPPORTED);
        assertThat(result.warnings())
            .singleElement()
            .satisfies(w -> {
                assertThat(w.type()).isEqualTo(WarningType.UNSUPPORTED_ELEMENT);
                assertThat(w.elementId()).isEqualTo("Complex_1");
            });
    }

    @Test
    @DisplayName("Should read boundary events with trigger and interrupting flag")
    void parse_boundaryEvent_readsAttachment() {
        String markup = DiagramFixtures.process("""
                <bpmn:startEvent id="Start_1" />
                <bpmn:task id="Task_1" name="Check Stock" />
                <bpmn:boundaryEvent id="Timer_1" name="2 days" attachedToRef="Task_1" cancelActivity="false">
                  <bpmn:timerEventDefinition id="TimerDef_1" />
                </bpmn:boundaryEvent>
                <bpmn:endEvent id="End_1" />
                <bpmn:sequenceFlow id="Flow_1" sourceRef="Start_1" targetRef="Task_1" />
                <bpmn:sequenceFlow id="Flow_2" sourceRef="Task_1" targetRef="End_1" />
                <bpmn:sequenceFlow id="Flow_3" sourceRef="Timer_1" targetRef="End_1" />
            """);

        DiagramElement timer = parser.parse(markup).graph().requireElement("Timer_1");

        assertThat(timer.kind()).isEqualTo(ElementKind.BOUNDARY_EVENT);
        assertThat(timer.eventType()).isEqualTo(EventType.TIMER);
        assertThat(timer.attachedToId()).isEqualTo("Task_1");
        assertThat(timer.interrupting()).isFalse();
    }

    @Test
    @DisplayName("Should apply the SLA of a group to the activities drawn inside it")
    void parse_slaGroup_appliesToContainedActivities() {
        String markup = """
            <?xml version="1.0" encoding="UTF-8"?>
            <bpmn:definitions xmlns:bpmn="http://www.omg.org/spec/BPMN/20100524/MODEL"
                              xmlns:bpmndi="http://www.omg.org/spec/BPMN/20100524/DI"
                              xmlns:dc="http://www.omg.org/spec/DD/20100524/DC" id="Defs">
              <bpmn:process id="Process_1">
                <bpmn:startEvent id="Start_1" />
                <bpmn:task id="Task_In" name="Inside" />
                <bpmn:task id="Task_Out" name="Outside" />
                <bpmn:group id="Group_1">
                  <bpmn:documentation textFormat="application/x-sla">4 hours</bpmn:documentation>
                </bpmn:group>
                <bpmn:sequenceFlow id="Flow_1" sourceRef="Start_1" targetRef="Task_In" />
                <bpmn:sequenceFlow id="Flow_2" sourceRef="Task_In" targetRef="Task_Out" />
              </bpmn:process>
              <bpmndi:BPMNDiagram id="Diagram_1">
                <bpmndi:BPMNPlane id="Plane_1" bpmnElement="Process_1">
                  <bpmndi:BPMNShape id="Shape_Group" bpmnElement="Group_1">
                    <dc:Bounds x="100" y="100" width="300" height="200" />
                  </bpmndi:BPMNShape>
                  <bpmndi:BPMNShape id="Shape_In" bpmnElement="Task_In">
                    <dc:Bounds x="150" y="150" width="100" height="80" />
                  </bpmndi:BPMNShape>
                  <bpmndi:BPMNShape id="Shape_Out" bpmnElement="Task_Out">
                    <dc:Bounds x="600" y="150" width="100" height="80" />
                  </bpmndi:BPMNShape>
                </bpmndi:BPMNPlane>
              </bpmndi:BPMNDiagram>
            </bpmn:definitions>
            """;

        ProcessGraph graph = parser.parse(markup).graph();

        assertThat(graph.requireElement("Task_In").sla()).isEqualTo("4 hours");
        assertThat(graph.requireElement("Task_Out").sla()).isNull();
    }

    @Test
    @DisplayName("Should strip combining marks from lane names")
    void parse_laneWithDiacritics_stripsMarks() {
        String markup = DiagramFixtures.process("""
                <bpmn:laneSet id="LaneSet_1">
                  <bpmn:lane id="Lane_1" name="Cafe&#x301; Staff">
                    <bpmn:flowNodeRef>Start_1</bpmn:flowNodeRef>
                  </bpmn:lane>
                </bpmn:laneSet>
                <bpmn:startEvent id="Start_1" />
            """);

        assertThat(parser.parse(markup).graph().lanes().get(0).name()).isEqualTo("Cafe Staff");
    }

    @Test
    @DisplayName("Should reject markup that is not well-formed XML")
    void parse_malformedXml_throwsMalformedDiagram() {
        assertThatThrownBy(() -> parser.parse("<bpmn:definitions"))
            .isInstanceOf(MalformedDiagramException.class)
            .hasMessageContaining("not well-formed");
    }

    @Test
    @DisplayName("Should reject empty markup")
    void parse_blankMarkup_throwsMalformedDiagram() {
        assertThatThrownBy(() -> parser.parse("   "))
            .isInstanceOf(MalformedDiagramException.class);
    }

    @Test
    @DisplayName("Should reject XML that is not a BPMN definitions document")
    void parse_foreignRoot_throwsMalformedDiagram() {
        assertThatThrownBy(() -> parser.parse("<project><name>x</name></project>"))
            .isInstanceOf(MalformedDiagramException.class)
            .hasMessageContaining("definitions");
    }

    @Test
    @DisplayName("Should refuse document type declarations")
    void parse_doctype_throwsMalformedDiagram() {
        String markup = """
            <?xml version="1.0"?>
            <!DOCTYPE definitions [<!ENTITY xxe SYSTEM "file:///etc/passwd">]>
            <bpmn:definitions xmlns:bpmn="http://www.omg.org/spec/BPMN/20100524/MODEL" id="Defs">
              <bpmn:process id="Process_1"><bpmn:startEvent id="Start_1" name="&xxe;" /></bpmn:process>
            </bpmn:definitions>
            """;

        assertThatThrownBy(() -> parser.parse(markup))
            .isInstanceOf(MalformedDiagramException.class);
    }

    @Test
    @DisplayName("Should fail when a flow references an element that does not exist")
    void parse_danglingFlow_throwsStructureException() {
        String markup = DiagramFixtures.process("""
                <bpmn:startEvent id="Start_1" />
                <bpmn:sequenceFlow id="Flow_1" sourceRef="Start_1" targetRef="Task_Missing" />
            """);

        assertThatThrownBy(() -> parser.parse(markup))
            .isInstanceOf(DiagramStructureException.class)
            .hasMessageContaining("Task_Missing")
            .satisfies(e -> {
                DiagramStructureException failure = (DiagramStructureException) e;
                assertThat(failure.getStage()).isEqualTo(PipelineStage.PARSE);
                assertThat(failure.getElementId()).isEqualTo("Flow_1");
            });
    }

    @Test
    @DisplayName("Should fail on duplicate element ids")
    void parse_duplicateId_throwsStructureException() {
        String markup = DiagramFixtures.process("""
                <bpmn:startEvent id="Start_1" />
                <bpmn:task id="Start_1" name="Twin" />
            """);

        assertThatThrownBy(() -> parser.parse(markup))
            .isInstanceOf(DiagramStructureException.class)
            .hasMessageContaining("Duplicate element id");
    }

    @Test
    @DisplayName("Should fail when a boundary event is attached to an unknown activity")
    void parse_danglingBoundary_throwsStructureException() {
        String markup = DiagramFixtures.process("""
                <bpmn:startEvent id="Start_1" />
                <bpmn:boundaryEvent id="Boundary_1" attachedToRef="Task_Nowhere" />
            """);

        assertThatThrownBy(() -> parser.parse(markup))
            .isInstanceOf(DiagramStructureException.class)
            .hasMessageContaining("Task_Nowhere");
    }

    @Test
    @DisplayName("Should fail when the diagram has no process")
    void parse_noProcess_throwsMalformedDiagram() {
        String markup = """
            <bpmn:definitions xmlns:bpmn="http://www.omg.org/spec/BPMN/20100524/MODEL" id="Defs" />
            """;

        assertThatThrownBy(() -> parser.parse(markup))
            .isInstanceOf(MalformedDiagramException.class)
            .hasMessageContaining("no process");
    }

    @Test
    @DisplayName("Should accept a byte order mark before the XML declaration")
    void parse_leadingByteOrderMark_isIgnored() {
        String markup = "\uFEFF" + DiagramFixtures.load(DiagramFixtures.REWORK_LOOP);

        assertThat(parser.parse(markup).graph().processId()).isEqualTo("Process_Rework");
    }
}

package com.sopgenerator.core.linearizer;

import com.sopgenerator.core.DiagramFixtures;
import com.sopgenerator.core.model.ProcessGraph;
import com.sopgenerator.core.parser.BpmnDiagramParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link MergePointFinder}.
 */
class MergePointFinderTest {

    private final MergePointFinder finder = new MergePointFinder();
    private final BpmnDiagramParser parser = new BpmnDiagramParser();

    @Test
    void find_parallelBranches_returnsJoin() {
        ProcessGraph graph = parser.parse(DiagramFixtures.load(DiagramFixtures.PARALLEL_ONBOARDING)).graph();

        assertThat(finder.find(graph, "Split", List.of("Task_Contract", "Task_Laptop"), Set.of("Start_1", "Split")))
            .contains("Join");
    }

    @Test
    void find_branchesEndingSeparately_returnsEmpty() {
        ProcessGraph graph = parser.parse(DiagramFixtures.load(DiagramFixtures.PURCHASE_APPROVAL)).graph();

        assertThat(finder.find(graph, "Gateway_Approved", List.of("Task_Approve", "End_Rejected"), Set.of()))
            .isEmpty();
    }

    @Test
    void find_branchLoopingBack_ignoresElementsOnPath() {
        ProcessGraph graph = parser.parse(DiagramFixtures.load(DiagramFixtures.REWORK_LOOP)).graph();
        Set<String> path = Set.of("Start_1", "Task_Draft", "Task_Review", "Gateway_Ok");

        assertThat(finder.find(graph, "Gateway_Ok", List.of("End_1", "Task_Draft"), path)).isEmpty();
    }

    @Test
    void find_singleDistinctTarget_returnsThatTarget() {
        ProcessGraph graph = parser.parse(DiagramFixtures.load(DiagramFixtures.PURCHASE_APPROVAL)).graph();

        assertThat(finder.find(graph, "Task_Submit", List.of("Gateway_Approved", "Gateway_Approved"), Set.of()))
            .contains("Gateway_Approved");
    }

    @Test
    void find_noTargets_returnsEmpty() {
        ProcessGraph graph = parser.parse(DiagramFixtures.load(DiagramFixtures.PURCHASE_APPROVAL)).graph();

        assertThat(finder.find(graph, "Task_Submit", List.of(), Set.of())).isEmpty();
    }
}

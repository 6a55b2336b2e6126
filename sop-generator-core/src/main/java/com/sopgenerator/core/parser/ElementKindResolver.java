package com.sopgenerator.core.parser;

import com.sopgenerator.core.model.ElementKind;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps namespaced BPMN element names to {@link ElementKind}s.
 *
 * <p>Resolution order:
 * <ol>
 *   <li>BPMN model elements that are not flow nodes (lanes, artifacts, data, documentation)
 *       resolve to empty and are not part of the graph</li>
 *   <li>known BPMN flow node names resolve to their kind</li>
 *   <li>any other BPMN element, and any element from a foreign namespace, resolves to
 *       {@link ElementKind#UNSUPPORTED}</li>
 * </ol>
 */
public class ElementKindResolver {

    private static final Map<String, ElementKind> FLOW_NODES = Map.ofEntries(
        Map.entry("task", ElementKind.TASK),
        Map.entry("userTask", ElementKind.TASK),
        Map.entry("serviceTask", ElementKind.TASK),
        Map.entry("manualTask", ElementKind.TASK),
        Map.entry("scriptTask", ElementKind.TASK),
        Map.entry("sendTask", ElementKind.TASK),
        Map.entry("receiveTask", ElementKind.TASK),
        Map.entry("businessRuleTask", ElementKind.TASK),
        Map.entry("callActivity", ElementKind.SUB_PROCESS),
        Map.entry("subProcess", ElementKind.SUB_PROCESS),
        Map.entry("adHocSubProcess", ElementKind.SUB_PROCESS),
        Map.entry("transaction", ElementKind.SUB_PROCESS),
        Map.entry("startEvent", ElementKind.START_EVENT),
        Map.entry("endEvent", ElementKind.END_EVENT),
        Map.entry("intermediateCatchEvent", ElementKind.INTERMEDIATE_EVENT),
        Map.entry("intermediateThrowEvent", ElementKind.INTERMEDIATE_EVENT),
        Map.entry("boundaryEvent", ElementKind.BOUNDARY_EVENT),
        Map.entry("exclusiveGateway", ElementKind.EXCLUSIVE_GATEWAY),
        Map.entry("parallelGateway", ElementKind.PARALLEL_GATEWAY),
        Map.entry("inclusiveGateway", ElementKind.INCLUSIVE_GATEWAY)
    );

    private static final Set<String> NON_FLOW_ELEMENTS = Set.of(
        "documentation",
        "extensionElements",
        "laneSet",
        "sequenceFlow",
        "group",
        "textAnnotation",
        "association",
        "dataObject",
        "dataObjectReference",
        "dataStoreReference",
        "ioSpecification",
        "property",
        "messageFlow",
        "auditing",
        "monitoring"
    );

    /**
     * Resolves the kind of a child element of a process.
     *
     * @param namespace namespace URI of the element (may be null)
     * @param localName local element name
     * @return the kind, or empty if the element is not a flow node
     */
    public Optional<ElementKind> resolve(String namespace, String localName) {
        if (!BpmnNamespaces.MODEL.equals(namespace)) {
            return Optional.of(ElementKind.UNSUPPORTED);
        }
        if (NON_FLOW_ELEMENTS.contains(localName)) {
            return Optional.empty();
        }
        return Optional.of(FLOW_NODES.getOrDefault(localName, ElementKind.UNSUPPORTED));
    }
}

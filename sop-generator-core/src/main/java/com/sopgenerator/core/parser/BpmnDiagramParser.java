package com.sopgenerator.core.parser;

import com.sopgenerator.core.exception.DiagramStructureException;
import com.sopgenerator.core.exception.MalformedDiagramException;
import com.sopgenerator.core.exception.PipelineStage;
import com.sopgenerator.core.model.Abbreviation;
import com.sopgenerator.core.model.DiagramElement;
import com.sopgenerator.core.model.DiagramMetadata;
import com.sopgenerator.core.model.ElementKind;
import com.sopgenerator.core.model.EventType;
import com.sopgenerator.core.model.Lane;
import com.sopgenerator.core.model.PipelineWarning;
import com.sopgenerator.core.model.Policy;
import com.sopgenerator.core.model.ProcessGraph;
import com.sopgenerator.core.model.Raci;
import com.sopgenerator.core.model.SequenceFlow;
import com.sopgenerator.core.model.WarningType;
import com.sopgenerator.core.util.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Parser for BPMN 2.0 XML diagrams.
 *
 * <p>Reads the first process of the diagram that contains flow nodes (preferring the process
 * referenced by a collaboration participant) using a namespace-aware DOM. Only direct children
 * of the process become graph elements; the internals of sub-processes are not expanded.
 *
 * <p><b>Extracted data:</b>
 * <ul>
 *   <li>flow nodes with label, lane, untyped documentation and {@code application/x-sla} SLA</li>
 *   <li>sequence flows with name (condition label) and documentation</li>
 *   <li>lanes with RACI documentation ({@code application/x-responsible} and friends)</li>
 *   <li>SLA groups, applied to activities whose shape centre lies inside the group bounds</li>
 *   <li>document metadata: participant name and documentation, scope and policy documentation,
 *       Zeebe version tag and properties</li>
 * </ul>
 *
 * <p>Elements of unknown kind are kept as {@link ElementKind#UNSUPPORTED} nodes and reported as
 * warnings. Missing flow endpoints, duplicate ids and dangling boundary attachments are fatal.
 */
public class BpmnDiagramParser implements DiagramParser {

    private static final Logger log = LoggerFactory.getLogger(BpmnDiagramParser.class);

    private static final String DISALLOW_DOCTYPE = "http://apache.org/xml/features/disallow-doctype-decl";

    private static final Map<String, EventType> EVENT_DEFINITIONS = Map.of(
        "timerEventDefinition", EventType.TIMER,
        "messageEventDefinition", EventType.MESSAGE,
        "signalEventDefinition", EventType.SIGNAL,
        "errorEventDefinition", EventType.ERROR,
        "conditionalEventDefinition", EventType.CONDITIONAL,
        "escalationEventDefinition", EventType.ESCALATION
    );

    private final ElementKindResolver kindResolver;

    public BpmnDiagramParser() {
        this(new ElementKindResolver());
    }

    public BpmnDiagramParser(ElementKindResolver kindResolver) {
        this.kindResolver = Objects.requireNonNull(kindResolver, "kindResolver must not be null");
    }

    @Override
    public String getId() {
        return "bpmn";
    }

    @Override
    public ParseResult parse(String markup) {
        Objects.requireNonNull(markup, "markup must not be null");
        if (markup.isBlank()) {
            throw new MalformedDiagramException("Diagram markup is empty");
        }

        Document document = readDocument(markup);
        Element definitions = document.getDocumentElement();
        if (!isModel(definitions, "definitions")) {
            throw new MalformedDiagramException(
                "Root element is not a BPMN definitions element: " + definitions.getNodeName());
        }

        Element process = selectProcess(definitions);
        String processId = process.getAttribute("id");
        log.debug("Parsing process '{}'", processId);

        List<PipelineWarning> warnings = new ArrayList<>();
        List<Lane> lanes = new ArrayList<>();
        Map<String, String> laneByElement = new HashMap<>();
        for (Element laneSet : modelChildren(process, "laneSet")) {
            readLaneSet(laneSet, lanes, laneByElement);
        }

        List<DiagramElement> elements = new ArrayList<>();
        List<Element> flowNodes = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (Element child : childElements(process)) {
            if (isModel(child, "sequenceFlow")) {
                flowNodes.add(child);
                continue;
            }
            Optional<ElementKind> kind = kindResolver.resolve(child.getNamespaceURI(), child.getLocalName());
            if (kind.isEmpty()) {
                continue;
            }
            String id = child.getAttribute("id");
            if (id.isEmpty()) {
                if (kind.get() == ElementKind.UNSUPPORTED) {
                    log.debug("Skipping anonymous element <{}>", child.getNodeName());
                    continue;
                }
                throw new DiagramStructureException(PipelineStage.PARSE, null,
                    "Flow node <" + child.getLocalName() + "> has no id");
            }
            if (!ids.add(id)) {
                throw new DiagramStructureException(PipelineStage.PARSE, id, "Duplicate element id: " + id);
            }

            DiagramElement element = readElement(child, kind.get(), laneByElement.get(id), elements.size());
            if (element.kind() == ElementKind.UNSUPPORTED) {
                warnings.add(new PipelineWarning(WarningType.UNSUPPORTED_ELEMENT, id,
                    "Unsupported element <" + child.getNodeName() + "> passed through"));
            }
            elements.add(element);
        }

        if (elements.isEmpty()) {
            throw new MalformedDiagramException("Process '" + processId + "' contains no flow elements");
        }

        validateBoundaryEvents(elements, ids);
        List<SequenceFlow> flows = readFlows(flowNodes, ids);
        elements = applyGroupSla(elements, readSlaGroups(definitions), readShapeBounds(document));
        DiagramMetadata metadata = readMetadata(definitions, process);

        ProcessGraph graph = ProcessGraph.of(processId, elements, flows, lanes, metadata);
        log.info("Parsed process '{}': {} elements, {} flows, {} lanes, {} warnings",
            processId, elements.size(), flows.size(), lanes.size(), warnings.size());
        return new ParseResult(graph, warnings);
    }

    private Document readDocument(String markup) {
        String content = markup.startsWith("\uFEFF") ? markup.substring(1) : markup;
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            factory.setFeature(DISALLOW_DOCTYPE, true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);

            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new RethrowingErrorHandler());
            return builder.parse(new InputSource(new StringReader(content)));
        } catch (SAXException e) {
            throw new MalformedDiagramException("Diagram markup is not well-formed XML: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new MalformedDiagramException("Failed to read diagram markup: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser configuration failed", e);
        }
    }

    /**
     * Picks the process to document: the first participant's process with flow nodes, otherwise
     * the first process with flow nodes, otherwise the first process.
     */
    private Element selectProcess(Element definitions) {
        List<Element> processes = modelChildren(definitions, "process");
        if (processes.isEmpty()) {
            throw new MalformedDiagramException("Diagram contains no process element");
        }

        Map<String, Element> byId = new LinkedHashMap<>();
        processes.forEach(p -> byId.put(p.getAttribute("id"), p));

        for (Element participant : descendants(definitions, "participant")) {
            Element referenced = byId.get(participant.getAttribute("processRef"));
            if (referenced != null && hasFlowNodes(referenced)) {
                return referenced;
            }
        }
        return processes.stream()
            .filter(this::hasFlowNodes)
            .findFirst()
            .orElse(processes.get(0));
    }

    private boolean hasFlowNodes(Element process) {
        return childElements(process).stream()
            .filter(child -> BpmnNamespaces.MODEL.equals(child.getNamespaceURI()))
            .anyMatch(child -> kindResolver.resolve(child.getNamespaceURI(), child.getLocalName()).isPresent());
    }

    private void readLaneSet(Element laneSet, List<Lane> lanes, Map<String, String> laneByElement) {
        for (Element laneElement : modelChildren(laneSet, "lane")) {
            String laneId = laneElement.getAttribute("id");
            List<String> members = new ArrayList<>();
            for (Element ref : modelChildren(laneElement, "flowNodeRef")) {
                String memberId = ref.getTextContent().strip();
                if (!memberId.isEmpty()) {
                    members.add(memberId);
                    laneByElement.put(memberId, laneId);
                }
            }

            Raci raci = new Raci(
                documentation(laneElement, BpmnNamespaces.FORMAT_RESPONSIBLE),
                documentation(laneElement, BpmnNamespaces.FORMAT_ACCOUNTABLE),
                documentation(laneElement, BpmnNamespaces.FORMAT_CONSULTED),
                documentation(laneElement, BpmnNamespaces.FORMAT_INFORMED)
            );
            lanes.add(new Lane(laneId, TextUtils.stripCombiningMarks(laneElement.getAttribute("name")), members, raci));

            // nested lanes are read after their parent so the innermost lane wins
            for (Element childLaneSet : modelChildren(laneElement, "childLaneSet")) {
                readLaneSet(childLaneSet, lanes, laneByElement);
            }
        }
    }

    private DiagramElement readElement(Element node, ElementKind kind, String laneId, int order) {
        String attachedTo = node.getAttribute("attachedToRef");
        return new DiagramElement(
            node.getAttribute("id"),
            kind,
            TextUtils.collapseWhitespace(node.getAttribute("name")),
            laneId,
            node.getLocalName(),
            documentation(node, null),
            documentation(node, BpmnNamespaces.FORMAT_SLA),
            eventType(node),
            attachedTo.isEmpty() ? null : attachedTo,
            !"false".equalsIgnoreCase(node.getAttribute("cancelActivity")),
            order
        );
    }

    private EventType eventType(Element node) {
        return childElements(node).stream()
            .map(child -> EVENT_DEFINITIONS.get(child.getLocalName()))
            .filter(Objects::nonNull)
            .findFirst()
            .orElse(EventType.NONE);
    }

    private void validateBoundaryEvents(List<DiagramElement> elements, Set<String> ids) {
        for (DiagramElement element : elements) {
            if (element.kind() != ElementKind.BOUNDARY_EVENT) {
                continue;
            }
            if (element.attachedToId() == null || !ids.contains(element.attachedToId())) {
                throw new DiagramStructureException(PipelineStage.PARSE, element.id(),
                    "Boundary event " + element.id() + " is attached to unknown activity " + element.attachedToId());
            }
        }
    }

    private List<SequenceFlow> readFlows(List<Element> flowNodes, Set<String> ids) {
        List<SequenceFlow> flows = new ArrayList<>();
        for (Element flowNode : flowNodes) {
            String id = flowNode.getAttribute("id");
            String source = flowNode.getAttribute("sourceRef");
            String target = flowNode.getAttribute("targetRef");
            if (id.isEmpty()) {
                throw new DiagramStructureException(PipelineStage.PARSE, null,
                    "Sequence flow from " + source + " to " + target + " has no id");
            }
            if (!ids.contains(source)) {
                throw new DiagramStructureException(PipelineStage.PARSE, id,
                    "Sequence flow " + id + " references unknown source element '" + source + "'");
            }
            if (!ids.contains(target)) {
                throw new DiagramStructureException(PipelineStage.PARSE, id,
                    "Sequence flow " + id + " references unknown target element '" + target + "'");
            }
            flows.add(new SequenceFlow(
                id,
                source,
                target,
                TextUtils.collapseWhitespace(flowNode.getAttribute("name")),
                documentation(flowNode, null),
                flows.size()
            ));
        }
        return flows;
    }

    private Map<String, Bounds> readShapeBounds(Document document) {
        Map<String, Bounds> bounds = new HashMap<>();
        NodeList shapes = document.getElementsByTagNameNS(BpmnNamespaces.DI, "BPMNShape");
        for (int i = 0; i < shapes.getLength(); i++) {
            Element shape = (Element) shapes.item(i);
            String elementRef = shape.getAttribute("bpmnElement");
            NodeList boundsNodes = shape.getElementsByTagNameNS(BpmnNamespaces.DC, "Bounds");
            if (elementRef.isEmpty() || boundsNodes.getLength() == 0) {
                continue;
            }
            Element b = (Element) boundsNodes.item(0);
            try {
                bounds.put(elementRef, new Bounds(
                    Double.parseDouble(b.getAttribute("x")),
                    Double.parseDouble(b.getAttribute("y")),
                    Double.parseDouble(b.getAttribute("width")),
                    Double.parseDouble(b.getAttribute("height"))));
            } catch (NumberFormatException e) {
                log.debug("Ignoring shape {} with unreadable bounds: {}", elementRef, e.getMessage());
            }
        }
        return bounds;
    }

    private List<SlaGroup> readSlaGroups(Element definitions) {
        List<SlaGroup> groups = new ArrayList<>();
        for (Element group : descendants(definitions, "group")) {
            String sla = documentation(group, BpmnNamespaces.FORMAT_SLA);
            if (sla != null) {
                groups.add(new SlaGroup(group.getAttribute("id"), sla));
            }
        }
        return groups;
    }

    private List<DiagramElement> applyGroupSla(List<DiagramElement> elements, List<SlaGroup> groups,
                                               Map<String, Bounds> bounds) {
        if (groups.isEmpty()) {
            return elements;
        }
        List<DiagramElement> result = new ArrayList<>(elements.size());
        for (DiagramElement element : elements) {
            Bounds shape = bounds.get(element.id());
            if (!element.kind().isActivity() || element.sla() != null || shape == null) {
                result.add(element);
                continue;
            }
            result.add(groups.stream()
                .filter(group -> bounds.containsKey(group.id()))
                .filter(group -> bounds.get(group.id()).contains(shape.centerX(), shape.centerY()))
                .findFirst()
                .map(group -> element.withSla(group.sla()))
                .orElse(element));
        }
        return result;
    }

    private DiagramMetadata readMetadata(Element definitions, Element process) {
        String processId = process.getAttribute("id");
        List<Element> participants = descendants(definitions, "participant");
        Element participant = participants.stream()
            .filter(p -> processId.equals(p.getAttribute("processRef")) && !p.getAttribute("name").isBlank())
            .findFirst()
            .or(() -> participants.stream().filter(p -> !p.getAttribute("name").isBlank()).findFirst())
            .orElse(null);

        String participantName = participant == null ? null : blankToNull(participant.getAttribute("name"));
        String purpose = participant == null ? null : modelChildren(participant, "documentation").stream()
            .map(doc -> doc.getTextContent().strip())
            .filter(text -> !text.isEmpty())
            .findFirst()
            .orElse(null);

        List<Policy> policies = new ArrayList<>();
        for (Element doc : modelChildren(process, "documentation")) {
            String text = doc.getTextContent().strip();
            if (BpmnNamespaces.FORMAT_POLICY.equals(doc.getAttribute("textFormat")) && !text.isEmpty()) {
                policies.add(new Policy(String.valueOf(policies.size() + 1), text));
            }
        }

        String processCode = null;
        List<Abbreviation> abbreviations = new ArrayList<>();
        for (Element extensions : modelChildren(process, "extensionElements")) {
            for (Element extension : childElements(extensions)) {
                if (!BpmnNamespaces.ZEEBE.equals(extension.getNamespaceURI())) {
                    continue;
                }
                if ("versionTag".equals(extension.getLocalName()) && processCode == null) {
                    processCode = blankToNull(extension.getAttribute("value"));
                } else if ("properties".equals(extension.getLocalName())) {
                    for (Element property : childElements(extension)) {
                        String term = property.getAttribute("name").strip();
                        if (!term.isEmpty()) {
                            abbreviations.add(new Abbreviation(term, property.getAttribute("value").strip()));
                        }
                    }
                }
            }
        }
        if (processCode == null) {
            processCode = blankToNull(process.getAttributeNS(BpmnNamespaces.CAMUNDA, "versionTag"));
        }

        return new DiagramMetadata(
            participantName == null ? null : TextUtils.collapseWhitespace(participantName),
            purpose,
            blankToNull(TextUtils.collapseWhitespace(process.getAttribute("name"))),
            documentation(process, BpmnNamespaces.FORMAT_SCOPE),
            processCode,
            abbreviations,
            policies
        );
    }

    /**
     * Returns the first non-blank documentation text with the given format. A null format
     * selects untyped ({@code text/plain} or no format) documentation.
     */
    private String documentation(Element node, String format) {
        for (Element doc : modelChildren(node, "documentation")) {
            String textFormat = doc.getAttribute("textFormat");
            boolean matches = format == null
                ? textFormat.isEmpty() || "text/plain".equals(textFormat)
                : format.equals(textFormat);
            String text = doc.getTextContent().strip();
            if (matches && !text.isEmpty()) {
                return text;
            }
        }
        return null;
    }

    private static boolean isModel(Element element, String localName) {
        return BpmnNamespaces.MODEL.equals(element.getNamespaceURI()) && localName.equals(element.getLocalName());
    }

    private static List<Element> childElements(Element parent) {
        List<Element> children = new ArrayList<>();
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                children.add((Element) node);
            }
        }
        return children;
    }

    private static List<Element> modelChildren(Element parent, String localName) {
        return childElements(parent).stream()
            .filter(child -> isModel(child, localName))
            .toList();
    }

    private static List<Element> descendants(Element root, String localName) {
        NodeList nodes = root.getElementsByTagNameNS(BpmnNamespaces.MODEL, localName);
        List<Element> result = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        return result;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }

    private record Bounds(double x, double y, double width, double height) {

        double centerX() {
            return x + width / 2;
        }

        double centerY() {
            return y + height / 2;
        }

        boolean contains(double px, double py) {
            return px >= x && px <= x + width && py >= y && py <= y + height;
        }
    }

    private record SlaGroup(String id, String sla) {
    }

    /**
     * Turns parser errors into exceptions instead of printing them to standard error.
     */
    private static final class RethrowingErrorHandler implements ErrorHandler {

        @Override
        public void warning(SAXParseException exception) {
            log.debug("XML warning at line {}: {}", exception.getLineNumber(), exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    }
}

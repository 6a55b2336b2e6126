package com.sopgenerator.core.synthesis;

import com.sopgenerator.core.config.SopConfig.DocumentSettings;
import com.sopgenerator.core.config.SopConfig.SectionSettings;
import com.sopgenerator.core.model.Abbreviation;
import com.sopgenerator.core.model.DiagramElement;
import com.sopgenerator.core.model.DiagramMetadata;
import com.sopgenerator.core.model.ElementKind;
import com.sopgenerator.core.model.Lane;
import com.sopgenerator.core.model.MetadataField;
import com.sopgenerator.core.model.Policy;
import com.sopgenerator.core.model.ProcessGraph;
import com.sopgenerator.core.model.ReferencedDocument;
import com.sopgenerator.core.model.SequenceFlow;
import com.sopgenerator.core.model.Step;
import com.sopgenerator.core.util.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Derives metadata defaults and the auxiliary document sections from a process graph.
 *
 * <p>Stateless apart from its settings; one instance can serve any number of requests.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SectionSynthesizer synthesizer = new SectionSynthesizer(config.document(), config.sections(), Glossary.load());
 * MetadataDefaults defaults = synthesizer.defaults(graph);
 * SynthesizedSections sections = synthesizer.synthesize(graph, steps, SectionOverrides.none());
 * }</pre>
 */
public class SectionSynthesizer {

    public static final String UNTITLED_PROCESS = "Untitled Process";
    public static final String DIAGRAM_REFERENCE_PREFIX = "DGM- ";

    private static final Logger log = LoggerFactory.getLogger(SectionSynthesizer.class);
    private static final Pattern ACRONYM = Pattern.compile("\\b[A-Z][A-Z0-9&]{1,7}\\b");

    private final DocumentSettings documentSettings;
    private final SectionSettings sectionSettings;
    private final Glossary glossary;

    public SectionSynthesizer(DocumentSettings documentSettings, SectionSettings sectionSettings, Glossary glossary) {
        this.documentSettings = Objects.requireNonNull(documentSettings, "documentSettings must not be null");
        this.sectionSettings = Objects.requireNonNull(sectionSettings, "sectionSettings must not be null");
        this.glossary = Objects.requireNonNull(glossary, "glossary must not be null");
    }

    /**
     * Computes the default value of every editable field.
     *
     * @param graph process graph
     * @return defaults in field order
     */
    public MetadataDefaults defaults(ProcessGraph graph) {
        DiagramMetadata metadata = graph.metadata();
        String processName = processName(graph);

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(MetadataField.PROCESS_NAME.key(), processName);
        fields.put(MetadataField.PROCESS_CODE.key(), nullToEmpty(metadata.processCode()));
        fields.put(MetadataField.ISSUED_BY.key(), documentSettings.issuedBy());
        fields.put(MetadataField.RELEASE_DATE.key(), documentSettings.releaseDate());
        fields.put(MetadataField.PROCESS_OWNER.key(), "");
        fields.put(MetadataField.PURPOSE.key(), TextUtils.isBlank(metadata.purpose())
            ? DocumentSettings.fill(documentSettings.purposeTemplate(), processName)
            : metadata.purpose().strip());
        fields.put(MetadataField.SCOPE.key(), TextUtils.isBlank(metadata.scope())
            ? DocumentSettings.fill(documentSettings.scopeTemplate(), processName)
            : metadata.scope().strip());
        fields.put(MetadataField.INPUTS.key(), inputs(graph));
        fields.put(MetadataField.OUTPUTS.key(), outputs(graph));
        return new MetadataDefaults(fields);
    }

    /**
     * Builds the auxiliary sections.
     *
     * @param graph process graph
     * @param steps linearized steps, scanned for acronyms in step titles
     * @param overrides author-supplied section content
     * @return synthesized sections
     */
    public SynthesizedSections synthesize(ProcessGraph graph, List<Step> steps, SectionOverrides overrides) {
        SectionOverrides effective = overrides == null ? SectionOverrides.none() : overrides;

        List<ReferencedDocument> references = effective.references() != null
            ? effective.references()
            : referencedDocuments(graph);
        List<Abbreviation> abbreviations = abbreviations(graph, steps, effective.abbreviations());
        List<Policy> policies = effective.policies() != null
            ? effective.policies()
            : policies(graph);

        log.debug("Synthesized {} abbreviations, {} references, {} policies",
            abbreviations.size(), references.size(), policies.size());
        return new SynthesizedSections(abbreviations, references, policies);
    }

    /**
     * Lists one approval per distinct lane name, sorted alphabetically.
     *
     * @param graph process graph
     * @return referenced documents
     */
    public List<ReferencedDocument> referencedDocuments(ProcessGraph graph) {
        TreeSet<String> laneNames = new TreeSet<>();
        for (Lane lane : graph.lanes()) {
            if (!lane.name().isBlank()) {
                laneNames.add(lane.name());
            }
        }

        List<ReferencedDocument> references = new ArrayList<>();
        for (String name : laneNames) {
            references.add(new ReferencedDocument(null, name + " Approval"));
        }
        if (sectionSettings.diagramReference()) {
            String processName = processName(graph);
            references.add(new ReferencedDocument(
                DIAGRAM_REFERENCE_PREFIX + nullToEmpty(graph.metadata().processCode()),
                processName + " Process Diagram"));
        }
        return references;
    }

    /**
     * Collects abbreviations from the glossary, the diagram text and the author.
     *
     * @param graph process graph
     * @param steps linearized steps
     * @param userEntries author entries, override synthesized ones by term (may be null)
     * @return abbreviations sorted by term
     */
    public List<Abbreviation> abbreviations(ProcessGraph graph, List<Step> steps, List<Abbreviation> userEntries) {
        Map<String, Abbreviation> byTerm = new LinkedHashMap<>();

        for (GlossaryEntry entry : glossary.alwaysIncluded()) {
            byTerm.put(entry.term(), new Abbreviation(entry.term(), entry.definition()));
        }

        for (String acronym : detectAcronyms(graph, steps)) {
            if (byTerm.containsKey(acronym)) {
                continue;
            }
            String definition = glossary.lookup(acronym)
                .map(GlossaryEntry::definition)
                .orElse("[Definition for " + acronym + "]");
            byTerm.put(acronym, new Abbreviation(acronym, definition));
        }

        for (Abbreviation declared : graph.metadata().abbreviations()) {
            byTerm.put(declared.term(), declared);
        }

        if (userEntries != null) {
            for (Abbreviation user : userEntries) {
                if (!user.term().isBlank()) {
                    byTerm.put(user.term().strip(), new Abbreviation(user.term().strip(), user.definition()));
                }
            }
        }

        return byTerm.values().stream()
            .sorted(Comparator.comparing(Abbreviation::term, String.CASE_INSENSITIVE_ORDER)
                .thenComparing(Abbreviation::term))
            .toList();
    }

    /**
     * Returns the policies declared in the diagram, or the configured boilerplate.
     *
     * @param graph process graph
     * @return numbered policies
     */
    public List<Policy> policies(ProcessGraph graph) {
        if (!graph.metadata().policies().isEmpty()) {
            return graph.metadata().policies();
        }
        String processName = processName(graph);
        List<Policy> policies = new ArrayList<>();
        int number = 1;
        for (String template : documentSettings.policyTemplates()) {
            policies.add(new Policy(String.valueOf(number++), DocumentSettings.fill(template, processName)));
        }
        return policies;
    }

    /**
     * Resolves the process name: participant name, then process name, then a placeholder.
     *
     * @param graph process graph
     * @return display name of the process
     */
    public String processName(ProcessGraph graph) {
        DiagramMetadata metadata = graph.metadata();
        if (!TextUtils.isBlank(metadata.participantName())) {
            return metadata.participantName().strip();
        }
        if (!TextUtils.isBlank(metadata.processName())) {
            return metadata.processName().strip();
        }
        return UNTITLED_PROCESS;
    }

    private TreeSet<String> detectAcronyms(ProcessGraph graph, List<Step> steps) {
        Stream<String> elementTexts = graph.elements().stream()
            .flatMap(element -> Stream.of(element.label(), element.documentation()));
        Stream<String> flowTexts = graph.flows().stream()
            .flatMap(flow -> Stream.of(flow.conditionLabel(), flow.documentation()));
        Stream<String> laneTexts = graph.lanes().stream().map(Lane::name);
        Stream<String> stepTexts = steps == null ? Stream.empty() : steps.stream().map(Step::title);

        TreeSet<String> acronyms = new TreeSet<>();
        Stream.of(elementTexts, flowTexts, laneTexts, stepTexts)
            .flatMap(s -> s)
            .filter(Objects::nonNull)
            .forEach(text -> {
                Matcher matcher = ACRONYM.matcher(text);
                while (matcher.find()) {
                    acronyms.add(matcher.group());
                }
            });
        return acronyms;
    }

    private String inputs(ProcessGraph graph) {
        List<String> lines = new ArrayList<>();
        int number = 1;
        for (DiagramElement start : graph.elementsOfKind(ElementKind.START_EVENT)) {
            String name = start.hasLabel() ? start.label() : firstFlowLabel(graph, start.id());
            if (!name.isEmpty()) {
                lines.add(number + ". " + name);
            }
            number++;
        }
        return String.join("\n", lines);
    }

    private String outputs(ProcessGraph graph) {
        List<String> lines = new ArrayList<>();
        for (DiagramElement end : graph.elementsOfKind(ElementKind.END_EVENT)) {
            if (end.hasLabel()) {
                lines.add((lines.size() + 1) + ". " + end.label());
            }
        }
        return String.join("\n", lines);
    }

    private String firstFlowLabel(ProcessGraph graph, String elementId) {
        return graph.outgoing(elementId).stream()
            .filter(SequenceFlow::hasConditionLabel)
            .map(SequenceFlow::conditionLabel)
            .findFirst()
            .orElse("");
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}

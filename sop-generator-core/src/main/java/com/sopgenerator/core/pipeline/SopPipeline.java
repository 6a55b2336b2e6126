package com.sopgenerator.core.pipeline;

import com.sopgenerator.core.config.SopConfig;
import com.sopgenerator.core.linearizer.Linearization;
import com.sopgenerator.core.linearizer.LinearizerOptions;
import com.sopgenerator.core.linearizer.StepLinearizer;
import com.sopgenerator.core.model.DocumentContext;
import com.sopgenerator.core.model.PipelineWarning;
import com.sopgenerator.core.model.ProcessGraph;
import com.sopgenerator.core.parser.BpmnDiagramParser;
import com.sopgenerator.core.parser.DiagramParser;
import com.sopgenerator.core.parser.ParseResult;
import com.sopgenerator.core.renderer.DocumentRenderer;
import com.sopgenerator.core.renderer.DocumentRenderers;
import com.sopgenerator.core.renderer.GeneratedDocument;
import com.sopgenerator.core.renderer.RenderContext;
import com.sopgenerator.core.synthesis.Glossary;
import com.sopgenerator.core.synthesis.MetadataDefaults;
import com.sopgenerator.core.synthesis.SectionOverrides;
import com.sopgenerator.core.synthesis.SectionSynthesizer;
import com.sopgenerator.core.synthesis.SynthesizedSections;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point of the diagram-to-document transformation.
 *
 * <p>Data flows parser, linearizer, synthesizer, renderer. Every call builds its own graph and
 * document context; the pipeline holds configuration only and may be shared between threads.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SopPipeline pipeline = new SopPipeline(ConfigLoader.load(Paths.get("sop-generator.yaml")));
 * ParseResult parsed = pipeline.ingest(markup);
 * Map<String, String> defaults = pipeline.extractMetadata(parsed.graph());
 * GeneratedDocument document = pipeline.finalizeDocument(parsed.graph(), userFields, SectionOverrides.none());
 * }</pre>
 */
public class SopPipeline {

    private static final Logger log = LoggerFactory.getLogger(SopPipeline.class);

    private final SopConfig config;
    private final DiagramParser parser;
    private final StepLinearizer linearizer;
    private final SectionSynthesizer synthesizer;

    public SopPipeline() {
        this(SopConfig.defaults());
    }

    public SopPipeline(SopConfig config) {
        this(config, new BpmnDiagramParser(), Glossary.load());
    }

    public SopPipeline(SopConfig config, DiagramParser parser, Glossary glossary) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.linearizer = new StepLinearizer(new LinearizerOptions(
            config.linearizer().branchOrder(), config.document().unassignedLane()));
        this.synthesizer = new SectionSynthesizer(config.document(), config.sections(), glossary);
    }

    public SopConfig config() {
        return config;
    }

    /**
     * Parses diagram markup.
     *
     * @param markup diagram markup
     * @return graph and parse warnings
     * @throws com.sopgenerator.core.exception.MalformedDiagramException if the markup is not a diagram
     * @throws com.sopgenerator.core.exception.DiagramStructureException if the diagram is inconsistent
     */
    public ParseResult ingest(String markup) {
        return parser.parse(markup);
    }

    /**
     * Computes the default value of every editable document field.
     *
     * @param graph parsed graph
     * @return field key to default value, in field order
     */
    public Map<String, String> extractMetadata(ProcessGraph graph) {
        return synthesizer.defaults(graph).fields();
    }

    /**
     * Linearizes the graph and assembles everything the renderer needs.
     *
     * @param graph parsed graph
     * @param userFields author-edited field values, may be null
     * @param overrides author-supplied section content, may be null
     * @return document context
     */
    public DocumentContext prepare(ProcessGraph graph, Map<String, String> userFields, SectionOverrides overrides) {
        Objects.requireNonNull(graph, "graph must not be null");

        Linearization linearization = linearizer.linearize(graph);
        MetadataDefaults defaults = synthesizer.defaults(graph);
        Map<String, String> fields = defaults.merge(userFields);
        SynthesizedSections sections = synthesizer.synthesize(graph, linearization.steps(), overrides);

        List<PipelineWarning> warnings = new ArrayList<>(linearization.warnings());
        log.debug("Prepared document context: {} steps, {} warnings", linearization.steps().size(), warnings.size());
        return new DocumentContext(fields, linearization.steps(), sections.abbreviations(),
            sections.references(), sections.policies(), warnings);
    }

    /**
     * Produces the Word document with the built-in template.
     *
     * <p>The result carries linearization and render warnings only; parse warnings stay on the
     * {@link ParseResult}. Use {@link #finalizeDocument(ParseResult, Map, SectionOverrides)} to
     * get all of them on the document.
     *
     * @param graph parsed graph
     * @param userFields author-edited field values, may be null
     * @param overrides author-supplied section content, may be null
     * @return rendered document with the linearization and render warnings
     */
    public GeneratedDocument finalizeDocument(ProcessGraph graph, Map<String, String> userFields,
                                              SectionOverrides overrides) {
        return finalizeDocument(graph, userFields, overrides,
            DocumentRenderers.find(DocumentRenderers.DEFAULT_RENDERER),
            new RenderContext(null, config.style(), Map.of()));
    }

    /**
     * Produces the Word document with the built-in template, parse warnings included.
     *
     * @param parsed result of {@link #ingest(String)}
     * @param userFields author-edited field values, may be null
     * @param overrides author-supplied section content, may be null
     * @return rendered document with the warnings of every stage
     */
    public GeneratedDocument finalizeDocument(ParseResult parsed, Map<String, String> userFields,
                                              SectionOverrides overrides) {
        return finalizeDocument(parsed, userFields, overrides,
            DocumentRenderers.find(DocumentRenderers.DEFAULT_RENDERER),
            new RenderContext(null, config.style(), Map.of()));
    }

    /**
     * Produces a document with the given renderer and template, parse warnings first.
     *
     * @param parsed result of {@link #ingest(String)}
     * @param userFields author-edited field values, may be null
     * @param overrides author-supplied section content, may be null
     * @param renderer renderer to use
     * @param context template and styling
     * @return rendered document with the warnings of every stage
     * @throws com.sopgenerator.core.exception.DocumentRenderException if rendering fails
     */
    public GeneratedDocument finalizeDocument(ParseResult parsed, Map<String, String> userFields,
                                              SectionOverrides overrides, DocumentRenderer renderer,
                                              RenderContext context) {
        Objects.requireNonNull(parsed, "parsed must not be null");
        GeneratedDocument generated = finalizeDocument(parsed.graph(), userFields, overrides, renderer, context);
        if (parsed.warnings().isEmpty()) {
            return generated;
        }
        List<PipelineWarning> warnings = new ArrayList<>(parsed.warnings());
        warnings.addAll(generated.warnings());
        return new GeneratedDocument(generated.fileName(), generated.content(), generated.contentType(), warnings);
    }

    /**
     * Produces a document with the given renderer and template.
     *
     * <p>Parse warnings are not included, see
     * {@link #finalizeDocument(ParseResult, Map, SectionOverrides, DocumentRenderer, RenderContext)}.
     *
     * @param graph parsed graph
     * @param userFields author-edited field values, may be null
     * @param overrides author-supplied section content, may be null
     * @param renderer renderer to use
     * @param context template and styling
     * @return rendered document with the linearization and render warnings
     * @throws com.sopgenerator.core.exception.DocumentRenderException if rendering fails
     */
    public GeneratedDocument finalizeDocument(ProcessGraph graph, Map<String, String> userFields,
                                              SectionOverrides overrides, DocumentRenderer renderer,
                                              RenderContext context) {
        Objects.requireNonNull(renderer, "renderer must not be null");
        DocumentContext document = prepare(graph, userFields, overrides);
        GeneratedDocument generated = renderer.render(document, context);
        log.info("Generated {} ({} bytes) for process '{}'", generated.fileName(), generated.size(), graph.processId());
        return generated;
    }
}

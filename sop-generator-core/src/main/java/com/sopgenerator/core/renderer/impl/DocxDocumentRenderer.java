package com.sopgenerator.core.renderer.impl;

import com.sopgenerator.core.exception.DocumentRenderException;
import com.sopgenerator.core.model.Abbreviation;
import com.sopgenerator.core.model.DocumentContext;
import com.sopgenerator.core.model.PipelineWarning;
import com.sopgenerator.core.model.Policy;
import com.sopgenerator.core.model.ReferencedDocument;
import com.sopgenerator.core.model.WarningType;
import com.sopgenerator.core.renderer.DocumentRenderer;
import com.sopgenerator.core.renderer.GeneratedDocument;
import com.sopgenerator.core.renderer.RenderContext;
import com.sopgenerator.core.renderer.docx.ConditionalSections;
import com.sopgenerator.core.renderer.docx.DefaultTemplateFactory;
import com.sopgenerator.core.renderer.docx.DocumentStyle;
import com.sopgenerator.core.renderer.docx.PlaceholderReplacer;
import com.sopgenerator.core.renderer.docx.RowTemplates;
import com.sopgenerator.core.renderer.docx.SectionTableWriter;
import com.sopgenerator.core.renderer.docx.StepTableWriter;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFFooter;
import org.apache.poi.xwpf.usermodel.XWPFHeader;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Renderer that fills a Word template with the procedure.
 *
 * <p>The template is either the file named by {@link RenderContext#templatePath()} or the
 * built-in Guideline V2 template. The template file is only read; every call works on its own
 * in-memory copy.
 *
 * <p><b>Steps:</b>
 * <ol>
 *   <li>Drop {@code {{#name}}...{{/name}}} sections whose list or field is empty</li>
 *   <li>Substitute the scalar fields in the body, headers and footers</li>
 *   <li>Expand the {@code step.*}, {@code abbreviation.*}, {@code reference.*} and
 *       {@code policy.*} prototype rows</li>
 * </ol>
 *
 * <p>Text written from the diagram is never scanned for placeholders again.
 *
 * <p>Placeholders without a value render empty and produce an
 * {@link WarningType#UNKNOWN_PLACEHOLDER} warning.
 */
public class DocxDocumentRenderer implements DocumentRenderer {

    static final String ABBREVIATION_PREFIX = "abbreviation.";
    static final String REFERENCE_PREFIX = "reference.";
    static final String POLICY_PREFIX = "policy.";
    static final List<String> ROW_PREFIXES =
        List.of(StepTableWriter.PREFIX, ABBREVIATION_PREFIX, REFERENCE_PREFIX, POLICY_PREFIX);

    private static final Logger log = LoggerFactory.getLogger(DocxDocumentRenderer.class);

    @Override
    public String getId() {
        return "docx";
    }

    @Override
    public String getFileExtension() {
        return "docx";
    }

    @Override
    public GeneratedDocument render(DocumentContext document, RenderContext context) {
        DocumentStyle style = new DocumentStyle(context.style());
        List<PipelineWarning> warnings = new ArrayList<>(document.warnings());
        log.info("Rendering {} steps with {} template", document.steps().size(),
            context.hasTemplate() ? context.templatePath() : "built-in");

        try (XWPFDocument docx = open(context, style)) {
            ConditionalSections sections = new ConditionalSections(name -> hasContent(document, name));
            sections.apply(docx);
            for (String name : sections.unmatchedMarkers()) {
                warnings.add(new PipelineWarning(WarningType.TEMPLATE_MISMATCH, null,
                    "Section marker '" + name + "' has no counterpart and was removed"));
            }

            Function<String, String> scalars = name -> scalar(document, name);
            PlaceholderReplacer replacer = new PlaceholderReplacer(scalars, DocxDocumentRenderer::isRowToken);
            replacer.replaceIn(docx);
            for (XWPFHeader header : docx.getHeaderList()) {
                replacer.replaceIn(header);
            }
            for (XWPFFooter footer : docx.getFooterList()) {
                replacer.replaceIn(footer);
            }
            Set<String> unknown = new LinkedHashSet<>(replacer.unknownNames());

            boolean stepsWritten = expandTables(docx, document, style, scalars, unknown);
            if (!stepsWritten) {
                warnings.add(new PipelineWarning(WarningType.TEMPLATE_MISMATCH, null,
                    "Template has no {{step.*}} row, the procedure was not rendered"));
            }

            for (String name : unknown) {
                log.warn("Template placeholder has no value: {}", name);
                warnings.add(new PipelineWarning(WarningType.UNKNOWN_PLACEHOLDER, null,
                    "Placeholder {{" + name + "}} has no value and was left empty"));
            }

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            docx.write(out);
            log.info("Rendered document: {} bytes, {} warnings", out.size(), warnings.size());
            return new GeneratedDocument(fileName(document, getFileExtension()), out.toByteArray(),
                GeneratedDocument.DOCX_CONTENT_TYPE, warnings);
        } catch (IOException | POIXMLException | UnsupportedFileFormatException e) {
            throw new DocumentRenderException("Failed to render document: " + e.getMessage(), e);
        }
    }

    private XWPFDocument open(RenderContext context, DocumentStyle style) throws IOException {
        if (!context.hasTemplate()) {
            return new DefaultTemplateFactory(style).create();
        }
        if (!Files.isRegularFile(context.templatePath())) {
            throw new IOException("Template not found: " + context.templatePath());
        }
        try (InputStream in = Files.newInputStream(context.templatePath())) {
            return new XWPFDocument(in);
        }
    }

    private boolean expandTables(XWPFDocument docx, DocumentContext document, DocumentStyle style,
                                 Function<String, String> scalars, Set<String> unknown) {
        StepTableWriter stepWriter = new StepTableWriter(style);
        SectionTableWriter sectionWriter = new SectionTableWriter();
        Map<String, List<Map<String, String>>> regions = new LinkedHashMap<>();
        regions.put(ABBREVIATION_PREFIX, document.abbreviations().stream().map(DocxDocumentRenderer::entry).toList());
        regions.put(REFERENCE_PREFIX, document.references().stream().map(DocxDocumentRenderer::entry).toList());
        regions.put(POLICY_PREFIX, document.policies().stream().map(DocxDocumentRenderer::entry).toList());

        boolean stepsWritten = false;
        for (XWPFTable table : new ArrayList<>(docx.getTables())) {
            List<RowTemplates.Prototype> prototypes = RowTemplates.findPrototypes(table, ROW_PREFIXES);
            // bottom-up, so earlier indices stay valid and filled rows are never scanned
            for (int i = prototypes.size() - 1; i >= 0; i--) {
                RowTemplates.Prototype prototype = prototypes.get(i);
                if (prototype.prefix().equals(StepTableWriter.PREFIX)) {
                    unknown.addAll(stepWriter.write(table, prototype.rowIndex(), document.steps(), scalars));
                    stepsWritten = true;
                } else {
                    unknown.addAll(sectionWriter.write(table, prototype.rowIndex(), prototype.prefix(),
                        regions.get(prototype.prefix()), scalars));
                }
            }
        }
        return stepsWritten;
    }

    private static boolean isRowToken(String name) {
        return ROW_PREFIXES.stream().anyMatch(name::startsWith);
    }

    private static boolean hasContent(DocumentContext document, String name) {
        return switch (name) {
            case "steps" -> !document.steps().isEmpty();
            case "abbreviations" -> !document.abbreviations().isEmpty();
            case "references" -> !document.references().isEmpty();
            case "policies" -> !document.policies().isEmpty();
            default -> !document.fields().getOrDefault(name, "").isBlank();
        };
    }

    /**
     * Resolves scalar placeholders. The list names resolve to a plain text rendering for
     * templates that do not use prototype rows.
     */
    private static String scalar(DocumentContext document, String name) {
        String field = document.fields().get(name);
        if (field != null) {
            return field;
        }
        return switch (name) {
            case "abbreviations" -> document.abbreviations().stream()
                .map(a -> a.term() + ": " + a.definition())
                .collect(Collectors.joining("\n"));
            case "references" -> document.references().stream()
                .map(r -> r.reference() + " | " + r.title())
                .collect(Collectors.joining("\n"));
            case "policies" -> document.policies().stream()
                .map(p -> p.reference() + ". " + p.text())
                .collect(Collectors.joining("\n"));
            default -> null;
        };
    }

    private static Map<String, String> entry(Abbreviation abbreviation) {
        return Map.of("term", abbreviation.term(), "definition", abbreviation.definition());
    }

    private static Map<String, String> entry(ReferencedDocument reference) {
        return Map.of("id", reference.reference(), "title", reference.title());
    }

    private static Map<String, String> entry(Policy policy) {
        return Map.of("ref", policy.reference(), "text", policy.text());
    }

    static String fileName(DocumentContext document, String extension) {
        String name = document.fields().getOrDefault("process_name", "").strip()
            .replaceAll("[\\\\/:*?\"<>|]", "_");
        return (name.isEmpty() ? "SOP" : name) + "." + extension;
    }
}

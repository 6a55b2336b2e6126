package com.sopgenerator.core.renderer.impl;

import com.sopgenerator.core.model.Abbreviation;
import com.sopgenerator.core.model.DocumentContext;
import com.sopgenerator.core.model.MetadataField;
import com.sopgenerator.core.model.Paragraph;
import com.sopgenerator.core.model.ParagraphRole;
import com.sopgenerator.core.model.Policy;
import com.sopgenerator.core.model.ReferencedDocument;
import com.sopgenerator.core.model.Step;
import com.sopgenerator.core.renderer.DocumentRenderer;
import com.sopgenerator.core.renderer.GeneratedDocument;
import com.sopgenerator.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Renders a plain Markdown preview of the document.
 *
 * <p>Useful for reviewing the procedure before producing the Word document. Templates and
 * styling are ignored.
 */
public class MarkdownDocumentRenderer implements DocumentRenderer {

    private static final Logger log = LoggerFactory.getLogger(MarkdownDocumentRenderer.class);

    @Override
    public String getId() {
        return "markdown";
    }

    @Override
    public String getFileExtension() {
        return "md";
    }

    @Override
    public GeneratedDocument render(DocumentContext document, RenderContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("# ").append(document.field(MetadataField.PROCESS_NAME)).append("\n\n");

        sb.append("| Field | Value |\n");
        sb.append("|-------|-------|\n");
        row(sb, "Process Code", document.field(MetadataField.PROCESS_CODE));
        row(sb, "Issued By", document.field(MetadataField.ISSUED_BY));
        row(sb, "Released Date", document.field(MetadataField.RELEASE_DATE));
        row(sb, "Process Owner", document.field(MetadataField.PROCESS_OWNER));
        sb.append("\n");

        section(sb, "Purpose", document.field(MetadataField.PURPOSE));
        section(sb, "Scope", document.field(MetadataField.SCOPE));

        sb.append("## Abbreviations and Definitions\n\n");
        for (Abbreviation abbreviation : document.abbreviations()) {
            sb.append("- **").append(abbreviation.term()).append("**: ").append(abbreviation.definition()).append("\n");
        }
        sb.append("\n");

        if (!document.references().isEmpty()) {
            sb.append("## Referenced Documents and Approvals\n\n");
            for (ReferencedDocument reference : document.references()) {
                sb.append("- ").append(reference.reference()).append(" | ").append(reference.title()).append("\n");
            }
            sb.append("\n");
        }

        section(sb, "Key Process Inputs", document.field(MetadataField.INPUTS));
        section(sb, "Key Process Outputs", document.field(MetadataField.OUTPUTS));

        sb.append("## Process Description\n\n");
        for (Step step : document.steps()) {
            step(sb, step);
        }
        sb.append("\n");

        if (!document.policies().isEmpty()) {
            sb.append("## General Policies\n\n");
            for (Policy policy : document.policies()) {
                sb.append(policy.reference()).append(". ").append(policy.text()).append("\n");
            }
        }

        log.debug("Rendered markdown preview with {} steps", document.steps().size());
        return new GeneratedDocument(DocxDocumentRenderer.fileName(document, getFileExtension()),
            sb.toString().getBytes(StandardCharsets.UTF_8), GeneratedDocument.MARKDOWN_CONTENT_TYPE,
            document.warnings());
    }

    private void step(StringBuilder sb, Step step) {
        String indent = "  ".repeat(step.depth());
        boolean first = true;
        for (Paragraph paragraph : step.paragraphs()) {
            if (first) {
                sb.append(indent).append("- ");
                if (!step.ref().isEmpty()) {
                    sb.append("**").append(step.ref()).append("** ");
                }
                first = false;
            } else {
                sb.append(indent).append("  ");
            }
            sb.append(paragraph.role() == ParagraphRole.ROUTING ? "_" + paragraph.text() + "_" : paragraph.text());
            sb.append("\n");
        }
    }

    private void row(StringBuilder sb, String name, String value) {
        sb.append("| ").append(name).append(" | ").append(value.replace("\n", "<br>")).append(" |\n");
    }

    private void section(StringBuilder sb, String title, String text) {
        sb.append("## ").append(title).append("\n\n");
        sb.append(text.isBlank() ? "N/A" : text).append("\n\n");
    }
}

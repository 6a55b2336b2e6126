package com.sopgenerator.core.renderer.docx;

import com.sopgenerator.core.config.SopConfig.StyleSettings;
import com.sopgenerator.core.model.Paragraph;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;

import java.util.Objects;

/**
 * Applies the configured font scheme and shading to generated content.
 */
public class DocumentStyle {

    /** Size of RACI and SLA cell text. */
    public static final int ASSIGNMENT_SIZE = 9;
    public static final String HEADER_FILL = "4472C4";
    public static final String HEADER_TEXT = "FFFFFF";
    public static final String TEXT_COLOR = "000000";

    private final StyleSettings settings;

    public DocumentStyle(StyleSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public StyleSettings settings() {
        return settings;
    }

    /**
     * Sets font family, size and weight of a run.
     *
     * @param run run to format
     * @param size font size in points
     * @param bold whether the run is bold
     */
    public void font(XWPFRun run, int size, boolean bold) {
        run.setFontFamily(settings.fontFamily());
        run.setFontSize(size);
        run.setBold(bold);
    }

    /**
     * Formats a run as a step reference.
     *
     * @param run run to format
     */
    public void reference(XWPFRun run) {
        font(run, settings.refSize(), true);
        run.setColor(settings.refColor());
    }

    /**
     * Writes one narrative paragraph.
     *
     * @param target empty paragraph to fill
     * @param paragraph narrative paragraph
     * @param depth branch nesting level, drives the left indentation
     */
    public void narrative(XWPFParagraph target, Paragraph paragraph, int depth) {
        if (depth > 0) {
            target.setIndentationLeft(depth * settings.indentPerLevel());
        }
        XWPFRun run = target.createRun();
        run.setText(paragraph.text());
        run.setColor(TEXT_COLOR);
        switch (paragraph.role()) {
            case TITLE -> {
                target.setAlignment(ParagraphAlignment.LEFT);
                font(run, settings.titleSize(), true);
            }
            case BODY -> {
                target.setAlignment(ParagraphAlignment.BOTH);
                font(run, settings.bodySize(), false);
            }
            case ROUTING -> {
                target.setAlignment(ParagraphAlignment.LEFT);
                font(run, settings.bodySize(), false);
                run.setItalic(true);
            }
        }
    }

    public void routingShade(XWPFTableCell cell) {
        cell.setColor(settings.routingShade());
    }

    public void slaShade(XWPFTableCell cell) {
        cell.setColor(settings.slaShade());
    }
}

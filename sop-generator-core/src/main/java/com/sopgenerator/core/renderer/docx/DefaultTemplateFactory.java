package com.sopgenerator.core.renderer.docx;

import org.apache.poi.wp.usermodel.HeaderFooterType;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFFooter;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTblLayoutType;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTblPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTblWidth;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTcPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STTblLayoutType;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STTblWidth;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.math.BigInteger;

/**
 * Builds the Guideline V2 Word template.
 *
 * <p>Layout: centred title, metadata table, the Purpose, Scope, Abbreviations and Definitions,
 * Referenced Documents and Approvals, Key Process Inputs and Key Process Outputs sections,
 * the seven column process description table (Ref., Process Description, R, A, C, I, SLA)
 * and a General Policies section. The referenced documents and policies sections are
 * conditional and disappear when their list is empty. Every variable part is a {@code {{placeholder}}}.
 */
public class DefaultTemplateFactory {

    static final String[] STEP_HEADERS = {"Ref.", "Process Description", "R", "A", "C", "I", "SLA"};
    static final double[] STEP_WIDTHS_INCHES = {0.52, 5.0, 1.0, 1.0, 1.0, 1.0, 0.62};

    private static final int TWIPS_PER_INCH = 1440;
    private static final int TITLE_SIZE = 16;
    private static final int HEADING_SIZE = 12;
    private static final int TABLE_HEADING_SIZE = 14;
    private static final int FRONT_MATTER_SIZE = 12;

    private final DocumentStyle style;

    public DefaultTemplateFactory(DocumentStyle style) {
        this.style = style;
    }

    /**
     * Creates a new template document.
     *
     * @return template, owned by the caller
     */
    public XWPFDocument create() {
        XWPFDocument document = new XWPFDocument();

        XWPFParagraph title = document.createParagraph();
        title.setAlignment(ParagraphAlignment.CENTER);
        text(title, "{{process_name}}", TITLE_SIZE, true);
        document.createParagraph();

        metadataTable(document);
        document.createParagraph();

        section(document, "Purpose", "{{purpose}}");
        section(document, "Scope", "{{scope}}");

        heading(document, "Abbreviations and Definitions", HEADING_SIZE);
        twoColumnTable(document, "Term", "Definition", "{{abbreviation.term}}", "{{abbreviation.definition}}", false);
        document.createParagraph();

        marker(document, "{{#references}}");
        heading(document, "Referenced Documents and Approvals", HEADING_SIZE);
        twoColumnTable(document, "Document No.", "Document Title", "{{reference.id}}", "{{reference.title}}", false);
        document.createParagraph();
        marker(document, "{{/references}}");

        section(document, "Key Process Inputs", "{{inputs}}");
        section(document, "Key Process Outputs", "{{outputs}}");

        heading(document, "Process Description", TABLE_HEADING_SIZE);
        stepTable(document);
        document.createParagraph();

        marker(document, "{{#policies}}");
        heading(document, "General Policies", HEADING_SIZE);
        twoColumnTable(document, "Ref.", "Policy", "{{policy.ref}}", "{{policy.text}}", true);
        marker(document, "{{/policies}}");

        XWPFFooter footer = document.createFooter(HeaderFooterType.DEFAULT);
        XWPFParagraph footerParagraph = footer.createParagraph();
        footerParagraph.setAlignment(ParagraphAlignment.RIGHT);
        text(footerParagraph, "{{process_code}} | {{issued_by}}", DocumentStyle.ASSIGNMENT_SIZE, false);

        return document;
    }

    /**
     * Serializes a new template.
     *
     * @return docx bytes
     */
    public byte[] toBytes() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        write(out);
        return out.toByteArray();
    }

    /**
     * Writes a new template to a stream. The stream is not closed.
     *
     * @param out target stream
     */
    public void write(OutputStream out) {
        try (XWPFDocument document = create()) {
            document.write(out);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write the default template", e);
        }
    }

    private void metadataTable(XWPFDocument document) {
        String[][] cells = {
            {"Process Name:", "{{process_name}}", "Process Code:", "{{process_code}}"},
            {"Issued By:", "{{issued_by}}", "Released Date:", "{{release_date}}"},
            {"Process Owner:", "{{process_owner}}", "", ""}
        };
        XWPFTable table = document.createTable(cells.length, 4);
        for (int r = 0; r < cells.length; r++) {
            XWPFTableRow row = table.getRow(r);
            for (int c = 0; c < 4; c++) {
                cellText(row.getCell(c), cells[r][c], FRONT_MATTER_SIZE, c % 2 == 0);
            }
        }
        borders(table);
    }

    private void twoColumnTable(XWPFDocument document, String firstHeader, String secondHeader,
                                String firstToken, String secondToken, boolean referenceStyle) {
        XWPFTable table = document.createTable(2, 2);
        headerCell(table.getRow(0).getCell(0), firstHeader);
        headerCell(table.getRow(0).getCell(1), secondHeader);

        XWPFTableCell first = table.getRow(1).getCell(0);
        if (referenceStyle) {
            XWPFParagraph paragraph = first.getParagraphs().get(0);
            paragraph.setAlignment(ParagraphAlignment.CENTER);
            XWPFRun run = paragraph.createRun();
            run.setText(firstToken);
            style.reference(run);
        } else {
            cellText(first, firstToken, FRONT_MATTER_SIZE, true);
        }
        cellText(table.getRow(1).getCell(1), secondToken, FRONT_MATTER_SIZE, referenceStyle);

        width(table.getRow(0).getCell(0), 1.5);
        width(table.getRow(1).getCell(0), 1.5);
        width(table.getRow(0).getCell(1), 8.62);
        width(table.getRow(1).getCell(1), 8.62);
        borders(table);
    }

    private void stepTable(XWPFDocument document) {
        XWPFTable table = document.createTable(2, STEP_HEADERS.length);
        fixedLayout(table);

        XWPFTableRow header = table.getRow(0);
        XWPFTableRow prototype = table.getRow(1);
        String[] tokens = {
            "{{step.ref}}", "{{step.description}}", "{{step.responsible}}", "{{step.accountable}}",
            "{{step.consulted}}", "{{step.informed}}", "{{step.sla}}"
        };
        for (int c = 0; c < STEP_HEADERS.length; c++) {
            headerCell(header.getCell(c), STEP_HEADERS[c]);
            width(header.getCell(c), STEP_WIDTHS_INCHES[c]);

            XWPFTableCell cell = prototype.getCell(c);
            width(cell, STEP_WIDTHS_INCHES[c]);
            int size = c < 2 ? style.settings().bodySize() : DocumentStyle.ASSIGNMENT_SIZE;
            cellText(cell, tokens[c], size, false);
            if (c >= 2) {
                cell.getParagraphs().get(0).setAlignment(ParagraphAlignment.CENTER);
            }
        }
        borders(table);
    }

    private void section(XWPFDocument document, String title, String token) {
        heading(document, title, HEADING_SIZE);
        XWPFParagraph content = document.createParagraph();
        content.setAlignment(ParagraphAlignment.BOTH);
        text(content, token, style.settings().bodySize(), false);
        document.createParagraph();
    }

    private void heading(XWPFDocument document, String title, int size) {
        text(document.createParagraph(), title, size, true);
    }

    private void marker(XWPFDocument document, String token) {
        document.createParagraph().createRun().setText(token);
    }

    private void headerCell(XWPFTableCell cell, String text) {
        cell.setColor(DocumentStyle.HEADER_FILL);
        XWPFRun run = cellText(cell, text, style.settings().bodySize(), true);
        run.setColor(DocumentStyle.HEADER_TEXT);
    }

    private XWPFRun cellText(XWPFTableCell cell, String text, int size, boolean bold) {
        return text(cell.getParagraphs().get(0), text, size, bold);
    }

    private XWPFRun text(XWPFParagraph paragraph, String text, int size, boolean bold) {
        XWPFRun run = paragraph.createRun();
        run.setText(text);
        style.font(run, size, bold);
        return run;
    }

    private static void borders(XWPFTable table) {
        table.setTopBorder(XWPFTable.XWPFBorderType.SINGLE, 4, 0, "000000");
        table.setBottomBorder(XWPFTable.XWPFBorderType.SINGLE, 4, 0, "000000");
        table.setLeftBorder(XWPFTable.XWPFBorderType.SINGLE, 4, 0, "000000");
        table.setRightBorder(XWPFTable.XWPFBorderType.SINGLE, 4, 0, "000000");
        table.setInsideHBorder(XWPFTable.XWPFBorderType.SINGLE, 4, 0, "000000");
        table.setInsideVBorder(XWPFTable.XWPFBorderType.SINGLE, 4, 0, "000000");
    }

    private static void fixedLayout(XWPFTable table) {
        CTTblPr tblPr = table.getCTTbl().getTblPr() != null
            ? table.getCTTbl().getTblPr()
            : table.getCTTbl().addNewTblPr();
        CTTblLayoutType layout = tblPr.isSetTblLayout() ? tblPr.getTblLayout() : tblPr.addNewTblLayout();
        layout.setType(STTblLayoutType.FIXED);
    }

    private static void width(XWPFTableCell cell, double inches) {
        CTTcPr tcPr = cell.getCTTc().isSetTcPr() ? cell.getCTTc().getTcPr() : cell.getCTTc().addNewTcPr();
        CTTblWidth width = tcPr.isSetTcW() ? tcPr.getTcW() : tcPr.addNewTcW();
        width.setType(STTblWidth.DXA);
        width.setW(BigInteger.valueOf(Math.round(inches * TWIPS_PER_INCH)));
    }
}

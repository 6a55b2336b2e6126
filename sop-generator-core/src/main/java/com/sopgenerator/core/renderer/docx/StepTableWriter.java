package com.sopgenerator.core.renderer.docx;

import com.sopgenerator.core.model.Paragraph;
import com.sopgenerator.core.model.Step;
import com.sopgenerator.core.model.StepKind;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTc;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTcPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTVMerge;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STMerge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Expands the step prototype row of the process description table.
 *
 * <p>The prototype is the row holding {@code {{step.*}}} tokens. The cell with
 * {@code {{step.ref}}} receives the styled reference, the cell with {@code {{step.description}}}
 * the narrative paragraphs indented by depth; every other token is substituted in place.
 * Decision and branch rows are shaded. An activity's SLA cell is merged vertically with the
 * routing rows that directly follow it.
 */
public class StepTableWriter {

    public static final String PREFIX = "step.";

    private static final Logger log = LoggerFactory.getLogger(StepTableWriter.class);

    private final DocumentStyle style;

    public StepTableWriter(DocumentStyle style) {
        this.style = style;
    }

    /**
     * Replaces the prototype row with one row per step.
     *
     * @param table process description table
     * @param prototypeIndex index of the prototype row
     * @param steps steps in order
     * @param fallback resolver for tokens that are not step tokens
     * @return names of tokens without a value
     */
    public Set<String> write(XWPFTable table, int prototypeIndex, List<Step> steps,
                             Function<String, String> fallback) {
        XWPFTableRow prototype = table.getRow(prototypeIndex);
        int refColumn = RowTemplates.columnOf(prototype, PREFIX + "ref");
        int descriptionColumn = RowTemplates.columnOf(prototype, PREFIX + "description");
        int slaColumn = RowTemplates.columnOf(prototype, PREFIX + "sla");
        SlaSpan[] spans = slaSpans(steps);

        Set<String> unknown = new LinkedHashSet<>();
        for (int i = 0; i < steps.size(); i++) {
            Step step = steps.get(i);
            SlaSpan span = spans[i];
            XWPFTableRow row = RowTemplates.copy(prototype, table);
            List<XWPFTableCell> cells = row.getTableCells();

            // tokens first: the narrative may itself contain token-like text
            PlaceholderReplacer replacer = new PlaceholderReplacer(name -> name.startsWith(PREFIX)
                ? value(step, span, name.substring(PREFIX.length()))
                : fallback.apply(name));
            replacer.replaceIn(row);
            unknown.addAll(replacer.unknownNames());

            if (refColumn >= 0) {
                writeReference(cells.get(refColumn), step.ref());
            }
            if (descriptionColumn >= 0) {
                writeNarrative(cells.get(descriptionColumn), step);
            }

            if (step.kind().isRouting()) {
                for (int c = 0; c < cells.size(); c++) {
                    if (c != slaColumn) {
                        style.routingShade(cells.get(c));
                    }
                }
            }
            if (slaColumn >= 0 && span != SlaSpan.NONE) {
                applySla(cells.get(slaColumn), span);
            }

            table.addRow(row, prototypeIndex + 1 + i);
        }
        table.removeRow(prototypeIndex);
        log.debug("Wrote {} step rows", steps.size());
        return unknown;
    }

    private void writeReference(XWPFTableCell cell, String ref) {
        XWPFParagraph paragraph = RowTemplates.clear(cell);
        paragraph.setAlignment(ParagraphAlignment.CENTER);
        if (!ref.isEmpty()) {
            XWPFRun run = paragraph.createRun();
            run.setText(ref);
            style.reference(run);
        }
    }

    private void writeNarrative(XWPFTableCell cell, Step step) {
        XWPFParagraph first = RowTemplates.clear(cell);
        List<Paragraph> paragraphs = step.paragraphs();
        for (int i = 0; i < paragraphs.size(); i++) {
            XWPFParagraph target = i == 0 ? first : cell.addParagraph();
            style.narrative(target, paragraphs.get(i), step.depth());
        }
    }

    private void applySla(XWPFTableCell cell, SlaSpan span) {
        style.slaShade(cell);
        if (span == SlaSpan.SINGLE) {
            return;
        }
        CTTc tc = cell.getCTTc();
        CTTcPr tcPr = tc.isSetTcPr() ? tc.getTcPr() : tc.addNewTcPr();
        CTVMerge merge = tcPr.isSetVMerge() ? tcPr.getVMerge() : tcPr.addNewVMerge();
        merge.setVal(span == SlaSpan.FIRST ? STMerge.RESTART : STMerge.CONTINUE);
    }

    private String value(Step step, SlaSpan span, String field) {
        return switch (field) {
            case "ref" -> step.ref();
            case "description" -> step.text();
            case "title" -> step.title();
            case "lane" -> step.laneName() == null ? "" : step.laneName();
            case "responsible" -> step.raci().responsible();
            case "accountable" -> step.raci().accountable();
            case "consulted" -> step.raci().consulted();
            case "informed" -> step.raci().informed();
            case "sla" -> span == SlaSpan.SINGLE || span == SlaSpan.FIRST ? step.sla() : "";
            case "kind" -> step.kind().name();
            default -> null;
        };
    }

    /**
     * Decides, per step, how its SLA cell takes part in a vertical merge.
     *
     * @param steps steps in order
     * @return one span marker per step
     */
    static SlaSpan[] slaSpans(List<Step> steps) {
        SlaSpan[] spans = new SlaSpan[steps.size()];
        Arrays.fill(spans, SlaSpan.NONE);
        int i = 0;
        while (i < steps.size()) {
            Step step = steps.get(i);
            boolean owner = (step.kind() == StepKind.ACTIVITY || step.kind() == StepKind.SUB_PROCESS)
                && step.sla() != null && !step.sla().isBlank();
            if (!owner) {
                i++;
                continue;
            }
            int end = i + 1;
            while (end < steps.size() && steps.get(end).kind().isRouting()) {
                end++;
            }
            if (end - i == 1) {
                spans[i] = SlaSpan.SINGLE;
            } else {
                spans[i] = SlaSpan.FIRST;
                for (int j = i + 1; j < end; j++) {
                    spans[j] = SlaSpan.CONTINUED;
                }
            }
            i = end;
        }
        return spans;
    }

    enum SlaSpan {
        NONE,
        SINGLE,
        FIRST,
        CONTINUED
    }
}

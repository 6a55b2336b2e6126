package com.sopgenerator.core.renderer.docx;

import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRow;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Finds and copies prototype rows of repeating table regions.
 *
 * <p>POI copies the XML of a row when it is added to a table, so a copy must be completely
 * filled before {@link XWPFTable#addRow(XWPFTableRow, int)} is called.
 */
public final class RowTemplates {

    private RowTemplates() {
        // Utility class
    }

    /**
     * Lists the prototype rows of a table, top to bottom.
     *
     * <p>A row belongs to the first prefix, in the given order, that one of its tokens starts with.
     *
     * @param table table to search
     * @param prefixes token prefixes, e.g. {@code step.}
     * @return index and prefix of every prototype row
     */
    public static List<Prototype> findPrototypes(XWPFTable table, List<String> prefixes) {
        List<Prototype> prototypes = new ArrayList<>();
        List<XWPFTableRow> rows = table.getRows();
        for (int i = 0; i < rows.size(); i++) {
            String prefix = prefixOf(rows.get(i), prefixes);
            if (prefix != null) {
                prototypes.add(new Prototype(i, prefix));
            }
        }
        return prototypes;
    }

    /**
     * Finds the cell holding a token.
     *
     * @param row row to search
     * @param name full token name, e.g. {@code step.ref}
     * @return cell index, or -1
     */
    static int columnOf(XWPFTableRow row, String name) {
        List<XWPFTableCell> cells = row.getTableCells();
        for (int i = 0; i < cells.size(); i++) {
            Matcher matcher = PlaceholderReplacer.TOKEN.matcher(cells.get(i).getText());
            while (matcher.find()) {
                if (matcher.group(1).equals(name)) {
                    return i;
                }
            }
        }
        return -1;
    }

    static XWPFTableRow copy(XWPFTableRow prototype, XWPFTable table) {
        CTRow ctRow = (CTRow) prototype.getCtRow().copy();
        return new XWPFTableRow(ctRow, table);
    }

    /**
     * Drops every paragraph of a cell and returns a fresh empty one.
     *
     * @param cell cell to clear
     * @return the new first paragraph
     */
    static XWPFParagraph clear(XWPFTableCell cell) {
        int old = cell.getParagraphs().size();
        XWPFParagraph fresh = cell.addParagraph();
        for (int i = 0; i < old; i++) {
            cell.removeParagraph(0);
        }
        return fresh;
    }

    /**
     * A prototype row of a repeating region.
     *
     * @param rowIndex index of the row in its table
     * @param prefix token prefix of the region
     */
    public record Prototype(int rowIndex, String prefix) {
    }

    private static String prefixOf(XWPFTableRow row, List<String> prefixes) {
        for (String prefix : prefixes) {
            for (XWPFTableCell cell : row.getTableCells()) {
                if (hasToken(cell, prefix)) {
                    return prefix;
                }
            }
        }
        return null;
    }

    private static boolean hasToken(XWPFTableCell cell, String prefix) {
        Matcher matcher = PlaceholderReplacer.TOKEN.matcher(cell.getText());
        while (matcher.find()) {
            if (matcher.group(1).startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}

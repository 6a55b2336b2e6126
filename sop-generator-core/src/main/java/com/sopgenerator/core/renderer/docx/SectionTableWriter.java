package com.sopgenerator.core.renderer.docx;

import com.sopgenerator.core.model.Raci;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Expands the prototype row of an auxiliary section table (abbreviations, references,
 * policies).
 *
 * <p>Each entry is a map from field name to value. The formatting of the filled rows is the
 * formatting of the prototype. An empty list yields one row with "N/A" in every field; templates
 * that should drop the section instead wrap it in {@code {{#name}}...{{/name}}}.
 */
public class SectionTableWriter {

    /**
     * Replaces the prototype row with one row per entry.
     *
     * @param table section table
     * @param prototypeIndex index of the prototype row
     * @param prefix token prefix of the region, e.g. {@code abbreviation.}
     * @param entries entries in order
     * @param fallback resolver for tokens outside the region
     * @return names of tokens without a value
     */
    public Set<String> write(XWPFTable table, int prototypeIndex, String prefix,
                             List<Map<String, String>> entries, Function<String, String> fallback) {
        XWPFTableRow prototype = table.getRow(prototypeIndex);
        Set<String> unknown = new LinkedHashSet<>();

        if (entries.isEmpty()) {
            XWPFTableRow row = RowTemplates.copy(prototype, table);
            PlaceholderReplacer replacer = new PlaceholderReplacer(name -> name.startsWith(prefix)
                ? Raci.NOT_APPLICABLE
                : fallback.apply(name));
            replacer.replaceIn(row);
            unknown.addAll(replacer.unknownNames());
            table.addRow(row, prototypeIndex + 1);
        }

        for (int i = 0; i < entries.size(); i++) {
            Map<String, String> entry = entries.get(i);
            XWPFTableRow row = RowTemplates.copy(prototype, table);
            PlaceholderReplacer replacer = new PlaceholderReplacer(name -> name.startsWith(prefix)
                ? entry.get(name.substring(prefix.length()))
                : fallback.apply(name));
            replacer.replaceIn(row);
            unknown.addAll(replacer.unknownNames());
            table.addRow(row, prototypeIndex + 1 + i);
        }

        table.removeRow(prototypeIndex);
        return unknown;
    }
}

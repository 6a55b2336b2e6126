package com.sopgenerator.core.renderer.docx;

import org.apache.poi.xwpf.usermodel.IBody;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTR;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {{name}}} tokens inside Word paragraphs.
 *
 * <p>Works on the run structure: a token may be split across several runs, as Word often does
 * after editing. The replacement text is written into the run where the token starts and keeps
 * that run's formatting; the remaining parts of the token are cut from the following runs.
 * Newlines in a value become line breaks. Tokens the resolver does not know render empty and
 * are remembered in {@link #unknownNames()}. Deferred tokens are left in place for a later pass.
 */
public class PlaceholderReplacer {

    /** Matches {@code {{name}}}, {@code {{ name }}} and the section markers {@code {{#name}}}, {@code {{/name}}}. */
    public static final Pattern TOKEN = Pattern.compile("\\{\\{\\s*([#/]?[A-Za-z0-9_.]+)\\s*\\}\\}");

    private final Function<String, String> resolver;
    private final Predicate<String> deferred;
    private final Set<String> unknown = new LinkedHashSet<>();

    /**
     * @param resolver returns the value of a placeholder, or null when the name is unknown
     */
    public PlaceholderReplacer(Function<String, String> resolver) {
        this(resolver, name -> false);
    }

    /**
     * @param resolver returns the value of a placeholder, or null when the name is unknown
     * @param deferred names to leave untouched, e.g. the tokens of table prototype rows
     */
    public PlaceholderReplacer(Function<String, String> resolver, Predicate<String> deferred) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.deferred = Objects.requireNonNull(deferred, "deferred must not be null");
    }

    /**
     * Returns the names that had no value, in order of first appearance.
     *
     * @return unknown placeholder names
     */
    public Set<String> unknownNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(unknown));
    }

    /**
     * Replaces tokens in every paragraph and table of a body, nested tables included.
     *
     * @param body document body, header, footer or table cell
     */
    public void replaceIn(IBody body) {
        for (XWPFParagraph paragraph : new ArrayList<>(body.getParagraphs())) {
            replaceIn(paragraph);
        }
        for (XWPFTable table : new ArrayList<>(body.getTables())) {
            replaceIn(table);
        }
    }

    public void replaceIn(XWPFTable table) {
        for (XWPFTableRow row : table.getRows()) {
            replaceIn(row);
        }
    }

    public void replaceIn(XWPFTableRow row) {
        for (XWPFTableCell cell : row.getTableCells()) {
            replaceIn(cell);
        }
    }

    /**
     * Replaces every token of one paragraph.
     *
     * @param paragraph paragraph to rewrite
     */
    public void replaceIn(XWPFParagraph paragraph) {
        List<XWPFRun> runs = paragraph.getRuns();
        if (runs.isEmpty()) {
            return;
        }

        String[] texts = new String[runs.size()];
        int[] starts = new int[runs.size()];
        StringBuilder full = new StringBuilder();
        for (int i = 0; i < runs.size(); i++) {
            String text = runs.get(i).text();
            texts[i] = text == null ? "" : text;
            starts[i] = full.length();
            full.append(texts[i]);
        }
        if (full.indexOf("{{") < 0) {
            return;
        }

        List<Token> matches = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(full);
        while (matcher.find()) {
            if (!deferred.test(matcher.group(1))) {
                matches.add(new Token(matcher.start(), matcher.end(), matcher.group(1)));
            }
        }

        boolean[] touched = new boolean[runs.size()];
        // right to left, so earlier offsets stay valid
        for (int m = matches.size() - 1; m >= 0; m--) {
            Token match = matches.get(m);
            String value = resolve(match.name());
            int first = runAt(starts, texts, match.start());
            int last = runAt(starts, texts, match.end() - 1);

            String prefix = texts[first].substring(0, match.start() - starts[first]);
            if (first == last) {
                String suffix = texts[first].substring(match.end() - starts[first]);
                texts[first] = prefix + value + suffix;
            } else {
                String suffix = texts[last].substring(match.end() - starts[last]);
                texts[first] = prefix + value;
                for (int i = first + 1; i < last; i++) {
                    texts[i] = "";
                    touched[i] = true;
                }
                texts[last] = suffix;
                touched[last] = true;
            }
            touched[first] = true;
        }

        for (int i = 0; i < runs.size(); i++) {
            if (touched[i]) {
                setText(runs.get(i), texts[i]);
            }
        }
    }

    /**
     * Replaces the whole text of a run, turning newlines into line breaks.
     *
     * @param run run to rewrite
     * @param text new text
     */
    public static void setText(XWPFRun run, String text) {
        CTR ctr = run.getCTR();
        while (ctr.sizeOfTArray() > 0) {
            ctr.removeT(0);
        }
        while (ctr.sizeOfBrArray() > 0) {
            ctr.removeBr(0);
        }
        while (ctr.sizeOfCrArray() > 0) {
            ctr.removeCr(0);
        }
        while (ctr.sizeOfTabArray() > 0) {
            ctr.removeTab(0);
        }
        String[] lines = text.split("\n", -1);
        run.setText(lines[0]);
        for (int i = 1; i < lines.length; i++) {
            run.addBreak();
            run.setText(lines[i]);
        }
    }

    private String resolve(String name) {
        String value = resolver.apply(name);
        if (value == null) {
            unknown.add(name);
            return "";
        }
        return value;
    }

    private static int runAt(int[] starts, String[] texts, int offset) {
        for (int i = starts.length - 1; i >= 0; i--) {
            if (starts[i] <= offset && !texts[i].isEmpty()) {
                return i;
            }
        }
        return 0;
    }

    private record Token(int start, int end, String name) {
    }
}

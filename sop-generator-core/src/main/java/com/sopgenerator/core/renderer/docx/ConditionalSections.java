package com.sopgenerator.core.renderer.docx;

import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Removes optional template sections.
 *
 * <p>A section is every body element between a paragraph holding only {@code {{#name}}} and a
 * paragraph holding only {@code {{/name}}}. The section is dropped when {@code name} has no
 * content; the marker paragraphs are always dropped.
 */
public class ConditionalSections {

    private static final Logger log = LoggerFactory.getLogger(ConditionalSections.class);
    private static final Pattern MARKER = Pattern.compile("^\\{\\{\\s*([#/])([A-Za-z0-9_.]+)\\s*\\}\\}$");

    private final Predicate<String> hasContent;
    private final List<String> unmatched = new ArrayList<>();

    /**
     * @param hasContent tells whether the named list or field has content
     */
    public ConditionalSections(Predicate<String> hasContent) {
        this.hasContent = hasContent;
    }

    /**
     * Returns the names of markers without a counterpart.
     *
     * @return unmatched marker names
     */
    public List<String> unmatchedMarkers() {
        return List.copyOf(unmatched);
    }

    /**
     * Applies every section of the document body.
     *
     * @param document document to edit in place
     */
    public void apply(XWPFDocument document) {
        int open;
        while ((open = findMarker(document, 0, '#', null)) >= 0) {
            String name = markerName(document.getBodyElements().get(open));
            int close = findMarker(document, open + 1, '/', name);
            if (close < 0) {
                log.warn("Section '{}' is never closed, removing its marker only", name);
                unmatched.add(name);
                document.removeBodyElement(open);
                continue;
            }
            boolean keep = hasContent.test(name);
            log.debug("Section '{}' {}", name, keep ? "kept" : "removed");
            if (keep) {
                document.removeBodyElement(close);
                document.removeBodyElement(open);
            } else {
                for (int i = close; i >= open; i--) {
                    document.removeBodyElement(i);
                }
            }
        }

        // stray closing markers
        int close;
        while ((close = findMarker(document, 0, '/', null)) >= 0) {
            String name = markerName(document.getBodyElements().get(close));
            log.warn("Section end '{}' has no start, removing it", name);
            unmatched.add(name);
            document.removeBodyElement(close);
        }
    }

    private int findMarker(XWPFDocument document, int from, char type, String name) {
        List<IBodyElement> elements = document.getBodyElements();
        for (int i = from; i < elements.size(); i++) {
            Matcher matcher = marker(elements.get(i));
            if (matcher != null && matcher.group(1).charAt(0) == type
                && (name == null || name.equals(matcher.group(2)))) {
                return i;
            }
        }
        return -1;
    }

    private String markerName(IBodyElement element) {
        Matcher matcher = marker(element);
        return matcher == null ? "" : matcher.group(2);
    }

    private Matcher marker(IBodyElement element) {
        if (!(element instanceof XWPFParagraph paragraph)) {
            return null;
        }
        Matcher matcher = MARKER.matcher(paragraph.getText().strip());
        return matcher.matches() ? matcher : null;
    }
}

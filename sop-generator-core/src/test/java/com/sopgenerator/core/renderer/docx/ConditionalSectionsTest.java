package com.sopgenerator.core.renderer.docx;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConditionalSections}.
 */
class ConditionalSectionsTest {

    private static XWPFDocument document(String... paragraphs) {
        XWPFDocument document = new XWPFDocument();
        for (String text : paragraphs) {
            document.createParagraph().createRun().setText(text);
        }
        return document;
    }

    private static String[] texts(XWPFDocument document) {
        return document.getParagraphs().stream().map(XWPFParagraph::getText).toArray(String[]::new);
    }

    @Test
    void apply_sectionWithContent_keepsBodyAndDropsMarkers() throws IOException {
        try (XWPFDocument document = document("Intro", "{{#policies}}", "General Policies", "{{/policies}}", "End")) {
            new ConditionalSections(Set.of("policies")::contains).apply(document);

            assertThat(texts(document)).containsExactly("Intro", "General Policies", "End");
        }
    }

    @Test
    void apply_emptySection_removesEverythingBetweenMarkers() throws IOException {
        try (XWPFDocument document = document("Intro", "{{#policies}}", "General Policies", "{{/policies}}", "End")) {
            new ConditionalSections(name -> false).apply(document);

            assertThat(texts(document)).containsExactly("Intro", "End");
        }
    }

    @Test
    void apply_sectionCoversTables() throws IOException {
        try (XWPFDocument document = document("{{#references}}")) {
            document.createTable(2, 2);
            document.createParagraph().createRun().setText("{{/references}}");

            new ConditionalSections(name -> false).apply(document);

            assertThat(document.getTables()).isEmpty();
            assertThat(document.getBodyElements()).isEmpty();
        }
    }

    @Test
    void apply_unmatchedMarkers_areRemovedAndReported() throws IOException {
        try (XWPFDocument document = document("{{#scope}}", "Scope text", "{{/purpose}}")) {
            ConditionalSections sections = new ConditionalSections(name -> true);

            sections.apply(document);

            assertThat(texts(document)).containsExactly("Scope text");
            assertThat(sections.unmatchedMarkers()).containsExactly("scope", "purpose");
        }
    }
}

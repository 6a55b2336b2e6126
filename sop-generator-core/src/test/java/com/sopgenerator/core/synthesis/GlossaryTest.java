package com.sopgenerator.core.synthesis;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link Glossary}.
 */
class GlossaryTest {

    private final Glossary glossary = Glossary.load();

    @Test
    void load_bundledResource_containsStandardTerms() {
        assertThat(glossary.alwaysIncluded())
            .extracting(GlossaryEntry::term)
            .containsExactly("SOP", "SLA", "RACI", "N/A");
    }

    @Test
    void lookup_ignoresCase() {
        assertThat(glossary.lookup("kpi"))
            .map(GlossaryEntry::definition)
            .contains("Key Performance Indicator");
        assertThat(glossary.lookup("XYZ")).isEmpty();
    }
}

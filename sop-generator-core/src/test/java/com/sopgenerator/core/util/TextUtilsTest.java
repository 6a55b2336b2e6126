package com.sopgenerator.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TextUtils}.
 */
class TextUtilsTest {

    @Test
    void collapseWhitespace_withLineBreaks_joinsWords() {
        assertThat(TextUtils.collapseWhitespace("  Approve\n  the\tRequest ")).isEqualTo("Approve the Request");
        assertThat(TextUtils.collapseWhitespace(null)).isEmpty();
    }

    @Test
    void stripCombiningMarks_withDecomposedAccents_removesMarks() {
        assertThat(TextUtils.stripCombiningMarks("Cafe\u0301  Staff")).isEqualTo("Cafe Staff");
    }

    @Test
    void declaredStepNumber_withNumberPrefix_returnsNumber() {
        assertThat(TextUtils.declaredStepNumber("3. Approve request")).contains(3);
        assertThat(TextUtils.declaredStepNumber("Approve request")).isEmpty();
        assertThat(TextUtils.declaredStepNumber(null)).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
        "'12 - Review Invoice', 'Review Invoice'",
        "'Review Invoice', 'Review Invoice'"
    })
    void stripStepNumber_withNumberPrefix_removesPrefix(String label, String expected) {
        assertThat(TextUtils.stripStepNumber(label)).isEqualTo(expected);
    }

    @Test
    void ensurePeriod_addsPeriodOnlyWhenMissing() {
        assertThat(TextUtils.ensurePeriod("Submit the form")).isEqualTo("Submit the form.");
        assertThat(TextUtils.ensurePeriod("Approved?")).isEqualTo("Approved?");
        assertThat(TextUtils.ensurePeriod("  ")).isEmpty();
    }

    @Test
    void decapitalize_keepsLeadingAcronym() {
        assertThat(TextUtils.decapitalize("Submit form")).isEqualTo("submit form");
        assertThat(TextUtils.decapitalize("ERP entry")).isEqualTo("ERP entry");
    }

    @Test
    void toSentenceCase_keepsAcronyms() {
        assertThat(TextUtils.toSentenceCase("Update SAP Vendor Record")).isEqualTo("update SAP vendor record");
    }

    @Test
    void letter_returnsSpreadsheetStyleCodes() {
        assertThat(TextUtils.letter(0)).isEqualTo("A");
        assertThat(TextUtils.letter(25)).isEqualTo("Z");
        assertThat(TextUtils.letter(26)).isEqualTo("AA");
        assertThat(TextUtils.letter(27)).isEqualTo("AB");
        assertThatThrownBy(() -> TextUtils.letter(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}

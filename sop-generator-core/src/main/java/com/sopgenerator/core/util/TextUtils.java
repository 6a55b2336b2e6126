package com.sopgenerator.core.util;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility class for the text clean-up applied to diagram labels and narrative sentences.
 */
public final class TextUtils {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{Mn}+");
    private static final Pattern STEP_NUMBER_PREFIX = Pattern.compile("^\\s*(\\d+)\\s*[.:\\-]?\\s*");

    private TextUtils() {
        // Utility class
    }

    /**
     * Trims a string and collapses inner whitespace (including line breaks) to single spaces.
     *
     * @param text text to clean, may be null
     * @return cleaned text, empty for null input
     */
    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text.strip()).replaceAll(" ");
    }

    /**
     * Removes non-spacing combining marks (diacritics such as Arabic harakat) from a name.
     *
     * @param text text to clean, may be null
     * @return text without combining marks, whitespace collapsed
     */
    public static String stripCombiningMarks(String text) {
        if (text == null) {
            return "";
        }
        return collapseWhitespace(COMBINING_MARKS.matcher(text).replaceAll(""));
    }

    /**
     * Returns the step number a label starts with, as in {@code "3. Approve request"}.
     *
     * @param label element label
     * @return the declared number, if present
     */
    public static Optional<Integer> declaredStepNumber(String label) {
        if (label == null) {
            return Optional.empty();
        }
        Matcher matcher = STEP_NUMBER_PREFIX.matcher(label);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(Integer.parseInt(matcher.group(1)));
    }

    /**
     * Removes a leading step number from a label.
     *
     * @param label element label
     * @return label without the number prefix, whitespace collapsed
     */
    public static String stripStepNumber(String label) {
        if (label == null) {
            return "";
        }
        return collapseWhitespace(STEP_NUMBER_PREFIX.matcher(label).replaceFirst(""));
    }

    /**
     * Appends a period unless the sentence already ends with terminal punctuation.
     *
     * @param sentence sentence text
     * @return sentence ending with punctuation, empty for blank input
     */
    public static String ensurePeriod(String sentence) {
        String trimmed = sentence == null ? "" : sentence.strip();
        if (trimmed.isEmpty()) {
            return "";
        }
        char last = trimmed.charAt(trimmed.length() - 1);
        return last == '.' || last == '!' || last == '?' || last == ':' ? trimmed : trimmed + ".";
    }

    /**
     * Lower-cases the first letter so a label reads as the continuation of a sentence.
     *
     * <p>Words that are fully upper case (acronyms) are left alone.
     *
     * @param text label text
     * @return text with a lower-case first letter
     */
    public static String decapitalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        int firstWordEnd = text.indexOf(' ');
        String firstWord = firstWordEnd < 0 ? text : text.substring(0, firstWordEnd);
        if (firstWord.length() > 1 && firstWord.equals(firstWord.toUpperCase())) {
            return text;
        }
        return Character.toLowerCase(text.charAt(0)) + text.substring(1);
    }

    /**
     * Lower-cases every word of a label except acronyms, so "Submit Purchase Request" reads
     * "submit purchase request" inside a sentence while "Update SAP" keeps "SAP".
     *
     * @param text label text
     * @return sentence-case text
     */
    public static String toSentenceCase(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String[] words = text.split(" ");
        StringBuilder sb = new StringBuilder();
        for (String word : words) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            boolean acronym = word.length() > 1 && word.equals(word.toUpperCase()) && !word.equals(word.toLowerCase());
            sb.append(acronym ? word : word.toLowerCase());
        }
        return sb.toString();
    }

    /**
     * Returns the spreadsheet-style letter for a zero based index: A, B, ..., Z, AA, AB.
     *
     * @param index zero based index
     * @return letter code
     */
    public static String letter(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative: " + index);
        }
        StringBuilder sb = new StringBuilder();
        int value = index;
        do {
            sb.insert(0, (char) ('A' + value % 26));
            value = value / 26 - 1;
        } while (value >= 0);
        return sb.toString();
    }

    /**
     * Returns true if the text is null or blank.
     *
     * @param text text to test
     * @return true if there is no visible content
     */
    public static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }
}

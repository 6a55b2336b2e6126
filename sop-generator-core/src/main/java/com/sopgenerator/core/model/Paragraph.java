package com.sopgenerator.core.model;

import java.util.Objects;

/**
 * Paragraph of a step narrative.
 *
 * @param text paragraph text
 * @param role formatting role
 */
public record Paragraph(String text, ParagraphRole role) {

    public Paragraph {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(role, "role must not be null");
    }

    public static Paragraph title(String text) {
        return new Paragraph(text, ParagraphRole.TITLE);
    }

    public static Paragraph body(String text) {
        return new Paragraph(text, ParagraphRole.BODY);
    }

    public static Paragraph routing(String text) {
        return new Paragraph(text, ParagraphRole.ROUTING);
    }
}

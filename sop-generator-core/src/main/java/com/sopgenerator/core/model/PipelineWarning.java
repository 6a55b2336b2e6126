package com.sopgenerator.core.model;

import java.util.Objects;

/**
 * Non-fatal issue found while generating a document.
 *
 * @param type warning type
 * @param elementId diagram element concerned, or null
 * @param message human readable description
 */
public record PipelineWarning(
    WarningType type,
    String elementId,
    String message
) {
    public PipelineWarning {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    /**
     * Formats the warning for console output.
     *
     * @return one-line description
     */
    public String describe() {
        return elementId == null
            ? type + ": " + message
            : type + " [" + elementId + "]: " + message;
    }
}

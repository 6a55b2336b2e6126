package com.sopgenerator.core.exception;

import java.util.Objects;

/**
 * Base class of all fatal pipeline failures.
 *
 * <p>A failure aborts the current request only. It names the stage that failed and, where
 * one is known, the diagram element involved so callers can explain the problem to an author.
 */
public abstract class SopGenerationException extends RuntimeException {

    private final PipelineStage stage;
    private final String elementId;

    protected SopGenerationException(PipelineStage stage, String elementId, String message, Throwable cause) {
        super(message, cause);
        this.stage = Objects.requireNonNull(stage, "stage must not be null");
        this.elementId = elementId;
    }

    public PipelineStage getStage() {
        return stage;
    }

    /**
     * Returns the id of the element involved.
     *
     * @return element id, or null when the failure is not tied to one element
     */
    public String getElementId() {
        return elementId;
    }
}

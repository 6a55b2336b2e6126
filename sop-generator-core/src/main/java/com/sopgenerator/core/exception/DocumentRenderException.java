package com.sopgenerator.core.exception;

/**
 * Failure to assemble or serialize the output document.
 */
public class DocumentRenderException extends SopGenerationException {

    public DocumentRenderException(String message, Throwable cause) {
        super(PipelineStage.RENDER, null, message, cause);
    }
}

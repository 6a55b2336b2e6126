package com.sopgenerator.core.exception;

/**
 * Readable diagram that lacks required structure, such as a start event or a flow target.
 */
public class DiagramStructureException extends SopGenerationException {

    public DiagramStructureException(PipelineStage stage, String elementId, String message) {
        super(stage, elementId, message, null);
    }
}

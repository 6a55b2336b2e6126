package com.sopgenerator.core.exception;

/**
 * Diagram markup that cannot be read at all (not XML, not BPMN, no flow elements).
 */
public class MalformedDiagramException extends SopGenerationException {

    public MalformedDiagramException(String message) {
        super(PipelineStage.PARSE, null, message, null);
    }

    public MalformedDiagramException(String message, Throwable cause) {
        super(PipelineStage.PARSE, null, message, cause);
    }
}

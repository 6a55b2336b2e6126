package com.sopgenerator.core.exception;

/**
 * Pipeline stage in which a failure occurred.
 */
public enum PipelineStage {
    PARSE,
    LINEARIZE,
    SYNTHESIZE,
    RENDER
}

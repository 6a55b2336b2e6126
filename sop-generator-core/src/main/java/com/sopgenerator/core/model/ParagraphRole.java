package com.sopgenerator.core.model;

/**
 * Role of a paragraph inside a step, which drives its formatting.
 */
public enum ParagraphRole {
    /** Bold heading line of the step. */
    TITLE,
    /** Narrative text. */
    BODY,
    /** Where the procedure continues ("Proceed to Step 4"). */
    ROUTING
}

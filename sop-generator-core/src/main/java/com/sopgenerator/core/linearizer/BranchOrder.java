package com.sopgenerator.core.linearizer;

/**
 * Order in which the outgoing flows of a split are emitted.
 */
public enum BranchOrder {
    /** Order of appearance in the diagram markup. */
    DOCUMENT,
    /** Condition label, lexically; unlabeled flows last in document order. */
    LABEL
}

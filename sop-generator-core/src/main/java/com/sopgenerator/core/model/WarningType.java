package com.sopgenerator.core.model;

/**
 * Recoverable conditions reported alongside pipeline results.
 */
public enum WarningType {
    /** Element has no path from any start event. */
    UNREACHABLE_ELEMENT,
    /** Element kind is not recognized and was passed through. */
    UNSUPPORTED_ELEMENT,
    /** Branch without a condition label, numbered positionally. */
    UNLABELED_CONDITION,
    /** Template placeholder without a value, rendered empty. */
    UNKNOWN_PLACEHOLDER,
    /** Template lacks a region the document content needs. */
    TEMPLATE_MISMATCH
}

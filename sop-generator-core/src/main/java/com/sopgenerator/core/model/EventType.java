package com.sopgenerator.core.model;

/**
 * Trigger of an event, taken from its event definition child element.
 */
public enum EventType {
    NONE,
    TIMER,
    MESSAGE,
    SIGNAL,
    ERROR,
    CONDITIONAL,
    ESCALATION
}

package com.sopgenerator.core.model;

/**
 * Closed set of diagram element kinds understood by the generator.
 *
 * <p>Every flow node of a diagram is resolved to exactly one of these kinds. Nodes the
 * generator does not understand are tagged {@link #UNSUPPORTED} instead of being dropped.
 */
public enum ElementKind {
    /** Any BPMN task variant (user, service, manual, script, send, receive, business rule). */
    TASK,
    START_EVENT,
    END_EVENT,
    /** Intermediate catch or throw event on the sequence flow. */
    INTERMEDIATE_EVENT,
    /** Event attached to the boundary of an activity. */
    BOUNDARY_EVENT,
    /** Collapsed sub-process or call activity; its internals are not expanded. */
    SUB_PROCESS,
    EXCLUSIVE_GATEWAY,
    PARALLEL_GATEWAY,
    INCLUSIVE_GATEWAY,
    UNSUPPORTED;

    /**
     * Returns true for the three gateway kinds.
     *
     * @return true if this kind is a gateway
     */
    public boolean isGateway() {
        return this == EXCLUSIVE_GATEWAY || this == PARALLEL_GATEWAY || this == INCLUSIVE_GATEWAY;
    }

    /**
     * Returns true for kinds that describe work performed by a lane.
     *
     * @return true for tasks and sub-processes
     */
    public boolean isActivity() {
        return this == TASK || this == SUB_PROCESS;
    }
}

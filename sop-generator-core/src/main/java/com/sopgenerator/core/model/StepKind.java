package com.sopgenerator.core.model;

/**
 * Kind of a linearized procedure step.
 */
public enum StepKind {
    /** Process input triggered by a start event. */
    START,
    /** Numbered task performed by a lane. */
    ACTIVITY,
    /** Collapsed sub-process or call activity. */
    SUB_PROCESS,
    /** Intermediate event the process waits for. */
    WAIT,
    /** Exclusive or inclusive decision point; followed by its branches. */
    DECISION,
    /** Parallel split; followed by its branches. */
    PARALLEL,
    /** Header of one branch of a decision, parallel split or boundary event. */
    BRANCH,
    /** Back-edge to a step already on the current path. */
    LOOP,
    /** Continuation at a step already emitted elsewhere. */
    JUMP,
    END,
    /** Element of a kind the generator does not understand. */
    UNSUPPORTED;

    /**
     * Returns true for rows that describe control flow rather than work.
     *
     * @return true for decision, parallel and branch rows
     */
    public boolean isRouting() {
        return this == DECISION || this == PARALLEL || this == BRANCH;
    }
}

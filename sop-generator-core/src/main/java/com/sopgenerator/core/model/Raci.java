package com.sopgenerator.core.model;

/**
 * Responsible / Accountable / Consulted / Informed assignment of a lane.
 *
 * @param responsible responsible party
 * @param accountable accountable party
 * @param consulted consulted parties
 * @param informed informed parties
 */
public record Raci(
    String responsible,
    String accountable,
    String consulted,
    String informed
) {
    public static final String NOT_APPLICABLE = "N/A";

    /**
     * Compact constructor, blank values become {@value #NOT_APPLICABLE}.
     */
    public Raci {
        responsible = orNotApplicable(responsible);
        accountable = orNotApplicable(accountable);
        consulted = orNotApplicable(consulted);
        informed = orNotApplicable(informed);
    }

    /**
     * Returns an assignment with every role set to {@value #NOT_APPLICABLE}.
     *
     * @return empty assignment
     */
    public static Raci notApplicable() {
        return new Raci(null, null, null, null);
    }

    private static String orNotApplicable(String value) {
        return value == null || value.isBlank() ? NOT_APPLICABLE : value.strip();
    }
}

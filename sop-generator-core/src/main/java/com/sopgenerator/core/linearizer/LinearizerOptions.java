package com.sopgenerator.core.linearizer;

/**
 * Settings of the {@link StepLinearizer}.
 *
 * @param branchOrder order of branches at a split
 * @param unassignedLane actor named in narratives of elements outside any lane
 */
public record LinearizerOptions(
    BranchOrder branchOrder,
    String unassignedLane
) {
    public static final String DEFAULT_UNASSIGNED_LANE = "[LANE UNREADABLE]";

    public LinearizerOptions {
        if (branchOrder == null) {
            branchOrder = BranchOrder.DOCUMENT;
        }
        if (unassignedLane == null || unassignedLane.isBlank()) {
            unassignedLane = DEFAULT_UNASSIGNED_LANE;
        }
    }

    /**
     * Returns document branch order and the default unassigned lane text.
     *
     * @return default options
     */
    public static LinearizerOptions defaults() {
        return new LinearizerOptions(BranchOrder.DOCUMENT, DEFAULT_UNASSIGNED_LANE);
    }
}

package com.sopgenerator.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Organizational grouping of diagram elements (role or department).
 *
 * @param id lane identifier
 * @param name lane name with combining marks removed (empty when unnamed)
 * @param memberIds ids of the flow nodes referenced by the lane, in markup order
 * @param raci RACI assignment documented on the lane
 */
public record Lane(
    String id,
    String name,
    List<String> memberIds,
    Raci raci
) {
    /**
     * Compact constructor with validation.
     */
    public Lane {
        Objects.requireNonNull(id, "id must not be null");
        if (name == null) {
            name = "";
        }
        memberIds = memberIds == null ? List.of() : List.copyOf(memberIds);
        if (raci == null) {
            raci = Raci.notApplicable();
        }
    }
}

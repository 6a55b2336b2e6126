package com.sopgenerator.core.model;

import java.util.List;

/**
 * Document metadata declared inside the diagram itself.
 *
 * <p>Read from the collaboration participant, the process documentation
 * ({@code application/x-scope}, {@code application/x-policy}) and Zeebe extension elements.
 * Every value is optional.
 *
 * @param participantName name of the pool, the preferred process name
 * @param purpose participant documentation
 * @param processName name attribute of the process element
 * @param scope scope documentation of the process
 * @param processCode version tag of the process
 * @param abbreviations terms declared as extension properties
 * @param policies policy documentation entries, numbered from 1
 */
public record DiagramMetadata(
    String participantName,
    String purpose,
    String processName,
    String scope,
    String processCode,
    List<Abbreviation> abbreviations,
    List<Policy> policies
) {
    /**
     * Compact constructor, null lists become empty.
     */
    public DiagramMetadata {
        abbreviations = abbreviations == null ? List.of() : List.copyOf(abbreviations);
        policies = policies == null ? List.of() : List.copyOf(policies);
    }

    /**
     * Returns metadata with nothing declared.
     *
     * @return empty metadata
     */
    public static DiagramMetadata empty() {
        return new DiagramMetadata(null, null, null, null, null, List.of(), List.of());
    }
}

package com.sopgenerator.core.model;

import java.util.Objects;

/**
 * Entry of the referenced documents and approvals section.
 *
 * @param reference document number or code ("N/A" when none)
 * @param title document title
 */
public record ReferencedDocument(String reference, String title) {

    public ReferencedDocument {
        Objects.requireNonNull(title, "title must not be null");
        if (reference == null || reference.isBlank()) {
            reference = Raci.NOT_APPLICABLE;
        }
    }
}

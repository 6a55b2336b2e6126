package com.sopgenerator.core.model;

import java.util.Objects;

/**
 * Entry of the general policies section.
 *
 * @param reference policy number
 * @param text policy statement
 */
public record Policy(String reference, String text) {

    public Policy {
        Objects.requireNonNull(text, "text must not be null");
        if (reference == null) {
            reference = "";
        }
    }
}

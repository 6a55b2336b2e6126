package com.sopgenerator.core.model;

import java.util.Objects;

/**
 * Entry of the abbreviations and definitions section.
 *
 * @param term abbreviation or term
 * @param definition its meaning
 */
public record Abbreviation(String term, String definition) {

    public Abbreviation {
        Objects.requireNonNull(term, "term must not be null");
        if (definition == null) {
            definition = "";
        }
    }
}

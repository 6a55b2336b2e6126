package com.sopgenerator.core.synthesis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Known term of the glossary.
 *
 * @param term abbreviation
 * @param definition its meaning
 * @param always whether the term is listed in every document
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GlossaryEntry(
    @JsonProperty("term") String term,
    @JsonProperty("definition") String definition,
    @JsonProperty("always") boolean always
) {
    public GlossaryEntry {
        Objects.requireNonNull(term, "term must not be null");
        if (definition == null) {
            definition = "";
        }
    }
}

package com.sopgenerator.core.synthesis;

import com.sopgenerator.core.model.Abbreviation;
import com.sopgenerator.core.model.Policy;
import com.sopgenerator.core.model.ReferencedDocument;

import java.util.List;

/**
 * Auxiliary sections derived from a diagram.
 *
 * @param abbreviations abbreviations sorted by term
 * @param references referenced documents
 * @param policies general policies
 */
public record SynthesizedSections(
    List<Abbreviation> abbreviations,
    List<ReferencedDocument> references,
    List<Policy> policies
) {
    public SynthesizedSections {
        abbreviations = abbreviations == null ? List.of() : List.copyOf(abbreviations);
        references = references == null ? List.of() : List.copyOf(references);
        policies = policies == null ? List.of() : List.copyOf(policies);
    }
}

package com.sopgenerator.core.synthesis;

import com.sopgenerator.core.model.Abbreviation;
import com.sopgenerator.core.model.Policy;
import com.sopgenerator.core.model.ReferencedDocument;

import java.util.List;

/**
 * Author-supplied section content.
 *
 * <p>A {@code null} list means "synthesize from the diagram". Abbreviations merge with the
 * synthesized ones by term; references and policies replace the synthesized lists.
 *
 * @param abbreviations user abbreviations, or null
 * @param references user referenced documents, or null
 * @param policies user policies, or null
 */
public record SectionOverrides(
    List<Abbreviation> abbreviations,
    List<ReferencedDocument> references,
    List<Policy> policies
) {
    public SectionOverrides {
        abbreviations = abbreviations == null ? null : List.copyOf(abbreviations);
        references = references == null ? null : List.copyOf(references);
        policies = policies == null ? null : List.copyOf(policies);
    }

    public static SectionOverrides none() {
        return new SectionOverrides(null, null, null);
    }
}

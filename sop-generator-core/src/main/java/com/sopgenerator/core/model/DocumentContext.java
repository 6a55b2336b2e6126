package com.sopgenerator.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the renderer needs to produce one document.
 *
 * @param fields scalar metadata values keyed by placeholder name
 * @param steps linearized procedure
 * @param abbreviations abbreviations and definitions
 * @param references referenced documents and approvals
 * @param policies general policies
 * @param warnings warnings collected by earlier stages
 */
public record DocumentContext(
    Map<String, String> fields,
    List<Step> steps,
    List<Abbreviation> abbreviations,
    List<ReferencedDocument> references,
    List<Policy> policies,
    List<PipelineWarning> warnings
) {
    /**
     * Compact constructor, copies every collection and keeps field order.
     */
    public DocumentContext {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        steps = steps == null ? List.of() : List.copyOf(steps);
        abbreviations = abbreviations == null ? List.of() : List.copyOf(abbreviations);
        references = references == null ? List.of() : List.copyOf(references);
        policies = policies == null ? List.of() : List.copyOf(policies);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Returns a scalar field value.
     *
     * @param field metadata field
     * @return value, or empty string when unset
     */
    public String field(MetadataField field) {
        return fields.getOrDefault(field.key(), "");
    }
}

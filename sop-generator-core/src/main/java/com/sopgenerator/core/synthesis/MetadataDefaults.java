package com.sopgenerator.core.synthesis;

import com.sopgenerator.core.model.MetadataField;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default values of the editable document fields, in {@link MetadataField} order.
 *
 * @param fields field key to default value
 */
public record MetadataDefaults(Map<String, String> fields) {

    public MetadataDefaults {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String value(MetadataField field) {
        return fields.getOrDefault(field.key(), "");
    }

    /**
     * Applies author edits on top of the defaults.
     *
     * <p>Non-blank user values win. Blank or missing values keep the default. Keys that are
     * not document fields are kept after the known ones.
     *
     * @param userFields values entered by the author, may be null
     * @return merged fields in field order
     */
    public Map<String, String> merge(Map<String, String> userFields) {
        Map<String, String> merged = new LinkedHashMap<>(fields);
        if (userFields == null) {
            return merged;
        }
        userFields.forEach((key, value) -> {
            if (key != null && value != null && !value.isBlank()) {
                merged.put(key, value.strip());
            }
        });
        return merged;
    }
}

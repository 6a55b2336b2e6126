package com.sopgenerator.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Scalar document fields an author can edit before the document is rendered.
 *
 * <p>The key of each field is also the name of its template placeholder.
 */
public enum MetadataField {
    PROCESS_NAME("process_name"),
    PROCESS_CODE("process_code"),
    ISSUED_BY("issued_by"),
    RELEASE_DATE("release_date"),
    PROCESS_OWNER("process_owner"),
    PURPOSE("purpose"),
    SCOPE("scope"),
    INPUTS("inputs"),
    OUTPUTS("outputs");

    private final String key;

    MetadataField(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * Resolves a field by its key.
     *
     * @param key placeholder key, e.g. {@code process_name}
     * @return matching field, if any
     */
    public static Optional<MetadataField> fromKey(String key) {
        return Arrays.stream(values())
            .filter(field -> field.key.equals(key))
            .findFirst();
    }
}

package com.sopgenerator.core.session;

import com.sopgenerator.core.model.ProcessGraph;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Work in progress of one author: the uploaded diagram and the fields edited so far.
 *
 * @param id session id
 * @param markup uploaded diagram markup
 * @param graph parsed graph
 * @param userFields field values entered by the author
 * @param lastTouched time of the last access
 */
public record SessionEntry(
    String id,
    String markup,
    ProcessGraph graph,
    Map<String, String> userFields,
    Instant lastTouched
) {
    public SessionEntry {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(markup, "markup must not be null");
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(lastTouched, "lastTouched must not be null");
        userFields = userFields == null ? Map.of() : Map.copyOf(userFields);
    }

    SessionEntry touch(Instant now) {
        return new SessionEntry(id, markup, graph, userFields, now);
    }

    SessionEntry withUserFields(Map<String, String> fields, Instant now) {
        return new SessionEntry(id, markup, graph, fields, now);
    }
}

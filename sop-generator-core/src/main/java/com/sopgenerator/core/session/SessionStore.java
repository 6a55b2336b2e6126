package com.sopgenerator.core.session;

import com.sopgenerator.core.model.ProcessGraph;

import java.util.Map;
import java.util.Optional;

/**
 * Keeps an uploaded diagram between the ingest and finalize calls of a front end.
 *
 * <p>Entries expire after a period of inactivity. Implementations must be thread safe.
 */
public interface SessionStore {

    /**
     * Stores a new session.
     *
     * @param markup uploaded markup
     * @param graph parsed graph
     * @return new session id
     */
    String create(String markup, ProcessGraph graph);

    /**
     * Returns a live session and refreshes its expiry.
     *
     * @param id session id
     * @return the session, or empty when unknown or expired
     */
    Optional<SessionEntry> get(String id);

    /**
     * Replaces the author's field values.
     *
     * @param id session id
     * @param userFields new field values
     * @return the updated session, or empty when unknown or expired
     */
    Optional<SessionEntry> updateFields(String id, Map<String, String> userFields);

    /**
     * Removes a session.
     *
     * @param id session id
     * @return true if a session was removed
     */
    boolean remove(String id);

    /**
     * Drops every expired session.
     *
     * @return number of sessions dropped
     */
    int evictExpired();

    int size();
}

package com.sopgenerator.core.session;

import com.sopgenerator.core.config.SopConfig.SessionSettings;
import com.sopgenerator.core.model.ProcessGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link SessionStore} backed by a concurrent map.
 *
 * <p>Expired entries are dropped when accessed and by {@link #evictExpired()}. When the store
 * is full, creating a session first evicts expired entries and then the least recently
 * touched one.
 */
public class InMemorySessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

    private final ConcurrentMap<String, SessionEntry> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;

    public InMemorySessionStore(SessionSettings settings) {
        this(settings, Clock.systemUTC());
    }

    public InMemorySessionStore(SessionSettings settings, Clock clock) {
        Objects.requireNonNull(settings, "settings must not be null");
        this.ttl = Duration.ofMinutes(settings.ttlMinutes());
        this.maxEntries = settings.maxEntries();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public String create(String markup, ProcessGraph graph) {
        Instant now = clock.instant();
        synchronized (this) {
            if (entries.size() >= maxEntries) {
                evictExpired();
            }
            while (entries.size() >= maxEntries) {
                entries.values().stream()
                    .min(Comparator.comparing(SessionEntry::lastTouched))
                    .ifPresent(oldest -> {
                        log.debug("Session store full, evicting session {}", oldest.id());
                        entries.remove(oldest.id());
                    });
            }
            String id = UUID.randomUUID().toString();
            entries.put(id, new SessionEntry(id, markup, graph, Map.of(), now));
            log.debug("Created session {} ({} active)", id, entries.size());
            return id;
        }
    }

    @Override
    public Optional<SessionEntry> get(String id) {
        Instant now = clock.instant();
        SessionEntry entry = entries.computeIfPresent(id, (key, current) ->
            isExpired(current, now) ? null : current.touch(now));
        return Optional.ofNullable(entry);
    }

    @Override
    public Optional<SessionEntry> updateFields(String id, Map<String, String> userFields) {
        Instant now = clock.instant();
        SessionEntry entry = entries.computeIfPresent(id, (key, current) ->
            isExpired(current, now) ? null : current.withUserFields(userFields, now));
        return Optional.ofNullable(entry);
    }

    @Override
    public boolean remove(String id) {
        return entries.remove(id) != null;
    }

    @Override
    public int evictExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> isExpired(entry, now));
        int evicted = before - entries.size();
        if (evicted > 0) {
            log.info("Evicted {} expired sessions", evicted);
        }
        return evicted;
    }

    @Override
    public int size() {
        return entries.size();
    }

    private boolean isExpired(SessionEntry entry, Instant now) {
        return !entry.lastTouched().plus(ttl).isAfter(now);
    }
}

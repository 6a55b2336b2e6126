package com.sopgenerator.core.session;

import com.sopgenerator.core.config.SopConfig.SessionSettings;
import com.sopgenerator.core.model.ProcessGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link InMemorySessionStore}.
 */
class InMemorySessionStoreTest {

    private static final ProcessGraph GRAPH = ProcessGraph.of("Process_1", List.of(), List.of(), List.of(), null);

    private MutableClock clock;
    private InMemorySessionStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-05T09:00:00Z"));
        store = new InMemorySessionStore(new SessionSettings(30L, 2), clock);
    }

    @Test
    void create_returnsRetrievableSession() {
        String id = store.create("<definitions/>", GRAPH);

        assertThat(store.get(id)).hasValueSatisfying(entry -> {
            assertThat(entry.markup()).isEqualTo("<definitions/>");
            assertThat(entry.graph()).isSameAs(GRAPH);
            assertThat(entry.userFields()).isEmpty();
        });
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void get_afterTtl_returnsEmptyAndDropsSession() {
        String id = store.create("<definitions/>", GRAPH);

        clock.advance(Duration.ofMinutes(30));

        assertThat(store.get(id)).isEmpty();
        assertThat(store.size()).isZero();
    }

    @Test
    void get_refreshesExpiry() {
        String id = store.create("<definitions/>", GRAPH);

        clock.advance(Duration.ofMinutes(20));
        assertThat(store.get(id)).isPresent();
        clock.advance(Duration.ofMinutes(20));

        assertThat(store.get(id)).isPresent();
    }

    @Test
    void updateFields_replacesUserFields() {
        String id = store.create("<definitions/>", GRAPH);

        store.updateFields(id, Map.of("process_owner", "Head of Finance"));

        assertThat(store.get(id))
            .map(SessionEntry::userFields)
            .contains(Map.of("process_owner", "Head of Finance"));
    }

    @Test
    void updateFields_unknownSession_returnsEmpty() {
        assertThat(store.updateFields("missing", Map.of())).isEmpty();
    }

    @Test
    void create_whenFull_evictsLeastRecentlyTouched() {
        String first = store.create("a", GRAPH);
        clock.advance(Duration.ofMinutes(1));
        String second = store.create("b", GRAPH);
        clock.advance(Duration.ofMinutes(1));
        store.get(first);

        String third = store.create("c", GRAPH);

        assertThat(store.size()).isEqualTo(2);
        assertThat(store.get(second)).isEmpty();
        assertThat(store.get(first)).isPresent();
        assertThat(store.get(third)).isPresent();
    }

    @Test
    void evictExpired_dropsOnlyExpiredSessions() {
        store.create("a", GRAPH);
        clock.advance(Duration.ofMinutes(25));
        String fresh = store.create("b", GRAPH);
        clock.advance(Duration.ofMinutes(10));

        assertThat(store.evictExpired()).isEqualTo(1);
        assertThat(store.get(fresh)).isPresent();
    }

    @Test
    void remove_deletesSession() {
        String id = store.create("a", GRAPH);

        assertThat(store.remove(id)).isTrue();
        assertThat(store.remove(id)).isFalse();
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}

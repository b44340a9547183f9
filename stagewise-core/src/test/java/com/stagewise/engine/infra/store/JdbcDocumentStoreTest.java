package com.stagewise.engine.infra.store;

import com.stagewise.engine.MutableClock;
import com.stagewise.engine.api.store.VersionedDocument;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcDocumentStoreTest {

    private MutableClock clock;
    private JdbcDocumentStore store;

    @BeforeEach
    void setUp() {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:docs-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        JdbcDocumentStore.initializeSchema(dataSource);
        clock = MutableClock.startingAt("2025-03-01T10:00:00Z");
        store = new JdbcDocumentStore(dataSource, clock);
    }

    @Test
    @DisplayName("Should insert a new document at version 1")
    void shouldInsertDocument() {
        assertThat(store.compareAndSet("sessions", "s1", 0, "{\"a\":1}")).isTrue();

        VersionedDocument doc = store.find("sessions", "s1").orElseThrow();
        assertThat(doc.version()).isEqualTo(1);
        assertThat(doc.body()).isEqualTo("{\"a\":1}");
        assertThat(doc.updatedAt()).isEqualTo(Instant.parse("2025-03-01T10:00:00Z"));
    }

    @Test
    @DisplayName("Should refuse a second insert of the same document")
    void shouldRejectDuplicateInsert() {
        store.compareAndSet("sessions", "s1", 0, "first");

        assertThat(store.compareAndSet("sessions", "s1", 0, "second")).isFalse();
        assertThat(store.find("sessions", "s1").orElseThrow().body()).isEqualTo("first");
    }

    @Test
    @DisplayName("Should update only when the expected version matches")
    void shouldApplyOptimisticLocking() {
        store.compareAndSet("sessions", "s1", 0, "v1");
        clock.advance(Duration.ofSeconds(5));

        assertThat(store.compareAndSet("sessions", "s1", 1, "v2")).isTrue();
        assertThat(store.compareAndSet("sessions", "s1", 1, "stale")).isFalse();

        VersionedDocument doc = store.find("sessions", "s1").orElseThrow();
        assertThat(doc.version()).isEqualTo(2);
        assertThat(doc.body()).isEqualTo("v2");
        assertThat(doc.updatedAt()).isEqualTo(Instant.parse("2025-03-01T10:00:05Z"));
    }

    @Test
    @DisplayName("Should keep collections apart")
    void shouldSeparateCollections() {
        store.compareAndSet("sessions", "s1", 0, "session");
        store.compareAndSet("participant_contexts", "s1", 0, "context");

        assertThat(store.find("sessions", "s1").orElseThrow().body()).isEqualTo("session");
        assertThat(store.find("participant_contexts", "s1").orElseThrow().body()).isEqualTo("context");
    }

    @Test
    @DisplayName("Should delete a document")
    void shouldDelete() {
        store.compareAndSet("sessions", "s1", 0, "body");

        store.delete("sessions", "s1");

        assertThat(store.find("sessions", "s1")).isEmpty();
        assertThat(store.compareAndSet("sessions", "s1", 0, "again")).isTrue();
    }

    @Test
    @DisplayName("Should tolerate repeated schema initialization")
    void shouldInitializeSchemaTwice() {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:twice-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");

        JdbcDocumentStore.initializeSchema(dataSource);
        JdbcDocumentStore.initializeSchema(dataSource);

        assertThat(new JdbcDocumentStore(dataSource).find("sessions", "none")).isEmpty();
    }
}

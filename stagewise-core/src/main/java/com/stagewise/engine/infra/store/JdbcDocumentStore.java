/*
 * Copyright (c) 2025 Stagewise Navigation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.stagewise.engine.infra.store;

import com.stagewise.engine.api.exceptions.StoreUnavailableException;
import com.stagewise.engine.api.store.DocumentStore;
import com.stagewise.engine.api.store.VersionedDocument;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JDBC document store for H2 or PostgreSQL.
 *
 * <p>Optimistic locking: an insert claims version 1, every later write is a
 * conditional {@code UPDATE ... WHERE version = ?}. A lost race shows up as a
 * primary key violation on insert or zero updated rows, and is reported as
 * {@code false} rather than an error.
 *
 * <p><b>Thread Safety:</b> all operations are thread-safe through database ACID properties.
 */
public class JdbcDocumentStore implements DocumentStore {

    private static final Logger logger = Logger.getLogger(JdbcDocumentStore.class.getName());

    static final Map<String, String> SQL = SqlLoader.loadQueries("sql/queries.sql");

    private final DataSource dataSource;
    private final Clock clock;

    public JdbcDocumentStore(DataSource dataSource) {
        this(dataSource, Clock.systemUTC());
    }

    public JdbcDocumentStore(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    /**
     * Creates the engine tables if they do not exist. Shared by every JDBC
     * store; safe to call more than once.
     */
    public static void initializeSchema(DataSource dataSource) {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String sql : SqlLoader.loadStatements("sql/schema.sql")) {
                stmt.execute(sql);
            }
            logger.info("Navigation engine schema initialized");
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to initialize navigation engine schema", e);
            throw new StoreUnavailableException("Failed to initialize schema", e);
        }
    }

    @Override
    public Optional<VersionedDocument> find(String collection, String id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SQL.get("find_document"))) {
            stmt.setString(1, collection);
            stmt.setString(2, id);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new VersionedDocument(
                        rs.getString("id"),
                        rs.getLong("version"),
                        rs.getString("body"),
                        rs.getTimestamp("updated_at").toInstant()));
            }
        } catch (SQLException e) {
            throw failure("Failed to read " + collection + "/" + id, e);
        }
    }

    @Override
    public boolean compareAndSet(String collection, String id, long expectedVersion, String body) {
        Timestamp now = Timestamp.from(clock.instant());
        try (Connection conn = dataSource.getConnection()) {
            if (expectedVersion == 0) {
                return insert(conn, collection, id, body, now);
            }
            try (PreparedStatement stmt = conn.prepareStatement(SQL.get("update_document"))) {
                int idx = 1;
                stmt.setString(idx++, body);
                stmt.setTimestamp(idx++, now);
                stmt.setString(idx++, collection);
                stmt.setString(idx++, id);
                stmt.setLong(idx, expectedVersion);
                return stmt.executeUpdate() == 1;
            }
        } catch (SQLException e) {
            throw failure("Failed to write " + collection + "/" + id, e);
        }
    }

    private boolean insert(Connection conn, String collection, String id, String body, Timestamp now)
            throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("insert_document"))) {
            stmt.setString(1, collection);
            stmt.setString(2, id);
            stmt.setString(3, body);
            stmt.setTimestamp(4, now);
            stmt.executeUpdate();
            return true;
        } catch (SQLException e) {
            if (isDuplicateKey(e)) {
                logger.fine("Document " + collection + "/" + id + " was created concurrently");
                return false;
            }
            throw e;
        }
    }

    @Override
    public void delete(String collection, String id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SQL.get("delete_document"))) {
            stmt.setString(1, collection);
            stmt.setString(2, id);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw failure("Failed to delete " + collection + "/" + id, e);
        }
    }

    /**
     * SQLState class 23 is an integrity constraint violation in both H2 and
     * PostgreSQL.
     */
    static boolean isDuplicateKey(SQLException e) {
        return e.getSQLState() != null && e.getSQLState().startsWith("23");
    }

    static StoreUnavailableException failure(String message, SQLException e) {
        logger.log(Level.SEVERE, message, e);
        return new StoreUnavailableException(message, e);
    }
}

/*
 * Copyright (c) 2025 Stagewise Navigation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.stagewise.engine.infra.store;

import com.stagewise.engine.api.exceptions.StoreUnavailableException;
import com.stagewise.engine.api.store.BranchKey;
import com.stagewise.engine.api.store.CounterCondition;
import com.stagewise.engine.api.store.CounterField;
import com.stagewise.engine.api.store.CounterSnapshot;
import com.stagewise.engine.api.store.DistributionCounterStore;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Distribution counters in a relational database.
 *
 * <p>Every conditional increment is one {@code UPDATE ... WHERE} statement,
 * so the check and the increment are atomic under the database's row lock.
 * Rows are created lazily with an insert that tolerates a concurrent insert
 * of the same key.
 */
public class JdbcDistributionCounterStore implements DistributionCounterStore {

    private static final Logger logger = Logger.getLogger(JdbcDistributionCounterStore.class.getName());

    private static final Map<String, String> SQL = JdbcDocumentStore.SQL;

    private final DataSource dataSource;

    public JdbcDistributionCounterStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public CounterSnapshot get(BranchKey key) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SQL.get("select_counter"))) {
            bindKey(stmt, key, 1);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return CounterSnapshot.zero();
                }
                return new CounterSnapshot(rs.getLong("started_count"), rs.getLong("completed_count"),
                        rs.getLong("active_count"));
            }
        } catch (SQLException e) {
            throw failure("Failed to read counter " + key, e);
        }
    }

    @Override
    public Map<String, CounterSnapshot> getAll(String experimentId, String decisionPointId) {
        Map<String, CounterSnapshot> result = new LinkedHashMap<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SQL.get("select_counters"))) {
            stmt.setString(1, experimentId);
            stmt.setString(2, decisionPointId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.put(rs.getString("branch_id"), new CounterSnapshot(rs.getLong("started_count"),
                            rs.getLong("completed_count"), rs.getLong("active_count")));
                }
            }
            return result;
        } catch (SQLException e) {
            throw failure("Failed to read counters of " + experimentId + ":" + decisionPointId, e);
        }
    }

    @Override
    public long incrementAndGet(BranchKey key, CounterField field) {
        try (Connection conn = dataSource.getConnection()) {
            ensureRow(conn, key);
            conn.setAutoCommit(false);
            try {
                try (PreparedStatement stmt = conn.prepareStatement(sql("increment_counter", field))) {
                    bindKey(stmt, key, 1);
                    stmt.executeUpdate();
                }
                long value;
                try (PreparedStatement stmt = conn.prepareStatement(sql("select_counter_value", field))) {
                    bindKey(stmt, key, 1);
                    try (ResultSet rs = stmt.executeQuery()) {
                        rs.next();
                        value = rs.getLong(1);
                    }
                }
                conn.commit();
                return value;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw failure("Failed to increment " + field + " of " + key, e);
        }
    }

    @Override
    public boolean incrementIf(BranchKey key, CounterField field, CounterCondition condition) {
        String query = condition.comparison() == CounterCondition.Comparison.EQUAL_TO
                ? "increment_counter_if_equal" : "increment_counter_if_less";
        try (Connection conn = dataSource.getConnection()) {
            ensureRow(conn, key);
            try (PreparedStatement stmt = conn.prepareStatement(sql(query, field))) {
                int idx = bindKey(stmt, key, 1);
                stmt.setLong(idx, condition.operand());
                return stmt.executeUpdate() == 1;
            }
        } catch (SQLException e) {
            throw failure("Failed conditional increment of " + key, e);
        }
    }

    @Override
    public void decrement(BranchKey key, CounterField field) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql("decrement_counter", field))) {
            bindKey(stmt, key, 1);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw failure("Failed to decrement " + field + " of " + key, e);
        }
    }

    @Override
    public void markActive(BranchKey key, String sessionId, Instant since) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SQL.get("insert_active"))) {
            int idx = bindKey(stmt, key, 1);
            stmt.setString(idx++, sessionId);
            stmt.setTimestamp(idx, Timestamp.from(since));
            stmt.executeUpdate();
        } catch (SQLException e) {
            if (JdbcDocumentStore.isDuplicateKey(e)) {
                return;
            }
            throw failure("Failed to mark " + sessionId + " active on " + key, e);
        }
    }

    @Override
    public void clearActive(BranchKey key, String sessionId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SQL.get("delete_active"))) {
            int idx = bindKey(stmt, key, 1);
            stmt.setString(idx, sessionId);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw failure("Failed to clear active marker of " + sessionId + " on " + key, e);
        }
    }

    @Override
    public int sweepStaleActive(String experimentId, Instant cutoff) {
        List<String[]> stale = new ArrayList<>();
        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement stmt = conn.prepareStatement(SQL.get("select_stale_active"))) {
                stmt.setString(1, experimentId);
                stmt.setTimestamp(2, Timestamp.from(cutoff));
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        stale.add(new String[]{rs.getString(1), rs.getString(2), rs.getString(3)});
                    }
                }
            }
            int dropped = 0;
            conn.setAutoCommit(false);
            try {
                for (String[] row : stale) {
                    BranchKey key = new BranchKey(experimentId, row[0], row[1]);
                    try (PreparedStatement delete = conn.prepareStatement(SQL.get("delete_active"))) {
                        int idx = bindKey(delete, key, 1);
                        delete.setString(idx, row[2]);
                        if (delete.executeUpdate() == 0) {
                            continue;
                        }
                    }
                    try (PreparedStatement decrement = conn.prepareStatement(sql("decrement_counter", CounterField.STARTED))) {
                        bindKey(decrement, key, 1);
                        decrement.executeUpdate();
                    }
                    dropped++;
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
            if (dropped > 0) {
                logger.info("Swept " + dropped + " stale active markers of " + experimentId);
            }
            return dropped;
        } catch (SQLException e) {
            throw failure("Failed to sweep active markers of " + experimentId, e);
        }
    }

    @Override
    public void reset(String experimentId, String decisionPointId) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                for (String query : new String[]{"delete_counters", "delete_active_by_decision_point"}) {
                    try (PreparedStatement stmt = conn.prepareStatement(SQL.get(query))) {
                        stmt.setString(1, experimentId);
                        stmt.setString(2, decisionPointId);
                        stmt.executeUpdate();
                    }
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw failure("Failed to reset counters of " + experimentId + ":" + decisionPointId, e);
        }
    }

    private static void ensureRow(Connection conn, BranchKey key) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("insert_counter"))) {
            bindKey(stmt, key, 1);
            stmt.executeUpdate();
        } catch (SQLException e) {
            if (!JdbcDocumentStore.isDuplicateKey(e)) {
                throw e;
            }
        }
    }

    /**
     * Binds experiment, decision point and branch starting at {@code idx}.
     *
     * @return next free parameter index
     */
    private static int bindKey(PreparedStatement stmt, BranchKey key, int idx) throws SQLException {
        stmt.setString(idx++, key.experimentId());
        stmt.setString(idx++, key.decisionPointId());
        stmt.setString(idx++, key.branchId());
        return idx;
    }

    private static String sql(String name, CounterField field) {
        return SQL.get(name).replace("{column}", field.column());
    }

    private static StoreUnavailableException failure(String message, SQLException e) {
        logger.log(Level.SEVERE, message, e);
        return new StoreUnavailableException(message, e);
    }
}

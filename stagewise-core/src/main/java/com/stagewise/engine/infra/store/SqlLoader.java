/*
 * Copyright (c) 2025 Stagewise Navigation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.stagewise.engine.infra.store;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Loads named SQL statements and schema scripts from classpath resources.
 *
 * <p><b>Query Format:</b>
 * <pre>
 * -- @name: query_name
 * SELECT * FROM table WHERE id = ?;
 * </pre>
 * The trailing semicolon is stripped.
 */
public final class SqlLoader {

    private static final Logger logger = Logger.getLogger(SqlLoader.class.getName());

    private static final String NAME_MARKER = "-- @name:";

    private SqlLoader() {
    }

    /**
     * @param resourcePath e.g. {@code sql/queries.sql}
     * @return query name to SQL text
     */
    public static Map<String, String> loadQueries(String resourcePath) {
        Map<String, String> queries = new HashMap<>();
        String currentName = null;
        StringBuilder current = new StringBuilder();

        for (String raw : readLines(resourcePath)) {
            String line = raw.trim();
            if (line.startsWith(NAME_MARKER)) {
                store(queries, currentName, current);
                currentName = line.substring(NAME_MARKER.length()).trim();
                current = new StringBuilder();
            } else if (line.startsWith("--") || line.isEmpty()) {
                continue;
            } else if (currentName != null) {
                if (current.length() > 0) {
                    current.append(' ');
                }
                current.append(line);
            }
        }
        store(queries, currentName, current);

        logger.info("Loaded " + queries.size() + " SQL queries from " + resourcePath);
        return Collections.unmodifiableMap(queries);
    }

    /**
     * Splits a schema script into executable statements, comments removed.
     */
    public static List<String> loadStatements(String resourcePath) {
        StringBuilder script = new StringBuilder();
        for (String line : readLines(resourcePath)) {
            if (!line.trim().startsWith("--")) {
                script.append(line).append('\n');
            }
        }
        List<String> statements = new ArrayList<>();
        for (String statement : script.toString().split(";")) {
            if (!statement.isBlank()) {
                statements.add(statement.trim());
            }
        }
        logger.info("Loaded " + statements.size() + " schema statements from " + resourcePath);
        return statements;
    }

    private static void store(Map<String, String> queries, String name, StringBuilder sql) {
        if (name == null || sql.length() == 0) {
            return;
        }
        String text = sql.toString().trim();
        if (text.endsWith(";")) {
            text = text.substring(0, text.length() - 1).trim();
        }
        queries.put(name, text);
    }

    private static List<String> readLines(String resourcePath) {
        InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(resourcePath);
        if (in == null) {
            throw new IllegalStateException("SQL resource not found: " + resourcePath);
        }
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read SQL resource " + resourcePath, e);
        }
        return lines;
    }
}

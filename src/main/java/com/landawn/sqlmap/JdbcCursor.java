/*
 * Copyright (C) 2025 HaiYang Li
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */

package com.landawn.sqlmap;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs each statement through a fresh {@link PreparedStatement} and buffers its result, so the statement is closed
 * when {@link #execute(String, Bindings)} returns.
 */
final class JdbcCursor implements Cursor {

    private final Connection conn;

    private List<String> columnLabels = Collections.emptyList();

    private List<Object[]> rows = Collections.emptyList();

    private int rowCount = -1;

    private String lastStatement;

    private boolean closed = false;

    JdbcCursor(final Connection conn) {
        this.conn = conn;
    }

    @Override
    public void execute(final String sql, final Bindings bindings) throws SQLException {
        assertNotClosed();

        if (bindings.isNamed()) {
            throw new IllegalArgumentException("JDBC statements only take positional bindings");
        }

        columnLabels = Collections.emptyList();
        rows = Collections.emptyList();
        rowCount = -1;
        lastStatement = sql;

        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            final List<?> parameters = bindings.positional();

            for (int i = 0, size = parameters.size(); i < size; i++) {
                stmt.setObject(i + 1, parameters.get(i));
            }

            if (stmt.execute()) {
                try (ResultSet rs = stmt.getResultSet()) {
                    readResult(rs);
                }
            } else {
                rowCount = stmt.getUpdateCount();
            }
        }
    }

    private void readResult(final ResultSet rs) throws SQLException {
        final ResultSetMetaData metaData = rs.getMetaData();
        final int columnCount = metaData.getColumnCount();
        final List<String> labels = new ArrayList<>(columnCount);

        for (int i = 1; i <= columnCount; i++) {
            labels.add(metaData.getColumnLabel(i));
        }

        final List<Object[]> result = new ArrayList<>();

        while (rs.next()) {
            final Object[] row = new Object[columnCount];

            for (int i = 0; i < columnCount; i++) {
                row[i] = rs.getObject(i + 1);
            }

            result.add(row);
        }

        columnLabels = Collections.unmodifiableList(labels);
        rows = result;
        rowCount = result.size();
    }

    @Override
    public List<String> columnLabels() {
        return columnLabels;
    }

    @Override
    public List<Object[]> fetchAll() throws SQLException {
        assertNotClosed();

        final List<Object[]> result = rows;
        rows = Collections.emptyList();

        return result;
    }

    @Override
    public int rowCount() {
        return rowCount;
    }

    @Override
    public String lastStatement() {
        return lastStatement;
    }

    @Override
    public void close() {
        closed = true;
        rows = Collections.emptyList();
    }

    private void assertNotClosed() throws SQLException {
        if (closed) {
            throw new SQLException("Cursor is closed");
        }
    }
}

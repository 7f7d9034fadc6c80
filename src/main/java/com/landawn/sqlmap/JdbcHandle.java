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
import java.sql.SQLException;

import com.landawn.abacus.util.N;

/**
 * {@link DbHandle} over a JDBC {@link Connection}. JDBC drivers take {@code ?} markers, so the style is always
 * {@link ParamStyle#QMARK}.
 */
public final class JdbcHandle implements DbHandle {

    private final Connection conn;

    private JdbcHandle(final Connection conn) {
        this.conn = conn;
    }

    /**
     *
     * @param conn
     * @return
     */
    public static JdbcHandle of(final Connection conn) {
        N.checkArgNotNull(conn, "conn");

        return new JdbcHandle(conn);
    }

    public Connection connection() {
        return conn;
    }

    @Override
    public ParamStyle paramStyle() {
        return ParamStyle.QMARK;
    }

    @Override
    public Cursor cursor() throws SQLException {
        if (conn.isClosed()) {
            throw new SQLException("Connection is closed");
        }

        return new JdbcCursor(conn);
    }

    @Override
    public boolean getAutoCommit() throws SQLException {
        return conn.getAutoCommit();
    }

    @Override
    public void setAutoCommit(final boolean autoCommit) throws SQLException {
        conn.setAutoCommit(autoCommit);
    }

    @Override
    public void commit() throws SQLException {
        conn.commit();
    }

    @Override
    public void rollback() throws SQLException {
        conn.rollback();
    }

    @Override
    public int getTransactionIsolation() throws SQLException {
        return conn.getTransactionIsolation();
    }

    @Override
    public void setTransactionIsolation(final int level) throws SQLException {
        conn.setTransactionIsolation(level);
    }

    @Override
    public void close() throws SQLException {
        conn.close();
    }

    /**
     * Handles over the same {@link Connection} instance are equal, so they share one transaction state.
     *
     * @param obj
     * @return
     */
    @Override
    public boolean equals(final Object obj) {
        return obj instanceof JdbcHandle && ((JdbcHandle) obj).conn == conn;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(conn);
    }

    @Override
    public String toString() {
        return "JdbcHandle{" + conn + "}";
    }
}

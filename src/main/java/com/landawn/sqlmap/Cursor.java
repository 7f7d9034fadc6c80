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

import java.sql.SQLException;
import java.util.List;

/**
 * A statement execution context obtained from a {@link DbHandle}. One cursor is reused for every operation run
 * through a {@link Database}.
 *
 * <p>The native SQL passed to {@link #execute(String, Bindings)} uses the markers of {@link DbHandle#paramStyle()},
 * and the bindings have the shape that style expects.</p>
 */
public interface Cursor extends AutoCloseable {

    /**
     * Executes one statement, replacing any result of the previous execution.
     *
     * @param sql native SQL text
     * @param bindings
     * @throws SQLException
     */
    void execute(String sql, Bindings bindings) throws SQLException;

    /**
     * Column labels of the current result, empty if the last statement produced no result set.
     *
     * @return
     */
    List<String> columnLabels();

    /**
     * Returns the remaining rows of the current result. Calling it again returns an empty list.
     *
     * @return
     * @throws SQLException
     */
    List<Object[]> fetchAll() throws SQLException;

    /**
     * Row count of the last execution: rows returned for a query, rows affected for an update, {@code -1} if unknown.
     *
     * @return
     */
    int rowCount();

    /**
     * The native SQL last executed, or {@code null}.
     *
     * @return
     */
    String lastStatement();

    @Override
    void close() throws SQLException;
}

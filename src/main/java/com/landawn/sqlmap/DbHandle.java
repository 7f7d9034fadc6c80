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

/**
 * An open database connection as the core sees it. Any driver works as long as it can be wrapped in this interface
 * and names the {@link ParamStyle} it expects.
 *
 * @see JdbcHandle
 */
public interface DbHandle extends AutoCloseable {

    ParamStyle paramStyle();

    Cursor cursor() throws SQLException;

    boolean getAutoCommit() throws SQLException;

    void setAutoCommit(boolean autoCommit) throws SQLException;

    void commit() throws SQLException;

    void rollback() throws SQLException;

    /**
     *
     * @return one of the {@code java.sql.Connection.TRANSACTION_*} constants
     * @throws SQLException
     */
    int getTransactionIsolation() throws SQLException;

    void setTransactionIsolation(int level) throws SQLException;

    @Override
    void close() throws SQLException;
}

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

/**
 * The isolation level a transaction scope runs with, mapped to the {@code java.sql.Connection.TRANSACTION_*}
 * constants a {@link DbHandle} understands.
 *
 * <p>{@link #DEFAULT} keeps whatever level the handle already has. There is no constant for
 * {@code TRANSACTION_NONE}: a scope without transactions can not be rolled back.</p>
 *
 * @see Database#beginTransaction(IsolationLevel)
 */
public enum IsolationLevel {

    DEFAULT(-1),

    READ_UNCOMMITTED(Connection.TRANSACTION_READ_UNCOMMITTED),

    READ_COMMITTED(Connection.TRANSACTION_READ_COMMITTED),

    REPEATABLE_READ(Connection.TRANSACTION_REPEATABLE_READ),

    SERIALIZABLE(Connection.TRANSACTION_SERIALIZABLE);

    private final int intValue;

    IsolationLevel(final int intValue) {
        this.intValue = intValue;
    }

    /**
     * The {@code Connection.TRANSACTION_*} value, or {@code -1} for {@link #DEFAULT}.
     *
     * @return
     */
    public int intValue() {
        return intValue;
    }

    /**
     * Sets this level on the handle. {@link #DEFAULT} leaves the handle unchanged.
     *
     * @param handle
     * @throws SQLException
     */
    void applyTo(final DbHandle handle) throws SQLException {
        if (this != DEFAULT) {
            handle.setTransactionIsolation(intValue);
        }
    }

    /**
     * The level reported by a driver. A value without a constant here, {@code TRANSACTION_NONE} included, maps to
     * {@link #DEFAULT}.
     *
     * @param jdbcLevel
     * @return
     */
    public static IsolationLevel fromJdbc(final int jdbcLevel) {
        for (final IsolationLevel level : values()) {
            if (level != DEFAULT && level.intValue == jdbcLevel) {
                return level;
            }
        }

        return DEFAULT;
    }
}

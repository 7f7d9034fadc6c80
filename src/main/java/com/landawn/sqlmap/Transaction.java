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

import com.landawn.abacus.exception.UncheckedSQLException;
import com.landawn.sqlmap.exception.RollbackException;

/**
 * A unit of work on one {@link DbHandle}: everything executed between begin and {@link #commit()} is applied together
 * or, after {@link #rollback()}, not at all.
 *
 * <pre>{@code
 * try (SqlTransaction tran = db.beginTransaction()) {
 *     db.call("create_user", "hal", "brightestday");
 *     db.call("grant_role", "hal", "lantern");
 *     tran.commit();
 * }
 * }</pre>
 *
 * @see SqlTransaction
 */
public interface Transaction {

    /**
     * Identifies the transaction in log messages.
     *
     * @return
     */
    String id();

    IsolationLevel isolationLevel();

    Status status();

    /**
     * Checks if the transaction is neither committed nor rolled back.
     *
     * @return
     */
    boolean isActive();

    /**
     * Commits the transaction. A failed commit is rolled back automatically.
     *
     * @throws UncheckedSQLException if the commit fails
     * @throws RollbackException if the rollback following a failed commit fails too
     */
    void commit() throws UncheckedSQLException, RollbackException;

    /**
     *
     * @throws RollbackException if the rollback fails
     */
    void rollback() throws RollbackException;

    /**
     * Rolls back the transaction unless it has already been committed or rolled back. Meant for {@code finally}
     * blocks and try-with-resources.
     *
     * @throws RollbackException if the rollback fails
     */
    void rollbackIfNotCommitted() throws RollbackException;

    enum Status {
        ACTIVE,

        COMMITTED,

        FAILED_COMMIT,

        ROLLED_BACK,

        FAILED_ROLLBACK
    }
}

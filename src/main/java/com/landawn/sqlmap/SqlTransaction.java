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
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import com.landawn.abacus.exception.UncheckedSQLException;
import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.util.N;
import com.landawn.abacus.util.Strings;
import com.landawn.sqlmap.exception.RollbackException;
import com.landawn.sqlmap.exception.TransactionStateException;

/**
 * A transaction on a {@link DbHandle}. Beginning one turns auto-commit off and applies the requested isolation level;
 * finishing it, by commit or rollback, restores both.
 *
 * <p>Transactions do not nest: while one is active on a handle, beginning another on the same handle, or on an equal
 * one such as a second {@link JdbcHandle} over the same connection, fails with {@link TransactionStateException}. Work that belongs together runs in the same transaction.</p>
 *
 * <p>Closing an active transaction rolls it back, so an uncommitted try-with-resources block is undone.</p>
 *
 * @see Database#beginTransaction()
 * @see Database#callInTransaction(com.landawn.abacus.util.Throwables.Callable)
 */
public final class SqlTransaction implements Transaction, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SqlTransaction.class);

    private static final Map<DbHandle, SqlTransaction> activeTransactions = Collections.synchronizedMap(new HashMap<>());

    private static final AtomicLong idGenerator = new AtomicLong();

    private final String _id; //NOSONAR

    private final DbHandle _handle; //NOSONAR

    private final IsolationLevel _isolationLevel; //NOSONAR

    private final boolean _originalAutoCommit; //NOSONAR

    private final int _originalIsolationLevel; //NOSONAR

    private Transaction.Status _status = Status.ACTIVE; //NOSONAR

    private SqlTransaction(final DbHandle handle, final IsolationLevel isolationLevel) throws SQLException {
        _id = Strings.concat(String.valueOf(System.identityHashCode(handle)), "_", String.valueOf(idGenerator.incrementAndGet()), "_",
                String.valueOf(System.currentTimeMillis()));
        _handle = handle;
        _isolationLevel = isolationLevel;

        _originalAutoCommit = handle.getAutoCommit();
        _originalIsolationLevel = handle.getTransactionIsolation();

        handle.setAutoCommit(false);

        try {
            isolationLevel.applyTo(handle);
        } catch (final SQLException e) {
            try {
                handle.setAutoCommit(_originalAutoCommit);
            } catch (final SQLException resetFailure) {
                e.addSuppressed(resetFailure);
            }

            throw e;
        }
    }

    /**
     *
     * @param handle
     * @param isolationLevel
     * @return
     * @throws TransactionStateException if a transaction is already active on the handle
     * @throws UncheckedSQLException if the handle cannot be switched to manual commit
     */
    static SqlTransaction begin(final DbHandle handle, final IsolationLevel isolationLevel) throws TransactionStateException, UncheckedSQLException {
        N.checkArgNotNull(handle, "handle");
        N.checkArgNotNull(isolationLevel, "isolationLevel");

        synchronized (activeTransactions) {
            final SqlTransaction active = activeTransactions.get(handle);

            if (active != null) {
                throw new TransactionStateException("Transaction(id=" + active._id + ") is already active on this handle. Transactions can not be nested");
            }

            final SqlTransaction tran;

            try {
                tran = new SqlTransaction(handle, isolationLevel);
            } catch (final SQLException e) {
                throw new UncheckedSQLException("Failed to begin transaction", e);
            }

            activeTransactions.put(handle, tran);

            if (logger.isInfoEnabled()) {
                logger.info("Beginning transaction(id={}) with isolation level: {}", tran._id,
                        isolationLevel + " (handle level: " + IsolationLevel.fromJdbc(tran._originalIsolationLevel) + ")");
            }

            return tran;
        }
    }

    /**
     *
     * @param handle
     * @return the active transaction on the handle, or {@code null}
     */
    static SqlTransaction getTransaction(final DbHandle handle) {
        return activeTransactions.get(handle);
    }

    @Override
    public String id() {
        return _id;
    }

    public DbHandle handle() {
        return _handle;
    }

    @Override
    public IsolationLevel isolationLevel() {
        return _isolationLevel;
    }

    @Override
    public Transaction.Status status() {
        return _status;
    }

    @Override
    public boolean isActive() {
        return _status == Status.ACTIVE;
    }

    @Override
    public void commit() throws TransactionStateException, UncheckedSQLException, RollbackException {
        if (_status != Status.ACTIVE) {
            throw new TransactionStateException("Transaction(id=" + _id + ") is already: " + _status + ". It can not be committed");
        }

        logger.info("Committing transaction(id={})", _id);

        _status = Status.FAILED_COMMIT;

        try {
            _handle.commit();

            _status = Status.COMMITTED;
        } catch (final SQLException e) {
            logger.warn("Failed to commit transaction(id={}). It will automatically be rolled back", _id);

            final UncheckedSQLException commitFailure = new UncheckedSQLException("Failed to commit transaction(id=" + _id + ")", e);

            executeRollback(commitFailure);

            throw commitFailure;
        }

        logger.info("Transaction(id={}) has been committed successfully", _id);

        finish();
    }

    @Override
    public void rollback() throws TransactionStateException, RollbackException {
        if (_status != Status.ACTIVE) {
            throw new TransactionStateException("Transaction(id=" + _id + ") is already: " + _status + ". It can not be rolled back");
        }

        executeRollback(null);
    }

    /**
     * Rolls back after {@code cause} escaped the transaction scope. If the rollback fails, the
     * {@link RollbackException} carries {@code cause} as its original exception.
     *
     * @param cause
     * @throws RollbackException
     */
    void rollbackOnFailure(final Throwable cause) throws RollbackException {
        if (_status == Status.ACTIVE) {
            executeRollback(cause);
        }
    }

    @Override
    public void rollbackIfNotCommitted() throws RollbackException {
        if (_status == Status.ACTIVE) {
            executeRollback(null);
        }
    }

    private void executeRollback(final Throwable original) throws RollbackException {
        logger.warn("Rolling back transaction(id={})", _id);

        _status = Status.FAILED_ROLLBACK;

        try {
            _handle.rollback();

            _status = Status.ROLLED_BACK;
        } catch (final SQLException e) {
            throw new RollbackException("Failed to roll back transaction(id=" + _id + ")", e, original);
        } finally {
            if (_status == Status.ROLLED_BACK) {
                logger.warn("Transaction(id={}) has been rolled back successfully", _id);
            } else {
                logger.warn("Failed to roll back transaction(id={})", _id);
            }

            finish();
        }
    }

    private void finish() {
        try {
            _handle.setAutoCommit(_originalAutoCommit);

            if (_isolationLevel != IsolationLevel.DEFAULT) {
                _handle.setTransactionIsolation(_originalIsolationLevel);
            }
        } catch (final SQLException e) {
            logger.warn("Failed to reset handle after transaction(id=" + _id + ")", e);
        } finally {
            activeTransactions.remove(_handle);

            logger.info("Finishing transaction(id={})", _id);
        }
    }

    /**
     * Rolls back the transaction if it is still active.
     *
     * @throws RollbackException
     */
    @Override
    public void close() throws RollbackException {
        rollbackIfNotCommitted();
    }

    @Override
    public int hashCode() {
        return _id.hashCode();
    }

    @Override
    public boolean equals(final Object obj) {
        return obj instanceof SqlTransaction && _id.equals(((SqlTransaction) obj)._id);
    }

    @Override
    public String toString() {
        return "SqlTransaction={id=" + _id + ", isolationLevel=" + _isolationLevel + ", status=" + _status + "}";
    }
}

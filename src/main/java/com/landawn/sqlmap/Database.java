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
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.landawn.abacus.exception.UncheckedSQLException;
import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.util.N;
import com.landawn.abacus.util.Throwables;
import com.landawn.abacus.util.function.TriConsumer;
import com.landawn.sqlmap.exception.MissingInterpolationValueException;
import com.landawn.sqlmap.exception.QueryArgumentException;
import com.landawn.sqlmap.exception.RollbackException;
import com.landawn.sqlmap.exception.TransactionStateException;

/**
 * Named SQL operations over one database handle.
 *
 * <p>Operations come from the {@code QUERIES} section of a {@link ConfigSource} or from {@link #register}. Their
 * statements use {@code ${name}} placeholders, bound by the driver, and {@code %(name)s} substitutions, pasted into the
 * SQL text as they are. Substituted text is not escaped or quoted: never pass untrusted input through it.</p>
 *
 * <pre>{@code
 * Map<String, Object> queries = new LinkedHashMap<>();
 * queries.put("create_user", "INSERT INTO users(name, password) VALUES(${name}, ${password})");
 * queries.put("list_users", "SELECT * FROM users ORDER BY name %(order)s");
 *
 * try (Database<Map<String, Object>> db = Database.of(ConfigSource.of(Map.of("QUERIES", queries)), JdbcHandle.of(conn))) {
 *     db.call("create_user", "bruce", "iamthenight");
 *     List<Map<String, Object>> users = db.call("list_users", Map.of("order", "DESC"));
 * }
 * }</pre>
 *
 * <p>A {@code Database} is not thread-safe. It shares one cursor between all of its operations.</p>
 *
 * @param <T> the row type produced by the row mapper
 */
public final class Database<T> implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Database.class);

    private final QueryRegistry registry;

    private final DbHandle handle;

    private final RowMapper<? extends T> rowMapper;

    private final QueryExecutor executor;

    private Database(final QueryRegistry registry, final DbHandle handle, final ParamStyle paramStyle, final RowMapper<? extends T> rowMapper) {
        this.registry = registry;
        this.handle = handle;
        this.rowMapper = rowMapper;

        try {
            this.executor = new QueryExecutor(paramStyle, handle.cursor());
        } catch (final SQLException e) {
            throw new UncheckedSQLException("Failed to open cursor", e);
        }

        logger.debug("Opened database with {} queries, paramstyle: {}", registry.size(), paramStyle.paramStyleName());
    }

    /**
     * Rows are returned as {@code Map}s from column label to value.
     *
     * @param config
     * @param handle
     * @return
     * @see #of(ConfigSource, DbHandle, String, RowMapper)
     */
    public static Database<Map<String, Object>> of(final ConfigSource config, final DbHandle handle) {
        return of(config, handle, RowMapper.TO_MAP);
    }

    /**
     *
     * @param <T>
     * @param config
     * @param handle
     * @param rowMapper
     * @return
     * @see #of(ConfigSource, DbHandle, String, RowMapper)
     */
    public static <T> Database<T> of(final ConfigSource config, final DbHandle handle, final RowMapper<? extends T> rowMapper) {
        N.checkArgNotNull(handle, "handle");

        return of(config, handle, handle.paramStyle().paramStyleName(), rowMapper);
    }

    /**
     *
     * @param <T>
     * @param config must contain a {@code QUERIES} section
     * @param handle
     * @param paramStyleName the DB-API paramstyle the cursor of {@code handle} expects
     * @param rowMapper
     * @return
     * @throws IllegalArgumentException if the configuration is invalid or the paramstyle is not supported
     * @throws UncheckedSQLException if no cursor can be obtained from the handle
     */
    public static <T> Database<T> of(final ConfigSource config, final DbHandle handle, final String paramStyleName, final RowMapper<? extends T> rowMapper)
            throws IllegalArgumentException, UncheckedSQLException {
        N.checkArgNotNull(config, "config");
        N.checkArgNotNull(handle, "handle");
        N.checkArgNotNull(rowMapper, "rowMapper");

        final ParamStyle paramStyle = ParamStyle.of(paramStyleName);

        return new Database<>(QueryRegistry.of(config), handle, paramStyle, rowMapper);
    }

    public QueryDefinition register(final String name, final String statement) {
        return registry.register(QueryDefinition.of(name, statement));
    }

    public QueryDefinition register(final String name, final List<String> statements) {
        return registry.register(name, statements, null);
    }

    /**
     * Adds an operation, replacing any operation with the same name.
     *
     * @param name
     * @param statements
     * @param parameterNames explicit formal parameters, may be {@code null}
     * @return
     * @see QueryDefinition#of(String, List, List)
     */
    public QueryDefinition register(final String name, final List<String> statements, final List<String> parameterNames) {
        return registry.register(name, statements, parameterNames);
    }

    /**
     * Executes an operation with positional arguments.
     *
     * @param name
     * @param args assigned to the formal parameters in order
     * @return the mapped rows of the last statement, empty if it produced no result set
     * @throws IllegalArgumentException if there is no operation with that name
     * @throws QueryArgumentException
     * @throws MissingInterpolationValueException
     * @throws SQLException
     */
    public List<T> call(final String name, final Object... args)
            throws IllegalArgumentException, QueryArgumentException, MissingInterpolationValueException, SQLException {
        return call(name, Collections.<String, Object> emptyMap(), args);
    }

    /**
     * Executes an operation. Positional arguments fill the formal parameters first, keywords supply the rest by name,
     * as well as the values of {@code %(name)s} substitutions.
     *
     * @param name
     * @param keywords
     * @param args
     * @return the mapped rows of the last statement, empty if it produced no result set
     * @throws IllegalArgumentException if there is no operation with that name
     * @throws QueryArgumentException if the arguments do not match the formal parameters; nothing is executed
     * @throws MissingInterpolationValueException if a substitution has no value; nothing is executed
     * @throws SQLException from the driver
     */
    public List<T> call(final String name, final Map<String, ?> keywords, final Object... args)
            throws IllegalArgumentException, QueryArgumentException, MissingInterpolationValueException, SQLException {
        return executor.execute(registry.get(name), rowMapper, keywords, args);
    }

    /**
     * Returns the operation as a callable. The definition is looked up on each call, so a later
     * {@link #register} of the same name is picked up.
     *
     * @param name
     * @return
     * @throws IllegalArgumentException if there is no operation with that name
     */
    public Query<T> query(final String name) throws IllegalArgumentException {
        registry.get(name);

        return new Query<>(this, name);
    }

    public Set<String> names() {
        return registry.names();
    }

    public boolean contains(final String name) {
        return registry.contains(name);
    }

    QueryRegistry registry() {
        return registry;
    }

    public DbHandle handle() {
        return handle;
    }

    public ParamStyle paramStyle() {
        return executor.paramStyle();
    }

    /**
     * The cursor shared by all operations. After a call it reflects the last statement executed.
     *
     * @return
     */
    public Cursor cursor() {
        return executor.cursor();
    }

    /**
     *
     * @return
     * @see #beginTransaction(IsolationLevel)
     */
    public SqlTransaction beginTransaction() throws TransactionStateException, UncheckedSQLException {
        return beginTransaction(IsolationLevel.DEFAULT);
    }

    /**
     * Starts a transaction on the handle. Commit or roll it back explicitly, or close it to roll back what is not
     * committed.
     *
     * <pre>{@code
     * try (SqlTransaction tran = db.beginTransaction(IsolationLevel.SERIALIZABLE)) {
     *     db.call("debit", from, amount);
     *     db.call("credit", to, amount);
     *     tran.commit();
     * }
     * }</pre>
     *
     * @param isolationLevel
     * @return
     * @throws TransactionStateException if a transaction is already active on the handle
     * @throws UncheckedSQLException
     */
    public SqlTransaction beginTransaction(final IsolationLevel isolationLevel) throws TransactionStateException, UncheckedSQLException {
        return SqlTransaction.begin(handle, isolationLevel);
    }

    public boolean isInTransaction() {
        return SqlTransaction.getTransaction(handle) != null;
    }

    /**
     * Runs {@code cmd} in a transaction. The transaction commits if {@code cmd} returns normally; on any exception it
     * is rolled back and the exception is rethrown as it is.
     *
     * @param <R>
     * @param <E>
     * @param cmd
     * @return the result of {@code cmd}
     * @throws E
     * @throws RollbackException if the rollback fails; the exception of {@code cmd} is its original exception
     * @throws TransactionStateException if a transaction is already active on the handle
     */
    public <R, E extends Throwable> R callInTransaction(final Throwables.Callable<R, E> cmd) throws E {
        N.checkArgNotNull(cmd, "cmd");

        final SqlTransaction tran = beginTransaction();
        final R result;

        try {
            result = cmd.call();
        } catch (final Throwable e) {
            tran.rollbackOnFailure(e);
            throw e;
        }

        tran.commit();

        return result;
    }

    /**
     *
     * @param <R>
     * @param <E>
     * @param cmd receives this database
     * @return
     * @throws E
     * @see #callInTransaction(Throwables.Callable)
     */
    public <R, E extends Throwable> R callInTransaction(final Throwables.Function<? super Database<T>, R, E> cmd) throws E {
        N.checkArgNotNull(cmd, "cmd");

        return callInTransaction(() -> cmd.apply(this));
    }

    /**
     *
     * @param <E>
     * @param cmd
     * @throws E
     * @see #callInTransaction(Throwables.Callable)
     */
    public <E extends Throwable> void runInTransaction(final Throwables.Runnable<E> cmd) throws E {
        N.checkArgNotNull(cmd, "cmd");

        callInTransaction(() -> {
            cmd.run();
            return null;
        });
    }

    /**
     *
     * @param <E>
     * @param cmd receives this database
     * @throws E
     * @see #callInTransaction(Throwables.Callable)
     */
    public <E extends Throwable> void runInTransaction(final Throwables.Consumer<? super Database<T>, E> cmd) throws E {
        N.checkArgNotNull(cmd, "cmd");

        callInTransaction(() -> {
            cmd.accept(this);
            return null;
        });
    }

    /**
     * Commits work done outside of a transaction.
     *
     * @throws TransactionStateException if a transaction is active; it must be committed through its scope
     * @throws SQLException
     */
    public void commit() throws TransactionStateException, SQLException {
        assertNotInTransaction("commit");

        handle.commit();
    }

    /**
     * Rolls back work done outside of a transaction.
     *
     * @throws TransactionStateException if a transaction is active; it must be rolled back through its scope
     * @throws SQLException
     */
    public void rollback() throws TransactionStateException, SQLException {
        assertNotInTransaction("rollback");

        handle.rollback();
    }

    private void assertNotInTransaction(final String action) {
        final SqlTransaction tran = SqlTransaction.getTransaction(handle);

        if (tran != null) {
            throw new TransactionStateException("Can not " + action + " while transaction(id=" + tran.id() + ") is active");
        }
    }

    /**
     * Closes the cursor and the handle. An active transaction is rolled back first. Otherwise, if the handle is not in
     * auto-commit mode, the work done since the last {@code commit()} is committed before the handle is closed.
     *
     * @throws SQLException
     */
    @Override
    public void close() throws SQLException {
        final SqlTransaction tran = SqlTransaction.getTransaction(handle);

        try {
            if (tran != null) {
                logger.warn("Closing database with active transaction(id={})", tran.id());
                tran.rollbackIfNotCommitted();
            } else if (!handle.getAutoCommit()) {
                logger.debug("Committing pending work before closing database");
                handle.commit();
            }
        } finally {
            try {
                executor.cursor().close();
            } finally {
                handle.close();
            }
        }
    }

    /**
     * Logs every executed statement in the current thread, at debug level on logger {@code com.landawn.sqlmap.SQL}.
     * Each line names the query, and the statement's position when the query has several, for example
     * {@code [SQL] create_user_and_count[2/3]: SELECT ...}.
     */
    public static void enableSqlLog() {
        enableSqlLog(QueryExecutor.DEFAULT_MAX_SQL_LOG_LENGTH);
    }

    /**
     *
     * @param maxSqlLogLength longer statements are abbreviated. A value {@code <= 0} keeps the current length
     */
    public static void enableSqlLog(final int maxSqlLogLength) {
        QueryExecutor.enableSqlLog(true, maxSqlLogLength);
    }

    public static void disableSqlLog() {
        QueryExecutor.enableSqlLog(false, 0);
    }

    public static boolean isSqlLogEnabled() {
        return QueryExecutor.logSettings_TL.get().sqlLogEnabled;
    }

    /**
     * Statements of the current thread running for at least {@code minExecutionTimeForSqlPerfLog} milliseconds are
     * logged at info level. A negative value turns it off.
     *
     * @param minExecutionTimeForSqlPerfLog
     */
    public static void setMinExecutionTimeForSqlPerfLog(final long minExecutionTimeForSqlPerfLog) {
        setMinExecutionTimeForSqlPerfLog(minExecutionTimeForSqlPerfLog, QueryExecutor.DEFAULT_MAX_SQL_LOG_LENGTH);
    }

    public static void setMinExecutionTimeForSqlPerfLog(final long minExecutionTimeForSqlPerfLog, final int maxSqlLogLength) {
        QueryExecutor.setMinExecutionTimeForSqlPerfLog(minExecutionTimeForSqlPerfLog, maxSqlLogLength);
    }

    public static long getMinExecutionTimeForSqlPerfLog() {
        return QueryExecutor.logSettings_TL.get().minExecutionTimeForSqlPerfLog;
    }

    /**
     * Sets a handler receiving every executed statement with its start and end time in milliseconds.
     *
     * @param sqlLogHandler {@code null} to remove the handler
     */
    public static void setSqlLogHandler(final TriConsumer<String, Long, Long> sqlLogHandler) {
        QueryExecutor.sqlLogHandler = sqlLogHandler;
    }

    public static TriConsumer<String, Long, Long> getSqlLogHandler() {
        return QueryExecutor.sqlLogHandler;
    }

    @Override
    public String toString() {
        return "Database{paramStyle=" + executor.paramStyle() + ", queries=" + registry.names() + "}";
    }
}

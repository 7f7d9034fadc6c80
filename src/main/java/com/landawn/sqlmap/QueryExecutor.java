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
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.util.Strings;
import com.landawn.abacus.util.function.TriConsumer;
import com.landawn.sqlmap.exception.MissingInterpolationValueException;
import com.landawn.sqlmap.exception.QueryArgumentException;

/**
 * Runs a {@link QueryDefinition} against a cursor.
 *
 * <p>Arguments are resolved and every statement is compiled and bound before the first statement executes, so an
 * argument error never leaves an operation half applied. Positional arguments fill the formal parameters left to
 * right, keywords fill them by name. A keyword may also name an unsafe substitution, or a placeholder that an unsafe
 * value introduced; such placeholders are resolved from the keywords, or from the formal parameter of the same
 * name.</p>
 */
final class QueryExecutor {

    static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

    static final Logger sqlLogger = LoggerFactory.getLogger("com.landawn.sqlmap.SQL");

    /**
     * Default maximum length of a logged statement.
     */
    static final int DEFAULT_MAX_SQL_LOG_LENGTH = 1024;

    /**
     * Default execution time, in milliseconds, from which a statement is logged as slow.
     */
    static final long DEFAULT_MIN_EXECUTION_TIME_FOR_SQL_PERF_LOG = 1000L;

    static final ThreadLocal<LogSettings> logSettings_TL = ThreadLocal.withInitial(LogSettings::new);

    static volatile TriConsumer<String, Long, Long> sqlLogHandler = null; //NOSONAR

    private final ParamStyle paramStyle;

    private final Cursor cursor;

    QueryExecutor(final ParamStyle paramStyle, final Cursor cursor) {
        this.paramStyle = paramStyle;
        this.cursor = cursor;
    }

    ParamStyle paramStyle() {
        return paramStyle;
    }

    Cursor cursor() {
        return cursor;
    }

    /**
     *
     * @param <T>
     * @param definition
     * @param rowMapper
     * @param keywords may be {@code null}
     * @param args positional arguments
     * @return the mapped rows of the last statement
     * @throws QueryArgumentException if the arguments do not match the formal parameters
     * @throws MissingInterpolationValueException if an unsafe substitution has no keyword
     * @throws SQLException from the driver, unchanged
     */
    <T> List<T> execute(final QueryDefinition definition, final RowMapper<? extends T> rowMapper, final Map<String, ?> keywords, final Object... args)
            throws QueryArgumentException, MissingInterpolationValueException, SQLException {
        final String name = definition.name();
        final List<String> formal = definition.parameters();
        final Map<String, ?> kw = keywords == null ? Collections.<String, Object> emptyMap() : keywords;
        final int argCount = args == null ? 0 : args.length;

        if (argCount > formal.size()) {
            throw new QueryArgumentException("Query '" + name + "' takes " + formal.size() + " positional argument(s) " + formal + " but " + argCount
                    + " were given");
        }

        final Map<String, Object> values = new LinkedHashMap<>(formal.size() + kw.size());

        for (int i = 0; i < argCount; i++) {
            values.put(formal.get(i), args[i]);
        }

        for (final String key : kw.keySet()) {
            if (values.containsKey(key)) {
                throw new QueryArgumentException("Query '" + name + "' got multiple values for parameter '" + key + "'");
            }
        }

        final List<StatementTemplate> templates = definition.templates();
        final List<CompiledStatement> compiled = new ArrayList<>(templates.size());
        final Set<String> formalSet = new HashSet<>(formal);
        final Set<String> dynamic = new LinkedHashSet<>();

        for (final StatementTemplate template : templates) {
            final CompiledStatement statement = template.compile(paramStyle, kw);

            for (final String identifier : statement.distinctParameters()) {
                if (!formalSet.contains(identifier)) {
                    dynamic.add(identifier);
                }
            }

            compiled.add(statement);
        }

        for (final Map.Entry<String, ?> entry : kw.entrySet()) {
            final String key = entry.getKey();

            if (formalSet.contains(key) || dynamic.contains(key)) {
                values.put(key, entry.getValue());
            } else if (!definition.unsafeNames().contains(key)) {
                throw new QueryArgumentException("Query '" + name + "' got an unexpected keyword argument '" + key + "'");
            }
        }

        for (final String parameter : formal) {
            if (!values.containsKey(parameter)) {
                throw new QueryArgumentException("Query '" + name + "' is missing a value for parameter '" + parameter + "'");
            }
        }

        for (final String identifier : dynamic) {
            if (!values.containsKey(identifier)) {
                throw new QueryArgumentException("Query '" + name + "' is missing a value for placeholder '" + identifier + "' introduced by unsafe substitution");
            }
        }

        final List<Bindings> bindings = new ArrayList<>(compiled.size());

        for (final CompiledStatement statement : compiled) {
            bindings.add(statement.bind(values));
        }

        if (logger.isDebugEnabled()) {
            logger.debug("Executing query '{}' with {} statement(s)", name, compiled.size());
        }

        final LogSettings settings = logSettings_TL.get();

        for (int i = 0, size = compiled.size(); i < size; i++) {
            execute(statementLabel(name, i + 1, size), compiled.get(i).driverText(), bindings.get(i), settings);
        }

        final List<Object[]> rows = cursor.fetchAll();
        final List<T> result = new ArrayList<>(rows.size());

        for (final Object[] row : rows) {
            result.add(rowMapper.apply(cursor, row));
        }

        return result;
    }

    private void execute(final String label, final String sql, final Bindings bindings, final LogSettings settings) throws SQLException {
        if (settings.sqlLogEnabled && sqlLogger.isDebugEnabled()) {
            sqlLogger.debug(Strings.concat("[SQL] ", label, ": ", settings.abbreviate(sql)));
        }

        final TriConsumer<String, Long, Long> handler = sqlLogHandler;
        final boolean perfLogEnabled = settings.minExecutionTimeForSqlPerfLog >= 0 && sqlLogger.isInfoEnabled();

        if (handler == null && !perfLogEnabled) {
            cursor.execute(sql, bindings);
            return;
        }

        final long startTime = System.currentTimeMillis();

        try {
            cursor.execute(sql, bindings);
        } finally {
            final long endTime = System.currentTimeMillis();

            if (perfLogEnabled && endTime - startTime >= settings.minExecutionTimeForSqlPerfLog) {
                sqlLogger.info(Strings.concat("[SQL-PERF] ", label, " took ", String.valueOf(endTime - startTime), " ms: ", settings.abbreviate(sql)));
            }

            if (handler != null) {
                handler.accept(sql, startTime, endTime);
            }
        }
    }

    /**
     * Names a statement in the SQL log: the query name, followed by {@code [index/count]} when the query runs more
     * than one statement.
     */
    static String statementLabel(final String queryName, final int index, final int count) {
        return count == 1 ? queryName : Strings.concat(queryName, "[", String.valueOf(index), "/", String.valueOf(count), "]");
    }

    static void enableSqlLog(final boolean b, final int maxSqlLogLength) {
        final LogSettings settings = logSettings_TL.get();

        if (logger.isDebugEnabled() && settings.sqlLogEnabled != b) {
            logger.debug(b ? "Turning on SQL log" : "Turning off SQL log");
        }

        settings.sqlLogEnabled = b;

        if (maxSqlLogLength > 0) {
            settings.maxSqlLogLength = maxSqlLogLength;
        }
    }

    static void setMinExecutionTimeForSqlPerfLog(final long minExecutionTimeForSqlPerfLog, final int maxSqlLogLength) {
        final LogSettings settings = logSettings_TL.get();

        if (logger.isDebugEnabled() && settings.minExecutionTimeForSqlPerfLog != minExecutionTimeForSqlPerfLog) {
            if (minExecutionTimeForSqlPerfLog >= 0) {
                logger.debug("set 'minExecutionTimeForSqlPerfLog' to: " + minExecutionTimeForSqlPerfLog);
            } else {
                logger.debug("Turning off SQL perf log");
            }
        }

        settings.minExecutionTimeForSqlPerfLog = minExecutionTimeForSqlPerfLog;

        if (maxSqlLogLength > 0) {
            settings.maxSqlLogLength = maxSqlLogLength;
        }
    }

    /**
     * SQL log settings of one thread. Statements longer than {@code maxSqlLogLength} are abbreviated in both logs.
     */
    static final class LogSettings {
        boolean sqlLogEnabled = false;
        int maxSqlLogLength = DEFAULT_MAX_SQL_LOG_LENGTH;
        long minExecutionTimeForSqlPerfLog = DEFAULT_MIN_EXECUTION_TIME_FOR_SQL_PERF_LOG;

        String abbreviate(final String sql) {
            return sql.length() <= maxSqlLogLength ? sql : Strings.abbreviate(sql, maxSqlLogLength);
        }
    }

    @Override
    public String toString() {
        return "QueryExecutor{paramStyle=" + paramStyle + "}";
    }
}

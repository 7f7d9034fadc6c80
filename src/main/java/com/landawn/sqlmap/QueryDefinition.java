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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

import com.landawn.abacus.util.N;
import com.landawn.sqlmap.exception.PositionalParameterException;
import com.landawn.sqlmap.exception.TemplateSyntaxException;
import com.landawn.sqlmap.exception.UnknownParameterException;

/**
 * The compiled, immutable form of one named operation: one or more statements executed in order, and the formal
 * parameters the operation exposes to callers.
 *
 * <p>Without an explicit parameter list the formal parameters are derived from the statements: positional markers
 * {@code _0, _1, ...} first, in index order, then named placeholders in first-seen order across all statements.
 * With an explicit list, the list is the formal parameters and it must declare every placeholder the statements use.</p>
 *
 * <pre>{@code
 * QueryDefinition def = QueryDefinition.of("create_user_returning_id",
 *         List.of("INSERT INTO users(name, password) VALUES(${username}, ${password})",
 *                 "SELECT MAX(id) AS id FROM users"),
 *         List.of("username", "password"));
 * }</pre>
 *
 * @see QueryRegistry
 */
public final class QueryDefinition {

    static final Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    private final String name;

    private final List<StatementTemplate> statements;

    private final List<String> parameters;

    private final boolean explicitParameters;

    private final Set<String> unsafeNames;

    private QueryDefinition(final String name, final List<StatementTemplate> statements, final List<String> parameters,
            final boolean explicitParameters, final Set<String> unsafeNames) {
        this.name = name;
        this.statements = Collections.unmodifiableList(statements);
        this.parameters = Collections.unmodifiableList(parameters);
        this.explicitParameters = explicitParameters;
        this.unsafeNames = Collections.unmodifiableSet(unsafeNames);
    }

    /**
     *
     * @param name
     * @param statement
     * @return
     * @see #of(String, List, List)
     */
    public static QueryDefinition of(final String name, final String statement) {
        N.checkArgNotNull(statement, "statement");

        return of(name, Collections.singletonList(statement), null);
    }

    /**
     *
     * @param name
     * @param statements
     * @return
     * @see #of(String, List, List)
     */
    public static QueryDefinition of(final String name, final List<String> statements) {
        return of(name, statements, null);
    }

    /**
     * Compiles an operation.
     *
     * @param name must match {@code [A-Za-z_][A-Za-z0-9_]*}
     * @param statements at least one statement
     * @param parameterNames explicit formal parameters, or {@code null} to derive them from the statements
     * @return
     * @throws IllegalArgumentException if the name is invalid, {@code statements} is empty or contains {@code null},
     *         or {@code parameterNames} contains a duplicate
     * @throws TemplateSyntaxException if a statement has malformed placeholder syntax
     * @throws UnknownParameterException if a statement uses a placeholder that {@code parameterNames} does not declare
     * @throws PositionalParameterException if positional markers are combined with {@code parameterNames} or do not
     *         form a contiguous run from {@code _0} within a statement
     */
    public static QueryDefinition of(final String name, final List<String> statements, final List<String> parameterNames)
            throws IllegalArgumentException, TemplateSyntaxException, UnknownParameterException, PositionalParameterException {
        N.checkArgNotNull(name, "name");
        N.checkArgument(NAME_PATTERN.matcher(name).matches(), "Invalid query name '%s'", name);
        N.checkArgNotEmpty(statements, "statements");

        final List<StatementTemplate> templates = new ArrayList<>(statements.size());
        final Set<String> unsafeNames = new LinkedHashSet<>();

        for (final String statement : statements) {
            N.checkArgument(statement != null, "Null statement in query '%s'", name);

            final StatementTemplate template = StatementTemplate.of(statement);

            checkPositionals(name, template, parameterNames != null);

            templates.add(template);
            unsafeNames.addAll(template.unsafeNames());
        }

        final List<String> parameters = parameterNames == null ? deriveParameters(templates) : checkDeclared(name, templates, parameterNames);

        return new QueryDefinition(name, templates, parameters, parameterNames != null, unsafeNames);
    }

    private static void checkPositionals(final String name, final StatementTemplate template, final boolean explicit) {
        final TreeSet<Integer> positions = new TreeSet<>();

        for (final String identifier : template.declaredIdentifiers()) {
            if (SqlTemplate.isPositional(identifier)) {
                positions.add(SqlTemplate.positionOf(identifier));
            }
        }

        if (positions.isEmpty()) {
            return;
        }

        if (explicit) {
            throw new PositionalParameterException("Query '" + name + "' declares parameter names, positional placeholders " + positions
                    + " are not allowed in: " + template.source());
        }

        if (positions.first() != 0 || positions.last() != positions.size() - 1) {
            throw new PositionalParameterException(
                    "Positional placeholders of query '" + name + "' must be contiguous from _0, found " + positions + " in: " + template.source());
        }
    }

    private static List<String> deriveParameters(final List<StatementTemplate> templates) {
        final TreeSet<Integer> positions = new TreeSet<>();
        final Set<String> named = new LinkedHashSet<>();

        for (final StatementTemplate template : templates) {
            for (final String identifier : template.declaredIdentifiers()) {
                if (SqlTemplate.isPositional(identifier)) {
                    positions.add(SqlTemplate.positionOf(identifier));
                } else {
                    named.add(identifier);
                }
            }
        }

        final List<String> result = new ArrayList<>(positions.size() + named.size());

        for (final Integer position : positions) {
            result.add("_" + position);
        }

        result.addAll(named);

        return result;
    }

    private static List<String> checkDeclared(final String name, final List<StatementTemplate> templates, final List<String> parameterNames) {
        final Set<String> declared = new LinkedHashSet<>(parameterNames.size());

        for (final String parameterName : parameterNames) {
            N.checkArgument(parameterName != null && SqlTemplate.isIdentifier(parameterName), "Invalid parameter name '%s' in query '%s'",
                    parameterName, name);

            if (!declared.add(parameterName)) {
                throw new IllegalArgumentException("Duplicate parameter name '" + parameterName + "' in query '" + name + "'");
            }
        }

        for (final StatementTemplate template : templates) {
            for (final String identifier : template.declaredIdentifiers()) {
                if (!declared.contains(identifier)) {
                    throw new UnknownParameterException(
                            "Placeholder '" + identifier + "' of query '" + name + "' is not in its parameter list " + parameterNames + ": " + template.source());
                }
            }
        }

        return new ArrayList<>(declared);
    }

    public String name() {
        return name;
    }

    /**
     * Formal parameters in the order positional call arguments are assigned to them.
     *
     * @return
     */
    public List<String> parameters() {
        return parameters;
    }

    public boolean hasExplicitParameters() {
        return explicitParameters;
    }

    /**
     * Names consumed by unsafe substitution in any statement.
     *
     * @return
     */
    public Set<String> unsafeNames() {
        return unsafeNames;
    }

    /**
     * Checks if any statement must be recompiled per call because it contains unsafe substitutions.
     *
     * @return
     */
    public boolean isDynamic() {
        return !unsafeNames.isEmpty();
    }

    /**
     * The statements as written, in execution order.
     *
     * @return
     */
    public List<String> statements() {
        final List<String> result = new ArrayList<>(statements.size());

        for (final StatementTemplate template : statements) {
            result.add(template.source());
        }

        return result;
    }

    public int statementCount() {
        return statements.size();
    }

    List<StatementTemplate> templates() {
        return statements;
    }

    @Override
    public String toString() {
        return "QueryDefinition{name=" + name + ", parameters=" + parameters + ", statements=" + statements + "}";
    }
}

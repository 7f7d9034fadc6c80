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
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.util.N;
import com.landawn.abacus.util.Strings;

/**
 * Named operations, by name. Definitions are added from a {@link ConfigSource} or registered one by one; registering
 * an existing name replaces its definition. A definition that fails to compile never enters the registry.
 *
 * <p>Reads are safe from any thread. Registration is expected from a single writer; a reader running concurrently
 * with a replacement may see either definition.</p>
 */
public final class QueryRegistry {

    private static final Logger logger = LoggerFactory.getLogger(QueryRegistry.class);

    static final String STATEMENTS = "statements";

    static final String QUERY = "query";

    static final String PARAMETERS = "parameters";

    private final Map<String, QueryDefinition> definitions = new ConcurrentHashMap<>();

    public QueryRegistry() {
    }

    /**
     * Creates a registry holding the operations of the {@code QUERIES} section.
     *
     * @param config
     * @return
     * @see #load(ConfigSource)
     */
    public static QueryRegistry of(final ConfigSource config) {
        final QueryRegistry registry = new QueryRegistry();

        registry.load(config);

        return registry;
    }

    /**
     * Registers every operation of the {@code QUERIES} section. Definitions are compiled before any of them is added,
     * so a malformed entry leaves the registry untouched.
     *
     * @param config
     * @throws IllegalArgumentException if the {@code QUERIES} section is missing or an entry has an unsupported shape
     * @see QueryDefinition#of(String, List, List)
     */
    public void load(final ConfigSource config) throws IllegalArgumentException {
        N.checkArgNotNull(config, "config");

        final ConfigSource queries = toSection(config.get(ConfigSource.QUERIES));

        if (queries == null) {
            throw new IllegalArgumentException("Missing or invalid '" + ConfigSource.QUERIES + "' section in configuration");
        }

        final List<QueryDefinition> loaded = new ArrayList<>();

        for (final String name : queries.keys()) {
            loaded.add(parseEntry(name, queries.get(name)));
        }

        for (final QueryDefinition definition : loaded) {
            register(definition);
        }
    }

    /**
     * Compiles and registers an operation, replacing any operation with the same name.
     *
     * @param name
     * @param statements
     * @param parameterNames explicit formal parameters, may be {@code null}
     * @return the registered definition
     * @see QueryDefinition#of(String, List, List)
     */
    public QueryDefinition register(final String name, final List<String> statements, final List<String> parameterNames) {
        return register(QueryDefinition.of(name, statements, parameterNames));
    }

    /**
     *
     * @param definition
     * @return the same definition
     */
    public QueryDefinition register(final QueryDefinition definition) {
        N.checkArgNotNull(definition, "definition");

        final QueryDefinition previous = definitions.put(definition.name(), definition);

        if (previous != null) {
            logger.debug("Replaced query '{}'", definition.name());
        } else {
            logger.debug("Registered query '{}' with parameters {}", definition.name(), definition.parameters());
        }

        return definition;
    }

    /**
     *
     * @param name
     * @return
     * @throws IllegalArgumentException if no operation has that name
     */
    public QueryDefinition get(final String name) throws IllegalArgumentException {
        final QueryDefinition definition = name == null ? null : definitions.get(name);

        if (definition == null) {
            throw new IllegalArgumentException("unknown query '" + name + "'");
        }

        return definition;
    }

    public boolean contains(final String name) {
        return name != null && definitions.containsKey(name);
    }

    /**
     * Registered names, sorted.
     *
     * @return
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(definitions.keySet()));
    }

    public int size() {
        return definitions.size();
    }

    static QueryDefinition parseEntry(final String name, final Object value) throws IllegalArgumentException {
        if (value instanceof String) {
            return QueryDefinition.of(name, (String) value);
        }

        if (value instanceof List) {
            return QueryDefinition.of(name, toStrings(name, STATEMENTS, value), null);
        }

        final ConfigSource section = toSection(value);

        if (section == null) {
            throw new IllegalArgumentException("invalid query specification for '" + name + "'");
        }

        Object statements = section.get(STATEMENTS);

        if (statements == null) {
            statements = section.get(QUERY);
        }

        if (statements == null) {
            throw new IllegalArgumentException("invalid query specification for '" + name + "': no '" + STATEMENTS + "' or '" + QUERY + "' entry");
        }

        final Object parameters = section.get(PARAMETERS);

        return QueryDefinition.of(name, statements instanceof String ? Collections.singletonList((String) statements) : toStrings(name, STATEMENTS, statements),
                parameters == null ? null : toParameterNames(name, parameters));
    }

    @SuppressWarnings("unchecked")
    private static ConfigSource toSection(final Object value) {
        if (value instanceof ConfigSource) {
            return (ConfigSource) value;
        } else if (value instanceof Map) {
            return ConfigSource.of((Map<String, ?>) value);
        } else {
            return null;
        }
    }

    private static List<String> toParameterNames(final String name, final Object value) {
        if (value instanceof String) {
            final List<String> result = new ArrayList<>();

            for (final String token : ((String) value).trim().split("\\s+")) {
                if (Strings.isNotEmpty(token)) {
                    result.add(token);
                }
            }

            return result;
        }

        return toStrings(name, PARAMETERS, value);
    }

    private static List<String> toStrings(final String name, final String entry, final Object value) {
        if (!(value instanceof List)) {
            throw new IllegalArgumentException("invalid query specification for '" + name + "': '" + entry + "' must be a string or a list of strings");
        }

        final List<?> list = (List<?>) value;
        final List<String> result = new ArrayList<>(list.size());

        for (final Object element : list) {
            if (!(element instanceof String)) {
                throw new IllegalArgumentException("invalid query specification for '" + name + "': '" + entry + "' must only contain strings");
            }

            result.add((String) element);
        }

        return result;
    }

    @Override
    public String toString() {
        return "QueryRegistry" + names();
    }
}

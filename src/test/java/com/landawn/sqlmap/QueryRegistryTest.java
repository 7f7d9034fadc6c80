package com.landawn.sqlmap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.landawn.sqlmap.exception.TemplateSyntaxException;
import com.landawn.sqlmap.exception.UnknownParameterException;

public class QueryRegistryTest extends TestBase {

    private static ConfigSource config(final Map<String, Object> queries) {
        return ConfigSource.of(kw(ConfigSource.QUERIES, queries));
    }

    @Test
    public void testLoadEntryShapes() {
        final Map<String, Object> queries = new LinkedHashMap<>();
        queries.put("create_table", "CREATE TABLE users(name VARCHAR(64) PRIMARY KEY, password VARCHAR(64))");
        queries.put("create_user_returning", Arrays.asList("INSERT INTO users VALUES(${name}, ${password})", "SELECT * FROM users WHERE name = ${name}"));
        queries.put("create_user", kw("statements", Collections.singletonList("INSERT INTO users(name, password) VALUES(${username}, ${password})"),
                "parameters", Arrays.asList("username", "password")));
        queries.put("find_user", kw("query", "SELECT * FROM users WHERE name = ${name} AND password = ${password}", "parameters", "password name"));
        queries.put("list_users", ConfigSource.of(kw("statements", "SELECT * FROM users ORDER BY name")));

        final QueryRegistry registry = QueryRegistry.of(config(queries));

        assertEquals(5, registry.size());
        assertEquals(1, registry.get("create_table").statementCount());
        assertEquals(2, registry.get("create_user_returning").statementCount());
        assertEquals(Arrays.asList("name", "password"), registry.get("create_user_returning").parameters());
        assertEquals(Arrays.asList("username", "password"), registry.get("create_user").parameters());
        assertEquals(Arrays.asList("password", "name"), registry.get("find_user").parameters());
        assertTrue(registry.get("list_users").parameters().isEmpty());
    }

    @Test
    public void testNames() {
        final QueryRegistry registry = QueryRegistry.of(config(kw("list_users", "SELECT * FROM users", "create_table", "CREATE TABLE users(name VARCHAR(64))")));

        assertEquals(Arrays.asList("create_table", "list_users"), Arrays.asList(registry.names().toArray()));
        assertTrue(registry.contains("list_users"));
        assertFalse(registry.contains("drop_users"));
        assertFalse(registry.contains(null));
    }

    @Test
    public void testMissingQueriesSection() {
        assertThrows(IllegalArgumentException.class, () -> QueryRegistry.of(ConfigSource.of(kw("queries", kw()))));
        assertThrows(IllegalArgumentException.class, () -> QueryRegistry.of(ConfigSource.of(kw("QUERIES", "SELECT 1"))));
    }

    @Test
    public void testEmptyQueriesSection() {
        assertEquals(0, QueryRegistry.of(config(kw())).size());
    }

    @Test
    public void testInvalidEntries() {
        assertThrows(IllegalArgumentException.class, () -> QueryRegistry.of(config(kw("count", 42))));
        assertThrows(IllegalArgumentException.class, () -> QueryRegistry.of(config(kw("mixed", Arrays.asList("SELECT 1", 2)))));
        assertThrows(IllegalArgumentException.class, () -> QueryRegistry.of(config(kw("no_statements", kw("parameters", Arrays.asList("a"))))));
        assertThrows(IllegalArgumentException.class, () -> QueryRegistry.of(config(kw("bad name", "SELECT 1"))));
        assertThrows(TemplateSyntaxException.class, () -> QueryRegistry.of(config(kw("broken", "SELECT ${name"))));
        assertThrows(UnknownParameterException.class,
                () -> QueryRegistry.of(config(kw("undeclared", kw("statements", "SELECT ${a}, ${b}", "parameters", Arrays.asList("a"))))));
    }

    @Test
    public void testFailedLoadLeavesRegistryUntouched() {
        final QueryRegistry registry = new QueryRegistry();
        registry.register("list_users", Collections.singletonList("SELECT * FROM users"), null);

        final Map<String, Object> queries = new LinkedHashMap<>();
        queries.put("list_users", "SELECT name FROM users");
        queries.put("broken", "SELECT ${name");

        assertThrows(TemplateSyntaxException.class, () -> registry.load(config(queries)));

        assertEquals(1, registry.size());
        assertEquals(Collections.singletonList("SELECT * FROM users"), registry.get("list_users").statements());
    }

    @Test
    public void testRegisterReplaces() {
        final QueryRegistry registry = new QueryRegistry();
        final QueryDefinition first = registry.register("list_users", Collections.singletonList("SELECT * FROM users"), null);
        final QueryDefinition second = registry.register(QueryDefinition.of("list_users", "SELECT name FROM users"));

        assertNotSame(first, second);
        assertSame(second, registry.get("list_users"));
        assertEquals(1, registry.size());
    }

    @Test
    public void testFailedRegistrationDoesNotReplace() {
        final QueryRegistry registry = new QueryRegistry();
        final QueryDefinition first = registry.register("find", Collections.singletonList("SELECT * FROM users WHERE name = ${name}"), null);

        assertThrows(TemplateSyntaxException.class, () -> registry.register("find", Collections.singletonList("SELECT * FROM users WHERE name = ${name"), null));

        assertSame(first, registry.get("find"));
    }

    @Test
    public void testUnknownQuery() {
        final IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> new QueryRegistry().get("drop_users"));

        assertTrue(e.getMessage().contains("unknown query 'drop_users'"));
    }
}

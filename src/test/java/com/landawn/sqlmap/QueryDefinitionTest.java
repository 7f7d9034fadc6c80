package com.landawn.sqlmap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import com.landawn.sqlmap.exception.PositionalParameterException;
import com.landawn.sqlmap.exception.TemplateSyntaxException;
import com.landawn.sqlmap.exception.UnknownParameterException;

public class QueryDefinitionTest extends TestBase {

    @Test
    public void testDerivedParameters() {
        final QueryDefinition def = QueryDefinition.of("create_user_returning_id",
                Arrays.asList("INSERT INTO users(name, password) VALUES(${name}, ${password})", "SELECT id FROM users WHERE name = ${name} AND kind = ${kind}"));

        assertEquals("create_user_returning_id", def.name());
        assertEquals(Arrays.asList("name", "password", "kind"), def.parameters());
        assertFalse(def.hasExplicitParameters());
        assertFalse(def.isDynamic());
        assertEquals(2, def.statementCount());
        assertEquals(Arrays.asList("INSERT INTO users(name, password) VALUES(${name}, ${password})",
                "SELECT id FROM users WHERE name = ${name} AND kind = ${kind}"), def.statements());
    }

    @Test
    public void testPositionalParametersComeFirst() {
        final QueryDefinition def = QueryDefinition.of("find", "SELECT * FROM users WHERE kind = ${kind} AND age > ${_1} AND name = ${_0}");

        assertEquals(Arrays.asList("_0", "_1", "kind"), def.parameters());
    }

    @Test
    public void testExplicitParameters() {
        final QueryDefinition def = QueryDefinition.of("create_user", Collections.singletonList("INSERT INTO users(name, password) VALUES(${password}, ${username})"),
                Arrays.asList("username", "password", "comment"));

        assertEquals(Arrays.asList("username", "password", "comment"), def.parameters());
        assertTrue(def.hasExplicitParameters());
    }

    @Test
    public void testExplicitParametersMustCoverPlaceholders() {
        final UnknownParameterException e = assertThrows(UnknownParameterException.class,
                () -> QueryDefinition.of("create_user", Collections.singletonList("INSERT INTO users(name, password) VALUES(${username}, ${password})"),
                        Collections.singletonList("username")));

        assertTrue(e.getMessage().contains("'password'"));
    }

    @Test
    public void testExplicitParametersExcludePositionals() {
        assertThrows(PositionalParameterException.class,
                () -> QueryDefinition.of("find", Collections.singletonList("SELECT * FROM users WHERE name = ${_0}"), Arrays.asList("_0", "name")));
    }

    @Test
    public void testPositionalsMustBeContiguous() {
        assertThrows(PositionalParameterException.class, () -> QueryDefinition.of("find", "SELECT * FROM users WHERE name = ${_1}"));
        assertThrows(PositionalParameterException.class, () -> QueryDefinition.of("find", "SELECT * FROM users WHERE name = ${_0} AND age > ${_2}"));

        assertEquals(Arrays.asList("_0", "_1"), QueryDefinition.of("find", "SELECT ${_1}, ${_0}, ${_0}").parameters());
    }

    @Test
    public void testPositionalsAreCheckedPerStatement() {
        assertThrows(PositionalParameterException.class,
                () -> QueryDefinition.of("find", Arrays.asList("SELECT * FROM users WHERE name = ${_0}", "SELECT * FROM roles WHERE id = ${_1}")));
    }

    @Test
    public void testInvalidExplicitParameters() {
        assertThrows(IllegalArgumentException.class,
                () -> QueryDefinition.of("find", Collections.singletonList("SELECT * FROM users WHERE name = ${name}"), Arrays.asList("name", "name")));
        assertThrows(IllegalArgumentException.class,
                () -> QueryDefinition.of("find", Collections.singletonList("SELECT * FROM users WHERE name = ${name}"), Arrays.asList("name", "two words")));
    }

    @Test
    public void testInvalidName() {
        assertThrows(IllegalArgumentException.class, () -> QueryDefinition.of("1st", "SELECT 1"));
        assertThrows(IllegalArgumentException.class, () -> QueryDefinition.of("list-users", "SELECT 1"));
        assertThrows(IllegalArgumentException.class, () -> QueryDefinition.of("", "SELECT 1"));
        assertThrows(IllegalArgumentException.class, () -> QueryDefinition.of(null, "SELECT 1"));

        assertEquals("_list_users2", QueryDefinition.of("_list_users2", "SELECT 1").name());
    }

    @Test
    public void testInvalidStatements() {
        assertThrows(IllegalArgumentException.class, () -> QueryDefinition.of("empty", Collections.emptyList()));
        assertThrows(IllegalArgumentException.class, () -> QueryDefinition.of("nulls", Arrays.asList("SELECT 1", null)));
        assertThrows(TemplateSyntaxException.class, () -> QueryDefinition.of("broken", "SELECT * FROM users WHERE name = ${name"));
    }

    @Test
    public void testUnsafeNames() {
        final QueryDefinition def = QueryDefinition.of("list_users",
                Arrays.asList("SELECT * FROM users WHERE %(predicate)s ORDER BY name %(order)s", "SELECT COUNT(*) FROM users ORDER BY 1 %(order)s"));

        assertTrue(def.isDynamic());
        assertEquals(Arrays.asList("predicate", "order"), Arrays.asList(def.unsafeNames().toArray()));
        assertTrue(def.parameters().isEmpty());
    }

    @Test
    public void testImmutable() {
        final QueryDefinition def = QueryDefinition.of("find", "SELECT * FROM users WHERE name = ${name}");

        assertThrows(UnsupportedOperationException.class, () -> def.parameters().add("x"));
    }
}

package com.landawn.sqlmap;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import org.junit.jupiter.api.Test;

public class RowMapperTest extends TestBase {

    @Test
    public void testToMap() throws SQLException {
        final Cursor cursor = mock(Cursor.class);
        when(cursor.columnLabels()).thenReturn(Arrays.asList("password", "name"));

        final Map<String, Object> row = RowMapper.TO_MAP.apply(cursor, new Object[] { "iamthenight", "bruce" });

        assertEquals(kw("password", "iamthenight", "name", "bruce"), row);
        assertEquals(Arrays.asList("password", "name"), new ArrayList<>(row.keySet()));
    }

    @Test
    public void testToMapWithoutLabels() throws SQLException {
        final Cursor cursor = mock(Cursor.class);
        when(cursor.columnLabels()).thenReturn(Collections.emptyList());

        assertEquals(kw("1", "a", "2", "b"), RowMapper.TO_MAP.apply(cursor, new Object[] { "a", "b" }));
    }

    @Test
    public void testToListAndArray() throws SQLException {
        final Cursor cursor = mock(Cursor.class);
        final Object[] row = { 1, null, "x" };

        assertEquals(Arrays.asList(1, null, "x"), RowMapper.TO_LIST.apply(cursor, row));
        assertArrayEquals(row, RowMapper.TO_ARRAY.apply(cursor, row));
    }
}

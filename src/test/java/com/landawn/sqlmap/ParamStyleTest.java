package com.landawn.sqlmap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.junit.jupiter.api.Test;

public class ParamStyleTest extends TestBase {

    private static final String SQL = "SELECT * FROM t WHERE a = ${a} AND b = ${b} OR a = ${a}";

    @Test
    public void testOf() {
        assertEquals(ParamStyle.QMARK, ParamStyle.of("qmark"));
        assertEquals(ParamStyle.NUMERIC, ParamStyle.of("numeric"));
        assertEquals(ParamStyle.NAMED, ParamStyle.of("named"));
        assertEquals(ParamStyle.FORMAT, ParamStyle.of("format"));
        assertEquals(ParamStyle.PYFORMAT, ParamStyle.of(" PyFormat "));

        assertThrows(IllegalArgumentException.class, () -> ParamStyle.of("dollar"));
        assertThrows(IllegalArgumentException.class, () -> ParamStyle.of(null));
    }

    @Test
    public void testParamStyleName() {
        for (final ParamStyle style : ParamStyle.values()) {
            assertEquals(style, ParamStyle.of(style.paramStyleName()));
        }
    }

    @Test
    public void testCompile() {
        final SqlTemplate template = SqlTemplate.parse(SQL);

        assertEquals("SELECT * FROM t WHERE a = ? AND b = ? OR a = ?", ParamStyle.QMARK.compile(template).driverText());
        assertEquals("SELECT * FROM t WHERE a = :1 AND b = :2 OR a = :1", ParamStyle.NUMERIC.compile(template).driverText());
        assertEquals("SELECT * FROM t WHERE a = :a AND b = :b OR a = :a", ParamStyle.NAMED.compile(template).driverText());
        assertEquals("SELECT * FROM t WHERE a = %s AND b = %s OR a = %s", ParamStyle.FORMAT.compile(template).driverText());
        assertEquals("SELECT * FROM t WHERE a = %(a)s AND b = %(b)s OR a = %(a)s", ParamStyle.PYFORMAT.compile(template).driverText());

        for (final ParamStyle style : ParamStyle.values()) {
            final CompiledStatement compiled = style.compile(template);

            assertEquals(style, compiled.paramStyle());
            assertEquals(SQL, compiled.rawText());
            assertEquals(Arrays.asList("a", "b", "a"), compiled.paramOrder());
            assertEquals(Arrays.asList("a", "b"), compiled.distinctParameters());
        }
    }

    @Test
    public void testNoPlaceholders() {
        final String sql = "SELECT * FROM users WHERE name LIKE 'b%' AND note = '$'";
        final SqlTemplate template = SqlTemplate.parse(sql);

        for (final ParamStyle style : ParamStyle.values()) {
            final CompiledStatement compiled = style.compile(template);

            assertEquals(sql, compiled.driverText());
            assertTrue(compiled.paramOrder().isEmpty());
            assertTrue(compiled.bind(Collections.<String, Object> emptyMap()).isEmpty());
        }
    }

    @Test
    public void testRepeatedPlaceholderIsSuppliedOnce() {
        final SqlTemplate template = SqlTemplate.parse(SQL);
        final Map<String, Object> values = kw("a", 1, "b", 2);

        assertEquals(Bindings.positional(Arrays.asList(1, 2, 1)), ParamStyle.QMARK.compile(template).bind(values));
        assertEquals(Bindings.positional(Arrays.asList(1, 2, 1)), ParamStyle.FORMAT.compile(template).bind(values));
        assertEquals(Bindings.positional(Arrays.asList(1, 2)), ParamStyle.NUMERIC.compile(template).bind(values));
        assertEquals(Bindings.named(kw("a", 1, "b", 2)), ParamStyle.NAMED.compile(template).bind(values));
        assertEquals(Bindings.named(kw("a", 1, "b", 2)), ParamStyle.PYFORMAT.compile(template).bind(values));
    }

    @Test
    public void testBindingCountMatchesOccurrences() {
        final SqlTemplate template = SqlTemplate.parse(SQL);

        for (final ParamStyle style : ParamStyle.values()) {
            final Bindings bindings = style.compile(template).bind(kw("a", 1, "b", 2));

            assertEquals(style.bindsPerOccurrence() ? 3 : 2, bindings.size());
            assertEquals(style.isNamed(), bindings.isNamed());
        }
    }

    @Test
    public void testSameQueryUnderEveryStyle() {
        final SqlTemplate template = SqlTemplate.parse(SQL);
        final String expected = "SELECT * FROM t WHERE a = 1 AND b = 2 OR a = 1";

        for (final ParamStyle style : ParamStyle.values()) {
            final CompiledStatement compiled = style.compile(template);

            assertEquals(expected, inline(style, compiled.driverText(), compiled.bind(kw("b", 2, "a", 1))), style.name());
        }
    }

    @Test
    public void testIsNamed() {
        assertFalse(ParamStyle.QMARK.isNamed());
        assertFalse(ParamStyle.NUMERIC.isNamed());
        assertTrue(ParamStyle.NAMED.isNamed());
        assertFalse(ParamStyle.FORMAT.isNamed());
        assertTrue(ParamStyle.PYFORMAT.isNamed());
    }

    /**
     * Substitutes the bindings back into the native text, the way each driver family would.
     */
    private static String inline(final ParamStyle style, final String sql, final Bindings bindings) {
        switch (style) {
            case QMARK:
                return replaceSequential(sql, "\\?", bindings.positional());

            case FORMAT:
                return replaceSequential(sql, "%s", bindings.positional());

            case NUMERIC:
                return replace(sql, Pattern.compile(":(\\d+)"), m -> String.valueOf(bindings.positional().get(Integer.parseInt(m.group(1)) - 1)));

            case NAMED:
                return replace(sql, Pattern.compile(":([A-Za-z_]\\w*)"), m -> String.valueOf(bindings.named().get(m.group(1))));

            case PYFORMAT:
                return replace(sql, Pattern.compile("%\\((\\w+)\\)s"), m -> String.valueOf(bindings.named().get(m.group(1))));

            default:
                throw new IllegalArgumentException(style.name());
        }
    }

    private static String replaceSequential(final String sql, final String marker, final List<Object> values) {
        final int[] index = { 0 };

        return replace(sql, Pattern.compile(marker), m -> String.valueOf(values.get(index[0]++)));
    }

    private static String replace(final String sql, final Pattern pattern, final java.util.function.Function<Matcher, String> replacement) {
        final Matcher matcher = pattern.matcher(sql);
        final StringBuilder sb = new StringBuilder();

        while (matcher.find()) {
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement.apply(matcher)));
        }

        matcher.appendTail(sb);

        return sb.toString();
    }
}

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

import com.landawn.abacus.util.N;
import com.landawn.sqlmap.exception.TemplateSyntaxException;

/**
 * A SQL statement split around its safe placeholders.
 *
 * <p>Safe placeholders are written {@code ${identifier}}, where the identifier is either a name
 * ({@code [A-Za-z_][A-Za-z0-9_]*}) or a positional marker {@code _0}, {@code _1}, ... Values are never inlined:
 * each occurrence becomes a driver bind marker, see {@link ParamStyle#compile(SqlTemplate)}.
 * {@code $$} is an escaped {@code $}; a {@code $} followed by anything else is kept literally.</p>
 *
 * <p>The parsed form keeps {@code n + 1} text segments around {@code n} placeholder occurrences:
 * segment {@code i} precedes occurrence {@code i}, and the last segment follows the last occurrence.
 * Occurrences are kept in textual order with duplicates.</p>
 *
 * <pre>{@code
 * SqlTemplate t = SqlTemplate.parse("SELECT * FROM users WHERE name = ${name} OR alias = ${name}");
 * t.identifiers(); // [name, name]
 * t.segments();    // ["SELECT * FROM users WHERE name = ", " OR alias = ", ""]
 * }</pre>
 */
public final class SqlTemplate {

    private final String text;

    private final List<String> segments;

    private final List<String> identifiers;

    private SqlTemplate(final String text, final List<String> segments, final List<String> identifiers) {
        this.text = text;
        this.segments = Collections.unmodifiableList(segments);
        this.identifiers = Collections.unmodifiableList(identifiers);
    }

    /**
     * Parses the safe placeholders of the specified text.
     *
     * @param text the statement, after unsafe interpolation
     * @return
     * @throws TemplateSyntaxException if a {@code ${} is unterminated or does not enclose a valid identifier
     */
    public static SqlTemplate parse(final String text) throws TemplateSyntaxException {
        N.checkArgNotNull(text, "text");

        final int len = text.length();
        final List<String> segments = new ArrayList<>();
        final List<String> identifiers = new ArrayList<>();
        final StringBuilder sb = new StringBuilder(len);

        int i = 0;

        while (i < len) {
            final char ch = text.charAt(i);

            if (ch != '$' || i + 1 >= len) {
                sb.append(ch);
                i++;
                continue;
            }

            final char next = text.charAt(i + 1);

            if (next == '$') {
                sb.append('$');
                i += 2;
            } else if (next == '{') {
                final int close = text.indexOf('}', i + 2);

                if (close < 0) {
                    throw new TemplateSyntaxException("Unterminated placeholder", text, i);
                }

                final String identifier = text.substring(i + 2, close);

                if (!isIdentifier(identifier)) {
                    throw new TemplateSyntaxException("Invalid placeholder identifier '" + identifier + "'", text, i);
                }

                segments.add(sb.toString());
                sb.setLength(0);
                identifiers.add(identifier);

                i = close + 1;
            } else {
                sb.append(ch);
                i++;
            }
        }

        segments.add(sb.toString());

        return new SqlTemplate(text, segments, identifiers);
    }

    /**
     * Checks if the specified identifier is a positional marker: an underscore followed by a zero-based index
     * without leading zeros.
     *
     * @param identifier
     * @return
     */
    public static boolean isPositional(final String identifier) {
        final int len = identifier == null ? 0 : identifier.length();

        if (len < 2 || identifier.charAt(0) != '_') {
            return false;
        }

        if (identifier.charAt(1) == '0') {
            return len == 2;
        }

        for (int i = 1; i < len; i++) {
            final char ch = identifier.charAt(i);

            if (ch < '0' || ch > '9') {
                return false;
            }
        }

        return true;
    }

    /**
     * Returns the index of a positional marker, for example {@code 2} for {@code _2}.
     *
     * @param identifier
     * @return
     * @throws IllegalArgumentException if the identifier is not positional
     */
    public static int positionOf(final String identifier) throws IllegalArgumentException {
        N.checkArgument(isPositional(identifier), "'%s' is not a positional identifier", identifier);

        return Integer.parseInt(identifier.substring(1));
    }

    static boolean isIdentifier(final String str) {
        final int len = str.length();

        if (len == 0 || !(Character.isLetter(str.charAt(0)) && str.charAt(0) < 128 || str.charAt(0) == '_')) {
            return false;
        }

        for (int i = 1; i < len; i++) {
            final char ch = str.charAt(i);

            if (!(ch < 128 && (Character.isLetterOrDigit(ch) || ch == '_'))) {
                return false;
            }
        }

        return true;
    }

    /**
     * The text this template was parsed from.
     *
     * @return
     */
    public String text() {
        return text;
    }

    /**
     * Literal text around the placeholders, {@code identifiers().size() + 1} entries.
     * Escaped {@code $$} are already reduced to {@code $}.
     *
     * @return
     */
    public List<String> segments() {
        return segments;
    }

    /**
     * Placeholder identifiers in textual order, one entry per occurrence.
     *
     * @return
     */
    public List<String> identifiers() {
        return identifiers;
    }

    /**
     * Distinct placeholder identifiers in first-seen order.
     *
     * @return
     */
    public Set<String> distinctIdentifiers() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(identifiers));
    }

    public boolean hasPlaceholders() {
        return !identifiers.isEmpty();
    }

    @Override
    public String toString() {
        return text;
    }
}

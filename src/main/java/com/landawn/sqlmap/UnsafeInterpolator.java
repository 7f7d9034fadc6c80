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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.landawn.abacus.util.N;
import com.landawn.sqlmap.exception.MissingInterpolationValueException;
import com.landawn.sqlmap.exception.TemplateSyntaxException;

/**
 * First, <b>unsafe</b> substitution pass applied to a SQL template before its safe placeholders are parsed.
 *
 * <p>References are written {@code %(name)s} and are replaced by the text of the supplied value, verbatim:
 * nothing is quoted or escaped. It exists for the structural parts of a statement that drivers can not bind
 * (sort direction, column or table names, whole predicates). The substituted text is parsed afterwards, so a value
 * may itself contain safe placeholders such as {@code ${pattern}}.</p>
 *
 * <p>{@code %%} stands for a literal {@code %}. Any other {@code %} is kept as is.</p>
 *
 * <pre>{@code
 * UnsafeInterpolator.interpolate("SELECT * FROM users ORDER BY name %(order)s", Map.of("order", "DESC"));
 * // SELECT * FROM users ORDER BY name DESC
 * }</pre>
 *
 * <p><b>Never</b> pass user input through this layer without validating it first.</p>
 */
public final class UnsafeInterpolator {

    private UnsafeInterpolator() {
        // singleton.
    }

    /**
     * Returns the names referenced by {@code %(name)s} in the template, in first-seen order.
     *
     * @param template
     * @return an unmodifiable set, empty if the template has no unsafe reference
     * @throws TemplateSyntaxException if a reference is malformed
     */
    public static Set<String> referencedNames(final String template) throws TemplateSyntaxException {
        N.checkArgNotNull(template, "template");

        final Set<String> names = new LinkedHashSet<>();

        scan(template, null, names);

        return names.isEmpty() ? Collections.emptySet() : Collections.unmodifiableSet(names);
    }

    /**
     * Replaces every {@code %(name)s} with {@code String.valueOf(values.get(name))} and every {@code %%} with {@code %}.
     *
     * @param template
     * @param values
     * @return the interpolated text
     * @throws TemplateSyntaxException if a reference is malformed
     * @throws MissingInterpolationValueException if a referenced name has no entry in {@code values}
     */
    public static String interpolate(final String template, final Map<String, ?> values)
            throws TemplateSyntaxException, MissingInterpolationValueException {
        N.checkArgNotNull(template, "template");

        return scan(template, values == null ? Collections.<String, Object> emptyMap() : values, null);
    }

    private static String scan(final String template, final Map<String, ?> values, final Set<String> names) {
        final int len = template.length();
        final StringBuilder sb = values == null ? null : new StringBuilder(len + 16);

        int i = 0;

        while (i < len) {
            final char ch = template.charAt(i);

            if (ch != '%' || i + 1 >= len) {
                append(sb, ch);
                i++;
                continue;
            }

            final char next = template.charAt(i + 1);

            if (next == '%') {
                append(sb, '%');
                i += 2;
            } else if (next == '(') {
                final int close = template.indexOf(')', i + 2);

                if (close < 0) {
                    throw new TemplateSyntaxException("Unterminated unsafe substitution", template, i);
                }

                final String name = template.substring(i + 2, close);

                if (name.isEmpty()) {
                    throw new TemplateSyntaxException("Empty unsafe substitution name", template, i);
                }

                if (close + 1 >= len || template.charAt(close + 1) != 's') {
                    throw new TemplateSyntaxException("Unsafe substitution '" + name + "' must end with ')s'", template, i);
                }

                if (names != null) {
                    names.add(name);
                }

                if (sb != null) {
                    if (!values.containsKey(name)) {
                        throw new MissingInterpolationValueException(name);
                    }

                    sb.append(values.get(name));
                }

                i = close + 2;
            } else {
                append(sb, ch);
                i++;
            }
        }

        return sb == null ? null : sb.toString();
    }

    private static void append(final StringBuilder sb, final char ch) {
        if (sb != null) {
            sb.append(ch);
        }
    }
}

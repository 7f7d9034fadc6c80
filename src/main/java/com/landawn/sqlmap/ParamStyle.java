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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.landawn.abacus.util.N;

/**
 * The bind-parameter conventions a database driver may expect, named after the DB-API {@code paramstyle} values.
 *
 * <table>
 * <caption>Native marker for the second distinct placeholder {@code ${b}}</caption>
 * <tr><th>Style</th><th>Marker</th><th>Bindings</th></tr>
 * <tr><td>{@link #QMARK}</td><td>{@code ?}</td><td>one value per occurrence</td></tr>
 * <tr><td>{@link #NUMERIC}</td><td>{@code :2}</td><td>one value per distinct name, 1-based</td></tr>
 * <tr><td>{@link #NAMED}</td><td>{@code :b}</td><td>name to value</td></tr>
 * <tr><td>{@link #FORMAT}</td><td>{@code %s}</td><td>one value per occurrence</td></tr>
 * <tr><td>{@link #PYFORMAT}</td><td>{@code %(b)s}</td><td>name to value</td></tr>
 * </table>
 *
 * <p>A placeholder used twice is supplied once by the caller whatever the style. {@link #QMARK} and {@link #FORMAT}
 * repeat the value in the positional bindings, the other styles reference it again.</p>
 */
public enum ParamStyle {

    /**
     * Question mark style, {@code WHERE name = ?}. This is what JDBC drivers accept.
     */
    QMARK("qmark", false) {
        @Override
        String marker(final String identifier, final int number) {
            return "?";
        }
    },

    /**
     * Numeric, positional style, {@code WHERE name = :1}.
     */
    NUMERIC("numeric", false) {
        @Override
        String marker(final String identifier, final int number) {
            return ":" + number;
        }
    },

    /**
     * Named style, {@code WHERE name = :name}.
     */
    NAMED("named", true) {
        @Override
        String marker(final String identifier, final int number) {
            return ":" + identifier;
        }
    },

    /**
     * printf format codes, {@code WHERE name = %s}.
     */
    FORMAT("format", false) {
        @Override
        String marker(final String identifier, final int number) {
            return "%s";
        }
    },

    /**
     * Extended format codes, {@code WHERE name = %(name)s}.
     */
    PYFORMAT("pyformat", true) {
        @Override
        String marker(final String identifier, final int number) {
            return "%(" + identifier + ")s";
        }
    };

    private final String paramStyleName;

    private final boolean named;

    ParamStyle(final String paramStyleName, final boolean named) {
        this.paramStyleName = paramStyleName;
        this.named = named;
    }

    /**
     *
     * @param identifier the placeholder identifier
     * @param number 1-based number of the identifier among the distinct identifiers of the statement
     * @return
     */
    abstract String marker(String identifier, int number);

    /**
     * The lower-case name of this style, for example {@code "qmark"}.
     *
     * @return
     */
    public String paramStyleName() {
        return paramStyleName;
    }

    /**
     * Checks if the driver takes the bindings of this style as a name-to-value mapping.
     *
     * @return
     */
    public boolean isNamed() {
        return named;
    }

    /**
     * Checks if each occurrence of a placeholder gets its own positional binding, so a repeated placeholder
     * repeats its value.
     *
     * @return
     */
    public boolean bindsPerOccurrence() {
        return this == QMARK || this == FORMAT;
    }

    /**
     * Rewrites the placeholders of the template into the native markers of this style.
     *
     * @param template
     * @return
     */
    public CompiledStatement compile(final SqlTemplate template) {
        N.checkArgNotNull(template, "template");

        final List<String> segments = template.segments();
        final List<String> identifiers = template.identifiers();
        final Map<String, Integer> numbers = new LinkedHashMap<>();
        final StringBuilder sb = new StringBuilder(template.text().length() + identifiers.size() * 4);

        for (int i = 0, size = identifiers.size(); i < size; i++) {
            final String identifier = identifiers.get(i);
            Integer number = numbers.get(identifier);

            if (number == null) {
                number = numbers.size() + 1;
                numbers.put(identifier, number);
            }

            sb.append(segments.get(i)).append(marker(identifier, number));
        }

        sb.append(segments.get(segments.size() - 1));

        return new CompiledStatement(this, template.text(), sb.toString(), identifiers, new ArrayList<>(numbers.keySet()));
    }

    /**
     * Looks up the style by its DB-API name ({@code qmark}, {@code numeric}, {@code named}, {@code format},
     * {@code pyformat}), ignoring case.
     *
     * @param paramStyleName
     * @return
     * @throws IllegalArgumentException if the name is not one of the supported styles
     */
    public static ParamStyle of(final String paramStyleName) throws IllegalArgumentException {
        N.checkArgNotNull(paramStyleName, "paramStyleName");

        for (final ParamStyle style : values()) {
            if (style.paramStyleName.equalsIgnoreCase(paramStyleName.trim())) {
                return style;
            }
        }

        throw new IllegalArgumentException("Unsupported paramstyle '" + paramStyleName + "'");
    }
}

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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.landawn.sqlmap.exception.QueryArgumentException;

/**
 * One statement rewritten for a specific {@link ParamStyle}: the native text plus the order in which its
 * placeholders must be bound. Instances are immutable and are created by {@link ParamStyle#compile(SqlTemplate)}.
 */
public final class CompiledStatement {

    private final ParamStyle paramStyle;

    private final String rawText;

    private final String driverText;

    private final List<String> paramOrder;

    private final List<String> distinctParameters;

    CompiledStatement(final ParamStyle paramStyle, final String rawText, final String driverText, final List<String> paramOrder,
            final List<String> distinctParameters) {
        this.paramStyle = paramStyle;
        this.rawText = rawText;
        this.driverText = driverText;
        this.paramOrder = Collections.unmodifiableList(new ArrayList<>(paramOrder));
        this.distinctParameters = Collections.unmodifiableList(distinctParameters);
    }

    public ParamStyle paramStyle() {
        return paramStyle;
    }

    /**
     * The statement after unsafe interpolation, placeholders still in {@code ${name}} form.
     *
     * @return
     */
    public String rawText() {
        return rawText;
    }

    /**
     * The statement with its placeholders rewritten into the native markers of {@link #paramStyle()}.
     *
     * @return
     */
    public String driverText() {
        return driverText;
    }

    /**
     * Placeholder names in textual order, one per native marker occurrence.
     *
     * @return
     */
    public List<String> paramOrder() {
        return paramOrder;
    }

    /**
     * Distinct placeholder names in first-seen order. For {@link ParamStyle#NUMERIC} entry {@code k - 1} is the name
     * bound to {@code :k}.
     *
     * @return
     */
    public List<String> distinctParameters() {
        return distinctParameters;
    }

    /**
     * Builds the native bindings of this statement from the resolved call values.
     *
     * @param values placeholder name to value; must contain every name of {@link #paramOrder()}
     * @return
     * @throws QueryArgumentException if a placeholder has no value
     */
    public Bindings bind(final Map<String, ?> values) throws QueryArgumentException {
        if (paramOrder.isEmpty()) {
            return Bindings.empty();
        }

        if (paramStyle.isNamed()) {
            final Map<String, Object> named = new LinkedHashMap<>(distinctParameters.size());

            for (final String name : distinctParameters) {
                named.put(name, valueOf(values, name));
            }

            return Bindings.named(named);
        }

        final List<String> names = paramStyle.bindsPerOccurrence() ? paramOrder : distinctParameters;
        final List<Object> positional = new ArrayList<>(names.size());

        for (final String name : names) {
            positional.add(valueOf(values, name));
        }

        return Bindings.positional(positional);
    }

    private static Object valueOf(final Map<String, ?> values, final String name) {
        if (!values.containsKey(name)) {
            throw new QueryArgumentException("No value supplied for parameter '" + name + "'");
        }

        return values.get(name);
    }

    @Override
    public String toString() {
        return "{paramStyle=" + paramStyle + ", driverText=" + driverText + ", paramOrder=" + paramOrder + "}";
    }
}

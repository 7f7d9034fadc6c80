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

import com.landawn.abacus.util.N;

/**
 * The values handed to a {@link Cursor} together with the native statement text.
 * Positional bindings are a list whose order follows the native markers; named bindings map each distinct
 * placeholder name to its value.
 */
public final class Bindings {

    private static final Bindings EMPTY = new Bindings(Collections.emptyList(), null);

    private final List<Object> positional;

    private final Map<String, Object> named;

    private Bindings(final List<Object> positional, final Map<String, Object> named) {
        this.positional = positional;
        this.named = named;
    }

    /**
     * No bindings at all.
     *
     * @return
     */
    public static Bindings empty() {
        return EMPTY;
    }

    /**
     *
     * @param values in native marker order
     * @return
     */
    public static Bindings positional(final List<?> values) {
        N.checkArgNotNull(values, "values");

        return new Bindings(Collections.unmodifiableList(new ArrayList<>(values)), null);
    }

    /**
     *
     * @param values placeholder name to value
     * @return
     */
    public static Bindings named(final Map<String, ?> values) {
        N.checkArgNotNull(values, "values");

        return new Bindings(null, Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public boolean isNamed() {
        return named != null;
    }

    /**
     *
     * @return
     * @throws IllegalStateException if these bindings are named
     */
    public List<Object> positional() throws IllegalStateException {
        if (positional == null) {
            throw new IllegalStateException("Bindings are named, not positional");
        }

        return positional;
    }

    /**
     *
     * @return
     * @throws IllegalStateException if these bindings are positional
     */
    public Map<String, Object> named() throws IllegalStateException {
        if (named == null) {
            throw new IllegalStateException("Bindings are positional, not named");
        }

        return named;
    }

    public int size() {
        return named == null ? positional.size() : named.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public int hashCode() {
        return named == null ? positional.hashCode() : named.hashCode();
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }

        if (obj instanceof Bindings) {
            final Bindings other = (Bindings) obj;

            return N.equals(positional, other.positional) && N.equals(named, other.named);
        }

        return false;
    }

    @Override
    public String toString() {
        return named == null ? String.valueOf(positional) : String.valueOf(named);
    }
}

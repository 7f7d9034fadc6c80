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
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.sqlmap.exception.MissingInterpolationValueException;
import com.landawn.sqlmap.exception.TemplateSyntaxException;

/**
 * One statement of a {@link QueryDefinition}, as written in the configuration.
 *
 * <p>A statement without unsafe substitutions is compiled once per {@link ParamStyle}. A statement with unsafe
 * substitutions is compiled per distinct combination of substitution values; the results are kept in a small LRU
 * table keyed by those values.</p>
 */
final class StatementTemplate {

    static final int MAX_MEMO_SIZE = 256;

    private static final Logger logger = LoggerFactory.getLogger(StatementTemplate.class);

    private final String source;

    private final Set<String> unsafeNames;

    private final SqlTemplate declared;

    private final Map<ParamStyle, CompiledStatement> compiledByStyle = new ConcurrentHashMap<>();

    private final Map<MemoKey, CompiledStatement> memo;

    private StatementTemplate(final String source, final Set<String> unsafeNames, final SqlTemplate declared) {
        this.source = source;
        this.unsafeNames = unsafeNames;
        this.declared = declared;
        this.memo = unsafeNames.isEmpty() ? null : Collections.synchronizedMap(new LinkedHashMap<MemoKey, CompiledStatement>(16, 0.75f, true) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(final Map.Entry<MemoKey, CompiledStatement> eldest) {
                return size() > MAX_MEMO_SIZE;
            }
        });
    }

    /**
     * Validates both placeholder layers of the statement.
     *
     * @param source
     * @return
     * @throws TemplateSyntaxException
     */
    static StatementTemplate of(final String source) throws TemplateSyntaxException {
        final Set<String> unsafeNames = UnsafeInterpolator.referencedNames(source);
        final SqlTemplate declared = SqlTemplate.parse(unsafeNames.isEmpty() ? UnsafeInterpolator.interpolate(source, null) : source);

        return new StatementTemplate(source, unsafeNames, declared);
    }

    String source() {
        return source;
    }

    /**
     * Names consumed by unsafe substitution, in first-seen order.
     *
     * @return
     */
    Set<String> unsafeNames() {
        return unsafeNames;
    }

    boolean isDynamic() {
        return !unsafeNames.isEmpty();
    }

    /**
     * Safe placeholders written literally in the statement. Placeholders introduced by unsafe values are not included.
     *
     * @return
     */
    List<String> declaredIdentifiers() {
        return declared.identifiers();
    }

    /**
     *
     * @param paramStyle
     * @param keywords call keywords, used for unsafe substitution only
     * @return
     * @throws MissingInterpolationValueException
     * @throws TemplateSyntaxException if the interpolated text is malformed
     */
    CompiledStatement compile(final ParamStyle paramStyle, final Map<String, ?> keywords)
            throws MissingInterpolationValueException, TemplateSyntaxException {
        if (memo == null) {
            return compiledByStyle.computeIfAbsent(paramStyle, style -> style.compile(declared));
        }

        final List<String> values = new ArrayList<>(unsafeNames.size());

        for (final String name : unsafeNames) {
            if (keywords == null || !keywords.containsKey(name)) {
                throw new MissingInterpolationValueException(name);
            }

            values.add(String.valueOf(keywords.get(name)));
        }

        final MemoKey key = new MemoKey(paramStyle, values);
        CompiledStatement compiled = memo.get(key);

        if (compiled == null) {
            final String text = UnsafeInterpolator.interpolate(source, keywords);

            if (logger.isDebugEnabled()) {
                logger.debug("Compiling {} for unsafe values {}", paramStyle, values);
            }

            compiled = paramStyle.compile(SqlTemplate.parse(text));
            memo.put(key, compiled);
        }

        return compiled;
    }

    int memoSize() {
        return memo == null ? 0 : memo.size();
    }

    @Override
    public String toString() {
        return source;
    }

    private static final class MemoKey {
        private final ParamStyle paramStyle;
        private final List<String> values;
        private final int hash;

        MemoKey(final ParamStyle paramStyle, final List<String> values) {
            this.paramStyle = paramStyle;
            this.values = values;
            this.hash = 31 * paramStyle.hashCode() + values.hashCode();
        }

        @Override
        public int hashCode() {
            return hash;
        }

        @Override
        public boolean equals(final Object obj) {
            return obj instanceof MemoKey && ((MemoKey) obj).paramStyle == paramStyle && ((MemoKey) obj).values.equals(values);
        }
    }
}

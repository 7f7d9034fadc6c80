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

package com.landawn.sqlmap.exception;

/**
 * Thrown when a SQL template contains malformed placeholder syntax, for example an unterminated {@code ${}
 * or an unsafe reference without its trailing conversion character.
 */
public class TemplateSyntaxException extends SqlMapException {

    private static final long serialVersionUID = 2210841706934712209L;

    private final String template;

    private final int position;

    /**
     *
     * @param message
     * @param template the template being parsed
     * @param position zero-based offset of the offending character
     */
    public TemplateSyntaxException(final String message, final String template, final int position) {
        super(message + " at position " + position + " in: " + template);
        this.template = template;
        this.position = position;
    }

    public String getTemplate() {
        return template;
    }

    public int getPosition() {
        return position;
    }
}

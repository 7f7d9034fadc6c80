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
 * Thrown at definition time when positional placeholders ({@code ${_0}}, {@code ${_1}}, ...) are not a contiguous
 * zero-based run within a statement, or are combined with an explicit parameter list.
 */
public class PositionalParameterException extends SqlMapException {

    private static final long serialVersionUID = 5031617716484327720L;

    /**
     *
     * @param message
     */
    public PositionalParameterException(final String message) {
        super(message);
    }
}

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
 * Thrown when the arguments of a call do not match the formal parameters of the operation.
 * It is always raised before the first statement of the operation is executed.
 */
public class QueryArgumentException extends SqlMapException {

    private static final long serialVersionUID = -6358035160982307451L;

    /**
     *
     * @param message
     */
    public QueryArgumentException(final String message) {
        super(message);
    }
}

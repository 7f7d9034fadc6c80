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
 * Base class of the errors raised by the template engine, the query registry and the transaction manager.
 * Errors reported by the database driver itself are not wrapped: they surface as {@link java.sql.SQLException}.
 */
public class SqlMapException extends RuntimeException {

    private static final long serialVersionUID = -4416279310265312876L;

    /**
     *
     * @param message
     */
    public SqlMapException(final String message) {
        super(message);
    }

    /**
     *
     * @param message
     * @param cause
     */
    public SqlMapException(final String message, final Throwable cause) {
        super(message, cause);
    }
}

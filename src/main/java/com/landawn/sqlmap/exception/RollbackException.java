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
 * Thrown when rolling back a transaction fails. The cause is the failure of the rollback itself; the exception that
 * made the rollback necessary, if any, is available from {@link #originalException()} and is also attached as a
 * suppressed exception.
 */
public class RollbackException extends SqlMapException {

    private static final long serialVersionUID = -8800217442915431376L;

    private final transient Throwable originalException;

    /**
     *
     * @param message
     * @param rollbackFailure
     * @param originalException the exception raised inside the transaction scope, may be {@code null}
     */
    public RollbackException(final String message, final Throwable rollbackFailure, final Throwable originalException) {
        super(message, rollbackFailure);
        this.originalException = originalException;

        if (originalException != null) {
            addSuppressed(originalException);
        }
    }

    public Throwable originalException() {
        return originalException;
    }
}

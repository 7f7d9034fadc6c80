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
 * Thrown when a template references an unsafe substitution {@code %(name)s} but no value was supplied for it.
 */
public class MissingInterpolationValueException extends SqlMapException {

    private static final long serialVersionUID = 7713520447086146641L;

    private final String name;

    /**
     *
     * @param name the unsafe substitution name without a value
     */
    public MissingInterpolationValueException(final String name) {
        super("No value supplied for unsafe substitution '" + name + "'");
        this.name = name;
    }

    public String getName() {
        return name;
    }
}

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

import java.util.Map;

import com.landawn.abacus.util.N;

/**
 * The minimal view of a configuration the core needs: look a key up, iterate the keys.
 *
 * <p>The top level is expected to expose a {@code QUERIES} section. Each entry of that section maps an operation name
 * to a statement string, a list of statement strings, or a nested section with {@code statements} (or {@code query})
 * and an optional {@code parameters} list. Nested sections may be {@code Map}s or {@code ConfigSource}s.</p>
 *
 * <pre>{@code
 * ConfigSource config = ConfigSource.of(Map.of("QUERIES", Map.of(
 *         "list_users", "SELECT * FROM users ORDER BY name ASC",
 *         "create_user", Map.of("statements", List.of("INSERT INTO users(name, password) VALUES(${username}, ${password})"),
 *                               "parameters", List.of("username", "password")))));
 * }</pre>
 */
public interface ConfigSource {

    /**
     * Section holding the operation definitions.
     */
    String QUERIES = "QUERIES";

    /**
     *
     * @param key
     * @return the value, or {@code null} if absent
     */
    Object get(String key);

    /**
     *
     * @return
     */
    Iterable<String> keys();

    /**
     * Adapts a map. The map is not copied.
     *
     * @param map
     * @return
     */
    static ConfigSource of(final Map<String, ?> map) {
        N.checkArgNotNull(map, "map");

        return new ConfigSource() {
            @Override
            public Object get(final String key) {
                return map.get(key);
            }

            @Override
            public Iterable<String> keys() {
                return map.keySet();
            }

            @Override
            public String toString() {
                return String.valueOf(map);
            }
        };
    }
}

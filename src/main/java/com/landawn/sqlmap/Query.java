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

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import com.landawn.sqlmap.exception.MissingInterpolationValueException;
import com.landawn.sqlmap.exception.QueryArgumentException;

/**
 * One operation of a {@link Database}, bound to its name.
 *
 * <pre>{@code
 * Query<Map<String, Object>> createUser = db.query("create_user");
 * createUser.call("bruce", "iamthenight");
 * }</pre>
 *
 * @param <T>
 */
public final class Query<T> {

    private final Database<T> database;

    private final String name;

    Query(final Database<T> database, final String name) {
        this.database = database;
        this.name = name;
    }

    public String name() {
        return name;
    }

    /**
     * The current definition registered under this name.
     *
     * @return
     */
    public QueryDefinition definition() {
        return database.registry().get(name);
    }

    public List<String> parameters() {
        return definition().parameters();
    }

    /**
     *
     * @param args
     * @return
     * @throws QueryArgumentException
     * @throws MissingInterpolationValueException
     * @throws SQLException
     * @see Database#call(String, Object...)
     */
    public List<T> call(final Object... args) throws QueryArgumentException, MissingInterpolationValueException, SQLException {
        return database.call(name, args);
    }

    /**
     *
     * @param keywords
     * @param args
     * @return
     * @throws QueryArgumentException
     * @throws MissingInterpolationValueException
     * @throws SQLException
     * @see Database#call(String, Map, Object...)
     */
    public List<T> call(final Map<String, ?> keywords, final Object... args) throws QueryArgumentException, MissingInterpolationValueException, SQLException {
        return database.call(name, keywords, args);
    }

    @Override
    public String toString() {
        return "Query{" + name + "}";
    }
}

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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.landawn.abacus.util.N;
import com.landawn.abacus.util.Throwables;

/**
 * Turns a fetched row into a result element. The cursor gives access to the column labels of the result.
 *
 * @param <T>
 */
@FunctionalInterface
public interface RowMapper<T> extends Throwables.BiFunction<Cursor, Object[], T, SQLException> {

    /**
     * Each row as a {@code Map} from column label to value, in column order.
     */
    RowMapper<Map<String, Object>> TO_MAP = (cursor, row) -> {
        final List<String> labels = cursor.columnLabels();
        final Map<String, Object> result = N.newLinkedHashMap(row.length);

        for (int i = 0; i < row.length; i++) {
            result.put(i < labels.size() ? labels.get(i) : String.valueOf(i + 1), row[i]);
        }

        return result;
    };

    RowMapper<List<Object>> TO_LIST = (cursor, row) -> new ArrayList<>(Arrays.asList(row));

    /**
     * The row as fetched.
     */
    RowMapper<Object[]> TO_ARRAY = (cursor, row) -> row;

    /**
     *
     * @param cursor
     * @param row
     * @return
     * @throws SQLException
     */
    @Override
    T apply(Cursor cursor, Object[] row) throws SQLException;
}

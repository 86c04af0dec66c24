/*
 * Copyright 2023-2043 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.asyncdb.mysql.protocol.client;

import io.asyncdb.mysql.protocol.message.server.ColumnDefinitionMessage;
import io.asyncdb.mysql.result.ResultRow;
import io.asyncdb.mysql.result.ResultSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * <p>
 * Append-only row store of one exchange. The column metadata is a snapshot taken when column definitions
 * finished, later definitions of the exchange don't change it.
 * <br/>
 */
final class MutableResultSet implements ResultSet {

    static MutableResultSet create(List<ColumnDefinitionMessage> columns) {
        return new MutableResultSet(columns);
    }

    private final List<ColumnDefinitionMessage> columnTypes;

    private final List<String> columnNames;

    private final List<ResultRow> rows = new ArrayList<>();

    private MutableResultSet(final List<ColumnDefinitionMessage> columns) {
        this.columnTypes = Collections.unmodifiableList(new ArrayList<>(columns));
        final List<String> names = new ArrayList<>(columns.size());
        for (ColumnDefinitionMessage column : columns) {
            names.add(column.name);
        }
        this.columnNames = Collections.unmodifiableList(names);
    }

    void addRow(final Object[] values) {
        if (values.length != this.columnTypes.size()) {
            throw new IllegalArgumentException(String.format("row size[%s] and column count[%s] not match.",
                    values.length, this.columnTypes.size()));
        }
        this.rows.add(ResultRow.of(values));
    }

    ColumnDefinitionMessage columnType(int index) {
        return this.columnTypes.get(index);
    }

    @Override
    public List<ColumnDefinitionMessage> columnTypes() {
        return this.columnTypes;
    }

    @Override
    public List<String> columnNames() {
        return this.columnNames;
    }

    @Override
    public List<ResultRow> rows() {
        return Collections.unmodifiableList(this.rows);
    }

    @Override
    public int size() {
        return this.rows.size();
    }

    @Override
    public ResultRow get(int index) {
        return this.rows.get(index);
    }

    @Override
    public String toString() {
        return String.format("MutableResultSet[ columns : %s , rows : %s ]", this.columnNames, this.rows.size());
    }


}

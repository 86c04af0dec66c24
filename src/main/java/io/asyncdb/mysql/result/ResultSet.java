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

package io.asyncdb.mysql.result;

import io.asyncdb.mysql.protocol.message.server.ColumnDefinitionMessage;

import java.util.List;

/**
 * <p>
 * All rows of one exchange together with the column metadata they were decoded with.
 * <br/>
 *
 * @since 1.0
 */
public interface ResultSet {

    List<ColumnDefinitionMessage> columnTypes();

    List<String> columnNames();

    List<ResultRow> rows();

    int size();

    ResultRow get(int index);


}

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

package io.asyncdb.mysql.protocol.message.client;

import io.asyncdb.mysql.protocol.message.server.ColumnDefinitionMessage;

import java.util.Collections;
import java.util.List;

/**
 * @see <a href="https://dev.mysql.com/doc/dev/mysql-server/latest/page_protocol_com_stmt_execute.html">COM_STMT_EXECUTE</a>
 */
public final class PreparedStatementExecuteMessage implements ClientMessage {

    public static PreparedStatementExecuteMessage create(byte[] statementId, List<Object> values,
                                                         List<ColumnDefinitionMessage> parameters) {
        return new PreparedStatementExecuteMessage(statementId, values, parameters);
    }

    private final byte[] statementId;

    public final List<Object> values;

    public final List<ColumnDefinitionMessage> parameters;

    private PreparedStatementExecuteMessage(byte[] statementId, List<Object> values,
                                            List<ColumnDefinitionMessage> parameters) {
        if (values.size() != parameters.size()) {
            throw new IllegalArgumentException(String.format("bind value count[%s] and parameter count[%s] not match",
                    values.size(), parameters.size()));
        }
        this.statementId = statementId.clone();
        this.values = values;
        this.parameters = Collections.unmodifiableList(parameters);
    }

    @Override
    public int command() {
        return COM_STMT_EXECUTE;
    }

    public byte[] statementId() {
        return this.statementId.clone();
    }

    @Override
    public String toString() {
        return String.format("PreparedStatementExecuteMessage[ values : %s , parameterCount : %s ]",
                this.values, this.parameters.size());
    }


}

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
import io.asyncdb.mysql.protocol.message.server.PreparedStatementPrepareResponse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * <p>
 * Server side handle of one prepared statement. Definitions fill parameters first, then result columns,
 * as the prepare response sends them.
 * <br/>
 *
 * @see PreparedStatementCache
 */
final class PreparedStatementHolder {

    static PreparedStatementHolder create(String statement, PreparedStatementPrepareResponse response) {
        return new PreparedStatementHolder(statement, response);
    }

    final String statement;

    private final byte[] statementId;

    private final List<ColumnDefinitionMessage> parameters;

    private final List<ColumnDefinitionMessage> columns;

    private int paramsToBeReceived;

    private int columnsToBeReceived;

    private PreparedStatementHolder(String statement, PreparedStatementPrepareResponse response) {
        this.statement = statement;
        this.statementId = response.statementId();
        this.paramsToBeReceived = response.paramsCount;
        this.columnsToBeReceived = response.columnsCount;
        this.parameters = new ArrayList<>(response.paramsCount);
        this.columns = new ArrayList<>(response.columnsCount);
    }

    boolean needsParameters() {
        return this.paramsToBeReceived != 0;
    }

    boolean needsColumns() {
        return this.columnsToBeReceived != 0;
    }

    boolean needsAny() {
        return this.needsParameters() || this.needsColumns();
    }

    /**
     * @return true : definition is a parameter
     */
    boolean add(final ColumnDefinitionMessage definition) {
        final boolean parameter;
        if (this.needsParameters()) {
            this.parameters.add(definition);
            this.paramsToBeReceived--;
            parameter = true;
        } else if (this.needsColumns()) {
            this.columns.add(definition);
            this.columnsToBeReceived--;
            parameter = false;
        } else {
            throw new IllegalStateException(String.format("%s expects no more definition.", this));
        }
        return parameter;
    }

    byte[] statementId() {
        return this.statementId.clone();
    }

    List<ColumnDefinitionMessage> parameters() {
        return Collections.unmodifiableList(this.parameters);
    }

    List<ColumnDefinitionMessage> columns() {
        return Collections.unmodifiableList(this.columns);
    }

    @Override
    public String toString() {
        return String.format("PreparedStatementHolder[ statement : %s , parameters : %s , columns : %s , paramsToBeReceived : %s , columnsToBeReceived : %s ]",
                this.statement, this.parameters.size(), this.columns.size(), this.paramsToBeReceived,
                this.columnsToBeReceived);
    }


}

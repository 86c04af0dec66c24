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

package io.asyncdb.mysql.protocol.message.server;

/**
 * @see <a href="https://dev.mysql.com/doc/dev/mysql-server/latest/page_protocol_com_stmt_prepare.html#sect_protocol_com_stmt_prepare_response_ok">COM_STMT_PREPARE_OK</a>
 */
public final class PreparedStatementPrepareResponse implements ServerMessage {

    public static PreparedStatementPrepareResponse create(byte[] statementId, int warningCount, int paramsCount,
                                                          int columnsCount) {
        return new PreparedStatementPrepareResponse(statementId, warningCount, paramsCount, columnsCount);
    }

    private final byte[] statementId;

    public final int warningCount;

    public final int paramsCount;

    public final int columnsCount;

    private PreparedStatementPrepareResponse(byte[] statementId, int warningCount, int paramsCount,
                                             int columnsCount) {
        this.statementId = statementId.clone();
        this.warningCount = warningCount;
        this.paramsCount = paramsCount;
        this.columnsCount = columnsCount;
    }

    @Override
    public Kind kind() {
        return Kind.PREPARE_RESPONSE;
    }

    public byte[] statementId() {
        return this.statementId.clone();
    }

    @Override
    public String toString() {
        return String.format("PreparedStatementPrepareResponse[ paramsCount : %s , columnsCount : %s , warningCount : %s ]",
                this.paramsCount, this.columnsCount, this.warningCount);
    }


}

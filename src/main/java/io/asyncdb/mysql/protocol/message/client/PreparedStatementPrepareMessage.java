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

import java.util.Objects;

/**
 * @see <a href="https://dev.mysql.com/doc/dev/mysql-server/latest/page_protocol_com_stmt_prepare.html">COM_STMT_PREPARE</a>
 */
public final class PreparedStatementPrepareMessage implements ClientMessage {

    public static PreparedStatementPrepareMessage of(String statement) {
        return new PreparedStatementPrepareMessage(statement);
    }

    public final String statement;

    private PreparedStatementPrepareMessage(String statement) {
        this.statement = Objects.requireNonNull(statement, "statement");
    }

    @Override
    public int command() {
        return COM_STMT_PREPARE;
    }

    @Override
    public String toString() {
        return String.format("PreparedStatementPrepareMessage[ statement : %s ]", this.statement);
    }


}

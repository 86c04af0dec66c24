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

import io.asyncdb.mysql.MySQLServerException;
import reactor.util.annotation.Nullable;

/**
 * @see <a href="https://dev.mysql.com/doc/dev/mysql-server/latest/page_protocol_basic_err_packet.html">Protocol::ERR_Packet</a>
 */
public final class ErrorMessage implements ServerMessage {

    public static final int ERROR_HEADER = 0xFF;

    public static ErrorMessage create(int errorCode, @Nullable String sqlState, String errorMessage) {
        return new ErrorMessage(errorCode, sqlState, errorMessage);
    }

    public final int errorCode;

    public final String sqlState;

    public final String errorMessage;

    private ErrorMessage(int errorCode, @Nullable String sqlState, String errorMessage) {
        this.errorCode = errorCode;
        this.sqlState = sqlState;
        this.errorMessage = errorMessage;
    }

    @Override
    public Kind kind() {
        return Kind.ERROR;
    }

    public MySQLServerException toException() {
        return new MySQLServerException(this.errorMessage, this.sqlState, this.errorCode);
    }

    @Override
    public String toString() {
        return String.format("ErrorMessage[ errorCode : %s , sqlState : %s , errorMessage : %s ]",
                this.errorCode, this.sqlState, this.errorMessage);
    }


}

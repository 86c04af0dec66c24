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

package io.asyncdb.mysql;

import reactor.util.annotation.Nullable;

/**
 * <p>
 * This class representing server error message.
 * <br/>
 *
 * @see io.asyncdb.mysql.protocol.message.server.ErrorMessage#toException()
 * @see <a href="https://dev.mysql.com/doc/dev/mysql-server/latest/page_protocol_basic_err_packet.html">Protocol::ERR_Packet</a>
 * @since 1.0
 */
public final class MySQLServerException extends MySQLClientException {

    private final String sqlState;

    private final int vendorCode;

    public MySQLServerException(String message, @Nullable String sqlState, int vendorCode) {
        super(message);
        this.sqlState = sqlState;
        this.vendorCode = vendorCode;
    }

    @Nullable
    public String getSqlState() {
        return this.sqlState;
    }

    public int getVendorCode() {
        return this.vendorCode;
    }


}

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
 * @see <a href="https://dev.mysql.com/doc/dev/mysql-server/latest/page_protocol_basic_ok_packet.html">Protocol::OK_Packet</a>
 */
public final class OkMessage extends Terminator {

    public static OkMessage create(long affectedRows, long lastInsertId, int statusFags, int warnings,
                                   String message) {
        return new OkMessage(affectedRows, lastInsertId, statusFags, warnings, message);
    }

    public final long affectedRows;

    public final long lastInsertId;

    public final String message;

    private OkMessage(long affectedRows, long lastInsertId, int statusFags, int warnings, String message) {
        super(warnings, statusFags);
        this.affectedRows = affectedRows;
        this.lastInsertId = lastInsertId;
        this.message = message;
    }

    @Override
    public Kind kind() {
        return Kind.OK;
    }

    @Override
    public String toString() {
        return String.format("OkMessage[ affectedRows : %s , lastInsertId : %s , statusFags : %s , warnings : %s , message : %s ]",
                this.affectedRows, this.lastInsertId, this.statusFags, this.warnings, this.message);
    }


}

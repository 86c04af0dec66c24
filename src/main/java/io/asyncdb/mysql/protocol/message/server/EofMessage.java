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
 * @see <a href="https://dev.mysql.com/doc/dev/mysql-server/latest/page_protocol_basic_eof_packet.html">Protocol::EOF_Packet</a>
 */
public final class EofMessage extends Terminator {

    public static final short EOF_HEADER = 0xFE;

    public static EofMessage create(int warnings, int statusFags) {
        return new EofMessage(warnings, statusFags);
    }

    private EofMessage(int warnings, int statusFags) {
        super(warnings, statusFags);
    }

    @Override
    public Kind kind() {
        return Kind.EOF;
    }

    @Override
    public String toString() {
        return String.format("EofMessage[ warnings : %s , statusFags : %s ]", this.warnings, this.statusFags);
    }


}

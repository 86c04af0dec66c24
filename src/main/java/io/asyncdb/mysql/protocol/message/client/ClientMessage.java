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

/**
 * <p>
 * A message that the frame codec encodes into the server byte stream.
 * <br/>
 *
 * @since 1.0
 */
public interface ClientMessage {

    /**
     * @return command byte, {@code -1} for messages sent outside the command phase.
     * @see <a href="https://dev.mysql.com/doc/dev/mysql-server/latest/my__command_8h.html">enum_server_command</a>
     */
    int command();

    int COM_QUIT = 0x01;

    int COM_QUERY = 0x03;

    int COM_STMT_PREPARE = 0x16;

    int COM_STMT_EXECUTE = 0x17;


}

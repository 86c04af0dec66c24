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

package io.asyncdb.mysql.protocol;

import io.asyncdb.mysql.protocol.message.server.EofMessage;
import io.asyncdb.mysql.protocol.message.server.ErrorMessage;
import io.asyncdb.mysql.protocol.message.server.HandshakeMessage;
import io.asyncdb.mysql.protocol.message.server.OkMessage;
import io.asyncdb.mysql.result.ResultSet;
import io.netty.channel.ChannelHandlerContext;

/**
 * <p>
 * Consumer of the events of one connection. All methods are invoked synchronously on the I/O thread
 * of the connection, in the order the server messages arrived, so implementations must not block.
 * <br/>
 * <p>
 * {@link #onResultSet(ResultSet, EofMessage)} is invoked only after all rows of the exchange have arrived.
 * <br/>
 *
 * @see io.asyncdb.mysql.protocol.client.MySQLConnectionHandler
 * @since 1.0
 */
public interface MySQLHandlerDelegate {

    void onHandshake(HandshakeMessage message);

    void onOk(OkMessage message);

    void onError(ErrorMessage message);

    void onEOF(EofMessage message);

    void onResultSet(ResultSet resultSet, EofMessage message);

    void connected(ChannelHandlerContext ctx);

    void exceptionCaught(Throwable cause);


}

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

import io.netty.channel.ChannelHandler;

/**
 * <p>
 * The byte level codec of one connection: packet framing, length prefixes and charset aware encoding.
 * One instance serves exactly one connection.
 * <br/>
 * <p>
 * The decoder emits {@link io.asyncdb.mysql.protocol.message.server.ServerMessage},
 * the encoder accepts {@link io.asyncdb.mysql.protocol.message.client.ClientMessage}.
 * The phase hooks tell the decoder how to interpret the next response, they are invoked before the
 * corresponding request is written.
 * <br/>
 *
 * @since 1.0
 */
public interface FrameCodec {

    ChannelHandler decoder();

    ChannelHandler encoder();

    void queryProcessStarted();

    void preparedStatementPrepareStarted();

    void preparedStatementExecuteStarted(int columnCount, int paramCount);


}

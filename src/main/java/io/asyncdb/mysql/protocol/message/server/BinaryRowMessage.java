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

import io.netty.buffer.ByteBuf;
import io.netty.buffer.DefaultByteBufHolder;

/**
 * <p>
 * One row of binary protocol. The buffer starts at the null bitmap, the packet header is already consumed.
 * <br/>
 *
 * @see <a href="https://dev.mysql.com/doc/dev/mysql-server/latest/page_protocol_binary_resultset.html#sect_protocol_binary_resultset_row">Binary Protocol Resultset Row</a>
 */
public final class BinaryRowMessage extends DefaultByteBufHolder implements ServerMessage {

    public static BinaryRowMessage wrap(ByteBuf buffer) {
        return new BinaryRowMessage(buffer);
    }

    private BinaryRowMessage(ByteBuf buffer) {
        super(buffer);
    }

    @Override
    public Kind kind() {
        return Kind.BINARY_ROW;
    }

    public ByteBuf buffer() {
        return content();
    }


}

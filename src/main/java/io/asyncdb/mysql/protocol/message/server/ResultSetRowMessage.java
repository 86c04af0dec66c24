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
import io.netty.util.AbstractReferenceCounted;
import io.netty.util.ReferenceCounted;
import reactor.util.annotation.Nullable;

/**
 * <p>
 * One row of text protocol, each column is the raw bytes of the value or {@code null} for SQL NULL.
 * Releasing this message releases all column buffers.
 * <br/>
 *
 * @see <a href="https://dev.mysql.com/doc/dev/mysql-server/latest/page_protocol_com_query_response_text_resultset_row.html">Text Resultset Row</a>
 */
public final class ResultSetRowMessage extends AbstractReferenceCounted implements ServerMessage {

    public static ResultSetRowMessage wrap(final ByteBuf... columns) {
        return new ResultSetRowMessage(columns.clone());
    }

    private final ByteBuf[] columns;

    private ResultSetRowMessage(ByteBuf[] columns) {
        this.columns = columns;
    }

    @Override
    public Kind kind() {
        return Kind.ROW;
    }

    public int size() {
        return this.columns.length;
    }

    @Nullable
    public ByteBuf get(int index) {
        return this.columns[index];
    }

    @Override
    public ReferenceCounted touch(final Object hint) {
        for (ByteBuf column : this.columns) {
            if (column != null) {
                column.touch(hint);
            }
        }
        return this;
    }

    @Override
    protected void deallocate() {
        for (ByteBuf column : this.columns) {
            if (column != null) {
                column.release();
            }
        }
    }


}

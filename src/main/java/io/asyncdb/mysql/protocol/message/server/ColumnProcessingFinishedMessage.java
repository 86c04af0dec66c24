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
 * Marks the end of column definitions, the frame codec emits it in place of the metadata EOF packet.
 */
public final class ColumnProcessingFinishedMessage implements ServerMessage {

    public static ColumnProcessingFinishedMessage from(EofMessage eof) {
        return new ColumnProcessingFinishedMessage(eof);
    }

    public final EofMessage eof;

    private ColumnProcessingFinishedMessage(EofMessage eof) {
        this.eof = eof;
    }

    @Override
    public Kind kind() {
        return Kind.COLUMN_DEFINITION_FINISHED;
    }


}

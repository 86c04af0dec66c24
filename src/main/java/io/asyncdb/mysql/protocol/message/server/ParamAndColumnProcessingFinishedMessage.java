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
 * Marks the end of a prepare response whose parameter and column definitions ended together.
 */
public final class ParamAndColumnProcessingFinishedMessage implements ServerMessage {

    public static ParamAndColumnProcessingFinishedMessage from(EofMessage eof) {
        return new ParamAndColumnProcessingFinishedMessage(eof);
    }

    public final EofMessage eof;

    private ParamAndColumnProcessingFinishedMessage(EofMessage eof) {
        this.eof = eof;
    }

    @Override
    public Kind kind() {
        return Kind.PARAM_AND_COLUMN_PROCESSING_FINISHED;
    }


}

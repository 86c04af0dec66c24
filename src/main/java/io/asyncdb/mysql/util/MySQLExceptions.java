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

package io.asyncdb.mysql.util;

import io.asyncdb.mysql.MySQLClientException;
import io.asyncdb.mysql.SessionCloseException;
import io.netty.handler.codec.CodecException;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.UnresolvedAddressException;

public abstract class MySQLExceptions {

    private MySQLExceptions() {
        throw new UnsupportedOperationException();
    }


    /**
     * <p>
     * Strip the wrapper that the frame codec adds around decode / encode failures.
     * {@link io.netty.handler.codec.DecoderException} and {@link io.netty.handler.codec.EncoderException}
     * both are {@link CodecException}.
     * <br/>
     */
    public static Throwable unwrap(final Throwable cause) {
        Throwable error = cause;
        while (error instanceof CodecException && error.getCause() != null) {
            error = error.getCause();
        }
        return error;
    }

    public static MySQLClientException mapConnectionError(final Throwable cause) {
        final MySQLClientException error;
        if (cause instanceof MySQLClientException) {
            error = (MySQLClientException) cause;
        } else if (cause instanceof ClosedChannelException) {
            error = new MySQLClientException("connect failure,possibly server too busy", cause);
        } else if (cause instanceof ConnectException) {
            error = new MySQLClientException(String.format("connect failure, %s", cause.getMessage()), cause);
        } else if (cause instanceof UnresolvedAddressException || cause instanceof UnknownHostException) {
            error = new MySQLClientException("connect failure, host can't be resolved", cause);
        } else {
            error = new MySQLClientException("connect error, unknown error", cause);
        }
        return error;
    }

    public static SessionCloseException sessionHaveClosed() {
        return new SessionCloseException("session have closed.");
    }

    public static SessionCloseException closedBeforeHandshake(String connectionId) {
        return new SessionCloseException(String.format("connection[%s] closed before handshake.", connectionId));
    }

    public static SessionCloseException closedDuringExchange(String connectionId, Object phase) {
        return new SessionCloseException(String.format("connection[%s] closed during exchange, phase %s.",
                connectionId, phase));
    }

    public static IllegalStateException rowOutsideResultSet(Object message) {
        return new IllegalStateException(String.format("%s received outside of result set.",
                message.getClass().getSimpleName()));
    }

    public static IllegalStateException noPendingPrepare() {
        return new IllegalStateException("prepare response received without pending prepare statement.");
    }


}

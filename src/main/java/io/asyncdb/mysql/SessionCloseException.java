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

package io.asyncdb.mysql;

/**
 * <p>
 * Emitted when the transport of a connection has been closed,
 * by {@code disconnect()}, by the peer or before the handshake completed.
 * <br/>
 *
 * @since 1.0
 */
public final class SessionCloseException extends MySQLClientException {

    public SessionCloseException(String message) {
        super(message);
    }

    public SessionCloseException(String message, Throwable cause) {
        super(message, cause);
    }

}

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

import reactor.util.annotation.Nullable;

/**
 * <p>
 * Reply to the server greeting. Authentication data is computed by the caller, the frame codec only
 * serializes it.
 * <br/>
 *
 * @see <a href="https://dev.mysql.com/doc/dev/mysql-server/latest/page_protocol_connection_phase_packets_protocol_handshake_response.html">Protocol::HandshakeResponse41</a>
 */
public final class HandshakeResponseMessage implements ClientMessage {

    public static HandshakeResponseMessage create(String username, byte[] authResponse, @Nullable String database,
                                                  int characterSet, String authenticationMethod) {
        return new HandshakeResponseMessage(username, authResponse, database, characterSet, authenticationMethod);
    }

    public final String username;

    private final byte[] authResponse;

    public final String database;

    public final int characterSet;

    public final String authenticationMethod;

    private HandshakeResponseMessage(String username, byte[] authResponse, @Nullable String database,
                                     int characterSet, String authenticationMethod) {
        this.username = username;
        this.authResponse = authResponse.clone();
        this.database = database;
        this.characterSet = characterSet;
        this.authenticationMethod = authenticationMethod;
    }

    @Override
    public int command() {
        return -1;
    }

    public byte[] authResponse() {
        return this.authResponse.clone();
    }

    @Override
    public String toString() {
        return String.format("HandshakeResponseMessage[ username : %s , database : %s , authenticationMethod : %s ]",
                this.username, this.database, this.authenticationMethod);
    }


}

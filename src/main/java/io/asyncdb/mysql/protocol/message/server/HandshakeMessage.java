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
 * @see <a href="https://dev.mysql.com/doc/dev/mysql-server/latest/page_protocol_connection_phase_packets_protocol_handshake_v10.html">Protocol::HandshakeV10</a>
 */
public final class HandshakeMessage implements ServerMessage {

    public static HandshakeMessage create(String serverVersion, long connectionId, byte[] seed,
                                          int serverCapabilities, int characterSet, int statusFlags,
                                          String authenticationMethod) {
        return new HandshakeMessage(serverVersion, connectionId, seed, serverCapabilities, characterSet,
                statusFlags, authenticationMethod);
    }

    public final String serverVersion;

    public final long connectionId;

    private final byte[] seed;

    public final int serverCapabilities;

    public final int characterSet;

    public final int statusFlags;

    public final String authenticationMethod;

    private HandshakeMessage(String serverVersion, long connectionId, byte[] seed, int serverCapabilities,
                             int characterSet, int statusFlags, String authenticationMethod) {
        this.serverVersion = serverVersion;
        this.connectionId = connectionId;
        this.seed = seed.clone();
        this.serverCapabilities = serverCapabilities;
        this.characterSet = characterSet;
        this.statusFlags = statusFlags;
        this.authenticationMethod = authenticationMethod;
    }

    @Override
    public Kind kind() {
        return Kind.HANDSHAKE;
    }

    public byte[] seed() {
        return this.seed.clone();
    }

    @Override
    public String toString() {
        return String.format("HandshakeMessage[ serverVersion : %s , connectionId : %s , authenticationMethod : %s ]",
                this.serverVersion, this.connectionId, this.authenticationMethod);
    }


}

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

package io.asyncdb.mysql.protocol.client;

import io.asyncdb.mysql.protocol.MySQLHandlerDelegate;
import io.asyncdb.mysql.protocol.message.server.EofMessage;
import io.asyncdb.mysql.protocol.message.server.ErrorMessage;
import io.asyncdb.mysql.protocol.message.server.HandshakeMessage;
import io.asyncdb.mysql.protocol.message.server.OkMessage;
import io.asyncdb.mysql.result.ResultSet;
import io.netty.channel.ChannelHandlerContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Records every event in arrival order.
 */
final class RecordingDelegate implements MySQLHandlerDelegate {

    final List<Object> events = new ArrayList<>();

    final List<HandshakeMessage> handshakes = new ArrayList<>();

    final List<OkMessage> oks = new ArrayList<>();

    final List<ErrorMessage> errors = new ArrayList<>();

    final List<EofMessage> eofs = new ArrayList<>();

    final List<ResultSet> resultSets = new ArrayList<>();

    final List<Throwable> exceptions = new ArrayList<>();

    int connectedCount;

    @Override
    public void onHandshake(HandshakeMessage message) {
        this.events.add(message);
        this.handshakes.add(message);
    }

    @Override
    public void onOk(OkMessage message) {
        this.events.add(message);
        this.oks.add(message);
    }

    @Override
    public void onError(ErrorMessage message) {
        this.events.add(message);
        this.errors.add(message);
    }

    @Override
    public void onEOF(EofMessage message) {
        this.events.add(message);
        this.eofs.add(message);
    }

    @Override
    public void onResultSet(ResultSet resultSet, EofMessage message) {
        this.events.add(resultSet);
        this.resultSets.add(resultSet);
    }

    @Override
    public void connected(ChannelHandlerContext ctx) {
        this.connectedCount++;
    }

    @Override
    public void exceptionCaught(Throwable cause) {
        this.events.add(cause);
        this.exceptions.add(cause);
    }


}

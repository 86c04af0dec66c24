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

import io.asyncdb.mysql.protocol.message.client.PreparedStatementMessage;
import io.asyncdb.mysql.protocol.message.server.ColumnDefinitionMessage;
import io.asyncdb.mysql.protocol.message.server.PreparedStatementPrepareResponse;
import io.asyncdb.mysql.util.MySQLExceptions;
import reactor.util.annotation.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * <p>
 * State of the exchange in flight. Each phase only carries the fields that can exist in it, the connection
 * handler replaces the whole value on each transition.
 * <ul>
 *     <li>{@link Phase#IDLE} : no exchange, or request written and nothing received yet</li>
 *     <li>{@link Phase#PREPARING} : prepare request written, optional holder after prepare response</li>
 *     <li>{@link Phase#COLLECTING} : column definitions of a query or execute response</li>
 *     <li>{@link Phase#STREAMING} : column definitions finished, rows go to the result set</li>
 * </ul>
 * Every ok / error / eof returns to {@link #idle()}.
 * <br/>
 */
abstract class ExchangeState {

    enum Phase {
        IDLE,
        PREPARING,
        COLLECTING,
        STREAMING
    }

    static ExchangeState idle() {
        return Idle.INSTANCE;
    }

    static ExchangeState preparing(PreparedStatementMessage request) {
        return new Preparing(request, null, new ArrayList<>(), new ArrayList<>());
    }

    static ExchangeState streaming(MutableResultSet resultSet) {
        return new Streaming(resultSet, new ArrayList<>());
    }


    private ExchangeState() {
    }

    abstract Phase phase();

    /**
     * @return the column definitions received in current phase, in arrival order.
     */
    abstract List<ColumnDefinitionMessage> columns();

    /**
     * @return parameter definitions of a prepare response, in arrival order.
     */
    List<ColumnDefinitionMessage> parameters() {
        return Collections.emptyList();
    }

    @Nullable
    MutableResultSet resultSet() {
        return null;
    }

    @Nullable
    PreparedStatementHolder holder() {
        return null;
    }

    @Nullable
    PreparedStatementMessage preparingRequest() {
        return null;
    }

    abstract ExchangeState onColumnDefinition(ColumnDefinitionMessage definition);

    ExchangeState onPrepareResponse(PreparedStatementPrepareResponse response) {
        throw MySQLExceptions.noPendingPrepare();
    }

    /**
     * @return {@link Phase#STREAMING} state whose result set snapshots {@link #columns()}
     */
    final ExchangeState finishColumns() {
        final List<ColumnDefinitionMessage> columns = this.columns();
        final List<ColumnDefinitionMessage> accumulator;
        if (columns instanceof ArrayList) {
            accumulator = columns;
        } else {
            accumulator = new ArrayList<>(columns);
        }
        return new Streaming(MutableResultSet.create(columns), accumulator);
    }


    private static final class Idle extends ExchangeState {

        private static final Idle INSTANCE = new Idle();

        @Override
        Phase phase() {
            return Phase.IDLE;
        }

        @Override
        List<ColumnDefinitionMessage> columns() {
            return Collections.emptyList();
        }

        @Override
        ExchangeState onColumnDefinition(final ColumnDefinitionMessage definition) {
            final List<ColumnDefinitionMessage> columns = new ArrayList<>();
            columns.add(definition);
            return new Collecting(columns);
        }

    }// Idle

    private static final class Preparing extends ExchangeState {

        private final PreparedStatementMessage request;

        private final PreparedStatementHolder holder;

        private final List<ColumnDefinitionMessage> columns;

        private final List<ColumnDefinitionMessage> parameters;

        private Preparing(PreparedStatementMessage request, @Nullable PreparedStatementHolder holder,
                          List<ColumnDefinitionMessage> columns, List<ColumnDefinitionMessage> parameters) {
            this.request = request;
            this.holder = holder;
            this.columns = columns;
            this.parameters = parameters;
        }

        @Override
        Phase phase() {
            return Phase.PREPARING;
        }

        @Override
        List<ColumnDefinitionMessage> columns() {
            return this.columns;
        }

        @Override
        List<ColumnDefinitionMessage> parameters() {
            return this.parameters;
        }

        @Override
        PreparedStatementHolder holder() {
            return this.holder;
        }

        @Override
        PreparedStatementMessage preparingRequest() {
            return this.request;
        }

        @Override
        ExchangeState onColumnDefinition(final ColumnDefinitionMessage definition) {
            final PreparedStatementHolder holder = this.holder;
            if (holder != null && holder.needsAny() && holder.add(definition)) {
                this.parameters.add(definition);
            }
            this.columns.add(definition);
            return this;
        }

        @Override
        ExchangeState onPrepareResponse(final PreparedStatementPrepareResponse response) {
            final PreparedStatementHolder holder;
            holder = PreparedStatementHolder.create(this.request.statement, response);
            return new Preparing(this.request, holder, new ArrayList<>(), new ArrayList<>());
        }

    }// Preparing

    private static final class Collecting extends ExchangeState {

        private final List<ColumnDefinitionMessage> columns;

        private Collecting(List<ColumnDefinitionMessage> columns) {
            this.columns = columns;
        }

        @Override
        Phase phase() {
            return Phase.COLLECTING;
        }

        @Override
        List<ColumnDefinitionMessage> columns() {
            return this.columns;
        }

        @Override
        ExchangeState onColumnDefinition(final ColumnDefinitionMessage definition) {
            this.columns.add(definition);
            return this;
        }

    }// Collecting

    private static final class Streaming extends ExchangeState {

        private final MutableResultSet resultSet;

        private final List<ColumnDefinitionMessage> columns;

        private Streaming(MutableResultSet resultSet, List<ColumnDefinitionMessage> columns) {
            this.resultSet = resultSet;
            this.columns = columns;
        }

        @Override
        Phase phase() {
            return Phase.STREAMING;
        }

        @Override
        List<ColumnDefinitionMessage> columns() {
            return this.columns;
        }

        @Override
        MutableResultSet resultSet() {
            return this.resultSet;
        }

        /**
         * Definitions of the execute response that follows a prepare finished on this connection.
         */
        @Override
        ExchangeState onColumnDefinition(final ColumnDefinitionMessage definition) {
            this.columns.add(definition);
            return this;
        }

    }// Streaming


}

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

import io.asyncdb.mysql.protocol.message.client.PreparedStatementExecuteMessage;
import io.asyncdb.mysql.protocol.message.client.PreparedStatementMessage;
import io.asyncdb.mysql.protocol.message.client.PreparedStatementPrepareMessage;
import io.asyncdb.mysql.protocol.message.server.*;
import io.asyncdb.mysql.result.ResultSet;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.testng.Assert;
import org.testng.annotations.Test;
import reactor.core.publisher.Mono;

import java.util.Collections;

/**
 * <p>
 * This class test prepare, cache and execute of {@link MySQLConnectionHandler}.
 * <br/>
 */
public class PreparedStatementTests extends HandlerTestSupport {

    private static final String SELECT_PARAM = "SELECT ?";

    private static final byte[] STATEMENT_ID = {1, 0, 0, 0};


    @Test
    public void prepareThenExecute() {
        this.handler.write(PreparedStatementMessage.of(SELECT_PARAM, Collections.singletonList(7L))).block();

        final Object prepare = this.channel.readOutbound();
        Assert.assertTrue(prepare instanceof PreparedStatementPrepareMessage, String.valueOf(prepare));
        Assert.assertEquals(((PreparedStatementPrepareMessage) prepare).statement, SELECT_PARAM);
        Assert.assertEquals(this.codec.prepareCount, 1);
        Assert.assertEquals(this.handler.exchangeState().phase(), ExchangeState.Phase.PREPARING);

        prepareResponse();

        final Object execute = this.channel.readOutbound();
        Assert.assertTrue(execute instanceof PreparedStatementExecuteMessage, String.valueOf(execute));
        final PreparedStatementExecuteMessage message = (PreparedStatementExecuteMessage) execute;
        Assert.assertEquals(message.statementId(), STATEMENT_ID);
        Assert.assertEquals(message.values, Collections.singletonList(7L));
        Assert.assertEquals(message.parameters.size(), 1);

        Assert.assertEquals(this.codec.executeCounts.size(), 1);
        Assert.assertEquals(this.codec.executeCounts.get(0), new int[]{1, 1});
        Assert.assertTrue(this.handler.preparedStatements().contains(SELECT_PARAM));
        Assert.assertEquals(this.handler.exchangeState().phase(), ExchangeState.Phase.STREAMING);

        executeResponse(7L);

        Assert.assertEquals(this.delegate.resultSets.size(), 1);
        final ResultSet resultSet = this.delegate.resultSets.get(0);
        Assert.assertEquals(resultSet.size(), 1);
        Assert.assertEquals(resultSet.get(0).get(0), 7L);
        Assert.assertEquals(this.handler.exchangeState().phase(), ExchangeState.Phase.IDLE);
        Assert.assertTrue(this.delegate.exceptions.isEmpty());
    }

    @Test
    public void secondExecuteHitsCache() {
        this.handler.write(PreparedStatementMessage.of(SELECT_PARAM, Collections.singletonList(7L))).block();
        this.channel.readOutbound();
        prepareResponse();
        this.channel.readOutbound();
        executeResponse(7L);

        this.handler.write(PreparedStatementMessage.of(SELECT_PARAM, Collections.singletonList(8L))).block();

        final Object execute = this.channel.readOutbound();
        Assert.assertTrue(execute instanceof PreparedStatementExecuteMessage, String.valueOf(execute));
        Assert.assertEquals(((PreparedStatementExecuteMessage) execute).statementId(), STATEMENT_ID);
        Assert.assertEquals(((PreparedStatementExecuteMessage) execute).values, Collections.singletonList(8L));
        Assert.assertNull(this.channel.readOutbound());
        Assert.assertEquals(this.codec.prepareCount, 1);
        Assert.assertEquals(this.codec.executeCounts.size(), 2);
        Assert.assertEquals(this.handler.preparedStatements().size(), 1);

        executeResponse(8L);
        Assert.assertEquals(this.delegate.resultSets.size(), 2);
        Assert.assertEquals(this.delegate.resultSets.get(1).get(0).get(0), 8L);
    }

    @Test
    public void closeDropsCachedStatements() {
        this.handler.write(PreparedStatementMessage.of(SELECT_PARAM, Collections.singletonList(7L))).block();
        this.channel.readOutbound();
        prepareResponse();
        this.channel.readOutbound();
        executeResponse(7L);
        Assert.assertEquals(this.handler.preparedStatements().size(), 1);

        this.channel.close();

        Assert.assertEquals(this.handler.preparedStatements().size(), 0);
    }

    @Test
    public void bindCountMismatchLeavesNoExchange() {
        this.handler.write(PreparedStatementMessage.of(SELECT_PARAM, Collections.emptyList())).block();
        this.channel.readOutbound();
        prepareResponse();
        Assert.assertEquals(this.handler.exchangeState().phase(), ExchangeState.Phase.IDLE);

        this.channel.close();
        // only the bind error, close finds no exchange in flight
        Assert.assertEquals(this.delegate.exceptions.size(), 1);
    }

    @Test
    public void prepareErrorClearsState() {
        final String sql = "SELECT id FROM not_exists WHERE id = ?";
        this.handler.write(PreparedStatementMessage.of(sql, Collections.singletonList(1))).block();
        this.channel.readOutbound();

        this.channel.writeInbound(ErrorMessage.create(1146, "42S02", "Table 'army.not_exists' doesn't exist"));

        Assert.assertEquals(this.delegate.errors.size(), 1);
        Assert.assertEquals(this.handler.exchangeState().phase(), ExchangeState.Phase.IDLE);
        Assert.assertNull(this.handler.exchangeState().preparingRequest());
        Assert.assertFalse(this.handler.preparedStatements().contains(sql));

        // retry prepares again
        this.handler.write(PreparedStatementMessage.of(sql, Collections.singletonList(1))).block();
        Assert.assertTrue(this.channel.readOutbound() instanceof PreparedStatementPrepareMessage);
        Assert.assertEquals(this.codec.prepareCount, 2);
    }

    @Test
    public void prepareResponseWithoutPendingPrepare() {
        this.channel.writeInbound(PreparedStatementPrepareResponse.create(STATEMENT_ID, 0, 1, 1));

        Assert.assertEquals(this.delegate.exceptions.size(), 1);
        Assert.assertTrue(this.delegate.exceptions.get(0) instanceof IllegalStateException);
        Assert.assertEquals(this.handler.exchangeState().phase(), ExchangeState.Phase.IDLE);
    }

    @Test
    public void bindCountMismatchFromCache() {
        this.handler.write(PreparedStatementMessage.of(SELECT_PARAM, Collections.singletonList(7L))).block();
        this.channel.readOutbound();
        prepareResponse();
        this.channel.readOutbound();
        executeResponse(7L);

        final Mono<Void> mono;
        mono = this.handler.write(PreparedStatementMessage.of(SELECT_PARAM, Collections.emptyList()));

        Assert.expectThrows(IllegalArgumentException.class, mono::block);
        Assert.assertNull(this.channel.readOutbound());
        Assert.assertEquals(this.delegate.exceptions.size(), 1);
        Assert.assertTrue(this.delegate.exceptions.get(0) instanceof IllegalArgumentException);
    }

    @Test
    public void bindCountMismatchAfterPrepare() {
        this.handler.write(PreparedStatementMessage.of(SELECT_PARAM, Collections.emptyList())).block();
        this.channel.readOutbound();
        prepareResponse();

        Assert.assertNull(this.channel.readOutbound());
        Assert.assertEquals(this.delegate.exceptions.size(), 1);
        Assert.assertTrue(this.delegate.exceptions.get(0) instanceof IllegalArgumentException);
        // statement stays prepared on server
        Assert.assertTrue(this.handler.preparedStatements().contains(SELECT_PARAM));
    }

    @Test
    public void noParameterStatement() {
        final String sql = "SELECT 'army'";
        this.handler.write(PreparedStatementMessage.of(sql, Collections.emptyList())).block();
        this.channel.readOutbound();

        this.channel.writeInbound(PreparedStatementPrepareResponse.create(STATEMENT_ID, 0, 0, 1));
        this.channel.writeInbound(column("army", ColumnTypes.VAR_STRING));
        this.channel.writeInbound(columnsFinished());

        final Object execute = this.channel.readOutbound();
        Assert.assertTrue(execute instanceof PreparedStatementExecuteMessage, String.valueOf(execute));
        Assert.assertEquals(this.codec.executeCounts.get(0), new int[]{1, 0});
    }


    /**
     * prepare response of {@link #SELECT_PARAM} : one parameter, one column.
     */
    private void prepareResponse() {
        this.channel.writeInbound(PreparedStatementPrepareResponse.create(STATEMENT_ID, 0, 1, 1));
        this.channel.writeInbound(column("?", ColumnTypes.LONGLONG));
        this.channel.writeInbound(ParamProcessingFinishedMessage.from(eof()));
        this.channel.writeInbound(column("?", ColumnTypes.LONGLONG));
        this.channel.writeInbound(columnsFinished());
    }

    private void executeResponse(final long value) {
        this.channel.writeInbound(column("?", ColumnTypes.LONGLONG));
        this.channel.writeInbound(columnsFinished());
        this.channel.writeInbound(BinaryRowMessage.wrap(binaryLong(value)));
        this.channel.writeInbound(EofMessage.create(0, 0));
    }

    private static ByteBuf binaryLong(final long value) {
        final ByteBuf buffer = Unpooled.buffer(9);
        buffer.writeByte(0);
        buffer.writeLongLE(value);
        return buffer;
    }


}

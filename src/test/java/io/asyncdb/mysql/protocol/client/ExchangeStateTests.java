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
import io.asyncdb.mysql.protocol.message.server.ColumnTypes;
import io.asyncdb.mysql.protocol.message.server.PreparedStatementPrepareResponse;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;

import static io.asyncdb.mysql.protocol.client.HandlerTestSupport.column;

/**
 * <p>
 * This class test {@link ExchangeState} transitions.
 * <br/>
 */
public class ExchangeStateTests {


    @Test
    public void idleToStreaming() {
        ExchangeState state = ExchangeState.idle();
        Assert.assertEquals(state.phase(), ExchangeState.Phase.IDLE);
        Assert.assertNull(state.resultSet());

        state = state.onColumnDefinition(column("a", ColumnTypes.LONG));
        state = state.onColumnDefinition(column("b", ColumnTypes.LONG));
        Assert.assertEquals(state.phase(), ExchangeState.Phase.COLLECTING);
        Assert.assertEquals(state.columns().size(), 2);

        state = state.finishColumns();
        Assert.assertEquals(state.phase(), ExchangeState.Phase.STREAMING);
        Assert.assertNotNull(state.resultSet());
        Assert.assertEquals(state.resultSet().columnNames(), Arrays.asList("a", "b"));
    }

    @Test
    public void finishWithoutColumns() {
        final ExchangeState state = ExchangeState.idle().finishColumns();
        Assert.assertEquals(state.phase(), ExchangeState.Phase.STREAMING);
        Assert.assertEquals(state.resultSet().columnTypes().size(), 0);
    }

    @Test
    public void resultSetSnapshotsColumns() {
        ExchangeState state = ExchangeState.idle().onColumnDefinition(column("a", ColumnTypes.LONG));
        state = state.finishColumns();
        state.onColumnDefinition(column("late", ColumnTypes.LONG));

        Assert.assertEquals(state.resultSet().columnNames(), Collections.singletonList("a"));
    }

    @Test
    public void preparingSplitsParametersAndColumns() {
        final PreparedStatementMessage request;
        request = PreparedStatementMessage.of("SELECT id, name FROM u WHERE id = ?", Collections.singletonList(1));

        ExchangeState state = ExchangeState.preparing(request);
        Assert.assertSame(state.preparingRequest(), request);
        Assert.assertNull(state.holder());

        state = state.onPrepareResponse(PreparedStatementPrepareResponse.create(new byte[]{9, 0, 0, 0}, 0, 1, 2));
        Assert.assertEquals(state.phase(), ExchangeState.Phase.PREPARING);
        Assert.assertNotNull(state.holder());

        state = state.onColumnDefinition(column("?", ColumnTypes.LONGLONG));
        state = state.onColumnDefinition(column("id", ColumnTypes.LONGLONG));
        state = state.onColumnDefinition(column("name", ColumnTypes.VAR_STRING));

        Assert.assertEquals(state.parameters().size(), 1);
        Assert.assertEquals(state.columns().size(), 3);
        Assert.assertFalse(state.holder().needsAny());
        Assert.assertEquals(state.holder().columns().size(), 2);
        Assert.assertEquals(state.holder().columns().get(1).name, "name");
    }

    @Test
    public void prepareResponseOutsidePreparing() {
        final PreparedStatementPrepareResponse response;
        response = PreparedStatementPrepareResponse.create(new byte[]{1, 0, 0, 0}, 0, 0, 0);

        Assert.expectThrows(IllegalStateException.class, () -> ExchangeState.idle().onPrepareResponse(response));
        Assert.expectThrows(IllegalStateException.class,
                () -> ExchangeState.idle().finishColumns().onPrepareResponse(response));
    }


}

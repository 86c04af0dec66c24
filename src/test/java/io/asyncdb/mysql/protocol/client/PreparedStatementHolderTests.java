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

import io.asyncdb.mysql.protocol.message.server.ColumnTypes;
import io.asyncdb.mysql.protocol.message.server.PreparedStatementPrepareResponse;
import org.testng.Assert;
import org.testng.annotations.Test;

import static io.asyncdb.mysql.protocol.client.HandlerTestSupport.column;

/**
 * <p>
 * This class test {@link PreparedStatementHolder} and {@link PreparedStatementCache}.
 * <br/>
 */
public class PreparedStatementHolderTests {


    @Test
    public void parametersFirst() {
        final PreparedStatementHolder holder = create("INSERT INTO u(id, name) VALUES (?, ?)", 2, 1);

        Assert.assertTrue(holder.needsParameters());
        Assert.assertTrue(holder.add(column("?", ColumnTypes.LONGLONG)));
        Assert.assertTrue(holder.add(column("?", ColumnTypes.VAR_STRING)));
        Assert.assertFalse(holder.needsParameters());
        Assert.assertTrue(holder.needsColumns());

        Assert.assertFalse(holder.add(column("id", ColumnTypes.LONGLONG)));
        Assert.assertFalse(holder.needsAny());
        Assert.assertEquals(holder.parameters().size(), 2);
        Assert.assertEquals(holder.columns().size(), 1);

        Assert.expectThrows(IllegalStateException.class, () -> holder.add(column("extra", ColumnTypes.LONG)));
    }

    @Test
    public void statementIdIsCopied() {
        final PreparedStatementHolder holder = create("SELECT 1", 0, 1);
        final byte[] id = holder.statementId();
        id[0] = 100;
        Assert.assertEquals(holder.statementId(), new byte[]{5, 0, 0, 0});
    }

    @Test
    public void cacheByStatementText() {
        final PreparedStatementCache cache = new PreparedStatementCache();
        final PreparedStatementHolder holder = create("SELECT ?", 1, 1);

        Assert.assertNull(cache.get("SELECT ?"));
        cache.put(holder);
        Assert.assertSame(cache.get("SELECT ?"), holder);
        Assert.assertFalse(cache.contains("select ?"));
        Assert.assertEquals(cache.size(), 1);

        cache.clear();
        Assert.assertEquals(cache.size(), 0);
    }


    private static PreparedStatementHolder create(String sql, int paramsCount, int columnsCount) {
        final PreparedStatementPrepareResponse response;
        response = PreparedStatementPrepareResponse.create(new byte[]{5, 0, 0, 0}, 0, paramsCount, columnsCount);
        return PreparedStatementHolder.create(sql, response);
    }


}

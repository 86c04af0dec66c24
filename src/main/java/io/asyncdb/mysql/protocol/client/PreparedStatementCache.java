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

import reactor.util.annotation.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * <p>
 * Statement text to {@link PreparedStatementHolder} of one connection.
 * <br/>
 * <p>
 * This cache has no eviction : every distinct statement text stays prepared on server and cached here
 * until the connection closes. Callers that build statement text dynamically should not use the prepared
 * path for it.
 * <br/>
 * <p>
 * Only accessed from the I/O thread of the connection, no lock.
 * <br/>
 */
final class PreparedStatementCache {

    private final Map<String, PreparedStatementHolder> holderMap = new HashMap<>();

    @Nullable
    PreparedStatementHolder get(String statement) {
        return this.holderMap.get(statement);
    }

    void put(final PreparedStatementHolder holder) {
        this.holderMap.put(holder.statement, holder);
    }

    boolean contains(String statement) {
        return this.holderMap.containsKey(statement);
    }

    int size() {
        return this.holderMap.size();
    }

    void clear() {
        this.holderMap.clear();
    }


}

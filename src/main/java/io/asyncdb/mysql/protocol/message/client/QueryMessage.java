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

import java.util.Objects;

/**
 * @see <a href="https://dev.mysql.com/doc/dev/mysql-server/latest/page_protocol_com_query.html">Protocol::COM_QUERY</a>
 */
public final class QueryMessage implements ClientMessage {

    public static QueryMessage of(String query) {
        return new QueryMessage(query);
    }

    public final String query;

    private QueryMessage(String query) {
        this.query = Objects.requireNonNull(query, "query");
    }

    @Override
    public int command() {
        return COM_QUERY;
    }

    @Override
    public String toString() {
        return String.format("QueryMessage[ query : %s ]", this.query);
    }


}

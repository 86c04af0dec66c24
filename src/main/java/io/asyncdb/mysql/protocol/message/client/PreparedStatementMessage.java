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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * <p>
 * Application request to execute a statement through the prepared statement protocol.
 * The connection handler turns it into {@link PreparedStatementPrepareMessage} and / or
 * {@link PreparedStatementExecuteMessage}, so the frame codec never sees this message.
 * <br/>
 *
 * @since 1.0
 */
public final class PreparedStatementMessage {

    public static PreparedStatementMessage of(String statement, List<?> values) {
        return new PreparedStatementMessage(statement, values);
    }

    public final String statement;

    private final List<Object> values;

    private PreparedStatementMessage(String statement, List<?> values) {
        this.statement = Objects.requireNonNull(statement, "statement");
        // values may contain null
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public List<Object> values() {
        return this.values;
    }

    @Override
    public String toString() {
        return String.format("PreparedStatementMessage[ statement : %s , values : %s ]", this.statement, this.values);
    }


}

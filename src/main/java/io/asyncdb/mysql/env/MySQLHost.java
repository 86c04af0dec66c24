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

package io.asyncdb.mysql.env;

import reactor.util.annotation.Nullable;

import java.util.Map;

/**
 * <p>
 * One MySQL server endpoint and its configuration.
 * <br/>
 *
 * @since 1.0
 */
public final class MySQLHost {

    public static MySQLHost from(Map<String, Object> properties) {
        return new MySQLHost(MySQLEnvironment.from(properties));
    }

    private final Environment env;

    private final String host;

    private final int port;

    private final String user;

    private final String password;

    private final String dbName;

    private MySQLHost(Environment env) {
        this.env = env;
        this.host = env.getOrDefault(MySQLKey.HOST);
        this.port = env.getInRange(MySQLKey.PORT, 0, 0xFFFF);
        this.user = env.get(MySQLKey.USER);
        this.password = env.get(MySQLKey.PASSWORD);
        this.dbName = env.get(MySQLKey.DB_NAME);
    }

    public String host() {
        return this.host;
    }

    public int port() {
        return this.port;
    }

    @Nullable
    public String user() {
        return this.user;
    }

    @Nullable
    public String password() {
        return this.password;
    }

    @Nullable
    public String dbName() {
        return this.dbName;
    }

    public Environment properties() {
        return this.env;
    }

    @Override
    public String toString() {
        return String.format("%s[ host : %s , port : %s , user : %s , dbName : %s ]", getClass().getSimpleName(),
                this.host, this.port, this.user, this.dbName);
    }


}

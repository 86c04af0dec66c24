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

import reactor.core.scheduler.Scheduler;
import reactor.util.annotation.Nullable;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * <p>
 * All configuration keys of the asyncdb MySQL client.
 * <br/>
 *
 * @param <T> value java type
 * @since 1.0
 */
public final class MySQLKey<T> extends Key<T> {

    public static final MySQLKey<String> HOST = new MySQLKey<>("host", String.class, "localhost");

    public static final MySQLKey<Integer> PORT = new MySQLKey<>("port", Integer.class, 3306);

    public static final MySQLKey<String> USER = new MySQLKey<>("user", String.class, null);

    public static final MySQLKey<String> PASSWORD = new MySQLKey<>("password", String.class, null);

    public static final MySQLKey<String> DB_NAME = new MySQLKey<>("dbName", String.class, null);

    /**
     * charset of text rows and of the statements the frame codec encodes.
     */
    public static final MySQLKey<Charset> CHARACTER_ENCODING = new MySQLKey<>("characterEncoding", Charset.class, StandardCharsets.UTF_8);

    public static final MySQLKey<Boolean> TCP_KEEP_ALIVE = new MySQLKey<>("tcpKeepAlive", Boolean.class, Boolean.TRUE);

    public static final MySQLKey<Boolean> TCP_NO_DELAY = new MySQLKey<>("tcpNoDelay", Boolean.class, Boolean.TRUE);

    /**
     * milliseconds
     */
    public static final MySQLKey<Integer> CONNECT_TIMEOUT = new MySQLKey<>("connectTimeout", Integer.class, 10_000);

    public static final MySQLKey<String> FACTORY_NAME = new MySQLKey<>("factoryName", String.class, "unnamed");

    public static final MySQLKey<Integer> FACTORY_WORKER_COUNT = new MySQLKey<>("factoryWorkerCount", Integer.class, Runtime.getRuntime().availableProcessors());

    /**
     * negative : same as {@link #FACTORY_WORKER_COUNT}
     */
    public static final MySQLKey<Integer> FACTORY_SELECT_COUNT = new MySQLKey<>("factorySelectCount", Integer.class, -1);

    /**
     * milliseconds
     */
    public static final MySQLKey<Long> SHUTDOWN_QUIET_PERIOD = new MySQLKey<>("shutdownQuietPeriod", Long.class, 0L);

    /**
     * milliseconds
     */
    public static final MySQLKey<Long> SHUTDOWN_TIMEOUT = new MySQLKey<>("shutdownTimeout", Long.class, 3000L);

    /**
     * the {@link Scheduler} that completes write futures.
     */
    public static final MySQLKey<Scheduler> RESULT_SCHEDULER = new MySQLKey<>("resultScheduler", Scheduler.class, null);


    private MySQLKey(String name, Class<T> valueClass, @Nullable T defaultValue) {
        super(name, valueClass, defaultValue);
    }


}

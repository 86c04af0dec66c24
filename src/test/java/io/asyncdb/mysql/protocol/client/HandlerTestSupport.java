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

import io.asyncdb.mysql.env.MySQLHost;
import io.asyncdb.mysql.env.MySQLKey;
import io.asyncdb.mysql.protocol.message.server.ColumnDefinitionMessage;
import io.asyncdb.mysql.protocol.message.server.ColumnProcessingFinishedMessage;
import io.asyncdb.mysql.protocol.message.server.EofMessage;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.BeforeMethod;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * <p>
 * Drives one {@link MySQLConnectionHandler} through {@link EmbeddedChannel}, no server needed.
 * <br/>
 */
public abstract class HandlerTestSupport {

    protected final Logger LOG = LoggerFactory.getLogger(getClass());

    static final int UTF8MB4_GENERAL_CI = 45;

    protected ClientConnectionFactory factory;

    protected RecordingFrameCodec codec;

    protected RecordingDelegate delegate;

    protected MySQLConnectionHandler handler;

    protected EmbeddedChannel channel;

    @BeforeClass
    public final void createFactory() {
        final Map<String, Object> map = new HashMap<>();
        map.put(MySQLKey.HOST.name, "127.0.0.1");
        map.put(MySQLKey.PORT.name, "3306");
        map.put(MySQLKey.FACTORY_NAME.name, getClass().getSimpleName());
        map.put(MySQLKey.FACTORY_WORKER_COUNT.name, "1");
        map.put(MySQLKey.RESULT_SCHEDULER.name, Schedulers.immediate());
        this.factory = ClientConnectionFactory.from(MySQLHost.from(map), () -> this.codec);
    }

    @AfterClass(alwaysRun = true)
    public final void closeFactory() {
        this.factory.close().block(Duration.ofSeconds(10));
    }

    @BeforeMethod
    public final void openChannel() {
        this.codec = new RecordingFrameCodec();
        this.delegate = new RecordingDelegate();
        this.handler = this.factory.newHandler(this.delegate);
        this.channel = new EmbeddedChannel(this.handler);
    }


    static ColumnDefinitionMessage column(String name, int columnType) {
        return ColumnDefinitionMessage.builder()
                .name(name)
                .columnType(columnType)
                .characterSet(UTF8MB4_GENERAL_CI)
                .build();
    }

    static EofMessage eof() {
        return EofMessage.create(0, 0);
    }

    static ColumnProcessingFinishedMessage columnsFinished() {
        return ColumnProcessingFinishedMessage.from(eof());
    }

    static ByteBuf text(String value) {
        return Unpooled.copiedBuffer(value, StandardCharsets.UTF_8);
    }


}

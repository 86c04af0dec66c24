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
import org.testng.Assert;
import org.testng.annotations.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * <p>
 * This class test {@link ClientConnectionFactory}.
 * <br/>
 */
public class ClientConnectionFactoryTests {


    @Test
    public void handlerIdsAndClose() {
        final Map<String, Object> map = new HashMap<>();
        map.put(MySQLKey.FACTORY_NAME.name, "army");
        map.put(MySQLKey.FACTORY_WORKER_COUNT.name, "1");

        final ClientConnectionFactory factory;
        factory = ClientConnectionFactory.from(MySQLHost.from(map), RecordingFrameCodec::new);

        Assert.assertEquals(factory.factoryName(), "army");
        Assert.assertNotNull(factory.eventLoopGroup());
        Assert.assertEquals(factory.newHandler(new RecordingDelegate()).connectionId(), "army-1");
        Assert.assertEquals(factory.newHandler(new RecordingDelegate()).connectionId(), "army-2");

        factory.close().block(Duration.ofSeconds(10));
        Assert.assertTrue(factory.isClosed());
        // idempotent
        factory.close().block(Duration.ofSeconds(10));

        Assert.expectThrows(IllegalStateException.class, () -> factory.newHandler(new RecordingDelegate()));
    }

    @Test
    public void defaultDecoders() {
        final ClientConnectionFactory factory;
        factory = ClientConnectionFactory.from(MySQLHost.from(new HashMap<>()), RecordingFrameCodec::new);
        try {
            Assert.assertSame(factory.textDecoders, DefaultTextDecoderRegistry.INSTANCE);
            Assert.assertTrue(factory.binaryRowDecoder instanceof DefaultBinaryRowDecoder);
            Assert.assertEquals(factory.factoryName(), "unnamed");
        } finally {
            factory.close().block(Duration.ofSeconds(10));
        }
    }


}

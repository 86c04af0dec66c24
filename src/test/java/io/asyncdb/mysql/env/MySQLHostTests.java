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

import io.asyncdb.mysql.MySQLClientException;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * <p>
 * This class test {@link MySQLHost} and {@link MySQLEnvironment}.
 * <br/>
 */
public class MySQLHostTests {


    @Test
    public void defaultValues() {
        final MySQLHost host = MySQLHost.from(new HashMap<>());

        Assert.assertEquals(host.host(), "localhost");
        Assert.assertEquals(host.port(), 3306);
        Assert.assertNull(host.user());
        Assert.assertNull(host.dbName());

        final Environment env = host.properties();
        Assert.assertTrue(env.isOn(MySQLKey.TCP_NO_DELAY));
        Assert.assertEquals(env.getOrDefault(MySQLKey.CHARACTER_ENCODING), StandardCharsets.UTF_8);
        Assert.assertNull(env.get(MySQLKey.RESULT_SCHEDULER));
    }

    @Test
    public void textValues() {
        final Map<String, Object> map = new HashMap<>();
        map.put(MySQLKey.HOST.name, "db.example.com");
        map.put(MySQLKey.PORT.name, " 3307 ");
        map.put(MySQLKey.USER.name, "army");
        map.put(MySQLKey.DB_NAME.name, "army_test");
        map.put(MySQLKey.TCP_KEEP_ALIVE.name, "FALSE");
        map.put(MySQLKey.SHUTDOWN_TIMEOUT.name, "5000");
        map.put(MySQLKey.CHARACTER_ENCODING.name, "ISO-8859-1");

        final MySQLHost host = MySQLHost.from(map);
        Assert.assertEquals(host.host(), "db.example.com");
        Assert.assertEquals(host.port(), 3307);
        Assert.assertEquals(host.user(), "army");
        Assert.assertEquals(host.dbName(), "army_test");

        final Environment env = host.properties();
        Assert.assertTrue(env.isOff(MySQLKey.TCP_KEEP_ALIVE));
        Assert.assertEquals(env.getOrDefault(MySQLKey.SHUTDOWN_TIMEOUT), Long.valueOf(5000L));
        Assert.assertEquals(env.getOrDefault(MySQLKey.CHARACTER_ENCODING), StandardCharsets.ISO_8859_1);
    }

    @Test
    public void portClamped() {
        final Map<String, Object> map = new HashMap<>();
        map.put(MySQLKey.PORT.name, 70_000);
        Assert.assertEquals(MySQLHost.from(map).port(), 0xFFFF);
    }

    @Test
    public void badValues() {
        final Map<String, Object> map = new HashMap<>();
        map.put(MySQLKey.PORT.name, "not a port");
        Assert.expectThrows(MySQLClientException.class, () -> MySQLHost.from(map));

        map.clear();
        map.put(MySQLKey.TCP_NO_DELAY.name, "yes");
        final Environment env = MySQLHost.from(map).properties();
        Assert.expectThrows(MySQLClientException.class, () -> env.isOn(MySQLKey.TCP_NO_DELAY));

        map.clear();
        map.put(MySQLKey.CONNECT_TIMEOUT.name, new Object());
        Assert.expectThrows(MySQLClientException.class,
                () -> MySQLHost.from(map).properties().get(MySQLKey.CONNECT_TIMEOUT));
    }

    @Test
    public void requiredValue() {
        final Environment env = MySQLHost.from(new HashMap<>()).properties();
        Assert.expectThrows(MySQLClientException.class, () -> env.getRequired(MySQLKey.PASSWORD));
        Assert.assertEquals(env.get(MySQLKey.PASSWORD, () -> "secret"), "secret");
    }


}

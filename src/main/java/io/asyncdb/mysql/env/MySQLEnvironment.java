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
import reactor.util.annotation.Nullable;

import java.nio.charset.Charset;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

final class MySQLEnvironment implements Environment {


    static MySQLEnvironment from(Map<String, Object> properties) {
        return new MySQLEnvironment(properties);
    }

    private final Map<String, Object> map;

    private MySQLEnvironment(Map<String, Object> properties) {
        this.map = Collections.unmodifiableMap(new HashMap<>(properties));
    }


    @Nullable
    @Override
    public <T> T get(final Key<T> key) throws MySQLClientException {
        final Object value = this.map.get(key.name);
        if (value == null) {
            return null;
        }
        return convert(key, value);
    }

    @Override
    public <T> T get(final Key<T> key, final Supplier<T> supplier) throws MySQLClientException {
        T value;
        value = get(key);
        if (value == null) {
            value = supplier.get();
        }
        return value;
    }

    @Override
    public <T> T getOrDefault(final Key<T> key) throws MySQLClientException {
        T value;
        value = get(key);
        if (value == null) {
            value = key.defaultValue();
        }
        if (value == null) {
            throw new MySQLClientException(String.format("%s no value and no default value", key));
        }
        return value;
    }

    @Override
    public <T extends Comparable<T>> T getInRange(final Key<T> key, final T minValue, final T maxValue)
            throws MySQLClientException {
        final T value;
        value = getOrDefault(key);
        if (value.compareTo(minValue) < 0) {
            return minValue;
        } else if (value.compareTo(maxValue) > 0) {
            return maxValue;
        }
        return value;
    }

    @Override
    public <T> T getRequired(final Key<T> key) throws MySQLClientException {
        final T value;
        value = get(key);
        if (value == null) {
            throw new MySQLClientException(String.format("%s is required", key));
        }
        return value;
    }

    @Override
    public boolean isOn(final Key<Boolean> key) throws MySQLClientException {
        return getOrDefault(key);
    }

    @Override
    public boolean isOff(final Key<Boolean> key) throws MySQLClientException {
        return !getOrDefault(key);
    }

    @Override
    public String toString() {
        return String.format("%s[ keys : %s ]", getClass().getSimpleName(), this.map.keySet());
    }

    /*################################## blow private method ##################################*/

    private static <T> T convert(final Key<T> key, final Object value) {
        final Class<T> valueClass = key.valueClass;
        if (valueClass.isInstance(value)) {
            return valueClass.cast(value);
        } else if (!(value instanceof String)) {
            throw new MySQLClientException(String.format("%s value type %s not match", key,
                    value.getClass().getName()));
        }
        final String text = ((String) value).trim();
        final Object result;
        try {
            if (valueClass == String.class) {
                result = text;
            } else if (valueClass == Integer.class) {
                result = Integer.parseInt(text);
            } else if (valueClass == Long.class) {
                result = Long.parseLong(text);
            } else if (valueClass == Boolean.class) {
                result = parseBoolean(key, text);
            } else if (valueClass == Charset.class) {
                result = Charset.forName(text);
            } else {
                throw new MySQLClientException(String.format("%s don't support text value", key));
            }
        } catch (MySQLClientException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new MySQLClientException(String.format("%s value[%s] error", key, text), e);
        }
        return valueClass.cast(result);
    }

    private static Boolean parseBoolean(final Key<?> key, final String text) {
        final Boolean value;
        if (text.equalsIgnoreCase("true")) {
            value = Boolean.TRUE;
        } else if (text.equalsIgnoreCase("false")) {
            value = Boolean.FALSE;
        } else {
            throw new MySQLClientException(String.format("%s value[%s] isn't boolean", key, text));
        }
        return value;
    }


}

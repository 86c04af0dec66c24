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

import java.util.function.Supplier;

/**
 * <p>
 * Read-only view of the configuration of one {@link MySQLHost}.
 * <br/>
 *
 * @since 1.0
 */
public interface Environment {

    @Nullable
    <T> T get(Key<T> key) throws MySQLClientException;

    <T> T get(Key<T> key, Supplier<T> supplier) throws MySQLClientException;

    /**
     * @throws MySQLClientException throw when value and default value both are null.
     */
    <T> T getOrDefault(Key<T> key) throws MySQLClientException;

    <T extends Comparable<T>> T getInRange(Key<T> key, T minValue, T maxValue) throws MySQLClientException;

    <T> T getRequired(Key<T> key) throws MySQLClientException;

    boolean isOn(Key<Boolean> key) throws MySQLClientException;

    boolean isOff(Key<Boolean> key) throws MySQLClientException;


}

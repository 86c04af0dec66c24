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

import java.util.Objects;

/**
 * <p>
 * A typed property key of {@link Environment}.
 * <br/>
 *
 * @param <T> value java type
 * @see MySQLKey
 * @since 1.0
 */
public class Key<T> {

    public final String name;

    public final Class<T> valueClass;

    private final T defaultValue;

    protected Key(String name, Class<T> valueClass, @Nullable T defaultValue) {
        this.name = Objects.requireNonNull(name, "name");
        this.valueClass = Objects.requireNonNull(valueClass, "valueClass");
        this.defaultValue = defaultValue;
    }

    @Nullable
    public final T defaultValue() {
        return this.defaultValue;
    }

    @Override
    public final int hashCode() {
        return Objects.hash(this.name, this.valueClass);
    }

    @Override
    public final boolean equals(final Object obj) {
        final boolean match;
        if (obj == this) {
            match = true;
        } else if (obj instanceof Key) {
            final Key<?> o = (Key<?>) obj;
            match = o.name.equals(this.name) && o.valueClass == this.valueClass;
        } else {
            match = false;
        }
        return match;
    }

    @Override
    public final String toString() {
        return String.format("%s[ name : %s , valueClass : %s ]", getClass().getSimpleName(), this.name,
                this.valueClass.getName());
    }


}

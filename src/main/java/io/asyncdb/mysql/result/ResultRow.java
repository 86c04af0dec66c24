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

package io.asyncdb.mysql.result;

import reactor.util.annotation.Nullable;

import java.util.Arrays;

/**
 * <p>
 * One decoded row. SQL NULL is kept as a {@code null} at its position, the row size always equals
 * the column count.
 * <br/>
 *
 * @since 1.0
 */
public final class ResultRow {

    public static ResultRow of(Object[] values) {
        return new ResultRow(values.clone());
    }

    private final Object[] values;

    private ResultRow(Object[] values) {
        this.values = values;
    }

    public int size() {
        return this.values.length;
    }

    @Nullable
    public Object get(int index) {
        return this.values[index];
    }

    public <T> T getNonNull(final int index, final Class<T> valueClass) {
        final Object value = this.values[index];
        if (value == null) {
            throw new NullPointerException(String.format("value at index[%s] is null", index));
        }
        return valueClass.cast(value);
    }

    public boolean isNull(int index) {
        return this.values[index] == null;
    }

    @Override
    public String toString() {
        return "ResultRow" + Arrays.toString(this.values);
    }


}

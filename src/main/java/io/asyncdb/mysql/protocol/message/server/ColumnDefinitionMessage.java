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

package io.asyncdb.mysql.protocol.message.server;

/**
 * <p>
 * One result column or one parameter of a prepared statement.
 * <br/>
 *
 * @see <a href="https://dev.mysql.com/doc/dev/mysql-server/latest/page_protocol_com_query_response_text_resultset_column_definition.html">Column Definition Protocol</a>
 */
public final class ColumnDefinitionMessage implements ServerMessage {

    /**
     * collation index of binary charset
     */
    public static final int BINARY_CHARSET = 63;

    private static final int UNSIGNED_FLAG = 1 << 5;

    private static final int NOT_NULL_FLAG = 1;

    public static Builder builder() {
        return new Builder();
    }

    public final String catalog;

    public final String schema;

    public final String table;

    public final String originalTable;

    public final String name;

    public final String originalName;

    public final int characterSet;

    public final long columnLength;

    public final int columnType;

    public final int flags;

    public final int decimals;

    private ColumnDefinitionMessage(Builder builder) {
        this.catalog = builder.catalog;
        this.schema = builder.schema;
        this.table = builder.table;
        this.originalTable = builder.originalTable;
        this.name = builder.name;
        this.originalName = builder.originalName;
        this.characterSet = builder.characterSet;
        this.columnLength = builder.columnLength;
        this.columnType = builder.columnType;
        this.flags = builder.flags;
        this.decimals = builder.decimals;
    }

    @Override
    public Kind kind() {
        return Kind.COLUMN_DEFINITION;
    }

    public boolean isUnsigned() {
        return (this.flags & UNSIGNED_FLAG) != 0;
    }

    public boolean isNotNull() {
        return (this.flags & NOT_NULL_FLAG) != 0;
    }

    public boolean isBinary() {
        return this.characterSet == BINARY_CHARSET;
    }

    @Override
    public String toString() {
        return String.format("ColumnDefinitionMessage[ name : %s , columnType : %s , characterSet : %s , flags : %s ]",
                this.name, this.columnType, this.characterSet, this.flags);
    }


    public static final class Builder {

        private String catalog = "def";

        private String schema = "";

        private String table = "";

        private String originalTable = "";

        private String name;

        private String originalName = "";

        private int characterSet = BINARY_CHARSET;

        private long columnLength;

        private int columnType = ColumnTypes.VAR_STRING;

        private int flags;

        private int decimals;

        private Builder() {
        }

        public Builder catalog(String catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder schema(String schema) {
            this.schema = schema;
            return this;
        }

        public Builder table(String table) {
            this.table = table;
            return this;
        }

        public Builder originalTable(String originalTable) {
            this.originalTable = originalTable;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder originalName(String originalName) {
            this.originalName = originalName;
            return this;
        }

        public Builder characterSet(int characterSet) {
            this.characterSet = characterSet;
            return this;
        }

        public Builder columnLength(long columnLength) {
            this.columnLength = columnLength;
            return this;
        }

        public Builder columnType(int columnType) {
            this.columnType = columnType;
            return this;
        }

        public Builder flags(int flags) {
            this.flags = flags;
            return this;
        }

        public Builder decimals(int decimals) {
            this.decimals = decimals;
            return this;
        }

        public ColumnDefinitionMessage build() {
            if (this.name == null) {
                throw new IllegalStateException("column name is null");
            }
            return new ColumnDefinitionMessage(this);
        }

    }


}

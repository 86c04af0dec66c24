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

import io.asyncdb.mysql.protocol.BinaryRowDecoder;
import io.asyncdb.mysql.protocol.message.server.ColumnDefinitionMessage;
import io.asyncdb.mysql.protocol.message.server.ColumnTypes;
import io.asyncdb.mysql.util.Packets;
import io.netty.buffer.ByteBuf;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * <p>
 * Decoder of binary protocol rows.
 * <br/>
 *
 * @see <a href="https://dev.mysql.com/doc/dev/mysql-server/latest/page_protocol_binary_resultset.html#sect_protocol_binary_resultset_row">Binary Protocol Resultset Row</a>
 * @see <a href="https://dev.mysql.com/doc/dev/mysql-server/latest/page_protocol_binary_resultset.html#sect_protocol_binary_resultset_row_value">Binary Protocol Value</a>
 */
public final class DefaultBinaryRowDecoder implements BinaryRowDecoder {

    /**
     * offset of result set row null bitmap
     */
    private static final int NULL_BITMAP_OFFSET = 2;

    public static DefaultBinaryRowDecoder create(Charset charset) {
        return new DefaultBinaryRowDecoder(charset);
    }

    private final Charset charset;

    private DefaultBinaryRowDecoder(Charset charset) {
        this.charset = charset;
    }

    @Override
    public Object[] decode(final ByteBuf buffer, final List<ColumnDefinitionMessage> columns) {
        final int columnCount = columns.size();

        final byte[] nullBitmap = new byte[(columnCount + 7 + NULL_BITMAP_OFFSET) >> 3];
        buffer.readBytes(nullBitmap);

        final Object[] values = new Object[columnCount];
        ColumnDefinitionMessage column;
        int bitIndex;
        for (int i = 0; i < columnCount; i++) {
            bitIndex = i + NULL_BITMAP_OFFSET;
            if ((nullBitmap[bitIndex >> 3] & (1 << (bitIndex & 7))) != 0) {
                values[i] = null;
                continue;
            }
            column = columns.get(i);
            values[i] = readValue(buffer, column);
        }
        return values;
    }

    /*################################## blow private method ##################################*/

    private Object readValue(final ByteBuf buffer, final ColumnDefinitionMessage column) {
        final boolean unsigned = column.isUnsigned();
        final Object value;
        switch (column.columnType) {
            case ColumnTypes.TINY:
                value = unsigned ? (int) buffer.readUnsignedByte() : (int) buffer.readByte();
                break;
            case ColumnTypes.SHORT:
            case ColumnTypes.YEAR:
                value = unsigned ? buffer.readUnsignedShortLE() : (int) buffer.readShortLE();
                break;
            case ColumnTypes.INT24:
                value = buffer.readIntLE();
                break;
            case ColumnTypes.LONG:
                if (unsigned) {
                    value = buffer.readUnsignedIntLE();
                } else {
                    value = buffer.readIntLE();
                }
                break;
            case ColumnTypes.LONGLONG: {
                final long v = buffer.readLongLE();
                if (unsigned) {
                    value = new BigInteger(Long.toUnsignedString(v));
                } else {
                    value = v;
                }
            }
            break;
            case ColumnTypes.FLOAT:
                value = buffer.readFloatLE();
                break;
            case ColumnTypes.DOUBLE:
                value = buffer.readDoubleLE();
                break;
            case ColumnTypes.DECIMAL:
            case ColumnTypes.NEWDECIMAL:
                value = new BigDecimal(Packets.readStringLenEnc(buffer, StandardCharsets.US_ASCII));
                break;
            case ColumnTypes.DATE:
                value = readDate(buffer);
                break;
            case ColumnTypes.DATETIME:
            case ColumnTypes.TIMESTAMP:
                value = readDateTime(buffer);
                break;
            case ColumnTypes.TIME:
                value = readTime(buffer);
                break;
            case ColumnTypes.NULL:
                value = null;
                break;
            case ColumnTypes.BIT:
            case ColumnTypes.GEOMETRY:
                value = Packets.readBytesLenEnc(buffer);
                break;
            case ColumnTypes.TINY_BLOB:
            case ColumnTypes.MEDIUM_BLOB:
            case ColumnTypes.LONG_BLOB:
            case ColumnTypes.BLOB:
            case ColumnTypes.VARCHAR:
            case ColumnTypes.VAR_STRING:
            case ColumnTypes.STRING:
                if (column.isBinary()) {
                    value = Packets.readBytesLenEnc(buffer);
                } else {
                    value = Packets.readStringLenEnc(buffer, this.charset);
                }
                break;
            default:
                value = Packets.readStringLenEnc(buffer, this.charset);
        }
        return value;
    }

    private static LocalDate readDate(final ByteBuf buffer) {
        final int length = Packets.readInt1AsInt(buffer);
        if (length == 0) {
            // zero date
            return null;
        }
        final LocalDate date;
        date = LocalDate.of(Packets.readInt2AsInt(buffer), Packets.readInt1AsInt(buffer), Packets.readInt1AsInt(buffer));
        buffer.skipBytes(length - 4);
        return date;
    }

    private static LocalDateTime readDateTime(final ByteBuf buffer) {
        final int length = Packets.readInt1AsInt(buffer);
        if (length == 0) {
            return null;
        }
        final int year, month, day;
        year = Packets.readInt2AsInt(buffer);
        month = Packets.readInt1AsInt(buffer);
        day = Packets.readInt1AsInt(buffer);

        int hour = 0, minute = 0, second = 0, micros = 0;
        if (length >= 7) {
            hour = Packets.readInt1AsInt(buffer);
            minute = Packets.readInt1AsInt(buffer);
            second = Packets.readInt1AsInt(buffer);
        }
        if (length >= 11) {
            micros = (int) Packets.readInt4AsLong(buffer);
        }
        return LocalDateTime.of(year, month, day, hour, minute, second, micros * 1000);
    }

    private static Duration readTime(final ByteBuf buffer) {
        final int length = Packets.readInt1AsInt(buffer);
        if (length == 0) {
            return Duration.ZERO;
        }
        final boolean negative = Packets.readInt1AsInt(buffer) == 1;
        Duration duration;
        duration = Duration.ofDays(Packets.readInt4AsLong(buffer))
                .plusHours(Packets.readInt1AsInt(buffer))
                .plusMinutes(Packets.readInt1AsInt(buffer))
                .plusSeconds(Packets.readInt1AsInt(buffer));
        if (length >= 12) {
            duration = duration.plusNanos(Packets.readInt4AsLong(buffer) * 1000L);
        }
        return negative ? duration.negated() : duration;
    }


}

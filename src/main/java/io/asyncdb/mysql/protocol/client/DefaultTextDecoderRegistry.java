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

import io.asyncdb.mysql.protocol.TextDecoderRegistry;
import io.asyncdb.mysql.protocol.TextValueDecoder;
import io.asyncdb.mysql.protocol.message.server.ColumnDefinitionMessage;
import io.asyncdb.mysql.protocol.message.server.ColumnTypes;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.Locale;

/**
 * <p>
 * Text protocol decoders of the common MySQL types.
 * <br/>
 *
 * @see <a href="https://dev.mysql.com/doc/dev/mysql-server/latest/page_protocol_com_query_response_text_resultset_row.html">Text Resultset Row</a>
 */
public final class DefaultTextDecoderRegistry implements TextDecoderRegistry {

    public static final DefaultTextDecoderRegistry INSTANCE = new DefaultTextDecoderRegistry();

    private static final String ZERO_DATE = "0000-00-00";

    static final DateTimeFormatter DATETIME_FORMATTER = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral(' ')
            .appendPattern("HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .toFormatter(Locale.ENGLISH);

    private DefaultTextDecoderRegistry() {
    }

    @Override
    public TextValueDecoder forType(final int columnType) {
        final TextValueDecoder decoder;
        switch (columnType) {
            case ColumnTypes.TINY:
            case ColumnTypes.SHORT:
            case ColumnTypes.INT24:
            case ColumnTypes.YEAR:
                decoder = DefaultTextDecoderRegistry::decodeInt;
                break;
            case ColumnTypes.LONG:
                decoder = DefaultTextDecoderRegistry::decodeLong;
                break;
            case ColumnTypes.LONGLONG:
                decoder = DefaultTextDecoderRegistry::decodeLongLong;
                break;
            case ColumnTypes.FLOAT:
                decoder = (column, value, charset) -> Float.parseFloat(ascii(value));
                break;
            case ColumnTypes.DOUBLE:
                decoder = (column, value, charset) -> Double.parseDouble(ascii(value));
                break;
            case ColumnTypes.DECIMAL:
            case ColumnTypes.NEWDECIMAL:
                decoder = (column, value, charset) -> new BigDecimal(ascii(value));
                break;
            case ColumnTypes.DATE:
                decoder = DefaultTextDecoderRegistry::decodeDate;
                break;
            case ColumnTypes.DATETIME:
            case ColumnTypes.TIMESTAMP:
                decoder = DefaultTextDecoderRegistry::decodeDateTime;
                break;
            case ColumnTypes.TIME:
                decoder = (column, value, charset) -> parseTime(ascii(value));
                break;
            case ColumnTypes.BIT:
            case ColumnTypes.GEOMETRY:
                decoder = DefaultTextDecoderRegistry::decodeBytes;
                break;
            case ColumnTypes.TINY_BLOB:
            case ColumnTypes.MEDIUM_BLOB:
            case ColumnTypes.LONG_BLOB:
            case ColumnTypes.BLOB:
            case ColumnTypes.VARCHAR:
            case ColumnTypes.VAR_STRING:
            case ColumnTypes.STRING:
                decoder = DefaultTextDecoderRegistry::decodeStringOrBytes;
                break;
            default:
                // JSON , ENUM , SET and unknown types
                decoder = DefaultTextDecoderRegistry::decodeString;
        }
        return decoder;
    }


    /**
     * <p>
     * Format : {@code [-]HHH:MM:SS[.ffffff]} , hour can exceed 24.
     * <br/>
     */
    static Duration parseTime(final String text) {
        final boolean negative = text.startsWith("-");
        final String body = negative ? text.substring(1) : text;

        final String[] parts = body.split(":");
        if (parts.length != 3) {
            throw new IllegalArgumentException(String.format("TIME value[%s] error", text));
        }
        final int dotIndex = parts[2].indexOf('.');
        final long seconds, nanos;
        if (dotIndex < 0) {
            seconds = Long.parseLong(parts[2]);
            nanos = 0L;
        } else {
            seconds = Long.parseLong(parts[2].substring(0, dotIndex));
            final StringBuilder fraction = new StringBuilder(parts[2].substring(dotIndex + 1));
            while (fraction.length() < 9) {
                fraction.append('0');
            }
            nanos = Long.parseLong(fraction.toString());
        }
        final Duration duration;
        duration = Duration.ofHours(Long.parseLong(parts[0]))
                .plusMinutes(Long.parseLong(parts[1]))
                .plusSeconds(seconds)
                .plusNanos(nanos);
        return negative ? duration.negated() : duration;
    }

    /*################################## blow private method ##################################*/

    private static String ascii(ByteBuf value) {
        return value.toString(value.readerIndex(), value.readableBytes(), StandardCharsets.US_ASCII);
    }

    private static Object decodeInt(ColumnDefinitionMessage column, ByteBuf value, Charset charset) {
        return Integer.parseInt(ascii(value));
    }

    private static Object decodeLong(ColumnDefinitionMessage column, ByteBuf value, Charset charset) {
        final Object v;
        if (column.isUnsigned()) {
            v = Long.parseLong(ascii(value));
        } else {
            v = Integer.parseInt(ascii(value));
        }
        return v;
    }

    private static Object decodeLongLong(ColumnDefinitionMessage column, ByteBuf value, Charset charset) {
        final Object v;
        if (column.isUnsigned()) {
            v = new BigInteger(ascii(value));
        } else {
            v = Long.parseLong(ascii(value));
        }
        return v;
    }

    private static Object decodeDate(ColumnDefinitionMessage column, ByteBuf value, Charset charset) {
        final String text = ascii(value);
        if (text.startsWith(ZERO_DATE)) {
            // zero date , same as null
            return null;
        }
        return LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE);
    }

    private static Object decodeDateTime(ColumnDefinitionMessage column, ByteBuf value, Charset charset) {
        final String text = ascii(value);
        if (text.startsWith(ZERO_DATE)) {
            return null;
        }
        return LocalDateTime.parse(text, DATETIME_FORMATTER);
    }

    private static Object decodeBytes(ColumnDefinitionMessage column, ByteBuf value, Charset charset) {
        return ByteBufUtil.getBytes(value);
    }

    private static Object decodeStringOrBytes(ColumnDefinitionMessage column, ByteBuf value, Charset charset) {
        final Object v;
        if (column.isBinary()) {
            v = ByteBufUtil.getBytes(value);
        } else {
            v = value.toString(value.readerIndex(), value.readableBytes(), charset);
        }
        return v;
    }

    private static Object decodeString(ColumnDefinitionMessage column, ByteBuf value, Charset charset) {
        return value.toString(value.readerIndex(), value.readableBytes(), charset);
    }


}

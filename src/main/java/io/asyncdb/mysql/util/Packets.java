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

package io.asyncdb.mysql.util;

import io.netty.buffer.ByteBuf;

import java.nio.charset.Charset;

/**
 * <p>
 * Little-endian primitives of MySQL protocol that value decoders share.
 * <br/>
 *
 * @see <a href="https://dev.mysql.com/doc/dev/mysql-server/latest/page_protocol_basic_dt_integers.html">Integer Types</a>
 * @see <a href="https://dev.mysql.com/doc/dev/mysql-server/latest/page_protocol_basic_dt_strings.html">String Types</a>
 */
public abstract class Packets {

    private Packets() {
        throw new UnsupportedOperationException();
    }

    public static final int ENC_0 = 0xFB;

    public static final int ENC_3 = 0xFC;

    public static final int ENC_4 = 0xFD;

    public static final int ENC_9 = 0xFE;


    public static int readInt1AsInt(ByteBuf byteBuf) {
        return byteBuf.readUnsignedByte();
    }

    public static int readInt2AsInt(ByteBuf byteBuf) {
        return byteBuf.readUnsignedShortLE();
    }

    public static int readInt3(ByteBuf byteBuf) {
        return byteBuf.readUnsignedMediumLE();
    }

    public static long readInt4AsLong(ByteBuf byteBuf) {
        return byteBuf.readUnsignedIntLE();
    }

    /**
     * @see <a href="https://dev.mysql.com/doc/dev/mysql-server/latest/page_protocol_basic_dt_integers.html#sect_protocol_basic_dt_int_le">Protocol::LengthEncodedInteger</a>
     */
    public static long readLenEnc(final ByteBuf byteBuf) {
        final int sw = readInt1AsInt(byteBuf);
        final long int8;
        switch (sw) {
            case ENC_0:
                // represents a NULL in a ProtocolText::ResultsetRow
                int8 = -1L;
                break;
            case ENC_3:
                int8 = readInt2AsInt(byteBuf);
                break;
            case ENC_4:
                int8 = readInt3(byteBuf);
                break;
            case ENC_9:
                int8 = byteBuf.readLongLE();
                break;
            default:
                int8 = sw;
        }
        return int8;
    }

    public static int readLenEncAsInt(final ByteBuf byteBuf) {
        final long length = readLenEnc(byteBuf);
        if (length > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(String.format("length encoded integer %s too large", length));
        }
        return (int) length;
    }

    public static byte[] readBytesLenEnc(final ByteBuf byteBuf) {
        final int length = readLenEncAsInt(byteBuf);
        final byte[] bytes;
        if (length < 0) {
            bytes = new byte[0];
        } else {
            bytes = new byte[length];
            byteBuf.readBytes(bytes);
        }
        return bytes;
    }

    public static String readStringLenEnc(final ByteBuf byteBuf, final Charset charset) {
        final int length = readLenEncAsInt(byteBuf);
        final String text;
        if (length < 0) {
            text = "";
        } else {
            text = byteBuf.readCharSequence(length, charset).toString();
        }
        return text;
    }


}

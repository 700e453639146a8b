/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.memlink.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.memlink.exception.MemcacheErrorKind;
import org.memlink.exception.MemcacheException;
import org.memlink.serde.SerializedValue;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Builds the exact bytes of every command of the memcached text protocol.
 *
 * <p>Keys are written as US-ASCII; a key that cannot be encoded fails with a
 * {@code CLIENT_ERROR} before any buffer is produced.
 */
public final class CommandEncoder {

    private static final byte SPACE = ' ';
    private static final byte[] CRLF = {'\r', '\n'};
    private static final byte[] NOREPLY = " noreply".getBytes(StandardCharsets.US_ASCII);

    private CommandEncoder() {}

    /**
     * Encodes {@code <name> <key> <flags> <expire> <length>[ noreply]\r\n<payload>\r\n}.
     */
    public static ByteBuf encodeStore(
            CommandName command, String key, SerializedValue value, int expire, boolean noreply) {
        if (command.family() != CommandName.Family.STORE || command == CommandName.CAS) {
            throw new IllegalArgumentException(command + " is not a plain store command");
        }
        return store(command, key, value, expire, null, noreply);
    }

    /**
     * Encodes {@code cas <key> <flags> <expire> <length> <cas>[ noreply]\r\n<payload>\r\n}.
     */
    public static ByteBuf encodeCas(String key, SerializedValue value, long cas, int expire, boolean noreply) {
        return store(CommandName.CAS, key, value, expire, Long.toUnsignedString(cas), noreply);
    }

    /**
     * Encodes {@code <name> <key1> <key2> ...\r\n}.
     */
    public static ByteBuf encodeFetch(CommandName command, Collection<String> keys) {
        if (command.family() != CommandName.Family.FETCH) {
            throw new IllegalArgumentException(command + " is not a fetch command");
        }
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("At least one key is required");
        }
        List<ByteBuffer> encodedKeys = new ArrayList<>(keys.size());
        for (String key : keys) {
            encodedKeys.add(encodeKey(key));
        }
        ByteBuf buffer = Unpooled.buffer();
        buffer.writeCharSequence(command.wireName(), StandardCharsets.US_ASCII);
        for (ByteBuffer key : encodedKeys) {
            buffer.writeByte(SPACE);
            buffer.writeBytes(key);
        }
        buffer.writeBytes(CRLF);
        return buffer;
    }

    public static ByteBuf encodeDelete(String key, boolean noreply) {
        return line(CommandName.DELETE, key, null, noreply);
    }

    /**
     * Encodes {@code incr|decr <key> <delta>[ noreply]\r\n}; the delta is written unsigned.
     */
    public static ByteBuf encodeArithmetic(CommandName command, String key, long delta, boolean noreply) {
        if (command != CommandName.INCR && command != CommandName.DECR) {
            throw new IllegalArgumentException(command + " is not an arithmetic command");
        }
        return line(command, key, Long.toUnsignedString(delta), noreply);
    }

    public static ByteBuf encodeTouch(String key, int expire, boolean noreply) {
        return line(CommandName.TOUCH, key, Integer.toString(expire), noreply);
    }

    public static ByteBuf encodeFlushAll(int delay, boolean noreply) {
        ByteBuf buffer = Unpooled.buffer();
        buffer.writeCharSequence(CommandName.FLUSH_ALL.wireName() + " " + delay, StandardCharsets.US_ASCII);
        if (noreply) {
            buffer.writeBytes(NOREPLY);
        }
        buffer.writeBytes(CRLF);
        return buffer;
    }

    public static ByteBuf encodeQuit() {
        ByteBuf buffer = Unpooled.buffer(6);
        buffer.writeCharSequence(CommandName.QUIT.wireName(), StandardCharsets.US_ASCII);
        buffer.writeBytes(CRLF);
        return buffer;
    }

    private static ByteBuf store(
            CommandName command, String key, SerializedValue value, int expire, String cas, boolean noreply) {
        if (value.flags() < 0 || value.flags() > SerializedValue.MAX_FLAGS) {
            throw MemcacheException.clientError("Flags out of range 0-65535: " + value.flags());
        }
        ByteBuffer encodedKey = encodeKey(key);
        byte[] payload = value.bytes();

        StringBuilder header = new StringBuilder()
                .append(' ')
                .append(value.flags())
                .append(' ')
                .append(expire)
                .append(' ')
                .append(payload.length);
        if (cas != null) {
            header.append(' ').append(cas);
        }

        ByteBuf buffer = Unpooled.buffer(command.wireName().length() + encodedKey.remaining() + header.length()
                + NOREPLY.length + payload.length + 2 * CRLF.length + 1);
        buffer.writeCharSequence(command.wireName(), StandardCharsets.US_ASCII);
        buffer.writeByte(SPACE);
        buffer.writeBytes(encodedKey);
        buffer.writeCharSequence(header, StandardCharsets.US_ASCII);
        if (noreply) {
            buffer.writeBytes(NOREPLY);
        }
        buffer.writeBytes(CRLF);
        buffer.writeBytes(payload);
        buffer.writeBytes(CRLF);
        return buffer;
    }

    private static ByteBuf line(CommandName command, String key, String argument, boolean noreply) {
        ByteBuffer encodedKey = encodeKey(key);
        ByteBuf buffer = Unpooled.buffer();
        buffer.writeCharSequence(command.wireName(), StandardCharsets.US_ASCII);
        buffer.writeByte(SPACE);
        buffer.writeBytes(encodedKey);
        if (argument != null) {
            buffer.writeByte(SPACE);
            buffer.writeCharSequence(argument, StandardCharsets.US_ASCII);
        }
        if (noreply) {
            buffer.writeBytes(NOREPLY);
        }
        buffer.writeBytes(CRLF);
        return buffer;
    }

    static ByteBuffer encodeKey(String key) {
        try {
            return StandardCharsets.US_ASCII.newEncoder().encode(CharBuffer.wrap(key));
        } catch (CharacterCodingException e) {
            throw new MemcacheException(MemcacheErrorKind.CLIENT_ERROR, "Key cannot be encoded as ASCII: " + key, e);
        }
    }
}

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

package org.memlink.serde;

import org.memlink.exception.MemcacheErrorKind;
import org.memlink.exception.MemcacheException;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;

/**
 * Ready-made serializer and deserializer pairs for the common value types.
 */
public final class ValueSerdes {

    private ValueSerdes() {}

    /**
     * Stores raw bytes with flags {@code 0}.
     */
    public static ValueSerializer<byte[]> bytesSerializer() {
        return (key, value) -> SerializedValue.of(value);
    }

    /**
     * Returns the raw bytes, ignoring flags.
     */
    public static ValueDeserializer<byte[]> bytesDeserializer() {
        return (key, value, flags) -> value;
    }

    /**
     * Stores strings as UTF-8 with flags {@code 0}. Strings UTF-8 cannot represent fail
     * with {@code CLIENT_ERROR}.
     */
    public static ValueSerializer<String> stringSerializer() {
        return (key, value) -> SerializedValue.of(encodeUtf8(key, value));
    }

    /**
     * Decodes values as UTF-8, ignoring flags.
     */
    public static ValueDeserializer<String> stringDeserializer() {
        return (key, value, flags) -> new String(value, StandardCharsets.UTF_8);
    }

    static byte[] encodeUtf8(String key, String value) {
        try {
            ByteBuffer encoded = StandardCharsets.UTF_8.newEncoder().encode(CharBuffer.wrap(value));
            byte[] bytes = new byte[encoded.remaining()];
            encoded.get(bytes);
            return bytes;
        } catch (CharacterCodingException e) {
            throw new MemcacheException(
                    MemcacheErrorKind.CLIENT_ERROR, "Value for key '" + key + "' cannot be encoded as UTF-8", e);
        }
    }
}

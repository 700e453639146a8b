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

import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import java.nio.charset.StandardCharsets;

/**
 * Serializer and deserializer pair storing plain strings as UTF-8 under {@link #FLAG_STRING}
 * and every other value as JSON under {@link #FLAG_JSON}.
 *
 * <p>Values stored under flags {@code 0} (written by a client without serialization) are
 * read back as strings when the target type is {@code String}.
 *
 * @param <T> the application value type
 */
public final class JsonValueSerde<T> implements ValueSerializer<T>, ValueDeserializer<T> {

    public static final int FLAG_RAW = 0;
    public static final int FLAG_STRING = 1;
    public static final int FLAG_JSON = 2;

    private static final ObjectMapper DEFAULT_MAPPER = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private final ObjectMapper mapper;
    private final Class<T> type;

    private JsonValueSerde(ObjectMapper mapper, Class<T> type) {
        this.mapper = mapper;
        this.type = type;
    }

    public static <T> JsonValueSerde<T> of(Class<T> type) {
        return new JsonValueSerde<>(DEFAULT_MAPPER, type);
    }

    public static <T> JsonValueSerde<T> of(ObjectMapper mapper, Class<T> type) {
        return new JsonValueSerde<>(mapper, type);
    }

    @Override
    public SerializedValue serialize(String key, T value) {
        if (value instanceof String) {
            return new SerializedValue(ValueSerdes.encodeUtf8(key, (String) value), FLAG_STRING);
        }
        return new SerializedValue(mapper.writeValueAsBytes(value), FLAG_JSON);
    }

    @Override
    public T deserialize(String key, byte[] value, int flags) {
        switch (flags) {
            case FLAG_JSON:
                return mapper.readValue(value, type);
            case FLAG_RAW:
            case FLAG_STRING:
                if (type == String.class || type == Object.class) {
                    return type.cast(new String(value, StandardCharsets.UTF_8));
                }
                throw new IllegalArgumentException(
                        "Value for key '" + key + "' is a plain string and cannot be read as " + type.getName());
            default:
                throw new IllegalArgumentException("Unknown flags " + flags + " for key '" + key + "'");
        }
    }
}

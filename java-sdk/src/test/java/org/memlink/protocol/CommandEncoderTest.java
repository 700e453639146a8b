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
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.memlink.exception.MemcacheErrorKind;
import org.memlink.exception.MemcacheException;
import org.memlink.serde.SerializedValue;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandEncoderTest {

    private static String text(ByteBuf buffer) {
        try {
            return buffer.toString(StandardCharsets.UTF_8);
        } finally {
            buffer.release();
        }
    }

    private static SerializedValue value(String text) {
        return SerializedValue.of(text.getBytes(StandardCharsets.UTF_8));
    }

    @Nested
    class Store {

        @Test
        void shouldEncodeSet() {
            assertThat(text(CommandEncoder.encodeStore(CommandName.SET, "foo", value("bar"), 0, false)))
                    .isEqualTo("set foo 0 0 3\r\nbar\r\n");
        }

        @Test
        void shouldAppendNoreplyBeforeHeaderTerminator() {
            assertThat(text(CommandEncoder.encodeStore(CommandName.ADD, "foo", value("bar"), 60, true)))
                    .isEqualTo("add foo 0 60 3 noreply\r\nbar\r\n");
        }

        @Test
        void shouldWriteFlagsAndPayloadLengthInBytes() {
            // given
            SerializedValue serialized = new SerializedValue("héllo".getBytes(StandardCharsets.UTF_8), 65535);

            // when
            String encoded = text(CommandEncoder.encodeStore(CommandName.PREPEND, "k", serialized, 5, false));

            // then
            assertThat(encoded).isEqualTo("prepend k 65535 5 6\r\nhéllo\r\n");
        }

        @Test
        void shouldEncodeEmptyPayload() {
            assertThat(text(CommandEncoder.encodeStore(CommandName.APPEND, "k", value(""), 0, false)))
                    .isEqualTo("append k 0 0 0\r\n\r\n");
        }

        @Test
        void shouldEncodeCasWithUnsignedToken() {
            assertThat(text(CommandEncoder.encodeCas("k", value("v"), -1L, 0, false)))
                    .isEqualTo("cas k 0 0 1 18446744073709551615\r\nv\r\n");
            assertThat(text(CommandEncoder.encodeCas("k", value("v"), 42L, 10, true)))
                    .isEqualTo("cas k 0 10 1 42 noreply\r\nv\r\n");
        }

        @Test
        void shouldRejectFlagsOutOfRange() {
            SerializedValue serialized = new SerializedValue(new byte[0], 65536);

            assertThatThrownBy(() -> CommandEncoder.encodeStore(CommandName.SET, "k", serialized, 0, false))
                    .isInstanceOfSatisfying(MemcacheException.class, e -> {
                        assertThat(e.getKind()).isEqualTo(MemcacheErrorKind.CLIENT_ERROR);
                        assertThat(e.getDetail()).isEqualTo("Flags out of range 0-65535: 65536");
                    });
        }

        @ParameterizedTest
        @EnumSource(
                value = CommandName.class,
                names = {"SET", "ADD", "REPLACE", "APPEND", "PREPEND"},
                mode = EnumSource.Mode.EXCLUDE)
        void shouldRejectCommandsOutsidePlainStoreFamily(CommandName command) {
            assertThatThrownBy(() -> CommandEncoder.encodeStore(command, "k", value("v"), 0, false))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class Fetch {

        @Test
        void shouldEncodeSingleKey() {
            assertThat(text(CommandEncoder.encodeFetch(CommandName.GET, List.of("foo"))))
                    .isEqualTo("get foo\r\n");
        }

        @Test
        void shouldJoinKeysWithSpacesInOrder() {
            assertThat(text(CommandEncoder.encodeFetch(CommandName.GETS, List.of("b", "a", "c"))))
                    .isEqualTo("gets b a c\r\n");
        }

        @Test
        void shouldRejectEmptyKeys() {
            assertThatThrownBy(() -> CommandEncoder.encodeFetch(CommandName.GET, List.of()))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldRejectNonFetchCommand() {
            assertThatThrownBy(() -> CommandEncoder.encodeFetch(CommandName.DELETE, List.of("k")))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class Misc {

        @Test
        void shouldEncodeDelete() {
            assertThat(text(CommandEncoder.encodeDelete("foo", false))).isEqualTo("delete foo\r\n");
            assertThat(text(CommandEncoder.encodeDelete("foo", true))).isEqualTo("delete foo noreply\r\n");
        }

        @Test
        void shouldEncodeArithmeticWithUnsignedDelta() {
            assertThat(text(CommandEncoder.encodeArithmetic(CommandName.INCR, "n", 5, false)))
                    .isEqualTo("incr n 5\r\n");
            assertThat(text(CommandEncoder.encodeArithmetic(CommandName.DECR, "n", -1L, true)))
                    .isEqualTo("decr n 18446744073709551615 noreply\r\n");
        }

        @Test
        void shouldRejectNonArithmeticCommand() {
            assertThatThrownBy(() -> CommandEncoder.encodeArithmetic(CommandName.TOUCH, "n", 1, false))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldEncodeTouch() {
            assertThat(text(CommandEncoder.encodeTouch("k", 30, false))).isEqualTo("touch k 30\r\n");
        }

        @Test
        void shouldEncodeFlushAll() {
            assertThat(text(CommandEncoder.encodeFlushAll(0, false))).isEqualTo("flush_all 0\r\n");
            assertThat(text(CommandEncoder.encodeFlushAll(10, true))).isEqualTo("flush_all 10 noreply\r\n");
        }

        @Test
        void shouldEncodeQuit() {
            assertThat(text(CommandEncoder.encodeQuit())).isEqualTo("quit\r\n");
        }
    }

    @Nested
    class Keys {

        @Test
        void shouldRejectNonAsciiKey() {
            assertThatThrownBy(() -> CommandEncoder.encodeDelete("clé", false))
                    .isInstanceOfSatisfying(MemcacheException.class, e -> {
                        assertThat(e.getKind()).isEqualTo(MemcacheErrorKind.CLIENT_ERROR);
                        assertThat(e.getDetail()).isEqualTo("Key cannot be encoded as ASCII: clé");
                    });
        }

        @Test
        void shouldRejectNonAsciiKeyAmongFetchKeys() {
            assertThatThrownBy(() -> CommandEncoder.encodeFetch(CommandName.GET, List.of("ok", "ключ")))
                    .isInstanceOfSatisfying(MemcacheException.class, e -> assertThat(e.getKind())
                            .isEqualTo(MemcacheErrorKind.CLIENT_ERROR));
        }
    }
}

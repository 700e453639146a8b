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

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * Serves pre-split chunks, then an empty buffer for every further call.
 */
final class ScriptedChunkSource implements ChunkSource {

    private final Deque<byte[]> chunks = new ArrayDeque<>();
    private int served;

    static ScriptedChunkSource of(String... chunks) {
        ScriptedChunkSource source = new ScriptedChunkSource();
        for (String chunk : chunks) {
            source.chunks.add(chunk.getBytes(StandardCharsets.UTF_8));
        }
        return source;
    }

    static ScriptedChunkSource split(byte[] stream, int chunkSize) {
        ScriptedChunkSource source = new ScriptedChunkSource();
        for (int offset = 0; offset < stream.length; offset += chunkSize) {
            source.chunks.add(Arrays.copyOfRange(stream, offset, Math.min(stream.length, offset + chunkSize)));
        }
        return source;
    }

    @Override
    public ByteBuf nextChunk() {
        byte[] chunk = chunks.poll();
        if (chunk == null) {
            return Unpooled.EMPTY_BUFFER;
        }
        served++;
        return Unpooled.wrappedBuffer(chunk);
    }

    int served() {
        return served;
    }
}

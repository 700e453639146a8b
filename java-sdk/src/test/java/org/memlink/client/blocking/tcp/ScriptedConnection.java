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

package org.memlink.client.blocking.tcp;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * In-memory connection replaying canned server bytes and recording every request.
 */
final class ScriptedConnection implements MemcacheConnection {

    private final Deque<String> replies = new ArrayDeque<>();
    private final List<String> requests = new ArrayList<>();
    private boolean closed;

    ScriptedConnection reply(String... chunks) {
        for (String chunk : chunks) {
            replies.add(chunk);
        }
        return this;
    }

    @Override
    public void send(ByteBuf request) {
        try {
            requests.add(request.toString(StandardCharsets.UTF_8));
        } finally {
            request.release();
        }
    }

    @Override
    public ByteBuf nextChunk() {
        String chunk = replies.poll();
        if (chunk == null) {
            return Unpooled.EMPTY_BUFFER;
        }
        return Unpooled.copiedBuffer(chunk, StandardCharsets.UTF_8);
    }

    @Override
    public void close() {
        closed = true;
    }

    List<String> requests() {
        return requests;
    }

    boolean isClosed() {
        return closed;
    }
}

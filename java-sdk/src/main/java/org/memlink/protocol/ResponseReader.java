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
import org.memlink.exception.MemcacheException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Incremental reader of CRLF-terminated lines and fixed-size values.
 *
 * <p>Chunks pulled from the {@link ChunkSource} are accumulated in a pending buffer. Bytes
 * read past the end of the returned line or value stay pending for the next call, so the
 * buffer always starts at the first byte of the next protocol element. A terminator split
 * across two chunks is found because the search runs over the accumulated bytes.
 *
 * <p>Not thread-safe; owned by a single connection and released together with it.
 */
public final class ResponseReader {

    private static final Logger log = LoggerFactory.getLogger(ResponseReader.class);
    private static final byte CR = '\r';
    private static final byte LF = '\n';
    private static final int TERMINATOR_LENGTH = 2;

    private final ChunkSource source;
    private final ByteBuf pending;

    public ResponseReader(ChunkSource source) {
        this.source = source;
        this.pending = Unpooled.buffer();
    }

    /**
     * Reads the next line.
     *
     * @return the line, decoded as UTF-8, without its terminator
     * @throws MemcacheException with kind {@code UNEXPECTED_CLOSE} if the stream ends first
     */
    public String readLine() {
        int searchFrom = pending.readerIndex();
        while (true) {
            int lf = pending.indexOf(searchFrom, pending.writerIndex(), LF);
            if (lf == -1) {
                searchFrom = pending.writerIndex();
                fill();
                continue;
            }
            if (lf > pending.readerIndex() && pending.getByte(lf - 1) == CR) {
                int start = pending.readerIndex();
                String line = pending.toString(start, lf - 1 - start, StandardCharsets.UTF_8);
                pending.readerIndex(lf + 1);
                pending.discardSomeReadBytes();
                log.trace("Read line: {}", line);
                return line;
            }
            // a bare LF is part of the line
            searchFrom = lf + 1;
        }
    }

    /**
     * Reads a value of exactly {@code size} bytes followed by the terminator.
     *
     * @param size the number of value bytes announced by the server
     * @return the value bytes, terminator excluded
     * @throws MemcacheException with kind {@code UNEXPECTED_CLOSE} if the stream ends first,
     *     or {@code UNKNOWN_RESPONSE} if the value is not followed by CRLF
     */
    public byte[] readValue(int size) {
        if (size < 0 || size > Integer.MAX_VALUE - TERMINATOR_LENGTH) {
            throw new IllegalArgumentException("Invalid value size: " + size);
        }
        while (pending.readableBytes() < size + TERMINATOR_LENGTH) {
            fill();
        }
        byte[] value = new byte[size];
        pending.readBytes(value);
        byte first = pending.readByte();
        byte second = pending.readByte();
        pending.discardSomeReadBytes();
        if (first != CR || second != LF) {
            throw MemcacheException.unknownResponse("Value of " + size + " bytes is not terminated by CRLF");
        }
        log.trace("Read value of {} bytes", size);
        return value;
    }

    /**
     * Returns the number of bytes read from the source but not consumed yet.
     */
    public int pendingBytes() {
        return pending.readableBytes();
    }

    /**
     * Drops the pending bytes and frees the buffer. The reader cannot be used afterwards.
     */
    public void release() {
        if (pending.refCnt() > 0) {
            pending.release();
        }
    }

    private void fill() {
        ByteBuf chunk = source.nextChunk();
        try {
            if (!chunk.isReadable()) {
                throw MemcacheException.unexpectedClose();
            }
            pending.writeBytes(chunk);
        } finally {
            chunk.release();
        }
    }
}

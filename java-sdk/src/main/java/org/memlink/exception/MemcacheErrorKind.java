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

package org.memlink.exception;

/**
 * The closed set of failure classes a memcached client operation can end with.
 *
 * <p>Callers are expected to branch on the kind carried by {@link MemcacheException}
 * rather than on exception subclasses.
 */
public enum MemcacheErrorKind {
    /**
     * The server answered {@code ERROR}: it did not recognize the command, which usually
     * means a protocol version mismatch. Not retriable.
     */
    UNKNOWN_COMMAND(false),

    /**
     * The server answered {@code CLIENT_ERROR}, or the request could not be encoded locally
     * (bad key or value form). Not retriable with the same request.
     */
    CLIENT_ERROR(false),

    /**
     * The server answered {@code SERVER_ERROR}. The condition may be transient; a caller may
     * retry at a higher level.
     */
    SERVER_ERROR(true),

    /**
     * A response line did not match the grammar of the command that was issued.
     */
    UNKNOWN_RESPONSE(false),

    /**
     * The stream ended before a complete line or value was read.
     */
    UNEXPECTED_CLOSE(true),

    /**
     * The underlying transport failed: connect failure, I/O timeout or channel error.
     */
    TRANSPORT(true);

    private final boolean transientFailure;

    MemcacheErrorKind(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    /**
     * Returns whether a fresh attempt of the same request could succeed.
     *
     * @return true for failures caused by server or network conditions
     */
    public boolean isTransient() {
        return transientFailure;
    }
}

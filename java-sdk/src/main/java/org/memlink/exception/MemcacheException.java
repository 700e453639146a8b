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

import org.apache.commons.lang3.StringUtils;

/**
 * Exception thrown by every memlink client operation that fails.
 *
 * <p>The failure class is carried as a {@link MemcacheErrorKind}; the detail is the text
 * the server sent (for {@code CLIENT_ERROR} and {@code SERVER_ERROR}), an excerpt of the
 * offending line (for unknown responses), or a description of the local condition.
 */
public class MemcacheException extends RuntimeException {

    private final MemcacheErrorKind kind;
    private final String detail;

    /**
     * Constructs a new MemcacheException.
     *
     * @param kind the failure class
     * @param detail the failure detail, may be empty
     */
    public MemcacheException(MemcacheErrorKind kind, String detail) {
        super(buildMessage(kind, detail));
        this.kind = kind;
        this.detail = StringUtils.defaultString(detail);
    }

    /**
     * Constructs a new MemcacheException with a cause.
     *
     * @param kind the failure class
     * @param detail the failure detail, may be empty
     * @param cause the underlying cause
     */
    public MemcacheException(MemcacheErrorKind kind, String detail, Throwable cause) {
        super(buildMessage(kind, detail), cause);
        this.kind = kind;
        this.detail = StringUtils.defaultString(detail);
    }

    public static MemcacheException unknownCommand(String commandName) {
        return new MemcacheException(MemcacheErrorKind.UNKNOWN_COMMAND, commandName);
    }

    public static MemcacheException clientError(String detail) {
        return new MemcacheException(MemcacheErrorKind.CLIENT_ERROR, detail);
    }

    public static MemcacheException serverError(String detail) {
        return new MemcacheException(MemcacheErrorKind.SERVER_ERROR, detail);
    }

    public static MemcacheException unknownResponse(String excerpt) {
        return new MemcacheException(MemcacheErrorKind.UNKNOWN_RESPONSE, excerpt);
    }

    public static MemcacheException unexpectedClose() {
        return new MemcacheException(MemcacheErrorKind.UNEXPECTED_CLOSE, "Connection closed by server");
    }

    public static MemcacheException transport(String detail, Throwable cause) {
        return new MemcacheException(MemcacheErrorKind.TRANSPORT, detail, cause);
    }

    /**
     * Returns the failure class.
     *
     * @return the kind
     */
    public MemcacheErrorKind getKind() {
        return kind;
    }

    /**
     * Returns the failure detail without the kind prefix.
     *
     * @return the detail, never null
     */
    public String getDetail() {
        return detail;
    }

    private static String buildMessage(MemcacheErrorKind kind, String detail) {
        if (StringUtils.isBlank(detail)) {
            return kind.name();
        }
        return kind.name() + ": " + detail;
    }
}

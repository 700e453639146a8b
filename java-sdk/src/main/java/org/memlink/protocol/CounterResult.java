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

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;

/**
 * Reply to an {@code incr} or {@code decr}: either the counter's new unsigned 64-bit value
 * or the {@code NOT_FOUND} token.
 */
public final class CounterResult {

    public static final String NOT_FOUND_TOKEN = "NOT_FOUND";

    private static final CounterResult NOT_FOUND = new CounterResult(null);

    private final BigInteger value;

    private CounterResult(BigInteger value) {
        this.value = value;
    }

    public static CounterResult of(BigInteger value) {
        return new CounterResult(Objects.requireNonNull(value, "value"));
    }

    public static CounterResult of(long value) {
        return of(BigInteger.valueOf(value));
    }

    public static CounterResult notFound() {
        return NOT_FOUND;
    }

    public boolean isFound() {
        return value != null;
    }

    public Optional<BigInteger> value() {
        return Optional.ofNullable(value);
    }

    /**
     * Returns the literal reply: the decimal value, or {@code NOT_FOUND}.
     */
    @Override
    public String toString() {
        return value == null ? NOT_FOUND_TOKEN : value.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CounterResult that = (CounterResult) o;
        return Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }
}

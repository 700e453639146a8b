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

import java.util.Arrays;
import java.util.Objects;

/**
 * Wire form of a value: its bytes and the 16-bit flags stored alongside them.
 */
public record SerializedValue(byte[] bytes, int flags) {

    public static final int MAX_FLAGS = 0xFFFF;

    public SerializedValue {
        Objects.requireNonNull(bytes, "bytes");
    }

    public static SerializedValue of(byte[] bytes) {
        return new SerializedValue(bytes, 0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SerializedValue that = (SerializedValue) o;
        return flags == that.flags && Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(bytes) + flags;
    }

    @Override
    public String toString() {
        return "SerializedValue[length=" + bytes.length + ", flags=" + flags + "]";
    }
}

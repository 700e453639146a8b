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

/**
 * Turns an application value into the bytes stored in memcached plus the 16-bit flags
 * stored alongside them.
 *
 * @param <V> the application value type
 */
@FunctionalInterface
public interface ValueSerializer<V> {

    /**
     * Serializes a value about to be stored under the given key.
     *
     * @param key the cache key
     * @param value the value to store
     * @return the wire bytes and flags
     */
    SerializedValue serialize(String key, V value);
}

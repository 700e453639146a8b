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
 * Turns the bytes and flags returned by memcached back into an application value.
 *
 * @param <V> the application value type
 */
@FunctionalInterface
public interface ValueDeserializer<V> {

    /**
     * Deserializes a value fetched for the given key.
     *
     * @param key the cache key
     * @param value the raw bytes sent by the server
     * @param flags the flags stored with the value
     * @return the application value
     */
    V deserialize(String key, byte[] value, int flags);
}

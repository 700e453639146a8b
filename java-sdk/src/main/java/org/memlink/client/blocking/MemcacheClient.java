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

package org.memlink.client.blocking;

import org.memlink.protocol.CounterResult;
import org.memlink.protocol.StoreResult;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Blocking client for a single memcached server speaking the text protocol.
 *
 * <p>Operations return an empty {@link Optional} when sent with {@code noreply}. Overloads
 * without a {@code noreply} argument use {@link #isDefaultNoreply()} for set, add, replace,
 * append, prepend, delete, touch and flush_all, and always wait for the reply of cas, incr
 * and decr. Expiry and delay arguments are in seconds, zero meaning none.
 *
 * <p>Every failure is reported as a {@link org.memlink.exception.MemcacheException}; the
 * connection is closed when one occurs and reopened by the next call.
 *
 * @param <V> the application value type
 */
public interface MemcacheClient<V> extends AutoCloseable {

    boolean isDefaultNoreply();

    default Optional<StoreResult> set(String key, V value) {
        return set(key, value, 0);
    }

    default Optional<StoreResult> set(String key, V value, int expire) {
        return set(key, value, expire, isDefaultNoreply());
    }

    Optional<StoreResult> set(String key, V value, int expire, boolean noreply);

    default void setMany(Map<String, ? extends V> values) {
        setMany(values, 0);
    }

    default void setMany(Map<String, ? extends V> values, int expire) {
        setMany(values, expire, isDefaultNoreply());
    }

    /**
     * Stores every entry with one {@code set} per key, in the map's iteration order.
     *
     * <p>The first failure aborts the loop and is rethrown; entries sent before it may or
     * may not have been stored.
     */
    default void setMany(Map<String, ? extends V> values, int expire, boolean noreply) {
        for (Map.Entry<String, ? extends V> entry : values.entrySet()) {
            set(entry.getKey(), entry.getValue(), expire, noreply);
        }
    }

    default Optional<StoreResult> add(String key, V value) {
        return add(key, value, 0);
    }

    default Optional<StoreResult> add(String key, V value, int expire) {
        return add(key, value, expire, isDefaultNoreply());
    }

    Optional<StoreResult> add(String key, V value, int expire, boolean noreply);

    default Optional<StoreResult> replace(String key, V value) {
        return replace(key, value, 0);
    }

    default Optional<StoreResult> replace(String key, V value, int expire) {
        return replace(key, value, expire, isDefaultNoreply());
    }

    Optional<StoreResult> replace(String key, V value, int expire, boolean noreply);

    default Optional<StoreResult> append(String key, V value) {
        return append(key, value, 0);
    }

    default Optional<StoreResult> append(String key, V value, int expire) {
        return append(key, value, expire, isDefaultNoreply());
    }

    Optional<StoreResult> append(String key, V value, int expire, boolean noreply);

    default Optional<StoreResult> prepend(String key, V value) {
        return prepend(key, value, 0);
    }

    default Optional<StoreResult> prepend(String key, V value, int expire) {
        return prepend(key, value, expire, isDefaultNoreply());
    }

    Optional<StoreResult> prepend(String key, V value, int expire, boolean noreply);

    default Optional<StoreResult> cas(String key, V value, long cas) {
        return cas(key, value, cas, 0);
    }

    default Optional<StoreResult> cas(String key, V value, long cas, int expire) {
        return cas(key, value, cas, expire, false);
    }

    /**
     * Stores the value only if the key's current cas token equals {@code cas}.
     *
     * @return {@code STORED}, {@code EXISTS} when the token is stale, or {@code NOT_FOUND}
     */
    Optional<StoreResult> cas(String key, V value, long cas, int expire, boolean noreply);

    default Optional<V> get(String key) {
        return Optional.ofNullable(getMany(List.of(key)).get(key));
    }

    /**
     * Fetches several keys with one {@code get} command.
     *
     * @return the values of the keys the server returned; missing keys are absent
     */
    Map<String, V> getMany(Collection<String> keys);

    default Optional<CasValue<V>> gets(String key) {
        return Optional.ofNullable(getsMany(List.of(key)).get(key));
    }

    /**
     * Fetches several keys with their cas tokens with one {@code gets} command.
     *
     * @return the values of the keys the server returned; missing keys are absent
     */
    Map<String, CasValue<V>> getsMany(Collection<String> keys);

    default Optional<String> delete(String key) {
        return delete(key, isDefaultNoreply());
    }

    /**
     * @return {@code DELETED} or {@code NOT_FOUND}, as sent by the server
     */
    Optional<String> delete(String key, boolean noreply);

    default void deleteMany(Collection<String> keys) {
        deleteMany(keys, isDefaultNoreply());
    }

    /**
     * Deletes every key with one {@code delete} per key, sequentially.
     *
     * <p>The first failure aborts the loop and is rethrown; keys sent before it may or may
     * not have been deleted.
     */
    default void deleteMany(Collection<String> keys, boolean noreply) {
        for (String key : keys) {
            delete(key, noreply);
        }
    }

    default Optional<CounterResult> incr(String key, long delta) {
        return incr(key, delta, false);
    }

    Optional<CounterResult> incr(String key, long delta, boolean noreply);

    default Optional<CounterResult> decr(String key, long delta) {
        return decr(key, delta, false);
    }

    Optional<CounterResult> decr(String key, long delta, boolean noreply);

    default Optional<String> touch(String key) {
        return touch(key, 0);
    }

    default Optional<String> touch(String key, int expire) {
        return touch(key, expire, isDefaultNoreply());
    }

    Optional<String> touch(String key, int expire, boolean noreply);

    default Optional<String> flushAll() {
        return flushAll(0);
    }

    default Optional<String> flushAll(int delay) {
        return flushAll(delay, isDefaultNoreply());
    }

    Optional<String> flushAll(int delay, boolean noreply);

    /**
     * Sends {@code quit} and closes the connection. The client reconnects on the next call.
     */
    void quit();

    /**
     * Closes the connection if one is open. The client reconnects on the next call.
     */
    @Override
    void close();
}

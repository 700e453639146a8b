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
import org.memlink.client.blocking.CasValue;
import org.memlink.client.blocking.MemcacheClient;
import org.memlink.protocol.CommandEncoder;
import org.memlink.protocol.CommandName;
import org.memlink.protocol.CounterResult;
import org.memlink.protocol.ResponseClassifier;
import org.memlink.protocol.StoreResult;
import org.memlink.protocol.ValueHeader;
import org.memlink.serde.SerializedValue;
import org.memlink.serde.ValueDeserializer;
import org.memlink.serde.ValueSerdes;
import org.memlink.serde.ValueSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@link MemcacheClient} over a single TCP connection.
 *
 * <p>The connection is opened by the first operation and closed whenever an operation
 * fails; the next operation opens a new one. One request is in flight at a time, and an
 * instance must not be shared between threads without external synchronization.
 *
 * @param <V> the application value type
 */
public class MemcacheTcpClient<V> implements MemcacheClient<V> {

    private static final Logger log = LoggerFactory.getLogger(MemcacheTcpClient.class);

    private final ConnectionLifecycle lifecycle;
    private final ValueSerializer<V> serializer;
    private final ValueDeserializer<V> deserializer;
    private final boolean ignoreErrors;
    private final boolean defaultNoreply;

    MemcacheTcpClient(
            ConnectionFactory connectionFactory,
            ValueSerializer<V> serializer,
            ValueDeserializer<V> deserializer,
            boolean ignoreErrors,
            boolean defaultNoreply) {
        this.lifecycle = new ConnectionLifecycle(connectionFactory);
        this.serializer = serializer;
        this.deserializer = deserializer;
        this.ignoreErrors = ignoreErrors;
        this.defaultNoreply = defaultNoreply;
    }

    /**
     * Creates a builder for a client storing raw {@code byte[]} values with flags {@code 0}.
     *
     * @return a new builder
     */
    public static MemcacheTcpClientBuilder<byte[]> builder() {
        return new MemcacheTcpClientBuilder<>(ValueSerdes.bytesSerializer(), ValueSerdes.bytesDeserializer());
    }

    /**
     * Creates a builder for a client converting values with the given functions.
     *
     * @param serializer turns values into bytes and flags before they are stored
     * @param deserializer turns fetched bytes and flags back into values
     * @return a new builder
     */
    public static <V> MemcacheTcpClientBuilder<V> builder(
            ValueSerializer<V> serializer, ValueDeserializer<V> deserializer) {
        return new MemcacheTcpClientBuilder<>(serializer, deserializer);
    }

    @Override
    public boolean isDefaultNoreply() {
        return defaultNoreply;
    }

    @Override
    public Optional<StoreResult> set(String key, V value, int expire, boolean noreply) {
        return store(CommandName.SET, key, value, expire, noreply);
    }

    @Override
    public Optional<StoreResult> add(String key, V value, int expire, boolean noreply) {
        return store(CommandName.ADD, key, value, expire, noreply);
    }

    @Override
    public Optional<StoreResult> replace(String key, V value, int expire, boolean noreply) {
        return store(CommandName.REPLACE, key, value, expire, noreply);
    }

    @Override
    public Optional<StoreResult> append(String key, V value, int expire, boolean noreply) {
        return store(CommandName.APPEND, key, value, expire, noreply);
    }

    @Override
    public Optional<StoreResult> prepend(String key, V value, int expire, boolean noreply) {
        return store(CommandName.PREPEND, key, value, expire, noreply);
    }

    @Override
    public Optional<StoreResult> cas(String key, V value, long cas, int expire, boolean noreply) {
        return exchange(
                () -> CommandEncoder.encodeCas(key, serialize(key, value), cas, expire, noreply),
                noreply,
                line -> ResponseClassifier.classifyStore(line, CommandName.CAS));
    }

    @Override
    public Map<String, V> getMany(Collection<String> keys) {
        return fetch(CommandName.GET, keys, (header, value) -> value);
    }

    @Override
    public Map<String, CasValue<V>> getsMany(Collection<String> keys) {
        return fetch(CommandName.GETS, keys, (header, value) -> new CasValue<>(value, header.cas().orElseThrow()));
    }

    @Override
    public Optional<String> delete(String key, boolean noreply) {
        return exchange(
                () -> CommandEncoder.encodeDelete(key, noreply),
                noreply,
                line -> ResponseClassifier.classifyMisc(line, CommandName.DELETE));
    }

    @Override
    public Optional<CounterResult> incr(String key, long delta, boolean noreply) {
        return arithmetic(CommandName.INCR, key, delta, noreply);
    }

    @Override
    public Optional<CounterResult> decr(String key, long delta, boolean noreply) {
        return arithmetic(CommandName.DECR, key, delta, noreply);
    }

    @Override
    public Optional<String> touch(String key, int expire, boolean noreply) {
        return exchange(
                () -> CommandEncoder.encodeTouch(key, expire, noreply),
                noreply,
                line -> ResponseClassifier.classifyMisc(line, CommandName.TOUCH));
    }

    @Override
    public Optional<String> flushAll(int delay, boolean noreply) {
        return exchange(
                () -> CommandEncoder.encodeFlushAll(delay, noreply),
                noreply,
                line -> ResponseClassifier.classifyMisc(line, CommandName.FLUSH_ALL));
    }

    @Override
    public void quit() {
        try {
            exchange(CommandEncoder::encodeQuit, true, line -> line);
        } finally {
            close();
        }
    }

    @Override
    public void close() {
        lifecycle.teardown();
    }

    ConnectionLifecycle.State connectionState() {
        return lifecycle.state();
    }

    private Optional<StoreResult> store(CommandName command, String key, V value, int expire, boolean noreply) {
        return exchange(
                () -> CommandEncoder.encodeStore(command, key, serialize(key, value), expire, noreply),
                noreply,
                line -> ResponseClassifier.classifyStore(line, command));
    }

    private Optional<CounterResult> arithmetic(CommandName command, String key, long delta, boolean noreply) {
        return exchange(
                () -> CommandEncoder.encodeArithmetic(command, key, delta, noreply),
                noreply,
                line -> ResponseClassifier.classifyCounter(line, command));
    }

    private SerializedValue serialize(String key, V value) {
        return serializer.serialize(key, value);
    }

    private <R> Map<String, R> fetch(
            CommandName command, Collection<String> keys, BiFunction<ValueHeader, V, R> resultMapper) {
        if (keys.isEmpty()) {
            return Collections.emptyMap();
        }
        try {
            return withSession(session -> {
                session.connection().send(CommandEncoder.encodeFetch(command, keys));
                Map<String, R> result = new LinkedHashMap<>();
                while (true) {
                    String line = session.reader().readLine();
                    Optional<ValueHeader> header = ResponseClassifier.classifyFetch(line, command);
                    if (header.isEmpty()) {
                        return result;
                    }
                    byte[] raw = session.reader().readValue(header.get().size());
                    V value = deserializer.deserialize(header.get().key(), raw, header.get().flags());
                    result.put(header.get().key(), resultMapper.apply(header.get(), value));
                }
            });
        } catch (RuntimeException e) {
            if (!ignoreErrors) {
                throw e;
            }
            log.warn("Treating failed {} of {} key(s) as a miss: {}", command.wireName(), keys.size(), e.toString());
            return Collections.emptyMap();
        }
    }

    private <T> Optional<T> exchange(Supplier<ByteBuf> request, boolean noreply, Function<String, T> classifier) {
        return withSession(session -> {
            session.connection().send(request.get());
            if (noreply) {
                return Optional.empty();
            }
            return Optional.of(classifier.apply(session.reader().readLine()));
        });
    }

    private <T> T withSession(Function<ConnectionLifecycle.Session, T> operation) {
        ConnectionLifecycle.Session session = lifecycle.acquire();
        try {
            return operation.apply(session);
        } catch (RuntimeException e) {
            log.debug("Closing connection after failure: {}", e.toString());
            lifecycle.teardown();
            throw e;
        }
    }
}

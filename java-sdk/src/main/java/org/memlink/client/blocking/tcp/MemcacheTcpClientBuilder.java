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

import org.apache.commons.lang3.StringUtils;
import org.memlink.serde.ValueDeserializer;
import org.memlink.serde.ValueSerializer;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Builder for creating configured MemcacheTcpClient instances.
 *
 * <p>Example usage:
 * <pre>{@code
 * // Raw byte[] values
 * var client = MemcacheTcpClient.builder()
 *     .host("localhost")
 *     .port(11211)
 *     .build();
 * client.set("greeting", "hello".getBytes(StandardCharsets.UTF_8));
 *
 * // JSON values, treating fetch failures as misses
 * JsonValueSerde<Profile> serde = JsonValueSerde.of(Profile.class);
 * var profiles = MemcacheTcpClient.builder(serde, serde)
 *     .connectionTimeout(Duration.ofSeconds(1))
 *     .requestTimeout(Duration.ofMillis(500))
 *     .ignoreErrors(true)
 *     .build();
 * }</pre>
 *
 * <p>Building does not connect; the first operation does.
 *
 * @param <V> the application value type
 * @see MemcacheTcpClient#builder()
 */
public final class MemcacheTcpClientBuilder<V> {
    // timeouts are handed to the transport as milliseconds, the connect timeout as an int
    private static final Duration MIN_TIMEOUT = Duration.ofMillis(1);
    private static final Duration MAX_CONNECTION_TIMEOUT = Duration.ofMillis(Integer.MAX_VALUE);

    private final ValueSerializer<V> serializer;
    private final ValueDeserializer<V> deserializer;
    private String host = "localhost";
    private Integer port = 11211;
    private Duration connectionTimeout;
    private Duration requestTimeout;
    private boolean noDelay = false;
    private boolean ignoreErrors = false;
    private boolean defaultNoreply = true;
    private ConnectionFactory connectionFactory;

    MemcacheTcpClientBuilder(ValueSerializer<V> serializer, ValueDeserializer<V> deserializer) {
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.deserializer = Objects.requireNonNull(deserializer, "deserializer");
    }

    /**
     * Sets the host address of the memcached server.
     *
     * @param host the host address
     * @return this builder
     */
    public MemcacheTcpClientBuilder<V> host(String host) {
        this.host = host;
        return this;
    }

    /**
     * Sets the port of the memcached server.
     *
     * @param port the port number
     * @return this builder
     */
    public MemcacheTcpClientBuilder<V> port(Integer port) {
        this.port = port;
        return this;
    }

    /**
     * Sets how long to wait for the TCP connection to be established.
     *
     * @param connectionTimeout the connection timeout duration
     * @return this builder
     */
    public MemcacheTcpClientBuilder<V> connectionTimeout(Duration connectionTimeout) {
        this.connectionTimeout = connectionTimeout;
        return this;
    }

    /**
     * Sets how long a single send, or a single wait for response bytes, may block.
     *
     * @param requestTimeout the request timeout duration
     * @return this builder
     */
    public MemcacheTcpClientBuilder<V> requestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        return this;
    }

    /**
     * Enables or disables TCP_NODELAY on the connection. Disabled by default.
     *
     * @param noDelay whether to set TCP_NODELAY
     * @return this builder
     */
    public MemcacheTcpClientBuilder<V> noDelay(boolean noDelay) {
        this.noDelay = noDelay;
        return this;
    }

    /**
     * When enabled, get, gets and their multi-key forms return an empty result instead of
     * failing. Other operations always fail. Disabled by default.
     *
     * @param ignoreErrors whether fetch failures are treated as misses
     * @return this builder
     */
    public MemcacheTcpClientBuilder<V> ignoreErrors(boolean ignoreErrors) {
        this.ignoreErrors = ignoreErrors;
        return this;
    }

    /**
     * Sets whether overloads without a {@code noreply} argument send {@code noreply}.
     * Enabled by default. Never applies to cas, incr and decr.
     *
     * @param defaultNoreply the default noreply mode
     * @return this builder
     */
    public MemcacheTcpClientBuilder<V> defaultNoreply(boolean defaultNoreply) {
        this.defaultNoreply = defaultNoreply;
        return this;
    }

    MemcacheTcpClientBuilder<V> connectionFactory(ConnectionFactory connectionFactory) {
        this.connectionFactory = connectionFactory;
        return this;
    }

    /**
     * Builds and returns a configured MemcacheTcpClient instance.
     *
     * @return a new MemcacheTcpClient instance
     * @throws IllegalArgumentException if the host is blank, the port is out of range, or a
     *     timeout is out of range
     */
    public MemcacheTcpClient<V> build() {
        if (StringUtils.isBlank(host)) {
            throw new IllegalArgumentException("Host cannot be null or empty");
        }
        if (port == null || port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Port must be between 1 and 65535");
        }
        requireMinimum(connectionTimeout, "Connection timeout");
        requireMinimum(requestTimeout, "Request timeout");
        if (connectionTimeout != null && connectionTimeout.compareTo(MAX_CONNECTION_TIMEOUT) > 0) {
            throw new IllegalArgumentException("Connection timeout cannot exceed " + MAX_CONNECTION_TIMEOUT);
        }

        ConnectionFactory factory = connectionFactory;
        if (factory == null) {
            ConnectionSettings settings = new ConnectionSettings(
                    host,
                    port,
                    Optional.ofNullable(connectionTimeout),
                    Optional.ofNullable(requestTimeout),
                    noDelay);
            factory = () -> TcpConnection.open(settings);
        }
        return new MemcacheTcpClient<>(factory, serializer, deserializer, ignoreErrors, defaultNoreply);
    }

    private static void requireMinimum(Duration timeout, String name) {
        if (timeout != null && timeout.compareTo(MIN_TIMEOUT) < 0) {
            throw new IllegalArgumentException(name + " must be at least " + MIN_TIMEOUT);
        }
    }
}

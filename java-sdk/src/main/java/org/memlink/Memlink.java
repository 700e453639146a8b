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

package org.memlink;

import org.memlink.client.blocking.tcp.MemcacheTcpClient;
import org.memlink.client.blocking.tcp.MemcacheTcpClientBuilder;
import org.memlink.serde.ValueDeserializer;
import org.memlink.serde.ValueSerializer;

/**
 * Main entry point for creating memlink clients.
 *
 * <h2>Raw values</h2>
 * <pre>{@code
 * try (var client = Memlink.tcpClientBuilder()
 *         .host("localhost")
 *         .port(11211)
 *         .build()) {
 *     client.set("key", "value".getBytes(StandardCharsets.UTF_8), 0, false);
 *     Optional<byte[]> value = client.get("key");
 * }
 * }</pre>
 *
 * <h2>Serialized values</h2>
 * <pre>{@code
 * var client = Memlink.tcpClientBuilder(ValueSerdes.stringSerializer(), ValueSerdes.stringDeserializer())
 *     .build();
 * client.set("greeting", "hello");
 * }</pre>
 *
 * <h2>Version Information</h2>
 * <pre>{@code
 * String version = Memlink.version();          // e.g., "1.0.0"
 * MemlinkVersion info = Memlink.versionInfo(); // Full version details
 * }</pre>
 *
 * @see MemcacheTcpClientBuilder
 * @see MemlinkVersion
 */
public final class Memlink {

    private Memlink() {}

    /**
     * Creates a builder for TCP clients storing raw {@code byte[]} values.
     *
     * @return a TCP client builder
     */
    public static MemcacheTcpClientBuilder<byte[]> tcpClientBuilder() {
        return MemcacheTcpClient.builder();
    }

    /**
     * Creates a builder for TCP clients converting values with the given functions.
     *
     * @param serializer turns values into bytes and flags
     * @param deserializer turns bytes and flags back into values
     * @return a TCP client builder
     */
    public static <V> MemcacheTcpClientBuilder<V> tcpClientBuilder(
            ValueSerializer<V> serializer, ValueDeserializer<V> deserializer) {
        return MemcacheTcpClient.builder(serializer, deserializer);
    }

    /**
     * Returns the library version string.
     *
     * @return the version string (e.g., "1.0.0")
     */
    public static String version() {
        return MemlinkVersion.getInstance().getVersion();
    }

    /**
     * Returns detailed version information.
     *
     * @return the version information object
     */
    public static MemlinkVersion versionInfo() {
        return MemlinkVersion.getInstance();
    }
}

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

import org.junit.jupiter.api.Test;
import org.memlink.client.blocking.tcp.MemcacheTcpClientBuilder;
import org.memlink.serde.JsonValueSerde;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class MemlinkTest {

    @Test
    void tcpBuilderReturnsBuilder() {
        MemcacheTcpClientBuilder<byte[]> builder = Memlink.tcpClientBuilder();
        assertThat(builder).isNotNull();

        JsonValueSerde<String> serde = JsonValueSerde.of(String.class);
        MemcacheTcpClientBuilder<String> typed = Memlink.tcpClientBuilder(serde, serde);
        assertThat(typed).isNotNull();
    }

    @Test
    void tcpBuilderHasFluentApi() {
        MemcacheTcpClientBuilder<byte[]> builder = Memlink.tcpClientBuilder();

        assertThat(builder.host("localhost")).isSameAs(builder);
        assertThat(builder.port(11211)).isSameAs(builder);
        assertThat(builder.connectionTimeout(Duration.ofSeconds(1))).isSameAs(builder);
        assertThat(builder.requestTimeout(Duration.ofSeconds(1))).isSameAs(builder);
        assertThat(builder.noDelay(true)).isSameAs(builder);
        assertThat(builder.ignoreErrors(true)).isSameAs(builder);
        assertThat(builder.defaultNoreply(false)).isSameAs(builder);
    }

    @Test
    void versionMethodsReturnValues() {
        String version = Memlink.version();
        assertThat(version).isNotNull().isNotEqualTo("unknown");

        MemlinkVersion versionInfo = Memlink.versionInfo();
        assertThat(versionInfo).isSameAs(MemlinkVersion.getInstance());
        assertThat(versionInfo.getVersion()).isEqualTo(version);
    }
}

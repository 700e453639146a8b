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

package org.memlink.client;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Starts a memcached container once per test class, or points at an external server on
 * {@code localhost:11211} when {@code USE_EXTERNAL_SERVER} is set.
 */
public abstract class BaseIntegrationTest {

    protected static GenericContainer<?> memcachedServer;
    private static final String LOCALHOST_IP = "127.0.0.1";
    private static final int MEMCACHED_PORT = 11211;
    private static final Logger log = LoggerFactory.getLogger(BaseIntegrationTest.class);
    private static final boolean USE_EXTERNAL_SERVER = System.getenv("USE_EXTERNAL_SERVER") != null;

    public static int serverPort() {
        return USE_EXTERNAL_SERVER ? MEMCACHED_PORT : memcachedServer.getMappedPort(MEMCACHED_PORT);
    }

    public static String serverHost() {
        return USE_EXTERNAL_SERVER ? LOCALHOST_IP : memcachedServer.getHost();
    }

    @BeforeAll
    static void setupContainer() {
        if (!USE_EXTERNAL_SERVER) {
            log.info("Starting memcached container...");
            memcachedServer = new GenericContainer<>(DockerImageName.parse("memcached:1.6-alpine"))
                    .withExposedPorts(MEMCACHED_PORT)
                    .withLogConsumer(frame -> System.out.print(frame.getUtf8String()));
            memcachedServer.start();
        } else {
            log.info("Using external memcached server");
        }
    }

    @AfterAll
    static void stopContainer() {
        if (memcachedServer != null && memcachedServer.isRunning()) {
            memcachedServer.stop();
        }
    }
}

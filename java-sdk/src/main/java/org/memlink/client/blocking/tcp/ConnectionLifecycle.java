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

import org.memlink.protocol.ResponseReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The client's connection, either {@link State#DISCONNECTED} or {@link State#CONNECTED}.
 *
 * <p>{@link #acquire()} and {@link #teardown()} are the only transitions. A connection and
 * its response reader are created together and released together.
 */
final class ConnectionLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ConnectionLifecycle.class);

    enum State {
        DISCONNECTED,
        CONNECTED
    }

    private final ConnectionFactory connectionFactory;
    private Session session;

    ConnectionLifecycle(ConnectionFactory connectionFactory) {
        this.connectionFactory = connectionFactory;
    }

    /**
     * Returns the open session, connecting first if disconnected.
     */
    Session acquire() {
        if (session == null) {
            MemcacheConnection connection = connectionFactory.open();
            session = new Session(connection, new ResponseReader(connection));
        }
        return session;
    }

    /**
     * Closes the connection and drops its pending bytes. No-op when disconnected.
     */
    void teardown() {
        if (session == null) {
            return;
        }
        Session closing = session;
        session = null;
        closing.reader().release();
        try {
            closing.connection().close();
        } catch (RuntimeException e) {
            log.debug("Error while closing connection", e);
        }
    }

    State state() {
        return session == null ? State.DISCONNECTED : State.CONNECTED;
    }

    record Session(MemcacheConnection connection, ResponseReader reader) {}
}

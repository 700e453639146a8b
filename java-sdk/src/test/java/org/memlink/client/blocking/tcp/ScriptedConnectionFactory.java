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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Hands out queued connections in order and fails once they run out.
 */
final class ScriptedConnectionFactory implements ConnectionFactory {

    private final Deque<ScriptedConnection> queued = new ArrayDeque<>();
    private final List<ScriptedConnection> opened = new ArrayList<>();

    ScriptedConnection next() {
        ScriptedConnection connection = new ScriptedConnection();
        queued.add(connection);
        return connection;
    }

    @Override
    public MemcacheConnection open() {
        ScriptedConnection connection = queued.poll();
        if (connection == null) {
            throw new IllegalStateException("No more scripted connections");
        }
        opened.add(connection);
        return connection;
    }

    List<ScriptedConnection> opened() {
        return opened;
    }
}

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

package org.memlink.protocol;

import java.util.Optional;

/**
 * Outcome tokens a server may answer a store-family command with.
 */
public enum StoreResult {
    STORED,
    NOT_STORED,
    EXISTS,
    NOT_FOUND;

    /**
     * Looks up the outcome matching a whole response line.
     *
     * @param line the response line without its terminator
     * @return the matching outcome, or empty if the line is not an outcome token
     */
    public static Optional<StoreResult> fromLine(String line) {
        for (StoreResult result : values()) {
            if (result.name().equals(line)) {
                return Optional.of(result);
            }
        }
        return Optional.empty();
    }
}

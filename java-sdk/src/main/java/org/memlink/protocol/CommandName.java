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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Every command this client sends, tagged with its family and, for the store family,
 * the closed set of outcomes the server may answer with.
 */
public enum CommandName {
    SET("set", Family.STORE, EnumSet.of(StoreResult.STORED)),
    ADD("add", Family.STORE, EnumSet.of(StoreResult.STORED, StoreResult.NOT_STORED)),
    REPLACE("replace", Family.STORE, EnumSet.of(StoreResult.STORED, StoreResult.NOT_STORED)),
    APPEND("append", Family.STORE, EnumSet.of(StoreResult.STORED, StoreResult.NOT_STORED)),
    PREPEND("prepend", Family.STORE, EnumSet.of(StoreResult.STORED, StoreResult.NOT_STORED)),
    CAS("cas", Family.STORE, EnumSet.of(StoreResult.STORED, StoreResult.EXISTS, StoreResult.NOT_FOUND)),
    GET("get", Family.FETCH),
    GETS("gets", Family.FETCH),
    DELETE("delete", Family.MISC),
    INCR("incr", Family.MISC),
    DECR("decr", Family.MISC),
    TOUCH("touch", Family.MISC),
    FLUSH_ALL("flush_all", Family.MISC),
    QUIT("quit", Family.MISC);

    public enum Family {
        STORE,
        FETCH,
        MISC
    }

    private final String wireName;
    private final Family family;
    private final Set<StoreResult> validOutcomes;

    CommandName(String wireName, Family family) {
        this(wireName, family, EnumSet.noneOf(StoreResult.class));
    }

    CommandName(String wireName, Family family, Set<StoreResult> validOutcomes) {
        this.wireName = wireName;
        this.family = family;
        this.validOutcomes = Collections.unmodifiableSet(validOutcomes);
    }

    public String wireName() {
        return wireName;
    }

    public Family family() {
        return family;
    }

    /**
     * Returns the outcomes a server may answer this command with. Empty for commands
     * outside the store family.
     */
    public Set<StoreResult> validOutcomes() {
        return validOutcomes;
    }

    /**
     * Returns whether {@code VALUE} headers sent in reply to this command carry a cas token.
     */
    public boolean expectsCas() {
        return this == GETS;
    }
}

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

import org.apache.commons.lang3.StringUtils;
import org.memlink.exception.MemcacheException;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Interprets a response line in the context of the command that was sent.
 *
 * <p>Error lines are checked first and in this order: {@code ERROR}, {@code CLIENT_ERROR},
 * {@code SERVER_ERROR}. Only then is the line matched against the grammar of the
 * command's family. Lines that match neither fail with {@code UNKNOWN_RESPONSE} carrying
 * at most {@value #EXCERPT_LENGTH} characters of the line.
 */
public final class ResponseClassifier {

    public static final int EXCERPT_LENGTH = 32;

    private static final String ERROR = "ERROR";
    private static final String CLIENT_ERROR = "CLIENT_ERROR";
    private static final String SERVER_ERROR = "SERVER_ERROR";
    private static final String VALUE = "VALUE";
    private static final String END = "END";

    private ResponseClassifier() {}

    /**
     * Throws the matching {@link MemcacheException} if the line is an error indicator.
     */
    public static void raiseErrors(String line, CommandName command) {
        if (line.startsWith(ERROR)) {
            throw MemcacheException.unknownCommand(command.wireName());
        }
        if (line.startsWith(CLIENT_ERROR)) {
            throw MemcacheException.clientError(errorDetail(line));
        }
        if (line.startsWith(SERVER_ERROR)) {
            throw MemcacheException.serverError(errorDetail(line));
        }
    }

    /**
     * Classifies the reply to a store-family command.
     *
     * @return the outcome, always one of {@link CommandName#validOutcomes()}
     */
    public static StoreResult classifyStore(String line, CommandName command) {
        raiseErrors(line, command);
        Optional<StoreResult> result = StoreResult.fromLine(line);
        if (result.isPresent() && command.validOutcomes().contains(result.get())) {
            return result.get();
        }
        throw unknownResponse(line);
    }

    /**
     * Classifies one line of a fetch reply.
     *
     * @return the parsed value header, or empty if the line is the {@code END} terminator
     */
    public static Optional<ValueHeader> classifyFetch(String line, CommandName command) {
        raiseErrors(line, command);
        if (END.equals(line)) {
            return Optional.empty();
        }
        if (line.startsWith(VALUE)) {
            return Optional.of(parseValueHeader(line, command.expectsCas()));
        }
        throw unknownResponse(line);
    }

    /**
     * Classifies the reply to a delete, touch, flush_all or quit: the line is returned as is.
     */
    public static String classifyMisc(String line, CommandName command) {
        raiseErrors(line, command);
        return line;
    }

    /**
     * Classifies the reply to an incr or decr.
     */
    public static CounterResult classifyCounter(String line, CommandName command) {
        raiseErrors(line, command);
        if (CounterResult.NOT_FOUND_TOKEN.equals(line)) {
            return CounterResult.notFound();
        }
        // memcached pads the value with trailing spaces when a decr shrinks its length
        String digits = StringUtils.stripEnd(line, " ");
        if (digits.isEmpty() || !StringUtils.isNumeric(digits)) {
            throw unknownResponse(line);
        }
        return CounterResult.of(new BigInteger(digits));
    }

    static ValueHeader parseValueHeader(String line, boolean expectCas) {
        String[] tokens = StringUtils.split(line, ' ');
        int expectedTokens = expectCas ? 5 : 4;
        if (tokens.length != expectedTokens || !VALUE.equals(tokens[0])) {
            throw unknownResponse(line);
        }
        try {
            int flags = Integer.parseInt(tokens[2]);
            int size = Integer.parseInt(tokens[3]);
            if (size < 0) {
                throw unknownResponse(line);
            }
            Optional<Long> cas = expectCas ? Optional.of(Long.parseUnsignedLong(tokens[4])) : Optional.empty();
            return new ValueHeader(tokens[1], flags, size, cas);
        } catch (NumberFormatException e) {
            throw unknownResponse(line);
        }
    }

    private static String errorDetail(String line) {
        return line.substring(line.indexOf(' ') + 1);
    }

    private static MemcacheException unknownResponse(String line) {
        return MemcacheException.unknownResponse(StringUtils.truncate(line, EXCERPT_LENGTH));
    }
}

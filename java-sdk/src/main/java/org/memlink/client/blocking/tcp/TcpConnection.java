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
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelOption;
import org.memlink.exception.MemcacheException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.Connection;
import reactor.netty.tcp.TcpClient;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Blocking view of a reactor-netty TCP connection.
 *
 * <p>Inbound chunks are copied off the event loop into a queue that {@link #nextChunk()}
 * drains, waiting at most the request timeout for each chunk. Chunks delivered after
 * {@link #close()} are released instead of queued.
 */
final class TcpConnection implements MemcacheConnection {

    private static final Logger log = LoggerFactory.getLogger(TcpConnection.class);
    private static final InboundEvent END_OF_STREAM = new InboundEvent(Unpooled.EMPTY_BUFFER, null);

    private final Connection connection;
    private final ConnectionSettings settings;
    private final BlockingQueue<InboundEvent> inbound = new LinkedBlockingQueue<>();
    private boolean closed;

    private TcpConnection(Connection connection, ConnectionSettings settings) {
        this.connection = connection;
        this.settings = settings;
    }

    static TcpConnection open(ConnectionSettings settings) {
        TcpClient client = TcpClient.create()
                .host(settings.host())
                .port(settings.port())
                .option(ChannelOption.TCP_NODELAY, settings.noDelay());
        if (settings.connectionTimeout().isPresent()) {
            client = client.option(
                    ChannelOption.CONNECT_TIMEOUT_MILLIS,
                    Math.toIntExact(settings.connectionTimeout().get().toMillis()));
        }

        Connection connection;
        try {
            connection = settings.connectionTimeout().isPresent()
                    ? client.connectNow(settings.connectionTimeout().get())
                    : client.connectNow();
        } catch (RuntimeException e) {
            throw MemcacheException.transport("Failed to connect to " + settings, e);
        }
        log.debug("Connected to {}", settings);

        TcpConnection tcpConnection = new TcpConnection(connection, settings);
        tcpConnection.subscribeInbound();
        return tcpConnection;
    }

    private void subscribeInbound() {
        connection
                .inbound()
                .receive()
                .subscribe(
                        chunk -> enqueue(new InboundEvent(Unpooled.copiedBuffer(chunk), null)),
                        error -> enqueue(new InboundEvent(Unpooled.EMPTY_BUFFER, error)),
                        () -> enqueue(END_OF_STREAM));
    }

    private void enqueue(InboundEvent event) {
        synchronized (inbound) {
            if (!closed) {
                inbound.add(event);
                return;
            }
        }
        // delivered after close
        event.chunk().release();
    }

    @Override
    public void send(ByteBuf request) {
        log.trace("Sending {} bytes to {}", request.readableBytes(), settings);
        Mono<Void> write = connection.outbound().send(Mono.just(request)).then();
        try {
            Optional<Duration> timeout = settings.requestTimeout();
            if (timeout.isPresent()) {
                write.block(timeout.get());
            } else {
                write.block();
            }
        } catch (RuntimeException e) {
            throw MemcacheException.transport("Failed to send request to " + settings, e);
        }
    }

    @Override
    public ByteBuf nextChunk() {
        InboundEvent event;
        try {
            Optional<Duration> timeout = settings.requestTimeout();
            event = timeout.isPresent()
                    ? inbound.poll(timeout.get().toMillis(), TimeUnit.MILLISECONDS)
                    : inbound.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw MemcacheException.transport("Interrupted while waiting for a response from " + settings, e);
        }
        if (event == null) {
            String message = "Timed out after " + settings.requestTimeout().get() + " waiting for " + settings;
            throw MemcacheException.transport(message, new TimeoutException(message));
        }
        if (event.error() != null) {
            throw MemcacheException.transport("Connection to " + settings + " failed", event.error());
        }
        if (event == END_OF_STREAM) {
            // keep the end visible to any later read
            enqueue(END_OF_STREAM);
        }
        return event.chunk();
    }

    @Override
    public void close() {
        synchronized (inbound) {
            closed = true;
            InboundEvent event;
            while ((event = inbound.poll()) != null) {
                event.chunk().release();
            }
        }
        connection.dispose();
        log.debug("Closed connection to {}", settings);
    }

    int queuedEvents() {
        return inbound.size();
    }

    private record InboundEvent(ByteBuf chunk, Throwable error) {}
}

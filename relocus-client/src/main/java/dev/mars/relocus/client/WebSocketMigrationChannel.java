/*
 * Copyright 2026 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.relocus.client;

import dev.mars.relocus.connection.MigrationChannel;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * A migration data channel carried over a WebSocket. Binary messages are queued as they
 * arrive and handed out through {@link #read(byte[])}; a close frame from the peer ends
 * the stream.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 * @version 1.0
 */
public class WebSocketMigrationChannel implements MigrationChannel {
    private static final Logger logger = Logger.getLogger(WebSocketMigrationChannel.class.getName());

    private static final ByteBuffer END_OF_STREAM = ByteBuffer.allocate(0);

    private final String name;
    private final BlockingQueue<ByteBuffer> incoming = new LinkedBlockingQueue<>();
    private final Duration sendTimeout;
    private volatile WebSocket webSocket;
    private volatile Throwable failure;
    private ByteBuffer current;
    private boolean endOfStream;

    private WebSocketMigrationChannel(String name, Duration sendTimeout) {
        this.name = name;
        this.sendTimeout = sendTimeout;
    }

    /**
     * Connect a channel and wait for the handshake to finish.
     */
    public static WebSocketMigrationChannel open(HttpClient httpClient, URI uri, String name, Duration timeout)
            throws IOException {
        WebSocketMigrationChannel channel = new WebSocketMigrationChannel(name, timeout);
        try {
            channel.webSocket = httpClient.newWebSocketBuilder()
                    .connectTimeout(timeout)
                    .buildAsync(uri, channel.new Listener())
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted opening channel " + name);
        } catch (ExecutionException | TimeoutException e) {
            throw new IOException("Failed to open migration channel " + name + ": " + e.getMessage(), e);
        }
        logger.fine("Opened migration channel " + name);
        return channel;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int read(byte[] buffer) throws IOException {
        while (current == null || !current.hasRemaining()) {
            if (endOfStream) {
                return -1;
            }
            try {
                current = incoming.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted reading channel " + name);
            }
            if (current == END_OF_STREAM) {
                endOfStream = true;
                if (failure != null) {
                    throw new IOException("Channel " + name + " failed: " + failure.getMessage(), failure);
                }
                return -1;
            }
        }
        int count = Math.min(buffer.length, current.remaining());
        current.get(buffer, 0, count);
        return count;
    }

    @Override
    public void write(byte[] buffer, int offset, int length) throws IOException {
        ByteBuffer data = ByteBuffer.wrap(Arrays.copyOfRange(buffer, offset, offset + length));
        complete(webSocket.sendBinary(data, true), "write");
    }

    @Override
    public void closeOutput() throws IOException {
        if (!webSocket.isOutputClosed()) {
            complete(webSocket.sendClose(WebSocket.NORMAL_CLOSURE, ""), "close");
        }
    }

    @Override
    public void close() {
        webSocket.abort();
        incoming.offer(END_OF_STREAM);
    }

    private void complete(CompletionStage<WebSocket> stage, String action) throws IOException {
        try {
            stage.toCompletableFuture().get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted during " + action + " on channel " + name);
        } catch (ExecutionException | TimeoutException e) {
            throw new IOException("Failed to " + action + " channel " + name + ": " + e.getMessage(), e);
        }
    }

    private final class Listener implements WebSocket.Listener {
        private final ByteArrayOutputStream partial = new ByteArrayOutputStream();

        @Override
        public void onOpen(WebSocket socket) {
            socket.request(1);
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket socket, ByteBuffer data, boolean last) {
            byte[] chunk = new byte[data.remaining()];
            data.get(chunk);
            partial.write(chunk, 0, chunk.length);
            if (last) {
                incoming.offer(ByteBuffer.wrap(partial.toByteArray()));
                partial.reset();
            }
            socket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket socket, int statusCode, String reason) {
            logger.fine("Peer closed migration channel " + name + " (" + statusCode + ")");
            incoming.offer(END_OF_STREAM);
            return null;
        }

        @Override
        public void onError(WebSocket socket, Throwable error) {
            failure = error;
            incoming.offer(END_OF_STREAM);
        }
    }
}

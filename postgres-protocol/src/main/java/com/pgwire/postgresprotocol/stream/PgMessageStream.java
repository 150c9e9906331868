package com.pgwire.postgresprotocol.stream;

import com.pgwire.postgresprotocol.encoder.ClientPostgresProtocolMessageEncoder;
import com.pgwire.postgresprotocol.exception.ConnectionClosedException;
import com.pgwire.postgresprotocol.exception.PgClientException;
import com.pgwire.postgresprotocol.handler.PgMessageFramingHandler;
import com.pgwire.postgresprotocol.handler.PgMessageQueueHandler;
import com.pgwire.postgresprotocol.model.internal.PgMessageInfo;
import com.pgwire.postgresprotocol.utils.PostgresHandlerUtils;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Blocking message-level view of a Netty channel connected to a Postgres backend.
 * <p>
 * Not thread safe: exactly one thread sends and receives at a time. Once the stream failed every
 * further call fails with {@link ConnectionClosedException}.
 */
@Slf4j
public class PgMessageStream implements Closeable {

    public static final String FRAMING_HANDLER_NAME = "pg-message-framing";
    public static final String QUEUE_HANDLER_NAME = "pg-message-queue";

    private final Channel channel;
    private final PgMessageQueueHandler queueHandler;
    private final BlockingQueue<Object> inbound;

    private volatile Throwable failure = null;
    private volatile boolean closed = false;

    public PgMessageStream(Channel channel) {
        this.channel = channel;
        this.queueHandler = new PgMessageQueueHandler();
        this.inbound = queueHandler.getInbound();

        channel.pipeline().addLast(FRAMING_HANDLER_NAME, new PgMessageFramingHandler());
        channel.pipeline().addLast(QUEUE_HANDLER_NAME, queueHandler);
    }

    public ByteBufAllocator alloc() {
        return channel.alloc();
    }

    /**
     * Frames {@code payload} as one message with the given start byte and sends it immediately.
     * The payload buffer is released.
     */
    public void send(byte startByte, ByteBuf payload) {
        ByteBuf message;
        try {
            message = ClientPostgresProtocolMessageEncoder.encodeMessage(startByte, payload, channel.alloc());
        } finally {
            payload.release();
        }
        writeAndFlush(message);
    }

    /**
     * Queues an already encoded message without flushing it.
     */
    public void write(ByteBuf encodedMessage) {
        ensureUsable(encodedMessage);
        channel.write(encodedMessage).addListener(this::onWriteCompleted);
    }

    public void flush() {
        ensureUsable(null);
        channel.flush();
    }

    public ChannelFuture writeAndFlush(ByteBuf encodedMessage) {
        ensureUsable(encodedMessage);
        ChannelFuture future = channel.writeAndFlush(encodedMessage);
        future.addListener(this::onWriteCompleted);
        return future;
    }

    /**
     * Blocks until the next complete backend message arrives.
     *
     * @throws com.pgwire.postgresprotocol.exception.ProtocolFramingException if the stream carries malformed messages
     * @throws ConnectionClosedException                                       if the stream is closed or failed
     */
    public PgMessageInfo receive() {
        ensureUsable(null);

        Object next;
        try {
            next = inbound.take();
        } catch (InterruptedException e) {
            throw interrupted(e);
        }

        return unwrap(next);
    }

    /**
     * Like {@link #receive()} but gives up after the timeout.
     *
     * @return next message, null when none arrived in time
     */
    public PgMessageInfo receive(long timeout, TimeUnit unit) {
        ensureUsable(null);

        Object next;
        try {
            next = inbound.poll(timeout, unit);
        } catch (InterruptedException e) {
            throw interrupted(e);
        }

        return next == null ? null : unwrap(next);
    }

    private ConnectionClosedException interrupted(InterruptedException e) {
        Thread.currentThread().interrupt();
        markFailed(e);
        return new ConnectionClosedException("Interrupted while waiting for a message from Postgres. Connection state is unknown and it can not be used anymore.", e);
    }

    private PgMessageInfo unwrap(Object next) {
        if (next instanceof PgMessageInfo) {
            return (PgMessageInfo) next;
        }

        if (next == PgMessageQueueHandler.END_OF_STREAM) {
            markFailed(null);
            throw new ConnectionClosedException("Connection to Postgres was closed.");
        }

        Throwable cause = (Throwable) next;
        markFailed(cause);
        if (cause instanceof PgClientException) {
            throw (PgClientException) cause;
        }
        throw new ConnectionClosedException("Connection to Postgres failed: " + cause.getMessage(), cause);
    }

    public boolean isUsable() {
        return !closed && failure == null && channel.isActive();
    }

    /**
     * Marks the stream as broken and closes the underlying channel.
     */
    public void markFailed(Throwable cause) {
        if (failure == null) {
            failure = cause != null ? cause : new ConnectionClosedException("Connection to Postgres was closed.");
        }
        closeChannel();
    }

    /**
     * Sends Terminate when the channel is still alive and closes it.
     */
    public void terminate() {
        if (closed) {
            return;
        }
        closed = true;

        if (channel.isActive() && failure == null) {
            PostgresHandlerUtils.writeLastAndClose(channel, ClientPostgresProtocolMessageEncoder.encodeClientTerminateMessage(channel.alloc()));
        } else {
            channel.close();
        }

        releaseQueued();
    }

    @Override
    public void close() {
        terminate();
    }

    private void closeChannel() {
        closed = true;
        channel.close();
        releaseQueued();
    }

    private void releaseQueued() {
        Object next;
        while ((next = inbound.poll()) != null) {
            if (next instanceof PgMessageInfo) {
                ((PgMessageInfo) next).release();
            }
        }
    }

    private void onWriteCompleted(Future<? super Void> future) {
        if (!future.isSuccess()) {
            log.debug("Write to Postgres failed.", future.cause());
            queueHandler.streamFailed(future.cause());
        }
    }

    private void ensureUsable(ByteBuf pendingMessage) {
        if (failure != null || closed) {
            if (pendingMessage != null) {
                pendingMessage.release();
            }
            throw new ConnectionClosedException(
                    failure == null ? "Connection is closed." : "Connection is not usable anymore: " + failure.getMessage(),
                    failure
            );
        }
    }
}

package com.pgwire.client.netty;

import com.pgwire.postgresprotocol.exception.PgConnectionInitializationException;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.extern.slf4j.Slf4j;

/**
 * Event loop shared by all connections. Its threads are daemons, so an application does not have to
 * shut it down.
 */
@Slf4j
public class PgEventLoop {
    private static final String THREAD_POOL_NAME = "pgwire-client";

    private static final EventLoopGroup WORKER_GROUP = new NioEventLoopGroup(0, new DefaultThreadFactory(THREAD_POOL_NAME, true));

    /**
     * Opens a TCP connection and waits until it is established.
     *
     * @throws PgConnectionInitializationException when the connection can not be established in time
     */
    public static Channel connect(String host, int port, int connectTimeoutMs) {
        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(WORKER_GROUP)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                // protocol handlers are added once the channel is connected
                .handler(new ChannelInboundHandlerAdapter())
                .remoteAddress(host, port);

        ChannelFuture channelFuture = bootstrap.connect();
        try {
            channelFuture.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            channelFuture.channel().close();
            throw new PgConnectionInitializationException("Interrupted while connecting to Postgres at " + host + ":" + port + ".", e);
        }

        if (!channelFuture.isSuccess()) {
            throw new PgConnectionInitializationException("Failed to connect to Postgres at " + host + ":" + port + ".", channelFuture.cause());
        }

        log.debug("Connected to Postgres at {}:{}.", host, port);
        return channelFuture.channel();
    }

    private PgEventLoop() {
    }
}

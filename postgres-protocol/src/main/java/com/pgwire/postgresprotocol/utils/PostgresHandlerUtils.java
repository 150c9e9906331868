package com.pgwire.postgresprotocol.utils;

import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;

public class PostgresHandlerUtils {

    /**
     * Writes the last message of a conversation and closes the channel once it is flushed. The
     * message is released if the channel is already gone.
     */
    public static void writeLastAndClose(Channel channel, ByteBuf lastMessage) {
        if (channel == null || !channel.isActive()) {
            lastMessage.release();
            if (channel != null) {
                channel.close();
            }
            return;
        }

        channel.writeAndFlush(lastMessage).addListener(ChannelFutureListener.CLOSE);
    }

    private PostgresHandlerUtils() {
    }
}

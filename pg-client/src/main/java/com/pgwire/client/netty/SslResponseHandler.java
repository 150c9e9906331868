package com.pgwire.client.netty;

import com.pgwire.postgresprotocol.exception.ProtocolFramingException;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.ReferenceCountUtil;

import java.util.concurrent.CompletableFuture;

/**
 * Waits for the single byte the server answers an SSLRequest with and removes itself. Bytes after
 * the answer are rejected, they could only have been injected before the handshake.
 */
public class SslResponseHandler extends ChannelInboundHandlerAdapter {
    private final CompletableFuture<Byte> response = new CompletableFuture<>();

    public CompletableFuture<Byte> getResponse() {
        return response;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        ByteBuf buf = (ByteBuf) msg;
        try {
            if (!buf.isReadable()) {
                return;
            }
            byte answer = buf.readByte();
            if (buf.isReadable()) {
                response.completeExceptionally(new ProtocolFramingException("Received unencrypted data after the SSL response."));
            } else {
                response.complete(answer);
            }
            ctx.pipeline().remove(this);
        } finally {
            ReferenceCountUtil.release(buf);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        response.completeExceptionally(cause);
        ctx.close();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        response.completeExceptionally(new ProtocolFramingException("Connection closed before the SSL response was received."));
        super.channelInactive(ctx);
    }
}

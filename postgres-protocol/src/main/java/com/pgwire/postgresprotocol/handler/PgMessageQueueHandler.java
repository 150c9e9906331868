package com.pgwire.postgresprotocol.handler;

import com.pgwire.postgresprotocol.model.internal.PgMessageInfo;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.ReferenceCountUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Last handler of a client pipeline. Hands framed messages, failures and end of stream over to the
 * thread that drives the protocol exchange.
 */
@Slf4j
public class PgMessageQueueHandler extends ChannelInboundHandlerAdapter {

    /**
     * Queued once the channel became inactive.
     */
    public static final Object END_OF_STREAM = new Object();

    private final BlockingQueue<Object> inbound = new LinkedBlockingQueue<>();

    public BlockingQueue<Object> getInbound() {
        return inbound;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (msg instanceof PgMessageInfo) {
            inbound.add(msg);
        } else {
            log.warn("Unexpected inbound object {} dropped.", msg.getClass().getName());
            ReferenceCountUtil.release(msg);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.debug("Stream failure queued for the protocol thread.", cause);
        inbound.add(cause);
        ctx.close();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        inbound.add(END_OF_STREAM);
        super.channelInactive(ctx);
    }

    /**
     * Reports a failure that did not come through the pipeline, e.g. a failed write.
     */
    public void streamFailed(Throwable cause) {
        inbound.add(cause);
    }
}

package com.pgwire.postgresprotocol.handler;

import com.pgwire.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import com.pgwire.postgresprotocol.exception.ProtocolFramingException;
import com.pgwire.postgresprotocol.model.internal.PgMessageInfo;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import lombok.extern.slf4j.Slf4j;

/**
 * Splits the inbound byte stream into backend messages. Bytes of a message that is not complete yet
 * are kept as leftovers until the next read delivers the rest. Each complete message is passed on as
 * {@link PgMessageInfo}.
 */
@Slf4j
public class PgMessageFramingHandler extends ChannelInboundHandlerAdapter {

    private ByteBuf leftovers = null;
    private boolean failed = false;

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (!(msg instanceof ByteBuf)) {
            ctx.fireChannelRead(msg);
            return;
        }

        ByteBuf packet = (ByteBuf) msg;

        if (failed) {
            packet.release();
            return;
        }

        try {
            if (leftovers == null) {
                leftovers = ctx.alloc().buffer(packet.readableBytes());
            }
            leftovers.writeBytes(packet);
        } finally {
            packet.release();
        }

        splitToMessages(ctx);
    }

    private void splitToMessages(ChannelHandlerContext ctx) {
        while (leftovers.readableBytes() >= PostgresProtocolGeneralConstants.MESSAGE_MARKER_AND_LENGTH_BYTES_COUNT) {
            int messageStart = leftovers.readerIndex();
            byte startByte = leftovers.getByte(messageStart);
            int length = leftovers.getInt(messageStart + 1);

            if (length < PostgresProtocolGeneralConstants.MESSAGE_LENGTH_BYTES_COUNT || length > PostgresProtocolGeneralConstants.MAX_MESSAGE_LENGTH) {
                failed = true;
                releaseLeftovers();
                ctx.fireExceptionCaught(new ProtocolFramingException("Message '" + (char) startByte + "' advertises implausible length " + length + "."));
                return;
            }

            // 1 byte for message type
            if (leftovers.readableBytes() < length + 1) {
                break;
            }

            leftovers.skipBytes(PostgresProtocolGeneralConstants.MESSAGE_MARKER_AND_LENGTH_BYTES_COUNT);

            int payloadLength = length - PostgresProtocolGeneralConstants.MESSAGE_LENGTH_BYTES_COUNT;
            ByteBuf payload = ctx.alloc().buffer(payloadLength);
            payload.writeBytes(leftovers, payloadLength);

            ctx.fireChannelRead(
                    PgMessageInfo
                            .builder()
                            .startByte(startByte)
                            .payload(payload)
                            .build()
            );

            if (leftovers == null) {
                // handler was removed while the message was processed
                return;
            }
        }

        leftovers.discardReadBytes();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (!failed && leftovers != null && leftovers.isReadable()) {
            int pending = leftovers.readableBytes();
            failed = true;
            releaseLeftovers();
            ctx.fireExceptionCaught(new ProtocolFramingException("Stream closed in the middle of a message, " + pending + " bytes pending."));
        }
        super.channelInactive(ctx);
    }

    @Override
    public void handlerRemoved(ChannelHandlerContext ctx) throws Exception {
        releaseLeftovers();
        super.handlerRemoved(ctx);
    }

    private void releaseLeftovers() {
        if (leftovers != null) {
            if (leftovers.refCnt() > 0) {
                leftovers.release();
            }
            leftovers = null;
        }
    }
}

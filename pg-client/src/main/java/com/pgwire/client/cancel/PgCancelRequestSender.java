package com.pgwire.client.cancel;

import com.pgwire.client.netty.PgEventLoop;
import com.pgwire.postgresprotocol.encoder.ClientPostgresProtocolMessageEncoder;
import com.pgwire.postgresprotocol.exception.PgClientException;
import com.pgwire.postgresprotocol.model.protocol.BackendKeyData;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import lombok.extern.slf4j.Slf4j;

/**
 * Sends CancelRequest over a short-lived connection. The server answers nothing; whether the running
 * statement was cancelled shows up on the original connection as a {@code query_canceled} error.
 */
@Slf4j
public class PgCancelRequestSender {

    public static void send(String host, int port, BackendKeyData backendKeyData, int connectTimeoutMs) {
        if (backendKeyData == null) {
            throw new PgClientException("Server did not send BackendKeyData, the connection can not be cancelled.");
        }

        Channel channel = PgEventLoop.connect(host, port, connectTimeoutMs);
        try {
            ChannelFuture future = channel.writeAndFlush(
                    ClientPostgresProtocolMessageEncoder.encodeCancelRequestMessage(backendKeyData.getProcessId(), backendKeyData.getSecretKey(), channel.alloc())
            );
            if (!future.awaitUninterruptibly(connectTimeoutMs) || !future.isSuccess()) {
                throw new PgClientException("Failed to send cancel request for backend " + backendKeyData.getProcessId() + ".", future.cause());
            }
            log.debug("Sent cancel request for backend {}.", backendKeyData.getProcessId());
        } finally {
            channel.close();
        }
    }

    private PgCancelRequestSender() {
    }
}

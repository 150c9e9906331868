package com.pgwire.client.support;

import com.pgwire.client.connection.PgConnection;
import com.pgwire.client.model.PgConnectionSettings;
import com.pgwire.postgresprotocol.stream.PgMessageStream;
import io.netty.buffer.ByteBuf;
import io.netty.channel.embedded.EmbeddedChannel;
import lombok.Getter;

import java.util.List;

/**
 * A {@link PgConnection} over an {@link EmbeddedChannel}. Backend messages are queued with
 * {@link #reply(ByteBuf...)} before the call that reads them.
 */
@Getter
public class ScriptedConnection {
    public static final int BACKEND_PROCESS_ID = 4242;

    private final EmbeddedChannel channel;
    private final PgConnection connection;

    private ScriptedConnection(EmbeddedChannel channel, PgConnection connection) {
        this.channel = channel;
        this.connection = connection;
    }

    public static PgConnectionSettings settings() {
        return PgConnectionSettings
                .builder()
                .host("localhost")
                .database("db")
                .user("alice")
                .password("secret")
                .build();
    }

    /**
     * Opens a connection that authenticates without a password and discards the startup messages.
     */
    public static ScriptedConnection open() {
        EmbeddedChannel channel = new EmbeddedChannel();
        PgMessageStream stream = new PgMessageStream(channel);
        channel.writeInbound(
                BackendMessages.authOk(),
                BackendMessages.parameterStatus("server_version", "16.1"),
                BackendMessages.parameterStatus("client_encoding", "UTF8"),
                BackendMessages.backendKeyData(BACKEND_PROCESS_ID, 99),
                BackendMessages.readyForQuery('I')
        );
        PgConnection connection = PgConnection.openOnStream(settings(), stream);
        FrontendMessage.drain(channel, true);
        return new ScriptedConnection(channel, connection);
    }

    public void reply(ByteBuf... messages) {
        channel.writeInbound((Object[]) messages);
    }

    public List<FrontendMessage> sent() {
        return FrontendMessage.drain(channel, false);
    }
}

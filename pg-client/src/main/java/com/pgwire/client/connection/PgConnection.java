package com.pgwire.client.connection;

import com.pgwire.client.cancel.PgCancelRequestSender;
import com.pgwire.client.copy.PgCopyWriter;
import com.pgwire.client.listener.PgNoticeListener;
import com.pgwire.client.listener.PgNotificationListener;
import com.pgwire.client.model.PgConnectionSettings;
import com.pgwire.client.model.PgPreparedStatement;
import com.pgwire.client.model.PgQueryResult;
import com.pgwire.client.netty.PgEventLoop;
import com.pgwire.client.netty.SslResponseHandler;
import com.pgwire.client.query.PgExtendedQueryExecutor;
import com.pgwire.client.query.PgSimpleQueryExecutor;
import com.pgwire.client.reader.ListRowReader;
import com.pgwire.client.reader.RowReader;
import com.pgwire.client.startup.PgStartupSequencer;
import com.pgwire.configuration.PgWireConfigLoader;
import com.pgwire.configuration.model.SslMode;
import com.pgwire.configuration.predefined.PgWireConnectionProperties;
import com.pgwire.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import com.pgwire.postgresprotocol.encoder.ClientPostgresProtocolMessageEncoder;
import com.pgwire.postgresprotocol.exception.ConnectionBusyException;
import com.pgwire.postgresprotocol.exception.ConnectionClosedException;
import com.pgwire.postgresprotocol.exception.PgConnectionInitializationException;
import com.pgwire.postgresprotocol.exception.UnknownPreparedStatementException;
import com.pgwire.postgresprotocol.model.protocol.BackendKeyData;
import com.pgwire.postgresprotocol.model.protocol.NotificationResponse;
import com.pgwire.postgresprotocol.model.protocol.TransactionStatus;
import com.pgwire.postgresprotocol.stream.PgMessageStream;
import com.pgwire.typecodec.reader.ReadTable;
import io.netty.channel.Channel;
import io.netty.handler.ssl.SslHandler;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * A single authenticated connection to a Postgres backend.
 * <p>
 * One exchange runs at a time. A call made while another exchange or a COPY is in progress fails
 * with {@link ConnectionBusyException}. Server errors abort the exchange only; the connection stays
 * usable unless the error was FATAL or the stream broke.
 */
@Slf4j
public class PgConnection implements AutoCloseable {
    public static final String SSL_HANDLER_NAME = "pg-ssl";
    private static final String SSL_RESPONSE_HANDLER_NAME = "pg-ssl-response";

    @Getter
    private final PgConnectionSettings settings;
    private final Map<String, PgPreparedStatement> preparedStatements = new ConcurrentHashMap<>();
    private final AtomicBoolean exchangeInProgress = new AtomicBoolean(false);

    private volatile PgSession session;
    private volatile boolean copyInProgress = false;

    private PgConnection(PgConnectionSettings settings, PgSession session) {
        this.settings = settings;
        this.session = session;
    }

    /**
     * Connects, negotiates SSL when configured and authenticates.
     *
     * @throws PgConnectionInitializationException when the server can not be reached or SSL negotiation fails
     */
    public static PgConnection open(PgConnectionSettings settings) {
        Channel channel = connectChannel(settings);
        return new PgConnection(settings, startSession(settings, channel));
    }

    public static PgConnection open(PgWireConnectionProperties properties) {
        return open(PgConnectionSettings.fromProperties(properties));
    }

    /**
     * Opens a connection configured through {@code pgwire.connection.*} properties.
     */
    public static PgConnection open() {
        return open(PgWireConfigLoader.load());
    }

    /**
     * Runs the startup sequence over an already established stream.
     */
    public static PgConnection openOnStream(PgConnectionSettings settings, PgMessageStream stream) {
        return new PgConnection(settings, startSession(settings, stream));
    }

    public List<PgQueryResult<List<List<Object>>>> simpleQuery(String sql) {
        return simpleQuery(sql, ListRowReader::new);
    }

    /**
     * Runs one or more ';'-separated statements through the simple query protocol.
     *
     * @return one result per statement, in order
     */
    public <R> List<PgQueryResult<R>> simpleQuery(String sql, Supplier<? extends RowReader<R>> readerSupplier) {
        acquire();
        try {
            return PgSimpleQueryExecutor.execute(session, sql, readerSupplier);
        } finally {
            release();
        }
    }

    public PgPreparedStatement prepare(String name, String sql) {
        return prepare(name, sql, Collections.emptyList());
    }

    /**
     * Prepares {@code sql} under {@code name}. A statement already prepared under that name is closed
     * first.
     *
     * @param parameterTypeOids declared parameter types, 0 or a shorter list leaves the type to the server
     */
    public PgPreparedStatement prepare(String name, String sql, List<Integer> parameterTypeOids) {
        acquire();
        try {
            boolean closeExisting = preparedStatements.remove(name) != null;
            PgPreparedStatement statement = PgExtendedQueryExecutor.prepare(session, name, sql, parameterTypeOids, closeExisting);
            preparedStatements.put(name, statement);
            log.debug("Prepared statement '{}' with {} parameters.", name, statement.getParameterTypeOids().size());
            return statement;
        } finally {
            release();
        }
    }

    public <R> PgQueryResult<R> execute(String name, Supplier<? extends RowReader<R>> readerSupplier, Object... parameters) {
        return execute(name, readerSupplier, Arrays.asList(parameters));
    }

    public <R> PgQueryResult<R> execute(String name, Supplier<? extends RowReader<R>> readerSupplier, List<?> parameters) {
        PgPreparedStatement statement = preparedStatements.get(name);
        if (statement == null) {
            throw new UnknownPreparedStatementException(name);
        }

        acquire();
        try {
            return PgExtendedQueryExecutor.execute(session, statement, readerSupplier, parameters);
        } finally {
            release();
        }
    }

    /**
     * Closes the prepared statement on the server and forgets it.
     */
    public void unprepare(String name) {
        if (!preparedStatements.containsKey(name)) {
            throw new UnknownPreparedStatementException(name);
        }

        acquire();
        try {
            preparedStatements.remove(name);
            PgExtendedQueryExecutor.close(session, name);
        } finally {
            release();
        }
    }

    /**
     * Runs {@code sql} once through the unnamed statement.
     */
    public <R> PgQueryResult<R> query(String sql, Supplier<? extends RowReader<R>> readerSupplier, Object... parameters) {
        acquire();
        try {
            PgPreparedStatement statement = PgExtendedQueryExecutor.prepare(session, PgExtendedQueryExecutor.UNNAMED, sql, Collections.emptyList(), false);
            return PgExtendedQueryExecutor.execute(session, statement, readerSupplier, Arrays.asList(parameters));
        } finally {
            release();
        }
    }

    public PgCopyWriter copyIn(String table, String... columns) {
        return PgCopyWriter.open(this, table, columns);
    }

    /**
     * Reserves the connection for a COPY writer until {@link #endCopy()}.
     *
     * @return session the writer drives
     */
    public PgSession beginCopy() {
        acquire();
        copyInProgress = true;
        return session;
    }

    public void endCopy() {
        copyInProgress = false;
        release();
    }

    /**
     * Asks the server to cancel whatever this connection is running. Safe to call from any thread.
     */
    public void cancelRequest() {
        PgCancelRequestSender.send(settings.getHost(), settings.getPort(), session.getBackendKeyData(), settings.getConnectTimeoutMs());
    }

    /**
     * Returns the next notification, reading from the idle connection while waiting.
     *
     * @return notification, null if none arrived in time
     */
    public NotificationResponse waitForNotification(Duration timeout) {
        acquire();
        try {
            return session.pollNotification(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } finally {
            release();
        }
    }

    /**
     * Closes this connection and establishes a new one with the same settings. Prepared statements
     * are forgotten; listeners and the read table are carried over.
     */
    public void reopen() {
        if (exchangeInProgress.get()) {
            throw new ConnectionBusyException("Can not reopen a connection while an exchange is in progress.");
        }

        PgSession previous = session;
        previous.getStream().terminate();
        preparedStatements.clear();

        PgSession reopened = startSession(settings, connectChannel(settings));
        reopened.setReadTable(previous.getReadTable());
        reopened.setNoticeListener(previous.getNoticeListener());
        reopened.setNotificationListener(previous.getNotificationListener());
        session = reopened;
        log.debug("Reopened connection to {}:{}.", settings.getHost(), settings.getPort());
    }

    /**
     * Switches the read table until the returned scope is closed.
     */
    public ReadTableScope useReadTable(ReadTable readTable) {
        ReadTable previous = session.getReadTable();
        session.setReadTable(readTable);
        return new ReadTableScope(this, previous);
    }

    public ReadTable getReadTable() {
        return session.getReadTable();
    }

    public void setReadTable(ReadTable readTable) {
        session.setReadTable(readTable);
    }

    public void setNoticeListener(PgNoticeListener listener) {
        session.setNoticeListener(listener);
    }

    public void setNotificationListener(PgNotificationListener listener) {
        session.setNotificationListener(listener);
    }

    public TransactionStatus getTransactionStatus() {
        return session.getTransactionStatus();
    }

    public Map<String, String> getServerParameters() {
        return session.getServerParameters();
    }

    /**
     * @return backend process id, -1 if the server did not send BackendKeyData
     */
    public int getBackendProcessId() {
        BackendKeyData keyData = session.getBackendKeyData();
        return keyData == null ? -1 : keyData.getProcessId();
    }

    public PgPreparedStatement getPreparedStatement(String name) {
        return preparedStatements.get(name);
    }

    public boolean isUsable() {
        return session.getStream().isUsable();
    }

    /**
     * Sends Terminate and closes the channel.
     */
    @Override
    public void close() {
        preparedStatements.clear();
        session.getStream().terminate();
    }

    private void acquire() {
        if (copyInProgress) {
            throw new ConnectionBusyException("A COPY is in progress on this connection. Finish or abort it first.");
        }
        if (!exchangeInProgress.compareAndSet(false, true)) {
            throw new ConnectionBusyException("Another exchange is in progress on this connection.");
        }
        if (!session.getStream().isUsable()) {
            exchangeInProgress.set(false);
            throw new ConnectionClosedException("Connection to Postgres is closed.");
        }
    }

    private void release() {
        exchangeInProgress.set(false);
    }

    private static Channel connectChannel(PgConnectionSettings settings) {
        Channel channel = PgEventLoop.connect(settings.getHost(), settings.getPort(), settings.getConnectTimeoutMs());
        try {
            if (settings.getSslMode() != SslMode.DISABLE) {
                negotiateSsl(channel, settings);
            }
        } catch (RuntimeException e) {
            channel.close();
            throw e;
        }
        return channel;
    }

    private static PgSession startSession(PgConnectionSettings settings, Channel channel) {
        PgMessageStream stream;
        try {
            stream = new PgMessageStream(channel);
        } catch (RuntimeException e) {
            channel.close();
            throw e;
        }
        return startSession(settings, stream);
    }

    private static PgSession startSession(PgConnectionSettings settings, PgMessageStream stream) {
        PgSession session = new PgSession(stream, ReadTable.installed());
        new PgStartupSequencer(settings, session).run();
        log.debug("Connection to database {} as {} is ready.", settings.getDatabase(), settings.getUser());
        return session;
    }

    private static void negotiateSsl(Channel channel, PgConnectionSettings settings) {
        if (settings.getSslContext() == null) {
            if (settings.getSslMode() == SslMode.REQUIRE) {
                throw new PgConnectionInitializationException("SSL is required but no SslContext was configured.");
            }
            log.debug("SSL preferred but no SslContext configured, continuing without SSL.");
            return;
        }

        SslResponseHandler responseHandler = new SslResponseHandler();
        channel.pipeline().addLast(SSL_RESPONSE_HANDLER_NAME, responseHandler);
        channel.writeAndFlush(ClientPostgresProtocolMessageEncoder.encodeSslRequestMessage(channel.alloc()));

        byte answer;
        try {
            answer = responseHandler.getResponse().get(settings.getConnectTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PgConnectionInitializationException("Interrupted while waiting for the SSL response.", e);
        } catch (ExecutionException e) {
            throw new PgConnectionInitializationException("SSL negotiation failed.", e.getCause());
        } catch (TimeoutException e) {
            throw new PgConnectionInitializationException("Server did not answer the SSL request in time.", e);
        }

        switch (answer) {
            case PostgresProtocolGeneralConstants.SSL_ACCEPTED_RESPONSE -> {
                SslHandler sslHandler = settings.getSslContext().newHandler(channel.alloc(), settings.getHost(), settings.getPort());
                channel.pipeline().addFirst(SSL_HANDLER_NAME, sslHandler);
                if (!sslHandler.handshakeFuture().awaitUninterruptibly(settings.getConnectTimeoutMs()) || !sslHandler.handshakeFuture().isSuccess()) {
                    throw new PgConnectionInitializationException("SSL handshake with " + settings.getHost() + " failed.", sslHandler.handshakeFuture().cause());
                }
                log.debug("SSL established with {}:{}.", settings.getHost(), settings.getPort());
            }
            case PostgresProtocolGeneralConstants.SSL_REJECTED_RESPONSE -> {
                if (settings.getSslMode() == SslMode.REQUIRE) {
                    throw new PgConnectionInitializationException("SSL is required but the server does not support it.");
                }
                log.debug("Server refused SSL, continuing without it.");
            }
            default -> throw new PgConnectionInitializationException("Unexpected answer '" + (char) answer + "' to the SSL request.");
        }
    }

    /**
     * Restores the read table that was active before {@link #useReadTable(ReadTable)}.
     */
    public static class ReadTableScope implements AutoCloseable {
        private final PgConnection connection;
        private final ReadTable previous;

        private ReadTableScope(PgConnection connection, ReadTable previous) {
            this.connection = connection;
            this.previous = previous;
        }

        @Override
        public void close() {
            connection.setReadTable(previous);
        }
    }
}

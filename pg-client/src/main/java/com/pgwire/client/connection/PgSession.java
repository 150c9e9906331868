package com.pgwire.client.connection;

import com.pgwire.client.listener.LoggingNoticeListener;
import com.pgwire.client.listener.PgNoticeListener;
import com.pgwire.client.listener.PgNotificationListener;
import com.pgwire.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import com.pgwire.postgresprotocol.decoder.ServerPostgresProtocolMessageDecoder;
import com.pgwire.postgresprotocol.error.PgErrorClassifier;
import com.pgwire.postgresprotocol.error.PgServerException;
import com.pgwire.postgresprotocol.model.internal.PgMessageInfo;
import com.pgwire.postgresprotocol.model.protocol.BackendKeyData;
import com.pgwire.postgresprotocol.model.protocol.NotificationResponse;
import com.pgwire.postgresprotocol.model.protocol.ParameterStatus;
import com.pgwire.postgresprotocol.model.protocol.TransactionStatus;
import com.pgwire.postgresprotocol.stream.PgMessageStream;
import com.pgwire.typecodec.reader.ReadTable;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Per-connection protocol state shared by the startup sequencer, the executors and the COPY writer.
 * Messages the server may send at any time (ParameterStatus, NoticeResponse, NotificationResponse)
 * are consumed here and never reach the executors.
 */
@Slf4j
public class PgSession {
    // queued only while no listener is set; the oldest are dropped beyond this
    static final int MAX_PENDING_NOTIFICATIONS = 1024;

    @Getter
    private final PgMessageStream stream;
    private final Map<String, String> serverParameters = new ConcurrentHashMap<>();
    private final BlockingQueue<NotificationResponse> pendingNotifications = new LinkedBlockingQueue<>(MAX_PENDING_NOTIFICATIONS);

    @Getter
    @Setter
    private volatile BackendKeyData backendKeyData;
    @Getter
    private volatile TransactionStatus transactionStatus = TransactionStatus.IDLE;
    @Getter
    @Setter
    private volatile ReadTable readTable;
    @Getter
    @Setter
    private volatile PgNoticeListener noticeListener = LoggingNoticeListener.INSTANCE;
    @Getter
    @Setter
    private volatile PgNotificationListener notificationListener;

    public PgSession(PgMessageStream stream, ReadTable readTable) {
        this.stream = stream;
        this.readTable = readTable;
    }

    /**
     * @return next message an exchange has to handle; the caller releases it
     */
    public PgMessageInfo receive() {
        while (true) {
            PgMessageInfo message = stream.receive();
            if (!handleAsyncMessage(message)) {
                return message;
            }
        }
    }

    /**
     * Consumes and releases the message if it is one the server may send at any time.
     *
     * @return true if the message was consumed
     */
    public boolean handleAsyncMessage(PgMessageInfo message) {
        switch (message.getStartByte()) {
            case PostgresProtocolGeneralConstants.PARAMETER_STATUS_MESSAGE_START_CHAR -> {
                try {
                    ParameterStatus parameterStatus = ServerPostgresProtocolMessageDecoder.decodeParameterStatus(message);
                    serverParameters.put(parameterStatus.getName(), parameterStatus.getValue());
                    log.debug("Server parameter {} = {}", parameterStatus.getName(), parameterStatus.getValue());
                } finally {
                    message.release();
                }
                return true;
            }
            case PostgresProtocolGeneralConstants.NOTICE_RESPONSE_START_CHAR -> {
                try {
                    noticeListener.onNotice(ServerPostgresProtocolMessageDecoder.decodeNoticeResponse(message));
                } finally {
                    message.release();
                }
                return true;
            }
            case PostgresProtocolGeneralConstants.NOTIFICATION_RESPONSE_START_CHAR -> {
                NotificationResponse notification;
                try {
                    notification = ServerPostgresProtocolMessageDecoder.decodeNotificationResponse(message);
                } finally {
                    message.release();
                }
                PgNotificationListener listener = notificationListener;
                if (listener != null) {
                    listener.onNotification(notification);
                } else {
                    queueNotification(notification);
                }
                return true;
            }
            default -> {
                return false;
            }
        }
    }

    public void onReadyForQuery(PgMessageInfo message) {
        transactionStatus = ServerPostgresProtocolMessageDecoder.decodeReadyForQuery(message);
    }

    /**
     * Classifies an ErrorResponse. FATAL and PANIC errors end the session, so the stream is marked
     * failed before the exception is returned.
     */
    public PgServerException classifyError(PgMessageInfo message) {
        PgServerException exception = PgErrorClassifier.classify(message);
        if (exception.isFatal()) {
            log.warn("Postgres ended the session: {}", exception.getMessage());
            stream.markFailed(exception);
        }
        return exception;
    }

    private void queueNotification(NotificationResponse notification) {
        while (!pendingNotifications.offer(notification)) {
            NotificationResponse dropped = pendingNotifications.poll();
            if (dropped != null) {
                log.warn("Notification queue is full, dropping notification on channel '{}' from process {}.", dropped.getChannel(), dropped.getProcessId());
            }
        }
    }

    /**
     * Returns a queued notification or reads from the idle connection until one arrives.
     *
     * @return notification, null when none arrived in time
     */
    public NotificationResponse pollNotification(long timeout, TimeUnit unit) {
        NotificationResponse notification = pendingNotifications.poll();
        if (notification != null) {
            return notification;
        }

        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return null;
            }

            PgMessageInfo message = stream.receive(remaining, TimeUnit.NANOSECONDS);
            if (message == null) {
                return null;
            }
            if (!handleAsyncMessage(message)) {
                try {
                    if (message.getStartByte() == PostgresProtocolGeneralConstants.ERROR_MESSAGE_START_CHAR) {
                        throw classifyError(message);
                    }
                    log.warn("Ignoring unexpected message '{}' received while idle.", (char) message.getStartByte());
                } finally {
                    message.release();
                }
            }

            notification = pendingNotifications.poll();
            if (notification != null) {
                return notification;
            }
        }
    }

    public Map<String, String> getServerParameters() {
        return Collections.unmodifiableMap(serverParameters);
    }
}

package com.pgwire.client.listener;

import com.pgwire.postgresprotocol.model.protocol.NotificationResponse;

/**
 * Receives {@code NOTIFY} messages. Called on the thread that is reading from the connection.
 */
@FunctionalInterface
public interface PgNotificationListener {
    void onNotification(NotificationResponse notification);
}

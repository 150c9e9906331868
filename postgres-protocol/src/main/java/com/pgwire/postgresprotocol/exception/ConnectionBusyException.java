package com.pgwire.postgresprotocol.exception;

public class ConnectionBusyException extends PgClientException {
    public ConnectionBusyException(String message) {
        super(message);
    }

    public ConnectionBusyException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.pgwire.postgresprotocol.exception;

/**
 * The connection was closed or its stream failed. The connection must be discarded.
 */
public class ConnectionClosedException extends PgClientException {
    public ConnectionClosedException(String message) {
        super(message);
    }

    public ConnectionClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}

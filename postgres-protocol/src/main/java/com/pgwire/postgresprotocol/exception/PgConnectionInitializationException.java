package com.pgwire.postgresprotocol.exception;

public class PgConnectionInitializationException extends PgClientException {
    public PgConnectionInitializationException(String message) {
        super(message);
    }

    public PgConnectionInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.pgwire.postgresprotocol.exception;

public class ValueEncodingException extends PgClientException {
    public ValueEncodingException(String message) {
        super(message);
    }

    public ValueEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}

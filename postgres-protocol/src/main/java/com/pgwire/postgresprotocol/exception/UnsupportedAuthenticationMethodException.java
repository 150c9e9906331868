package com.pgwire.postgresprotocol.exception;

public class UnsupportedAuthenticationMethodException extends PgClientException {
    public UnsupportedAuthenticationMethodException(String message) {
        super(message);
    }

    public UnsupportedAuthenticationMethodException(String message, Throwable cause) {
        super(message, cause);
    }
}

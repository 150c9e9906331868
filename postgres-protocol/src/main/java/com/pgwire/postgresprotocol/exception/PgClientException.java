package com.pgwire.postgresprotocol.exception;

/**
 * Root of failures detected on the client side: broken framing, local contract violations and
 * codec problems. Errors reported by the server are {@link com.pgwire.postgresprotocol.error.PgServerException}.
 */
public class PgClientException extends RuntimeException {
    public PgClientException() {
    }

    public PgClientException(String message) {
        super(message);
    }

    public PgClientException(String message, Throwable cause) {
        super(message, cause);
    }

    public PgClientException(Throwable cause) {
        super(cause);
    }

    public PgClientException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}

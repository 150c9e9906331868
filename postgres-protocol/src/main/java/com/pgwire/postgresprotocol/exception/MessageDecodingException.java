package com.pgwire.postgresprotocol.exception;

public class MessageDecodingException extends PgClientException {
    public MessageDecodingException(String message) {
        super(message);
    }

    public MessageDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.pgwire.postgresprotocol.exception;

/**
 * The byte stream does not carry well-formed messages: implausible length or truncated message.
 */
public class ProtocolFramingException extends PgClientException {
    public ProtocolFramingException(String message) {
        super(message);
    }

    public ProtocolFramingException(String message, Throwable cause) {
        super(message, cause);
    }
}

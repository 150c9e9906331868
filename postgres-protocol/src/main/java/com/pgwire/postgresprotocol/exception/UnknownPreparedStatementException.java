package com.pgwire.postgresprotocol.exception;

import lombok.Getter;

@Getter
public class UnknownPreparedStatementException extends PgClientException {
    private final String statementName;

    public UnknownPreparedStatementException(String statementName) {
        super("No prepared statement named '" + statementName + "' on this connection.");
        this.statementName = statementName;
    }
}

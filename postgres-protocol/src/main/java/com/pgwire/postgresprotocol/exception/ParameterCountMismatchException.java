package com.pgwire.postgresprotocol.exception;

import lombok.Getter;

@Getter
public class ParameterCountMismatchException extends PgClientException {
    private final String statementName;
    private final int expected;
    private final int actual;

    public ParameterCountMismatchException(String statementName, int expected, int actual) {
        super("Prepared statement '" + statementName + "' expects " + expected + " parameters but " + actual + " were given.");
        this.statementName = statementName;
        this.expected = expected;
        this.actual = actual;
    }
}

package com.pgwire.postgresprotocol.model.protocol;

import com.pgwire.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import com.pgwire.postgresprotocol.exception.MessageDecodingException;
import lombok.Getter;

public enum TransactionStatus {
    IDLE(PostgresProtocolGeneralConstants.READY_FOR_QUERY_TRANSACTION_IDLE),
    IN_TRANSACTION(PostgresProtocolGeneralConstants.READY_FOR_QUERY_TRANSACTION_IN_PROGRESS),
    FAILED_TRANSACTION(PostgresProtocolGeneralConstants.READY_FOR_QUERY_TRANSACTION_FAILED);

    @Getter
    private final byte indicator;

    TransactionStatus(byte indicator) {
        this.indicator = indicator;
    }

    public static TransactionStatus fromIndicator(byte indicator) {
        for (TransactionStatus status : values()) {
            if (status.indicator == indicator) {
                return status;
            }
        }
        throw new MessageDecodingException("Unknown transaction status indicator '" + (char) indicator + "' in ReadyForQuery.");
    }
}

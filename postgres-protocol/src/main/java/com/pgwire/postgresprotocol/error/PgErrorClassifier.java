package com.pgwire.postgresprotocol.error;

import com.pgwire.postgresprotocol.decoder.ServerPostgresProtocolMessageDecoder;
import com.pgwire.postgresprotocol.model.internal.PgMessageInfo;
import com.pgwire.postgresprotocol.model.protocol.ErrorResponse;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class PgErrorClassifier {

    public static PgServerException classify(PgMessageInfo errorMessage) {
        return classify(ServerPostgresProtocolMessageDecoder.decodeErrorResponse(errorMessage));
    }

    public static PgServerException classify(ErrorResponse errorResponse) {
        String sqlState = errorResponse.getCode();
        PgErrorCondition condition = PgErrorCondition.fromSqlState(sqlState);
        PgErrorClass errorClass = condition != null ? condition.getErrorClass() : PgErrorClass.fromSqlState(sqlState);

        if (errorClass == PgErrorClass.UNKNOWN) {
            log.debug("SQLSTATE '{}' does not belong to a known class.", sqlState);
        }

        return new PgServerException(errorClass, condition, errorResponse);
    }

    private PgErrorClassifier() {
    }
}

package com.pgwire.postgresprotocol.utils;

import com.pgwire.postgresprotocol.model.protocol.ErrorResponse;
import org.apache.commons.lang3.StringUtils;

public class PostgresErrorMessageUtils {

    public static String getLoggableErrorMessageFromErrorResponse(ErrorResponse errorResponse) {
        if (errorResponse == null) {
            return null;
        }

        StringBuilder builder = new StringBuilder();

        if (StringUtils.isNotEmpty(errorResponse.getSeverity())) {
            builder.append(errorResponse.getSeverity()).append(": ");
        }

        builder.append(StringUtils.defaultIfEmpty(errorResponse.getMessage(), "no message"));

        if (StringUtils.isNotEmpty(errorResponse.getCode())) {
            builder.append(" [").append(errorResponse.getCode()).append("]");
        }
        if (StringUtils.isNotEmpty(errorResponse.getDetail())) {
            builder.append(" DETAIL: ").append(errorResponse.getDetail());
        }
        if (StringUtils.isNotEmpty(errorResponse.getHint())) {
            builder.append(" HINT: ").append(errorResponse.getHint());
        }

        return builder.toString();
    }

    private PostgresErrorMessageUtils() {
    }
}

package com.pgwire.postgresprotocol.error;

import com.pgwire.postgresprotocol.constant.PostgresProtocolErrorAndNoticeConstant;
import com.pgwire.postgresprotocol.model.protocol.ErrorResponse;
import com.pgwire.postgresprotocol.utils.PostgresErrorMessageUtils;
import lombok.Getter;

import java.util.Optional;

/**
 * An error reported by the server through ErrorResponse. Match on {@link #getErrorClass()} for the
 * SQLSTATE class or on {@link #getCondition()} for a specific code.
 */
@Getter
public class PgServerException extends RuntimeException {

    private final PgErrorClass errorClass;
    private final PgErrorCondition condition;
    private final ErrorResponse errorResponse;

    public PgServerException(PgErrorClass errorClass, PgErrorCondition condition, ErrorResponse errorResponse) {
        super(PostgresErrorMessageUtils.getLoggableErrorMessageFromErrorResponse(errorResponse));
        this.errorClass = errorClass;
        this.condition = condition;
        this.errorResponse = errorResponse;
    }

    public Optional<PgErrorCondition> findCondition() {
        return Optional.ofNullable(condition);
    }

    public boolean is(PgErrorCondition expected) {
        return condition == expected;
    }

    public boolean is(PgErrorClass expected) {
        return errorClass == expected;
    }

    public String getSqlState() {
        return errorResponse.getCode();
    }

    public String getSeverity() {
        return errorResponse.getSeverityNotLocalized() != null ? errorResponse.getSeverityNotLocalized() : errorResponse.getSeverity();
    }

    public String getServerMessage() {
        return errorResponse.getMessage();
    }

    public String getDetail() {
        return errorResponse.getDetail();
    }

    public String getHint() {
        return errorResponse.getHint();
    }

    public String getConstraintName() {
        return errorResponse.getConstraintName();
    }

    public String getTableName() {
        return errorResponse.getTableName();
    }

    /**
     * FATAL and PANIC errors end the backend session.
     */
    public boolean isFatal() {
        String severity = getSeverity();
        return PostgresProtocolErrorAndNoticeConstant.FATAL_SEVERITY.equals(severity)
                || PostgresProtocolErrorAndNoticeConstant.PANIC_SEVERITY.equals(severity);
    }
}

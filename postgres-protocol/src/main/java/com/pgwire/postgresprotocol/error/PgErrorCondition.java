package com.pgwire.postgresprotocol.error;

import lombok.Getter;

/**
 * Specific SQLSTATE codes a caller is likely to react to, each refining one {@link PgErrorClass}.
 */
public enum PgErrorCondition {
    // class 08
    CONNECTION_DOES_NOT_EXIST("08003", PgErrorClass.CONNECTION_EXCEPTION),
    CONNECTION_FAILURE("08006", PgErrorClass.CONNECTION_EXCEPTION),
    SQLCLIENT_UNABLE_TO_ESTABLISH_SQLCONNECTION("08001", PgErrorClass.CONNECTION_EXCEPTION),
    SQLSERVER_REJECTED_ESTABLISHMENT_OF_SQLCONNECTION("08004", PgErrorClass.CONNECTION_EXCEPTION),
    PROTOCOL_VIOLATION("08P01", PgErrorClass.CONNECTION_EXCEPTION),

    // class 22
    STRING_DATA_RIGHT_TRUNCATION("22001", PgErrorClass.DATA_EXCEPTION),
    NUMERIC_VALUE_OUT_OF_RANGE("22003", PgErrorClass.DATA_EXCEPTION),
    NULL_VALUE_NOT_ALLOWED("22004", PgErrorClass.DATA_EXCEPTION),
    INVALID_DATETIME_FORMAT("22007", PgErrorClass.DATA_EXCEPTION),
    DATETIME_FIELD_OVERFLOW("22008", PgErrorClass.DATA_EXCEPTION),
    DIVISION_BY_ZERO("22012", PgErrorClass.DATA_EXCEPTION),
    CHARACTER_NOT_IN_REPERTOIRE("22021", PgErrorClass.DATA_EXCEPTION),
    INVALID_TEXT_REPRESENTATION("22P02", PgErrorClass.DATA_EXCEPTION),
    INVALID_BINARY_REPRESENTATION("22P03", PgErrorClass.DATA_EXCEPTION),
    BAD_COPY_FILE_FORMAT("22P04", PgErrorClass.DATA_EXCEPTION),

    // class 23
    RESTRICT_VIOLATION("23001", PgErrorClass.INTEGRITY_CONSTRAINT_VIOLATION),
    NOT_NULL_VIOLATION("23502", PgErrorClass.INTEGRITY_CONSTRAINT_VIOLATION),
    FOREIGN_KEY_VIOLATION("23503", PgErrorClass.INTEGRITY_CONSTRAINT_VIOLATION),
    UNIQUE_VIOLATION("23505", PgErrorClass.INTEGRITY_CONSTRAINT_VIOLATION),
    CHECK_VIOLATION("23514", PgErrorClass.INTEGRITY_CONSTRAINT_VIOLATION),
    EXCLUSION_VIOLATION("23P01", PgErrorClass.INTEGRITY_CONSTRAINT_VIOLATION),

    // class 25
    ACTIVE_SQL_TRANSACTION("25001", PgErrorClass.INVALID_TRANSACTION_STATE),
    READ_ONLY_SQL_TRANSACTION("25006", PgErrorClass.INVALID_TRANSACTION_STATE),
    IN_FAILED_SQL_TRANSACTION("25P02", PgErrorClass.INVALID_TRANSACTION_STATE),

    // class 28
    INVALID_PASSWORD("28P01", PgErrorClass.INVALID_AUTHORIZATION_SPECIFICATION),

    // class 40
    TRANSACTION_INTEGRITY_CONSTRAINT_VIOLATION("40002", PgErrorClass.TRANSACTION_ROLLBACK),
    SERIALIZATION_FAILURE("40001", PgErrorClass.TRANSACTION_ROLLBACK),
    STATEMENT_COMPLETION_UNKNOWN("40003", PgErrorClass.TRANSACTION_ROLLBACK),
    DEADLOCK_DETECTED("40P01", PgErrorClass.TRANSACTION_ROLLBACK),

    // class 42
    SYNTAX_ERROR("42601", PgErrorClass.SYNTAX_ERROR_OR_ACCESS_RULE_VIOLATION),
    INSUFFICIENT_PRIVILEGE("42501", PgErrorClass.SYNTAX_ERROR_OR_ACCESS_RULE_VIOLATION),
    UNDEFINED_COLUMN("42703", PgErrorClass.SYNTAX_ERROR_OR_ACCESS_RULE_VIOLATION),
    UNDEFINED_FUNCTION("42883", PgErrorClass.SYNTAX_ERROR_OR_ACCESS_RULE_VIOLATION),
    UNDEFINED_TABLE("42P01", PgErrorClass.SYNTAX_ERROR_OR_ACCESS_RULE_VIOLATION),
    UNDEFINED_OBJECT("42704", PgErrorClass.SYNTAX_ERROR_OR_ACCESS_RULE_VIOLATION),
    DATATYPE_MISMATCH("42804", PgErrorClass.SYNTAX_ERROR_OR_ACCESS_RULE_VIOLATION),
    DUPLICATE_COLUMN("42701", PgErrorClass.SYNTAX_ERROR_OR_ACCESS_RULE_VIOLATION),
    DUPLICATE_OBJECT("42710", PgErrorClass.SYNTAX_ERROR_OR_ACCESS_RULE_VIOLATION),
    DUPLICATE_PREPARED_STATEMENT("42P05", PgErrorClass.SYNTAX_ERROR_OR_ACCESS_RULE_VIOLATION),
    DUPLICATE_TABLE("42P07", PgErrorClass.SYNTAX_ERROR_OR_ACCESS_RULE_VIOLATION),
    AMBIGUOUS_COLUMN("42702", PgErrorClass.SYNTAX_ERROR_OR_ACCESS_RULE_VIOLATION),
    INDETERMINATE_DATATYPE("42P18", PgErrorClass.SYNTAX_ERROR_OR_ACCESS_RULE_VIOLATION),
    INVALID_FOREIGN_KEY("42830", PgErrorClass.SYNTAX_ERROR_OR_ACCESS_RULE_VIOLATION),

    // class 53
    DISK_FULL("53100", PgErrorClass.INSUFFICIENT_RESOURCES),
    OUT_OF_MEMORY("53200", PgErrorClass.INSUFFICIENT_RESOURCES),
    TOO_MANY_CONNECTIONS("53300", PgErrorClass.INSUFFICIENT_RESOURCES),
    CONFIGURATION_LIMIT_EXCEEDED("53400", PgErrorClass.INSUFFICIENT_RESOURCES),

    // class 55
    OBJECT_IN_USE("55006", PgErrorClass.OBJECT_NOT_IN_PREREQUISITE_STATE),
    LOCK_NOT_AVAILABLE("55P03", PgErrorClass.OBJECT_NOT_IN_PREREQUISITE_STATE),

    // class 57
    QUERY_CANCELED("57014", PgErrorClass.OPERATOR_INTERVENTION),
    ADMIN_SHUTDOWN("57P01", PgErrorClass.OPERATOR_INTERVENTION),
    CRASH_SHUTDOWN("57P02", PgErrorClass.OPERATOR_INTERVENTION),
    CANNOT_CONNECT_NOW("57P03", PgErrorClass.OPERATOR_INTERVENTION),
    DATABASE_DROPPED("57P04", PgErrorClass.OPERATOR_INTERVENTION),

    // class 3D, 3F
    INVALID_CATALOG_NAME("3D000", PgErrorClass.INVALID_CATALOG_NAME),
    INVALID_SCHEMA_NAME("3F000", PgErrorClass.INVALID_SCHEMA_NAME);

    @Getter
    private final String sqlState;
    @Getter
    private final PgErrorClass errorClass;

    PgErrorCondition(String sqlState, PgErrorClass errorClass) {
        this.sqlState = sqlState;
        this.errorClass = errorClass;
    }

    /**
     * @return matching condition or null when the code has no dedicated leaf
     */
    public static PgErrorCondition fromSqlState(String sqlState) {
        if (sqlState == null) {
            return null;
        }

        for (PgErrorCondition condition : values()) {
            if (condition.sqlState.equals(sqlState)) {
                return condition;
            }
        }

        return null;
    }
}

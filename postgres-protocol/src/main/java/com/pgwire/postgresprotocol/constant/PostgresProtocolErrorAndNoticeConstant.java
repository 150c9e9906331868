package com.pgwire.postgresprotocol.constant;

public class PostgresProtocolErrorAndNoticeConstant {

    // Message fields https://www.postgresql.org/docs/current/protocol-error-fields.html

    public static final byte SEVERITY_LOCALIZED_MARKER = 'S';
    public static final byte SEVERITY_NOT_LOCALIZED_MARKER = 'V';
    public static final byte SQLSTATE_CODE_MARKER = 'C';
    public static final byte MESSAGE_MARKER = 'M';
    public static final byte DETAIL_MARKER = 'D';
    public static final byte HINT_MARKER = 'H';
    public static final byte POSITION_MARKER = 'P';
    public static final byte INTERNAL_POSITION_MARKER = 'p';
    public static final byte INTERNAL_QUERY_MARKER = 'q';
    public static final byte WHERE_MARKER = 'W';
    public static final byte SCHEMA_NAME_MARKER = 's';
    public static final byte TABLE_NAME_MARKER = 't';
    public static final byte COLUMN_NAME_MARKER = 'c';
    public static final byte DATA_TYPE_NAME_MARKER = 'd';
    public static final byte CONSTRAINT_NAME_MARKER = 'n';
    public static final byte FILE_MARKER = 'F';
    public static final byte LINE_MARKER = 'L';
    public static final byte ROUTINE_MARKER = 'R';

    // Severity
    public static final String FATAL_SEVERITY = "FATAL";
    public static final String PANIC_SEVERITY = "PANIC";

    private PostgresProtocolErrorAndNoticeConstant() {
    }
}

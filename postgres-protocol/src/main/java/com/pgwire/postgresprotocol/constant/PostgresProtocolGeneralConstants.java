package com.pgwire.postgresprotocol.constant;

public class PostgresProtocolGeneralConstants {
    public static final byte DELIMITER_BYTE = 0;
    public static final int MESSAGE_LENGTH_BYTES_COUNT = 4;
    public static final int MESSAGE_MARKER_AND_LENGTH_BYTES_COUNT = MESSAGE_LENGTH_BYTES_COUNT + 1;
    // backend never sends anything larger, see PqRecvBuffer limits in the server
    public static final int MAX_MESSAGE_LENGTH = 0x3FFFFFFF;

    public static final short PROTOCOL_MAJOR_VERSION = 3;
    public static final short PROTOCOL_MINOR_VERSION = 0;
    public static final int CANCEL_REQUEST_CODE = 80877102;
    public static final int SSL_REQUEST_CODE = 80877103;
    public static final int CANCEL_REQUEST_MESSAGE_LENGTH = 16;
    public static final int SSL_REQUEST_MESSAGE_LENGTH = 8;
    public static final byte SSL_ACCEPTED_RESPONSE = 'S';
    public static final byte SSL_REJECTED_RESPONSE = 'N';

    public static final int AUTH_OK_MESSAGE_DATA = 0;
    public static final int SASL_AUTH_INT_MARKER = 10;
    public static final int SASL_AUTH_CHALLENGE_MARKER = 11;
    public static final int SASL_AUTH_COMPLETED_MARKER = 12;

    public static final String STARTUP_PARAMETER_USER = "user";
    public static final String STARTUP_PARAMETER_DATABASE = "database";
    public static final String STARTUP_PARAMETER_APPLICATION_NAME = "application_name";
    public static final String STARTUP_PARAMETER_CLIENT_ENCODING = "client_encoding";
    public static final String STARTUP_PARAMETER_DATE_STYLE = "DateStyle";
    public static final String CLIENT_ENCODING_UTF8 = "UTF8";
    public static final String DATE_STYLE_ISO = "ISO, MDY";

    // backend message start chars
    public static final byte AUTH_REQUEST_START_CHAR = 'R';
    public static final byte BACKEND_KEY_DATA_START_CHAR = 'K';
    public static final byte BIND_COMPLETE_START_CHAR = '2';
    public static final byte CLOSE_COMPLETE_START_CHAR = '3';
    public static final byte COMMAND_COMPLETE_START_CHAR = 'C';
    public static final byte COPY_IN_RESPONSE_START_CHAR = 'G';
    public static final byte COPY_OUT_RESPONSE_START_CHAR = 'H';
    public static final byte COPY_BOTH_RESPONSE_START_CHAR = 'W';
    public static final byte DATA_ROW_START_CHAR = 'D';
    public static final byte EMPTY_QUERY_RESPONSE_START_CHAR = 'I';
    public static final byte ERROR_MESSAGE_START_CHAR = 'E';
    public static final byte NEGOTIATE_PROTOCOL_VERSION_START_CHAR = 'v';
    public static final byte NO_DATA_START_CHAR = 'n';
    public static final byte NOTICE_RESPONSE_START_CHAR = 'N';
    public static final byte NOTIFICATION_RESPONSE_START_CHAR = 'A';
    public static final byte PARAMETER_DESCRIPTION_START_CHAR = 't';
    public static final byte PARAMETER_STATUS_MESSAGE_START_CHAR = 'S';
    public static final byte PARSE_COMPLETE_START_CHAR = '1';
    public static final byte PORTAL_SUSPENDED_START_CHAR = 's';
    public static final byte READY_FOR_QUERY_MESSAGE_START_CHAR = 'Z';
    public static final byte ROW_DESCRIPTION_START_CHAR = 'T';

    // copy messages travel both ways
    public static final byte COPY_DATA_START_CHAR = 'd';
    public static final byte COPY_DONE_START_CHAR = 'c';
    public static final byte COPY_FAIL_START_CHAR = 'f';

    // frontend message start bytes
    public static final byte QUERY_MESSAGE_START_BYTE = 'Q';
    public static final byte PARSE_MESSAGE_START_BYTE = 'P';
    public static final byte DESCRIBE_MESSAGE_START_BYTE = 'D';
    public static final byte BIND_MESSAGE_START_BYTE = 'B';
    public static final byte EXECUTE_MESSAGE_START_BYTE = 'E';
    public static final byte SYNC_MESSAGE_START_BYTE = 'S';
    public static final byte CLOSE_MESSAGE_START_BYTE = 'C';
    public static final byte FLUSH_MESSAGE_START_BYTE = 'H';
    public static final byte CLIENT_TERMINATION_MESSAGE_START_CHAR = 'X';
    public static final byte CLIENT_PASSWORD_RESPONSE_START_CHAR = 'p';

    // targets of Describe and Close
    public static final byte DESCRIBE_OR_CLOSE_STATEMENT = 'S';
    public static final byte DESCRIBE_OR_CLOSE_PORTAL = 'P';

    // ready for query
    public static final byte READY_FOR_QUERY_TRANSACTION_IDLE = 'I';
    public static final byte READY_FOR_QUERY_TRANSACTION_IN_PROGRESS = 'T';
    public static final byte READY_FOR_QUERY_TRANSACTION_FAILED = 'E';

    // format codes
    public static final short TEXT_FORMAT_CODE = 0;
    public static final short BINARY_FORMAT_CODE = 1;

    public static final int NULL_VALUE_LENGTH = -1;

    private PostgresProtocolGeneralConstants() {
    }
}

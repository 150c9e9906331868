package com.pgwire.postgresprotocol.decoder;

import com.pgwire.postgresprotocol.constant.PostgresProtocolErrorAndNoticeConstant;
import com.pgwire.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import com.pgwire.postgresprotocol.exception.MessageDecodingException;
import com.pgwire.postgresprotocol.model.internal.PgMessageInfo;
import com.pgwire.postgresprotocol.model.protocol.*;
import com.pgwire.postgresprotocol.utils.DecoderUtils;
import io.netty.buffer.ByteBuf;
import org.apache.commons.lang3.math.NumberUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes backend messages framed by {@link com.pgwire.postgresprotocol.handler.PgMessageFramingHandler}.
 * Methods read from a duplicate of the payload, so the message itself can be decoded again.
 */
public class ServerPostgresProtocolMessageDecoder {

    public static AuthenticationRequestMessage decodeAuthRequestMessage(PgMessageInfo messageInfo) {
        ByteBuf byteBuf = payloadOf(messageInfo, PostgresProtocolGeneralConstants.AUTH_REQUEST_START_CHAR);

        try {
            int methodMarker = byteBuf.readInt();

            return AuthenticationRequestMessage
                    .builder()
                    .method(PostgresProtocolAuthenticationMethod.fromMarker(methodMarker))
                    .methodMarker(methodMarker)
                    .specificData(DecoderUtils.readBytes(byteBuf, byteBuf.readableBytes()))
                    .build();

        } catch (IndexOutOfBoundsException e) {
            throw new MessageDecodingException("Error decoding AuthRequest. ", e);
        }
    }

    public static RowDescription decodeRowDescriptionMessage(PgMessageInfo messageInfo) {
        ByteBuf byteBuf = payloadOf(messageInfo, PostgresProtocolGeneralConstants.ROW_DESCRIPTION_START_CHAR);

        try {
            int numOfFieldsInRow = byteBuf.readUnsignedShort();
            List<RowDescription.FieldDescription> fieldDescriptions = new ArrayList<>(numOfFieldsInRow);

            for (int i = 0; i < numOfFieldsInRow; i++) {
                String fieldName = DecoderUtils.readNextNullTerminatedString(byteBuf);

                int tableOid = byteBuf.readInt();
                short columnAttributeNumber = byteBuf.readShort();
                int fieldDataTypeOid = byteBuf.readInt();
                short fieldDataTypeSize = byteBuf.readShort();
                int typeModifier = byteBuf.readInt();
                short formatCode = byteBuf.readShort();

                fieldDescriptions.add(
                        RowDescription.FieldDescription
                                .builder()
                                .fieldName(fieldName)
                                .tableOid(tableOid)
                                .columnAttributeNumber(columnAttributeNumber)
                                .fieldDataTypeOid(fieldDataTypeOid)
                                .fieldDataTypeSize(fieldDataTypeSize)
                                .typeModifier(typeModifier)
                                .formatCode(formatCode)
                                .build()
                );
            }

            return RowDescription
                    .builder()
                    .fieldDescriptions(fieldDescriptions)
                    .build();
        } catch (IndexOutOfBoundsException e) {
            throw new MessageDecodingException("Error decoding RowDescription. ", e);
        }
    }

    public static DataRow decodeDataRowMessage(PgMessageInfo messageInfo) {
        ByteBuf byteBuf = payloadOf(messageInfo, PostgresProtocolGeneralConstants.DATA_ROW_START_CHAR);

        try {
            int numberOfColumns = byteBuf.readUnsignedShort();
            List<byte[]> columns = new ArrayList<>(numberOfColumns);

            for (int i = 0; i < numberOfColumns; i++) {
                int columnLength = byteBuf.readInt();
                if (columnLength == PostgresProtocolGeneralConstants.NULL_VALUE_LENGTH) {
                    columns.add(null);
                } else if (columnLength < 0 || columnLength > byteBuf.readableBytes()) {
                    throw new MessageDecodingException("DataRow column " + i + " advertises length " + columnLength + " but only " + byteBuf.readableBytes() + " bytes remain.");
                } else {
                    columns.add(DecoderUtils.readBytes(byteBuf, columnLength));
                }
            }

            return new DataRow(columns);
        } catch (IndexOutOfBoundsException e) {
            throw new MessageDecodingException("Error decoding DataRow. ", e);
        }
    }

    public static CommandComplete decodeCommandCompleteMessage(PgMessageInfo messageInfo) {
        ByteBuf byteBuf = payloadOf(messageInfo, PostgresProtocolGeneralConstants.COMMAND_COMPLETE_START_CHAR);

        return CommandComplete
                .builder()
                .commandTag(DecoderUtils.readNextNullTerminatedString(byteBuf))
                .build();
    }

    public static ErrorResponse decodeErrorResponse(PgMessageInfo messageInfo) {
        return decodeErrorOrNoticeFields(payloadOf(messageInfo, PostgresProtocolGeneralConstants.ERROR_MESSAGE_START_CHAR));
    }

    public static ErrorResponse decodeNoticeResponse(PgMessageInfo messageInfo) {
        return decodeErrorOrNoticeFields(payloadOf(messageInfo, PostgresProtocolGeneralConstants.NOTICE_RESPONSE_START_CHAR));
    }

    public static ParameterStatus decodeParameterStatus(PgMessageInfo messageInfo) {
        ByteBuf byteBuf = payloadOf(messageInfo, PostgresProtocolGeneralConstants.PARAMETER_STATUS_MESSAGE_START_CHAR);

        return ParameterStatus
                .builder()
                .name(DecoderUtils.readNextNullTerminatedString(byteBuf))
                .value(DecoderUtils.readNextNullTerminatedString(byteBuf))
                .build();
    }

    public static BackendKeyData decodeBackendKeyData(PgMessageInfo messageInfo) {
        ByteBuf byteBuf = payloadOf(messageInfo, PostgresProtocolGeneralConstants.BACKEND_KEY_DATA_START_CHAR);

        try {
            return BackendKeyData
                    .builder()
                    .processId(byteBuf.readInt())
                    .secretKey(byteBuf.readInt())
                    .build();
        } catch (IndexOutOfBoundsException e) {
            throw new MessageDecodingException("Error decoding BackendKeyData. ", e);
        }
    }

    public static TransactionStatus decodeReadyForQuery(PgMessageInfo messageInfo) {
        ByteBuf byteBuf = payloadOf(messageInfo, PostgresProtocolGeneralConstants.READY_FOR_QUERY_MESSAGE_START_CHAR);

        if (!byteBuf.isReadable()) {
            throw new MessageDecodingException("ReadyForQuery without transaction status.");
        }

        return TransactionStatus.fromIndicator(byteBuf.readByte());
    }

    public static ParameterDescription decodeParameterDescription(PgMessageInfo messageInfo) {
        ByteBuf byteBuf = payloadOf(messageInfo, PostgresProtocolGeneralConstants.PARAMETER_DESCRIPTION_START_CHAR);

        try {
            int count = byteBuf.readUnsignedShort();
            List<Integer> oids = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                oids.add(byteBuf.readInt());
            }

            return ParameterDescription
                    .builder()
                    .parameterTypeOids(oids)
                    .build();
        } catch (IndexOutOfBoundsException e) {
            throw new MessageDecodingException("Error decoding ParameterDescription. ", e);
        }
    }

    public static CopyInResponse decodeCopyResponse(PgMessageInfo messageInfo) {
        byte startByte = messageInfo.getStartByte();
        if (startByte != PostgresProtocolGeneralConstants.COPY_IN_RESPONSE_START_CHAR
                && startByte != PostgresProtocolGeneralConstants.COPY_OUT_RESPONSE_START_CHAR
                && startByte != PostgresProtocolGeneralConstants.COPY_BOTH_RESPONSE_START_CHAR) {
            throw new MessageDecodingException("Received message with wrong start char.");
        }

        ByteBuf byteBuf = messageInfo.getPayload().duplicate();

        try {
            byte overallFormat = byteBuf.readByte();
            int count = byteBuf.readUnsignedShort();
            List<Short> formats = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                formats.add(byteBuf.readShort());
            }

            return CopyInResponse
                    .builder()
                    .overallFormat(overallFormat)
                    .columnFormatCodes(formats)
                    .build();
        } catch (IndexOutOfBoundsException e) {
            throw new MessageDecodingException("Error decoding copy response. ", e);
        }
    }

    public static NotificationResponse decodeNotificationResponse(PgMessageInfo messageInfo) {
        ByteBuf byteBuf = payloadOf(messageInfo, PostgresProtocolGeneralConstants.NOTIFICATION_RESPONSE_START_CHAR);

        try {
            return NotificationResponse
                    .builder()
                    .processId(byteBuf.readInt())
                    .channel(DecoderUtils.readNextNullTerminatedString(byteBuf))
                    .payload(DecoderUtils.readNextNullTerminatedString(byteBuf))
                    .build();
        } catch (IndexOutOfBoundsException e) {
            throw new MessageDecodingException("Error decoding NotificationResponse. ", e);
        }
    }

    private static ErrorResponse decodeErrorOrNoticeFields(ByteBuf byteBuf) {
        ErrorResponse ret = new ErrorResponse();

        while (byteBuf.isReadable()) {
            byte fieldType = byteBuf.readByte();

            if (fieldType == PostgresProtocolGeneralConstants.DELIMITER_BYTE) {
                return ret;
            }

            String value = DecoderUtils.readNextNullTerminatedString(byteBuf);

            switch (fieldType) {
                case PostgresProtocolErrorAndNoticeConstant.SEVERITY_LOCALIZED_MARKER -> ret.setSeverity(value);
                case PostgresProtocolErrorAndNoticeConstant.SEVERITY_NOT_LOCALIZED_MARKER -> ret.setSeverityNotLocalized(value);
                case PostgresProtocolErrorAndNoticeConstant.SQLSTATE_CODE_MARKER -> ret.setCode(value);
                case PostgresProtocolErrorAndNoticeConstant.MESSAGE_MARKER -> ret.setMessage(value);
                case PostgresProtocolErrorAndNoticeConstant.DETAIL_MARKER -> ret.setDetail(value);
                case PostgresProtocolErrorAndNoticeConstant.HINT_MARKER -> ret.setHint(value);
                case PostgresProtocolErrorAndNoticeConstant.POSITION_MARKER -> ret.setPosition(toInteger(value));
                case PostgresProtocolErrorAndNoticeConstant.INTERNAL_POSITION_MARKER -> ret.setInternalPosition(toInteger(value));
                case PostgresProtocolErrorAndNoticeConstant.INTERNAL_QUERY_MARKER -> ret.setInternalQuery(value);
                case PostgresProtocolErrorAndNoticeConstant.WHERE_MARKER -> ret.setWhere(value);
                case PostgresProtocolErrorAndNoticeConstant.SCHEMA_NAME_MARKER -> ret.setSchemaName(value);
                case PostgresProtocolErrorAndNoticeConstant.TABLE_NAME_MARKER -> ret.setTableName(value);
                case PostgresProtocolErrorAndNoticeConstant.COLUMN_NAME_MARKER -> ret.setColumnName(value);
                case PostgresProtocolErrorAndNoticeConstant.DATA_TYPE_NAME_MARKER -> ret.setDataTypeName(value);
                case PostgresProtocolErrorAndNoticeConstant.CONSTRAINT_NAME_MARKER -> ret.setConstraintName(value);
                case PostgresProtocolErrorAndNoticeConstant.FILE_MARKER -> ret.setFile(value);
                case PostgresProtocolErrorAndNoticeConstant.LINE_MARKER -> ret.setLine(toInteger(value));
                case PostgresProtocolErrorAndNoticeConstant.ROUTINE_MARKER -> ret.setRoutine(value);
                default -> {
                    // unknown fields must be ignored, new ones may be added in future versions
                }
            }
        }

        return ret;
    }

    private static Integer toInteger(String value) {
        return NumberUtils.isDigits(value) ? Integer.valueOf(value) : null;
    }

    private static ByteBuf payloadOf(PgMessageInfo messageInfo, byte expectedStartByte) {
        if (messageInfo.getStartByte() != expectedStartByte) {
            throw new MessageDecodingException("Received message with wrong start char. Expected '" + (char) expectedStartByte + "' but got '" + (char) messageInfo.getStartByte() + "'.");
        }

        return messageInfo.getPayload().duplicate();
    }

    private ServerPostgresProtocolMessageDecoder() {
    }
}

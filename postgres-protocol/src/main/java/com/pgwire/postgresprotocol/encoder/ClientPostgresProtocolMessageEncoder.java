package com.pgwire.postgresprotocol.encoder;

import com.pgwire.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import com.pgwire.postgresprotocol.model.protocol.BindParameter;
import com.pgwire.postgresprotocol.model.protocol.SaslInitialResponse;
import com.pgwire.postgresprotocol.model.protocol.SaslResponse;
import com.pgwire.postgresprotocol.model.protocol.StartupMessage;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Encodes frontend messages. Every method returns one complete message (start byte, length, body)
 * ready to be written to the channel.
 */
public class ClientPostgresProtocolMessageEncoder {

    public static ByteBuf encodeMessage(byte startByte, ByteBuf payload, ByteBufAllocator allocator) {
        int payloadLength = payload.readableBytes();

        ByteBuf buf = allocator.buffer(PostgresProtocolGeneralConstants.MESSAGE_MARKER_AND_LENGTH_BYTES_COUNT + payloadLength);

        buf.writeByte(startByte);
        buf.writeInt(PostgresProtocolGeneralConstants.MESSAGE_LENGTH_BYTES_COUNT + payloadLength);
        buf.writeBytes(payload, payload.readerIndex(), payloadLength);

        return buf;
    }

    public static ByteBuf encodeSimpleQueryMessage(String sqlStatement, ByteBufAllocator allocator) {
        byte[] sqlStatementBytes = sqlStatement.getBytes(StandardCharsets.UTF_8);

        // 4 bytes length + 1 delimiter byte
        int length = 5 + sqlStatementBytes.length;

        ByteBuf buf = allocator.buffer(length + 1);

        buf.writeByte(PostgresProtocolGeneralConstants.QUERY_MESSAGE_START_BYTE);
        buf.writeInt(length);

        buf.writeBytes(sqlStatementBytes);
        buf.writeByte(PostgresProtocolGeneralConstants.DELIMITER_BYTE);

        return buf;
    }

    public static ByteBuf encodeParseMessage(String statementName, String sqlStatement, List<Integer> parameterTypeOids, ByteBufAllocator allocator) {
        byte[] nameBytes = statementName.getBytes(StandardCharsets.UTF_8);
        byte[] sqlBytes = sqlStatement.getBytes(StandardCharsets.UTF_8);

        // length (int32) + 2 delimiters + number of parameter types (int16) + oids
        int length = 4 + nameBytes.length + 1 + sqlBytes.length + 1 + 2 + 4 * parameterTypeOids.size();

        ByteBuf buf = allocator.buffer(length + 1);

        buf.writeByte(PostgresProtocolGeneralConstants.PARSE_MESSAGE_START_BYTE);
        buf.writeInt(length);
        buf.writeBytes(nameBytes);
        buf.writeByte(PostgresProtocolGeneralConstants.DELIMITER_BYTE);
        buf.writeBytes(sqlBytes);
        buf.writeByte(PostgresProtocolGeneralConstants.DELIMITER_BYTE);
        buf.writeShort(parameterTypeOids.size());
        for (Integer oid : parameterTypeOids) {
            buf.writeInt(oid == null ? 0 : oid);
        }

        return buf;
    }

    public static ByteBuf encodeDescribeMessage(byte target, String name, ByteBufAllocator allocator) {
        return encodeTargetedMessage(PostgresProtocolGeneralConstants.DESCRIBE_MESSAGE_START_BYTE, target, name, allocator);
    }

    public static ByteBuf encodeCloseMessage(byte target, String name, ByteBufAllocator allocator) {
        return encodeTargetedMessage(PostgresProtocolGeneralConstants.CLOSE_MESSAGE_START_BYTE, target, name, allocator);
    }

    public static ByteBuf encodeBindMessage(String portalName,
                                            String statementName,
                                            List<BindParameter> parameters,
                                            List<Short> resultFormatCodes,
                                            ByteBufAllocator allocator) {
        byte[] portalBytes = portalName.getBytes(StandardCharsets.UTF_8);
        byte[] statementBytes = statementName.getBytes(StandardCharsets.UTF_8);

        // length (int32) + 2 delimiters + format codes count (int16) + parameters count (int16) + result formats count (int16)
        int length = 4 + portalBytes.length + 1 + statementBytes.length + 1 + 2 + 2 + 2;
        length += 2 * parameters.size();
        for (BindParameter parameter : parameters) {
            length += 4;
            if (parameter.getValue() != null) {
                length += parameter.getValue().length;
            }
        }
        length += 2 * resultFormatCodes.size();

        ByteBuf buf = allocator.buffer(length + 1);

        buf.writeByte(PostgresProtocolGeneralConstants.BIND_MESSAGE_START_BYTE);
        buf.writeInt(length);
        buf.writeBytes(portalBytes);
        buf.writeByte(PostgresProtocolGeneralConstants.DELIMITER_BYTE);
        buf.writeBytes(statementBytes);
        buf.writeByte(PostgresProtocolGeneralConstants.DELIMITER_BYTE);

        buf.writeShort(parameters.size());
        for (BindParameter parameter : parameters) {
            buf.writeShort(parameter.getFormatCode());
        }

        buf.writeShort(parameters.size());
        for (BindParameter parameter : parameters) {
            if (parameter.getValue() == null) {
                buf.writeInt(PostgresProtocolGeneralConstants.NULL_VALUE_LENGTH);
            } else {
                buf.writeInt(parameter.getValue().length);
                buf.writeBytes(parameter.getValue());
            }
        }

        buf.writeShort(resultFormatCodes.size());
        for (Short formatCode : resultFormatCodes) {
            buf.writeShort(formatCode);
        }

        return buf;
    }

    public static ByteBuf encodeExecuteMessage(String portalName, int maxRows, ByteBufAllocator allocator) {
        byte[] portalBytes = portalName.getBytes(StandardCharsets.UTF_8);

        // length (int32) + delimiter + max rows (int32)
        int length = 4 + portalBytes.length + 1 + 4;

        ByteBuf buf = allocator.buffer(length + 1);

        buf.writeByte(PostgresProtocolGeneralConstants.EXECUTE_MESSAGE_START_BYTE);
        buf.writeInt(length);
        buf.writeBytes(portalBytes);
        buf.writeByte(PostgresProtocolGeneralConstants.DELIMITER_BYTE);
        buf.writeInt(maxRows);

        return buf;
    }

    public static ByteBuf encodeSyncMessage(ByteBufAllocator allocator) {
        return encodeEmptyMessage(PostgresProtocolGeneralConstants.SYNC_MESSAGE_START_BYTE, allocator);
    }

    public static ByteBuf encodeFlushMessage(ByteBufAllocator allocator) {
        return encodeEmptyMessage(PostgresProtocolGeneralConstants.FLUSH_MESSAGE_START_BYTE, allocator);
    }

    public static ByteBuf encodeClientTerminateMessage(ByteBufAllocator allocator) {
        return encodeEmptyMessage(PostgresProtocolGeneralConstants.CLIENT_TERMINATION_MESSAGE_START_CHAR, allocator);
    }

    public static ByteBuf encodeCopyDoneMessage(ByteBufAllocator allocator) {
        return encodeEmptyMessage(PostgresProtocolGeneralConstants.COPY_DONE_START_CHAR, allocator);
    }

    public static ByteBuf encodeCopyDataMessage(ByteBuf data, ByteBufAllocator allocator) {
        return encodeMessage(PostgresProtocolGeneralConstants.COPY_DATA_START_CHAR, data, allocator);
    }

    public static ByteBuf encodeCopyFailMessage(String reason, ByteBufAllocator allocator) {
        return encodeStringMessage(PostgresProtocolGeneralConstants.COPY_FAIL_START_CHAR, reason, allocator);
    }

    public static ByteBuf encodePasswordMessage(String password, ByteBufAllocator allocator) {
        return encodeStringMessage(PostgresProtocolGeneralConstants.CLIENT_PASSWORD_RESPONSE_START_CHAR, password, allocator);
    }

    public static ByteBuf encodeClientStartupMessage(StartupMessage startupMessage, ByteBufAllocator allocator) {
        //4 bytes length + 4 bytes version + 1 byte final delimiter
        int length = 9;

        for (var e : startupMessage.getParameters().entrySet()) {
            length += e.getKey().getBytes(StandardCharsets.UTF_8).length;
            length += e.getValue().getBytes(StandardCharsets.UTF_8).length;
            //delimiter
            length += 2;
        }

        ByteBuf buf = allocator.buffer(length);

        buf.writeInt(length);
        buf.writeShort(startupMessage.getMajorVersion());
        buf.writeShort(startupMessage.getMinorVersion());

        for (var e : startupMessage.getParameters().entrySet()) {
            buf.writeBytes(e.getKey().getBytes(StandardCharsets.UTF_8));
            buf.writeByte(PostgresProtocolGeneralConstants.DELIMITER_BYTE);
            buf.writeBytes(e.getValue().getBytes(StandardCharsets.UTF_8));
            buf.writeByte(PostgresProtocolGeneralConstants.DELIMITER_BYTE);
        }

        buf.writeByte(PostgresProtocolGeneralConstants.DELIMITER_BYTE);

        return buf;
    }

    public static ByteBuf encodeSslRequestMessage(ByteBufAllocator allocator) {
        ByteBuf buf = allocator.buffer(PostgresProtocolGeneralConstants.SSL_REQUEST_MESSAGE_LENGTH);

        buf.writeInt(PostgresProtocolGeneralConstants.SSL_REQUEST_MESSAGE_LENGTH);
        buf.writeInt(PostgresProtocolGeneralConstants.SSL_REQUEST_CODE);

        return buf;
    }

    public static ByteBuf encodeCancelRequestMessage(int processId, int secretKey, ByteBufAllocator allocator) {
        ByteBuf buf = allocator.buffer(PostgresProtocolGeneralConstants.CANCEL_REQUEST_MESSAGE_LENGTH);

        buf.writeInt(PostgresProtocolGeneralConstants.CANCEL_REQUEST_MESSAGE_LENGTH);
        buf.writeInt(PostgresProtocolGeneralConstants.CANCEL_REQUEST_CODE);
        buf.writeInt(processId);
        buf.writeInt(secretKey);

        return buf;
    }

    public static ByteBuf encodeSaslInitialResponseMessage(SaslInitialResponse saslInitialResponse, ByteBufAllocator allocator) {
        byte[] mechanismNameBytes = saslInitialResponse.getMechanism().getBytes(StandardCharsets.UTF_8);
        byte[] saslSpecificData = saslInitialResponse.getClientFirstMessage().getBytes(StandardCharsets.UTF_8);

        //length (int32) + 1 delimiter byte + length of sasl data (int32)
        int length = 9 + mechanismNameBytes.length + saslSpecificData.length;

        ByteBuf buf = allocator.buffer(length + 1);

        buf.writeByte(PostgresProtocolGeneralConstants.CLIENT_PASSWORD_RESPONSE_START_CHAR);
        buf.writeInt(length);
        buf.writeBytes(mechanismNameBytes);
        buf.writeByte(PostgresProtocolGeneralConstants.DELIMITER_BYTE);
        buf.writeInt(saslSpecificData.length);
        buf.writeBytes(saslSpecificData);

        return buf;
    }

    public static ByteBuf encodeSaslResponseMessage(SaslResponse saslResponse, ByteBufAllocator allocator) {
        byte[] saslSpecificData = saslResponse.getClientFinalMessage().getBytes(StandardCharsets.UTF_8);

        //length (int32)
        int length = 4 + saslSpecificData.length;

        ByteBuf buf = allocator.buffer(length + 1);

        buf.writeByte(PostgresProtocolGeneralConstants.CLIENT_PASSWORD_RESPONSE_START_CHAR);
        buf.writeInt(length);
        buf.writeBytes(saslSpecificData);

        return buf;
    }

    private static ByteBuf encodeEmptyMessage(byte startByte, ByteBufAllocator allocator) {
        ByteBuf buf = allocator.buffer(PostgresProtocolGeneralConstants.MESSAGE_MARKER_AND_LENGTH_BYTES_COUNT);

        buf.writeByte(startByte);
        buf.writeInt(PostgresProtocolGeneralConstants.MESSAGE_LENGTH_BYTES_COUNT);

        return buf;
    }

    private static ByteBuf encodeStringMessage(byte startByte, String value, ByteBufAllocator allocator) {
        byte[] valueBytes = value.getBytes(StandardCharsets.UTF_8);

        // 4 bytes length + 1 delimiter byte
        int length = 5 + valueBytes.length;

        ByteBuf buf = allocator.buffer(length + 1);

        buf.writeByte(startByte);
        buf.writeInt(length);
        buf.writeBytes(valueBytes);
        buf.writeByte(PostgresProtocolGeneralConstants.DELIMITER_BYTE);

        return buf;
    }

    private static ByteBuf encodeTargetedMessage(byte startByte, byte target, String name, ByteBufAllocator allocator) {
        byte[] nameBytes = name.getBytes(StandardCharsets.UTF_8);

        // length (int32) + target byte + delimiter
        int length = 4 + 1 + nameBytes.length + 1;

        ByteBuf buf = allocator.buffer(length + 1);

        buf.writeByte(startByte);
        buf.writeInt(length);
        buf.writeByte(target);
        buf.writeBytes(nameBytes);
        buf.writeByte(PostgresProtocolGeneralConstants.DELIMITER_BYTE);

        return buf;
    }

    private ClientPostgresProtocolMessageEncoder() {
    }
}

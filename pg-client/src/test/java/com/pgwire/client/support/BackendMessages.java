package com.pgwire.client.support;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

/**
 * Builds framed backend messages for scripted conversations.
 */
public class BackendMessages {

    public static ByteBuf message(char startByte, Consumer<ByteBuf> body) {
        ByteBuf payload = Unpooled.buffer();
        body.accept(payload);
        ByteBuf framed = Unpooled.buffer(5 + payload.readableBytes());
        framed.writeByte(startByte);
        framed.writeInt(4 + payload.readableBytes());
        framed.writeBytes(payload);
        payload.release();
        return framed;
    }

    public static ByteBuf authOk() {
        return message('R', buf -> buf.writeInt(0));
    }

    public static ByteBuf authCleartext() {
        return message('R', buf -> buf.writeInt(3));
    }

    public static ByteBuf authMd5(byte[] salt) {
        return message('R', buf -> buf.writeInt(5).writeBytes(salt));
    }

    public static ByteBuf authSasl(String... mechanisms) {
        return message('R', buf -> {
            buf.writeInt(10);
            for (String mechanism : mechanisms) {
                writeCString(buf, mechanism);
            }
            buf.writeByte(0);
        });
    }

    public static ByteBuf authRequest(int method) {
        return message('R', buf -> buf.writeInt(method));
    }

    public static ByteBuf backendKeyData(int processId, int secretKey) {
        return message('K', buf -> buf.writeInt(processId).writeInt(secretKey));
    }

    public static ByteBuf parameterStatus(String name, String value) {
        return message('S', buf -> {
            writeCString(buf, name);
            writeCString(buf, value);
        });
    }

    public static ByteBuf readyForQuery(char status) {
        return message('Z', buf -> buf.writeByte(status));
    }

    public static ByteBuf rowDescription(Column... columns) {
        return message('T', buf -> {
            buf.writeShort(columns.length);
            for (Column column : columns) {
                writeCString(buf, column.name);
                // table oid, attribute number
                buf.writeInt(0).writeShort(0);
                buf.writeInt(column.typeOid);
                // type size, modifier
                buf.writeShort(-1).writeInt(-1);
                buf.writeShort(column.formatCode);
            }
        });
    }

    public static ByteBuf dataRow(byte[]... values) {
        return message('D', buf -> {
            buf.writeShort(values.length);
            for (byte[] value : values) {
                if (value == null) {
                    buf.writeInt(-1);
                } else {
                    buf.writeInt(value.length).writeBytes(value);
                }
            }
        });
    }

    public static ByteBuf commandComplete(String tag) {
        return message('C', buf -> writeCString(buf, tag));
    }

    public static ByteBuf emptyQueryResponse() {
        return message('I', buf -> {
        });
    }

    public static ByteBuf error(String severity, String sqlState, String text) {
        return message('E', buf -> writeFields(buf, severity, sqlState, text));
    }

    public static ByteBuf notice(String text) {
        return message('N', buf -> writeFields(buf, "NOTICE", "00000", text));
    }

    public static ByteBuf notification(int processId, String channel, String payload) {
        return message('A', buf -> {
            buf.writeInt(processId);
            writeCString(buf, channel);
            writeCString(buf, payload);
        });
    }

    public static ByteBuf parseComplete() {
        return message('1', buf -> {
        });
    }

    public static ByteBuf bindComplete() {
        return message('2', buf -> {
        });
    }

    public static ByteBuf closeComplete() {
        return message('3', buf -> {
        });
    }

    public static ByteBuf noData() {
        return message('n', buf -> {
        });
    }

    public static ByteBuf parameterDescription(int... typeOids) {
        return message('t', buf -> {
            buf.writeShort(typeOids.length);
            for (int oid : typeOids) {
                buf.writeInt(oid);
            }
        });
    }

    public static ByteBuf copyInResponse(int format, int columnCount) {
        return message('G', buf -> {
            buf.writeByte(format);
            buf.writeShort(columnCount);
            for (int i = 0; i < columnCount; i++) {
                buf.writeShort(format);
            }
        });
    }

    public static byte[] text(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    public static byte[] int4(int value) {
        return new byte[]{(byte) (value >>> 24), (byte) (value >>> 16), (byte) (value >>> 8), (byte) value};
    }

    public static Column column(String name, int typeOid) {
        return new Column(name, typeOid, 0);
    }

    public static Column binaryColumn(String name, int typeOid) {
        return new Column(name, typeOid, 1);
    }

    private static void writeFields(ByteBuf buf, String severity, String sqlState, String text) {
        writeCString(buf, "S" + severity);
        writeCString(buf, "V" + severity);
        writeCString(buf, "C" + sqlState);
        writeCString(buf, "M" + text);
        buf.writeByte(0);
    }

    private static void writeCString(ByteBuf buf, String value) {
        buf.writeBytes(value.getBytes(StandardCharsets.UTF_8));
        buf.writeByte(0);
    }

    public static final class Column {
        private final String name;
        private final int typeOid;
        private final int formatCode;

        private Column(String name, int typeOid, int formatCode) {
            this.name = name;
            this.typeOid = typeOid;
            this.formatCode = formatCode;
        }
    }

    private BackendMessages() {
    }
}

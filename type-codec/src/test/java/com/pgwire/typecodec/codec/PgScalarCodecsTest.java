package com.pgwire.typecodec.codec;

import com.pgwire.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import com.pgwire.postgresprotocol.exception.MessageDecodingException;
import com.pgwire.typecodec.constant.PgTypeOids;
import com.pgwire.typecodec.model.PgPoint;
import com.pgwire.typecodec.reader.ReadTable;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PgScalarCodecsTest {

    private final ReadTable readTable = ReadTable.defaultTable();

    private Object binary(int oid, ByteBuf value) {
        return readTable.decode(oid, PostgresProtocolGeneralConstants.BINARY_FORMAT_CODE, ByteBufUtil.getBytes(value));
    }

    private Object text(int oid, String value) {
        return readTable.decode(oid, PostgresProtocolGeneralConstants.TEXT_FORMAT_CODE, value.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void decodesIntegersBigEndian() {
        assertThat(binary(PgTypeOids.INT2, Unpooled.buffer().writeShort(-2))).isEqualTo((short) -2);
        assertThat(binary(PgTypeOids.INT4, Unpooled.wrappedBuffer(new byte[]{0, 0, 1, 0}))).isEqualTo(256);
        assertThat(binary(PgTypeOids.INT8, Unpooled.buffer().writeLong(Long.MIN_VALUE))).isEqualTo(Long.MIN_VALUE);
    }

    @Test
    void decodesOidAsUnsigned() {
        assertThat(binary(PgTypeOids.OID, Unpooled.buffer().writeInt(-1))).isEqualTo(4294967295L);
        assertThat(text(PgTypeOids.OID, "4294967295")).isEqualTo(4294967295L);
    }

    @Test
    void decodesFloatsAndBool() {
        assertThat(binary(PgTypeOids.FLOAT4, Unpooled.buffer().writeFloat(1.5f))).isEqualTo(1.5f);
        assertThat(binary(PgTypeOids.FLOAT8, Unpooled.buffer().writeDouble(-0.25))).isEqualTo(-0.25);
        assertThat(binary(PgTypeOids.BOOL, Unpooled.wrappedBuffer(new byte[]{1}))).isEqualTo(true);
        assertThat(binary(PgTypeOids.BOOL, Unpooled.wrappedBuffer(new byte[]{0}))).isEqualTo(false);
    }

    @Test
    void rejectsFixedWidthValueOfWrongLength() {
        assertThatThrownBy(() -> binary(PgTypeOids.INT4, Unpooled.wrappedBuffer(new byte[]{1, 2})))
                .isInstanceOf(MessageDecodingException.class);
    }

    @Test
    void textTypesRequireValidUtf8() {
        assertThat(binary(PgTypeOids.VARCHAR, Unpooled.copiedBuffer("naïve", StandardCharsets.UTF_8))).isEqualTo("naïve");
        assertThatThrownBy(() -> binary(PgTypeOids.TEXT, Unpooled.wrappedBuffer(new byte[]{(byte) 0xFF, 'a'})))
                .isInstanceOf(MessageDecodingException.class);
    }

    @Test
    void jsonbSkipsVersionByte() {
        ByteBuf value = Unpooled.buffer().writeByte(1).writeBytes("{\"a\": 1}".getBytes(StandardCharsets.UTF_8));
        assertThat(binary(PgTypeOids.JSONB, value)).isEqualTo("{\"a\": 1}");

        assertThatThrownBy(() -> binary(PgTypeOids.JSONB, Unpooled.wrappedBuffer(new byte[]{2, '1'})))
                .isInstanceOf(MessageDecodingException.class);
    }

    @Test
    void decodesUuidAndPoint() {
        UUID uuid = UUID.fromString("a0eebc99-9c0b-4ef8-bb6d-6bb9bd380a11");
        ByteBuf uuidBytes = Unpooled.buffer().writeLong(uuid.getMostSignificantBits()).writeLong(uuid.getLeastSignificantBits());
        assertThat(binary(PgTypeOids.UUID, uuidBytes)).isEqualTo(uuid);

        assertThat(binary(PgTypeOids.POINT, Unpooled.buffer().writeDouble(1.5).writeDouble(-2)))
                .isEqualTo(new PgPoint(1.5, -2));
        assertThat(text(PgTypeOids.POINT, "(1.5,-2)")).isEqualTo(new PgPoint(1.5, -2));
    }

    @Test
    void byteaIsReturnedUnchanged() {
        byte[] raw = {0, (byte) 0xDE, (byte) 0xAD, 0};
        assertThat((byte[]) binary(PgTypeOids.BYTEA, Unpooled.wrappedBuffer(raw))).isEqualTo(raw);
    }

    @Test
    void parsesByteaHexAndEscapeFormats() {
        assertThat((byte[]) text(PgTypeOids.BYTEA, "\\x00dead")).isEqualTo(new byte[]{0, (byte) 0xDE, (byte) 0xAD});
        assertThat((byte[]) text(PgTypeOids.BYTEA, "a\\000\\\\b")).isEqualTo(new byte[]{'a', 0, '\\', 'b'});
        assertThatThrownBy(() -> text(PgTypeOids.BYTEA, "\\x0"))
                .isInstanceOf(MessageDecodingException.class);
    }

    @Test
    void parsesTextScalars() {
        assertThat(text(PgTypeOids.BOOL, "t")).isEqualTo(true);
        assertThat(text(PgTypeOids.BOOL, "f")).isEqualTo(false);
        assertThat(text(PgTypeOids.BOOL, "true")).isEqualTo(true);
        assertThat(text(PgTypeOids.BOOL, "false")).isEqualTo(false);
        assertThatThrownBy(() -> text(PgTypeOids.BOOL, "yes")).isInstanceOf(MessageDecodingException.class);
        assertThat(text(PgTypeOids.INT2, "-7")).isEqualTo((short) -7);
        assertThat(text(PgTypeOids.INT8, "9000000000")).isEqualTo(9000000000L);
        assertThat(text(PgTypeOids.FLOAT8, "Infinity")).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(text(PgTypeOids.TEXT, "plain")).isEqualTo("plain");
        assertThatThrownBy(() -> text(PgTypeOids.INT4, "12x")).isInstanceOf(MessageDecodingException.class);
    }
}

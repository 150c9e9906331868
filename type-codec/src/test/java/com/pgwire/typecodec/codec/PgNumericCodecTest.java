package com.pgwire.typecodec.codec;

import com.pgwire.postgresprotocol.exception.MessageDecodingException;
import com.pgwire.typecodec.reader.ReadTable;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PgNumericCodecTest {

    private static ByteBuf numeric(int weight, int sign, int displayScale, int... digits) {
        ByteBuf buf = Unpooled.buffer();
        buf.writeShort(digits.length);
        buf.writeShort(weight);
        buf.writeShort(sign);
        buf.writeShort(displayScale);
        for (int digit : digits) {
            buf.writeShort(digit);
        }
        return buf;
    }

    private static Object decode(ByteBuf buf) {
        return PgNumericCodec.decode(buf, ReadTable.defaultTable());
    }

    @Test
    void decodesBase10000Digits() {
        // 12345.678
        assertThat(decode(numeric(1, PgNumericCodec.SIGN_POSITIVE, 3, 1, 2345, 6780)))
                .isEqualTo(new BigDecimal("12345.678"));
        assertThat(decode(numeric(-1, PgNumericCodec.SIGN_NEGATIVE, 4, 1)))
                .isEqualTo(new BigDecimal("-0.0001"));
        assertThat(decode(numeric(2, PgNumericCodec.SIGN_POSITIVE, 0, 1)))
                .isEqualTo(new BigDecimal("100000000"));
    }

    @Test
    void keepsDisplayScaleOfZero() {
        assertThat(decode(numeric(0, PgNumericCodec.SIGN_POSITIVE, 2))).isEqualTo(new BigDecimal("0.00"));
    }

    @Test
    void specialValuesBecomeDoubles() {
        assertThat(decode(numeric(0, PgNumericCodec.SIGN_NAN, 0))).isEqualTo(Double.NaN);
        assertThat(decode(numeric(0, PgNumericCodec.SIGN_POSITIVE_INFINITY, 0))).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(decode(numeric(0, PgNumericCodec.SIGN_NEGATIVE_INFINITY, 0))).isEqualTo(Double.NEGATIVE_INFINITY);
    }

    @Test
    void rejectsDigitCountNotMatchingLength() {
        ByteBuf buf = numeric(0, PgNumericCodec.SIGN_POSITIVE, 0, 1);
        buf.setShort(0, 3);

        assertThatThrownBy(() -> decode(buf)).isInstanceOf(MessageDecodingException.class);
    }

    @Test
    void encodesGroupsAndStripsTrailingZeroGroups() {
        ByteBuf out = Unpooled.buffer();
        PgNumericCodec.encode(new BigDecimal("12345.678"), out);

        assertThat(out.readShort()).isEqualTo((short) 3);
        assertThat(out.readShort()).isEqualTo((short) 1);
        assertThat(out.readUnsignedShort()).isEqualTo(PgNumericCodec.SIGN_POSITIVE);
        assertThat(out.readShort()).isEqualTo((short) 3);
        assertThat(out.readShort()).isEqualTo((short) 1);
        assertThat(out.readShort()).isEqualTo((short) 2345);
        assertThat(out.readShort()).isEqualTo((short) 6780);

        ByteBuf large = Unpooled.buffer();
        PgNumericCodec.encode(new BigInteger("100000000"), large);
        assertThat(large.readShort()).isEqualTo((short) 1);
        assertThat(large.readShort()).isEqualTo((short) 2);
    }

    @Test
    void encodedValuesDecodeToSameNumber() {
        for (String literal : new String[]{"0", "-1.5", "0.000012", "98765432109876543210.0123456789"}) {
            ByteBuf out = Unpooled.buffer();
            PgNumericCodec.encode(new BigDecimal(literal), out);
            assertThat(decode(out)).isEqualTo(new BigDecimal(literal));
        }
    }

    @Test
    void nonFiniteDoublesEncodeAsSpecialValues() {
        ByteBuf out = Unpooled.buffer();
        PgNumericCodec.encode((Object) Double.NEGATIVE_INFINITY, out);

        assertThat(decode(out)).isEqualTo(Double.NEGATIVE_INFINITY);
    }

    @Test
    void parsesTextForm() {
        assertThat(PgNumericCodec.parse("-3.140", ReadTable.defaultTable())).isEqualTo(new BigDecimal("-3.140"));
        assertThat(PgNumericCodec.parse("NaN", ReadTable.defaultTable())).isEqualTo(Double.NaN);
    }
}

package com.pgwire.typecodec.encoder;

import com.pgwire.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import com.pgwire.postgresprotocol.model.protocol.BindParameter;
import com.pgwire.typecodec.constant.PgTypeOids;
import com.pgwire.typecodec.model.PgNull;
import io.netty.buffer.ByteBufAllocator;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PgParameterEncoderTest {
    private static final ByteBufAllocator ALLOC = ByteBufAllocator.DEFAULT;

    @Test
    void nullsBecomeNullParameter() {
        assertThat(PgParameterEncoder.encode(PgTypeOids.INT4, null, ALLOC).getValue()).isNull();
        assertThat(PgParameterEncoder.encode(PgTypeOids.TEXT, PgNull.NULL, ALLOC).getValue()).isNull();
    }

    @Test
    void supportedValueIsSentInBinary() {
        BindParameter parameter = PgParameterEncoder.encode(PgTypeOids.INT4, 7, ALLOC);

        assertThat(parameter.getFormatCode()).isEqualTo(PostgresProtocolGeneralConstants.BINARY_FORMAT_CODE);
        assertThat(parameter.getValue()).isEqualTo(new byte[]{0, 0, 0, 7});
    }

    @Test
    void otherValuesFallBackToText() {
        BindParameter parameter = PgParameterEncoder.encode(PgTypeOids.INT4, "42", ALLOC);

        assertThat(parameter.getFormatCode()).isEqualTo(PostgresProtocolGeneralConstants.TEXT_FORMAT_CODE);
        assertThat(new String(parameter.getValue(), StandardCharsets.UTF_8)).isEqualTo("42");

        BindParameter unknownType = PgParameterEncoder.encode(0, 3.5, ALLOC);
        assertThat(unknownType.getFormatCode()).isEqualTo(PostgresProtocolGeneralConstants.TEXT_FORMAT_CODE);
        assertThat(new String(unknownType.getValue(), StandardCharsets.UTF_8)).isEqualTo("3.5");
    }

    @Test
    void textFormOfScalars() {
        assertThat(PgParameterEncoder.toText(true)).isEqualTo("t");
        assertThat(PgParameterEncoder.toText(false)).isEqualTo("f");
        assertThat(PgParameterEncoder.toText(new byte[]{(byte) 0xDE, (byte) 0xAD})).isEqualTo("\\xdead");
        assertThat(PgParameterEncoder.toText(12L)).isEqualTo("12");
    }

    @Test
    void textFormOfArraysQuotesElements() {
        assertThat(PgParameterEncoder.toText(Arrays.asList("a", null, "say \"hi\""))).isEqualTo("{\"a\",NULL,\"say \\\"hi\\\"\"}");
        assertThat(PgParameterEncoder.toText(new String[]{"back\\slash"})).isEqualTo("{\"back\\\\slash\"}");
        assertThat(PgParameterEncoder.toText(List.of(List.of(1, 2), List.of(3, 4)))).isEqualTo("{{\"1\",\"2\"},{\"3\",\"4\"}}");
    }
}

package com.pgwire.typecodec.codec;

import com.pgwire.postgresprotocol.exception.MessageDecodingException;
import com.pgwire.typecodec.model.PgBitString;
import com.pgwire.typecodec.reader.ReadTable;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PgBitStringCodecTest {

    @Test
    void decodesBitSixteenWithExactLength() {
        ByteBuf value = Unpooled.buffer().writeInt(16).writeByte(0x00).writeByte(0x20);

        PgBitString bits = (PgBitString) PgBitStringCodec.decode(value, ReadTable.defaultTable());

        assertThat(bits.length()).isEqualTo(16);
        assertThat(bits).hasToString("0000000000100000");
    }

    @Test
    void dropsPadBitsOfLastByte() {
        // varbit '101' is sent as 1010 0000
        ByteBuf value = Unpooled.buffer().writeInt(3).writeByte(0xA0);

        assertThat(PgBitStringCodec.decode(value, ReadTable.defaultTable())).hasToString("101");
    }

    @Test
    void rejectsByteCountNotMatchingBitLength() {
        ByteBuf value = Unpooled.buffer().writeInt(9).writeByte(0xFF);

        assertThatThrownBy(() -> PgBitStringCodec.decode(value, ReadTable.defaultTable()))
                .isInstanceOf(MessageDecodingException.class);
    }

    @Test
    void encodesPackedWithZeroPadding() {
        ByteBuf out = Unpooled.buffer();
        PgBitStringCodec.encode(PgBitString.fromString("110000001"), out);

        assertThat(out.readInt()).isEqualTo(9);
        assertThat(out.readUnsignedByte()).isEqualTo((short) 0xC0);
        assertThat(out.readUnsignedByte()).isEqualTo((short) 0x80);
        assertThat(out.isReadable()).isFalse();
    }

    @Test
    void parsesTextForm() {
        assertThat(PgBitStringCodec.parse("0101", ReadTable.defaultTable())).isEqualTo(PgBitString.fromString("0101"));
        assertThatThrownBy(() -> PgBitString.fromString("012")).isInstanceOf(MessageDecodingException.class);
    }
}

package com.pgwire.typecodec.codec;

import com.pgwire.postgresprotocol.exception.MessageDecodingException;
import com.pgwire.postgresprotocol.utils.DecoderUtils;
import com.pgwire.typecodec.model.PgBitString;
import com.pgwire.typecodec.reader.ReadTable;
import io.netty.buffer.ByteBuf;

/**
 * {@code bit} and {@code varbit}: int32 bit length followed by the bits packed into bytes, pad bits last.
 */
public class PgBitStringCodec {

    public static Object decode(ByteBuf value, ReadTable readTable) {
        if (value.readableBytes() < 4) {
            throw new MessageDecodingException("Binary bit string is shorter than its length field.");
        }
        int bitLength = value.readInt();
        int byteLength = (bitLength + 7) / 8;
        if (bitLength < 0 || value.readableBytes() != byteLength) {
            throw new MessageDecodingException("Bit string of " + bitLength + " bits does not match " + value.readableBytes() + " data bytes.");
        }
        return PgBitString.fromPackedBytes(bitLength, DecoderUtils.readBytes(value, byteLength));
    }

    public static Object parse(String text, ReadTable readTable) {
        return PgBitString.fromString(text.trim());
    }

    public static void encode(Object value, ByteBuf out) {
        PgBitString bitString = (PgBitString) value;
        out.writeInt(bitString.length());
        out.writeBytes(bitString.toPackedBytes());
    }

    private PgBitStringCodec() {
    }
}

package com.pgwire.postgresprotocol.utils;

import com.pgwire.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import com.pgwire.postgresprotocol.exception.MessageDecodingException;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

public class DecoderUtils {

    /**
     * Reads a C string and moves the reader index past its terminator.
     *
     * @return decoded string, empty string for an immediate terminator
     */
    public static String readNextNullTerminatedString(ByteBuf byteBuf) {
        int terminatorIdx = byteBuf.indexOf(byteBuf.readerIndex(), byteBuf.writerIndex(), PostgresProtocolGeneralConstants.DELIMITER_BYTE);

        if (terminatorIdx < 0) {
            throw new MessageDecodingException("String field is not null terminated.");
        }

        int length = terminatorIdx - byteBuf.readerIndex();
        String ret = readStrictUtf8(byteBuf, length);
        // skip null terminator
        byteBuf.skipBytes(1);

        return ret;
    }

    /**
     * Decodes UTF-8 and fails on malformed input instead of substituting replacement characters.
     */
    public static String readStrictUtf8(ByteBuf byteBuf, int length) {
        if (length == 0) {
            return "";
        }

        ByteBuffer nioBuffer = byteBuf.nioBuffer(byteBuf.readerIndex(), length);
        try {
            String ret = StandardCharsets.UTF_8
                    .newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(nioBuffer)
                    .toString();
            byteBuf.skipBytes(length);
            return ret;
        } catch (CharacterCodingException e) {
            throw new MessageDecodingException("Invalid UTF-8 byte sequence: " + ByteBufUtil.hexDump(byteBuf, byteBuf.readerIndex(), Math.min(length, 32)), e);
        }
    }

    public static byte[] readBytes(ByteBuf byteBuf, int length) {
        byte[] ret = new byte[length];
        byteBuf.readBytes(ret);
        return ret;
    }

    private DecoderUtils() {
    }
}

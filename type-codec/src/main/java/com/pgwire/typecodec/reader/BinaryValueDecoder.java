package com.pgwire.typecodec.reader;

import io.netty.buffer.ByteBuf;

/**
 * Decodes one value sent in binary format. The buffer holds exactly the bytes of the value.
 * Nested values must be decoded through {@code readTable}.
 */
@FunctionalInterface
public interface BinaryValueDecoder {
    Object decode(ByteBuf value, ReadTable readTable);
}

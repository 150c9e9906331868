package com.pgwire.typecodec.reader;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Read table entry of one type OID. Either decoder may be absent.
 */
@Getter
@AllArgsConstructor
public class TypeReader {
    private final BinaryValueDecoder binaryDecoder;
    private final TextValueDecoder textDecoder;

    public static TypeReader of(BinaryValueDecoder binaryDecoder, TextValueDecoder textDecoder) {
        return new TypeReader(binaryDecoder, textDecoder);
    }

    public static TypeReader binaryOnly(BinaryValueDecoder binaryDecoder) {
        return new TypeReader(binaryDecoder, null);
    }

    public static TypeReader textOnly(TextValueDecoder textDecoder) {
        return new TypeReader(null, textDecoder);
    }

    public boolean hasBinaryDecoder() {
        return binaryDecoder != null;
    }

    public boolean hasTextDecoder() {
        return textDecoder != null;
    }
}

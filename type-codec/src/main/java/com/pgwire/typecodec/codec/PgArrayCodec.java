package com.pgwire.typecodec.codec;

import com.pgwire.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import com.pgwire.postgresprotocol.exception.MessageDecodingException;
import com.pgwire.typecodec.reader.ReadTable;
import com.pgwire.typecodec.reader.TextValueDecoder;
import io.netty.buffer.ByteBuf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Arrays of any element type. Binary layout: int32 dimension count, int32 flags, int32 element OID,
 * per dimension int32 size and int32 lower bound, then the elements in row-major order, each
 * prefixed by its int32 length (-1 for null).
 * <p>
 * One dimension decodes to a flat {@link List}, N dimensions to N levels of nested lists. Lower
 * bounds are not kept.
 */
public class PgArrayCodec {
    private static final int MAX_DIMENSIONS = 6;

    public static Object decode(ByteBuf value, ReadTable readTable) {
        if (value.readableBytes() < 12) {
            throw new MessageDecodingException("Binary array is shorter than its header.");
        }
        int dimensionCount = value.readInt();
        // has-null flag, not needed for decoding
        value.readInt();
        int elementOid = value.readInt();

        if (dimensionCount == 0) {
            return Collections.emptyList();
        }
        if (dimensionCount < 0 || dimensionCount > MAX_DIMENSIONS) {
            throw new MessageDecodingException("Invalid array dimension count " + dimensionCount + ".");
        }
        if (value.readableBytes() < dimensionCount * 8) {
            throw new MessageDecodingException("Binary array is shorter than its dimension list.");
        }

        int[] sizes = new int[dimensionCount];
        int elementCount = 1;
        for (int i = 0; i < dimensionCount; i++) {
            sizes[i] = value.readInt();
            // lower bound
            value.readInt();
            if (sizes[i] < 0) {
                throw new MessageDecodingException("Negative array dimension size " + sizes[i] + ".");
            }
            try {
                elementCount = Math.multiplyExact(elementCount, sizes[i]);
            } catch (ArithmeticException e) {
                throw new MessageDecodingException("Array dimensions overflow the element count.", e);
            }
        }
        // every element carries at least its int32 length
        if (elementCount > value.readableBytes() / 4) {
            throw new MessageDecodingException("Binary array declares " + elementCount + " elements but only " + value.readableBytes() + " bytes remain.");
        }

        List<Object> result = readDimension(value, readTable, elementOid, sizes, 0);
        if (value.isReadable()) {
            throw new MessageDecodingException("Binary array has " + value.readableBytes() + " trailing bytes.");
        }
        return result;
    }

    private static List<Object> readDimension(ByteBuf value, ReadTable readTable, int elementOid, int[] sizes, int dimension) {
        List<Object> ret = new ArrayList<>(sizes[dimension]);
        boolean innermost = dimension == sizes.length - 1;
        for (int i = 0; i < sizes[dimension]; i++) {
            if (innermost) {
                ret.add(readElement(value, readTable, elementOid));
            } else {
                ret.add(readDimension(value, readTable, elementOid, sizes, dimension + 1));
            }
        }
        return ret;
    }

    private static Object readElement(ByteBuf value, ReadTable readTable, int elementOid) {
        if (value.readableBytes() < 4) {
            throw new MessageDecodingException("Binary array ended before all elements were read.");
        }
        int length = value.readInt();
        if (length == PostgresProtocolGeneralConstants.NULL_VALUE_LENGTH) {
            return null;
        }
        if (length < 0 || length > value.readableBytes()) {
            throw new MessageDecodingException("Invalid array element length " + length + ".");
        }
        return readTable.decodeBinary(elementOid, value.readSlice(length));
    }

    /**
     * @return text decoder of array literals such as {@code [0:1]={{1,2},{NULL,"a,b"}}}
     */
    public static TextValueDecoder textDecoder(int elementOid) {
        return (text, readTable) -> parse(text, elementOid, readTable);
    }

    public static List<Object> parse(String text, int elementOid, ReadTable readTable) {
        LiteralCursor cursor = new LiteralCursor(text);
        if (cursor.peek() == '[') {
            int eq = text.indexOf('=');
            if (eq < 0) {
                throw new MessageDecodingException("Invalid array bounds in '" + text + "'.");
            }
            cursor.position = eq + 1;
        }
        List<Object> ret = parseLevel(cursor, elementOid, readTable);
        cursor.skipWhitespace();
        if (!cursor.atEnd()) {
            throw new MessageDecodingException("Unexpected trailing characters in array literal '" + text + "'.");
        }
        return ret;
    }

    private static List<Object> parseLevel(LiteralCursor cursor, int elementOid, ReadTable readTable) {
        cursor.skipWhitespace();
        cursor.expect('{');
        List<Object> ret = new ArrayList<>();
        cursor.skipWhitespace();
        if (cursor.peek() == '}') {
            cursor.position++;
            return ret;
        }

        while (true) {
            cursor.skipWhitespace();
            char c = cursor.peek();
            if (c == '{') {
                ret.add(parseLevel(cursor, elementOid, readTable));
            } else if (c == '"') {
                ret.add(readTable.decodeText(elementOid, cursor.readQuoted()));
            } else {
                String raw = cursor.readUntil(',', '}').trim();
                ret.add("NULL".equalsIgnoreCase(raw) ? null : readTable.decodeText(elementOid, raw));
            }

            cursor.skipWhitespace();
            char next = cursor.next();
            if (next == '}') {
                return ret;
            }
            if (next != ',') {
                throw cursor.error("Expected ',' or '}'");
            }
        }
    }

    private PgArrayCodec() {
    }
}

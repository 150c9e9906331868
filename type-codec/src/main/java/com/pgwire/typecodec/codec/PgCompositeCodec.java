package com.pgwire.typecodec.codec;

import com.pgwire.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import com.pgwire.postgresprotocol.exception.MessageDecodingException;
import com.pgwire.typecodec.reader.ReadTable;
import io.netty.buffer.ByteBuf;

import java.util.ArrayList;
import java.util.List;

/**
 * Anonymous records and composite types. Binary layout: int32 field count, then per field int32
 * type OID, int32 length (-1 for null) and the value.
 */
public class PgCompositeCodec {

    public static Object decode(ByteBuf value, ReadTable readTable) {
        if (value.readableBytes() < 4) {
            throw new MessageDecodingException("Binary record is shorter than its field count.");
        }
        int fieldCount = value.readInt();
        if (fieldCount < 0) {
            throw new MessageDecodingException("Negative record field count " + fieldCount + ".");
        }

        List<Object> ret = new ArrayList<>(fieldCount);
        for (int i = 0; i < fieldCount; i++) {
            if (value.readableBytes() < 8) {
                throw new MessageDecodingException("Binary record ended before field " + i + ".");
            }
            int fieldOid = value.readInt();
            int length = value.readInt();
            if (length == PostgresProtocolGeneralConstants.NULL_VALUE_LENGTH) {
                ret.add(null);
                continue;
            }
            if (length < 0 || length > value.readableBytes()) {
                throw new MessageDecodingException("Invalid record field length " + length + ".");
            }
            ret.add(readTable.decodeBinary(fieldOid, value.readSlice(length)));
        }

        if (value.isReadable()) {
            throw new MessageDecodingException("Binary record has " + value.readableBytes() + " trailing bytes.");
        }
        return ret;
    }

    /**
     * Parses a record literal such as {@code (1,,"a ""b""")}. Field types are unknown in text form,
     * so fields stay strings; an empty unquoted field is null.
     */
    public static Object parse(String text, ReadTable readTable) {
        LiteralCursor cursor = new LiteralCursor(text.trim());
        cursor.expect('(');
        List<Object> ret = new ArrayList<>();
        if (cursor.peek() == ')') {
            cursor.position++;
            return ret;
        }

        while (true) {
            if (cursor.peek() == '"') {
                StringBuilder field = new StringBuilder(cursor.readQuoted());
                // a field may continue after its closing quote
                field.append(cursor.readUntil(',', ')'));
                ret.add(field.toString());
            } else {
                String raw = cursor.readUntil(',', ')');
                ret.add(raw.isEmpty() ? null : raw);
            }

            char next = cursor.next();
            if (next == ')') {
                break;
            }
            if (next != ',') {
                throw cursor.error("Expected ',' or ')'");
            }
        }

        if (!cursor.atEnd()) {
            throw cursor.error("Unexpected trailing characters");
        }
        return ret;
    }

    private PgCompositeCodec() {
    }
}

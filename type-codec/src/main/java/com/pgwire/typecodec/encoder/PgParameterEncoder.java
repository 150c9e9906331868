package com.pgwire.typecodec.encoder;

import com.pgwire.postgresprotocol.model.protocol.BindParameter;
import com.pgwire.typecodec.model.PgNull;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.ByteBufUtil;

import java.lang.reflect.Array;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Turns Bind parameter values into their wire form. A value is sent in binary when the declared type
 * has an encoder accepting it, otherwise as text and left to the server's input function.
 */
public class PgParameterEncoder {

    public static BindParameter encode(int typeOid, Object value, ByteBufAllocator allocator) {
        if (value == null || value == PgNull.NULL) {
            return BindParameter.nullValue();
        }
        if (PgValueEncoders.canEncode(typeOid, value)) {
            return BindParameter.binary(PgValueEncoders.encodeBinary(typeOid, value, allocator));
        }
        return BindParameter.text(toText(value).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Text input form of a value, arrays and lists as {@code {...}} array literals.
     */
    public static String toText(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value ? "t" : "f";
        }
        if (value instanceof byte[]) {
            return "\\x" + ByteBufUtil.hexDump((byte[]) value);
        }
        if (PgArrayEncoder.isContainer(value)) {
            StringBuilder builder = new StringBuilder("{");
            if (value instanceof List) {
                List<?> list = (List<?>) value;
                for (int i = 0; i < list.size(); i++) {
                    appendArrayElement(builder, i, list.get(i));
                }
            } else {
                for (int i = 0; i < Array.getLength(value); i++) {
                    appendArrayElement(builder, i, Array.get(value, i));
                }
            }
            return builder.append('}').toString();
        }
        return value.toString();
    }

    private static void appendArrayElement(StringBuilder builder, int idx, Object element) {
        if (idx > 0) {
            builder.append(',');
        }
        if (element == null || element == PgNull.NULL) {
            builder.append("NULL");
        } else if (PgArrayEncoder.isContainer(element)) {
            builder.append(toText(element));
        } else {
            String text = toText(element);
            builder.append('"');
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (c == '"' || c == '\\') {
                    builder.append('\\');
                }
                builder.append(c);
            }
            builder.append('"');
        }
    }

    private PgParameterEncoder() {
    }
}

package com.pgwire.typecodec.codec;

import com.pgwire.postgresprotocol.exception.MessageDecodingException;
import com.pgwire.postgresprotocol.utils.DecoderUtils;
import com.pgwire.typecodec.model.PgPoint;
import com.pgwire.typecodec.reader.ReadTable;
import io.netty.buffer.ByteBuf;
import org.apache.commons.lang3.StringUtils;

import java.io.ByteArrayOutputStream;
import java.util.UUID;

/**
 * Decoders of fixed-layout and string types.
 */
public class PgScalarCodecs {

    public static Object decodeBool(ByteBuf value, ReadTable readTable) {
        checkLength(value, 1, "bool");
        return value.readByte() != 0;
    }

    public static Object decodeInt2(ByteBuf value, ReadTable readTable) {
        checkLength(value, 2, "int2");
        return value.readShort();
    }

    public static Object decodeInt4(ByteBuf value, ReadTable readTable) {
        checkLength(value, 4, "int4");
        return value.readInt();
    }

    public static Object decodeInt8(ByteBuf value, ReadTable readTable) {
        checkLength(value, 8, "int8");
        return value.readLong();
    }

    public static Object decodeOid(ByteBuf value, ReadTable readTable) {
        checkLength(value, 4, "oid");
        return value.readUnsignedInt();
    }

    public static Object decodeFloat4(ByteBuf value, ReadTable readTable) {
        checkLength(value, 4, "float4");
        return value.readFloat();
    }

    public static Object decodeFloat8(ByteBuf value, ReadTable readTable) {
        checkLength(value, 8, "float8");
        return value.readDouble();
    }

    public static Object decodeString(ByteBuf value, ReadTable readTable) {
        return DecoderUtils.readStrictUtf8(value, value.readableBytes());
    }

    public static Object decodeJsonb(ByteBuf value, ReadTable readTable) {
        if (value.readableBytes() < 1) {
            throw new MessageDecodingException("Empty jsonb value.");
        }
        byte version = value.readByte();
        if (version != 1) {
            throw new MessageDecodingException("Unsupported jsonb format version " + version + ".");
        }
        return DecoderUtils.readStrictUtf8(value, value.readableBytes());
    }

    public static Object decodeBytea(ByteBuf value, ReadTable readTable) {
        return DecoderUtils.readBytes(value, value.readableBytes());
    }

    public static Object decodeUuid(ByteBuf value, ReadTable readTable) {
        checkLength(value, 16, "uuid");
        return new UUID(value.readLong(), value.readLong());
    }

    public static Object decodePoint(ByteBuf value, ReadTable readTable) {
        checkLength(value, 16, "point");
        return new PgPoint(value.readDouble(), value.readDouble());
    }

    public static Object parseBool(String text, ReadTable readTable) {
        return switch (text) {
            case "t", "true" -> Boolean.TRUE;
            case "f", "false" -> Boolean.FALSE;
            default -> throw new MessageDecodingException("Invalid bool literal '" + text + "'.");
        };
    }

    public static Object parseInt2(String text, ReadTable readTable) {
        try {
            return Short.parseShort(text.trim());
        } catch (NumberFormatException e) {
            throw new MessageDecodingException("Invalid int2 literal '" + text + "'.", e);
        }
    }

    public static Object parseInt4(String text, ReadTable readTable) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new MessageDecodingException("Invalid int4 literal '" + text + "'.", e);
        }
    }

    public static Object parseInt8(String text, ReadTable readTable) {
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            throw new MessageDecodingException("Invalid int8 literal '" + text + "'.", e);
        }
    }

    public static Object parseOid(String text, ReadTable readTable) {
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            throw new MessageDecodingException("Invalid oid literal '" + text + "'.", e);
        }
    }

    public static Object parseFloat4(String text, ReadTable readTable) {
        try {
            return Float.parseFloat(text.trim());
        } catch (NumberFormatException e) {
            throw new MessageDecodingException("Invalid float4 literal '" + text + "'.", e);
        }
    }

    public static Object parseFloat8(String text, ReadTable readTable) {
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            throw new MessageDecodingException("Invalid float8 literal '" + text + "'.", e);
        }
    }

    public static Object parseString(String text, ReadTable readTable) {
        return text;
    }

    public static Object parseUuid(String text, ReadTable readTable) {
        try {
            return UUID.fromString(text.trim());
        } catch (IllegalArgumentException e) {
            throw new MessageDecodingException("Invalid uuid literal '" + text + "'.", e);
        }
    }

    public static Object parsePoint(String text, ReadTable readTable) {
        String inner = StringUtils.removeEnd(StringUtils.removeStart(text.trim(), "("), ")");
        String[] parts = StringUtils.split(inner, ',');
        if (parts.length != 2) {
            throw new MessageDecodingException("Invalid point literal '" + text + "'.");
        }
        try {
            return new PgPoint(Double.parseDouble(parts[0].trim()), Double.parseDouble(parts[1].trim()));
        } catch (NumberFormatException e) {
            throw new MessageDecodingException("Invalid point literal '" + text + "'.", e);
        }
    }

    /**
     * Accepts both the {@code hex} and the {@code escape} output formats of {@code bytea_output}.
     */
    public static Object parseBytea(String text, ReadTable readTable) {
        if (text.startsWith("\\x")) {
            String hex = text.substring(2);
            if (hex.length() % 2 != 0) {
                throw new MessageDecodingException("Odd number of digits in bytea hex literal.");
            }
            byte[] ret = new byte[hex.length() / 2];
            for (int i = 0; i < ret.length; i++) {
                int hi = Character.digit(hex.charAt(2 * i), 16);
                int lo = Character.digit(hex.charAt(2 * i + 1), 16);
                if (hi < 0 || lo < 0) {
                    throw new MessageDecodingException("Invalid bytea hex literal.");
                }
                ret[i] = (byte) ((hi << 4) | lo);
            }
            return ret;
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c != '\\') {
                out.write(c);
                i++;
            } else if (i + 1 < text.length() && text.charAt(i + 1) == '\\') {
                out.write('\\');
                i += 2;
            } else if (i + 3 < text.length() && isOctal(text, i + 1, 3)) {
                out.write(Integer.parseInt(text.substring(i + 1, i + 4), 8));
                i += 4;
            } else {
                throw new MessageDecodingException("Invalid bytea escape literal.");
            }
        }
        return out.toByteArray();
    }

    private static boolean isOctal(String text, int from, int count) {
        for (int i = from; i < from + count; i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '7') {
                return false;
            }
        }
        return true;
    }

    static void checkLength(ByteBuf value, int expected, String typeName) {
        if (value.readableBytes() != expected) {
            throw new MessageDecodingException("Binary " + typeName + " value must be " + expected + " bytes, got " + value.readableBytes() + ".");
        }
    }

    private PgScalarCodecs() {
    }
}

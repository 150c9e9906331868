package com.pgwire.typecodec.codec;

import com.pgwire.postgresprotocol.exception.MessageDecodingException;
import com.pgwire.postgresprotocol.exception.ValueEncodingException;
import com.pgwire.typecodec.reader.ReadTable;
import io.netty.buffer.ByteBuf;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code numeric} in its binary layout: int16 digit count, int16 weight, uint16 sign, uint16 display
 * scale, then base-10000 digits, most significant first. The value is
 * {@code digits[0] * 10000^weight + digits[1] * 10000^(weight - 1) + ...}.
 */
public class PgNumericCodec {
    public static final int SIGN_POSITIVE = 0x0000;
    public static final int SIGN_NEGATIVE = 0x4000;
    public static final int SIGN_NAN = 0xC000;
    public static final int SIGN_POSITIVE_INFINITY = 0xD000;
    public static final int SIGN_NEGATIVE_INFINITY = 0xF000;

    private static final int NBASE = 10000;
    private static final int DIGITS_PER_GROUP = 4;
    private static final BigInteger NBASE_BIG = BigInteger.valueOf(NBASE);

    public static Object decode(ByteBuf value, ReadTable readTable) {
        if (value.readableBytes() < 8) {
            throw new MessageDecodingException("Binary numeric value is shorter than its header.");
        }
        int digitCount = value.readShort();
        int weight = value.readShort();
        int sign = value.readUnsignedShort();
        int displayScale = value.readUnsignedShort();

        switch (sign) {
            case SIGN_NAN -> {
                return Double.NaN;
            }
            case SIGN_POSITIVE_INFINITY -> {
                return Double.POSITIVE_INFINITY;
            }
            case SIGN_NEGATIVE_INFINITY -> {
                return Double.NEGATIVE_INFINITY;
            }
            case SIGN_POSITIVE, SIGN_NEGATIVE -> {
            }
            default -> throw new MessageDecodingException("Invalid numeric sign 0x" + Integer.toHexString(sign) + ".");
        }

        if (digitCount < 0 || value.readableBytes() != digitCount * 2) {
            throw new MessageDecodingException("Binary numeric digit count " + digitCount + " does not match value length.");
        }
        if (digitCount == 0) {
            return BigDecimal.ZERO.setScale(displayScale);
        }

        BigInteger unscaled = BigInteger.ZERO;
        for (int i = 0; i < digitCount; i++) {
            int digit = value.readShort();
            if (digit < 0 || digit >= NBASE) {
                throw new MessageDecodingException("Invalid numeric digit " + digit + ".");
            }
            unscaled = unscaled.multiply(NBASE_BIG).add(BigInteger.valueOf(digit));
        }

        int exponent = (weight - digitCount + 1) * DIGITS_PER_GROUP;
        BigDecimal result = new BigDecimal(unscaled).scaleByPowerOfTen(exponent).setScale(displayScale, RoundingMode.DOWN);
        return sign == SIGN_NEGATIVE ? result.negate() : result;
    }

    public static Object parse(String text, ReadTable readTable) {
        String trimmed = text.trim();
        switch (trimmed) {
            case "NaN" -> {
                return Double.NaN;
            }
            case "Infinity" -> {
                return Double.POSITIVE_INFINITY;
            }
            case "-Infinity" -> {
                return Double.NEGATIVE_INFINITY;
            }
            default -> {
                try {
                    return new BigDecimal(trimmed);
                } catch (NumberFormatException e) {
                    throw new MessageDecodingException("Invalid numeric literal '" + text + "'.", e);
                }
            }
        }
    }

    /**
     * Accepts any {@link Number}. Non-finite doubles and floats map to NaN and the infinities.
     */
    public static void encode(Object value, ByteBuf out) {
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d)) {
                writeSpecial(SIGN_NAN, out);
                return;
            }
            if (Double.isInfinite(d)) {
                writeSpecial(d > 0 ? SIGN_POSITIVE_INFINITY : SIGN_NEGATIVE_INFINITY, out);
                return;
            }
        }
        encode(toBigDecimal(value), out);
    }

    public static void encode(BigDecimal value, ByteBuf out) {
        BigDecimal normalized = value.scale() < 0 ? value.setScale(0) : value;
        int displayScale = normalized.scale();
        int fractionGroups = (displayScale + DIGITS_PER_GROUP - 1) / DIGITS_PER_GROUP;
        BigInteger unscaled = normalized.abs().setScale(fractionGroups * DIGITS_PER_GROUP).unscaledValue();

        // least significant group first
        List<Integer> groups = new ArrayList<>();
        while (unscaled.signum() > 0) {
            BigInteger[] qr = unscaled.divideAndRemainder(NBASE_BIG);
            groups.add(qr[1].intValue());
            unscaled = qr[0];
        }

        int weight = groups.size() - fractionGroups - 1;
        int lowest = 0;
        while (lowest < groups.size() && groups.get(lowest) == 0) {
            lowest++;
        }
        if (lowest == groups.size()) {
            weight = 0;
        }

        int digitCount = groups.size() - lowest;
        if (digitCount > Short.MAX_VALUE || weight > Short.MAX_VALUE || weight < Short.MIN_VALUE || displayScale > 0x3FFF) {
            throw new ValueEncodingException("Numeric value " + value + " is out of the range of the numeric type.");
        }

        out.writeShort(digitCount);
        out.writeShort(weight);
        out.writeShort(normalized.signum() < 0 ? SIGN_NEGATIVE : SIGN_POSITIVE);
        out.writeShort(displayScale);
        for (int i = groups.size() - 1; i >= lowest; i--) {
            out.writeShort(groups.get(i));
        }
    }

    static BigDecimal toBigDecimal(Object value) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof BigInteger) {
            return new BigDecimal((BigInteger) value);
        }
        if (value instanceof Double || value instanceof Float) {
            return BigDecimal.valueOf(((Number) value).doubleValue());
        }
        if (value instanceof Number) {
            return new BigDecimal(value.toString());
        }
        throw new ValueEncodingException("Cannot encode " + value.getClass().getName() + " as numeric.");
    }

    private static void writeSpecial(int sign, ByteBuf out) {
        out.writeShort(0);
        out.writeShort(0);
        out.writeShort(sign);
        out.writeShort(0);
    }

    private PgNumericCodec() {
    }
}

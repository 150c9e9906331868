package com.pgwire.typecodec.encoder;

import com.pgwire.postgresprotocol.exception.ValueEncodingException;
import com.pgwire.typecodec.codec.PgBitStringCodec;
import com.pgwire.typecodec.codec.PgDateTimeCodec;
import com.pgwire.typecodec.codec.PgNumericCodec;
import com.pgwire.typecodec.constant.PgTypeOids;
import com.pgwire.typecodec.model.PgBitString;
import com.pgwire.typecodec.model.PgInterval;
import com.pgwire.typecodec.model.PgPoint;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.ByteBufUtil;
import lombok.Cleanup;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Binary encoders of the built-in types, keyed by type OID.
 */
public class PgValueEncoders {
    private static final long MAX_OID = 0xFFFFFFFFL;

    private static final Map<Integer, BinaryValueEncoder> ENCODERS;

    static {
        Map<Integer, BinaryValueEncoder> map = new HashMap<>();

        map.put(PgTypeOids.BOOL, BinaryValueEncoder.of(Boolean.class, (v, out) -> out.writeByte((Boolean) v ? 1 : 0)));
        map.put(PgTypeOids.INT2, integralEncoder(Short.MIN_VALUE, Short.MAX_VALUE, (out, v) -> out.writeShort((int) v)));
        map.put(PgTypeOids.INT4, integralEncoder(Integer.MIN_VALUE, Integer.MAX_VALUE, (out, v) -> out.writeInt((int) v)));
        map.put(PgTypeOids.INT8, integralEncoder(Long.MIN_VALUE, Long.MAX_VALUE, ByteBuf::writeLong));
        map.put(PgTypeOids.OID, integralEncoder(0, MAX_OID, (out, v) -> out.writeInt((int) v)));
        map.put(PgTypeOids.FLOAT4, BinaryValueEncoder.of(Number.class, (v, out) -> out.writeFloat(((Number) v).floatValue())));
        map.put(PgTypeOids.FLOAT8, BinaryValueEncoder.of(Number.class, (v, out) -> out.writeDouble(((Number) v).doubleValue())));
        map.put(PgTypeOids.NUMERIC, BinaryValueEncoder.of(Number.class, PgNumericCodec::encode));

        BinaryValueEncoder stringEncoder = BinaryValueEncoder.of(CharSequence.class,
                (v, out) -> out.writeCharSequence((CharSequence) v, StandardCharsets.UTF_8));
        map.put(PgTypeOids.TEXT, stringEncoder);
        map.put(PgTypeOids.VARCHAR, stringEncoder);
        map.put(PgTypeOids.BPCHAR, stringEncoder);
        map.put(PgTypeOids.NAME, stringEncoder);
        map.put(PgTypeOids.CHAR, stringEncoder);
        map.put(PgTypeOids.JSON, stringEncoder);
        map.put(PgTypeOids.XML, stringEncoder);
        map.put(PgTypeOids.UNKNOWN, stringEncoder);
        map.put(PgTypeOids.JSONB, BinaryValueEncoder.of(CharSequence.class, (v, out) -> {
            out.writeByte(1);
            out.writeCharSequence((CharSequence) v, StandardCharsets.UTF_8);
        }));

        map.put(PgTypeOids.BYTEA, BinaryValueEncoder.of(byte[].class, (v, out) -> out.writeBytes((byte[]) v)));
        map.put(PgTypeOids.UUID, BinaryValueEncoder.of(UUID.class, (v, out) -> {
            UUID uuid = (UUID) v;
            out.writeLong(uuid.getMostSignificantBits());
            out.writeLong(uuid.getLeastSignificantBits());
        }));
        map.put(PgTypeOids.POINT, BinaryValueEncoder.of(PgPoint.class, (v, out) -> {
            PgPoint point = (PgPoint) v;
            out.writeDouble(point.getX());
            out.writeDouble(point.getY());
        }));
        map.put(PgTypeOids.BIT, BinaryValueEncoder.of(PgBitString.class, PgBitStringCodec::encode));
        map.put(PgTypeOids.VARBIT, BinaryValueEncoder.of(PgBitString.class, PgBitStringCodec::encode));

        map.put(PgTypeOids.DATE, BinaryValueEncoder.of(LocalDate.class, PgDateTimeCodec::encodeDate));
        map.put(PgTypeOids.TIME, BinaryValueEncoder.of(LocalTime.class, PgDateTimeCodec::encodeTime));
        map.put(PgTypeOids.TIMETZ, BinaryValueEncoder.of(OffsetTime.class, PgDateTimeCodec::encodeTimeTz));
        map.put(PgTypeOids.TIMESTAMP, BinaryValueEncoder.of(LocalDateTime.class, PgDateTimeCodec::encodeTimestamp));
        map.put(PgTypeOids.TIMESTAMPTZ, BinaryValueEncoder.ofTypes(PgDateTimeCodec::encodeTimestampTz,
                OffsetDateTime.class, ZonedDateTime.class, Instant.class));
        map.put(PgTypeOids.INTERVAL, BinaryValueEncoder.ofTypes(PgDateTimeCodec::encodeInterval, PgInterval.class, Duration.class));

        PgTypeOids.getArrayElementOids().forEach((arrayOid, elementOid) -> {
            BinaryValueEncoder elementEncoder = map.get(elementOid);
            if (elementEncoder != null) {
                map.put(arrayOid, new PgArrayEncoder(elementOid, elementEncoder));
            }
        });

        ENCODERS = Collections.unmodifiableMap(map);
    }

    /**
     * @return encoder of {@code oid}, null when the type has none
     */
    public static BinaryValueEncoder find(int oid) {
        return ENCODERS.get(oid);
    }

    public static boolean canEncode(int oid, Object value) {
        BinaryValueEncoder encoder = ENCODERS.get(oid);
        return encoder != null && encoder.supports(value);
    }

    /**
     * Writes {@code value} in binary format into {@code out}, without a length prefix.
     */
    public static void encodeBinary(int oid, Object value, ByteBuf out) {
        BinaryValueEncoder encoder = ENCODERS.get(oid);
        if (encoder == null) {
            throw new ValueEncodingException("No binary encoder for type OID " + oid + ".");
        }
        if (!encoder.supports(value)) {
            throw new ValueEncodingException("Binary encoder of type OID " + oid + " does not accept " + value.getClass().getName() + ".");
        }
        try {
            encoder.encode(value, out);
        } catch (ClassCastException | ArithmeticException e) {
            throw new ValueEncodingException("Failed to encode " + value.getClass().getName() + " as type OID " + oid + ".", e);
        }
    }

    public static byte[] encodeBinary(int oid, Object value, ByteBufAllocator allocator) {
        @Cleanup("release") ByteBuf buf = allocator.buffer();
        encodeBinary(oid, value, buf);
        return ByteBufUtil.getBytes(buf);
    }

    private static BinaryValueEncoder integralEncoder(long min, long max, LongWriter writer) {
        return new BinaryValueEncoder() {
            @Override
            public boolean supports(Object value) {
                if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
                    long l = ((Number) value).longValue();
                    return l >= min && l <= max;
                }
                if (value instanceof BigInteger) {
                    BigInteger big = (BigInteger) value;
                    return big.bitLength() < 64 && big.longValue() >= min && big.longValue() <= max;
                }
                return false;
            }

            @Override
            public void encode(Object value, ByteBuf out) {
                writer.write(out, ((Number) value).longValue());
            }
        };
    }

    @FunctionalInterface
    private interface LongWriter {
        void write(ByteBuf out, long value);
    }

    private PgValueEncoders() {
    }
}

package com.pgwire.typecodec.codec;

import com.pgwire.postgresprotocol.exception.MessageDecodingException;
import com.pgwire.postgresprotocol.exception.ValueEncodingException;
import com.pgwire.typecodec.model.PgInterval;
import com.pgwire.typecodec.reader.ReadTable;
import com.pgwire.typecodec.utils.PostgresTimeUtils;
import io.netty.buffer.ByteBuf;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;

/**
 * Date and time types. Decoders only extract the raw counts and hand them to the temporal value
 * factory of the read table. Text input is expected in {@code DateStyle = ISO} and
 * {@code IntervalStyle = postgres}.
 */
public class PgDateTimeCodec {
    private static final String INFINITY = "infinity";
    private static final String NEGATIVE_INFINITY = "-infinity";
    private static final String BC_SUFFIX = " BC";

    public static Object decodeDate(ByteBuf value, ReadTable readTable) {
        PgScalarCodecs.checkLength(value, 4, "date");
        return readTable.getTemporalValueFactory().fromDate(value.readInt());
    }

    public static Object decodeTime(ByteBuf value, ReadTable readTable) {
        PgScalarCodecs.checkLength(value, 8, "time");
        return readTable.getTemporalValueFactory().fromTime(value.readLong());
    }

    public static Object decodeTimeTz(ByteBuf value, ReadTable readTable) {
        PgScalarCodecs.checkLength(value, 12, "timetz");
        long micros = value.readLong();
        int zoneSecondsWest = value.readInt();
        return readTable.getTemporalValueFactory().fromTimeWithTimeZone(micros, zoneSecondsWest);
    }

    public static Object decodeTimestamp(ByteBuf value, ReadTable readTable) {
        PgScalarCodecs.checkLength(value, 8, "timestamp");
        return readTable.getTemporalValueFactory().fromTimestamp(value.readLong());
    }

    public static Object decodeTimestampTz(ByteBuf value, ReadTable readTable) {
        PgScalarCodecs.checkLength(value, 8, "timestamptz");
        return readTable.getTemporalValueFactory().fromTimestampWithTimeZone(value.readLong());
    }

    public static Object decodeInterval(ByteBuf value, ReadTable readTable) {
        PgScalarCodecs.checkLength(value, 16, "interval");
        long micros = value.readLong();
        int days = value.readInt();
        int months = value.readInt();
        return readTable.getTemporalValueFactory().fromInterval(months, days, micros);
    }

    public static Object parseDate(String text, ReadTable readTable) {
        return readTable.getTemporalValueFactory().fromDate(parseDays(text.trim()));
    }

    public static Object parseTime(String text, ReadTable readTable) {
        return readTable.getTemporalValueFactory().fromTime(parseMicrosOfDay(text.trim()));
    }

    public static Object parseTimeTz(String text, ReadTable readTable) {
        String trimmed = text.trim();
        int offsetStart = findOffsetStart(trimmed, 0);
        if (offsetStart < 0) {
            throw new MessageDecodingException("Missing zone offset in timetz literal '" + text + "'.");
        }
        long micros = parseMicrosOfDay(trimmed.substring(0, offsetStart));
        ZoneOffset offset = parseOffset(trimmed.substring(offsetStart));
        return readTable.getTemporalValueFactory().fromTimeWithTimeZone(micros, -offset.getTotalSeconds());
    }

    public static Object parseTimestamp(String text, ReadTable readTable) {
        String trimmed = text.trim();
        if (INFINITY.equals(trimmed)) {
            return readTable.getTemporalValueFactory().fromTimestamp(Long.MAX_VALUE);
        }
        if (NEGATIVE_INFINITY.equals(trimmed)) {
            return readTable.getTemporalValueFactory().fromTimestamp(Long.MIN_VALUE);
        }
        return readTable.getTemporalValueFactory().fromTimestamp(parseTimestampMicros(trimmed, false));
    }

    public static Object parseTimestampTz(String text, ReadTable readTable) {
        String trimmed = text.trim();
        if (INFINITY.equals(trimmed)) {
            return readTable.getTemporalValueFactory().fromTimestampWithTimeZone(Long.MAX_VALUE);
        }
        if (NEGATIVE_INFINITY.equals(trimmed)) {
            return readTable.getTemporalValueFactory().fromTimestampWithTimeZone(Long.MIN_VALUE);
        }
        return readTable.getTemporalValueFactory().fromTimestampWithTimeZone(parseTimestampMicros(trimmed, true));
    }

    /**
     * Parses the {@code postgres} interval style, e.g. {@code 1 year 2 mons -3 days +04:05:06.5}.
     */
    public static Object parseInterval(String text, ReadTable readTable) {
        String[] tokens = StringUtils.split(text.trim(), ' ');
        int months = 0;
        int days = 0;
        long micros = 0;
        int i = 0;
        try {
            while (i < tokens.length) {
                String token = tokens[i];
                if (token.indexOf(':') >= 0) {
                    micros += parseSignedTime(token);
                    i++;
                    continue;
                }
                if (i + 1 >= tokens.length) {
                    throw new MessageDecodingException("Invalid interval literal '" + text + "'.");
                }
                int amount = Integer.parseInt(token);
                String unit = tokens[i + 1];
                if (unit.startsWith("year")) {
                    months += amount * 12;
                } else if (unit.startsWith("mon")) {
                    months += amount;
                } else if (unit.startsWith("day")) {
                    days += amount;
                } else {
                    throw new MessageDecodingException("Unknown interval unit '" + unit + "' in '" + text + "'.");
                }
                i += 2;
            }
        } catch (NumberFormatException e) {
            throw new MessageDecodingException("Invalid interval literal '" + text + "'.", e);
        }
        return readTable.getTemporalValueFactory().fromInterval(months, days, micros);
    }

    public static void encodeDate(Object value, ByteBuf out) {
        out.writeInt(PostgresTimeUtils.toDaysSinceEpoch((LocalDate) value));
    }

    public static void encodeTime(Object value, ByteBuf out) {
        out.writeLong(PostgresTimeUtils.toMicrosecondsOfDay((LocalTime) value));
    }

    public static void encodeTimeTz(Object value, ByteBuf out) {
        OffsetTime time = (OffsetTime) value;
        out.writeLong(PostgresTimeUtils.toMicrosecondsOfDay(time.toLocalTime()));
        out.writeInt(-time.getOffset().getTotalSeconds());
    }

    public static void encodeTimestamp(Object value, ByteBuf out) {
        out.writeLong(PostgresTimeUtils.toMicrosecondsSinceEpoch((LocalDateTime) value));
    }

    public static void encodeTimestampTz(Object value, ByteBuf out) {
        if (value instanceof OffsetDateTime) {
            out.writeLong(PostgresTimeUtils.toMicrosecondsSinceEpoch((OffsetDateTime) value));
        } else if (value instanceof ZonedDateTime) {
            out.writeLong(PostgresTimeUtils.toMicrosecondsSinceEpoch(((ZonedDateTime) value).toOffsetDateTime()));
        } else if (value instanceof Instant) {
            out.writeLong(PostgresTimeUtils.toMicrosecondsSinceEpoch((Instant) value));
        } else {
            throw new ValueEncodingException("Cannot encode " + value.getClass().getName() + " as timestamptz.");
        }
    }

    public static void encodeInterval(Object value, ByteBuf out) {
        PgInterval interval = value instanceof Duration ? PgInterval.of((Duration) value) : (PgInterval) value;
        out.writeLong(interval.getMicroseconds());
        out.writeInt(interval.getDays());
        out.writeInt(interval.getMonths());
    }

    static int parseDays(String text) {
        if (INFINITY.equals(text)) {
            return Integer.MAX_VALUE;
        }
        if (NEGATIVE_INFINITY.equals(text)) {
            return Integer.MIN_VALUE;
        }
        return PostgresTimeUtils.toDaysSinceEpoch(parseLocalDate(text));
    }

    private static LocalDate parseLocalDate(String text) {
        boolean bc = text.endsWith(BC_SUFFIX);
        String datePart = bc ? text.substring(0, text.length() - BC_SUFFIX.length()) : text;
        try {
            LocalDate date = LocalDate.parse(datePart);
            // year 1 BC is proleptic year 0
            return bc ? date.withYear(1 - date.getYear()) : date;
        } catch (DateTimeException e) {
            throw new MessageDecodingException("Invalid date literal '" + text + "'.", e);
        }
    }

    static long parseMicrosOfDay(String text) {
        if ("24:00:00".equals(text)) {
            return PostgresTimeUtils.MICROS_PER_DAY;
        }
        try {
            return PostgresTimeUtils.toMicrosecondsOfDay(LocalTime.parse(text));
        } catch (DateTimeParseException e) {
            throw new MessageDecodingException("Invalid time literal '" + text + "'.", e);
        }
    }

    private static long parseTimestampMicros(String text, boolean withOffset) {
        boolean bc = text.endsWith(BC_SUFFIX);
        String value = bc ? text.substring(0, text.length() - BC_SUFFIX.length()) : text;

        int space = value.indexOf(' ');
        if (space < 0) {
            throw new MessageDecodingException("Invalid timestamp literal '" + text + "'.");
        }
        String datePart = value.substring(0, space);
        String timePart = value.substring(space + 1);

        ZoneOffset offset = ZoneOffset.UTC;
        if (withOffset) {
            int offsetStart = findOffsetStart(timePart, 0);
            if (offsetStart < 0) {
                throw new MessageDecodingException("Missing zone offset in timestamptz literal '" + text + "'.");
            }
            offset = parseOffset(timePart.substring(offsetStart));
            timePart = timePart.substring(0, offsetStart);
        }

        LocalDate date = parseLocalDate(bc ? datePart + BC_SUFFIX : datePart);
        LocalTime time;
        try {
            time = LocalTime.parse(timePart);
        } catch (DateTimeParseException e) {
            throw new MessageDecodingException("Invalid timestamp literal '" + text + "'.", e);
        }
        LocalDateTime utc = LocalDateTime.of(date, time).minusSeconds(offset.getTotalSeconds());
        return PostgresTimeUtils.toMicrosecondsSinceEpoch(utc);
    }

    /**
     * @return index of the sign of the zone offset following a {@code HH:MM:SS[.f]} time, -1 when absent
     */
    private static int findOffsetStart(String text, int from) {
        for (int i = from + 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '+' || c == '-') {
                return i;
            }
        }
        return -1;
    }

    private static ZoneOffset parseOffset(String text) {
        try {
            return ZoneOffset.of(text);
        } catch (DateTimeException e) {
            throw new MessageDecodingException("Invalid zone offset '" + text + "'.", e);
        }
    }

    private static long parseSignedTime(String token) {
        boolean negative = token.startsWith("-");
        String unsigned = negative || token.startsWith("+") ? token.substring(1) : token;
        String[] parts = StringUtils.split(unsigned, ':');
        if (parts.length != 3) {
            throw new MessageDecodingException("Invalid interval time part '" + token + "'.");
        }
        long hours = Long.parseLong(parts[0]);
        long minutes = Long.parseLong(parts[1]);
        long micros = new BigDecimal(parts[2]).movePointRight(6).longValueExact();
        long total = (hours * 3600 + minutes * 60) * PostgresTimeUtils.MICROS_PER_SECOND + micros;
        return negative ? -total : total;
    }

    private PgDateTimeCodec() {
    }
}

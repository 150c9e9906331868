package com.pgwire.typecodec.utils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

public class PostgresTimeUtils {
    public static final LocalDate POSTGRES_EPOCH_DATE = LocalDate.of(2000, 1, 1);
    // 2000-01-01T00:00:00Z in unix seconds
    public static final long POSTGRES_EPOCH_SECONDS = 946684800L;
    public static final long MICROS_PER_SECOND = 1_000_000L;
    public static final long MICROS_PER_DAY = 86_400L * MICROS_PER_SECOND;
    private static final long NANOS_PER_MICRO = 1_000L;

    public static LocalDate toLocalDate(int daysSinceEpoch) {
        return POSTGRES_EPOCH_DATE.plusDays(daysSinceEpoch);
    }

    public static int toDaysSinceEpoch(LocalDate date) {
        if (LocalDate.MAX.equals(date)) {
            return Integer.MAX_VALUE;
        }
        if (LocalDate.MIN.equals(date)) {
            return Integer.MIN_VALUE;
        }
        return Math.toIntExact(ChronoUnit.DAYS.between(POSTGRES_EPOCH_DATE, date));
    }

    /**
     * {@code 24:00:00} is a valid Postgres time and maps to {@link LocalTime#MAX}.
     */
    public static LocalTime toLocalTime(long microsecondsOfDay) {
        if (microsecondsOfDay >= MICROS_PER_DAY) {
            return LocalTime.MAX;
        }
        return LocalTime.ofNanoOfDay(microsecondsOfDay * NANOS_PER_MICRO);
    }

    public static long toMicrosecondsOfDay(LocalTime time) {
        if (LocalTime.MAX.equals(time)) {
            return MICROS_PER_DAY;
        }
        return time.toNanoOfDay() / NANOS_PER_MICRO;
    }

    public static LocalDateTime toLocalDateTime(long microsecondsSinceEpoch) {
        long seconds = Math.floorDiv(microsecondsSinceEpoch, MICROS_PER_SECOND);
        long micros = Math.floorMod(microsecondsSinceEpoch, MICROS_PER_SECOND);
        return LocalDateTime.ofEpochSecond(seconds + POSTGRES_EPOCH_SECONDS, (int) (micros * NANOS_PER_MICRO), ZoneOffset.UTC);
    }

    public static long toMicrosecondsSinceEpoch(LocalDateTime dateTime) {
        if (LocalDateTime.MAX.equals(dateTime)) {
            return Long.MAX_VALUE;
        }
        if (LocalDateTime.MIN.equals(dateTime)) {
            return Long.MIN_VALUE;
        }
        long seconds = dateTime.toEpochSecond(ZoneOffset.UTC) - POSTGRES_EPOCH_SECONDS;
        return seconds * MICROS_PER_SECOND + dateTime.getNano() / NANOS_PER_MICRO;
    }

    public static long toMicrosecondsSinceEpoch(OffsetDateTime dateTime) {
        if (OffsetDateTime.MAX.equals(dateTime)) {
            return Long.MAX_VALUE;
        }
        if (OffsetDateTime.MIN.equals(dateTime)) {
            return Long.MIN_VALUE;
        }
        return toMicrosecondsSinceEpoch(dateTime.atZoneSameInstant(ZoneOffset.UTC).toLocalDateTime());
    }

    public static long toMicrosecondsSinceEpoch(Instant instant) {
        return (instant.getEpochSecond() - POSTGRES_EPOCH_SECONDS) * MICROS_PER_SECOND + instant.getNano() / NANOS_PER_MICRO;
    }

    private PostgresTimeUtils() {
    }
}

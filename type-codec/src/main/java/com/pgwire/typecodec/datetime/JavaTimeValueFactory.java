package com.pgwire.typecodec.datetime;

import com.pgwire.typecodec.model.PgInterval;
import com.pgwire.typecodec.utils.PostgresTimeUtils;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZoneOffset;

/**
 * Default collaborator producing {@code java.time} values. Infinite dates and timestamps map to the
 * {@code MAX}/{@code MIN} constants of the corresponding class.
 */
public class JavaTimeValueFactory implements TemporalValueFactory {

    public static final JavaTimeValueFactory INSTANCE = new JavaTimeValueFactory();

    @Override
    public Object fromDate(int daysSinceEpoch) {
        if (daysSinceEpoch == Integer.MAX_VALUE) {
            return LocalDate.MAX;
        }
        if (daysSinceEpoch == Integer.MIN_VALUE) {
            return LocalDate.MIN;
        }
        return PostgresTimeUtils.toLocalDate(daysSinceEpoch);
    }

    @Override
    public Object fromTime(long microsecondsOfDay) {
        return PostgresTimeUtils.toLocalTime(microsecondsOfDay);
    }

    @Override
    public Object fromTimeWithTimeZone(long microsecondsOfDay, int zoneOffsetSecondsWest) {
        LocalTime time = PostgresTimeUtils.toLocalTime(microsecondsOfDay);
        return OffsetTime.of(time, ZoneOffset.ofTotalSeconds(-zoneOffsetSecondsWest));
    }

    @Override
    public Object fromTimestamp(long microsecondsSinceEpoch) {
        if (microsecondsSinceEpoch == Long.MAX_VALUE) {
            return LocalDateTime.MAX;
        }
        if (microsecondsSinceEpoch == Long.MIN_VALUE) {
            return LocalDateTime.MIN;
        }
        return PostgresTimeUtils.toLocalDateTime(microsecondsSinceEpoch);
    }

    @Override
    public Object fromTimestampWithTimeZone(long microsecondsSinceEpoch) {
        if (microsecondsSinceEpoch == Long.MAX_VALUE) {
            return OffsetDateTime.MAX;
        }
        if (microsecondsSinceEpoch == Long.MIN_VALUE) {
            return OffsetDateTime.MIN;
        }
        return PostgresTimeUtils.toLocalDateTime(microsecondsSinceEpoch).atOffset(ZoneOffset.UTC);
    }

    @Override
    public Object fromInterval(int months, int days, long microseconds) {
        return new PgInterval(months, days, microseconds);
    }
}

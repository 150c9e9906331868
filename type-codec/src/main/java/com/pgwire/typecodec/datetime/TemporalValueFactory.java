package com.pgwire.typecodec.datetime;

/**
 * Builds temporal values from the raw counts found on the wire. All counts are relative to the
 * Postgres epoch 2000-01-01 00:00:00. {@code Integer.MAX_VALUE}/{@code Integer.MIN_VALUE} days and
 * {@code Long.MAX_VALUE}/{@code Long.MIN_VALUE} microseconds stand for {@code infinity} and {@code -infinity}.
 */
public interface TemporalValueFactory {

    Object fromDate(int daysSinceEpoch);

    Object fromTime(long microsecondsOfDay);

    /**
     * @param zoneOffsetSecondsWest offset as sent by the server, positive west of Greenwich
     */
    Object fromTimeWithTimeZone(long microsecondsOfDay, int zoneOffsetSecondsWest);

    Object fromTimestamp(long microsecondsSinceEpoch);

    Object fromTimestampWithTimeZone(long microsecondsSinceEpoch);

    Object fromInterval(int months, int days, long microseconds);
}

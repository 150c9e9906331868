package com.pgwire.typecodec.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Postgres interval. Months, days and the time part are kept apart because their lengths depend on
 * the date the interval is applied to.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PgInterval {
    private int months;
    private int days;
    private long microseconds;

    public static PgInterval of(Duration duration) {
        return new PgInterval(0, 0, duration.getSeconds() * 1_000_000L + duration.getNano() / 1_000);
    }

    /**
     * Interval input syntax the server accepts regardless of {@code IntervalStyle}.
     */
    @Override
    public String toString() {
        BigDecimal seconds = BigDecimal.valueOf(microseconds, 6).stripTrailingZeros();
        return months + " mons " + days + " days " + seconds.toPlainString() + " secs";
    }
}

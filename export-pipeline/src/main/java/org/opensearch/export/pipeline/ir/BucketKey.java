package org.opensearch.export.pipeline.ir;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.regex.Pattern;

/**
 * A calendar month of the {@code updated} timestamp, the unit of work and of reconciliation.
 * Its text form is {@code YYYY-MM}, the same form the monthly histogram reports.
 */
public record BucketKey(int year, int month) implements Comparable<BucketKey> {
    private static final Pattern TEXT_FORM = Pattern.compile("(\\d{4})-(\\d{1,2})");

    public BucketKey {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("Month must be between 1 and 12, was " + month);
        }
        if (year < 0 || year > 9999) {
            throw new IllegalArgumentException("Year must have four digits, was " + year);
        }
    }

    public static BucketKey parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Bucket key must not be null");
        }
        var matcher = TEXT_FORM.matcher(text.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Expected a month as YYYY-MM, got '" + text + "'");
        }
        return new BucketKey(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
    }

    /** The month containing the clock's current instant, in UTC. */
    public static BucketKey current(Clock clock) {
        var now = YearMonth.now(clock.withZone(ZoneOffset.UTC));
        return new BucketKey(now.getYear(), now.getMonthValue());
    }

    /** First second of the month, inclusive. */
    public Instant rangeStart() {
        return yearMonth().atDay(1).atStartOfDay().toInstant(ZoneOffset.UTC);
    }

    /** Last second of the month, inclusive. */
    public Instant rangeEnd() {
        return yearMonth().atEndOfMonth().atTime(LocalTime.MAX).truncatedTo(ChronoUnit.SECONDS)
            .toInstant(ZoneOffset.UTC);
    }

    /** Name of the per-month output directory. */
    public String directoryName() {
        return "updated_" + this;
    }

    public boolean isAfter(BucketKey other) {
        return compareTo(other) > 0;
    }

    public boolean isBefore(BucketKey other) {
        return compareTo(other) < 0;
    }

    private YearMonth yearMonth() {
        return YearMonth.of(year, month);
    }

    @Override
    public int compareTo(BucketKey other) {
        return year != other.year ? Integer.compare(year, other.year) : Integer.compare(month, other.month);
    }

    @Override
    public String toString() {
        return String.format("%04d-%02d", year, month);
    }
}

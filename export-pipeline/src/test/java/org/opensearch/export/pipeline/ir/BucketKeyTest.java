package org.opensearch.export.pipeline.ir;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class BucketKeyTest {

    @Test
    void parsesAndFormatsZeroPadded() {
        var key = BucketKey.parse("2024-2");

        assertEquals(new BucketKey(2024, 2), key);
        assertEquals("2024-02", key.toString());
        assertEquals("updated_2024-02", key.directoryName());
        assertEquals(key, BucketKey.parse(key.toString()));
    }

    @ParameterizedTest
    @ValueSource(strings = {"2024-13", "2024-00", "24-01", "2024/01", "2024-01-01", ""})
    void rejectsInvalidText(String text) {
        assertThrows(IllegalArgumentException.class, () -> BucketKey.parse(text));
    }

    @Test
    void rangeCoversTheWholeMonthInclusive() {
        var february = new BucketKey(2024, 2);

        assertEquals(Instant.parse("2024-02-01T00:00:00Z"), february.rangeStart());
        assertEquals(Instant.parse("2024-02-29T23:59:59Z"), february.rangeEnd());
        assertEquals(Instant.parse("2023-12-31T23:59:59Z"), new BucketKey(2023, 12).rangeEnd());
    }

    @Test
    void currentMonthIsTakenInUtc() {
        // 23:30 on Jan 31st in UTC is already February in Tokyo
        var clock = Clock.fixed(Instant.parse("2024-01-31T23:30:00Z"), ZoneId.of("Asia/Tokyo"));

        assertEquals(new BucketKey(2024, 1), BucketKey.current(clock));
        assertEquals(new BucketKey(2024, 2),
            BucketKey.current(Clock.fixed(Instant.parse("2024-02-01T00:00:00Z"), ZoneOffset.UTC)));
    }

    @Test
    void ordersChronologically() {
        var december = new BucketKey(2023, 12);
        var january = new BucketKey(2024, 1);

        assertTrue(december.isBefore(january));
        assertTrue(january.isAfter(december));
        assertEquals(0, january.compareTo(BucketKey.parse("2024-01")));
    }
}

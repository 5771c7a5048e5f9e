package com.payoutengine.payout;

import com.payoutengine.common.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class CronSchedulesTest {

    @Test
    void testNext_FiveFieldExpression() {
        Instant next = CronSchedules.next("0 0 1 * *", Instant.parse("2024-01-15T10:00:00Z"), ZoneOffset.UTC);

        assertEquals(Instant.parse("2024-02-01T00:00:00Z"), next);
    }

    @Test
    void testNext_SixFieldExpression() {
        Instant next = CronSchedules.next("30 15 9 * * MON", Instant.parse("2024-01-15T10:00:00Z"), ZoneOffset.UTC);

        assertEquals(Instant.parse("2024-01-22T09:15:30Z"), next);
    }

    @Test
    void testNext_UsesZone() {
        Instant next = CronSchedules.next("0 3 * * *", Instant.parse("2024-01-15T10:00:00Z"), ZoneId.of("Europe/Moscow"));

        assertEquals(Instant.parse("2024-01-16T00:00:00Z"), next);
    }

    @Test
    void testParse_Invalid() {
        assertThrows(ValidationException.class, () -> CronSchedules.parse(null));
        assertThrows(ValidationException.class, () -> CronSchedules.parse("0 0 1 *"));
        assertThrows(ValidationException.class, () -> CronSchedules.parse("0 0 32 * *"));
        assertThrows(ValidationException.class, () -> CronSchedules.parse("every day"));
    }
}

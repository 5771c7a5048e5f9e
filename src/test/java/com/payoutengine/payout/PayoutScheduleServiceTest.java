package com.payoutengine.payout;

import com.payoutengine.common.exception.ValidationException;
import com.payoutengine.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PayoutScheduleService.
 */
@ExtendWith(MockitoExtension.class)
class PayoutScheduleServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    @Mock
    private PayoutScheduleRepository repository;

    private MutableClock clock;
    private PayoutScheduleService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        service = new PayoutScheduleService(repository, new PayoutProperties(), clock);
        lenient().when(repository.save(any(PayoutSchedule.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void testGetSchedule_CreatesDisabledDefault() {
        when(repository.findById(PayoutSchedule.SINGLETON_ID)).thenReturn(Optional.empty());

        PayoutSchedule schedule = service.getSchedule();

        assertEquals("0 0 1 * *", schedule.getCronExpression());
        assertFalse(schedule.isEnabled());
        assertNull(schedule.getLastRunAt());
        assertEquals(Instant.parse("2024-02-01T00:00:00Z"), schedule.getNextRunAt());
        verify(repository).save(schedule);
    }

    @Test
    void testUpdateSchedule() {
        when(repository.findById(PayoutSchedule.SINGLETON_ID)).thenReturn(Optional.of(new PayoutSchedule("0 0 1 * *", false, NOW)));

        PayoutSchedule schedule = service.updateSchedule("0 6 * * *", true, "admin");

        assertEquals("0 6 * * *", schedule.getCronExpression());
        assertTrue(schedule.isEnabled());
        assertEquals("admin", schedule.getUpdatedBy());
        assertEquals(Instant.parse("2024-01-16T06:00:00Z"), schedule.getNextRunAt());
    }

    @Test
    void testUpdateSchedule_InvalidCronKeepsSchedule() {
        PayoutSchedule existing = new PayoutSchedule("0 0 1 * *", true, NOW);
        when(repository.findById(PayoutSchedule.SINGLETON_ID)).thenReturn(Optional.of(existing));

        assertThrows(ValidationException.class, () -> service.updateSchedule("61 * * * *", null, "admin"));

        assertEquals("0 0 1 * *", existing.getCronExpression());
        verify(repository, never()).save(any());
    }

    @Test
    void testUpdateSchedule_NothingToChange() {
        assertThrows(ValidationException.class, () -> service.updateSchedule(null, null, "admin"));
        verifyNoInteractions(repository);
    }

    @Test
    void testIsDue() {
        PayoutSchedule schedule = new PayoutSchedule("0 0 1 * *", true, NOW);
        schedule.setNextRunAt(NOW.plus(Duration.ofHours(1)));
        when(repository.findById(PayoutSchedule.SINGLETON_ID)).thenReturn(Optional.of(schedule));

        assertFalse(service.isDue());
        clock.advance(Duration.ofHours(1));
        assertTrue(service.isDue());

        schedule.setEnabled(false);
        assertFalse(service.isDue());
    }

    @Test
    void testRecordRun() {
        PayoutSchedule schedule = new PayoutSchedule("0 0 1 * *", true, NOW);
        when(repository.findById(PayoutSchedule.SINGLETON_ID)).thenReturn(Optional.of(schedule));
        Instant finishedAt = Instant.parse("2024-02-01T00:03:00Z");

        service.recordRun(finishedAt);

        assertEquals(finishedAt, schedule.getLastRunAt());
        assertEquals(Instant.parse("2024-03-01T00:00:00Z"), schedule.getNextRunAt());
    }
}

package com.payoutengine.payout;

import com.payoutengine.common.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Reads and updates the persisted batch schedule.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayoutScheduleService {

    private final PayoutScheduleRepository scheduleRepository;
    private final PayoutProperties properties;
    private final Clock clock;

    /**
     * The schedule; a disabled default is created on first access.
     */
    @Transactional
    public PayoutSchedule getSchedule() {
        return scheduleRepository.findById(PayoutSchedule.SINGLETON_ID)
            .orElseGet(() -> {
                Instant now = clock.instant();
                PayoutSchedule schedule = new PayoutSchedule(properties.getDefaultCron(), false, now);
                schedule.setNextRunAt(CronSchedules.next(schedule.getCronExpression(), now, clock.getZone()));
                return scheduleRepository.save(schedule);
            });
    }

    /**
     * Update the cron expression and/or the enabled flag. Null leaves a value unchanged.
     *
     * @throws ValidationException if both are null or the expression does not parse
     */
    @Transactional
    public PayoutSchedule updateSchedule(String cronExpression, Boolean enabled, String updatedBy) {
        if (cronExpression == null && enabled == null) {
            throw new ValidationException("cron_expression or is_enabled required");
        }
        PayoutSchedule schedule = getSchedule();
        Instant now = clock.instant();

        if (cronExpression != null) {
            CronSchedules.parse(cronExpression);
            schedule.setCronExpression(cronExpression.trim());
        }
        if (enabled != null) {
            schedule.setEnabled(enabled);
        }
        schedule.setNextRunAt(CronSchedules.next(schedule.getCronExpression(), now, clock.getZone()));
        schedule.setUpdatedAt(now);
        schedule.setUpdatedBy(updatedBy);
        scheduleRepository.save(schedule);

        log.info("Payout schedule updated by {}: cron='{}', enabled={}, nextRunAt={}",
            updatedBy, schedule.getCronExpression(), schedule.isEnabled(), schedule.getNextRunAt());
        return schedule;
    }

    /**
     * Whether an enabled schedule has reached its next fire time.
     */
    @Transactional
    public boolean isDue() {
        PayoutSchedule schedule = getSchedule();
        return schedule.isEnabled()
            && schedule.getNextRunAt() != null
            && !clock.instant().isBefore(schedule.getNextRunAt());
    }

    /**
     * Record a finished batch run and advance the next fire time.
     */
    @Transactional
    public PayoutSchedule recordRun(Instant finishedAt) {
        PayoutSchedule schedule = getSchedule();
        schedule.setLastRunAt(finishedAt);
        schedule.setNextRunAt(CronSchedules.next(schedule.getCronExpression(), finishedAt, clock.getZone()));
        scheduleRepository.save(schedule);
        log.info("Payout schedule: lastRunAt={}, nextRunAt={}", finishedAt, schedule.getNextRunAt());
        return schedule;
    }
}

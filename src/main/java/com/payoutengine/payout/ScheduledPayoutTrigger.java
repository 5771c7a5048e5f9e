package com.payoutengine.payout;

import com.payoutengine.common.exception.BatchAlreadyRunningException;
import com.payoutengine.common.exception.PayoutEngineException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Starts the batch run when the persisted schedule is due. Checked once a minute.
 */
@Component
@ConditionalOnProperty(prefix = "payout-engine.payouts", name = "trigger-enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ScheduledPayoutTrigger {

    static final String SCHEDULER_USER = "scheduler";

    private final PayoutScheduleService scheduleService;
    private final PayoutScheduler scheduler;

    @Scheduled(cron = "${payout-engine.payouts.trigger-cron:0 * * * * *}")
    public void checkSchedule() {
        if (!scheduleService.isDue()) {
            return;
        }
        try {
            scheduler.runScheduled(SCHEDULER_USER);
        } catch (BatchAlreadyRunningException e) {
            log.info("Scheduled payout run skipped: {}", e.getMessage());
        } catch (PayoutEngineException e) {
            log.error("Scheduled payout run could not start: {}", e.getMessage(), e);
        }
    }
}

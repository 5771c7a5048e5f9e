package com.payoutengine.payout;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Singleton row (id 1) holding the batch payout schedule.
 */
@Entity
@Table(name = "payout_schedule")
@Data
@NoArgsConstructor
public class PayoutSchedule {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id = SINGLETON_ID;

    /**
     * Cron expression as entered, 5 or 6 fields.
     */
    @Column(name = "cron_expression", nullable = false)
    private String cronExpression;

    @Column(name = "is_enabled", nullable = false)
    private boolean enabled;

    /**
     * Completion time of the last batch run. Runs that could not start leave it untouched.
     */
    @Column(name = "last_run_at")
    private Instant lastRunAt;

    @Column(name = "next_run_at")
    private Instant nextRunAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "updated_by")
    private String updatedBy;

    public PayoutSchedule(String cronExpression, boolean enabled, Instant now) {
        this.cronExpression = cronExpression;
        this.enabled = enabled;
        this.updatedAt = now;
    }
}

package com.payoutengine.payout;

import com.payoutengine.common.exception.ValidationException;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Cron parsing for the payout schedule. Accepts classic 5-field expressions
 * (minute precision) as well as Spring's 6-field form with seconds.
 */
public final class CronSchedules {

    private CronSchedules() {
    }

    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ValidationException("cron_expression is required");
        }
        String trimmed = expression.trim();
        int fields = trimmed.split("\\s+").length;
        String normalized;
        if (fields == 5) {
            normalized = "0 " + trimmed;
        } else if (fields == 6) {
            normalized = trimmed;
        } else {
            throw new ValidationException("Invalid cron expression \"" + expression + "\": expected 5 or 6 fields, got " + fields);
        }
        try {
            return CronExpression.parse(normalized);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid cron expression \"" + expression + "\": " + e.getMessage(), e);
        }
    }

    /**
     * First fire time strictly after {@code after}, or null if the expression never fires again.
     */
    public static Instant next(String expression, Instant after, ZoneId zone) {
        ZonedDateTime next = parse(expression).next(after.atZone(zone));
        return next != null ? next.toInstant() : null;
    }
}

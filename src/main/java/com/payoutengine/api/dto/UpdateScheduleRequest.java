package com.payoutengine.api.dto;

import lombok.Data;

@Data
public class UpdateScheduleRequest {

    /**
     * 5-field cron (minute hour day month weekday) or 6-field with seconds.
     */
    private String cronExpression;

    private Boolean enabled;

    private String updatedBy;
}

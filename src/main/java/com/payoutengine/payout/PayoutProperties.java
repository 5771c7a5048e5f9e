package com.payoutengine.payout;

import com.payoutengine.credentials.Layer;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for payout execution.
 */
@Getter
@Setter
@ToString
@Validated
@ConfigurationProperties(prefix = "payout-engine.payouts")
public class PayoutProperties {

    /** Platform layer transfers are sent to: "pre" or "prod". */
    @NotBlank
    private String layer = "pre";

    /** Virtual account payouts are debited from. */
    private String sourceVirtualAccount;

    /** Transfer purpose; receives the period start and end dates. */
    @NotBlank
    private String purposeTemplate = "Payout for vending sales %s - %s";

    /** Beneficiaries settled concurrently in a batch run. */
    @Min(1)
    @Max(8)
    private int batchParallelism = 1;

    /** Cron used when no schedule was saved yet. */
    @NotBlank
    private String defaultCron = "0 0 1 * *";

    /** Whether the schedule is checked automatically. */
    private boolean triggerEnabled = true;

    /** How often the schedule is checked. */
    @NotBlank
    private String triggerCron = "0 * * * * *";

    public Layer targetLayer() {
        return Layer.parse(layer);
    }
}

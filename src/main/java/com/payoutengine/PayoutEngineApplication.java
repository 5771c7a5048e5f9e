package com.payoutengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the Payout Engine.
 *
 * Payout Engine is the boundary layer between the operator console and the
 * nominal-account platform: every platform call goes through a signed,
 * rate-limit-aware gateway, and vending revenue is settled into beneficiary
 * payouts on a schedule, exactly once per billing period.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class PayoutEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(PayoutEngineApplication.class, args);
    }
}

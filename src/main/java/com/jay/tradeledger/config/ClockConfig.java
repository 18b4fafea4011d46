package com.jay.tradeledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Wall clock shared by every ledger. Tests replace it with a fixed clock.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock marketClock(LedgerConfig config) {
        return Clock.system(ZoneId.of(config.market().getZone()));
    }
}

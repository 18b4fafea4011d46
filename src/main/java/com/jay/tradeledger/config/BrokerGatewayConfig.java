package com.jay.tradeledger.config;

import com.jay.tradeledger.broker.AuthRetryingGatewayPostProcessor;
import com.jay.tradeledger.broker.BrokerSession;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Broker wiring. The adapter module contributes the {@link com.jay.tradeledger.broker.BrokerOrderGateway}
 * and {@link BrokerSession} beans; this applies broker.auth_retry_attempts to them.
 */
@Configuration
public class BrokerGatewayConfig {

    // static: post-processors are created before the regular beans they wrap
    @Bean
    public static AuthRetryingGatewayPostProcessor authRetryingGatewayPostProcessor(
            ObjectProvider<BrokerSession> sessions, ObjectProvider<LedgerConfig> config) {
        return new AuthRetryingGatewayPostProcessor(sessions, config);
    }
}

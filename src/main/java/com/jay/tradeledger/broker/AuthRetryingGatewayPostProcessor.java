package com.jay.tradeledger.broker;

import com.jay.tradeledger.config.LedgerConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.config.BeanPostProcessor;

/**
 * Wraps the broker adapter's {@link BrokerOrderGateway} bean in an {@link AuthRetryingBrokerGateway},
 * so every modify and cancel sent by the ledger goes through the session-refresh retry.
 *
 * The session is the adapter bean itself when it implements {@link BrokerSession}, otherwise the
 * {@link BrokerSession} bean. Without either, the gateway is left as it is.
 * When no gateway bean exists at all nothing is wrapped and the premarket adjuster stays in paper mode.
 */
@Slf4j
@RequiredArgsConstructor
public class AuthRetryingGatewayPostProcessor implements BeanPostProcessor {

    private final ObjectProvider<BrokerSession> sessions;
    private final ObjectProvider<LedgerConfig> config;

    @Override
    public Object postProcessAfterInitialization(Object bean, String beanName) {
        if (!(bean instanceof BrokerOrderGateway gateway) || bean instanceof AuthRetryingBrokerGateway) {
            return bean;
        }
        BrokerSession session = bean instanceof BrokerSession self ? self : sessions.getIfAvailable();
        if (session == null) {
            log.warn("Broker gateway '{}' has no BrokerSession — expired sessions will not be refreshed", beanName);
            return bean;
        }
        int attempts = config.getObject().broker().getAuthRetryAttempts();
        log.info("Broker gateway '{}' wrapped with session refresh ({} retr{})", beanName, attempts,
            attempts == 1 ? "y" : "ies");
        return new AuthRetryingBrokerGateway(gateway, session, attempts);
    }
}

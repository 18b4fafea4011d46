package com.jay.tradeledger.broker;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Retries a broker call after refreshing the session when it fails with AUTH_EXPIRED.
 * Other errors are returned as they are.
 *
 * The refresh lock belongs to this gateway. Callers that hit an expired session at the same
 * time refresh once: whoever gets the lock second sees a newer session generation and just retries.
 */
@Slf4j
public class AuthRetryingBrokerGateway implements BrokerOrderGateway {

    private final BrokerOrderGateway delegate;
    private final BrokerSession session;
    private final int maxAuthRetries;
    private final ReentrantLock refreshLock = new ReentrantLock();

    public AuthRetryingBrokerGateway(BrokerOrderGateway delegate, BrokerSession session, int maxAuthRetries) {
        this.delegate = delegate;
        this.session = session;
        this.maxAuthRetries = Math.max(0, maxAuthRetries);
    }

    @Override
    public BrokerResult<Void> modifyOrder(String brokerOrderId, String symbol, int quantity, Double price) {
        return call("modifyOrder " + brokerOrderId, () -> delegate.modifyOrder(brokerOrderId, symbol, quantity, price));
    }

    @Override
    public BrokerResult<Void> cancelOrder(String brokerOrderId) {
        return call("cancelOrder " + brokerOrderId, () -> delegate.cancelOrder(brokerOrderId));
    }

    private <T> BrokerResult<T> call(String operation, Supplier<BrokerResult<T>> request) {
        long generation = session.generation();
        BrokerResult<T> result = request.get();

        for (int attempt = 1; result.isAuthExpired() && attempt <= maxAuthRetries; attempt++) {
            log.warn("{} failed with expired session — refreshing (attempt {}/{})", operation, attempt, maxAuthRetries);
            if (!refreshIfStale(generation)) {
                log.error("{}: broker session refresh failed", operation);
                return result;
            }
            generation = session.generation();
            result = request.get();
        }
        return result;
    }

    private boolean refreshIfStale(long seenGeneration) {
        refreshLock.lock();
        try {
            if (session.generation() != seenGeneration) {
                return true;
            }
            return session.refresh();
        } finally {
            refreshLock.unlock();
        }
    }
}

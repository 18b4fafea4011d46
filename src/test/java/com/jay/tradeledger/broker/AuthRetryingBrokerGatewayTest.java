package com.jay.tradeledger.broker;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AuthRetryingBrokerGatewayTest {

    private static final BrokerResult<Void> EXPIRED = BrokerResult.err(ApiError.authExpired("session expired"));

    private BrokerOrderGateway delegate;
    private CountingSession session;

    @BeforeEach
    void setUp() {
        delegate = mock(BrokerOrderGateway.class);
        session = new CountingSession(true);
    }

    @Test
    void retriesOnceAfterRefresh() {
        when(delegate.cancelOrder("B-1")).thenReturn(EXPIRED, BrokerResult.ok(null));
        AuthRetryingBrokerGateway gateway = new AuthRetryingBrokerGateway(delegate, session, 1);

        BrokerResult<Void> result = gateway.cancelOrder("B-1");

        assertThat(result.isOk()).isTrue();
        assertThat(session.refreshes).isEqualTo(1);
        verify(delegate, times(2)).cancelOrder("B-1");
    }

    @Test
    void givesUpAfterConfiguredAttempts() {
        when(delegate.modifyOrder("B-1", "TCS", 10, 3500.0)).thenReturn(EXPIRED);
        AuthRetryingBrokerGateway gateway = new AuthRetryingBrokerGateway(delegate, session, 1);

        BrokerResult<Void> result = gateway.modifyOrder("B-1", "TCS", 10, 3500.0);

        assertThat(result.isAuthExpired()).isTrue();
        verify(delegate, times(2)).modifyOrder("B-1", "TCS", 10, 3500.0);
    }

    @Test
    void otherErrorsAreNotRetried() {
        when(delegate.cancelOrder("B-1")).thenReturn(BrokerResult.err(ApiError.rejected("RMS", "already executed")));
        AuthRetryingBrokerGateway gateway = new AuthRetryingBrokerGateway(delegate, session, 1);

        BrokerResult<Void> result = gateway.cancelOrder("B-1");

        assertThat(result.error()).hasValueSatisfying(e -> assertThat(e.kind()).isEqualTo(ApiError.Kind.REJECTED));
        assertThat(session.refreshes).isZero();
        verify(delegate, times(1)).cancelOrder("B-1");
    }

    @Test
    void failedRefreshStopsRetrying() {
        CountingSession broken = new CountingSession(false);
        when(delegate.cancelOrder("B-1")).thenReturn(EXPIRED);
        AuthRetryingBrokerGateway gateway = new AuthRetryingBrokerGateway(delegate, broken, 3);

        BrokerResult<Void> result = gateway.cancelOrder("B-1");

        assertThat(result.isAuthExpired()).isTrue();
        assertThat(broken.refreshes).isEqualTo(1);
        verify(delegate, times(1)).cancelOrder("B-1");
    }

    @Test
    void sessionRefreshedElsewhereIsNotRefreshedAgain() {
        when(delegate.cancelOrder("B-1")).thenAnswer(inv -> {
            if (session.generation() == 0) {
                session.bump();
                return EXPIRED;
            }
            return BrokerResult.ok(null);
        });
        AuthRetryingBrokerGateway gateway = new AuthRetryingBrokerGateway(delegate, session, 1);

        BrokerResult<Void> result = gateway.cancelOrder("B-1");

        assertThat(result.isOk()).isTrue();
        assertThat(session.refreshes).isZero();
    }

    @Test
    void zeroAttemptsDisablesRetry() {
        when(delegate.cancelOrder("B-1")).thenReturn(EXPIRED);
        AuthRetryingBrokerGateway gateway = new AuthRetryingBrokerGateway(delegate, session, 0);

        gateway.cancelOrder("B-1");

        assertThat(session.refreshes).isZero();
        verify(delegate, times(1)).cancelOrder("B-1");
        verify(delegate, never()).modifyOrder("B-1", "TCS", 1, null);
    }

    private static final class CountingSession implements BrokerSession {
        private final boolean succeeds;
        private final AtomicLong generation = new AtomicLong();
        private int refreshes;

        CountingSession(boolean succeeds) {
            this.succeeds = succeeds;
        }

        @Override
        public boolean refresh() {
            refreshes++;
            if (succeeds) generation.incrementAndGet();
            return succeeds;
        }

        @Override
        public long generation() {
            return generation.get();
        }

        void bump() {
            generation.incrementAndGet();
        }
    }
}

package com.jay.tradeledger.broker;

/** The authenticated broker session behind a {@link BrokerOrderGateway}. */
public interface BrokerSession {

    /**
     * Re-authenticates against the broker.
     *
     * @return true when a fresh session is in place
     */
    boolean refresh();

    /** Incremented on every successful refresh. */
    long generation();
}

package com.jay.tradeledger.model.enums;

/** Result of an order state-machine transition. */
public enum TransitionOutcome {
    APPLIED,
    UNCHANGED,  // same transition re-applied
    ILLEGAL     // transition not defined from the current state, order left as is
}

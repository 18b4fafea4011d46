package com.jay.tradeledger.model;

import com.jay.tradeledger.entity.Signal;
import com.jay.tradeledger.model.enums.SignalStatus;

/** A signal as one user sees it: their own override if any, else the base status. */
public record SignalView(Signal signal, SignalStatus effectiveStatus) {}

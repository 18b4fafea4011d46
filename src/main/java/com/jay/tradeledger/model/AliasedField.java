package com.jay.tradeledger.model;

import java.util.List;

/** A logical field of an external payload and the keys it may arrive under, in priority order. */
public interface AliasedField {
    List<String> aliases();
}

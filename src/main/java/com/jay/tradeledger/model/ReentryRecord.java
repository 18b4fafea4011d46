package com.jay.tradeledger.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

/** One re-entry fill folded into a position. */
public record ReentryRecord(
    @JsonProperty("qty") int qty,
    @JsonProperty("level") Integer level,
    @JsonProperty("indicator_value") Double indicatorValue,
    @JsonProperty("price") double price,
    @JsonProperty("time") LocalDateTime time
) {}

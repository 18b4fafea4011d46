package com.jay.tradeledger.entity;

import com.jay.tradeledger.entity.converter.IndicatorMapConverter;
import com.jay.tradeledger.model.enums.SignalStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A recommendation for one symbol at one point in time. Not user-scoped.
 * The current signal of a symbol is its row with the greatest {@code ts}.
 */
@Entity
@Table(name = "signals", indexes = @Index(name = "ix_signals_symbol_ts", columnList = "symbol, ts"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Signal {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 32)
    private String symbol;

    @Column(length = 32)
    private String verdict;

    @Column(length = 32)
    private String finalVerdict;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SignalStatus status;

    @Column(nullable = false)
    private LocalDateTime ts;

    // Opaque analysis attributes (rsi10, ema9, ema200, confidence, ...)
    @Builder.Default
    @Convert(converter = IndicatorMapConverter.class)
    @Column(length = 8000)
    private Map<String, Object> indicators = new LinkedHashMap<>();
}

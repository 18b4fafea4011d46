package com.jay.tradeledger.layer2_signal;

import com.jay.tradeledger.config.LedgerConfig;
import com.jay.tradeledger.entity.Position;
import com.jay.tradeledger.entity.Signal;
import com.jay.tradeledger.layer1_clock.TradingWindowClock;
import com.jay.tradeledger.layer3_order.OrderLedger;
import com.jay.tradeledger.layer4_position.PositionAggregator;
import com.jay.tradeledger.model.ReconcileResult;
import com.jay.tradeledger.model.SignalPayload;
import com.jay.tradeledger.model.TradingDayWindow;
import com.jay.tradeledger.model.enums.SignalStatus;
import com.jay.tradeledger.repository.SignalRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Layer 2: Signal Ledger.
 * Deduplicates each batch of recommendations from the analysis pipeline against the
 * stored signals and runs the signal status machine.
 *
 * For every payload the current row of its symbol (greatest ts, any status) decides:
 *   none             : insert ACTIVE if buy-class, else skip
 *   ACTIVE           : both buy-class, update in place; only the new one, expire and insert;
 *                      new one not buy-class, expire
 *   REJECTED/EXPIRED : insert a clean ACTIVE row if buy-class, else skip
 *   TRADED           : skip if the user still holds it and the verdict is buy-class, else insert
 * Afterwards every ACTIVE row whose symbol was not in the batch is expired.
 *
 * At most one ACTIVE row exists per symbol after every call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignalLedger {

    private final SignalRepository signalRepo;
    private final OrderLedger orderLedger;
    private final PositionAggregator positionAggregator;
    private final TradingWindowClock clock;
    private final LedgerConfig config;

    /**
     * Applies one batch atomically.
     *
     * @param userId   user whose holdings decide the TRADED branch; may be null
     * @param skipGate true when the caller already validated the timing
     */
    @Transactional
    public ReconcileResult reconcile(List<SignalPayload> newSignals, Long userId, boolean skipGate) {
        if (!skipGate && !clock.maySyncNow()) {
            log.info("Signal sync not allowed now (market hours or non-trading day) — {} payloads skipped",
                newSignals.size());
            return ReconcileResult.gated(newSignals.size());
        }

        Counters counters = new Counters();
        Set<String> seenSymbols = new HashSet<>();
        LocalDateTime now = clock.now();

        for (SignalPayload payload : newSignals) {
            Optional<String> symbol = payload.symbol(config.signals().getTickerSuffixes());
            if (symbol.isEmpty()) {
                log.warn("Signal payload without symbol skipped: {}", payload);
                counters.skipped++;
                continue;
            }
            seenSymbols.add(symbol.get());
            apply(symbol.get(), payload, userId, now, counters);
        }

        counters.expired += expireUnlisted(seenSymbols);

        ReconcileResult result = new ReconcileResult(counters.inserted, counters.updated, counters.skipped,
            counters.expired);
        log.info("Signal reconcile for {} payloads (user {}): {}", newSignals.size(), userId, result);
        return result;
    }

    private void apply(String symbol, SignalPayload payload, Long userId, LocalDateTime now, Counters counters) {
        boolean buyClass = isBuyClass(payload);
        Optional<Signal> current = signalRepo.findFirstBySymbolOrderByTsDescIdDesc(symbol);

        if (current.isEmpty()) {
            if (buyClass) {
                insert(symbol, payload, now);
                counters.inserted++;
            } else {
                counters.skipped++;
            }
            return;
        }

        Signal existing = current.get();
        switch (existing.getStatus()) {
            case ACTIVE -> {
                boolean existingBuy = config.signals().isBuyClass(effectiveVerdict(existing));
                if (buyClass && existingBuy) {
                    // Refreshed even if this user already traded it; other users still read the base row
                    updateInPlace(existing, payload, now);
                    counters.updated++;
                } else if (buyClass) {
                    expire(existing);
                    insert(symbol, payload, after(existing, now));
                    counters.expired++;
                    counters.inserted++;
                } else {
                    expire(existing);
                    counters.expired++;
                    counters.skipped++;
                }
            }
            case REJECTED, EXPIRED -> {
                if (buyClass) {
                    insert(symbol, payload, after(existing, now));
                    counters.inserted++;
                } else {
                    counters.skipped++;
                }
            }
            case TRADED -> {
                if (buyClass && userHoldsPosition(userId, symbol)) {
                    log.debug("{} still held by user {} — no new signal", symbol, userId);
                    counters.skipped++;
                } else {
                    // The prior trade is no longer open, the symbol can be recommended again
                    insert(symbol, payload, after(existing, now));
                    counters.inserted++;
                }
            }
        }
    }

    /** Expires ACTIVE rows the analysis engine no longer flags. */
    private int expireUnlisted(Set<String> seenSymbols) {
        int expired = 0;
        for (Signal active : signalRepo.findByStatus(SignalStatus.ACTIVE)) {
            if (!seenSymbols.contains(active.getSymbol())) {
                expire(active);
                expired++;
            }
        }
        return expired;
    }

    private boolean userHoldsPosition(Long userId, String symbol) {
        if (userId == null) return false;
        return orderLedger.hasOngoingBuy(userId, symbol)
            && positionAggregator.latestPosition(userId, symbol).map(Position::isOpen).orElse(false);
    }

    // ── Reads ─────────────────────────────────────────────────────────────────

    @Transactional(readOnly = true)
    public Optional<Signal> current(String symbol) {
        return signalRepo.findFirstBySymbolOrderByTsDescIdDesc(symbol);
    }

    @Transactional(readOnly = true)
    public List<Signal> recent(int limit, boolean activeOnly) {
        PageRequest page = PageRequest.of(0, limit);
        return activeOnly
            ? signalRepo.findByStatusOrderByTsDesc(SignalStatus.ACTIVE, page)
            : signalRepo.findAllByOrderByTsDesc(page);
    }

    @Transactional(readOnly = true)
    public List<Signal> byDate(LocalDate date, int limit) {
        return signalRepo.findByTsGreaterThanEqualAndTsLessThanOrderByTsDesc(
            date.atStartOfDay(), date.plusDays(1).atStartOfDay(), PageRequest.of(0, limit));
    }

    /** Signals generated within the current trading-day window. */
    @Transactional(readOnly = true)
    public List<Signal> currentTradingDay(int limit) {
        TradingDayWindow window = clock.tradingDayWindow();
        return signalRepo.findByTsGreaterThanEqualAndTsLessThanOrderByTsDesc(
            window.start(), window.end(), PageRequest.of(0, limit));
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private boolean isBuyClass(SignalPayload payload) {
        return payload.verdict().map(v -> config.signals().isBuyClass(v)).orElse(false);
    }

    private static String effectiveVerdict(Signal signal) {
        return signal.getFinalVerdict() != null ? signal.getFinalVerdict() : signal.getVerdict();
    }

    private void insert(String symbol, SignalPayload payload, LocalDateTime now) {
        Signal signal = Signal.builder()
            .symbol(symbol)
            .verdict(payload.rawVerdict().orElse(payload.verdict().orElse(null)))
            .finalVerdict(payload.rawFinalVerdict().orElse(null))
            .status(SignalStatus.ACTIVE)
            .ts(now)
            .indicators(payload.indicators())
            .build();
        signalRepo.save(signal);
        log.debug("Inserted ACTIVE signal for {} ({})", symbol, effectiveVerdict(signal));
    }

    private void updateInPlace(Signal signal, SignalPayload payload, LocalDateTime now) {
        Map<String, Object> merged = new LinkedHashMap<>(signal.getIndicators());
        merged.putAll(payload.indicators());
        signal.setIndicators(merged);
        payload.rawVerdict().ifPresent(signal::setVerdict);
        // A final verdict missing from the payload is cleared
        signal.setFinalVerdict(payload.rawFinalVerdict().orElse(null));
        signal.setTs(after(signal, now));
        signalRepo.save(signal);
    }

    /** A ts strictly newer than the given row, so the new state becomes the current one. */
    private static LocalDateTime after(Signal signal, LocalDateTime now) {
        return now.isAfter(signal.getTs()) ? now : signal.getTs().plusNanos(1000);
    }

    private void expire(Signal signal) {
        signal.setStatus(SignalStatus.EXPIRED);
        signalRepo.save(signal);
        log.debug("Expired signal #{} for {}", signal.getId(), signal.getSymbol());
    }

    private static final class Counters {
        int inserted;
        int updated;
        int skipped;
        int expired;
    }
}

package com.jay.tradeledger.layer4_position;

import com.jay.tradeledger.entity.Position;
import com.jay.tradeledger.exception.PositionNotFoundException;
import com.jay.tradeledger.layer1_clock.TradingWindowClock;
import com.jay.tradeledger.model.InitialEntryMetadata;
import com.jay.tradeledger.model.OrderMetadata;
import com.jay.tradeledger.model.ReentryMetadata;
import com.jay.tradeledger.model.ReentryRecord;
import com.jay.tradeledger.model.enums.EntryType;
import com.jay.tradeledger.repository.PositionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Layer 4: Position Aggregator.
 * Folds executed buy and sell quantity into one holding per (user, symbol).
 *
 * Rules:
 * - First buy opens a position; initial entry price and entry indicator are set once
 * - A buy into an open position is a re-entry: weighted average, re-entry history appended
 * - Quantity never goes below zero; closedAt is set exactly when it reaches zero
 * - A buy into a fully closed symbol opens a fresh row
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PositionAggregator {

    private final PositionRepository positionRepo;
    private final TradingWindowClock clock;

    /**
     * Applies an executed buy.
     *
     * @param entryType INITIAL, REENTRY or null (inferred from whether a position is open)
     * @param meta      order metadata of the fill, may be null
     */
    @Transactional
    public Position applyFill(Long userId, String symbol, int executedQty, double executedPrice,
                              EntryType entryType, OrderMetadata meta) {
        if (executedQty <= 0) {
            throw new IllegalArgumentException("Executed quantity must be positive, got " + executedQty);
        }
        if (executedPrice <= 0) {
            throw new IllegalArgumentException("Executed price must be positive, got " + executedPrice);
        }

        Optional<Position> open = openPosition(userId, symbol);
        if (open.isEmpty()) {
            if (entryType == EntryType.REENTRY) {
                log.warn("Re-entry fill for {} (user {}) with no open position — opening a new one",
                    symbol, userId);
            }
            return positionRepo.save(newPosition(userId, symbol, executedQty, executedPrice, meta));
        }

        Position position = open.get();
        int oldQty = position.getQuantity();
        double oldAvg = position.getAvgPrice();
        int newQty = oldQty + executedQty;
        position.setAvgPrice((oldQty * oldAvg + executedQty * executedPrice) / newQty);
        position.setQuantity(newQty);

        if (position.getEntryIndicator() == null && meta != null) {
            position.setEntryIndicator(meta.indicator());
        }

        if (entryType == EntryType.INITIAL) {
            // Not expected in steady state: an initial order should never fill into an open position
            log.warn("Initial-entry fill for {} (user {}) while a position is open — qty {} -> {}, " +
                "no re-entry bookkeeping", symbol, userId, oldQty, newQty);
            return positionRepo.save(position);
        }

        ReentryMetadata reentry = meta instanceof ReentryMetadata r ? r : null;
        List<ReentryRecord> reentries = new ArrayList<>(position.getReentries());
        reentries.add(new ReentryRecord(
            executedQty,
            reentry != null ? reentry.level() : null,
            meta != null ? meta.indicator() : null,
            executedPrice,
            clock.now()));
        position.setReentries(reentries);
        position.setReentryCount(position.getReentryCount() + 1);
        position.setLastReentryPrice(executedPrice);

        log.info("Re-entry #{} into {} (user {}): qty {} -> {}, avg ₹{} -> ₹{}",
            position.getReentryCount(), symbol, userId, oldQty, newQty,
            String.format("%.2f", oldAvg), String.format("%.2f", position.getAvgPrice()));
        return positionRepo.save(position);
    }

    /**
     * Applies an executed sell. Partial sells leave the position open; a sell that brings
     * the quantity to zero (or would take it below) closes it.
     */
    @Transactional
    public Position applySell(Long userId, String symbol, int soldQty) {
        if (soldQty <= 0) {
            throw new IllegalArgumentException("Sold quantity must be positive, got " + soldQty);
        }
        Position position = openPosition(userId, symbol)
            .orElseThrow(() -> new PositionNotFoundException(userId, symbol));

        int remaining = Math.max(0, position.getQuantity() - soldQty);
        if (soldQty > position.getQuantity()) {
            log.warn("Sell of {} {} exceeds held quantity {} (user {}) — clamping at zero",
                soldQty, symbol, position.getQuantity(), userId);
        }
        position.setQuantity(remaining);
        if (remaining == 0) {
            position.setClosedAt(clock.now());
            log.info("Position closed: {} (user {})", symbol, userId);
        } else {
            log.info("Partial sell of {} {} (user {}), {} remaining", soldQty, symbol, userId, remaining);
        }
        return positionRepo.save(position);
    }

    /** Full manual exit, independent of fill accounting. */
    @Transactional
    public Position markClosed(Long userId, String symbol) {
        Position position = openPosition(userId, symbol)
            .orElseThrow(() -> new PositionNotFoundException(userId, symbol));
        position.setQuantity(0);
        position.setClosedAt(clock.now());
        log.info("Position force-closed: {} (user {})", symbol, userId);
        return positionRepo.save(position);
    }

    @Transactional(readOnly = true)
    public Optional<Position> openPosition(Long userId, String symbol) {
        return positionRepo.findFirstByUserIdAndSymbolAndClosedAtIsNullOrderByIdDesc(userId, symbol);
    }

    /** Most recent position for (user, symbol), open or closed. */
    @Transactional(readOnly = true)
    public Optional<Position> latestPosition(Long userId, String symbol) {
        return positionRepo.findFirstByUserIdAndSymbolOrderByIdDesc(userId, symbol);
    }

    @Transactional(readOnly = true)
    public List<Position> openPositions(Long userId) {
        return positionRepo.findByUserIdAndClosedAtIsNullOrderBySymbolAsc(userId);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private Position newPosition(Long userId, String symbol, int qty, double price, OrderMetadata meta) {
        Double initialEntryPrice = price;
        if (meta instanceof InitialEntryMetadata initial && initial.initialEntryPrice() != null) {
            initialEntryPrice = initial.initialEntryPrice();
        }
        LocalDateTime now = clock.now();
        log.info("Opened position: {} (user {}) qty={} @ ₹{}", symbol, userId, qty, String.format("%.2f", price));
        return Position.builder()
            .userId(userId)
            .symbol(symbol)
            .quantity(qty)
            .avgPrice(price)
            .openedAt(now)
            .initialEntryPrice(initialEntryPrice)
            .entryIndicator(meta != null ? meta.indicator() : null)
            .reentryCount(0)
            .reentries(new ArrayList<>())
            .build();
    }
}

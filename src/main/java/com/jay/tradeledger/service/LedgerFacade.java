package com.jay.tradeledger.service;

import com.jay.tradeledger.broker.OrderUpdateTranslator;
import com.jay.tradeledger.entity.Position;
import com.jay.tradeledger.entity.TradeOrder;
import com.jay.tradeledger.exception.LedgerException;
import com.jay.tradeledger.exception.LedgerStorageException;
import com.jay.tradeledger.layer2_signal.SignalLedger;
import com.jay.tradeledger.layer2_signal.UserSignalLedger;
import com.jay.tradeledger.layer3_order.OrderLedger;
import com.jay.tradeledger.layer4_position.PositionAggregator;
import com.jay.tradeledger.layer5_premarket.CapitalSource;
import com.jay.tradeledger.layer5_premarket.PremarketAdjuster;
import com.jay.tradeledger.layer5_premarket.PriceSource;
import com.jay.tradeledger.model.AdjustmentResult;
import com.jay.tradeledger.model.OrderUpdateSummary;
import com.jay.tradeledger.model.ReconcileResult;
import com.jay.tradeledger.model.SignalPayload;
import com.jay.tradeledger.model.SignalView;
import com.jay.tradeledger.model.enums.SignalStatus;
import com.jay.tradeledger.model.enums.TransitionOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Entry point for the scheduler, broker adapter and REST layer.
 * Each call delegates to one transactional ledger operation; a storage failure surfaces as
 * a retriable {@link LedgerStorageException} with nothing applied.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerFacade {

    private final SignalLedger signalLedger;
    private final UserSignalLedger userSignalLedger;
    private final OrderLedger orderLedger;
    private final PositionAggregator positionAggregator;
    private final OrderUpdateTranslator orderUpdateTranslator;
    private final PremarketAdjuster premarketAdjuster;

    // ── Signals ───────────────────────────────────────────────────────────────

    public ReconcileResult reconcileSignals(List<Map<String, Object>> payloads, Long userId, boolean skipGate) {
        List<SignalPayload> batch = payloads.stream().map(SignalPayload::of).toList();
        return storage("reconcile", () -> signalLedger.reconcile(batch, userId, skipGate));
    }

    public boolean markSignalTraded(String symbol, Long userId) {
        return storage("markTraded " + symbol, () -> userSignalLedger.markTraded(symbol, userId));
    }

    public boolean markSignalRejected(String symbol, Long userId) {
        return storage("markRejected " + symbol, () -> userSignalLedger.markRejected(symbol, userId));
    }

    public boolean reactivateSignal(String symbol, Long userId) {
        return storage("reactivate " + symbol, () -> userSignalLedger.reactivate(symbol, userId));
    }

    public List<SignalView> signals(Long userId, int limit, SignalStatus status) {
        if (userId != null) {
            return storage("signalsForUser", () -> userSignalLedger.signalsForUser(userId, limit, status));
        }
        return storage("recentSignals", () -> signalLedger.recent(limit, status == SignalStatus.ACTIVE).stream()
            .filter(s -> status == null || s.getStatus() == status)
            .map(s -> new SignalView(s, s.getStatus()))
            .toList());
    }

    // ── Orders ────────────────────────────────────────────────────────────────

    /**
     * Applies broker callbacks one transaction each, so one bad update does not hold back the
     * rest. Malformed updates and unknown order ids are skipped and counted.
     */
    public OrderUpdateSummary applyOrderUpdates(List<Map<String, Object>> updates) {
        int applied = 0, unchanged = 0, illegal = 0, skipped = 0;
        for (Map<String, Object> update : updates) {
            TransitionOutcome outcome;
            try {
                outcome = storage("orderUpdate", () -> orderUpdateTranslator.apply(update));
            } catch (LedgerStorageException e) {
                throw e;
            } catch (IllegalArgumentException | LedgerException e) {
                log.warn("Broker update skipped: {}", e.getMessage());
                skipped++;
                continue;
            }
            switch (outcome) {
                case APPLIED -> applied++;
                case UNCHANGED -> unchanged++;
                case ILLEGAL -> illegal++;
            }
        }
        OrderUpdateSummary summary = new OrderUpdateSummary(applied, unchanged, illegal, skipped);
        log.info("Broker order updates processed: {}", summary);
        return summary;
    }

    public List<TradeOrder> pendingOrders(Long userId) {
        return storage("findPending", () -> orderLedger.findPending(userId));
    }

    public AdjustmentResult adjustPremarket(PriceSource prices, CapitalSource capital) {
        return storage("adjustPending", () -> premarketAdjuster.adjustAllPending(prices, capital));
    }

    // ── Positions ─────────────────────────────────────────────────────────────

    public List<Position> openPositions(Long userId) {
        return storage("openPositions", () -> positionAggregator.openPositions(userId));
    }

    private <T> T storage(String operation, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataAccessException | TransactionException e) {
            log.error("{} failed in storage, rolled back: {}", operation, e.getMessage());
            throw new LedgerStorageException(operation, e);
        }
    }
}

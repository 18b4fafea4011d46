package com.jay.tradeledger.layer5_premarket;

import com.jay.tradeledger.broker.BrokerOrderGateway;
import com.jay.tradeledger.broker.BrokerResult;
import com.jay.tradeledger.config.LedgerConfig;
import com.jay.tradeledger.entity.Position;
import com.jay.tradeledger.entity.TradeOrder;
import com.jay.tradeledger.layer3_order.OrderLedger;
import com.jay.tradeledger.layer4_position.PositionAggregator;
import com.jay.tradeledger.model.AdjustmentResult;
import com.jay.tradeledger.model.enums.EntryType;
import com.jay.tradeledger.model.enums.OrderStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Layer 5: Premarket Adjuster.
 * Runs before the open over the pending (AMO) orders:
 *   re-entry order whose position has closed since placement : cancelled ("position closed")
 *   otherwise                                                : quantity resized to floor(capital / LTP)
 *
 * Without a broker gateway bean the ledger is updated directly (paper mode).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PremarketAdjuster {

    static final String POSITION_CLOSED = "position closed";

    private final OrderLedger orderLedger;
    private final PositionAggregator positionAggregator;
    private final LedgerConfig config;
    private final Optional<BrokerOrderGateway> gateway;

    /** Adjusts every pending order of every user. */
    @Transactional
    public AdjustmentResult adjustAllPending(PriceSource prices, CapitalSource capital) {
        return adjustPending(orderLedger.findPending(null), prices, capital);
    }

    @Transactional
    public AdjustmentResult adjustPending(List<TradeOrder> pendingOrders, PriceSource prices, CapitalSource capital) {
        Tally tally = new Tally();

        for (TradeOrder order : pendingOrders) {
            if (order.getStatus() != OrderStatus.PENDING) {
                log.debug("Order #{} is {} — not adjusted", order.getId(), order.getStatus());
                continue;
            }
            tally.total++;

            if (order.getEntryType() == EntryType.REENTRY && positionClosed(order)) {
                cancel(order, tally);
                continue;
            }

            Optional<Double> price = currentPrice(prices, order.getSymbol());
            if (price.isEmpty()) {
                tally.priceUnavailable++;
                continue;
            }
            resize(order, price.get(), capital.capitalFor(order), tally);
        }

        AdjustmentResult result = new AdjustmentResult(tally.total, tally.adjusted, tally.cancelled,
            tally.unchanged, tally.priceUnavailable, tally.failed);
        log.info("Premarket adjustment: {}", result);
        return result;
    }

    /** Quantity the capital buys at the given price, never below the configured minimum. */
    int targetQuantity(double capital, double price) {
        int affordable = (int) Math.floor(capital / price);
        return Math.max(config.premarket().getMinQuantity(), affordable);
    }

    private boolean positionClosed(TradeOrder order) {
        Optional<Position> latest = positionAggregator.latestPosition(order.getUserId(), order.getSymbol());
        if (latest.isEmpty()) {
            log.warn("Re-entry order #{} for {} has no position on record — resizing as usual",
                order.getId(), order.getSymbol());
            return false;
        }
        return !latest.get().isOpen();
    }

    private void cancel(TradeOrder order, Tally tally) {
        if (gateway.isPresent() && order.getBrokerOrderId() != null) {
            BrokerResult<Void> result = gateway.get().cancelOrder(order.getBrokerOrderId());
            if (!result.isOk()) {
                log.error("Cancel of re-entry order #{} {} failed at broker: {}", order.getId(),
                    order.getSymbol(), result.error().orElse(null));
                tally.failed++;
                return;
            }
        }
        orderLedger.markCancelled(order.getId(), POSITION_CLOSED);
        log.info("Re-entry order #{} {} cancelled — position closed", order.getId(), order.getSymbol());
        tally.cancelled++;
    }

    private void resize(TradeOrder order, double price, double capital, Tally tally) {
        int newQty = targetQuantity(capital, price);
        if (newQty == order.getQuantity()) {
            tally.unchanged++;
            return;
        }

        if (gateway.isPresent() && order.getBrokerOrderId() != null) {
            BrokerResult<Void> result = gateway.get().modifyOrder(order.getBrokerOrderId(), order.getSymbol(),
                newQty, price);
            if (!result.isOk()) {
                log.error("Modify of order #{} {} to qty {} failed at broker: {}", order.getId(),
                    order.getSymbol(), newQty, result.error().orElse(null));
                tally.failed++;
                return;
            }
        } else {
            log.info("[PAPER] Order #{} {} resized locally only", order.getId(), order.getSymbol());
        }
        orderLedger.updateQuantity(order.getId(), newQty, price);
        tally.adjusted++;
    }

    private Optional<Double> currentPrice(PriceSource prices, String symbol) {
        try {
            Optional<Double> price = prices.priceOf(symbol);
            if (price == null) price = Optional.empty();
            if (price.isEmpty() || price.get() <= 0) {
                log.warn("No premarket price for {} — order left unchanged", symbol);
                return Optional.empty();
            }
            return price;
        } catch (RuntimeException e) {
            log.warn("Premarket price lookup for {} failed: {} — order left unchanged", symbol, e.getMessage());
            return Optional.empty();
        }
    }

    private static final class Tally {
        int total;
        int adjusted;
        int cancelled;
        int unchanged;
        int priceUnavailable;
        int failed;
    }
}

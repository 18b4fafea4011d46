package com.jay.tradeledger.broker;

import com.jay.tradeledger.entity.TradeOrder;
import com.jay.tradeledger.layer3_order.OrderLedger;
import com.jay.tradeledger.model.enums.TransitionOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Turns broker order callbacks into {@link OrderLedger} transitions.
 * Open and partially filled orders are left alone until the broker reports a final state.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderUpdateTranslator {

    private final OrderLedger orderLedger;

    @Transactional
    public TransitionOutcome apply(Map<String, ?> rawUpdate) {
        return apply(BrokerOrderUpdate.from(rawUpdate));
    }

    @Transactional
    public TransitionOutcome apply(BrokerOrderUpdate update) {
        TradeOrder order = orderLedger.getByBrokerOrderId(update.brokerOrderId());

        return switch (update.state()) {
            case EXECUTED -> executed(order, update);
            case REJECTED -> orderLedger.markRejected(order.getId(),
                update.reasonText().orElse("rejected by broker"));
            case CANCELLED -> orderLedger.markCancelled(order.getId(),
                update.reasonText().orElse("cancelled at broker"));
            case FAILED -> {
                String reason = update.reasonText().orElse(update.rawStatus());
                yield orderLedger.markFailed(order.getId(), reason, ApiError.fromReason(reason).isRetriable(), null);
            }
            case OPEN, PARTIALLY_FILLED -> {
                log.debug("Order #{} ({}) still {} at broker", order.getId(), update.brokerOrderId(),
                    update.rawStatus());
                yield TransitionOutcome.UNCHANGED;
            }
            case UNKNOWN -> {
                log.warn("Unrecognised broker status '{}' for order {} — ignored", update.rawStatus(),
                    update.brokerOrderId());
                yield TransitionOutcome.UNCHANGED;
            }
        };
    }

    private TransitionOutcome executed(TradeOrder order, BrokerOrderUpdate update) {
        Double price = update.executionPrice() != null ? update.executionPrice() : order.getPrice();
        int qty = update.executionQty() != null ? update.executionQty() : order.getQuantity();
        if (price == null) {
            log.warn("Execution of order {} reported without a price and none was recorded — ignored",
                update.brokerOrderId());
            return TransitionOutcome.UNCHANGED;
        }
        return orderLedger.markExecuted(order.getId(), price, qty, null);
    }
}

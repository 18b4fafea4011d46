package com.jay.tradeledger.broker;

import com.jay.tradeledger.model.FieldAliases;

import java.util.Map;
import java.util.Optional;

/**
 * One order-execution callback from the broker adapter:
 * (brokerOrderId, status, executionPrice?, executionQty?, reason?).
 */
public record BrokerOrderUpdate(
    String brokerOrderId,
    BrokerOrderState state,
    String rawStatus,
    Double executionPrice,
    Integer executionQty,
    String reason
) {

    /** Resolves a raw broker payload through the {@link BrokerField} alias table. */
    public static BrokerOrderUpdate from(Map<String, ?> raw) {
        String orderId = FieldAliases.firstText(raw, BrokerField.ORDER_ID)
            .orElseThrow(() -> new IllegalArgumentException("Broker order update without order id: " + raw));
        String status = FieldAliases.firstText(raw, BrokerField.STATUS).orElse(null);
        return new BrokerOrderUpdate(
            orderId,
            BrokerOrderState.parse(status),
            status,
            FieldAliases.firstDouble(raw, BrokerField.EXECUTION_PRICE).filter(p -> p > 0).orElse(null),
            FieldAliases.firstDouble(raw, BrokerField.EXECUTION_QTY).filter(q -> q > 0)
                .map(Double::intValue).orElse(null),
            FieldAliases.firstText(raw, BrokerField.REASON).orElse(null));
    }

    public Optional<String> reasonText() {
        return Optional.ofNullable(reason);
    }
}

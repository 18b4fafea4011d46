package com.jay.tradeledger.broker;

import com.jay.tradeledger.model.AliasedField;

import java.util.List;

/**
 * Keys a broker order payload may use for each logical field, most specific first.
 * Broker APIs are inconsistent between the order book, order history and callbacks.
 */
public enum BrokerField implements AliasedField {
    ORDER_ID("nOrdNo", "orderId", "order_id", "neoOrdNo"),
    STATUS("ordSt", "orderStatus", "status"),
    EXECUTION_PRICE("avgPrc", "avgPrice", "averagePrice", "average_price"),
    EXECUTION_QTY("fldQty", "filledQty", "filled_quantity", "filledQuantity"),
    REASON("rejRsn", "rejectionReason", "rejReason", "statusMessage", "message"),
    EXECUTION_TIME("flDtTm", "exchangeTimestamp", "fillTime");

    private final List<String> aliases;

    BrokerField(String... aliases) {
        this.aliases = List.of(aliases);
    }

    @Override
    public List<String> aliases() {
        return aliases;
    }
}

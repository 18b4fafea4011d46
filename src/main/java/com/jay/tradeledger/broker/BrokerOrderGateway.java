package com.jay.tradeledger.broker;

/**
 * Order instructions sent to the broker. Implemented by the broker adapter; every call
 * reports failure through the result instead of throwing.
 */
public interface BrokerOrderGateway {

    BrokerResult<Void> modifyOrder(String brokerOrderId, String symbol, int quantity, Double price);

    BrokerResult<Void> cancelOrder(String brokerOrderId);
}

package com.jay.tradeledger.repository;

import com.jay.tradeledger.entity.TradeOrder;
import com.jay.tradeledger.model.enums.OrderSide;
import com.jay.tradeledger.model.enums.OrderStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface TradeOrderRepository extends JpaRepository<TradeOrder, Long> {

    Optional<TradeOrder> findByBrokerOrderId(String brokerOrderId);

    Optional<TradeOrder> findByUserIdAndBrokerOrderId(Long userId, String brokerOrderId);

    List<TradeOrder> findByStatusOrderByPlacedAtAsc(OrderStatus status);

    List<TradeOrder> findByUserIdAndStatusOrderByPlacedAtAsc(Long userId, OrderStatus status);

    List<TradeOrder> findByUserIdOrderByPlacedAtDesc(Long userId);

    boolean existsByUserIdAndSymbolAndSideAndStatusIn(Long userId, String symbol, OrderSide side,
                                                      Collection<OrderStatus> statuses);
}

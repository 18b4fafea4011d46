package com.jay.tradeledger.entity;

import com.jay.tradeledger.entity.converter.OrderMetadataConverter;
import com.jay.tradeledger.model.OrderMetadata;
import com.jay.tradeledger.model.enums.EntryType;
import com.jay.tradeledger.model.enums.OrderSide;
import com.jay.tradeledger.model.enums.OrderStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "orders", indexes = {
    @Index(name = "ix_orders_user_status_symbol", columnList = "user_id, status, symbol"),
    @Index(name = "ix_orders_broker_order_id", columnList = "broker_order_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeOrder {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(nullable = false, length = 32)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private OrderSide side;

    @Column(nullable = false)
    private int quantity;

    private Double price;               // limit price, null for market orders

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private EntryType entryType;

    @Convert(converter = OrderMetadataConverter.class)
    @Column(name = "order_metadata", length = 2000)
    private OrderMetadata metadata;

    @Column(name = "broker_order_id", length = 64)
    private String brokerOrderId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private OrderStatus status;

    @Column(nullable = false)
    private LocalDateTime placedAt;

    // Execution
    private Double executionPrice;
    private Integer executionQty;
    private LocalDateTime executionTime;

    // Failure / retry bookkeeping
    @Column(length = 500)
    private String failureReason;
    @Builder.Default
    private int retryCount = 0;
    private LocalDateTime firstFailedAt;
    private LocalDateTime lastFailedAt;

    @Column(length = 500)
    private String rejectionReason;
    @Column(length = 200)
    private String cancelledReason;
    private LocalDateTime closedAt;

    private LocalDateTime lastStatusCheck;
}

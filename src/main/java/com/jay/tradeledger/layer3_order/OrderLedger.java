package com.jay.tradeledger.layer3_order;

import com.jay.tradeledger.config.LedgerConfig;
import com.jay.tradeledger.entity.TradeOrder;
import com.jay.tradeledger.exception.InvalidOrderMetadataException;
import com.jay.tradeledger.exception.OrderNotFoundException;
import com.jay.tradeledger.layer1_clock.TradingWindowClock;
import com.jay.tradeledger.layer4_position.PositionAggregator;
import com.jay.tradeledger.model.OrderMetadata;
import com.jay.tradeledger.model.PlacementRequest;
import com.jay.tradeledger.model.enums.EntryType;
import com.jay.tradeledger.model.enums.OrderSide;
import com.jay.tradeledger.model.enums.OrderStatus;
import com.jay.tradeledger.model.enums.TransitionOutcome;
import com.jay.tradeledger.repository.TradeOrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Layer 3: Order Ledger.
 * Tracks one brokerage order from placement attempt to terminal state.
 *
 * <pre>
 *   PENDING       → ONGOING | FAILED | RETRY_PENDING | REJECTED | CLOSED
 *   RETRY_PENDING → ONGOING | FAILED | RETRY_PENDING
 *   ONGOING, FAILED, REJECTED, CLOSED are terminal here
 * </pre>
 *
 * Every transition stamps lastStatusCheck and is a no-op when re-applied with the same
 * arguments. Transitions not listed above are logged and leave the order unchanged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderLedger {

    private static final Set<OrderStatus> FROM_PENDING_ONLY = EnumSet.of(OrderStatus.PENDING);

    private final TradeOrderRepository orderRepo;
    private final PositionAggregator positionAggregator;
    private final TradingWindowClock clock;
    private final LedgerConfig config;

    // ── Placement ─────────────────────────────────────────────────────────────

    @Transactional
    public TradeOrder recordPlacement(PlacementRequest request) {
        Objects.requireNonNull(request.userId(), "userId");
        Objects.requireNonNull(request.symbol(), "symbol");
        Objects.requireNonNull(request.side(), "side");
        if (request.quantity() <= 0) {
            throw new IllegalArgumentException("Order quantity must be positive, got " + request.quantity());
        }

        EntryType entryType = request.entryType();
        OrderMetadata metadata = request.metadata();
        if (metadata != null) {
            metadata.validate();
            if (entryType == null) {
                entryType = metadata.entryType();
            } else if (metadata.entryType() != entryType) {
                throw new InvalidOrderMetadataException(String.format(
                    "Metadata variant %s does not match entry type %s", metadata.entryType(), entryType));
            }
        }

        LocalDateTime now = clock.now();
        TradeOrder order = TradeOrder.builder()
            .userId(request.userId())
            .symbol(request.symbol())
            .side(request.side())
            .quantity(request.quantity())
            .price(request.price())
            .entryType(entryType)
            .metadata(metadata)
            .brokerOrderId(request.brokerOrderId())
            .status(OrderStatus.PENDING)
            .placedAt(now)
            .lastStatusCheck(now)
            .build();
        TradeOrder saved = orderRepo.save(order);
        log.info("Order recorded: #{} {} {} x{} (user {}, {}, broker id {})", saved.getId(), saved.getSide(),
            saved.getSymbol(), saved.getQuantity(), saved.getUserId(), entryType, saved.getBrokerOrderId());
        return saved;
    }

    // ── Transitions ───────────────────────────────────────────────────────────

    /**
     * Execution confirmed. Folds the execution into the (user, symbol) position in the
     * same transaction: buys via applyFill, sells via applySell.
     */
    @Transactional
    public TransitionOutcome markExecuted(Long orderId, double executionPrice, int executionQty,
                                          LocalDateTime executedAt) {
        TradeOrder order = load(orderId);
        LocalDateTime when = executedAt != null ? executedAt : clock.now();

        if (order.getStatus() == OrderStatus.ONGOING) {
            boolean sameExecution = Objects.equals(order.getExecutionPrice(), executionPrice)
                && Objects.equals(order.getExecutionQty(), executionQty);
            return sameExecution ? unchanged(order) : illegal(order, "markExecuted with a different execution");
        }
        if (!order.getStatus().isAwaitingExecution()) {
            return illegal(order, "markExecuted");
        }

        order.setStatus(OrderStatus.ONGOING);
        order.setExecutionPrice(executionPrice);
        order.setExecutionQty(executionQty);
        order.setExecutionTime(when);
        order.setLastStatusCheck(clock.now());
        orderRepo.save(order);

        if (order.getSide() == OrderSide.BUY) {
            positionAggregator.applyFill(order.getUserId(), order.getSymbol(), executionQty, executionPrice,
                order.getEntryType(), order.getMetadata());
        } else {
            positionAggregator.applySell(order.getUserId(), order.getSymbol(), executionQty);
        }
        log.info("Order #{} executed: {} {} x{} @ ₹{}", order.getId(), order.getSide(), order.getSymbol(),
            executionQty, String.format("%.2f", executionPrice));
        return TransitionOutcome.APPLIED;
    }

    /**
     * Placement or broker error. A retriable failure moves the order to RETRY_PENDING while
     * retries remain; otherwise it is FAILED for good.
     *
     * A failure is identified by its reason and, when given, its time. Without a time, a repeat
     * of the reason already recorded is the same failure reported again. A later failed retry
     * with the same reason has to carry its own failedAt.
     */
    @Transactional
    public TransitionOutcome markFailed(Long orderId, String reason, boolean retriable, LocalDateTime failedAt) {
        TradeOrder order = load(orderId);
        LocalDateTime when = failedAt != null ? failedAt : clock.now();

        if (isRecordedFailure(order, reason, retriable, failedAt)) {
            return unchanged(order);
        }
        if (!order.getStatus().isAwaitingExecution()) {
            return illegal(order, "markFailed");
        }

        order.setFailureReason(reason);
        order.setLastFailedAt(when);
        if (order.getFirstFailedAt() == null) {
            order.setFirstFailedAt(when);
        }

        int maxRetries = config.orders().getMaxRetryAttempts();
        if (retriable && order.getRetryCount() < maxRetries) {
            order.setRetryCount(order.getRetryCount() + 1);
            order.setStatus(OrderStatus.RETRY_PENDING);
            log.warn("Order #{} {} failed ({}), retry {}/{} pending", order.getId(), order.getSymbol(),
                reason, order.getRetryCount(), maxRetries);
        } else {
            order.setStatus(OrderStatus.FAILED);
            log.error("Order #{} {} failed permanently after {} retries: {}", order.getId(), order.getSymbol(),
                order.getRetryCount(), reason);
        }
        order.setLastStatusCheck(clock.now());
        orderRepo.save(order);
        return TransitionOutcome.APPLIED;
    }

    /** Broker-side rejection; terminal. */
    @Transactional
    public TransitionOutcome markRejected(Long orderId, String reason) {
        TradeOrder order = load(orderId);
        if (order.getStatus() == OrderStatus.REJECTED && Objects.equals(order.getRejectionReason(), reason)) {
            return unchanged(order);
        }
        if (!FROM_PENDING_ONLY.contains(order.getStatus())) {
            return illegal(order, "markRejected");
        }
        order.setStatus(OrderStatus.REJECTED);
        order.setRejectionReason(reason);
        order.setLastStatusCheck(clock.now());
        orderRepo.save(order);
        log.warn("Order #{} {} rejected by broker: {}", order.getId(), order.getSymbol(), reason);
        return TransitionOutcome.APPLIED;
    }

    /** Explicit cancel before execution. */
    @Transactional
    public TransitionOutcome markCancelled(Long orderId, String reason) {
        TradeOrder order = load(orderId);
        if (order.getStatus() == OrderStatus.CLOSED && Objects.equals(order.getCancelledReason(), reason)) {
            return unchanged(order);
        }
        if (!FROM_PENDING_ONLY.contains(order.getStatus())) {
            return illegal(order, "markCancelled");
        }
        LocalDateTime now = clock.now();
        order.setStatus(OrderStatus.CLOSED);
        order.setCancelledReason(reason);
        order.setClosedAt(now);
        order.setLastStatusCheck(now);
        orderRepo.save(order);
        log.info("Order #{} {} cancelled: {}", order.getId(), order.getSymbol(), reason);
        return TransitionOutcome.APPLIED;
    }

    /** Persists a premarket quantity/price modification of a pending order. */
    @Transactional
    public TransitionOutcome updateQuantity(Long orderId, int quantity, Double price) {
        TradeOrder order = load(orderId);
        if (order.getStatus() != OrderStatus.PENDING) {
            return illegal(order, "updateQuantity");
        }
        if (order.getQuantity() == quantity && Objects.equals(order.getPrice(), price)) {
            return unchanged(order);
        }
        log.info("Order #{} {} modified: qty {} -> {}, price {} -> {}", order.getId(), order.getSymbol(),
            order.getQuantity(), quantity, order.getPrice(), price);
        order.setQuantity(quantity);
        order.setPrice(price);
        order.setLastStatusCheck(clock.now());
        orderRepo.save(order);
        return TransitionOutcome.APPLIED;
    }

    // ── Queries ───────────────────────────────────────────────────────────────

    @Transactional(readOnly = true)
    public TradeOrder get(Long orderId) {
        return load(orderId);
    }

    @Transactional(readOnly = true)
    public TradeOrder getByBrokerOrderId(String brokerOrderId) {
        return orderRepo.findByBrokerOrderId(brokerOrderId)
            .orElseThrow(() -> new OrderNotFoundException("No order with broker id " + brokerOrderId));
    }

    /** Pending orders of one user, or of every user when userId is null. Oldest first. */
    @Transactional(readOnly = true)
    public List<TradeOrder> findPending(Long userId) {
        return userId == null
            ? orderRepo.findByStatusOrderByPlacedAtAsc(OrderStatus.PENDING)
            : orderRepo.findByUserIdAndStatusOrderByPlacedAtAsc(userId, OrderStatus.PENDING);
    }

    @Transactional(readOnly = true)
    public List<TradeOrder> history(Long userId) {
        return orderRepo.findByUserIdOrderByPlacedAtDesc(userId);
    }

    /** True when the user has an executed buy for the symbol that is still being held. */
    @Transactional(readOnly = true)
    public boolean hasOngoingBuy(Long userId, String symbol) {
        return orderRepo.existsByUserIdAndSymbolAndSideAndStatusIn(userId, symbol, OrderSide.BUY,
            EnumSet.of(OrderStatus.ONGOING));
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private TradeOrder load(Long orderId) {
        return orderRepo.findById(orderId)
            .orElseThrow(() -> new OrderNotFoundException("No order with id " + orderId));
    }

    private static boolean isRecordedFailure(TradeOrder order, String reason, boolean retriable,
                                             LocalDateTime failedAt) {
        boolean sameFailure = Objects.equals(order.getFailureReason(), reason)
            && (failedAt == null || failedAt.equals(order.getLastFailedAt()));
        if (!sameFailure) return false;
        return order.getStatus() == OrderStatus.FAILED
            || (order.getStatus() == OrderStatus.RETRY_PENDING && retriable);
    }

    private TransitionOutcome unchanged(TradeOrder order) {
        order.setLastStatusCheck(clock.now());
        orderRepo.save(order);
        log.debug("Order #{} already {} — nothing to apply", order.getId(), order.getStatus());
        return TransitionOutcome.UNCHANGED;
    }

    private TransitionOutcome illegal(TradeOrder order, String transition) {
        log.error("Illegal transition {} on order #{} ({} {}, status {}) — order left unchanged",
            transition, order.getId(), order.getSide(), order.getSymbol(), order.getStatus());
        return TransitionOutcome.ILLEGAL;
    }
}

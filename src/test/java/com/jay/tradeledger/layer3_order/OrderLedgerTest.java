package com.jay.tradeledger.layer3_order;

import com.jay.tradeledger.entity.Position;
import com.jay.tradeledger.entity.TradeOrder;
import com.jay.tradeledger.exception.InvalidOrderMetadataException;
import com.jay.tradeledger.exception.OrderNotFoundException;
import com.jay.tradeledger.layer4_position.PositionAggregator;
import com.jay.tradeledger.model.InitialEntryMetadata;
import com.jay.tradeledger.model.OrderMetadata;
import com.jay.tradeledger.model.PlacementRequest;
import com.jay.tradeledger.model.ReentryMetadata;
import com.jay.tradeledger.model.enums.EntryType;
import com.jay.tradeledger.model.enums.OrderSide;
import com.jay.tradeledger.model.enums.OrderStatus;
import com.jay.tradeledger.model.enums.TransitionOutcome;
import com.jay.tradeledger.support.LedgerTestConfig;
import com.jay.tradeledger.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(LedgerTestConfig.class)
class OrderLedgerTest {

    @Autowired
    private OrderLedger orderLedger;

    @Autowired
    private PositionAggregator positions;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void resetClock() {
        clock.set(LedgerTestConfig.MONDAY_EVENING);
    }

    @Test
    void placementStartsPending() {
        TradeOrder order = placeBuy("RELIANCE", 10, EntryType.INITIAL,
            new InitialEntryMetadata(30.0, 28.4, null));

        assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(order.getPlacedAt()).isEqualTo(LedgerTestConfig.MONDAY_EVENING);
        assertThat(orderLedger.findPending(1L)).extracting(TradeOrder::getId).containsExactly(order.getId());
    }

    @Test
    void entryTypeIsInferredFromMetadata() {
        TradeOrder order = placeBuy("RELIANCE", 5, null, new ReentryMetadata(20, 19.5, 1));

        assertThat(order.getEntryType()).isEqualTo(EntryType.REENTRY);
    }

    @Test
    void mismatchedMetadataVariantIsRefused() {
        assertThatThrownBy(() -> placeBuy("RELIANCE", 5, EntryType.INITIAL, new ReentryMetadata(20, 19.5, 1)))
            .isInstanceOf(InvalidOrderMetadataException.class);
    }

    @Test
    void incompleteReentryMetadataIsRefused() {
        assertThatThrownBy(() -> placeBuy("RELIANCE", 5, EntryType.REENTRY, new ReentryMetadata(20, null, 1)))
            .isInstanceOf(InvalidOrderMetadataException.class)
            .hasMessageContaining("indicator_value");
    }

    @Test
    void executionOpensPosition() {
        TradeOrder order = placeBuy("RELIANCE", 10, EntryType.INITIAL, null);

        TransitionOutcome outcome = orderLedger.markExecuted(order.getId(), 2500.0, 10, null);

        assertThat(outcome).isEqualTo(TransitionOutcome.APPLIED);
        TradeOrder executed = orderLedger.get(order.getId());
        assertThat(executed.getStatus()).isEqualTo(OrderStatus.ONGOING);
        assertThat(executed.getExecutionTime()).isEqualTo(LedgerTestConfig.MONDAY_EVENING);
        assertThat(orderLedger.hasOngoingBuy(1L, "RELIANCE")).isTrue();
        assertThat(positions.openPosition(1L, "RELIANCE"))
            .hasValueSatisfying(p -> assertThat(p.getQuantity()).isEqualTo(10));
    }

    @Test
    void repeatedExecutionDoesNotDoubleFill() {
        TradeOrder order = placeBuy("RELIANCE", 10, EntryType.INITIAL, null);
        orderLedger.markExecuted(order.getId(), 2500.0, 10, null);

        TransitionOutcome again = orderLedger.markExecuted(order.getId(), 2500.0, 10, null);
        TransitionOutcome different = orderLedger.markExecuted(order.getId(), 2510.0, 10, null);

        assertThat(again).isEqualTo(TransitionOutcome.UNCHANGED);
        assertThat(different).isEqualTo(TransitionOutcome.ILLEGAL);
        Position position = positions.openPosition(1L, "RELIANCE").orElseThrow();
        assertThat(position.getQuantity()).isEqualTo(10);
        assertThat(position.getAvgPrice()).isEqualTo(2500.0);
    }

    @Test
    void sellExecutionReducesPosition() {
        orderLedger.markExecuted(placeBuy("RELIANCE", 10, EntryType.INITIAL, null).getId(), 2500.0, 10, null);
        TradeOrder sell = orderLedger.recordPlacement(PlacementRequest.builder()
            .userId(1L).symbol("RELIANCE").side(OrderSide.SELL).quantity(10).price(2600.0).build());

        orderLedger.markExecuted(sell.getId(), 2600.0, 10, null);

        assertThat(positions.openPosition(1L, "RELIANCE")).isEmpty();
        assertThat(positions.latestPosition(1L, "RELIANCE").orElseThrow().getClosedAt()).isNotNull();
    }

    @Test
    void retriableFailureSchedulesRetryUntilExhausted() {
        TradeOrder order = placeBuy("RELIANCE", 10, EntryType.INITIAL, null);
        LocalDateTime first = LedgerTestConfig.MONDAY_EVENING;

        for (int i = 0; i < 3; i++) {
            assertThat(orderLedger.markFailed(order.getId(), "gateway timeout", true, first.plusMinutes(i)))
                .isEqualTo(TransitionOutcome.APPLIED);
            assertThat(orderLedger.get(order.getId()).getStatus()).isEqualTo(OrderStatus.RETRY_PENDING);
        }
        orderLedger.markFailed(order.getId(), "gateway timeout", true, first.plusMinutes(3));

        TradeOrder failed = orderLedger.get(order.getId());
        assertThat(failed.getStatus()).isEqualTo(OrderStatus.FAILED);
        assertThat(failed.getRetryCount()).isEqualTo(3);
        assertThat(failed.getFirstFailedAt()).isEqualTo(first);
        assertThat(failed.getLastFailedAt()).isEqualTo(first.plusMinutes(3));
    }

    @Test
    void sameFailureReappliedIsUnchanged() {
        TradeOrder order = placeBuy("RELIANCE", 10, EntryType.INITIAL, null);
        LocalDateTime at = LedgerTestConfig.MONDAY_EVENING;

        orderLedger.markFailed(order.getId(), "gateway timeout", true, at);
        TransitionOutcome again = orderLedger.markFailed(order.getId(), "gateway timeout", true, at);

        assertThat(again).isEqualTo(TransitionOutcome.UNCHANGED);
        assertThat(orderLedger.get(order.getId()).getRetryCount()).isEqualTo(1);
    }

    @Test
    void undatedFailureReportedAgainIsUnchanged() {
        TradeOrder order = placeBuy("RELIANCE", 10, EntryType.INITIAL, null);

        orderLedger.markFailed(order.getId(), "gateway timeout", true, null);
        clock.advance(Duration.ofSeconds(30));

        assertThat(orderLedger.markFailed(order.getId(), "gateway timeout", true, null))
            .isEqualTo(TransitionOutcome.UNCHANGED);
        assertThat(orderLedger.get(order.getId()).getRetryCount()).isEqualTo(1);
        assertThat(orderLedger.markFailed(order.getId(), "gateway timeout", false, null))
            .isEqualTo(TransitionOutcome.APPLIED);
        assertThat(orderLedger.get(order.getId()).getStatus()).isEqualTo(OrderStatus.FAILED);
        assertThat(orderLedger.markFailed(order.getId(), "gateway timeout", true, null))
            .isEqualTo(TransitionOutcome.UNCHANGED);
    }

    @Test
    void retryPendingOrderCanStillExecute() {
        TradeOrder order = placeBuy("RELIANCE", 10, EntryType.INITIAL, null);
        orderLedger.markFailed(order.getId(), "gateway timeout", true, null);

        assertThat(orderLedger.markExecuted(order.getId(), 2500.0, 10, null)).isEqualTo(TransitionOutcome.APPLIED);
    }

    @Test
    void rejectionIsTerminal() {
        TradeOrder order = placeBuy("RELIANCE", 10, EntryType.INITIAL, null);

        assertThat(orderLedger.markRejected(order.getId(), "RMS: margin exceeded")).isEqualTo(TransitionOutcome.APPLIED);
        assertThat(orderLedger.markRejected(order.getId(), "RMS: margin exceeded")).isEqualTo(TransitionOutcome.UNCHANGED);
        assertThat(orderLedger.markExecuted(order.getId(), 2500.0, 10, null)).isEqualTo(TransitionOutcome.ILLEGAL);
        assertThat(orderLedger.get(order.getId()).getStatus()).isEqualTo(OrderStatus.REJECTED);
        assertThat(positions.openPosition(1L, "RELIANCE")).isEmpty();
    }

    @Test
    void cancelClosesPendingOrder() {
        TradeOrder order = placeBuy("RELIANCE", 10, EntryType.INITIAL, null);

        assertThat(orderLedger.markCancelled(order.getId(), "user cancelled")).isEqualTo(TransitionOutcome.APPLIED);

        TradeOrder cancelled = orderLedger.get(order.getId());
        assertThat(cancelled.getStatus()).isEqualTo(OrderStatus.CLOSED);
        assertThat(cancelled.getClosedAt()).isEqualTo(LedgerTestConfig.MONDAY_EVENING);
        assertThat(orderLedger.markCancelled(order.getId(), "user cancelled")).isEqualTo(TransitionOutcome.UNCHANGED);
    }

    @Test
    void executedOrderCannotBeCancelled() {
        TradeOrder order = placeBuy("RELIANCE", 10, EntryType.INITIAL, null);
        orderLedger.markExecuted(order.getId(), 2500.0, 10, null);

        assertThat(orderLedger.markCancelled(order.getId(), "late cancel")).isEqualTo(TransitionOutcome.ILLEGAL);
        assertThat(orderLedger.get(order.getId()).getStatus()).isEqualTo(OrderStatus.ONGOING);
    }

    @Test
    void quantityUpdateOnlyWhilePending() {
        TradeOrder order = placeBuy("RELIANCE", 40, EntryType.INITIAL, null);

        assertThat(orderLedger.updateQuantity(order.getId(), 38, 2600.0)).isEqualTo(TransitionOutcome.APPLIED);
        assertThat(orderLedger.updateQuantity(order.getId(), 38, 2600.0)).isEqualTo(TransitionOutcome.UNCHANGED);
        orderLedger.markCancelled(order.getId(), "user cancelled");
        assertThat(orderLedger.updateQuantity(order.getId(), 41, 2400.0)).isEqualTo(TransitionOutcome.ILLEGAL);
        assertThat(orderLedger.get(order.getId()).getQuantity()).isEqualTo(38);
    }

    @Test
    void lookupByBrokerOrderId() {
        TradeOrder order = placeBuy("RELIANCE", 10, EntryType.INITIAL, null);

        assertThat(orderLedger.getByBrokerOrderId("B-RELIANCE-10").getId()).isEqualTo(order.getId());
        assertThatThrownBy(() -> orderLedger.getByBrokerOrderId("missing"))
            .isInstanceOf(OrderNotFoundException.class);
    }

    private TradeOrder placeBuy(String symbol, int qty, EntryType entryType,
                                OrderMetadata metadata) {
        return orderLedger.recordPlacement(PlacementRequest.builder()
            .userId(1L)
            .symbol(symbol)
            .side(OrderSide.BUY)
            .quantity(qty)
            .price(2500.0)
            .entryType(entryType)
            .metadata(metadata)
            .brokerOrderId("B-" + symbol + "-" + qty)
            .build());
    }
}

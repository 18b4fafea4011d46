package com.jay.tradeledger.service;

import com.jay.tradeledger.entity.Signal;
import com.jay.tradeledger.exception.LedgerStorageException;
import com.jay.tradeledger.layer3_order.OrderLedger;
import com.jay.tradeledger.model.enums.SignalStatus;
import com.jay.tradeledger.repository.SignalRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

/**
 * Runs against committed data: no test-managed transaction wraps these calls, so a batch
 * that fails halfway must leave nothing behind on its own.
 */
@SpringBootTest
class LedgerFacadeTransactionTest {

    @Autowired
    private LedgerFacade facade;

    @Autowired
    private SignalRepository signalRepo;

    @MockBean
    private OrderLedger orderLedger;

    @BeforeEach
    void seed() {
        LocalDateTime yesterday = LocalDateTime.now().minusDays(1);
        signalRepo.save(signal("TCS", "buy", SignalStatus.ACTIVE, yesterday));
        signalRepo.save(signal("WIPRO", "buy", SignalStatus.TRADED, yesterday));
        signalRepo.save(signal("HDFCBANK", "strong_buy", SignalStatus.ACTIVE, yesterday));
    }

    @AfterEach
    void clean() {
        signalRepo.deleteAll();
    }

    @Test
    void storageFailureMidBatchLeavesNoPartialChanges() {
        when(orderLedger.hasOngoingBuy(anyLong(), eq("WIPRO")))
            .thenThrow(new DataAccessResourceFailureException("connection reset"));

        List<Map<String, Object>> batch = List.of(
            Map.of("symbol", "INFY", "verdict", "buy"),
            Map.of("symbol", "TCS", "verdict", "avoid"),
            Map.of("symbol", "WIPRO", "verdict", "buy"));

        assertThatThrownBy(() -> facade.reconcileSignals(batch, 7L, true))
            .isInstanceOf(LedgerStorageException.class);

        assertThat(signalRepo.findFirstBySymbolOrderByTsDescIdDesc("INFY")).isEmpty();
        assertThat(signalRepo.findFirstBySymbolOrderByTsDescIdDesc("TCS"))
            .hasValueSatisfying(s -> assertThat(s.getStatus()).isEqualTo(SignalStatus.ACTIVE));
        assertThat(signalRepo.findFirstBySymbolOrderByTsDescIdDesc("HDFCBANK"))
            .hasValueSatisfying(s -> assertThat(s.getStatus()).isEqualTo(SignalStatus.ACTIVE));
        assertThat(signalRepo.count()).isEqualTo(3);
    }

    @Test
    void completedBatchIsCommitted() {
        facade.reconcileSignals(List.of(Map.of("symbol", "INFY", "verdict", "buy")), 7L, true);

        assertThat(signalRepo.findFirstBySymbolOrderByTsDescIdDesc("INFY"))
            .hasValueSatisfying(s -> assertThat(s.getStatus()).isEqualTo(SignalStatus.ACTIVE));
        assertThat(signalRepo.findFirstBySymbolOrderByTsDescIdDesc("TCS"))
            .hasValueSatisfying(s -> assertThat(s.getStatus()).isEqualTo(SignalStatus.EXPIRED));
    }

    private static Signal signal(String symbol, String verdict, SignalStatus status, LocalDateTime ts) {
        return Signal.builder().symbol(symbol).verdict(verdict).status(status).ts(ts).build();
    }
}

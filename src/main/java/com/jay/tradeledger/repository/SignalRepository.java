package com.jay.tradeledger.repository;

import com.jay.tradeledger.entity.Signal;
import com.jay.tradeledger.model.enums.SignalStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface SignalRepository extends JpaRepository<Signal, Long> {

    /** Current row for a symbol, whatever its status. */
    Optional<Signal> findFirstBySymbolOrderByTsDescIdDesc(String symbol);

    Optional<Signal> findFirstBySymbolAndStatusInOrderByTsDescIdDesc(String symbol, Collection<SignalStatus> statuses);

    List<Signal> findBySymbolAndStatus(String symbol, SignalStatus status);

    List<Signal> findByStatus(SignalStatus status);

    List<Signal> findByStatusOrderByTsDesc(SignalStatus status, Pageable pageable);

    List<Signal> findAllByOrderByTsDesc(Pageable pageable);

    List<Signal> findByTsGreaterThanEqualAndTsLessThanOrderByTsDesc(LocalDateTime from, LocalDateTime to,
                                                                   Pageable pageable);
}

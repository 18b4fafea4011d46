package com.jay.tradeledger.repository;

import com.jay.tradeledger.entity.Position;
import org.springframework.stereotype.Repository;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PositionRepository extends JpaRepository<Position, Long> {

    Optional<Position> findFirstByUserIdAndSymbolAndClosedAtIsNullOrderByIdDesc(Long userId, String symbol);

    Optional<Position> findFirstByUserIdAndSymbolOrderByIdDesc(Long userId, String symbol);

    List<Position> findByUserIdAndClosedAtIsNullOrderBySymbolAsc(Long userId);

    List<Position> findByUserIdOrderByOpenedAtDesc(Long userId);
}

package com.jay.tradeledger.repository;

import com.jay.tradeledger.entity.UserSignalStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface UserSignalStatusRepository extends JpaRepository<UserSignalStatus, Long> {

    Optional<UserSignalStatus> findByUserIdAndSignalId(Long userId, Long signalId);

    List<UserSignalStatus> findByUserIdAndSignalIdIn(Long userId, Collection<Long> signalIds);
}

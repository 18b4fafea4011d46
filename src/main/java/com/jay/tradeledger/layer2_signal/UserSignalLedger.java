package com.jay.tradeledger.layer2_signal;

import com.jay.tradeledger.entity.Signal;
import com.jay.tradeledger.entity.UserSignalStatus;
import com.jay.tradeledger.layer1_clock.TradingWindowClock;
import com.jay.tradeledger.model.SignalView;
import com.jay.tradeledger.model.enums.SignalStatus;
import com.jay.tradeledger.repository.SignalRepository;
import com.jay.tradeledger.repository.UserSignalStatusRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Per-user annotations on signals. A user acting on a signal attaches a
 * {@link UserSignalStatus}; the base row keeps serving everyone else.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserSignalLedger {

    private final SignalRepository signalRepo;
    private final UserSignalStatusRepository userStatusRepo;
    private final TradingWindowClock clock;

    /**
     * Records that a user traded the current signal of a symbol. The base row becomes TRADED,
     * the global marker that some user acted on it. Without a user only an ACTIVE base row is marked.
     *
     * @return false when there is no signal the user may mark
     */
    @Transactional
    public boolean markTraded(String symbol, Long userId) {
        Optional<Signal> current = signalRepo.findFirstBySymbolOrderByTsDescIdDesc(symbol);
        if (current.isEmpty()) return false;
        Signal signal = current.get();

        if (userId == null) {
            if (signal.getStatus() != SignalStatus.ACTIVE) return false;
            signal.setStatus(SignalStatus.TRADED);
            signalRepo.save(signal);
            log.info("Signal {} marked TRADED", symbol);
            return true;
        }

        Optional<UserSignalStatus> existing = userStatusRepo.findByUserIdAndSignalId(userId, signal.getId());
        boolean markable = signal.getStatus() == SignalStatus.ACTIVE || signal.getStatus() == SignalStatus.EXPIRED;
        if (existing.isEmpty() && !markable) return false;

        upsert(existing, signal, userId, SignalStatus.TRADED);
        if (signal.getStatus() == SignalStatus.ACTIVE) {
            signal.setStatus(SignalStatus.TRADED);
            signalRepo.save(signal);
        }
        log.info("Signal {} marked TRADED for user {}", symbol, userId);
        return true;
    }

    /**
     * Rejects the latest ACTIVE or EXPIRED signal of a symbol for one user, leaving the base
     * row untouched. Without a user the base ACTIVE row itself becomes REJECTED.
     */
    @Transactional
    public boolean markRejected(String symbol, Long userId) {
        if (userId == null) {
            List<Signal> active = signalRepo.findBySymbolAndStatus(symbol, SignalStatus.ACTIVE);
            active.forEach(s -> s.setStatus(SignalStatus.REJECTED));
            signalRepo.saveAll(active);
            return !active.isEmpty();
        }

        Optional<Signal> target = signalRepo.findFirstBySymbolAndStatusInOrderByTsDescIdDesc(symbol,
            EnumSet.of(SignalStatus.ACTIVE, SignalStatus.EXPIRED));
        if (target.isEmpty()) return false;

        upsert(userStatusRepo.findByUserIdAndSignalId(userId, target.get().getId()), target.get(), userId,
            SignalStatus.REJECTED);
        log.info("Signal {} rejected by user {}", symbol, userId);
        return true;
    }

    /**
     * Makes the current signal of a symbol active again for a user. Refused when the signal is
     * EXPIRED or past its market-close expiry.
     */
    @Transactional
    public boolean reactivate(String symbol, Long userId) {
        Optional<Signal> current = signalRepo.findFirstBySymbolOrderByTsDescIdDesc(symbol);
        if (current.isEmpty()) return false;
        Signal signal = current.get();

        if (signal.getStatus() == SignalStatus.EXPIRED || clock.isExpiredByMarketClose(signal.getTs())) {
            log.info("Cannot reactivate {} for user {}: signal expired", symbol, userId);
            return false;
        }

        Optional<UserSignalStatus> existing = userStatusRepo.findByUserIdAndSignalId(userId, signal.getId());
        if (existing.isPresent()) {
            userStatusRepo.delete(existing.get());
            log.info("Signal {} reactivated for user {} (override removed)", symbol, userId);
            return true;
        }
        if (signal.getStatus() == SignalStatus.ACTIVE) return true;

        // Base row is REJECTED or TRADED; shadow it for this user only
        upsert(Optional.empty(), signal, userId, SignalStatus.ACTIVE);
        log.info("Signal {} reactivated for user {} (override added)", symbol, userId);
        return true;
    }

    /** Newest signals with the status this user sees, optionally filtered by that status. */
    @Transactional(readOnly = true)
    public List<SignalView> signalsForUser(Long userId, int limit, SignalStatus statusFilter) {
        List<Signal> signals = signalRepo.findAllByOrderByTsDesc(PageRequest.of(0, limit));
        if (signals.isEmpty()) return List.of();
        Map<Long, SignalStatus> overrides = userStatusRepo
            .findByUserIdAndSignalIdIn(userId, signals.stream().map(Signal::getId).toList())
            .stream()
            .collect(Collectors.toMap(UserSignalStatus::getSignalId, UserSignalStatus::getStatus));

        return signals.stream()
            .map(s -> new SignalView(s, overrides.getOrDefault(s.getId(), s.getStatus())))
            .filter(v -> statusFilter == null || v.effectiveStatus() == statusFilter)
            .toList();
    }

    @Transactional(readOnly = true)
    public Optional<SignalStatus> userStatus(String symbol, Long userId) {
        return signalRepo.findFirstBySymbolOrderByTsDescIdDesc(symbol)
            .flatMap(s -> userStatusRepo.findByUserIdAndSignalId(userId, s.getId()))
            .map(UserSignalStatus::getStatus);
    }

    private void upsert(Optional<UserSignalStatus> existing, Signal signal, Long userId, SignalStatus status) {
        UserSignalStatus row = existing.orElseGet(() -> UserSignalStatus.builder()
            .userId(userId)
            .signalId(signal.getId())
            .symbol(signal.getSymbol())
            .build());
        row.setStatus(status);
        row.setMarkedAt(clock.now());
        userStatusRepo.save(row);
    }
}

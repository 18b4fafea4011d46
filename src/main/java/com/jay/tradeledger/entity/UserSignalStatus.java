package com.jay.tradeledger.entity;

import com.jay.tradeledger.model.enums.SignalStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/** One user's override of a signal's status (traded, rejected or re-activated). */
@Entity
@Table(name = "user_signal_status",
    uniqueConstraints = @UniqueConstraint(name = "uq_user_signal", columnNames = {"user_id", "signal_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserSignalStatus {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "signal_id", nullable = false)
    private Long signalId;

    @Column(nullable = false, length = 32)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SignalStatus status;

    private LocalDateTime markedAt;
}

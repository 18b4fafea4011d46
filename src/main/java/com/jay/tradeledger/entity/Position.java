package com.jay.tradeledger.entity;

import com.jay.tradeledger.entity.converter.ReentryListConverter;
import com.jay.tradeledger.model.ReentryRecord;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Aggregated holding of one user in one symbol. {@code closedAt} is set exactly when
 * quantity reaches zero; a later buy into a closed symbol opens a new row.
 */
@Entity
@Table(name = "positions", indexes = @Index(name = "ix_positions_user_symbol", columnList = "user_id, symbol"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(nullable = false, length = 32)
    private String symbol;

    @Column(nullable = false)
    private int quantity;

    @Column(nullable = false)
    private double avgPrice;

    @Column(nullable = false)
    private LocalDateTime openedAt;

    private LocalDateTime closedAt;

    // Set by the first fill, never overwritten
    private Double initialEntryPrice;
    private Double entryIndicator;

    private Double lastReentryPrice;
    @Builder.Default
    private int reentryCount = 0;

    @Builder.Default
    @Convert(converter = ReentryListConverter.class)
    @Column(length = 8000)
    private List<ReentryRecord> reentries = new ArrayList<>();

    public boolean isOpen() {
        return closedAt == null;
    }
}

package com.nosota.scavenger.model;

import com.nosota.scavenger.api.model.WasteType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * A budgeted offer by a manufacturer to pay a reward per kilogram of one category.
 * <p>
 * Invariant: {@code 0 <= remainingBudget <= totalBudget}. The program deactivates
 * itself when the remaining budget reaches 0.
 * </p>
 */
@Entity
@Table(name = "incentive_program")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class IncentiveProgram {

    @Id
    private Long id;

    @Column(name = "issuer", nullable = false)
    private String issuer;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 32)
    private WasteType category;

    /**
     * Reward tokens per whole kilogram.
     */
    @Column(name = "reward_rate", nullable = false)
    private Long rewardRate;

    @Column(name = "total_budget", nullable = false)
    private Long totalBudget;

    @Column(name = "remaining_budget", nullable = false)
    private Long remainingBudget;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}

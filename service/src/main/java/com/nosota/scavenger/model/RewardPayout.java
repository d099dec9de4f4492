package com.nosota.scavenger.model;

import com.nosota.scavenger.api.model.PayoutShare;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Ledger entry for one reward payment from an incentive issuer to a participant.
 * Rows are only ever inserted.
 */
@Entity
@Table(name = "reward_payout")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class RewardPayout {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "waste_id", nullable = false)
    private Long wasteId;

    @Column(name = "incentive_id", nullable = false)
    private Long incentiveId;

    @Column(name = "payer", nullable = false)
    private String payer;

    @Column(name = "payee", nullable = false)
    private String payee;

    @Enumerated(EnumType.STRING)
    @Column(name = "payout_share", nullable = false, length = 32)
    private PayoutShare share;

    @Column(name = "amount", nullable = false)
    private Long amount;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}

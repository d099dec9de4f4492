package com.nosota.scavenger.model;

import com.nosota.scavenger.api.model.WasteStatus;
import com.nosota.scavenger.api.model.WasteType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * A discrete, tracked quantity of recyclable material.
 * <p>
 * Identifiers come from the WASTE id space and are never reused. A unit starts
 * PENDING, active and unconfirmed, owned by its submitter. Deactivation is one-way:
 * once {@code active} is false no further mutation is accepted.
 * </p>
 * <p>
 * Bulk hand-overs create a unit with weight 0; the receiving manufacturer records the
 * real weight later and the unit cannot be settled before that.
 * </p>
 */
@Entity
@Table(name = "waste_unit")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class WasteUnit {

    @Id
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 32)
    private WasteType category;

    /**
     * Weight in grams.
     */
    @Column(name = "weight", nullable = false)
    private Long weight;

    @Column(name = "submitter", nullable = false)
    private String submitter;

    @Column(name = "current_owner", nullable = false)
    private String currentOwner;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private WasteStatus status;

    @Column(name = "confirmed", nullable = false)
    private boolean confirmed;

    /**
     * Party that confirmed the unit. Before confirmation this is the submitter, after a
     * reset it is the owner that cleared the confirmation.
     */
    @Column(name = "confirmer", nullable = false)
    private String confirmer;

    @Column(name = "active", nullable = false)
    private boolean active;

    /**
     * Latitude in micro-degrees.
     */
    @Column(name = "latitude", nullable = false)
    private Long latitude;

    /**
     * Longitude in micro-degrees.
     */
    @Column(name = "longitude", nullable = false)
    private Long longitude;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}

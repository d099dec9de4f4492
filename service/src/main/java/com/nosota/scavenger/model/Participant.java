package com.nosota.scavenger.model;

import com.nosota.scavenger.api.model.ParticipantRole;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

@Entity
@Table(name = "participant")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Participant {

    @Id
    @Column(name = "address", nullable = false)
    private String address;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 32)
    private ParticipantRole role;

    @Column(name = "name")
    private String name;

    /**
     * Grams of waste submitted over the participant's lifetime.
     */
    @Column(name = "total_waste_submitted", nullable = false)
    private Long totalWasteSubmitted;

    @Column(name = "total_tokens_earned", nullable = false)
    private Long totalTokensEarned;

    @Column(name = "registered_at", nullable = false)
    private LocalDateTime registeredAt;
}

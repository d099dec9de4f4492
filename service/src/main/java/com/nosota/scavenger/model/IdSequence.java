package com.nosota.scavenger.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "id_sequence")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class IdSequence {

    @Id
    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 32)
    private IdKind name;

    /**
     * Last identifier handed out in this space; 0 before the first allocation.
     */
    @Column(name = "counter", nullable = false)
    private Long value;
}

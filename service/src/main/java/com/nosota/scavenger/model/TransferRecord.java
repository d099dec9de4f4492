package com.nosota.scavenger.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Append-only record of one custody change. Never updated or deleted.
 */
@Entity
@Table(name = "transfer_record")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class TransferRecord {

    @Id
    private Long id;

    @Column(name = "waste_id", nullable = false)
    private Long wasteId;

    @Column(name = "from_address", nullable = false)
    private String fromAddress;

    @Column(name = "to_address", nullable = false)
    private String toAddress;

    @Column(name = "transferred_at", nullable = false)
    private LocalDateTime timestamp;

    @Column(name = "note")
    private String note;

    @Column(name = "bulk", nullable = false)
    private boolean bulk;
}

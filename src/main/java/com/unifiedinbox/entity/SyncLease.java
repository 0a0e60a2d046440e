package com.unifiedinbox.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;
import java.time.Instant;

/**
 * Exclusive per-account sync lease. A row exists while a worker holds the
 * account; a row past {@code expiresAt} belongs to a dead worker and may be taken over.
 */
@Entity
@Table(name = "sync_leases")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SyncLease {

    @Id
    private Long accountId;

    @Column(nullable = false)
    private String holder;

    @Column(nullable = false)
    private Instant acquiredAt;

    @Column(nullable = false)
    private Instant expiresAt;
}

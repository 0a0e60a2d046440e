package com.unifiedinbox.repository;

import com.unifiedinbox.entity.SyncLease;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Every method runs in its own transaction so a failed insert never poisons the caller's.
 */
@Repository
public interface SyncLeaseRepository extends JpaRepository<SyncLease, Long> {

    // Fails with a primary key violation when another worker already holds the row
    @Modifying
    @Transactional
    @Query(value = "INSERT INTO sync_leases (account_id, holder, acquired_at, expires_at) " +
                   "VALUES (:accountId, :holder, :now, :expiresAt)", nativeQuery = true)
    int insertLease(@Param("accountId") Long accountId,
                    @Param("holder") String holder,
                    @Param("now") Instant now,
                    @Param("expiresAt") Instant expiresAt);

    @Modifying
    @Transactional
    @Query("UPDATE SyncLease l SET l.holder = :holder, l.acquiredAt = :now, l.expiresAt = :expiresAt " +
           "WHERE l.accountId = :accountId AND l.expiresAt <= :now")
    int takeOverExpired(@Param("accountId") Long accountId,
                        @Param("holder") String holder,
                        @Param("now") Instant now,
                        @Param("expiresAt") Instant expiresAt);

    @Modifying
    @Transactional
    @Query("DELETE FROM SyncLease l WHERE l.accountId = :accountId AND l.holder = :holder")
    int release(@Param("accountId") Long accountId, @Param("holder") String holder);
}

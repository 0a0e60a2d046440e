package com.unifiedinbox.repository;

import com.unifiedinbox.entity.EmailAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import java.util.List;
import java.util.Optional;

@Repository
public interface EmailAccountRepository extends JpaRepository<EmailAccount, Long> {
    List<EmailAccount> findByUserId(Long userId);

    @Query("SELECT a.id FROM EmailAccount a WHERE a.active = true ORDER BY a.lastSyncedAt ASC NULLS FIRST")
    List<Long> findActiveAccountIds();

    Optional<EmailAccount> findByUserIdAndEmailAddressAndProvider(Long userId, String emailAddress, EmailAccount.EmailProvider provider);

    // Touches only the error column so a failed sync never overwrites credentials or cursor
    @Modifying
    @Transactional
    @Query("UPDATE EmailAccount a SET a.lastSyncError = :error WHERE a.id = :accountId")
    int recordSyncError(@Param("accountId") Long accountId, @Param("error") String error);
}

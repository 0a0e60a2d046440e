package com.unifiedinbox.repository;

import com.unifiedinbox.entity.Message;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface MessageRepository extends JpaRepository<Message, Long> {

    Optional<Message> findByProviderMessageId(String providerMessageId);

    // Batch check for existing provider ids (for deduplication)
    @Query("SELECT m.providerMessageId FROM Message m WHERE m.providerMessageId IN :providerMessageIds")
    List<String> findExistingProviderMessageIds(@Param("providerMessageIds") Collection<String> providerMessageIds);

    long countByProviderMessageIdIn(Collection<String> providerMessageIds);

    List<Message> findByThreadId(Long threadId);

    @Query("SELECT COUNT(m) FROM Message m WHERE m.threadId IN " +
           "(SELECT t.id FROM MailThread t WHERE t.accountId = :accountId)")
    long countByAccountId(@Param("accountId") Long accountId);
}

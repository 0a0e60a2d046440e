package com.unifiedinbox.repository;

import com.unifiedinbox.entity.MailThread;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MailThreadRepository extends JpaRepository<MailThread, Long> {

    Optional<MailThread> findByAccountIdAndProviderThreadId(Long accountId, String providerThreadId);

    List<MailThread> findByAccountId(Long accountId);

    long countByAccountId(Long accountId);
}

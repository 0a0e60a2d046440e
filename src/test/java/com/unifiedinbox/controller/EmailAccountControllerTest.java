package com.unifiedinbox.controller;

import com.unifiedinbox.entity.EmailAccount;
import com.unifiedinbox.repository.EmailAccountRepository;
import com.unifiedinbox.service.BackgroundSyncService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(EmailAccountController.class)
class EmailAccountControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private EmailAccountRepository emailAccountRepository;
    @MockBean
    private BackgroundSyncService backgroundSyncService;

    private static EmailAccount account(boolean active) {
        EmailAccount account = new EmailAccount();
        account.setId(7L);
        account.setUserId(1L);
        account.setEmailAddress("ada@example.com");
        account.setProvider(EmailAccount.EmailProvider.OUTLOOK);
        account.setActive(active);
        account.setLastSyncedAt(Instant.parse("2024-05-01T10:00:00Z"));
        if (!active) {
            account.setLastSyncError("Re-authorization required: invalid_grant");
        }
        return account;
    }

    @Test
    void syncTriggerQueuesTheAccount() throws Exception {
        when(emailAccountRepository.existsById(7L)).thenReturn(true);
        when(backgroundSyncService.requestSync(7L)).thenReturn(true);

        mockMvc.perform(post("/api/accounts/7/sync"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.accountId").value(7))
            .andExpect(jsonPath("$.queued").value(true));
    }

    @Test
    void syncTriggerForUnknownAccountIsNotFound() throws Exception {
        when(emailAccountRepository.existsById(99L)).thenReturn(false);

        mockMvc.perform(post("/api/accounts/99/sync"))
            .andExpect(status().isNotFound());

        verify(backgroundSyncService, never()).requestSync(any());
    }

    @Test
    void statusShowsDeactivatedAccountsAsNeedingReauthorization() throws Exception {
        when(emailAccountRepository.findById(7L)).thenReturn(Optional.of(account(false)));

        mockMvc.perform(get("/api/accounts/7/sync-status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.provider").value("OUTLOOK"))
            .andExpect(jsonPath("$.active").value(false))
            .andExpect(jsonPath("$.requiresReauthorization").value(true))
            .andExpect(jsonPath("$.lastSyncError").value("Re-authorization required: invalid_grant"))
            .andExpect(jsonPath("$.lastSyncedAt").value("2024-05-01T10:00:00Z"));
    }

    @Test
    void listRequiresUserHeader() throws Exception {
        mockMvc.perform(get("/api/accounts"))
            .andExpect(status().isBadRequest());

        when(emailAccountRepository.findByUserId(1L)).thenReturn(List.of(account(true)));
        mockMvc.perform(get("/api/accounts").header("X-User-Id", "1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].email").value("ada@example.com"))
            .andExpect(jsonPath("$[0].requiresReauthorization").value(false));
    }
}

package com.example.support.service;

import com.example.support.domain.Account;
import com.example.support.service.exception.InvalidFormatException;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("UserDirectoryService Unit Tests")
class UserDirectoryServiceTest {

    @Mock
    private AccountRepository accountRepository;

    @InjectMocks
    private UserDirectoryService userDirectory;

    @Test
    @DisplayName("Should strip the leading plus before looking up the phone")
    void shouldNormalizePhone() {
        Account account = Account.builder().id(1L).phone("79991234567").build();
        when(accountRepository.findByPhone("79991234567")).thenReturn(Optional.of(account));

        assertThat(userDirectory.findByPhone(" +79991234567 ")).contains(account);
    }

    @Test
    @DisplayName("Should reject malformed phones without touching storage")
    void shouldRejectMalformedPhone() {
        assertThatThrownBy(() -> userDirectory.findByPhone("abc"))
                .isInstanceOf(InvalidFormatException.class)
                .extracting("errorCode")
                .isEqualTo("invalid_phone");

        verifyNoInteractions(accountRepository);
    }

    @Test
    @DisplayName("Should not look up a blank identity")
    void shouldSkipBlankIdentity() {
        assertThat(userDirectory.findByExternalIdentity("")).isEmpty();
        verifyNoInteractions(accountRepository);
    }

    @Test
    @DisplayName("Should delegate identity linking to the repository")
    void shouldLinkIdentity() {
        when(accountRepository.linkExternalIdentity(1L, "u1")).thenReturn(true);

        assertThat(userDirectory.linkExternalIdentity(1L, "u1")).isTrue();
        verify(accountRepository).linkExternalIdentity(1L, "u1");
    }

    @Test
    @DisplayName("Should prefer the account name unless it is the guest placeholder")
    void shouldPickDisplayName() {
        assertThat(UserDirectoryService.displayName(Account.builder().name("Анна").build(), "anna_tg"))
                .isEqualTo("Анна");
        assertThat(UserDirectoryService.displayName(Account.builder().name("Гость").build(), "anna_tg"))
                .isEqualTo("anna_tg");
        assertThat(UserDirectoryService.displayName(null, null)).isEqualTo("Гость");
    }

    @Test
    @DisplayName("Should derive the branch from the phone prefix")
    void shouldDeriveBranch() {
        assertThat(UserDirectoryService.branchOf(Account.builder().phone("79991234567").build())).isEqualTo("Россия");
        assertThat(UserDirectoryService.branchOf(Account.builder().phone("37529000000").build()))
                .isEqualTo("Неизвестно");
        assertThat(UserDirectoryService.branchOf(null)).isEqualTo("Неизвестно");
    }

    @Test
    @DisplayName("Should keep only the last four digits in logs")
    void shouldRedactPhone() {
        assertThat(UserDirectoryService.redact("79991234567")).isEqualTo("****4567");
        assertThat(UserDirectoryService.redact("12")).isEqualTo("****");
    }
}

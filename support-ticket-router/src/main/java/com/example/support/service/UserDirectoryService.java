package com.example.support.service;

import com.example.support.domain.Account;
import com.example.support.service.exception.InvalidFormatException;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Read-mostly view of the account directory. Accounts are never created here; a missing account is a
 * normal outcome for unregistered users.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserDirectoryService {

    private static final Pattern PHONE_PATTERN = Pattern.compile("\\+?\\d+");
    private static final String GUEST_NAME = "Гость";

    private final AccountRepository accountRepository;

    public Optional<Account> findByPhone(String phone) {
        String normalized = normalizePhone(phone);
        Optional<Account> account = accountRepository.findByPhone(normalized);
        log.debug("Phone lookup {} -> {}", redact(normalized), account.map(Account::getId).orElse(null));
        return account;
    }

    public Optional<Account> findByExternalIdentity(String externalIdentity) {
        if (!StringUtils.hasText(externalIdentity)) {
            return Optional.empty();
        }
        return accountRepository.findByExternalIdentity(externalIdentity);
    }

    public boolean linkExternalIdentity(long accountId, String externalIdentity) {
        if (!StringUtils.hasText(externalIdentity)) {
            throw new IllegalArgumentException("External identity is required");
        }
        boolean written = accountRepository.linkExternalIdentity(accountId, externalIdentity);
        if (written) {
            log.info("Linked conversation {} to account {}", externalIdentity, accountId);
        }
        return written;
    }

    /**
     * Name shown to staff: the account name unless it is the directory's guest placeholder.
     */
    public static String displayName(Account account, String senderName) {
        if (account != null && StringUtils.hasText(account.getName()) && !GUEST_NAME.equals(account.getName())) {
            return account.getName();
        }
        return StringUtils.hasText(senderName) ? senderName : GUEST_NAME;
    }

    public static String branchOf(Account account) {
        return account != null && account.hasPhone() && account.getPhone().startsWith("7") ? "Россия" : "Неизвестно";
    }

    public static String normalizePhone(String phone) {
        String trimmed = phone == null ? "" : phone.trim();
        if (!PHONE_PATTERN.matcher(trimmed).matches()) {
            throw new InvalidFormatException("Phone must contain digits only", "invalid_phone");
        }
        return trimmed.startsWith("+") ? trimmed.substring(1) : trimmed;
    }

    public static String redact(String phone) {
        if (phone == null || phone.length() <= 4) {
            return "****";
        }
        return "****" + phone.substring(phone.length() - 4);
    }
}

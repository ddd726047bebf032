package com.example.support.service;

import com.example.support.domain.Account;
import java.util.Optional;

public interface AccountRepository {

    Optional<Account> findById(long accountId);

    Optional<Account> findByPhone(String phone);

    Optional<Account> findByExternalIdentity(String externalIdentity);

    /**
     * Links the identity to the account and releases it from any other account. Returns
     * {@code false} when the link already existed and nothing was written.
     */
    boolean linkExternalIdentity(long accountId, String externalIdentity);
}

package com.example.support.persistence;

import com.example.support.domain.Account;
import com.example.support.service.AccountRepository;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

@Primary
@Component
@RequiredArgsConstructor
public class RetryingAccountRepository implements AccountRepository {

    private final JpaAccountRepository delegate;
    private final StorageRetryExecutor retryExecutor;

    @Override
    public Optional<Account> findById(long accountId) {
        return retryExecutor.execute("account.findById", () -> delegate.findById(accountId));
    }

    @Override
    public Optional<Account> findByPhone(String phone) {
        return retryExecutor.execute("account.findByPhone", () -> delegate.findByPhone(phone));
    }

    @Override
    public Optional<Account> findByExternalIdentity(String externalIdentity) {
        return retryExecutor.execute("account.findByExternalIdentity",
                () -> delegate.findByExternalIdentity(externalIdentity));
    }

    @Override
    public boolean linkExternalIdentity(long accountId, String externalIdentity) {
        return retryExecutor.execute("account.linkExternalIdentity",
                () -> delegate.linkExternalIdentity(accountId, externalIdentity));
    }
}

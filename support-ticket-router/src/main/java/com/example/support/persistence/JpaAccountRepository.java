package com.example.support.persistence;

import com.example.support.domain.Account;
import com.example.support.service.AccountRepository;
import java.util.Objects;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Repository
@RequiredArgsConstructor
public class JpaAccountRepository implements AccountRepository {

    private final AccountJpaRepository accountJpaRepository;
    private final SupportEntityMapper mapper;

    @Override
    @Transactional(readOnly = true)
    public Optional<Account> findById(long accountId) {
        return accountJpaRepository.findById(accountId).map(mapper::toAccount);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Account> findByPhone(String phone) {
        if (!StringUtils.hasText(phone)) {
            return Optional.empty();
        }
        return accountJpaRepository.findFirstByPhoneOrderByIdAsc(phone).map(mapper::toAccount);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Account> findByExternalIdentity(String externalIdentity) {
        if (!StringUtils.hasText(externalIdentity)) {
            return Optional.empty();
        }
        return accountJpaRepository.findFirstByExternalIdentity(externalIdentity).map(mapper::toAccount);
    }

    @Override
    @Transactional
    public boolean linkExternalIdentity(long accountId, String externalIdentity) {
        Optional<AccountEntity> account = accountJpaRepository.findById(accountId);
        if (account.isEmpty() || Objects.equals(account.get().getExternalIdentity(), externalIdentity)) {
            return false;
        }
        accountJpaRepository.releaseExternalIdentity(externalIdentity, accountId);
        return accountJpaRepository.assignExternalIdentity(accountId, externalIdentity) > 0;
    }
}

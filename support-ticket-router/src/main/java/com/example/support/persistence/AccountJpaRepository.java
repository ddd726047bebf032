package com.example.support.persistence;

import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AccountJpaRepository extends JpaRepository<AccountEntity, Long> {

    Optional<AccountEntity> findFirstByPhoneOrderByIdAsc(String phone);

    Optional<AccountEntity> findFirstByExternalIdentity(String externalIdentity);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(
            "update AccountEntity a set a.externalIdentity = null "
                    + "where a.externalIdentity = :identity and a.id <> :accountId")
    int releaseExternalIdentity(@Param("identity") String identity, @Param("accountId") Long accountId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update AccountEntity a set a.externalIdentity = :identity where a.id = :accountId")
    int assignExternalIdentity(@Param("accountId") Long accountId, @Param("identity") String identity);
}

package com.example.support.persistence;

import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface OrderJpaRepository extends JpaRepository<OrderEntity, Long> {

    List<OrderEntity> findByAccountIdOrderByCreatedAtDescIdAsc(Long accountId, Pageable pageable);

    Optional<OrderEntity> findFirstByOrderNumberOrderByIdDesc(String orderNumber);
}

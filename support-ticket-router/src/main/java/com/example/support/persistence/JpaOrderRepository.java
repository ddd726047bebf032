package com.example.support.persistence;

import com.example.support.domain.OrderSummary;
import com.example.support.service.OrderRepository;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Repository
@RequiredArgsConstructor
public class JpaOrderRepository implements OrderRepository {

    private final OrderJpaRepository orderJpaRepository;
    private final StoreJpaRepository storeJpaRepository;
    private final SupportEntityMapper mapper;

    @Override
    @Transactional(readOnly = true)
    public List<OrderSummary> findRecentOrders(long accountId, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        return orderJpaRepository.findByAccountIdOrderByCreatedAtDescIdAsc(accountId, PageRequest.of(0, limit))
                .stream()
                .map(mapper::toOrder)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<OrderSummary> findByOrderNumber(String orderNumber) {
        if (!StringUtils.hasText(orderNumber)) {
            return Optional.empty();
        }
        return orderJpaRepository.findFirstByOrderNumberOrderByIdDesc(orderNumber).map(mapper::toOrder);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> findStoreTitle(String storeId) {
        if (!StringUtils.hasText(storeId)) {
            return Optional.empty();
        }
        return storeJpaRepository.findById(storeId)
                .map(StoreEntity::displayTitle)
                .filter(StringUtils::hasText);
    }
}

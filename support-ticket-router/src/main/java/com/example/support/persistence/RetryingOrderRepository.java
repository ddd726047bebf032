package com.example.support.persistence;

import com.example.support.domain.OrderSummary;
import com.example.support.service.OrderRepository;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

@Primary
@Component
@RequiredArgsConstructor
public class RetryingOrderRepository implements OrderRepository {

    private final JpaOrderRepository delegate;
    private final StorageRetryExecutor retryExecutor;

    @Override
    public List<OrderSummary> findRecentOrders(long accountId, int limit) {
        return retryExecutor.execute("order.findRecentOrders", () -> delegate.findRecentOrders(accountId, limit));
    }

    @Override
    public Optional<OrderSummary> findByOrderNumber(String orderNumber) {
        return retryExecutor.execute("order.findByOrderNumber", () -> delegate.findByOrderNumber(orderNumber));
    }

    @Override
    public Optional<String> findStoreTitle(String storeId) {
        return retryExecutor.execute("order.findStoreTitle", () -> delegate.findStoreTitle(storeId));
    }
}

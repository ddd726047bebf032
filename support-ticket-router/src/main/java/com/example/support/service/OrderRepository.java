package com.example.support.service;

import com.example.support.domain.OrderSummary;
import java.util.List;
import java.util.Optional;

public interface OrderRepository {

    /**
     * Newest orders first, ties broken by insertion order.
     */
    List<OrderSummary> findRecentOrders(long accountId, int limit);

    Optional<OrderSummary> findByOrderNumber(String orderNumber);

    /**
     * Street for express stores, title otherwise.
     */
    Optional<String> findStoreTitle(String storeId);
}

package com.example.support.persistence;

import com.example.support.domain.Account;
import com.example.support.domain.OrderSummary;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Account directory and order history queries against an in-memory schema.
 */
@DataJpaTest
@ActiveProfiles("test")
@DisplayName("Account and order repositories Integration Tests")
class JpaAccountRepositoryTest {

    @Autowired
    private AccountJpaRepository accountJpaRepository;

    @Autowired
    private OrderJpaRepository orderJpaRepository;

    @Autowired
    private StoreJpaRepository storeJpaRepository;

    @Autowired
    private TestEntityManager entityManager;

    private JpaAccountRepository accounts;
    private JpaOrderRepository orders;

    @BeforeEach
    void setUp() {
        SupportEntityMapper mapper = new SupportEntityMapper();
        accounts = new JpaAccountRepository(accountJpaRepository, mapper);
        orders = new JpaOrderRepository(orderJpaRepository, storeJpaRepository, mapper);
    }

    private AccountEntity account(long id, String phone, String identity) {
        AccountEntity entity = new AccountEntity();
        entity.setId(id);
        entity.setName("Клиент " + id);
        entity.setPhone(phone);
        entity.setExternalIdentity(identity);
        return entityManager.persistAndFlush(entity);
    }

    private void order(long id, long accountId, String number, LocalDateTime createdAt, String storeId) {
        OrderEntity entity = new OrderEntity();
        entity.setId(id);
        entity.setAccountId(accountId);
        entity.setOrderNumber(number);
        entity.setCreatedAt(createdAt);
        entity.setStoreId(storeId);
        entityManager.persistAndFlush(entity);
    }

    private void store(String id, String title, String kind, String street) {
        StoreEntity entity = new StoreEntity();
        entity.setId(id);
        entity.setTitle(title);
        entity.setKind(kind);
        entity.setStreet(street);
        entityManager.persistAndFlush(entity);
    }

    @Nested
    @DisplayName("accounts")
    class Accounts {

        @Test
        @DisplayName("Should find the oldest account by phone")
        void shouldFindByPhone() {
            account(2L, "79991234567", null);
            account(1L, "79991234567", null);

            assertThat(accounts.findByPhone("79991234567")).map(Account::getId).contains(1L);
            assertThat(accounts.findByPhone("70000000000")).isEmpty();
        }

        @Test
        @DisplayName("Should write the identity link only when it changes")
        void shouldLinkIdentityOnce() {
            account(1L, "79991234567", null);

            assertThat(accounts.linkExternalIdentity(1L, "u1")).isTrue();
            assertThat(accounts.linkExternalIdentity(1L, "u1")).isFalse();
            assertThat(accounts.findByExternalIdentity("u1")).map(Account::getId).contains(1L);
        }

        @Test
        @DisplayName("Should move the identity away from the previously linked account")
        void shouldReleaseIdentityFromOtherAccount() {
            account(1L, "79990000001", "u1");
            account(2L, "79990000002", null);

            assertThat(accounts.linkExternalIdentity(2L, "u1")).isTrue();

            assertThat(accounts.findByExternalIdentity("u1")).map(Account::getId).contains(2L);
            assertThat(accounts.findById(1L)).map(Account::getExternalIdentity).isEmpty();
        }

        @Test
        @DisplayName("Should not link an unknown account")
        void shouldIgnoreUnknownAccount() {
            assertThat(accounts.linkExternalIdentity(404L, "u1")).isFalse();
        }
    }

    @Nested
    @DisplayName("orders")
    class Orders {

        @Test
        @DisplayName("Should list recent orders newest first up to the limit")
        void shouldListRecentOrders() {
            account(1L, "79991234567", null);
            order(10L, 1L, "A-1", LocalDateTime.of(2024, 4, 1, 12, 0), null);
            order(11L, 1L, "A-2", LocalDateTime.of(2024, 4, 20, 9, 30), null);
            order(12L, 1L, "A-3", LocalDateTime.of(2024, 4, 10, 18, 0), null);
            order(13L, 2L, "B-1", LocalDateTime.of(2024, 4, 30, 18, 0), null);

            List<OrderSummary> recent = orders.findRecentOrders(1L, 2);

            assertThat(recent).extracting(OrderSummary::getOrderNumber).containsExactly("A-2", "A-3");
            assertThat(orders.findRecentOrders(1L, 0)).isEmpty();
        }

        @Test
        @DisplayName("Should resolve the store title of an order, using the street for express stores")
        void shouldResolveStoreTitle() {
            store("s1", "ТЦ Столица", "mall", "Ленина, 1");
            store("s2", "Экспресс", "express", "Кирова, 5");
            store("s3", "", "mall", null);
            order(10L, 1L, "A-1", LocalDateTime.of(2024, 4, 1, 12, 0), "s2");

            assertThat(orders.findStoreTitle("s1")).contains("ТЦ Столица");
            assertThat(orders.findStoreTitle("s2")).contains("Кирова, 5");
            assertThat(orders.findStoreTitle("s3")).isEmpty();
            assertThat(orders.findByOrderNumber("A-1")).map(OrderSummary::getStoreId).contains("s2");
        }
    }
}

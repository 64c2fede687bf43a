package com.example.catalog.unit.application;

import com.example.catalog.application.dto.CreateOrderCommand;
import com.example.catalog.application.dto.OrderLine;
import com.example.catalog.application.dto.PartialReturnCommand;
import com.example.catalog.application.service.OrderLifecycleService;
import com.example.catalog.domain.exception.EntityNotFoundException;
import com.example.catalog.domain.exception.InsufficientStockException;
import com.example.catalog.domain.exception.InvalidInputException;
import com.example.catalog.domain.exception.InvalidOrderStateException;
import com.example.catalog.domain.model.Order;
import com.example.catalog.domain.model.OrderItem;
import com.example.catalog.domain.model.OrderStatus;
import com.example.catalog.support.InMemoryStoreFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for OrderLifecycleService, run against the real in-memory stores.
 */
@DisplayName("Order Lifecycle Service Tests")
class OrderLifecycleServiceTest {

    private InMemoryStoreFixture fixture;
    private OrderLifecycleService service;

    @BeforeEach
    void setUp() {
        fixture = new InMemoryStoreFixture();
        service = new OrderLifecycleService(fixture.productStore, fixture.orderStore, fixture.coordinator);
    }

    @Nested
    @DisplayName("Create Order")
    class CreateOrder {

        @Test
        @DisplayName("should_reserve_stock_for_every_line")
        void should_reserve_stock_for_every_line() {
            // Given: A stock=5, B stock=2
            long a = fixture.product("A", 5);
            long b = fixture.product("B", 2);

            // When
            Order order = service.createOrder(command("John", line(a, 3), line(b, 2)));

            // Then
            assertThat(order.getId()).isPositive();
            assertThat(order.getStatus()).isEqualTo(OrderStatus.CONFIRMED);
            assertThat(order.getItems()).containsExactly(OrderItem.of(a, 3), OrderItem.of(b, 2));
            assertThat(order.getCreatedAt()).isEqualTo(InMemoryStoreFixture.START);
            assertThat(order.getUpdatedAt()).isEqualTo(InMemoryStoreFixture.START);
            assertThat(fixture.stockOf(a)).isEqualTo(2);
            assertThat(fixture.stockOf(b)).isZero();
        }

        @Test
        @DisplayName("should_fail_with_not_enough_stock_and_leave_stock_unchanged")
        void should_fail_with_not_enough_stock_and_leave_stock_unchanged() {
            // Given
            long a = fixture.product("A", 1);

            // When
            InsufficientStockException ex = catchThrowableOfType(
                    () -> service.createOrder(command("John", line(a, 2))), InsufficientStockException.class);

            // Then
            assertThat(ex.getProductId()).isEqualTo(a);
            assertThat(ex.getRequestedQuantity()).isEqualTo(2);
            assertThat(ex.getAvailableQuantity()).isEqualTo(1);
            assertThat(fixture.stockOf(a)).isEqualTo(1);
            assertThat(fixture.orderStore.count()).isZero();
        }

        @Test
        @DisplayName("should_check_summed_quantity_of_duplicate_lines")
        void should_check_summed_quantity_of_duplicate_lines() {
            // Given: each line alone fits, together they do not
            long a = fixture.product("A", 4);

            // When & Then
            assertThatThrownBy(() -> service.createOrder(command("John", line(a, 3), line(a, 2))))
                    .isInstanceOf(InsufficientStockException.class)
                    .hasMessageContaining("requested 5");
            assertThat(fixture.stockOf(a)).isEqualTo(4);
        }

        @Test
        @DisplayName("should_keep_duplicate_lines_and_reserve_their_sum")
        void should_keep_duplicate_lines_and_reserve_their_sum() {
            // Given
            long a = fixture.product("A", 5);

            // When
            Order order = service.createOrder(command("John", line(a, 3), line(a, 2)));

            // Then
            assertThat(order.getItems()).containsExactly(OrderItem.of(a, 3), OrderItem.of(a, 2));
            assertThat(fixture.stockOf(a)).isZero();
        }

        @Test
        @DisplayName("should_leave_other_products_untouched_when_one_is_missing")
        void should_leave_other_products_untouched_when_one_is_missing() {
            // Given
            long a = fixture.product("A", 5);

            // When & Then
            assertThatThrownBy(() -> service.createOrder(command("John", line(a, 2), line(999L, 1))))
                    .isInstanceOf(EntityNotFoundException.class)
                    .hasMessageContaining("999");
            assertThat(fixture.stockOf(a)).isEqualTo(5);
            assertThat(fixture.orderStore.count()).isZero();
        }

        @Test
        @DisplayName("should_reject_invalid_input_without_opening_a_transaction")
        void should_reject_invalid_input_without_opening_a_transaction() {
            // Given
            long a = fixture.product("A", 5);

            // When & Then
            assertThatThrownBy(() -> service.createOrder(command(" ", line(a, 1))))
                    .isInstanceOf(InvalidInputException.class);
            assertThatThrownBy(() -> service.createOrder(new CreateOrderCommand("John", List.of())))
                    .isInstanceOf(InvalidInputException.class);
            assertThatThrownBy(() -> service.createOrder(new CreateOrderCommand("John", null)))
                    .isInstanceOf(InvalidInputException.class);
            assertThatThrownBy(() -> service.createOrder(command("John", line(a, 0))))
                    .isInstanceOf(InvalidInputException.class);
            assertThatThrownBy(() -> service.createOrder(command("John", line(-1L, 1))))
                    .isInstanceOf(InvalidInputException.class);

            assertThat(fixture.coordinator.getCommittedCount()).isZero();
            assertThat(fixture.coordinator.getAbortedCount()).isZero();
            assertThat(fixture.stockOf(a)).isEqualTo(5);
        }

        @Test
        @DisplayName("should_reject_summed_quantity_overflow")
        void should_reject_summed_quantity_overflow() {
            // Given
            long a = fixture.product("A", 5);

            // When & Then
            assertThatThrownBy(() -> service.createOrder(
                    command("John", line(a, Long.MAX_VALUE), line(a, 1))))
                    .isInstanceOf(InvalidInputException.class);
        }

        @Test
        @DisplayName("should_reject_null_line_as_invalid_input")
        void should_reject_null_line_as_invalid_input() {
            // Given
            long a = fixture.product("A", 5);
            CreateOrderCommand withNullLine = new CreateOrderCommand("John", Arrays.asList(line(a, 1), null));

            // When & Then
            assertThatThrownBy(() -> service.createOrder(withNullLine))
                    .isInstanceOf(InvalidInputException.class)
                    .hasMessageContaining("cannot be null");
            assertThat(fixture.stockOf(a)).isEqualTo(5);
            assertThat(fixture.orderStore.count()).isZero();
        }

        @Test
        @DisplayName("should_never_oversell_under_concurrent_orders")
        void should_never_oversell_under_concurrent_orders() throws Exception {
            // Given: 50 units, 20 buyers of 5 units each
            long a = fixture.product("A", 50);
            int buyers = 20;
            ExecutorService executor = Executors.newFixedThreadPool(8);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Boolean>> results = new ArrayList<>();

            try {
                for (int i = 0; i < buyers; i++) {
                    String customer = "buyer-" + i;
                    results.add(executor.submit(() -> {
                        start.await();
                        try {
                            service.createOrder(command(customer, line(a, 5)));
                            return true;
                        } catch (InsufficientStockException e) {
                            return false;
                        }
                    }));
                }

                // When
                start.countDown();
                long succeeded = 0;
                for (Future<Boolean> result : results) {
                    if (result.get(10, TimeUnit.SECONDS)) {
                        succeeded++;
                    }
                }

                // Then
                assertThat(succeeded).isEqualTo(10);
                assertThat(fixture.stockOf(a)).isZero();
                assertThat(fixture.orderStore.count()).isEqualTo(10);
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Get Order")
    class GetOrder {

        @Test
        @DisplayName("should_return_stored_order")
        void should_return_stored_order() {
            // Given
            long a = fixture.product("A", 5);
            Order created = service.createOrder(command("John", line(a, 1)));

            // When
            Order found = service.getOrder(created.getId());

            // Then
            assertThat(found.getCustomerName()).isEqualTo("John");
            assertThat(found.getItems()).containsExactly(OrderItem.of(a, 1));
        }

        @Test
        @DisplayName("should_reject_non_positive_id_and_report_missing_order")
        void should_reject_non_positive_id_and_report_missing_order() {
            assertThatThrownBy(() -> service.getOrder(0))
                    .isInstanceOf(InvalidInputException.class);
            assertThatThrownBy(() -> service.getOrder(42))
                    .isInstanceOf(EntityNotFoundException.class)
                    .hasMessageContaining("Order not found: 42");
        }
    }

    @Nested
    @DisplayName("Cancel Order")
    class CancelOrder {

        @Test
        @DisplayName("should_restore_stock_and_mark_cancelled")
        void should_restore_stock_and_mark_cancelled() {
            // Given
            long a = fixture.product("A", 5);
            long b = fixture.product("B", 2);
            Order order = service.createOrder(command("John", line(a, 3), line(b, 2)));
            fixture.clock.advance(Duration.ofMinutes(5));

            // When
            Order cancelled = service.cancelOrder(order.getId());

            // Then
            assertThat(cancelled.getStatus()).isEqualTo(OrderStatus.CANCELLED);
            assertThat(cancelled.getUpdatedAt()).isEqualTo(InMemoryStoreFixture.START.plus(Duration.ofMinutes(5)));
            assertThat(cancelled.getCreatedAt()).isEqualTo(InMemoryStoreFixture.START);
            assertThat(fixture.stockOf(a)).isEqualTo(5);
            assertThat(fixture.stockOf(b)).isEqualTo(2);
        }

        @Test
        @DisplayName("should_reject_second_cancel_without_changing_stock")
        void should_reject_second_cancel_without_changing_stock() {
            // Given
            long a = fixture.product("A", 5);
            Order order = service.createOrder(command("John", line(a, 3)));
            service.cancelOrder(order.getId());

            // When & Then
            assertThatThrownBy(() -> service.cancelOrder(order.getId()))
                    .isInstanceOf(InvalidOrderStateException.class);
            assertThat(fixture.stockOf(a)).isEqualTo(5);
            assertThat(service.getOrder(order.getId()).getStatus()).isEqualTo(OrderStatus.CANCELLED);
        }

        @Test
        @DisplayName("should_restore_duplicate_lines_in_full")
        void should_restore_duplicate_lines_in_full() {
            // Given
            long a = fixture.product("A", 6);
            Order order = service.createOrder(command("John", line(a, 2), line(a, 3)));

            // When
            service.cancelOrder(order.getId());

            // Then
            assertThat(fixture.stockOf(a)).isEqualTo(6);
        }

        @Test
        @DisplayName("should_leave_everything_untouched_when_a_product_was_deleted")
        void should_leave_everything_untouched_when_a_product_was_deleted() {
            // Given
            long a = fixture.product("A", 5);
            long b = fixture.product("B", 5);
            Order order = service.createOrder(command("John", line(a, 2), line(b, 1)));
            fixture.productStore.delete(b);

            // When & Then
            assertThatThrownBy(() -> service.cancelOrder(order.getId()))
                    .isInstanceOf(EntityNotFoundException.class);
            assertThat(fixture.stockOf(a)).isEqualTo(3);
            assertThat(service.getOrder(order.getId()).getStatus()).isEqualTo(OrderStatus.CONFIRMED);
        }

        @Test
        @DisplayName("should_reject_restore_beyond_stock_limit_without_mutation")
        void should_reject_restore_beyond_stock_limit_without_mutation() {
            // Given: stock of B raised to the limit after the order was placed
            long a = fixture.product("A", 5);
            long b = fixture.product("B", 5);
            Order order = service.createOrder(command("John", line(a, 2), line(b, 1)));
            fixture.productStore.update(fixture.productStore.getById(b).withStock(Long.MAX_VALUE));

            // When & Then
            assertThatThrownBy(() -> service.cancelOrder(order.getId()))
                    .isInstanceOf(InvalidInputException.class)
                    .hasMessageContaining("limit");
            assertThat(fixture.stockOf(a)).isEqualTo(3);
            assertThat(fixture.stockOf(b)).isEqualTo(Long.MAX_VALUE);
            assertThat(service.getOrder(order.getId()).getStatus()).isEqualTo(OrderStatus.CONFIRMED);
        }

        @Test
        @DisplayName("should_report_missing_order")
        void should_report_missing_order() {
            assertThatThrownBy(() -> service.cancelOrder(7))
                    .isInstanceOf(EntityNotFoundException.class);
            assertThatThrownBy(() -> service.cancelOrder(-7))
                    .isInstanceOf(InvalidInputException.class);
        }
    }

    @Nested
    @DisplayName("Partial Return")
    class PartialReturn {

        @Test
        @DisplayName("should_return_quantities_and_keep_order_confirmed")
        void should_return_quantities_and_keep_order_confirmed() {
            // Given: order holds A:4, B:3
            long a = fixture.product("A", 10);
            long b = fixture.product("B", 10);
            Order order = service.createOrder(command("John", line(a, 4), line(b, 3)));
            fixture.clock.advance(Duration.ofSeconds(30));

            // When
            Order updated = service.partialReturn(returning(order.getId(), line(a, 2), line(b, 1)));

            // Then
            assertThat(updated.getStatus()).isEqualTo(OrderStatus.CONFIRMED);
            assertThat(updated.quantitiesByProduct()).containsExactly(Map.entry(a, 2L), Map.entry(b, 2L));
            assertThat(updated.getUpdatedAt()).isEqualTo(InMemoryStoreFixture.START.plusSeconds(30));
            assertThat(fixture.stockOf(a)).isEqualTo(8);
            assertThat(fixture.stockOf(b)).isEqualTo(8);
        }

        @Test
        @DisplayName("should_reject_over_return_without_mutation")
        void should_reject_over_return_without_mutation() {
            // Given: order holds 2 units of A
            long a = fixture.product("A", 5);
            Order order = service.createOrder(command("John", line(a, 2)));

            // When & Then
            assertThatThrownBy(() -> service.partialReturn(returning(order.getId(), line(a, 3))))
                    .isInstanceOf(InvalidInputException.class)
                    .hasMessageContaining("holds 2");
            assertThat(fixture.stockOf(a)).isEqualTo(3);
            assertThat(service.getOrder(order.getId()).getItems()).containsExactly(OrderItem.of(a, 2));
        }

        @Test
        @DisplayName("should_validate_summed_return_entries")
        void should_validate_summed_return_entries() {
            // Given: each entry alone fits, together they exceed the held quantity
            long a = fixture.product("A", 5);
            Order order = service.createOrder(command("John", line(a, 2)));

            // When & Then
            assertThatThrownBy(() -> service.partialReturn(returning(order.getId(), line(a, 1), line(a, 2))))
                    .isInstanceOf(InvalidInputException.class);
            assertThat(fixture.stockOf(a)).isEqualTo(3);
        }

        @Test
        @DisplayName("should_reject_product_not_held_by_order")
        void should_reject_product_not_held_by_order() {
            // Given
            long a = fixture.product("A", 5);
            long b = fixture.product("B", 5);
            Order order = service.createOrder(command("John", line(a, 2)));

            // When & Then
            assertThatThrownBy(() -> service.partialReturn(returning(order.getId(), line(a, 1), line(b, 1))))
                    .isInstanceOf(InvalidInputException.class);
            assertThat(fixture.stockOf(a)).isEqualTo(3);
            assertThat(fixture.stockOf(b)).isEqualTo(5);
        }

        @Test
        @DisplayName("should_reduce_first_line_when_return_is_smaller")
        void should_reduce_first_line_when_return_is_smaller() {
            // Given: lines A:2, A:3
            long a = fixture.product("A", 5);
            Order order = service.createOrder(command("John", line(a, 2), line(a, 3)));

            // When
            Order updated = service.partialReturn(returning(order.getId(), line(a, 1)));

            // Then
            assertThat(updated.getItems()).containsExactly(OrderItem.of(a, 1), OrderItem.of(a, 3));
            assertThat(fixture.stockOf(a)).isEqualTo(1);
        }

        @Test
        @DisplayName("should_drop_first_line_when_return_matches_it")
        void should_drop_first_line_when_return_matches_it() {
            // Given: lines A:2, A:3
            long a = fixture.product("A", 5);
            Order order = service.createOrder(command("John", line(a, 2), line(a, 3)));

            // When
            Order updated = service.partialReturn(returning(order.getId(), line(a, 2)));

            // Then
            assertThat(updated.getItems()).containsExactly(OrderItem.of(a, 3));
            assertThat(fixture.stockOf(a)).isEqualTo(2);
        }

        @Test
        @DisplayName("should_carry_remainder_over_to_next_line")
        void should_carry_remainder_over_to_next_line() {
            // Given: lines A:2, B:1, A:3
            long a = fixture.product("A", 5);
            long b = fixture.product("B", 1);
            Order order = service.createOrder(command("John", line(a, 2), line(b, 1), line(a, 3)));

            // When: return 4 of A
            Order updated = service.partialReturn(returning(order.getId(), line(a, 4)));

            // Then: first A line dropped, second reduced by 2
            assertThat(updated.getItems()).containsExactly(OrderItem.of(b, 1), OrderItem.of(a, 1));
            assertThat(fixture.stockOf(a)).isEqualTo(4);
            assertThat(fixture.stockOf(b)).isZero();
        }

        @Test
        @DisplayName("should_keep_confirmed_order_with_no_items_left")
        void should_keep_confirmed_order_with_no_items_left() {
            // Given
            long a = fixture.product("A", 5);
            Order order = service.createOrder(command("John", line(a, 2), line(a, 3)));

            // When
            Order updated = service.partialReturn(returning(order.getId(), line(a, 5)));

            // Then
            assertThat(updated.getItems()).isEmpty();
            assertThat(updated.getStatus()).isEqualTo(OrderStatus.CONFIRMED);
            assertThat(fixture.stockOf(a)).isEqualTo(5);
        }

        @Test
        @DisplayName("should_reject_return_on_cancelled_order")
        void should_reject_return_on_cancelled_order() {
            // Given
            long a = fixture.product("A", 5);
            Order order = service.createOrder(command("John", line(a, 2)));
            service.cancelOrder(order.getId());

            // When & Then
            assertThatThrownBy(() -> service.partialReturn(returning(order.getId(), line(a, 1))))
                    .isInstanceOf(InvalidOrderStateException.class);
            assertThat(fixture.stockOf(a)).isEqualTo(5);
        }

        @Test
        @DisplayName("should_leave_everything_untouched_when_a_returned_product_was_deleted")
        void should_leave_everything_untouched_when_a_returned_product_was_deleted() {
            // Given
            long a = fixture.product("A", 5);
            long b = fixture.product("B", 5);
            Order order = service.createOrder(command("John", line(a, 2), line(b, 2)));
            fixture.productStore.delete(b);

            // When & Then
            assertThatThrownBy(() -> service.partialReturn(returning(order.getId(), line(a, 1), line(b, 1))))
                    .isInstanceOf(EntityNotFoundException.class);
            assertThat(fixture.stockOf(a)).isEqualTo(3);
            assertThat(service.getOrder(order.getId()).getItems()).hasSize(2);
        }

        @Test
        @DisplayName("should_reject_null_return_entry_as_invalid_input")
        void should_reject_null_return_entry_as_invalid_input() {
            // Given
            long a = fixture.product("A", 5);
            Order order = service.createOrder(command("John", line(a, 2)));

            // When & Then
            assertThatThrownBy(() -> service.partialReturn(
                    new PartialReturnCommand(order.getId(), Arrays.asList((OrderLine) null))))
                    .isInstanceOf(InvalidInputException.class);
            assertThat(fixture.stockOf(a)).isEqualTo(3);
        }

        @Test
        @DisplayName("should_reject_invalid_return_requests")
        void should_reject_invalid_return_requests() {
            assertThatThrownBy(() -> service.partialReturn(new PartialReturnCommand(1L, List.of())))
                    .isInstanceOf(InvalidInputException.class);
            assertThatThrownBy(() -> service.partialReturn(returning(0L, line(1L, 1))))
                    .isInstanceOf(InvalidInputException.class);
            assertThatThrownBy(() -> service.partialReturn(returning(1L, line(1L, -1))))
                    .isInstanceOf(InvalidInputException.class);
            assertThatThrownBy(() -> service.partialReturn(returning(99L, line(1L, 1))))
                    .isInstanceOf(EntityNotFoundException.class);
        }
    }

    private static OrderLine line(long productId, long quantity) {
        return new OrderLine(productId, quantity);
    }

    private static CreateOrderCommand command(String customerName, OrderLine... lines) {
        return new CreateOrderCommand(customerName, List.of(lines));
    }

    private static PartialReturnCommand returning(long orderId, OrderLine... lines) {
        return new PartialReturnCommand(orderId, List.of(lines));
    }
}

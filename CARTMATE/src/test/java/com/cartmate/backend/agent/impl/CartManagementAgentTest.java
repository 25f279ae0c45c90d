package com.cartmate.backend.agent.impl;

import com.cartmate.backend.cart.CartService;
import com.cartmate.backend.client.CartServiceClient;
import com.cartmate.backend.client.CartServiceClient.Cart;
import com.cartmate.backend.client.CartServiceClient.CartLine;
import com.cartmate.backend.domain.model.A2aResponse;
import com.cartmate.backend.domain.model.RequestType;
import com.cartmate.backend.domain.model.payload.CartCommand;
import com.cartmate.backend.domain.model.payload.RequestPayload;
import com.cartmate.backend.domain.model.payload.SessionScope;
import com.cartmate.backend.support.A2aTestHarness;
import com.cartmate.backend.support.RecordingAgent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link CartManagementAgent}.
 */
class CartManagementAgentTest {

    private static final String USER_ID = "user_s1";

    private A2aTestHarness harness;
    private CartServiceClient cartClient;
    private RecordingAgent requester;

    @BeforeEach
    void setUp() {
        harness = new A2aTestHarness();
        cartClient = mock(CartServiceClient.class);
        when(cartClient.isAvailable()).thenReturn(Mono.just(true));
        when(cartClient.addItem(anyString(), anyString(), anyInt())).thenReturn(Mono.empty());
        when(cartClient.emptyCart(anyString())).thenReturn(Mono.empty());
        new CartManagementAgent(harness.runtime, new CartService(cartClient)).start().block();
        requester = harness.startRecordingAgent("orchestrator_001", "orchestrator");
    }

    @AfterEach
    void tearDown() {
        harness.dispose();
    }

    private A2aResponse request(RequestType type, RequestPayload payload) {
        requester.sendRequest(CartManagementAgent.AGENT_ID, type, payload, null).block();
        assertThat(requester.getResponses()).hasSize(1);
        return requester.getResponses().get(0);
    }

    @Nested
    @DisplayName("Adding items")
    class AddTests {

        @Test
        @DisplayName("should add every valid item and report invalid ones")
        @SuppressWarnings("unchecked")
        void addsItems() {
            // Given
            CartCommand command = new CartCommand("s1", List.of(
                    new CartCommand.CartItem("OLJCESPC7Z", 2),
                    new CartCommand.CartItem("66VCHSJNUP", 0)));

            // When
            A2aResponse response = request(RequestType.ADD_TO_CART, command);

            // Then
            assertThat(response.isSuccess()).isTrue();
            assertThat(response.getData()).containsEntry("total_added", 1);
            assertThat((List<Map<String, Object>>) response.getData().get("failed_items"))
                    .extracting(item -> item.get("product_id"))
                    .containsExactly("66VCHSJNUP");
            verify(cartClient).addItem(USER_ID, "OLJCESPC7Z", 2);
            verify(cartClient, never()).addItem(USER_ID, "66VCHSJNUP", 0);
            assertThat(requester.getNotifications().get(1).getContent()).isEqualTo("Added 1 item(s) to cart (1 failed)");
        }

        @Test
        @DisplayName("should fail when no item could be added")
        void nothingAdded() {
            when(cartClient.addItem(USER_ID, "OLJCESPC7Z", 1))
                    .thenReturn(Mono.error(new IllegalStateException("out of stock")));

            A2aResponse response = request(RequestType.ADD_TO_CART, CartCommand.single("s1", "OLJCESPC7Z", 1));

            assertThat(response.isSuccess()).isFalse();
            assertThat(response.getError()).isEqualTo("Failed to add items to cart");
        }

        @Test
        @DisplayName("should reject an empty command")
        void emptyCommand() {
            A2aResponse response = request(RequestType.ADD_TO_CART, new CartCommand("s1", List.of()));

            assertThat(response.getError()).isEqualTo("No items to add to cart");
        }

        @Test
        @DisplayName("should fail when the cart service is unavailable")
        void serviceUnavailable() {
            when(cartClient.isAvailable()).thenReturn(Mono.just(false));

            A2aResponse response = request(RequestType.ADD_TO_CART, CartCommand.single("s1", "OLJCESPC7Z", 1));

            assertThat(response.getError()).isEqualTo("Cart service unavailable");
            verify(cartClient, never()).addItem(anyString(), anyString(), anyInt());
        }
    }

    @Nested
    @DisplayName("Reading and clearing")
    class ReadTests {

        @Test
        @DisplayName("should return the cart with its total quantity")
        void getsCart() {
            when(cartClient.getCart(USER_ID)).thenReturn(Mono.just(new Cart(USER_ID, List.of(
                    new CartLine("OLJCESPC7Z", 2), new CartLine("66VCHSJNUP", 1)))));

            A2aResponse response = request(RequestType.GET_CART, new SessionScope("s1"));

            assertThat(response.getData()).containsEntry("total_quantity", 3);
            assertThat(requester.getNotifications().get(1).getContent()).isEqualTo("Cart has 3 item(s)");
        }

        @Test
        @DisplayName("should empty the cart")
        void clearsCart() {
            A2aResponse response = request(RequestType.CLEAR_CART, new SessionScope("s1"));

            assertThat(response.getData()).containsEntry("message", "Cart cleared");
            verify(cartClient).emptyCart(USER_ID);
        }
    }

    @Nested
    @DisplayName("Rewriting")
    class RewriteTests {

        @Test
        @DisplayName("should rewrite the cart without the removed product")
        void removesItem() {
            // Given
            when(cartClient.getCart(USER_ID)).thenReturn(Mono.just(new Cart(USER_ID, List.of(
                    new CartLine("OLJCESPC7Z", 2), new CartLine("66VCHSJNUP", 1)))));

            // When
            A2aResponse response = request(RequestType.REMOVE_FROM_CART, CartCommand.single("s1", "OLJCESPC7Z", 0));

            // Then
            assertThat(response.isSuccess()).isTrue();
            assertThat(response.getData()).containsEntry("total_quantity", 1);
            InOrder order = inOrder(cartClient);
            order.verify(cartClient).emptyCart(USER_ID);
            order.verify(cartClient).addItem(USER_ID, "66VCHSJNUP", 1);
            verify(cartClient, never()).addItem(USER_ID, "OLJCESPC7Z", 2);
        }

        @Test
        @DisplayName("should change quantities and drop lines set to zero")
        @SuppressWarnings("unchecked")
        void updatesQuantities() {
            when(cartClient.getCart(USER_ID)).thenReturn(Mono.just(new Cart(USER_ID, List.of(
                    new CartLine("OLJCESPC7Z", 2), new CartLine("66VCHSJNUP", 1)))));

            A2aResponse response = request(RequestType.UPDATE_CART_ITEM, new CartCommand("s1", List.of(
                    new CartCommand.CartItem("OLJCESPC7Z", 5),
                    new CartCommand.CartItem("66VCHSJNUP", 0))));

            assertThat((List<Map<String, Object>>) response.getData().get("items"))
                    .containsExactly(Map.of("product_id", "OLJCESPC7Z", "quantity", 5));
            assertThat(response.getData()).containsEntry("message", "Updated 2 cart items");
            verify(cartClient).addItem(USER_ID, "OLJCESPC7Z", 5);
        }

        @Test
        @DisplayName("should report a cart service failure")
        void rewriteFailure() {
            when(cartClient.getCart(USER_ID)).thenReturn(Mono.error(new IllegalStateException("connection refused")));

            A2aResponse response = request(RequestType.REMOVE_FROM_CART, CartCommand.single("s1", "OLJCESPC7Z", 0));

            assertThat(response.getError()).isEqualTo("Error removing from cart: connection refused");
        }
    }
}

package com.cartmate.backend.api.v1;

import com.cartmate.backend.cart.CartService;
import com.cartmate.backend.client.CartServiceClient;
import com.cartmate.backend.client.CartServiceClient.Cart;
import com.cartmate.backend.client.CartServiceClient.CartLine;
import com.cartmate.backend.client.Money;
import com.cartmate.backend.client.ProductCatalogClient;
import com.cartmate.backend.client.ProductCatalogClient.Product;
import com.cartmate.backend.config.StorageConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.http.MediaType;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.validation.beanvalidation.LocalValidatorFactoryBean;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link CartController}.
 */
class CartControllerTest {

    private static final String USER_ID = "user_s1";
    private static final Product MUG = new Product("MUG", "Mug", "A simple mug", "/static/img/products/mug.jpg",
            new Money("USD", 8, 990_000_000), List.of("kitchen"));

    private CartServiceClient cartClient;
    private ProductCatalogClient catalogClient;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        cartClient = mock(CartServiceClient.class);
        catalogClient = mock(ProductCatalogClient.class);
        when(cartClient.isAvailable()).thenReturn(Mono.just(true));
        when(cartClient.addItem(anyString(), anyString(), anyInt())).thenReturn(Mono.empty());
        when(cartClient.emptyCart(anyString())).thenReturn(Mono.empty());
        when(cartClient.getCart(USER_ID)).thenReturn(Mono.just(new Cart(USER_ID, List.of(
                new CartLine("MUG", 2), new CartLine("GONE", 1), new CartLine("ZERO", 0)))));
        when(catalogClient.getProduct("MUG")).thenReturn(Mono.just(MUG));
        when(catalogClient.getProduct("GONE")).thenReturn(Mono.empty());

        ObjectMapper mapper = new StorageConfig().objectMapper();
        LocalValidatorFactoryBean validator = new LocalValidatorFactoryBean();
        validator.afterPropertiesSet();
        webTestClient = WebTestClient.bindToController(
                        new CartController(new CartService(cartClient), catalogClient))
                .httpMessageCodecs(codecs -> {
                    codecs.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(mapper));
                    codecs.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(mapper));
                })
                .validator(validator)
                .build();
    }

    @Nested
    @DisplayName("GET /api/v1/cart/{sessionId}")
    class GetCartTests {

        @Test
        @DisplayName("should list cart lines with catalog details")
        void returnsEnrichedCart() {
            webTestClient.get()
                    .uri("/api/v1/cart/s1")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(true)
                    .jsonPath("$.cart_data.user_id").isEqualTo(USER_ID)
                    .jsonPath("$.cart_data.total_items").isEqualTo(3)
                    .jsonPath("$.cart_data.items.length()").isEqualTo(2)
                    .jsonPath("$.cart_data.items[0].name").isEqualTo("Mug")
                    .jsonPath("$.cart_data.items[0].price").isEqualTo("USD 8.99")
                    .jsonPath("$.cart_data.items[0].quantity").isEqualTo(2)
                    .jsonPath("$.cart_data.items[0].picture").isEqualTo("/static/img/products/mug.jpg")
                    .jsonPath("$.cart_data.items[1].name").isEqualTo("Product GONE")
                    .jsonPath("$.cart_data.items[1].price").isEqualTo("Price unavailable");
        }

        @Test
        @DisplayName("should keep a placeholder when the catalog lookup fails")
        void catalogFailure() {
            when(catalogClient.getProduct("MUG")).thenReturn(Mono.error(new IllegalStateException("catalog down")));

            webTestClient.get()
                    .uri("/api/v1/cart/s1")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.cart_data.items[0].name").isEqualTo("Product MUG");
        }

        @Test
        @DisplayName("should answer 503 when the cart service is down")
        void unavailable() {
            when(cartClient.isAvailable()).thenReturn(Mono.just(false));

            webTestClient.get()
                    .uri("/api/v1/cart/s1")
                    .exchange()
                    .expectStatus().isEqualTo(503)
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(false)
                    .jsonPath("$.message").isEqualTo(CartController.UNAVAILABLE);
        }

        @Test
        @DisplayName("should answer 500 when the cart cannot be read")
        void cartError() {
            when(cartClient.getCart(USER_ID)).thenReturn(Mono.error(new IllegalStateException("timeout")));

            webTestClient.get()
                    .uri("/api/v1/cart/s1")
                    .exchange()
                    .expectStatus().is5xxServerError()
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(false)
                    .jsonPath("$.message").isEqualTo("Error retrieving cart: timeout");
        }
    }

    @Nested
    @DisplayName("Editing the cart")
    class EditTests {

        @Test
        @DisplayName("should add a product with the default quantity")
        void addsItem() {
            webTestClient.post()
                    .uri("/api/v1/cart/s1/items")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("product_id", "MUG"))
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(true)
                    .jsonPath("$.message").isEqualTo("Added 1 item(s) to cart")
                    .jsonPath("$.cart_data.product_id").isEqualTo("MUG");

            verify(cartClient).addItem(USER_ID, "MUG", 1);
        }

        @Test
        @DisplayName("should reject an add without a product")
        void addRequiresProduct() {
            webTestClient.post()
                    .uri("/api/v1/cart/s1/items")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("quantity", 2))
                    .exchange()
                    .expectStatus().isBadRequest();

            verify(cartClient, never()).addItem(anyString(), anyString(), anyInt());
        }

        @Test
        @DisplayName("should set a product's quantity by rewriting the cart")
        void updatesQuantity() {
            webTestClient.put()
                    .uri("/api/v1/cart/s1/items/MUG")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("quantity", 4))
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.message").isEqualTo("Updated quantity to 4")
                    .jsonPath("$.cart_data.items[0].quantity").isEqualTo(4)
                    .jsonPath("$.cart_data.total_items").isEqualTo(5);

            InOrder order = inOrder(cartClient);
            order.verify(cartClient).emptyCart(USER_ID);
            order.verify(cartClient).addItem(USER_ID, "MUG", 4);
        }

        @Test
        @DisplayName("should reject a negative quantity")
        void rejectsNegativeQuantity() {
            webTestClient.put()
                    .uri("/api/v1/cart/s1/items/MUG")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("quantity", -1))
                    .exchange()
                    .expectStatus().isBadRequest();

            verify(cartClient, never()).emptyCart(anyString());
        }

        @Test
        @DisplayName("should remove a product")
        void removesItem() {
            webTestClient.delete()
                    .uri("/api/v1/cart/s1/items/MUG")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.message").isEqualTo("Item removed from cart")
                    .jsonPath("$.cart_data.items.length()").isEqualTo(1)
                    .jsonPath("$.cart_data.items[0].product_id").isEqualTo("GONE");
        }

        @Test
        @DisplayName("should clear the cart")
        void clearsCart() {
            webTestClient.delete()
                    .uri("/api/v1/cart/s1")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(true)
                    .jsonPath("$.message").isEqualTo("Cart cleared successfully");

            verify(cartClient).emptyCart(USER_ID);
        }

        @Test
        @DisplayName("should not touch the cart while the service is down")
        void editUnavailable() {
            when(cartClient.isAvailable()).thenReturn(Mono.just(false));

            webTestClient.delete()
                    .uri("/api/v1/cart/s1")
                    .exchange()
                    .expectStatus().isEqualTo(503);

            verify(cartClient, never()).emptyCart(anyString());
        }
    }
}

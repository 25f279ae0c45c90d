package com.cartmate.backend.domain.model;

import com.cartmate.backend.domain.model.payload.CartCommand;
import com.cartmate.backend.domain.model.payload.ProductQuery;
import com.cartmate.backend.domain.model.payload.SessionScope;
import com.cartmate.backend.exception.InvalidMessageException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link A2aRequest}.
 */
class A2aRequestTest {

    @Test
    @DisplayName("should require acknowledgment by default")
    void requiresAckByDefault() {
        A2aRequest request = A2aRequest.builder()
                .receiver("cart_management_001")
                .requestType(RequestType.GET_CART)
                .payload(new SessionScope("s1"))
                .build();

        assertThat(request.isRequiresAck()).isTrue();
        assertThat(request.getType()).isEqualTo(A2aMessageType.REQUEST);
        assertThat(request.getId()).isNotBlank();
        assertThat(request.getConversationId()).isNotBlank();
    }

    @Test
    @DisplayName("should accept a payload matching the request type")
    void validatesMatchingPayload() {
        A2aRequest request = A2aRequest.builder()
                .receiver("cart_management_001")
                .requestType(RequestType.ADD_TO_CART)
                .payload(CartCommand.single("s1", "OLJCESPC7Z", 2))
                .build();

        assertThat(request.validate()).isSameAs(request);
        assertThat(request.payloadAs(CartCommand.class).items()).hasSize(1);
    }

    @Test
    @DisplayName("should reject a payload of the wrong class")
    void rejectsMismatchedPayload() {
        A2aRequest request = A2aRequest.builder()
                .receiver("product_discovery_001")
                .requestType(RequestType.SEARCH_PRODUCTS)
                .payload(new SessionScope("s1"))
                .build();

        assertThatThrownBy(request::validate)
                .isInstanceOf(InvalidMessageException.class)
                .hasMessageContaining("search_products requires ProductQuery");
        assertThatThrownBy(() -> request.payloadAs(ProductQuery.class))
                .isInstanceOf(InvalidMessageException.class);
    }

    @Test
    @DisplayName("should build a failed response addressed back to the requester")
    void failureResponse() {
        A2aRequest request = A2aRequest.builder()
                .sender("orchestrator_001")
                .receiver("checkout_001")
                .conversationId("conv-7")
                .requestType(RequestType.GET_CART)
                .payload(new SessionScope("s1"))
                .build();

        A2aResponse response = A2aResponse.failureFor(request, null);

        assertThat(response.getReceiver()).isEqualTo("orchestrator_001");
        assertThat(response.getSender()).isEqualTo("checkout_001");
        assertThat(response.getRequestId()).isEqualTo(request.getId());
        assertThat(response.getConversationId()).isEqualTo("conv-7");
        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getError()).isEqualTo("Unknown error");
        assertThat(response.isRequiresAck()).isFalse();
    }

    @ParameterizedTest(name = "success={0}, error={1}")
    @CsvSource(value = {
            "true, boom, NULL",
            "true, NULL, NULL",
            "false, boom, boom",
            "false, NULL, Unknown error",
            "false, '  ', Unknown error"
    }, nullValues = "NULL")
    @DisplayName("should carry an error exactly when the response failed")
    void errorOnlyOnFailure(boolean success, String error, String expected) {
        A2aResponse response = A2aResponse.builder()
                .sender("checkout_001")
                .receiver("orchestrator_001")
                .requestId("req-1")
                .success(success)
                .error(error)
                .build();

        assertThat(response.getError()).isEqualTo(expected);
    }
}

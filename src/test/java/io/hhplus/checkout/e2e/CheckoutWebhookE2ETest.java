package io.hhplus.checkout.e2e;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hhplus.checkout.application.webhook.PaymentSignatureVerifier;
import io.hhplus.checkout.config.TestContainersConfig;
import io.hhplus.checkout.domain.stock.StockLedgerEntry;
import io.hhplus.checkout.domain.stock.StockLedgerRepository;
import io.hhplus.checkout.domain.webhook.ClaimStatus;
import io.hhplus.checkout.domain.webhook.WebhookClaimRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 체크아웃 → 결제 웹훅 → 주문 확정 E2E
 *
 * 웹훅은 별도 Executor 에서 처리되므로 테스트 트랜잭션으로 감싸지 않는다.
 * 상품 ID를 매번 새로 만들어 데이터를 격리한다.
 */
@Import(TestContainersConfig.class)
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class CheckoutWebhookE2ETest {

    private static final String SALT_KEY = "test-salt-key-1";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private StockLedgerRepository stockLedgerRepository;

    @Autowired
    private WebhookClaimRepository webhookClaimRepository;

    @Autowired
    private PaymentSignatureVerifier signatureVerifier;

    private String productId;

    @BeforeEach
    void setUp() {
        productId = "P-" + UUID.randomUUID().toString().substring(0, 8);
        stockLedgerRepository.save(StockLedgerEntry.create(productId, "M", 10));
    }

    @Test
    @DisplayName("₹500 결제 성공 웹훅 - 주문 CONFIRMED, 재고 (9,0), 재전송은 DUPLICATE")
    void checkout_결제성공() throws Exception {
        // Given: 체크아웃
        JsonNode checkout = startCheckout();
        long orderId = checkout.path("orderId").asLong();
        String transactionId = checkout.path("providerTransactionId").asText();
        assertLedger(10, 1);

        // When: 서명된 성공 웹훅
        String payload = "{\"merchantTransactionId\":\"" + transactionId
            + "\",\"state\":\"COMPLETED\",\"amount\":50000}";
        sendWebhook(payload)
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.retryable").value(false));

        // Then
        mockMvc.perform(get("/api/orders/{orderId}/status", orderId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.status").value("CONFIRMED"))
            .andExpect(jsonPath("$.data.paymentStatus").value("PAID"));
        assertLedger(9, 0);

        // 재전송
        sendWebhook(payload)
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true));
        assertLedger(9, 0);
        assertThat(webhookClaimRepository.findByDedupKey("phonepe:" + transactionId + ":COMPLETED"))
            .hasValueSatisfying(claim -> assertThat(claim.getStatus()).isEqualTo(ClaimStatus.COMPLETED));
    }

    @Test
    @DisplayName("결제 실패 웹훅 - 주문 CANCELLED, 예약 수량 복구")
    void checkout_결제실패() throws Exception {
        // Given
        JsonNode checkout = startCheckout();
        long orderId = checkout.path("orderId").asLong();
        String transactionId = checkout.path("providerTransactionId").asText();

        // When
        sendWebhook("{\"merchantTransactionId\":\"" + transactionId + "\",\"state\":\"PAYMENT_DECLINED\"}")
            .andExpect(status().isOk());

        // Then
        mockMvc.perform(get("/api/orders/{orderId}/status", orderId))
            .andExpect(jsonPath("$.data.status").value("CANCELLED"));
        assertLedger(10, 0);
    }

    @Test
    @DisplayName("서명 헤더 없는 웹훅은 401")
    void webhook_서명없음() throws Exception {
        mockMvc.perform(post("/payment/webhook/phonepe")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"merchantTransactionId\":\"TXN-X\",\"state\":\"COMPLETED\",\"amount\":50000}"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error.code").value("W002"));
    }

    private JsonNode startCheckout() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/checkout")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"userEmail\":\"shopper@example.com\",\"currency\":\"INR\",\"items\":[{\"productId\":\""
                    + productId + "\",\"size\":\"M\",\"quantity\":1,\"unitPrice\":50000}]}"))
            .andExpect(status().isCreated())
            .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).path("data");
    }

    private ResultActions sendWebhook(String payload) throws Exception {
        return mockMvc.perform(post("/payment/webhook/phonepe")
            .contentType(MediaType.APPLICATION_JSON)
            .header("x-verify", signatureVerifier.sign(payload, SALT_KEY, 1))
            .content(payload));
    }

    private void assertLedger(int stock, int reserved) {
        StockLedgerEntry entry = stockLedgerRepository.findByProductIdAndSizeOrThrow(productId, "M");
        assertThat(entry.getStock()).isEqualTo(stock);
        assertThat(entry.getReserved()).isEqualTo(reserved);
    }
}

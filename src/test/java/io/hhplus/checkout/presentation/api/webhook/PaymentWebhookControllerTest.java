package io.hhplus.checkout.presentation.api.webhook;

import io.hhplus.checkout.application.facade.WebhookIntakeFacade;
import io.hhplus.checkout.application.webhook.WebhookAck;
import io.hhplus.checkout.application.webhook.WebhookCommand;
import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.config.PaymentWebhookProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 웹훅 엔드포인트 HTTP 계약
 *
 * - 처리 결과와 무관하게 200
 * - 모르는 제공자 400, 서명 헤더 없음 401
 */
@WebMvcTest(PaymentWebhookController.class)
class PaymentWebhookControllerTest {

    private static final String BODY = "{\"merchantTransactionId\":\"TXN-1\",\"state\":\"COMPLETED\",\"amount\":50000}";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private WebhookIntakeFacade webhookIntakeFacade;

    @MockitoBean
    private PaymentWebhookProperties properties;

    @Test
    @DisplayName("본문과 서명 헤더를 그대로 넘기고 x-request-id 를 돌려준다")
    void receive_정상() throws Exception {
        // Given
        given(webhookIntakeFacade.receive(any())).willReturn(WebhookAck.ok("처리 완료: CONFIRMED"));

        // When & Then
        mockMvc.perform(post("/payment/webhook/phonepe")
                .contentType(MediaType.APPLICATION_JSON)
                .header("x-verify", "abc###1")
                .header("x-request-id", "req-123")
                .content(BODY))
            .andExpect(status().isOk())
            .andExpect(header().string("x-request-id", "req-123"))
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.retryable").value(false));

        ArgumentCaptor<WebhookCommand> captor = ArgumentCaptor.forClass(WebhookCommand.class);
        verify(webhookIntakeFacade).receive(captor.capture());
        WebhookCommand command = captor.getValue();
        assertThat(command.provider()).isEqualTo("phonepe");
        assertThat(command.rawPayload()).isEqualTo(BODY);
        assertThat(command.signature()).isEqualTo("abc###1");
        assertThat(command.correlationId()).isEqualTo("req-123");
    }

    @Test
    @DisplayName("서명이 틀려 거부되어도 HTTP 200, success=false")
    void receive_거부도200() throws Exception {
        given(webhookIntakeFacade.receive(any())).willReturn(WebhookAck.rejected("서명이 올바르지 않습니다"));

        mockMvc.perform(post("/payment/webhook/phonepe")
                .contentType(MediaType.APPLICATION_JSON)
                .header("x-verify", "forged###1")
                .content(BODY))
            .andExpect(status().isOk())
            .andExpect(header().exists("x-request-id"))
            .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    @DisplayName("서명 헤더 없음은 401")
    void receive_서명없음() throws Exception {
        given(webhookIntakeFacade.receive(any())).willThrow(new BusinessException(ErrorCode.MISSING_SIGNATURE));

        mockMvc.perform(post("/payment/webhook/phonepe")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error.code").value("W002"));
    }

    @Test
    @DisplayName("모르는 제공자는 400")
    void receive_모르는제공자() throws Exception {
        given(webhookIntakeFacade.receive(any())).willThrow(new BusinessException(ErrorCode.UNKNOWN_PROVIDER));

        mockMvc.perform(post("/payment/webhook/unknown")
                .contentType(MediaType.APPLICATION_JSON)
                .header("x-verify", "abc###1")
                .content(BODY))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("W003"));
    }
}

package io.hhplus.checkout.presentation.api.webhook;

import io.hhplus.checkout.application.facade.WebhookIntakeFacade;
import io.hhplus.checkout.application.webhook.WebhookAck;
import io.hhplus.checkout.application.webhook.WebhookCommand;
import io.hhplus.checkout.config.PaymentWebhookProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * 결제 제공자 웹훅 수신
 *
 * 본문은 서명 검증을 위해 바이트 그대로(String) 받는다.
 * 처리 결과와 무관하게 200 으로 응답하며, 400(모르는 제공자)과 401(서명 헤더 없음)만 예외다.
 */
@RestController
@RequestMapping("/payment/webhook")
@RequiredArgsConstructor
public class PaymentWebhookController {

    private static final String REQUEST_ID_HEADER = "x-request-id";

    private final WebhookIntakeFacade webhookIntakeFacade;
    private final PaymentWebhookProperties properties;

    @PostMapping("/{provider}")
    public ResponseEntity<WebhookAck> receive(
            @PathVariable String provider,
            @RequestBody(required = false) String payload,
            @RequestHeader HttpHeaders headers
    ) {
        PaymentWebhookProperties.Provider config = properties.findProvider(provider)
                .orElseGet(PaymentWebhookProperties.Provider::new);

        String correlationId = headers.getFirst(REQUEST_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }

        WebhookCommand command = new WebhookCommand(
                provider,
                payload,
                headers.getFirst(config.getSignatureHeader()),
                config.getKeyIndexHeader() == null ? null : headers.getFirst(config.getKeyIndexHeader()),
                correlationId
        );

        WebhookAck ack = webhookIntakeFacade.receive(command);
        return ResponseEntity.ok()
                .header(REQUEST_ID_HEADER, correlationId)
                .body(ack);
    }
}

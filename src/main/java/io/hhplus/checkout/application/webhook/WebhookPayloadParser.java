package io.hhplus.checkout.application.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.domain.webhook.PaymentState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Locale;

/**
 * 제공자별로 조금씩 다른 웹훅 본문에서 거래 ID, 상태, 금액을 꺼낸다.
 *
 * 필드는 최상위 또는 payload / data / response 아래에서 찾는다.
 * response 가 문자열이면 Base64 로 인코딩된 JSON (PhonePe 콜백 형식) 으로 보고 디코딩한다.
 */
@Component
@RequiredArgsConstructor
public class WebhookPayloadParser {

    private static final List<String> TRANSACTION_ID_FIELDS = List.of("merchantTransactionId", "transactionId", "orderId");
    private static final List<String> STATE_FIELDS = List.of("state", "status", "code");
    private static final List<String> NESTED_FIELDS = List.of("payload", "data", "response");

    private final ObjectMapper objectMapper;

    /**
     * @throws BusinessException MALFORMED_PAYLOAD JSON이 아니거나 거래 ID/상태가 없음
     */
    public ParsedWebhook parse(String rawPayload) {
        JsonNode root = readJson(rawPayload);

        String transactionId = findText(root, TRANSACTION_ID_FIELDS);
        String reportedState = findText(root, STATE_FIELDS);
        if (transactionId == null || reportedState == null) {
            throw new BusinessException(
                ErrorCode.MALFORMED_PAYLOAD,
                "거래 ID 또는 결제 상태가 없습니다"
            );
        }

        String normalizedState = reportedState.trim().toUpperCase(Locale.ROOT);
        return new ParsedWebhook(
            transactionId.trim(),
            normalizedState,
            PaymentState.categorize(normalizedState),
            findAmount(root),
            findText(root, List.of("currency")),
            findText(root, List.of("timestamp"))
        );
    }

    private JsonNode readJson(String rawPayload) {
        if (rawPayload == null || rawPayload.isBlank()) {
            throw new BusinessException(ErrorCode.MALFORMED_PAYLOAD, "웹훅 본문이 비어 있습니다");
        }
        try {
            JsonNode root = objectMapper.readTree(rawPayload);
            if (root == null || !root.isObject()) {
                throw new BusinessException(ErrorCode.MALFORMED_PAYLOAD, "웹훅 본문이 JSON 객체가 아닙니다");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new BusinessException(ErrorCode.MALFORMED_PAYLOAD, e);
        }
    }

    private String findText(JsonNode root, List<String> fieldNames) {
        JsonNode node = findNode(root, fieldNames);
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text;
    }

    private Long findAmount(JsonNode root) {
        JsonNode node = findNode(root, List.of("amount"));
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            try {
                return Long.valueOf(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new BusinessException(ErrorCode.MALFORMED_PAYLOAD, "금액 형식이 올바르지 않습니다: " + node.asText());
            }
        }
        throw new BusinessException(ErrorCode.MALFORMED_PAYLOAD, "금액은 정수(minor unit)여야 합니다: " + node);
    }

    private JsonNode findNode(JsonNode root, List<String> fieldNames) {
        JsonNode direct = firstPresent(root, fieldNames);
        if (direct != null) {
            return direct;
        }
        for (String nestedField : NESTED_FIELDS) {
            JsonNode nested = unwrap(root.get(nestedField));
            if (nested == null) {
                continue;
            }
            JsonNode found = firstPresent(nested, fieldNames);
            if (found != null) {
                return found;
            }
            // data.payload 처럼 한 단계 더 들어간 경우
            for (String innerField : NESTED_FIELDS) {
                JsonNode inner = unwrap(nested.get(innerField));
                if (inner != null) {
                    found = firstPresent(inner, fieldNames);
                    if (found != null) {
                        return found;
                    }
                }
            }
        }
        return null;
    }

    private JsonNode firstPresent(JsonNode node, List<String> fieldNames) {
        for (String fieldName : fieldNames) {
            JsonNode value = node.get(fieldName);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    private JsonNode unwrap(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isObject()) {
            return node;
        }
        if (node.isTextual()) {
            try {
                byte[] decoded = Base64.getDecoder().decode(node.asText().trim());
                JsonNode decodedNode = objectMapper.readTree(new String(decoded, StandardCharsets.UTF_8));
                return decodedNode != null && decodedNode.isObject() ? decodedNode : null;
            } catch (IllegalArgumentException | JsonProcessingException e) {
                return null;
            }
        }
        return null;
    }
}

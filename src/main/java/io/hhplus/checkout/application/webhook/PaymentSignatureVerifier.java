package io.hhplus.checkout.application.webhook;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;

/**
 * 웹훅 서명 검증
 *
 * 서명 형식: hex(SHA-256(payload + saltKey + saltIndex)) + "###" + saltIndex
 * - saltIndex 가 서명 값에 없으면 별도 헤더(x-verify-index)의 값을 사용한다.
 * - 비교는 상수 시간으로 한다.
 * - 어떤 입력에도 예외를 던지지 않는다. 형식 오류, 모르는 인덱스는 모두 false.
 */
@Slf4j
@Component
public class PaymentSignatureVerifier {

    private static final String INDEX_SEPARATOR = "###";

    public boolean verify(String payload, String signatureHeader, String keyIndexHeader, Map<Integer, String> saltKeys) {
        if (payload == null || signatureHeader == null || signatureHeader.isBlank() || saltKeys == null) {
            return false;
        }

        String signature = signatureHeader.trim();
        String providedHash = signature;
        String indexValue = keyIndexHeader;

        int separatorAt = signature.lastIndexOf(INDEX_SEPARATOR);
        if (separatorAt >= 0) {
            providedHash = signature.substring(0, separatorAt);
            indexValue = signature.substring(separatorAt + INDEX_SEPARATOR.length());
        }

        Integer keyIndex = parseIndex(indexValue);
        if (keyIndex == null) {
            return false;
        }

        String saltKey = saltKeys.get(keyIndex);
        if (saltKey == null || saltKey.isEmpty() || providedHash.isEmpty()) {
            return false;
        }

        String expectedHash = sha256Hex(payload + saltKey + keyIndex);
        if (expectedHash == null) {
            return false;
        }

        return MessageDigest.isEqual(
            expectedHash.getBytes(StandardCharsets.US_ASCII),
            providedHash.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII)
        );
    }

    /**
     * 동일 규칙으로 서명 헤더 값을 만든다 (요청 서명, 테스트용).
     */
    public String sign(String payload, String saltKey, int keyIndex) {
        return sha256Hex(payload + saltKey + keyIndex) + INDEX_SEPARATOR + keyIndex;
    }

    private Integer parseIndex(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private String sha256Hex(String input) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            log.error("SHA-256 unavailable", e);
            return null;
        }
    }
}

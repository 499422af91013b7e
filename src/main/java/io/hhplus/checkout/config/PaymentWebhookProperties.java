package io.hhplus.checkout.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 결제 웹훅 수신 설정
 *
 * checkout.webhook.providers.{provider}.salt-keys.{index} 형태로 제공자별 서명 키를 등록한다.
 * 키 값은 환경 변수로 주입한다 (예: PHONEPE_SALT_1).
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "checkout.webhook")
public class PaymentWebhookProperties {

    /** 제공자 이름(소문자) → 제공자 설정 */
    @Valid
    private Map<String, Provider> providers = new HashMap<>();

    /** 단일 결제 허용 상한 (minor unit, paise) */
    @Min(1)
    private long maxAmount = 10_000_000L;

    /** 주문 금액과 보고 금액의 허용 오차 (minor unit) */
    @Min(0)
    private long amountTolerance = 1L;

    /** 제공자에게 응답하기 전 처리 결과를 기다리는 최대 시간 */
    private Duration ackTimeout = Duration.ofSeconds(3);

    /** PROCESSING 상태로 남은 claim을 회수할 수 있게 되는 시간 */
    private Duration staleClaimTimeout = Duration.ofSeconds(10);

    /** claim 소유자 식별용 워커 ID */
    @NotBlank
    private String workerId = "checkout-worker";

    public Optional<Provider> findProvider(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(providers.get(name.toLowerCase(Locale.ROOT)));
    }

    @Getter
    @Setter
    @ToString
    @Validated
    public static class Provider {

        /** 서명 헤더 이름 */
        @NotBlank
        private String signatureHeader = "x-verify";

        /** 서명 키 인덱스 헤더 이름 (서명 값에 ###index 가 없을 때 사용) */
        private String keyIndexHeader = "x-verify-index";

        /** 키 인덱스 → salt key */
        @ToString.Exclude
        private Map<Integer, String> saltKeys = new HashMap<>();
    }
}

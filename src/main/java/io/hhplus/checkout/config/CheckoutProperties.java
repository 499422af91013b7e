package io.hhplus.checkout.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * 체크아웃/재고 예약 설정
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "checkout")
public class CheckoutProperties {

    @Valid
    private Reservation reservation = new Reservation();

    @Valid
    private Sweeper sweeper = new Sweeper();

    @Valid
    private Stock stock = new Stock();

    @Getter
    @Setter
    public static class Reservation {
        /** 예약 유지 시간 (결제 대기 TTL) */
        private Duration ttl = Duration.ofMinutes(15);
    }

    @Getter
    @Setter
    public static class Sweeper {
        /** 한 번의 스윕에서 처리할 최대 예약 수 */
        @Min(1)
        private int batchSize = 200;
    }

    @Getter
    @Setter
    public static class Stock {
        /** 가용 재고가 이 값 미만이면 재고 부족 경고 대상 */
        @Min(0)
        private int lowStockThreshold = 5;

        /** 예약 수량이 재고 대비 이 비율을 넘으면 정체 예약 의심 */
        private double stuckReservationRatio = 0.5;
    }
}

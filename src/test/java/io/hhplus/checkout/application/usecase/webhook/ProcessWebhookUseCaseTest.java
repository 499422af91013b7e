package io.hhplus.checkout.application.usecase.webhook;

import io.hhplus.checkout.application.checkout.dto.StartCheckoutResponse;
import io.hhplus.checkout.application.order.OrderTransitionService;
import io.hhplus.checkout.application.webhook.WebhookCommand;
import io.hhplus.checkout.application.webhook.WebhookOutcome;
import io.hhplus.checkout.domain.checkout.ReservationStatus;
import io.hhplus.checkout.domain.order.Order;
import io.hhplus.checkout.domain.order.OrderStatus;
import io.hhplus.checkout.domain.reconciliation.ReconciliationTask;
import io.hhplus.checkout.domain.reconciliation.ReconciliationTask.TaskStatus;
import io.hhplus.checkout.domain.webhook.ClaimStatus;
import io.hhplus.checkout.domain.webhook.RawWebhook;
import io.hhplus.checkout.domain.webhook.WebhookClaim;
import io.hhplus.checkout.domain.webhook.WebhookResult;
import io.hhplus.checkout.support.InMemoryCheckoutFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static io.hhplus.checkout.support.InMemoryCheckoutFixture.payload;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

/**
 * 결제 웹훅 처리 시나리오
 *
 * 상품 P001/M 재고 10, ₹500(50000 paise) 1개 체크아웃 후 웹훅을 흘려 원장/주문 상태를 검증한다.
 */
class ProcessWebhookUseCaseTest {

    private static final long PRICE = 50000L;

    private InMemoryCheckoutFixture fixture;
    private ProcessWebhookUseCase processWebhookUseCase;
    private StartCheckoutResponse checkout;

    @BeforeEach
    void setUp() {
        fixture = new InMemoryCheckoutFixture();
        processWebhookUseCase = fixture.processWebhookUseCase;
        fixture.stock("P001", "M", 10);
        checkout = fixture.checkout("P001", "M", 1, PRICE);
    }

    @Test
    @DisplayName("SUCCESS 웹훅 - 원장 (10,1) → (9,0), 주문 CONFIRMED")
    void success_확정() {
        // Given
        assertThat(fixture.ledger("P001", "M")).containsExactly(10, 1);

        // When
        WebhookOutcome outcome = execute(payload(txn(), "COMPLETED", PRICE));

        // Then
        assertThat(outcome.result()).isEqualTo(WebhookResult.PROCESSED);
        assertThat(outcome.message()).isEqualTo("CONFIRMED");
        assertThat(fixture.ledger("P001", "M")).containsExactly(9, 0);
        assertThat(order().getStatus()).isEqualTo(OrderStatus.CONFIRMED);

        RawWebhook raw = fixture.rawWebhookRepository.findByIdOrThrow(outcome.rawWebhookId());
        assertThat(raw.isProcessed()).isTrue();
        assertThat(raw.getDedupKey()).isEqualTo("phonepe:" + txn() + ":COMPLETED");
        assertThat(fixture.meterRegistry.get("webhook_total").tag("result", "processed").counter().count())
            .isEqualTo(1.0);
    }

    @Test
    @DisplayName("같은 SUCCESS 웹훅 50건 동시 전달 - 1건 처리, 49건 DUPLICATE, 재고 한 번만 차감")
    void success_동시중복전달() throws InterruptedException {
        // Given
        String body = payload(txn(), "COMPLETED", PRICE);
        int threadCount = 50;
        ExecutorService executorService = Executors.newFixedThreadPool(threadCount);
        CountDownLatch ready = new CountDownLatch(threadCount);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        ConcurrentHashMap<WebhookResult, AtomicInteger> results = new ConcurrentHashMap<>();

        // When
        for (int i = 0; i < threadCount; i++) {
            executorService.submit(() -> {
                try {
                    ready.countDown();
                    start.await();
                    WebhookOutcome outcome = processWebhookUseCase.execute(fixture.signed(body));
                    results.computeIfAbsent(outcome.result(), k -> new AtomicInteger()).incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        ready.await(10, TimeUnit.SECONDS);
        start.countDown();
        done.await(30, TimeUnit.SECONDS);
        executorService.shutdown();

        // Then
        assertThat(results.get(WebhookResult.PROCESSED)).hasValue(1);
        assertThat(results.get(WebhookResult.DUPLICATE)).hasValue(49);
        assertThat(fixture.ledger("P001", "M")).containsExactly(9, 0);
        assertThat(order().getStatus()).isEqualTo(OrderStatus.CONFIRMED);

        List<RawWebhook> recorded = fixture.rawWebhookRepository.findAll();
        assertThat(recorded).hasSize(50);
        assertThat(recorded).filteredOn(RawWebhook::isProcessed).hasSize(1);
        assertThat(fixture.publishedEvents).hasSize(1);
    }

    @Test
    @DisplayName("주문 금액의 두 배를 보고하면 REJECTED, 상태 변경 없음")
    void success_금액두배() {
        // When
        WebhookOutcome outcome = execute(payload(txn(), "COMPLETED", PRICE * 2));

        // Then
        assertThat(outcome.result()).isEqualTo(WebhookResult.REJECTED);
        assertThat(outcome.errorCode()).isEqualTo("F001");
        assertThat(order().getStatus()).isEqualTo(OrderStatus.DRAFT);
        assertThat(fixture.ledger("P001", "M")).containsExactly(10, 1);
        assertThat(fixture.webhookClaimRepository.findByDedupKey(outcome.dedupKey())).isEmpty();
    }

    @Test
    @DisplayName("서명이 틀리면 REJECTED, 원문은 미처리로 남는다")
    void 서명오류() {
        // Given
        String body = payload(txn(), "COMPLETED", PRICE);
        WebhookCommand forged = new WebhookCommand("phonepe", body,
            fixture.signatureVerifier.sign(body, "wrong-key", 1), null, "req-forged");

        // When
        WebhookOutcome outcome = processWebhookUseCase.execute(forged);

        // Then
        assertThat(outcome.result()).isEqualTo(WebhookResult.REJECTED);
        assertThat(outcome.errorCode()).isEqualTo("W001");
        RawWebhook raw = fixture.rawWebhookRepository.findByIdOrThrow(outcome.rawWebhookId());
        assertThat(raw.isProcessed()).isFalse();
        assertThat(raw.getRawPayload()).isEqualTo(body);
        assertThat(order().getStatus()).isEqualTo(OrderStatus.DRAFT);
    }

    @Test
    @DisplayName("SUCCESS 후 FAILURE - 먼저 처리된 SUCCESS 가 최종, FAILURE 는 ALREADY_TERMINAL")
    void success_후_failure() {
        // When
        execute(payload(txn(), "COMPLETED", PRICE));
        WebhookOutcome failure = execute(payload(txn(), "FAILED", PRICE));

        // Then
        assertThat(failure.result()).isEqualTo(WebhookResult.PROCESSED);
        assertThat(failure.message()).isEqualTo("ALREADY_TERMINAL");
        assertThat(order().getStatus()).isEqualTo(OrderStatus.CONFIRMED);
        assertThat(fixture.ledger("P001", "M")).containsExactly(9, 0);
    }

    @Test
    @DisplayName("FAILURE 후 SUCCESS - 주문은 CANCELLED 유지, 재고 복구")
    void failure_후_success() {
        // When
        WebhookOutcome failure = execute(payload(txn(), "PAYMENT_DECLINED", 0L));
        WebhookOutcome success = execute(payload(txn(), "COMPLETED", PRICE));

        // Then
        assertThat(failure.message()).isEqualTo("CANCELLED");
        assertThat(success.message()).isEqualTo("ALREADY_TERMINAL");
        assertThat(order().getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(fixture.ledger("P001", "M")).containsExactly(10, 0);
        assertThat(fixture.reservationRepository.findByCheckoutSessionId(checkout.sessionId()))
            .allSatisfy(r -> assertThat(r.getStatus()).isEqualTo(ReservationStatus.RELEASED));
    }

    @Test
    @DisplayName("대기 상태 보고는 IGNORED, 주문 변화 없음")
    void pending_무시() {
        WebhookOutcome outcome = execute(payload(txn(), "PENDING", null));

        assertThat(outcome.result()).isEqualTo(WebhookResult.IGNORED);
        assertThat(order().getStatus()).isEqualTo(OrderStatus.DRAFT);
        assertThat(fixture.ledger("P001", "M")).containsExactly(10, 1);
    }

    @Test
    @DisplayName("모르는 거래 ID 는 IGNORED(ORDER_NOT_FOUND)")
    void 주문없음_무시() {
        WebhookOutcome outcome = execute(payload("TXN-UNKNOWN", "COMPLETED", PRICE));

        assertThat(outcome.result()).isEqualTo(WebhookResult.IGNORED);
        assertThat(outcome.errorCode()).isEqualTo("O001");
    }

    @Test
    @DisplayName("본문 해석 실패는 REJECTED(MALFORMED_PAYLOAD)")
    void 본문오류() {
        WebhookOutcome outcome = execute("{\"hello\":\"world\"}");

        assertThat(outcome.result()).isEqualTo(WebhookResult.REJECTED);
        assertThat(outcome.errorCode()).isEqualTo("W004");
    }

    @Test
    @DisplayName("스윕 이후 늦게 도착한 SUCCESS - MANUAL_REVIEW, 주문 DRAFT, 운영자 작업 생성")
    void 만료후_늦은성공() {
        // Given
        fixture.reservationExpiryService.sweep(LocalDateTime.now().plusMinutes(16));
        assertThat(fixture.ledger("P001", "M")).containsExactly(10, 0);

        // When
        WebhookOutcome outcome = execute(payload(txn(), "COMPLETED", PRICE));
        WebhookOutcome redelivery = execute(payload(txn(), "COMPLETED", PRICE));

        // Then
        assertThat(outcome.result()).isEqualTo(WebhookResult.MANUAL_REVIEW);
        assertThat(outcome.errorCode()).isEqualTo("S002");
        assertThat(order().getStatus()).isEqualTo(OrderStatus.DRAFT);
        assertThat(fixture.ledger("P001", "M")).containsExactly(10, 0);

        WebhookClaim claim = fixture.webhookClaimRepository.findByDedupKey(outcome.dedupKey()).orElseThrow();
        assertThat(claim.getStatus()).isEqualTo(ClaimStatus.MANUAL_REVIEW);

        List<ReconciliationTask> tasks = fixture.reconciliationTaskRepository.findByRawWebhookId(outcome.rawWebhookId());
        assertThat(tasks).singleElement()
            .satisfies(task -> assertThat(task.getStatus()).isEqualTo(TaskStatus.AWAITING_OPERATOR));

        assertThat(redelivery.result()).isEqualTo(WebhookResult.DUPLICATE);
    }

    @Test
    @DisplayName("저장소 장애 - QUEUED, claim FAILED, 재처리 작업 생성 후 reprocess 로 확정")
    void 저장소장애_재처리() {
        // Given
        OrderTransitionService failing = mock(OrderTransitionService.class);
        given(failing.confirm(anyLong(), anyString()))
            .willThrow(new DataAccessResourceFailureException("connection refused"));
        ProcessWebhookUseCase failingUseCase = fixture.processWebhookUseCase(failing);

        // When
        WebhookOutcome queued = failingUseCase.execute(fixture.signed(payload(txn(), "COMPLETED", PRICE)));

        // Then
        assertThat(queued.result()).isEqualTo(WebhookResult.QUEUED);
        assertThat(queued.errorCode()).isEqualTo("COMMON001");
        assertThat(fixture.webhookClaimRepository.findByDedupKey(queued.dedupKey()).orElseThrow().getStatus())
            .isEqualTo(ClaimStatus.FAILED);
        assertThat(fixture.rawWebhookRepository.findByIdOrThrow(queued.rawWebhookId()).isProcessed()).isFalse();

        List<ReconciliationTask> tasks = fixture.reconciliationTaskRepository.findByRawWebhookId(queued.rawWebhookId());
        assertThat(tasks).singleElement()
            .satisfies(task -> assertThat(task.getStatus()).isEqualTo(TaskStatus.PENDING));

        // When - 저장소 복구 후 재처리
        WebhookOutcome retried = processWebhookUseCase.reprocess(queued.rawWebhookId());

        // Then
        assertThat(retried.result()).isEqualTo(WebhookResult.PROCESSED);
        assertThat(order().getStatus()).isEqualTo(OrderStatus.CONFIRMED);
        assertThat(fixture.ledger("P001", "M")).containsExactly(9, 0);
        WebhookClaim claim = fixture.webhookClaimRepository.findByDedupKey(queued.dedupKey()).orElseThrow();
        assertThat(claim.getStatus()).isEqualTo(ClaimStatus.COMPLETED);
        assertThat(claim.getAttempts()).isEqualTo(2);
    }

    @Test
    @DisplayName("재처리가 다시 실패해도 새 재처리 작업을 만들지 않는다")
    void reprocess_실패_작업추가없음() {
        // Given
        OrderTransitionService failing = mock(OrderTransitionService.class);
        given(failing.confirm(anyLong(), anyString()))
            .willThrow(new DataAccessResourceFailureException("connection refused"));
        ProcessWebhookUseCase failingUseCase = fixture.processWebhookUseCase(failing);
        WebhookOutcome queued = failingUseCase.execute(fixture.signed(payload(txn(), "COMPLETED", PRICE)));

        // When
        WebhookOutcome retried = failingUseCase.reprocess(queued.rawWebhookId());

        // Then
        assertThat(retried.needsRetry()).isTrue();
        assertThat(fixture.reconciliationTaskRepository.findByRawWebhookId(queued.rawWebhookId())).hasSize(1);
    }

    private WebhookOutcome execute(String body) {
        return processWebhookUseCase.execute(fixture.signed(body));
    }

    private String txn() {
        return checkout.providerTransactionId();
    }

    private Order order() {
        return fixture.orderRepository.findByIdOrThrow(checkout.orderId());
    }
}

package io.hhplus.checkout.presentation.api.checkout;

import io.hhplus.checkout.application.checkout.CheckoutService;
import io.hhplus.checkout.application.checkout.dto.CheckoutSessionResponse;
import io.hhplus.checkout.application.checkout.dto.StartCheckoutRequest;
import io.hhplus.checkout.application.checkout.dto.StartCheckoutResponse;
import io.hhplus.checkout.presentation.common.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@Validated
@RestController
@RequestMapping("/api/checkout")
@RequiredArgsConstructor
public class CheckoutController {

    private final CheckoutService checkoutService;

    /**
     * 재고 예약 + DRAFT 주문 생성
     */
    @PostMapping
    public ResponseEntity<ApiResponse<StartCheckoutResponse>> startCheckout(
            @Valid @RequestBody StartCheckoutRequest request
    ) {
        StartCheckoutResponse response = checkoutService.startCheckout(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<ApiResponse<CheckoutSessionResponse>> getSession(@PathVariable String sessionId) {
        return ResponseEntity.ok(ApiResponse.success(checkoutService.getSession(sessionId)));
    }

    /**
     * 쇼핑객이 체크아웃을 포기한 경우 예약 해제
     */
    @DeleteMapping("/{sessionId}")
    public ResponseEntity<ApiResponse<CheckoutSessionResponse>> release(@PathVariable String sessionId) {
        return ResponseEntity.ok(ApiResponse.success(checkoutService.release(sessionId)));
    }
}

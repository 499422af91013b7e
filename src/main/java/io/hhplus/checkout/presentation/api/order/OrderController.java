package io.hhplus.checkout.presentation.api.order;

import io.hhplus.checkout.application.order.OrderQueryService;
import io.hhplus.checkout.application.order.dto.OrderStatusResponse;
import io.hhplus.checkout.presentation.common.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderQueryService orderQueryService;

    /**
     * 결제 대기 화면 폴링용. CONFIRMED/CANCELLED 가 될 때까지 DRAFT 로 보인다.
     */
    @GetMapping("/{orderId}/status")
    public ResponseEntity<ApiResponse<OrderStatusResponse>> getStatus(@PathVariable Long orderId) {
        return ResponseEntity.ok(ApiResponse.success(orderQueryService.getStatus(orderId)));
    }
}

package io.hhplus.checkout.presentation.api.admin;

import io.hhplus.checkout.application.stock.StockHealthService;
import io.hhplus.checkout.application.stock.StockLedgerService;
import io.hhplus.checkout.application.stock.dto.RestockRequest;
import io.hhplus.checkout.application.stock.dto.StockAvailabilityResponse;
import io.hhplus.checkout.application.stock.dto.StockHealthResponse;
import io.hhplus.checkout.presentation.common.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@Validated
@RestController
@RequestMapping("/api/admin/stock")
@RequiredArgsConstructor
public class StockAdminController {

    private final StockHealthService stockHealthService;
    private final StockLedgerService stockLedgerService;

    @GetMapping("/health")
    public ResponseEntity<ApiResponse<StockHealthResponse>> health() {
        return ResponseEntity.ok(ApiResponse.success(stockHealthService.report()));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<StockAvailabilityResponse>> availability(
            @RequestParam String productId,
            @RequestParam String size
    ) {
        return ResponseEntity.ok(ApiResponse.success(stockLedgerService.availability(productId, size)));
    }

    @PostMapping("/restock")
    public ResponseEntity<ApiResponse<StockAvailabilityResponse>> restock(@Valid @RequestBody RestockRequest request) {
        StockAvailabilityResponse response = stockLedgerService.restock(
                request.productId(), request.size(), request.quantity());
        return ResponseEntity.ok(ApiResponse.success(response));
    }
}

package io.hhplus.checkout.presentation.api.admin;

import io.hhplus.checkout.application.reconciliation.ReconciliationService;
import io.hhplus.checkout.application.reconciliation.dto.ReconciliationTaskResponse;
import io.hhplus.checkout.application.reconciliation.dto.ResolveTaskRequest;
import io.hhplus.checkout.presentation.common.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Validated
@RestController
@RequestMapping("/api/admin/reconciliation")
@RequiredArgsConstructor
public class ReconciliationController {

    private final ReconciliationService reconciliationService;

    @GetMapping("/manual-review")
    public ResponseEntity<ApiResponse<List<ReconciliationTaskResponse>>> listManualReview() {
        return ResponseEntity.ok(ApiResponse.success(reconciliationService.listOperatorQueue()));
    }

    @PostMapping("/{taskId}/resolve")
    public ResponseEntity<ApiResponse<ReconciliationTaskResponse>> resolve(
            @PathVariable Long taskId,
            @Valid @RequestBody ResolveTaskRequest request
    ) {
        return ResponseEntity.ok(ApiResponse.success(reconciliationService.resolve(taskId, request.note())));
    }
}

package io.hhplus.checkout.application.stock.dto;

import java.util.List;

/**
 * 재고 상태 리포트
 *
 * @param lowStock         가용 재고가 임계값 미만인 항목
 * @param stuckReservations 예약 수량이 재고 대비 비정상적으로 큰 항목 (만료 정리 누락 의심)
 */
public record StockHealthResponse(
    int totalEntries,
    long totalStock,
    long totalReserved,
    long totalAvailable,
    int lowStockThreshold,
    List<StockAvailabilityResponse> lowStock,
    List<StockAvailabilityResponse> stuckReservations
) {
}

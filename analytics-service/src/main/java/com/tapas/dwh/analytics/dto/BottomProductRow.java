package com.tapas.dwh.analytics.dto;

import java.math.BigDecimal;

public record BottomProductRow(
        String productName,
        String category,
        BigDecimal totalRevenue,
        Long totalUnitsSold) {
}

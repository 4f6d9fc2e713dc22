package com.tapas.dwh.analytics.dto;

import java.math.BigDecimal;

public record CategoryProductRankRow(
        String category,
        String productName,
        BigDecimal totalRevenue,
        int rankInCategory) {
}

package com.tapas.dwh.analytics.dto;

import java.math.BigDecimal;

public record CategoryRevenueRow(
        String category,
        BigDecimal categoryRevenue,
        Long unitsSold,
        long uniqueBuyers,
        BigDecimal avgOrderValue) {
}

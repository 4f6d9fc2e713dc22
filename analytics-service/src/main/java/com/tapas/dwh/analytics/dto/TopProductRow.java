package com.tapas.dwh.analytics.dto;

import java.math.BigDecimal;

public record TopProductRow(
        String productName,
        String category,
        String subcategory,
        BigDecimal totalRevenue,
        Long totalUnitsSold,
        long totalOrders,
        BigDecimal avgOrderValue) {
}

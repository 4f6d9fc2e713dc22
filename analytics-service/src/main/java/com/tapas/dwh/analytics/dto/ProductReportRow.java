package com.tapas.dwh.analytics.dto;

import java.math.BigDecimal;

/**
 * One product of the product report, with profit figures and its revenue rank
 * across all products.
 */
public record ProductReportRow(
        Long productKey,
        String productName,
        String category,
        String subcategory,
        BigDecimal cost,
        long totalOrders,
        Long totalUnitsSold,
        BigDecimal totalRevenue,
        BigDecimal totalProfit,
        BigDecimal profitMarginPct,
        int revenueRank) {
}

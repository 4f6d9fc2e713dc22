package com.tapas.dwh.analytics.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Overall business summary of the sales fact table.
 * Counts are zero and the remaining measures null when there are no sales.
 */
public record KeyMetrics(
        long totalCustomers,
        long totalProducts,
        long totalOrders,
        BigDecimal totalRevenue,
        Long totalQuantitySold,
        BigDecimal avgOrderValue,
        LocalDate firstOrderDate,
        LocalDate lastOrderDate,
        Long monthsOfData) {
}

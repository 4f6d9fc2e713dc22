package com.tapas.dwh.analytics.dto;

import java.math.BigDecimal;

public record MonthlyTrendRow(
        int orderYear,
        int orderMonth,
        String monthName,
        BigDecimal monthlyRevenue,
        long uniqueCustomers,
        Long totalUnitsSold) {
}

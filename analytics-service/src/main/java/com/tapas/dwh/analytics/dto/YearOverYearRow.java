package com.tapas.dwh.analytics.dto;

import java.math.BigDecimal;

public record YearOverYearRow(
        int orderYear,
        BigDecimal yearlyRevenue,
        BigDecimal prevYearRevenue,
        BigDecimal revenueChange,
        BigDecimal yoyGrowthPct) {
}

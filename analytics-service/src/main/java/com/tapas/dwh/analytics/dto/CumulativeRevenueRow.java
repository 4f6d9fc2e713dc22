package com.tapas.dwh.analytics.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record CumulativeRevenueRow(
        LocalDate orderDate,
        BigDecimal dailyRevenue,
        BigDecimal runningTotalRevenue,
        BigDecimal movingAvgRevenue) {
}

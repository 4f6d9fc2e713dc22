package com.tapas.dwh.analytics.dto;

import java.math.BigDecimal;

public record CountryRevenueRow(
        String country,
        long totalCustomers,
        BigDecimal totalRevenue,
        BigDecimal avgOrderValue) {
}

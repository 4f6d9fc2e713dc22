package com.tapas.dwh.analytics.dto;

import com.tapas.dwh.analytics.domain.CustomerSegment;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One customer of the customer report. Customers without orders carry zero orders
 * and null measures. Age and days since last order are relative to the evaluation date.
 */
public record CustomerReportRow(
        Long customerKey,
        String customerName,
        String country,
        String gender,
        Integer age,
        long totalOrders,
        BigDecimal totalRevenue,
        Long totalQuantity,
        LocalDate lastOrderDate,
        Long daysSinceLastOrder,
        CustomerSegment customerSegment) {
}

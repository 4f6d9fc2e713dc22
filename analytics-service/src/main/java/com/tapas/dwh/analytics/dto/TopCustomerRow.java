package com.tapas.dwh.analytics.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record TopCustomerRow(
        Long customerKey,
        String customerName,
        String country,
        BigDecimal totalSpent,
        long totalOrders,
        Long totalItemsBought,
        LocalDate firstPurchase,
        LocalDate lastPurchase,
        Long customerLifespanDays) {
}

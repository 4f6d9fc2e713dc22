package com.tapas.dwh.analytics.dto;

import com.tapas.dwh.analytics.domain.CustomerSegment;

import java.math.BigDecimal;

public record CustomerSegmentRow(
        Long customerKey,
        String customerName,
        String country,
        BigDecimal totalSpent,
        long totalOrders,
        CustomerSegment customerSegment,
        Long lifespanDays) {
}

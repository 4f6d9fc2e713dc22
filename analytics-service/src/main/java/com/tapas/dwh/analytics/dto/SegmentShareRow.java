package com.tapas.dwh.analytics.dto;

import com.tapas.dwh.analytics.domain.CustomerSegment;

import java.math.BigDecimal;

public record SegmentShareRow(
        CustomerSegment customerSegment,
        long customerCount,
        BigDecimal pctOfCustomers) {
}

package com.tapas.dwh.analytics.dto;

import java.math.BigDecimal;

/**
 * A category's revenue as a share of the revenue of all categories.
 */
public record CategoryShareRow(
        String category,
        BigDecimal revenue,
        BigDecimal totalRevenue,
        BigDecimal pctOfTotal) {
}

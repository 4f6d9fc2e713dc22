package com.tapas.dwh.analytics.domain;

import java.math.BigDecimal;

/**
 * Row of {@code dim_products}.
 */
public record ProductDimension(
        Long productKey,
        Long productId,
        String productNumber,
        String productName,
        String category,
        String subcategory,
        BigDecimal cost) {
}

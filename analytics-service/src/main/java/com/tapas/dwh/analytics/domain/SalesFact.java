package com.tapas.dwh.analytics.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Row of {@code fact_sales}. Grain is one order line; orderNumber repeats across the
 * lines of a multi-item order. Keys, date and measures may all be null.
 */
public record SalesFact(
        String orderNumber,
        Long productKey,
        Long customerKey,
        LocalDate orderDate,
        BigDecimal salesAmount,
        Integer quantity,
        BigDecimal price) {
}

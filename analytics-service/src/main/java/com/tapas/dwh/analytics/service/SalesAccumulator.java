package com.tapas.dwh.analytics.service;

import com.tapas.dwh.analytics.domain.SalesFact;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Running aggregate over sales lines. Null inputs are skipped the way SQL aggregates skip
 * them: revenue and quantity stay null until a non-null value is added.
 */
class SalesAccumulator {

    private BigDecimal revenue;
    private long amountCount;
    private Long quantity;
    private long orderLines;
    private final Set<String> orderNumbers = new HashSet<>();
    private final Set<Long> customerKeys = new HashSet<>();
    private final Set<Long> productKeys = new HashSet<>();
    private LocalDate firstOrderDate;
    private LocalDate lastOrderDate;

    static <K> Map<K, SalesAccumulator> groupBy(Iterable<SalesFact> facts,
                                                Function<SalesFact, K> keyFunction) {
        Map<K, SalesAccumulator> groups = new LinkedHashMap<>();
        for (SalesFact fact : facts) {
            groups.computeIfAbsent(keyFunction.apply(fact), k -> new SalesAccumulator()).add(fact);
        }
        return groups;
    }

    SalesAccumulator add(SalesFact fact) {
        if (fact.salesAmount() != null) {
            revenue = Ratios.add(revenue, fact.salesAmount());
            amountCount++;
        }
        if (fact.quantity() != null) {
            quantity = (quantity == null ? 0L : quantity) + fact.quantity();
        }
        if (fact.orderNumber() != null) {
            orderLines++;
            orderNumbers.add(fact.orderNumber());
        }
        if (fact.customerKey() != null) {
            customerKeys.add(fact.customerKey());
        }
        if (fact.productKey() != null) {
            productKeys.add(fact.productKey());
        }
        LocalDate orderDate = fact.orderDate();
        if (orderDate != null) {
            if (firstOrderDate == null || orderDate.isBefore(firstOrderDate)) {
                firstOrderDate = orderDate;
            }
            if (lastOrderDate == null || orderDate.isAfter(lastOrderDate)) {
                lastOrderDate = orderDate;
            }
        }
        return this;
    }

    BigDecimal revenue() {
        return revenue;
    }

    Long quantity() {
        return quantity;
    }

    /** Lines carrying an order number. */
    long orderLines() {
        return orderLines;
    }

    long distinctOrders() {
        return orderNumbers.size();
    }

    long distinctCustomers() {
        return customerKeys.size();
    }

    long distinctProducts() {
        return productKeys.size();
    }

    LocalDate firstOrderDate() {
        return firstOrderDate;
    }

    LocalDate lastOrderDate() {
        return lastOrderDate;
    }

    /** Mean sales amount per line, over lines that carry an amount. */
    BigDecimal averageAmount(int scale) {
        return Ratios.average(revenue, amountCount, scale);
    }
}

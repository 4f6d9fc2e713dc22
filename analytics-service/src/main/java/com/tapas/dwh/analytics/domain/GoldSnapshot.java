package com.tapas.dwh.analytics.domain;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The three Gold tables as read together for one report request.
 * Lookups by key follow left-join semantics: an unresolved key yields null.
 */
public final class GoldSnapshot {

    private final List<CustomerDimension> customers;
    private final List<ProductDimension> products;
    private final List<SalesFact> sales;

    private final Map<Long, CustomerDimension> customersByKey = new HashMap<>();
    private final Map<Long, ProductDimension> productsByKey = new HashMap<>();

    public GoldSnapshot(List<CustomerDimension> customers,
                        List<ProductDimension> products,
                        List<SalesFact> sales) {
        this.customers = List.copyOf(customers);
        this.products = List.copyOf(products);
        this.sales = List.copyOf(sales);

        for (CustomerDimension customer : this.customers) {
            if (customer.customerKey() != null) {
                customersByKey.putIfAbsent(customer.customerKey(), customer);
            }
        }
        for (ProductDimension product : this.products) {
            if (product.productKey() != null) {
                productsByKey.putIfAbsent(product.productKey(), product);
            }
        }
    }

    public static GoldSnapshot empty() {
        return new GoldSnapshot(List.of(), List.of(), List.of());
    }

    public List<CustomerDimension> customers() {
        return customers;
    }

    public List<ProductDimension> products() {
        return products;
    }

    public List<SalesFact> sales() {
        return sales;
    }

    public CustomerDimension customerOf(SalesFact fact) {
        return fact.customerKey() == null ? null : customersByKey.get(fact.customerKey());
    }

    public ProductDimension productOf(SalesFact fact) {
        return fact.productKey() == null ? null : productsByKey.get(fact.productKey());
    }
}

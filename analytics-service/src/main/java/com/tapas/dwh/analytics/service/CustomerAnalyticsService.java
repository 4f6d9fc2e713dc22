package com.tapas.dwh.analytics.service;

import com.tapas.dwh.analytics.config.AnalyticsProperties;
import com.tapas.dwh.analytics.domain.CustomerDimension;
import com.tapas.dwh.analytics.domain.CustomerSegment;
import com.tapas.dwh.analytics.domain.GoldSnapshot;
import com.tapas.dwh.analytics.domain.SalesFact;
import com.tapas.dwh.analytics.dto.CountryRevenueRow;
import com.tapas.dwh.analytics.dto.CustomerSegmentRow;
import com.tapas.dwh.analytics.dto.SegmentShareRow;
import com.tapas.dwh.analytics.dto.TopCustomerRow;
import com.tapas.dwh.analytics.repository.GoldTableRepository;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Customer analysis: top spenders, revenue by country and spend segmentation.
 * Sales lines are left-joined to the customer dimension.
 */
@Service
public class CustomerAnalyticsService {

    private static final Comparator<TopCustomerRow> TOP_ORDER = Comparator
            .comparing(TopCustomerRow::totalSpent, Rankings.DESCENDING)
            .thenComparing(TopCustomerRow::customerKey, Rankings.KEY);

    private static final Comparator<CustomerSegmentRow> SEGMENT_ORDER = Comparator
            .comparing(CustomerSegmentRow::totalSpent, Rankings.DESCENDING)
            .thenComparing(CustomerSegmentRow::customerKey, Rankings.KEY);

    private final GoldTableRepository repository;
    private final CustomerSegmentPolicy segmentPolicy;
    private final int scale;

    public CustomerAnalyticsService(GoldTableRepository repository,
                                    CustomerSegmentPolicy segmentPolicy,
                                    AnalyticsProperties properties) {
        this.repository = repository;
        this.segmentPolicy = segmentPolicy;
        this.scale = properties.getScale();
    }

    public List<TopCustomerRow> topCustomers(int limit) {
        Rankings.requirePositiveLimit(limit);
        return topCustomers(repository.loadSnapshot(), limit);
    }

    public List<TopCustomerRow> topCustomers(GoldSnapshot snapshot, int limit) {
        var groups = groupByCustomer(snapshot);

        var rows = new ArrayList<TopCustomerRow>(groups.size());
        groups.forEach((customer, agg) -> rows.add(new TopCustomerRow(
                customer.customerKey(),
                customer.customerName(),
                customer.country(),
                agg.revenue(),
                agg.distinctOrders(),
                agg.quantity(),
                agg.firstOrderDate(),
                agg.lastOrderDate(),
                daysBetween(agg.firstOrderDate(), agg.lastOrderDate()))));
        rows.sort(TOP_ORDER);
        return Rankings.limit(rows, limit);
    }

    public List<CountryRevenueRow> revenueByCountry() {
        return revenueByCountry(repository.loadSnapshot());
    }

    public List<CountryRevenueRow> revenueByCountry(GoldSnapshot snapshot) {
        Map<String, Set<Long>> matchedCustomers = new HashMap<>();
        var groups = SalesAccumulator.groupBy(snapshot.sales(), fact -> {
            CustomerDimension customer = snapshot.customerOf(fact);
            if (customer == null) {
                return null;
            }
            matchedCustomers.computeIfAbsent(customer.country(), k -> new HashSet<>()).add(customer.customerKey());
            return customer.country();
        });

        var rows = new ArrayList<CountryRevenueRow>(groups.size());
        groups.forEach((country, agg) -> rows.add(new CountryRevenueRow(
                country,
                matchedCustomers.getOrDefault(country, Set.of()).size(),
                agg.revenue(),
                agg.averageAmount(scale))));
        rows.sort(Comparator
                .comparing(CountryRevenueRow::totalRevenue, Rankings.DESCENDING)
                .thenComparing(CountryRevenueRow::country, Rankings.TEXT));
        return rows;
    }

    public List<CustomerSegmentRow> segmentation() {
        return segmentation(repository.loadSnapshot());
    }

    public List<CustomerSegmentRow> segmentation(GoldSnapshot snapshot) {
        var groups = groupByCustomer(snapshot);

        var rows = new ArrayList<CustomerSegmentRow>(groups.size());
        groups.forEach((customer, agg) -> rows.add(new CustomerSegmentRow(
                customer.customerKey(),
                customer.customerName(),
                customer.country(),
                agg.revenue(),
                agg.distinctOrders(),
                segmentPolicy.classify(agg.revenue()),
                daysBetween(agg.firstOrderDate(), agg.lastOrderDate()))));
        rows.sort(SEGMENT_ORDER);
        return rows;
    }

    public List<SegmentShareRow> segmentDistribution() {
        return segmentDistribution(repository.loadSnapshot());
    }

    /**
     * Customers per segment and their share of all customers. Customers are the distinct
     * customer keys of the sales lines; lines without a customer key count as one customer.
     */
    public List<SegmentShareRow> segmentDistribution(GoldSnapshot snapshot) {
        var spendByCustomer = SalesAccumulator.groupBy(snapshot.sales(), SalesFact::customerKey);

        Map<CustomerSegment, Long> counts = new EnumMap<>(CustomerSegment.class);
        for (SalesAccumulator agg : spendByCustomer.values()) {
            counts.merge(segmentPolicy.classify(agg.revenue()), 1L, Long::sum);
        }

        BigDecimal total = BigDecimal.valueOf(spendByCustomer.size());
        var rows = new ArrayList<SegmentShareRow>(counts.size());
        counts.forEach((segment, count) -> rows.add(new SegmentShareRow(
                segment,
                count,
                Ratios.percent(BigDecimal.valueOf(count), total, scale))));
        rows.sort(Comparator
                .comparingLong(SegmentShareRow::customerCount).reversed()
                .thenComparing(SegmentShareRow::customerSegment));
        return rows;
    }

    private static Map<CustomerGroup, SalesAccumulator> groupByCustomer(GoldSnapshot snapshot) {
        return SalesAccumulator.groupBy(snapshot.sales(), fact -> CustomerGroup.of(snapshot.customerOf(fact)));
    }

    static Long daysBetween(LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            return null;
        }
        return ChronoUnit.DAYS.between(start, end);
    }

    /**
     * Customer attributes the spend reports group on; all null for an unmatched customer.
     */
    private record CustomerGroup(Long customerKey, String customerName, String country) {

        static CustomerGroup of(CustomerDimension customer) {
            if (customer == null) {
                return new CustomerGroup(null, null, null);
            }
            return new CustomerGroup(customer.customerKey(), customer.fullName(), customer.country());
        }
    }
}

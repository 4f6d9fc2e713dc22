package com.tapas.dwh.analytics.service;

import com.tapas.dwh.analytics.config.AnalyticsProperties;
import com.tapas.dwh.analytics.domain.CustomerDimension;
import com.tapas.dwh.analytics.domain.GoldSnapshot;
import com.tapas.dwh.analytics.domain.ProductDimension;
import com.tapas.dwh.analytics.domain.SalesFact;
import com.tapas.dwh.analytics.dto.CustomerReportRow;
import com.tapas.dwh.analytics.dto.ProductReportRow;
import com.tapas.dwh.analytics.repository.GoldTableRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.Period;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Customer and product report views for dashboard consumers. Each view has one row per
 * dimension row, outer-joined to the sales lines, and is recomputed on every call.
 * Age and recency are evaluated against the injected clock.
 */
@Service
public class ReportViewService {

    private static final Logger logger = LoggerFactory.getLogger(ReportViewService.class);

    private static final Comparator<ProductReportRow> PRODUCT_REVENUE_ORDER = Comparator
            .comparing(ProductReportRow::totalRevenue, Rankings.DESCENDING)
            .thenComparing(ProductReportRow::productKey, Rankings.KEY);

    private final GoldTableRepository repository;
    private final CustomerSegmentPolicy segmentPolicy;
    private final Clock clock;
    private final int scale;

    public ReportViewService(GoldTableRepository repository,
                             CustomerSegmentPolicy segmentPolicy,
                             Clock clock,
                             AnalyticsProperties properties) {
        this.repository = repository;
        this.segmentPolicy = segmentPolicy;
        this.clock = clock;
        this.scale = properties.getScale();
    }

    public List<CustomerReportRow> customerReport() {
        return customerReport(repository.loadSnapshot());
    }

    public List<CustomerReportRow> customerReport(GoldSnapshot snapshot) {
        LocalDate today = LocalDate.now(clock);
        var salesByCustomer = SalesAccumulator.groupBy(snapshot.sales(), SalesFact::customerKey);

        var rows = new ArrayList<CustomerReportRow>(snapshot.customers().size());
        for (CustomerDimension customer : snapshot.customers()) {
            // a null key never joins, not even to lines without a customer
            var agg = customer.customerKey() == null ? null : salesByCustomer.get(customer.customerKey());
            if (agg == null) {
                agg = new SalesAccumulator();
            }
            rows.add(new CustomerReportRow(
                    customer.customerKey(),
                    customer.fullName(),
                    customer.country(),
                    customer.gender(),
                    age(customer.birthdate(), today),
                    agg.distinctOrders(),
                    agg.revenue(),
                    agg.quantity(),
                    agg.lastOrderDate(),
                    CustomerAnalyticsService.daysBetween(agg.lastOrderDate(), today),
                    segmentPolicy.classify(agg.revenue())));
        }
        rows.sort(Comparator.comparing(CustomerReportRow::customerKey, Rankings.KEY));

        logger.debug("Customer report evaluated on {}: {} rows", today, rows.size());
        return rows;
    }

    public List<ProductReportRow> productReport() {
        return productReport(repository.loadSnapshot());
    }

    /**
     * Product view with profit ({@code revenue - cost * units}), margin over revenue and a
     * competition rank by revenue across all products.
     */
    public List<ProductReportRow> productReport(GoldSnapshot snapshot) {
        var salesByProduct = SalesAccumulator.groupBy(snapshot.sales(), SalesFact::productKey);

        var unranked = new ArrayList<ProductReportRow>(snapshot.products().size());
        for (ProductDimension product : snapshot.products()) {
            var agg = product.productKey() == null ? null : salesByProduct.get(product.productKey());
            if (agg == null) {
                agg = new SalesAccumulator();
            }
            BigDecimal profit = profit(agg.revenue(), product.cost(), agg.quantity());
            unranked.add(new ProductReportRow(
                    product.productKey(),
                    product.productName(),
                    product.category(),
                    product.subcategory(),
                    product.cost(),
                    agg.distinctOrders(),
                    agg.quantity(),
                    agg.revenue(),
                    Ratios.round(profit, scale),
                    Ratios.percent(profit, agg.revenue(), scale),
                    0));
        }
        unranked.sort(PRODUCT_REVENUE_ORDER);

        int[] ranks = Rankings.competitionRanks(unranked, ProductReportRow::totalRevenue);
        var rows = new ArrayList<ProductReportRow>(unranked.size());
        for (int i = 0; i < unranked.size(); i++) {
            var row = unranked.get(i);
            rows.add(new ProductReportRow(
                    row.productKey(),
                    row.productName(),
                    row.category(),
                    row.subcategory(),
                    row.cost(),
                    row.totalOrders(),
                    row.totalUnitsSold(),
                    row.totalRevenue(),
                    row.totalProfit(),
                    row.profitMarginPct(),
                    ranks[i]));
        }
        return rows;
    }

    /**
     * Completed years between birthdate and the evaluation date.
     */
    static Integer age(LocalDate birthdate, LocalDate today) {
        if (birthdate == null) {
            return null;
        }
        return Period.between(birthdate, today).getYears();
    }

    private static BigDecimal profit(BigDecimal revenue, BigDecimal cost, Long units) {
        if (revenue == null || cost == null || units == null) {
            return null;
        }
        return revenue.subtract(cost.multiply(BigDecimal.valueOf(units)));
    }
}

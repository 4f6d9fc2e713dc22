package com.tapas.dwh.analytics.service;

import com.tapas.dwh.analytics.config.AnalyticsProperties;
import com.tapas.dwh.analytics.domain.GoldSnapshot;
import com.tapas.dwh.analytics.domain.ProductDimension;
import com.tapas.dwh.analytics.dto.BottomProductRow;
import com.tapas.dwh.analytics.dto.CategoryProductRankRow;
import com.tapas.dwh.analytics.dto.CategoryRevenueRow;
import com.tapas.dwh.analytics.dto.CategoryShareRow;
import com.tapas.dwh.analytics.dto.TopProductRow;
import com.tapas.dwh.analytics.repository.GoldTableRepository;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Product and category performance. Sales lines are left-joined to the product dimension,
 * so lines with an unknown product are reported under null product attributes.
 */
@Service
public class ProductPerformanceService {

    private static final Comparator<TopProductRow> TOP_ORDER = Comparator
            .comparing(TopProductRow::totalRevenue, Rankings.DESCENDING)
            .thenComparing(TopProductRow::productName, Rankings.TEXT)
            .thenComparing(TopProductRow::category, Rankings.TEXT)
            .thenComparing(TopProductRow::subcategory, Rankings.TEXT);

    private static final Comparator<BottomProductRow> BOTTOM_ORDER = Comparator
            .comparing(BottomProductRow::totalRevenue, Rankings.ASCENDING)
            .thenComparing(BottomProductRow::productName, Rankings.TEXT)
            .thenComparing(BottomProductRow::category, Rankings.TEXT);

    private static final Comparator<CategoryProductRankRow> CATEGORY_RANK_ORDER = Comparator
            .comparing(CategoryProductRankRow::category, Rankings.TEXT)
            .thenComparing(CategoryProductRankRow::totalRevenue, Rankings.DESCENDING)
            .thenComparing(CategoryProductRankRow::productName, Rankings.TEXT);

    private final GoldTableRepository repository;
    private final int scale;

    public ProductPerformanceService(GoldTableRepository repository, AnalyticsProperties properties) {
        this.repository = repository;
        this.scale = properties.getScale();
    }

    public List<TopProductRow> topProducts(int limit) {
        Rankings.requirePositiveLimit(limit);
        return topProducts(repository.loadSnapshot(), limit);
    }

    public List<TopProductRow> topProducts(GoldSnapshot snapshot, int limit) {
        var groups = SalesAccumulator.groupBy(snapshot.sales(),
                fact -> ProductGroup.of(snapshot.productOf(fact)));

        var rows = new ArrayList<TopProductRow>(groups.size());
        groups.forEach((group, agg) -> rows.add(new TopProductRow(
                group.productName(),
                group.category(),
                group.subcategory(),
                agg.revenue(),
                agg.quantity(),
                agg.distinctOrders(),
                agg.averageAmount(scale))));
        rows.sort(TOP_ORDER);
        return Rankings.limit(rows, limit);
    }

    public List<BottomProductRow> bottomProducts(int limit) {
        Rankings.requirePositiveLimit(limit);
        return bottomProducts(repository.loadSnapshot(), limit);
    }

    public List<BottomProductRow> bottomProducts(GoldSnapshot snapshot, int limit) {
        var groups = SalesAccumulator.groupBy(snapshot.sales(),
                fact -> ProductGroup.of(snapshot.productOf(fact)).withoutSubcategory());

        var rows = new ArrayList<BottomProductRow>(groups.size());
        groups.forEach((group, agg) -> rows.add(new BottomProductRow(
                group.productName(),
                group.category(),
                agg.revenue(),
                agg.quantity())));
        rows.sort(BOTTOM_ORDER);
        return Rankings.limit(rows, limit);
    }

    public List<CategoryRevenueRow> revenueByCategory() {
        return revenueByCategory(repository.loadSnapshot());
    }

    public List<CategoryRevenueRow> revenueByCategory(GoldSnapshot snapshot) {
        var groups = groupByCategory(snapshot);

        var rows = new ArrayList<CategoryRevenueRow>(groups.size());
        groups.forEach((category, agg) -> rows.add(new CategoryRevenueRow(
                category,
                agg.revenue(),
                agg.quantity(),
                agg.distinctCustomers(),
                agg.averageAmount(scale))));
        rows.sort(Comparator
                .comparing(CategoryRevenueRow::categoryRevenue, Rankings.DESCENDING)
                .thenComparing(CategoryRevenueRow::category, Rankings.TEXT));
        return rows;
    }

    public List<CategoryShareRow> categoryShare() {
        return categoryShare(repository.loadSnapshot());
    }

    /**
     * Each category's percentage of total revenue. The total is the sum of the category
     * sums, so the shares add up to 100 up to rounding.
     */
    public List<CategoryShareRow> categoryShare(GoldSnapshot snapshot) {
        var groups = groupByCategory(snapshot);

        BigDecimal total = null;
        for (SalesAccumulator agg : groups.values()) {
            total = Ratios.add(total, agg.revenue());
        }

        var rows = new ArrayList<CategoryShareRow>(groups.size());
        for (Map.Entry<String, SalesAccumulator> entry : groups.entrySet()) {
            BigDecimal revenue = entry.getValue().revenue();
            rows.add(new CategoryShareRow(entry.getKey(), revenue, total, Ratios.percent(revenue, total, scale)));
        }
        rows.sort(Comparator
                .comparing(CategoryShareRow::revenue, Rankings.DESCENDING)
                .thenComparing(CategoryShareRow::category, Rankings.TEXT));
        return rows;
    }

    public List<CategoryProductRankRow> categoryRankings() {
        return categoryRankings(repository.loadSnapshot());
    }

    /**
     * Ranks products inside their category by revenue, highest first, with competition
     * ranking: tied products share a rank and the following rank is skipped.
     */
    public List<CategoryProductRankRow> categoryRankings(GoldSnapshot snapshot) {
        var groups = SalesAccumulator.groupBy(snapshot.sales(),
                fact -> ProductGroup.of(snapshot.productOf(fact)).withoutSubcategory());

        var sorted = new ArrayList<CategoryProductRankRow>(groups.size());
        groups.forEach((group, agg) -> sorted.add(
                new CategoryProductRankRow(group.category(), group.productName(), agg.revenue(), 0)));
        sorted.sort(CATEGORY_RANK_ORDER);

        Map<String, List<CategoryProductRankRow>> byCategory = new LinkedHashMap<>();
        for (CategoryProductRankRow row : sorted) {
            byCategory.computeIfAbsent(row.category(), k -> new ArrayList<>()).add(row);
        }

        var rows = new ArrayList<CategoryProductRankRow>(sorted.size());
        for (List<CategoryProductRankRow> partition : byCategory.values()) {
            int[] ranks = Rankings.competitionRanks(partition, CategoryProductRankRow::totalRevenue);
            for (int i = 0; i < partition.size(); i++) {
                var row = partition.get(i);
                rows.add(new CategoryProductRankRow(row.category(), row.productName(), row.totalRevenue(), ranks[i]));
            }
        }
        return rows;
    }

    private static Map<String, SalesAccumulator> groupByCategory(GoldSnapshot snapshot) {
        return SalesAccumulator.groupBy(snapshot.sales(), fact -> {
            ProductDimension product = snapshot.productOf(fact);
            return product == null ? null : product.category();
        });
    }

    /**
     * Descriptive attributes a product report groups on; all null for an unmatched product.
     */
    private record ProductGroup(String productName, String category, String subcategory) {

        static ProductGroup of(ProductDimension product) {
            if (product == null) {
                return new ProductGroup(null, null, null);
            }
            return new ProductGroup(product.productName(), product.category(), product.subcategory());
        }

        ProductGroup withoutSubcategory() {
            return new ProductGroup(productName, category, null);
        }
    }
}

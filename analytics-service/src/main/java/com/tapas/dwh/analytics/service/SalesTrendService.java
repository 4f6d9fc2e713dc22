package com.tapas.dwh.analytics.service;

import com.tapas.dwh.analytics.config.AnalyticsProperties;
import com.tapas.dwh.analytics.domain.GoldSnapshot;
import com.tapas.dwh.analytics.domain.SalesFact;
import com.tapas.dwh.analytics.dto.CumulativeRevenueRow;
import com.tapas.dwh.analytics.dto.MonthlyTrendRow;
import com.tapas.dwh.analytics.dto.YearOverYearRow;
import com.tapas.dwh.analytics.repository.GoldTableRepository;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Changes over time: monthly trend, year-over-year comparison and cumulative revenue.
 * Sales lines without an order date are left out of every bucket.
 */
@Service
public class SalesTrendService {

    private final GoldTableRepository repository;
    private final int scale;
    private final int movingAverageWindow;

    public SalesTrendService(GoldTableRepository repository, AnalyticsProperties properties) {
        if (properties.getMovingAverageWindow() < 1) {
            throw new IllegalStateException(
                    "analytics.moving-average-window must be at least 1, was " + properties.getMovingAverageWindow());
        }
        this.repository = repository;
        this.scale = properties.getScale();
        this.movingAverageWindow = properties.getMovingAverageWindow();
    }

    public List<MonthlyTrendRow> monthlyTrend() {
        return monthlyTrend(repository.loadSnapshot());
    }

    public List<MonthlyTrendRow> monthlyTrend(GoldSnapshot snapshot) {
        var months = bucketByDate(snapshot, YearMonth::from);

        var rows = new ArrayList<MonthlyTrendRow>(months.size());
        months.forEach((month, agg) -> rows.add(new MonthlyTrendRow(
                month.getYear(),
                month.getMonthValue(),
                month.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH),
                agg.revenue(),
                agg.distinctCustomers(),
                agg.quantity())));
        return rows;
    }

    public List<YearOverYearRow> yearOverYear() {
        return yearOverYear(repository.loadSnapshot());
    }

    public List<YearOverYearRow> yearOverYear(GoldSnapshot snapshot) {
        var years = bucketByDate(snapshot, LocalDate::getYear);

        var rows = new ArrayList<YearOverYearRow>(years.size());
        BigDecimal previous = null;
        for (Map.Entry<Integer, SalesAccumulator> entry : years.entrySet()) {
            BigDecimal current = entry.getValue().revenue();
            BigDecimal change = Ratios.subtract(current, previous);
            rows.add(new YearOverYearRow(
                    entry.getKey(),
                    current,
                    previous,
                    change,
                    Ratios.percent(change, previous, scale)));
            previous = current;
        }
        return rows;
    }

    public List<CumulativeRevenueRow> cumulativeRevenue() {
        return cumulativeRevenue(repository.loadSnapshot());
    }

    /**
     * Daily revenue with its running total and a trailing average over the current day and
     * the preceding days of the series (window rows, not calendar days).
     */
    public List<CumulativeRevenueRow> cumulativeRevenue(GoldSnapshot snapshot) {
        var days = bucketByDate(snapshot, Function.identity());

        var dates = new ArrayList<>(days.keySet());
        var dailyRevenue = days.values().stream().map(SalesAccumulator::revenue).toList();

        var rows = new ArrayList<CumulativeRevenueRow>(dates.size());
        BigDecimal runningTotal = null;
        for (int i = 0; i < dates.size(); i++) {
            BigDecimal daily = dailyRevenue.get(i);
            runningTotal = Ratios.add(runningTotal, daily);
            var window = dailyRevenue.subList(Math.max(0, i - movingAverageWindow + 1), i + 1);
            rows.add(new CumulativeRevenueRow(dates.get(i), daily, runningTotal, average(window)));
        }
        return rows;
    }

    private BigDecimal average(List<BigDecimal> values) {
        BigDecimal sum = null;
        long count = 0;
        for (BigDecimal value : values) {
            if (value != null) {
                sum = sum == null ? value : sum.add(value);
                count++;
            }
        }
        return Ratios.average(sum, count, scale);
    }

    private static <K> Map<K, SalesAccumulator> bucketByDate(
            GoldSnapshot snapshot, Function<LocalDate, K> bucket) {
        Map<K, SalesAccumulator> buckets = new TreeMap<>();
        for (SalesFact fact : snapshot.sales()) {
            if (fact.orderDate() != null) {
                buckets.computeIfAbsent(bucket.apply(fact.orderDate()), k -> new SalesAccumulator()).add(fact);
            }
        }
        return buckets;
    }
}

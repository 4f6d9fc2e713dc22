package com.tapas.dwh.analytics.service;

import com.tapas.dwh.analytics.config.AnalyticsProperties;
import com.tapas.dwh.analytics.domain.GoldSnapshot;
import com.tapas.dwh.analytics.dto.KeyMetrics;
import com.tapas.dwh.analytics.repository.GoldTableRepository;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

@Service
public class KeyMetricsService {

    private final GoldTableRepository repository;
    private final int scale;

    public KeyMetricsService(GoldTableRepository repository, AnalyticsProperties properties) {
        this.repository = repository;
        this.scale = properties.getScale();
    }

    public KeyMetrics summary() {
        return summary(repository.loadSnapshot());
    }

    public KeyMetrics summary(GoldSnapshot snapshot) {
        var all = new SalesAccumulator();
        snapshot.sales().forEach(all::add);

        return new KeyMetrics(
                all.distinctCustomers(),
                all.distinctProducts(),
                all.orderLines(),
                all.revenue(),
                all.quantity(),
                all.averageAmount(scale),
                all.firstOrderDate(),
                all.lastOrderDate(),
                monthBoundariesBetween(all.firstOrderDate(), all.lastOrderDate()));
    }

    /**
     * Number of month boundaries crossed going from start to end, so 31 Jan to 1 Feb is one.
     */
    static Long monthBoundariesBetween(LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            return null;
        }
        long startMonth = start.getYear() * 12L + start.getMonthValue();
        long endMonth = end.getYear() * 12L + end.getMonthValue();
        return endMonth - startMonth;
    }
}

package com.tapas.dwh.analytics.service;

import com.tapas.dwh.analytics.config.AnalyticsProperties;
import com.tapas.dwh.analytics.domain.GoldSnapshot;
import com.tapas.dwh.analytics.domain.SalesFact;
import com.tapas.dwh.analytics.dto.CumulativeRevenueRow;
import com.tapas.dwh.analytics.dto.MonthlyTrendRow;
import com.tapas.dwh.analytics.dto.YearOverYearRow;
import com.tapas.dwh.analytics.repository.GoldTableRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static com.tapas.dwh.analytics.service.GoldFixtures.day;
import static com.tapas.dwh.analytics.service.GoldFixtures.properties;
import static com.tapas.dwh.analytics.service.GoldFixtures.sale;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.mock;

@DisplayName("SalesTrendService")
class SalesTrendServiceTest {

    private SalesTrendService service;

    @BeforeEach
    void setUp() {
        service = new SalesTrendService(mock(GoldTableRepository.class), properties());
    }

    private static GoldSnapshot snapshotOf(List<SalesFact> sales) {
        return new GoldSnapshot(List.of(), List.of(), sales);
    }

    @Test
    @DisplayName("Should bucket revenue by year and month, oldest first, skipping undated lines")
    void shouldBuildMonthlyTrend() {
        var snapshot = snapshotOf(List.of(
                sale("SO3", 1L, 2L, day(2013, 2, 3), "40", 1),
                sale("SO1", 1L, 1L, day(2012, 12, 30), "100", 2),
                sale("SO2", 2L, 1L, day(2013, 2, 1), "60", 3),
                sale("SO4", 2L, 3L, null, "999", 9)));

        List<MonthlyTrendRow> rows = service.monthlyTrend(snapshot);

        assertThat(rows).extracting(MonthlyTrendRow::orderYear, MonthlyTrendRow::orderMonth, MonthlyTrendRow::monthName)
                .containsExactly(
                        tuple(2012, 12, "December"),
                        tuple(2013, 2, "February"));
        assertThat(rows.get(1).monthlyRevenue()).isEqualByComparingTo("100");
        assertThat(rows.get(1).uniqueCustomers()).isEqualTo(2);
        assertThat(rows.get(1).totalUnitsSold()).isEqualTo(4L);
    }

    @Test
    @DisplayName("Should compare each year with the previous one")
    void shouldComputeYearOverYear() {
        var snapshot = snapshotOf(List.of(
                sale("SO1", 1L, 1L, day(2011, 5, 1), "200", 1),
                sale("SO2", 1L, 1L, day(2012, 5, 1), "250", 1),
                sale("SO3", 1L, 1L, day(2013, 5, 1), "200", 1)));

        List<YearOverYearRow> rows = service.yearOverYear(snapshot);

        assertThat(rows).extracting(YearOverYearRow::orderYear).containsExactly(2011, 2012, 2013);

        YearOverYearRow first = rows.get(0);
        assertThat(first.prevYearRevenue()).isNull();
        assertThat(first.revenueChange()).isNull();
        assertThat(first.yoyGrowthPct()).isNull();

        assertThat(rows.get(1).prevYearRevenue()).isEqualByComparingTo("200");
        assertThat(rows.get(1).revenueChange()).isEqualByComparingTo("50");
        assertThat(rows.get(1).yoyGrowthPct()).isEqualByComparingTo("25.00");

        assertThat(rows.get(2).revenueChange()).isEqualByComparingTo("-50");
        assertThat(rows.get(2).yoyGrowthPct()).isEqualByComparingTo("-20.00");
    }

    @Test
    @DisplayName("Should leave growth undefined when the previous year earned nothing")
    void shouldGuardZeroPreviousYear() {
        var snapshot = snapshotOf(List.of(
                sale("SO1", 1L, 1L, day(2011, 5, 1), "0", 1),
                sale("SO2", 1L, 1L, day(2012, 5, 1), "300", 1)));

        List<YearOverYearRow> rows = service.yearOverYear(snapshot);

        assertThat(rows.get(1).prevYearRevenue()).isEqualByComparingTo("0");
        assertThat(rows.get(1).revenueChange()).isEqualByComparingTo("300");
        assertThat(rows.get(1).yoyGrowthPct()).isNull();
    }

    @Test
    @DisplayName("Should round growth to two decimals")
    void shouldRoundGrowth() {
        var snapshot = snapshotOf(List.of(
                sale("SO1", 1L, 1L, day(2011, 5, 1), "300", 1),
                sale("SO2", 1L, 1L, day(2012, 5, 1), "400", 1)));

        assertThat(service.yearOverYear(snapshot).get(1).yoyGrowthPct()).isEqualTo(new BigDecimal("33.33"));
    }

    @Test
    @DisplayName("Should end the running total at the series total")
    void shouldAccumulateRunningTotal() {
        var sales = new ArrayList<SalesFact>();
        BigDecimal total = BigDecimal.ZERO;
        for (int d = 1; d <= 10; d++) {
            sales.add(sale("SO" + d, 1L, 1L, day(2013, 3, d), String.valueOf(d * 10), 1));
            total = total.add(BigDecimal.valueOf(d * 10L));
        }
        sales.add(sale("SO99", 1L, 1L, day(2013, 3, 4), "5", 1));
        total = total.add(BigDecimal.valueOf(5));

        List<CumulativeRevenueRow> rows = service.cumulativeRevenue(snapshotOf(sales));

        assertThat(rows).hasSize(10);
        assertThat(rows).extracting(CumulativeRevenueRow::orderDate).isSorted();
        assertThat(rows.get(3).dailyRevenue()).isEqualByComparingTo("45");
        assertThat(rows.get(rows.size() - 1).runningTotalRevenue()).isEqualByComparingTo(total);
    }

    @Test
    @DisplayName("Should average over the available days at the start and seven days afterwards")
    void shouldComputeTrailingAverage() {
        var sales = new ArrayList<SalesFact>();
        for (int d = 1; d <= 8; d++) {
            sales.add(sale("SO" + d, 1L, 1L, day(2013, 3, d), String.valueOf(d * 10), 1));
        }

        List<CumulativeRevenueRow> rows = service.cumulativeRevenue(snapshotOf(sales));

        assertThat(rows.get(0).movingAvgRevenue()).isEqualByComparingTo("10");
        assertThat(rows.get(1).movingAvgRevenue()).isEqualByComparingTo("15");
        // days 1..7
        assertThat(rows.get(6).movingAvgRevenue()).isEqualByComparingTo("40");
        // days 2..8
        assertThat(rows.get(7).movingAvgRevenue()).isEqualByComparingTo("50");
    }

    @Test
    @DisplayName("Should use series rows, not calendar days, for the trailing window")
    void shouldWindowOverRows() {
        var properties = properties();
        properties.setMovingAverageWindow(2);
        var twoDayService = new SalesTrendService(mock(GoldTableRepository.class), properties);

        List<CumulativeRevenueRow> rows = twoDayService.cumulativeRevenue(snapshotOf(List.of(
                sale("SO1", 1L, 1L, day(2013, 1, 1), "10", 1),
                sale("SO2", 1L, 1L, day(2013, 6, 1), "20", 1))));

        assertThat(rows.get(1).movingAvgRevenue()).isEqualByComparingTo("15");
    }

    @Test
    @DisplayName("Should return no rows for an empty fact table")
    void shouldReturnNoRowsWhenEmpty() {
        assertThat(service.monthlyTrend(GoldSnapshot.empty())).isEmpty();
        assertThat(service.yearOverYear(GoldSnapshot.empty())).isEmpty();
        assertThat(service.cumulativeRevenue(GoldSnapshot.empty())).isEmpty();
    }

    @Test
    @DisplayName("Should reject a moving average window below one")
    void shouldRejectInvalidWindow() {
        AnalyticsProperties properties = properties();
        properties.setMovingAverageWindow(0);

        assertThatThrownBy(() -> new SalesTrendService(mock(GoldTableRepository.class), properties))
                .isInstanceOf(IllegalStateException.class);
    }
}

package com.tapas.dwh.analytics.service;

import com.tapas.dwh.analytics.domain.CustomerSegment;
import com.tapas.dwh.analytics.domain.GoldSnapshot;
import com.tapas.dwh.analytics.dto.CountryRevenueRow;
import com.tapas.dwh.analytics.dto.CustomerSegmentRow;
import com.tapas.dwh.analytics.dto.SegmentShareRow;
import com.tapas.dwh.analytics.dto.TopCustomerRow;
import com.tapas.dwh.analytics.repository.GoldTableRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.tapas.dwh.analytics.service.GoldFixtures.customer;
import static com.tapas.dwh.analytics.service.GoldFixtures.day;
import static com.tapas.dwh.analytics.service.GoldFixtures.properties;
import static com.tapas.dwh.analytics.service.GoldFixtures.sale;
import static com.tapas.dwh.analytics.service.GoldFixtures.segmentPolicy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.mock;

@DisplayName("CustomerAnalyticsService")
class CustomerAnalyticsServiceTest {

    private CustomerAnalyticsService service;

    private GoldSnapshot snapshot;

    @BeforeEach
    void setUp() {
        service = new CustomerAnalyticsService(mock(GoldTableRepository.class), segmentPolicy(), properties());
        snapshot = new GoldSnapshot(
                List.of(
                        customer(1, "Jon", "Yang", "Australia"),
                        customer(2, "Eugene", "Huang", "Australia"),
                        customer(3, "Ruben", "Torres", "Germany"),
                        customer(4, "Christy", "Zhu", "Canada")),
                List.of(),
                List.of(
                        sale("SO1", 1L, 1L, day(2011, 1, 10), "3000", 1),
                        sale("SO2", 1L, 1L, day(2011, 3, 1), "2000", 2),
                        sale("SO3", 1L, 2L, day(2012, 1, 1), "4999.99", 1),
                        sale("SO4", 2L, 3L, day(2012, 6, 1), "999.99", 1),
                        sale("SO5", 2L, 77L, day(2013, 1, 1), "1500", 1)));
    }

    @Test
    @DisplayName("Should list top spenders with purchase span")
    void shouldReturnTopCustomers() {
        List<TopCustomerRow> rows = service.topCustomers(snapshot, 2);

        assertThat(rows).extracting(TopCustomerRow::customerKey).containsExactly(1L, 2L);

        TopCustomerRow jon = rows.get(0);
        assertThat(jon.customerName()).isEqualTo("Jon Yang");
        assertThat(jon.country()).isEqualTo("Australia");
        assertThat(jon.totalSpent()).isEqualByComparingTo("5000");
        assertThat(jon.totalOrders()).isEqualTo(2);
        assertThat(jon.totalItemsBought()).isEqualTo(3L);
        assertThat(jon.firstPurchase()).isEqualTo(day(2011, 1, 10));
        assertThat(jon.lastPurchase()).isEqualTo(day(2011, 3, 1));
        assertThat(jon.customerLifespanDays()).isEqualTo(50L);
    }

    @Test
    @DisplayName("Should count matched customers per country and keep unmatched revenue")
    void shouldAggregateByCountry() {
        List<CountryRevenueRow> rows = service.revenueByCountry(snapshot);

        assertThat(rows).extracting(CountryRevenueRow::country, CountryRevenueRow::totalCustomers)
                .containsExactly(
                        tuple("Australia", 2L),
                        tuple(null, 0L),
                        tuple("Germany", 1L));
        assertThat(rows.get(0).totalRevenue()).isEqualByComparingTo("9999.99");
        assertThat(rows.get(0).avgOrderValue()).isEqualByComparingTo("3333.33");
    }

    @Test
    @DisplayName("Should segment customers by lifetime spend")
    void shouldSegmentCustomers() {
        List<CustomerSegmentRow> rows = service.segmentation(snapshot);

        assertThat(rows).extracting(CustomerSegmentRow::customerKey, CustomerSegmentRow::customerSegment)
                .containsExactly(
                        tuple(1L, CustomerSegment.VIP),
                        tuple(2L, CustomerSegment.REGULAR),
                        tuple(null, CustomerSegment.REGULAR),
                        tuple(3L, CustomerSegment.NEW));
        assertThat(rows.get(0).lifespanDays()).isEqualTo(50L);
        assertThat(rows.get(1).lifespanDays()).isZero();
    }

    @Test
    @DisplayName("Should share customers across segments summing to 100 percent")
    void shouldDistributeSegments() {
        List<SegmentShareRow> rows = service.segmentDistribution(snapshot);

        assertThat(rows).extracting(SegmentShareRow::customerSegment, SegmentShareRow::customerCount)
                .containsExactly(
                        tuple(CustomerSegment.REGULAR, 2L),
                        tuple(CustomerSegment.VIP, 1L),
                        tuple(CustomerSegment.NEW, 1L));
        assertThat(rows.get(0).pctOfCustomers()).isEqualByComparingTo("50.00");

        BigDecimal sum = rows.stream().map(SegmentShareRow::pctOfCustomers).reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(sum).isEqualByComparingTo("100.00");
    }

    @Test
    @DisplayName("Should return no rows for an empty fact table")
    void shouldReturnNoRowsWhenEmpty() {
        assertThat(service.topCustomers(GoldSnapshot.empty(), 10)).isEmpty();
        assertThat(service.revenueByCountry(GoldSnapshot.empty())).isEmpty();
        assertThat(service.segmentation(GoldSnapshot.empty())).isEmpty();
        assertThat(service.segmentDistribution(GoldSnapshot.empty())).isEmpty();
    }
}

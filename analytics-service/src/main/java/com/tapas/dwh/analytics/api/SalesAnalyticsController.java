package com.tapas.dwh.analytics.api;

import com.tapas.dwh.analytics.dto.BottomProductRow;
import com.tapas.dwh.analytics.dto.CategoryProductRankRow;
import com.tapas.dwh.analytics.dto.CategoryRevenueRow;
import com.tapas.dwh.analytics.dto.CategoryShareRow;
import com.tapas.dwh.analytics.dto.CountryRevenueRow;
import com.tapas.dwh.analytics.dto.CumulativeRevenueRow;
import com.tapas.dwh.analytics.dto.CustomerSegmentRow;
import com.tapas.dwh.analytics.dto.KeyMetrics;
import com.tapas.dwh.analytics.dto.MonthlyTrendRow;
import com.tapas.dwh.analytics.dto.SegmentShareRow;
import com.tapas.dwh.analytics.dto.TopCustomerRow;
import com.tapas.dwh.analytics.dto.TopProductRow;
import com.tapas.dwh.analytics.dto.YearOverYearRow;
import com.tapas.dwh.analytics.service.CustomerAnalyticsService;
import com.tapas.dwh.analytics.service.KeyMetricsService;
import com.tapas.dwh.analytics.service.ProductPerformanceService;
import com.tapas.dwh.analytics.service.SalesTrendService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/analytics")
public class SalesAnalyticsController {

    private final KeyMetricsService keyMetricsService;
    private final SalesTrendService trendService;
    private final ProductPerformanceService productService;
    private final CustomerAnalyticsService customerService;

    public SalesAnalyticsController(KeyMetricsService keyMetricsService,
                                    SalesTrendService trendService,
                                    ProductPerformanceService productService,
                                    CustomerAnalyticsService customerService) {
        this.keyMetricsService = keyMetricsService;
        this.trendService = trendService;
        this.productService = productService;
        this.customerService = customerService;
    }

    @Operation(
            summary = "Overall business summary",
            description = "Distinct customers and products, order lines, revenue, units, average line value and the covered date range.",
            responses = {
                    @ApiResponse(
                            responseCode = "200",
                            description = "Successful response",
                            content = @Content(
                                    mediaType = "application/json",
                                    schema = @Schema(implementation = KeyMetrics.class),
                                    examples = @ExampleObject(
                                            name = "summaryExample",
                                            value = "{\n  \"totalCustomers\": 18484,\n  \"totalProducts\": 130,\n  \"totalOrders\": 60398,\n  \"totalRevenue\": 29356250.00,\n  \"totalQuantitySold\": 60423,\n  \"avgOrderValue\": 486.04,\n  \"firstOrderDate\": \"2010-12-29\",\n  \"lastOrderDate\": \"2014-01-28\",\n  \"monthsOfData\": 37\n}"
                                    )
                            )
                    )
            }
    )
    @GetMapping("/summary")
    public KeyMetrics summary() {
        return keyMetricsService.summary();
    }

    @Operation(summary = "Monthly revenue trend", description = "Revenue, unique customers and units per calendar month, oldest first.")
    @GetMapping("/trend/monthly")
    public List<MonthlyTrendRow> monthlyTrend() {
        return trendService.monthlyTrend();
    }

    @Operation(summary = "Year-over-year revenue comparison")
    @GetMapping("/trend/yearly")
    public List<YearOverYearRow> yearOverYear() {
        return trendService.yearOverYear();
    }

    @Operation(summary = "Daily revenue with running total and trailing average")
    @GetMapping("/trend/cumulative")
    public List<CumulativeRevenueRow> cumulativeRevenue() {
        return trendService.cumulativeRevenue();
    }

    @Operation(summary = "Top products by revenue")
    @GetMapping("/products/top")
    public List<TopProductRow> topProducts(
            @Parameter(description = "Max number of products to return", example = "10")
            @RequestParam(name = "limit", defaultValue = "${analytics.default-limit:10}") int limit
    ) {
        return productService.topProducts(limit);
    }

    @Operation(summary = "Bottom products by revenue", description = "Lowest-earning products, candidates for review.")
    @GetMapping("/products/bottom")
    public List<BottomProductRow> bottomProducts(
            @Parameter(description = "Max number of products to return", example = "10")
            @RequestParam(name = "limit", defaultValue = "${analytics.default-limit:10}") int limit
    ) {
        return productService.bottomProducts(limit);
    }

    @Operation(summary = "Revenue by product category")
    @GetMapping("/categories")
    public List<CategoryRevenueRow> revenueByCategory() {
        return productService.revenueByCategory();
    }

    @Operation(summary = "Each category's percentage of total revenue")
    @GetMapping("/categories/share")
    public List<CategoryShareRow> categoryShare() {
        return productService.categoryShare();
    }

    @Operation(summary = "Products ranked by revenue within their category")
    @GetMapping("/categories/rankings")
    public List<CategoryProductRankRow> categoryRankings() {
        return productService.categoryRankings();
    }

    @Operation(summary = "Top customers by revenue")
    @GetMapping("/customers/top")
    public List<TopCustomerRow> topCustomers(
            @Parameter(description = "Max number of customers to return", example = "10")
            @RequestParam(name = "limit", defaultValue = "${analytics.default-limit:10}") int limit
    ) {
        return customerService.topCustomers(limit);
    }

    @Operation(summary = "Revenue by customer country")
    @GetMapping("/countries")
    public List<CountryRevenueRow> revenueByCountry() {
        return customerService.revenueByCountry();
    }

    @Operation(summary = "Customers segmented by lifetime spend (VIP / Regular / New)")
    @GetMapping("/customers/segments")
    public List<CustomerSegmentRow> segmentation() {
        return customerService.segmentation();
    }

    @Operation(summary = "Share of customers in each segment")
    @GetMapping("/customers/segments/distribution")
    public List<SegmentShareRow> segmentDistribution() {
        return customerService.segmentDistribution();
    }
}

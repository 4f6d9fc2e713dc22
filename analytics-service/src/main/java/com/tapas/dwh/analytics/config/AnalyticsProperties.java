package com.tapas.dwh.analytics.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Reporting policy for the Gold-layer analytics.
 * Bound from the {@code analytics.*} keys of application.yml.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "analytics")
public class AnalyticsProperties {

    /** Schema holding dim_customers, dim_products and fact_sales. */
    private String schema = "gold";

    /** Row count for top/bottom reports when the request does not give one. */
    private int defaultLimit = 10;

    /** Decimal places for averages, profits and percentages. */
    private int scale = 2;

    /** Number of days (current included) in the trailing revenue average. */
    private int movingAverageWindow = 7;

    private Segmentation segmentation = new Segmentation();

    @Getter
    @Setter
    public static class Segmentation {

        /** Lifetime spend at or above which a customer is VIP. */
        private BigDecimal vipThreshold = new BigDecimal("5000");

        /** Lifetime spend at or above which a customer is Regular. */
        private BigDecimal regularThreshold = new BigDecimal("1000");
    }
}

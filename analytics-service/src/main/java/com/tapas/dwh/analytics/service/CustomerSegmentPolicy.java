package com.tapas.dwh.analytics.service;

import com.tapas.dwh.analytics.config.AnalyticsProperties;
import com.tapas.dwh.analytics.domain.CustomerSegment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Classifies lifetime spend into {@link CustomerSegment}s. Lower bounds are inclusive;
 * a customer without any spend is NEW.
 */
@Component
public class CustomerSegmentPolicy {

    private static final Logger logger = LoggerFactory.getLogger(CustomerSegmentPolicy.class);

    private final BigDecimal vipThreshold;
    private final BigDecimal regularThreshold;

    public CustomerSegmentPolicy(AnalyticsProperties properties) {
        this(properties.getSegmentation().getVipThreshold(),
                properties.getSegmentation().getRegularThreshold());
    }

    public CustomerSegmentPolicy(BigDecimal vipThreshold, BigDecimal regularThreshold) {
        if (vipThreshold == null || regularThreshold == null) {
            throw new IllegalStateException("Segmentation thresholds must be configured");
        }
        if (regularThreshold.compareTo(vipThreshold) > 0) {
            throw new IllegalStateException("Regular threshold " + regularThreshold
                    + " exceeds VIP threshold " + vipThreshold);
        }
        this.vipThreshold = vipThreshold;
        this.regularThreshold = regularThreshold;
        logger.info("Customer segmentation: VIP >= {}, Regular >= {}", vipThreshold, regularThreshold);
    }

    public CustomerSegment classify(BigDecimal totalSpent) {
        if (totalSpent == null) {
            return CustomerSegment.NEW;
        }
        if (totalSpent.compareTo(vipThreshold) >= 0) {
            return CustomerSegment.VIP;
        }
        if (totalSpent.compareTo(regularThreshold) >= 0) {
            return CustomerSegment.REGULAR;
        }
        return CustomerSegment.NEW;
    }
}

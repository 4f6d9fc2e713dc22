package com.tapas.dwh.analytics.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Spend band of a customer. Declared from the highest band down.
 */
public enum CustomerSegment {
    VIP("VIP"),
    REGULAR("Regular"),
    NEW("New");

    private final String label;

    CustomerSegment(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}

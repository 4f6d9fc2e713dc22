package com.tapas.dwh.analytics.domain;

import java.time.LocalDate;

/**
 * Row of {@code dim_customers}.
 */
public record CustomerDimension(
        Long customerKey,
        Long customerId,
        String customerNumber,
        String firstName,
        String lastName,
        String country,
        String gender,
        LocalDate birthdate) {

    /**
     * First and last name joined by a single space, skipping missing parts.
     */
    public String fullName() {
        if (firstName == null) {
            return lastName;
        }
        if (lastName == null) {
            return firstName;
        }
        return firstName + " " + lastName;
    }
}

package com.tapas.dwh.analytics.dto;

public record TableColumn(
        String columnName,
        String dataType) {
}

package com.tapas.dwh.analytics.service;

import com.tapas.dwh.analytics.dto.TableColumn;
import com.tapas.dwh.analytics.repository.GoldTableRepository;
import com.tapas.dwh.analytics.repository.WarehouseCatalogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class WarehouseCatalogService {

    private static final Logger logger = LoggerFactory.getLogger(WarehouseCatalogService.class);

    private final WarehouseCatalogRepository repository;
    private final GoldTableRepository goldTables;

    public WarehouseCatalogService(WarehouseCatalogRepository repository, GoldTableRepository goldTables) {
        this.repository = repository;
        this.goldTables = goldTables;
    }

    public boolean warehouseAvailable() {
        return goldTables.healthCheck();
    }

    public List<String> tables() {
        var tables = repository.findTableNames();
        logger.debug("Schema {} has {} tables", repository.schema(), tables.size());
        return tables;
    }

    /**
     * Columns of a table in the warehouse schema, in declaration order.
     * Empty when the schema has no such table.
     */
    public List<TableColumn> columns(String tableName) {
        if (tableName == null || tableName.isBlank()) {
            throw new IllegalArgumentException("table name must not be blank");
        }
        return repository.findColumns(tableName);
    }
}

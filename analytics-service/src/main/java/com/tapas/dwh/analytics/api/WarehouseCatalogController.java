package com.tapas.dwh.analytics.api;

import com.tapas.dwh.analytics.dto.TableColumn;
import com.tapas.dwh.analytics.service.WarehouseCatalogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/catalog")
public class WarehouseCatalogController {

    private final WarehouseCatalogService service;

    public WarehouseCatalogController(WarehouseCatalogService service) {
        this.service = service;
    }

    @Operation(summary = "Tables of the Gold schema")
    @GetMapping("/tables")
    public List<String> tables() {
        return service.tables();
    }

    @Operation(summary = "Columns and data types of a Gold table")
    @GetMapping("/tables/{table}/columns")
    public List<TableColumn> columns(
            @Parameter(description = "Table name", example = "fact_sales")
            @PathVariable("table") String table
    ) {
        return service.columns(table);
    }

    @Operation(summary = "Warehouse availability", description = "UP when the sales fact table can be queried.")
    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        if (service.warehouseAvailable()) {
            return ResponseEntity.ok(Map.of("warehouse", "UP"));
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("warehouse", "DOWN"));
    }
}

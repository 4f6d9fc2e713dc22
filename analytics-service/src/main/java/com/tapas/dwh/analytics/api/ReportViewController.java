package com.tapas.dwh.analytics.api;

import com.tapas.dwh.analytics.dto.CustomerReportRow;
import com.tapas.dwh.analytics.dto.ProductReportRow;
import com.tapas.dwh.analytics.service.ReportViewService;
import io.swagger.v3.oas.annotations.Operation;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/reports")
public class ReportViewController {

    private final ReportViewService service;

    public ReportViewController(ReportViewService service) {
        this.service = service;
    }

    @Operation(
            summary = "Customer report",
            description = "One row per customer, including customers without orders, with age, recency and spend segment."
    )
    @GetMapping("/customers")
    public List<CustomerReportRow> customerReport() {
        return service.customerReport();
    }

    @Operation(
            summary = "Product report",
            description = "One row per product, including unsold products, with profit, margin and revenue rank."
    )
    @GetMapping("/products")
    public List<ProductReportRow> productReport() {
        return service.productReport();
    }
}

package com.tapas.dwh.analytics.api;

import com.tapas.dwh.analytics.domain.CustomerSegment;
import com.tapas.dwh.analytics.dto.CustomerReportRow;
import com.tapas.dwh.analytics.dto.ProductReportRow;
import com.tapas.dwh.analytics.service.ReportViewService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ReportViewController.class)
@DisplayName("ReportViewController")
class ReportViewControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReportViewService service;

    @Test
    @DisplayName("Should serve the customer report")
    void shouldServeCustomerReport() throws Exception {
        when(service.customerReport()).thenReturn(List.of(
                new CustomerReportRow(1L, "Jon Yang", "Australia", "Male", 42, 3, new BigDecimal("8249"),
                        8L, LocalDate.of(2013, 5, 3), 120L, CustomerSegment.VIP),
                new CustomerReportRow(2L, "Eugene Huang", "Australia", "Male", 40, 0, null,
                        null, null, null, CustomerSegment.NEW)));

        mockMvc.perform(get("/api/reports/customers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].customerSegment").value("VIP"))
                .andExpect(jsonPath("$[0].lastOrderDate").value("2013-05-03"))
                .andExpect(jsonPath("$[1].totalOrders").value(0))
                .andExpect(jsonPath("$[1].customerSegment").value("New"));
    }

    @Test
    @DisplayName("Should serve the product report")
    void shouldServeProductReport() throws Exception {
        when(service.productReport()).thenReturn(List.of(
                new ProductReportRow(10L, "Road-150", "Bikes", "Road Bikes", new BigDecimal("2171.29"), 1, 1L,
                        new BigDecimal("3578.27"), new BigDecimal("1406.98"), new BigDecimal("39.32"), 1)));

        mockMvc.perform(get("/api/reports/products"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].productKey").value(10))
                .andExpect(jsonPath("$[0].profitMarginPct").value(39.32))
                .andExpect(jsonPath("$[0].revenueRank").value(1));
    }
}

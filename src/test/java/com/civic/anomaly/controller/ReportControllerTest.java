package com.civic.anomaly.controller;

import com.civic.anomaly.model.AnomalyReport;
import com.civic.anomaly.model.ReportEntry;
import com.civic.anomaly.service.AnomalyReportService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.ArrayList;
import java.util.List;

import static com.civic.anomaly.testutil.TestDataFactory.NOW;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ReportController.class)
class ReportControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AnomalyReportService reportService;

    @Test
    void generateReport_defaultWindow() throws Exception {
        when(reportService.generateReport(7)).thenReturn(AnomalyReport.builder()
                .windowDays(7)
                .generatedAt(NOW)
                .totalAnomalies(3)
                .bySeverity(new ArrayList<>(List.of(new ReportEntry("critical", 1), new ReportEntry("low", 2))))
                .build());

        mockMvc.perform(get("/api/v1/reports"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalAnomalies").value(3))
                .andExpect(jsonPath("$.bySeverity[0].key").value("critical"))
                .andExpect(jsonPath("$.bySeverity[1].count").value(2));
    }

    @Test
    void generateReport_invalidWindow_badRequest() throws Exception {
        when(reportService.generateReport(0)).thenThrow(new IllegalArgumentException("windowDays must be positive"));

        mockMvc.perform(get("/api/v1/reports").param("windowDays", "0"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void generateReport_nonNumericWindow_badRequest() throws Exception {
        mockMvc.perform(get("/api/v1/reports").param("windowDays", "week"))
                .andExpect(status().isBadRequest());
    }
}

package com.flagship.ledger_reports.outstanding;

import com.flagship.ledger_reports.common.Side;
import com.flagship.ledger_reports.directory.Company;
import com.flagship.ledger_reports.exception.ReportCancelledException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(OutstandingReportController.class)
class OutstandingReportControllerTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 30);

    @TestConfiguration
    static class FixedClock {
        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2024-06-30T08:00:00Z"), ZoneOffset.UTC);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private OutstandingReportService reportService;

    private static OutstandingReport report() {
        OutstandingBill bill = new OutstandingBill("Customer A", "INV-1", LocalDate.of(2024, 4, 10), "New Ref",
            "Sales", "S-1", new BigDecimal("1000"), new BigDecimal("600"), Side.DR, true, false, false,
            LocalDate.of(2024, 5, 10), 51, AgeingBucket.DAYS_31_60, new BigDecimal("600"));
        return new OutstandingReport(
            new Company("C-001", "1", "Flagship Traders"),
            ReportType.RECEIVABLES,
            TODAY,
            List.of(bill),
            List.of(new LedgerSubtotal("Customer A", new BigDecimal("600"), BigDecimal.ZERO,
                BigDecimal.ZERO, new BigDecimal("600"), 1, LocalDate.of(2024, 4, 10), new BigDecimal("-50"))),
            List.of(new AgeingTotal(AgeingBucket.DAYS_31_60, new BigDecimal("600"), BigDecimal.ZERO)),
            List.of(new OnAccountBalance("Customer A", new BigDecimal("-50"))),
            new BigDecimal("600"),
            BigDecimal.ZERO,
            BigDecimal.ZERO,
            List.of());
    }

    @Test
    @DisplayName("Outstanding report renders bills, subtotals, ageing and on-account balances")
    void rendersReport() throws Exception {
        when(reportService.generate(eq("C-001"), eq(ReportType.RECEIVABLES), eq(TODAY), isNull(), any()))
            .thenReturn(report());

        mockMvc.perform(get("/api/companies/C-001/outstanding").param("type", "Receivables"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.report_type").value("receivables"))
            .andExpect(jsonPath("$.as_on_date").value("2024-06-30"))
            .andExpect(jsonPath("$.count").value(1))
            .andExpect(jsonPath("$.ledger_count").value(1))
            .andExpect(jsonPath("$.data[0].bill_ref").value("INV-1"))
            .andExpect(jsonPath("$.data[0].voucher_no").value("S-1"))
            .andExpect(jsonPath("$.data[0].is_receivable").value(true))
            .andExpect(jsonPath("$.data[0].is_payable").value(false))
            .andExpect(jsonPath("$.data[0].is_advance").value(false))
            .andExpect(jsonPath("$.data[0].overdue_days").value(51))
            .andExpect(jsonPath("$.data[0].ageing_bucket").value("31-60"))
            .andExpect(jsonPath("$.data[0].balance_type").value("Dr"))
            .andExpect(jsonPath("$.ledgers[0].on_account_type").value("Cr"))
            .andExpect(jsonPath("$.ageing[0].bucket").value("31-60"))
            .andExpect(jsonPath("$.on_account[0].amount").value(50))
            .andExpect(jsonPath("$.on_account[0].amount_type").value("Cr"));
    }

    @Test
    @DisplayName("as_on and ledger are passed through")
    void passesFilters() throws Exception {
        LocalDate asOn = LocalDate.of(2024, 4, 30);
        when(reportService.generate(any(), any(), any(), any(), any())).thenReturn(report());

        mockMvc.perform(get("/api/companies/C-001/outstanding")
                .param("as_on", "30/04/2024")
                .param("ledger", "Customer A"))
            .andExpect(status().isOk());

        verify(reportService).generate(eq("C-001"), eq(ReportType.BOTH), eq(asOn), eq("Customer A"), any());
    }

    @Test
    @DisplayName("Unknown report type is a bad request")
    void badType() throws Exception {
        mockMvc.perform(get("/api/companies/C-001/outstanding").param("type", "everything"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invalid Request"));

        verifyNoInteractions(reportService);
    }

    @Test
    @DisplayName("Cancelled report maps to 409")
    void cancelled() throws Exception {
        when(reportService.generate(any(), any(), any(), any(), any()))
            .thenThrow(new ReportCancelledException("allocate"));

        mockMvc.perform(get("/api/companies/C-001/outstanding"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.kind").value("CANCELLED"))
            .andExpect(jsonPath("$.details.phase").value("allocate"));
    }
}

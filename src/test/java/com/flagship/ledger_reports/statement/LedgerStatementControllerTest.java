package com.flagship.ledger_reports.statement;

import com.flagship.ledger_reports.common.CancellationToken;
import com.flagship.ledger_reports.directory.Company;
import com.flagship.ledger_reports.directory.Ledger;
import com.flagship.ledger_reports.directory.LedgerNature;
import com.flagship.ledger_reports.exception.DataIssue;
import com.flagship.ledger_reports.exception.InconsistentDataException;
import com.flagship.ledger_reports.exception.InvalidRangeException;
import com.flagship.ledger_reports.exception.NotFoundException;
import com.flagship.ledger_reports.exception.StorageException;
import com.flagship.ledger_reports.observability.CorrelationContext;
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
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(LedgerStatementController.class)
class LedgerStatementControllerTest {

    private static final Company COMPANY = new Company("C-001", "1", "Flagship Traders");
    private static final Ledger CUSTOMER =
        new Ledger("C-001", "Customer A", LedgerNature.DEBTOR, BigDecimal.ZERO, null);

    @TestConfiguration
    static class FixedClock {
        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2025-02-15T10:00:00Z"), ZoneOffset.UTC);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LedgerStatementService statementService;

    private static LedgerStatement statement(LocalDate from, LocalDate to) {
        List<LedgerStatementRow> rows = List.of(
            new LedgerStatementRow("S1", LocalDate.of(2024, 4, 10), "Sales", "Sales", "S-1", null,
                new BigDecimal("1000.00"), BigDecimal.ZERO, new BigDecimal("1000.00")),
            new LedgerStatementRow("R1", LocalDate.of(2024, 5, 1), "Bank", "Receipt", "R-1", "cheque 1234",
                BigDecimal.ZERO, new BigDecimal("1250.00"), new BigDecimal("-250.00")));
        return new LedgerStatement(COMPANY, CUSTOMER, from, to, BigDecimal.ZERO,
            new BigDecimal("1000.00"), new BigDecimal("1250.00"), new BigDecimal("-250.00"), rows, List.of());
    }

    @Test
    @DisplayName("Statement is rendered with Dr/Cr sides and snake_case fields")
    void rendersStatement() throws Exception {
        LocalDate from = LocalDate.of(2024, 4, 1);
        LocalDate to = LocalDate.of(2024, 5, 31);
        when(statementService.generate(eq("C-001"), eq("Customer A/North"), eq(from), eq(to), any(CancellationToken.class)))
            .thenReturn(statement(from, to));

        mockMvc.perform(get("/api/companies/C-001/ledger-statement")
                .param("ledger", "Customer A/North")
                .param("from", "2024-04-01")
                .param("to", "31-05-2024"))
            .andExpect(status().isOk())
            .andExpect(header().exists(CorrelationContext.CORRELATION_ID_HEADER))
            .andExpect(jsonPath("$.company_name").value("Flagship Traders"))
            .andExpect(jsonPath("$.from_date").value("2024-04-01"))
            .andExpect(jsonPath("$.total_transactions").value(2))
            .andExpect(jsonPath("$.net_movement").value(-250.0))
            .andExpect(jsonPath("$.closing_balance").value(250.0))
            .andExpect(jsonPath("$.closing_balance_type").value("Cr"))
            .andExpect(jsonPath("$.opening_balance_type").value("Dr"))
            .andExpect(jsonPath("$.transactions[0].balance_type").value("Dr"))
            .andExpect(jsonPath("$.transactions[1].particulars").value("Bank"))
            .andExpect(jsonPath("$.transactions[1].narration").value("cheque 1234"));
    }

    @Test
    @DisplayName("Dates default to the current financial year up to today")
    void defaultDates() throws Exception {
        LocalDate from = LocalDate.of(2024, 4, 1);
        LocalDate to = LocalDate.of(2025, 2, 15);
        when(statementService.generate(anyString(), anyString(), any(), any(), any()))
            .thenReturn(statement(from, to));

        mockMvc.perform(get("/api/companies/C-001/ledger-statement").param("ledger", "Customer A"))
            .andExpect(status().isOk());

        verify(statementService).generate(eq("C-001"), eq("Customer A"), eq(from), eq(to), any());
    }

    @Test
    @DisplayName("Error kinds map to HTTP statuses")
    void errorMapping() throws Exception {
        when(statementService.generate(eq("missing"), anyString(), any(), any(), any()))
            .thenThrow(NotFoundException.company("missing"));
        when(statementService.generate(eq("range"), anyString(), any(), any(), any()))
            .thenThrow(new InvalidRangeException("From date after to date", Map.of("company_id", "range")));
        when(statementService.generate(eq("bad-data"), anyString(), any(), any(), any()))
            .thenThrow(new InconsistentDataException(
                List.of(new DataIssue(DataIssue.Type.UNBALANCED_VOUCHER, "V9", "out of balance by 1")),
                Map.of("company_id", "bad-data")));
        when(statementService.generate(eq("db-down"), anyString(), any(), any(), any()))
            .thenThrow(new StorageException("Voucher store read failed", Map.of("company_id", "db-down"),
                new RuntimeException("connection refused")));

        mockMvc.perform(get("/api/companies/missing/ledger-statement").param("ledger", "X"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.kind").value("NOT_FOUND"))
            .andExpect(jsonPath("$.details.company_id").value("missing"));
        mockMvc.perform(get("/api/companies/range/ledger-statement").param("ledger", "X"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.kind").value("INVALID_RANGE"));
        mockMvc.perform(get("/api/companies/bad-data/ledger-statement").param("ledger", "X"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.issues[0].reference").value("V9"));
        mockMvc.perform(get("/api/companies/db-down/ledger-statement").param("ledger", "X"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.kind").value("STORAGE"));
    }

    @Test
    @DisplayName("Missing ledger or malformed dates are bad requests")
    void badRequests() throws Exception {
        mockMvc.perform(get("/api/companies/C-001/ledger-statement"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Required parameter 'ledger' is missing"));
        mockMvc.perform(get("/api/companies/C-001/ledger-statement")
                .param("ledger", "Customer A")
                .param("from", "2024-02-30"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Invalid from date: '2024-02-30'"));
    }
}

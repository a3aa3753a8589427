package com.flagship.ledger_reports.directory;

import com.flagship.ledger_reports.voucher.VoucherStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(DirectoryController.class)
class DirectoryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private VoucherStore voucherStore;

    @Test
    @DisplayName("Lists companies")
    void listsCompanies() throws Exception {
        when(voucherStore.findCompanies()).thenReturn(List.of(
            new Company("C-001", "17", "Flagship Traders"),
            new Company("C-002", null, "Harbour Stores")));

        mockMvc.perform(get("/api/companies"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(2))
            .andExpect(jsonPath("$[0].company_id").value("C-001"))
            .andExpect(jsonPath("$[1].company_name").value("Harbour Stores"));
    }

    @Test
    @DisplayName("Lists ledgers with opening balance side from their nature")
    void listsLedgers() throws Exception {
        when(voucherStore.findCompany("C-001"))
            .thenReturn(Optional.of(new Company("C-001", "17", "Flagship Traders")));
        when(voucherStore.findLedgers("C-001")).thenReturn(List.of(
            new Ledger("C-001", "Capital", LedgerNature.LIABILITY, BigDecimal.ZERO, null),
            new Ledger("C-001", "Customer A", LedgerNature.DEBTOR, new BigDecimal("-75"), 30)));

        mockMvc.perform(get("/api/companies/C-001/ledgers"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].opening_balance_type").value("Cr"))
            .andExpect(jsonPath("$[1].opening_balance").value(75))
            .andExpect(jsonPath("$[1].opening_balance_type").value("Cr"))
            .andExpect(jsonPath("$[1].credit_period_days").value(30));
    }

    @Test
    @DisplayName("Ledgers of an unknown company are not found")
    void unknownCompany() throws Exception {
        when(voucherStore.findCompany("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/companies/nope/ledgers"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.kind").value("NOT_FOUND"));
    }
}

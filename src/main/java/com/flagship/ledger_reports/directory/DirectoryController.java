package com.flagship.ledger_reports.directory;

import com.flagship.ledger_reports.directory.dto.CompanyResponse;
import com.flagship.ledger_reports.directory.dto.LedgerResponse;
import com.flagship.ledger_reports.exception.NotFoundException;
import com.flagship.ledger_reports.voucher.VoucherStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Lists the companies and ledgers a report can be requested for.
 */
@RestController
@RequestMapping("/api/companies")
@RequiredArgsConstructor
public class DirectoryController {

    private final VoucherStore voucherStore;

    @GetMapping
    public ResponseEntity<List<CompanyResponse>> getCompanies() {
        return ResponseEntity.ok(voucherStore.findCompanies().stream()
            .map(CompanyResponse::from)
            .toList());
    }

    @GetMapping("/{companyId}/ledgers")
    public ResponseEntity<List<LedgerResponse>> getLedgers(@PathVariable("companyId") String companyId) {
        voucherStore.findCompany(companyId).orElseThrow(() -> NotFoundException.company(companyId));
        return ResponseEntity.ok(voucherStore.findLedgers(companyId).stream()
            .map(LedgerResponse::from)
            .toList());
    }
}

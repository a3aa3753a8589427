package com.flagship.ledger_reports.statement;

import com.flagship.ledger_reports.common.CancellationToken;
import com.flagship.ledger_reports.common.RequestDates;
import com.flagship.ledger_reports.statement.dto.LedgerStatementResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;

/**
 * REST endpoint for ledger statements.
 *
 * The ledger name travels as a query parameter because names may contain
 * slashes. {@code from} defaults to the start of the current financial year,
 * {@code to} to today.
 */
@RestController
@RequestMapping("/api/companies/{companyId}")
@RequiredArgsConstructor
@Slf4j
public class LedgerStatementController {

    private final LedgerStatementService statementService;
    private final Clock clock;

    @GetMapping("/ledger-statement")
    public ResponseEntity<LedgerStatementResponse> getStatement(
            @PathVariable("companyId") String companyId,
            @RequestParam("ledger") String ledger,
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to) {

        LocalDate today = LocalDate.now(clock);
        LocalDate toDate = RequestDates.parseOrDefault(to, "to", today);
        LocalDate fromDate = RequestDates.parseOrDefault(from, "from", RequestDates.financialYearStart(toDate));

        log.debug("Ledger statement requested: companyId={}, ledger={}, from={}, to={}",
            companyId, ledger, fromDate, toDate);

        // a servlet request gives no disconnect signal to cancel on
        LedgerStatement statement = statementService.generate(
            companyId, ledger, fromDate, toDate, CancellationToken.none());
        return ResponseEntity.ok(LedgerStatementResponse.from(statement));
    }
}

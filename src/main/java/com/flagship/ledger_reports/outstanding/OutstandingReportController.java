package com.flagship.ledger_reports.outstanding;

import com.flagship.ledger_reports.common.CancellationToken;
import com.flagship.ledger_reports.common.RequestDates;
import com.flagship.ledger_reports.outstanding.dto.OutstandingResponse;
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
 * REST endpoint for the bill-wise outstanding report.
 */
@RestController
@RequestMapping("/api/companies/{companyId}")
@RequiredArgsConstructor
@Slf4j
public class OutstandingReportController {

    private final OutstandingReportService reportService;
    private final Clock clock;

    /**
     * @param type receivables, payables or both
     * @param asOn defaults to today
     * @param ledger optional single-ledger filter
     */
    @GetMapping("/outstanding")
    public ResponseEntity<OutstandingResponse> getOutstanding(
            @PathVariable("companyId") String companyId,
            @RequestParam(value = "type", defaultValue = "both") String type,
            @RequestParam(value = "as_on", required = false) String asOn,
            @RequestParam(value = "ledger", required = false) String ledger) {

        ReportType reportType = ReportType.fromValue(type);
        LocalDate asOnDate = RequestDates.parseOrDefault(asOn, "as_on", LocalDate.now(clock));
        String ledgerFilter = ledger == null || ledger.isBlank() ? null : ledger;

        log.debug("Outstanding report requested: companyId={}, type={}, asOn={}, ledger={}",
            companyId, reportType.getValue(), asOnDate, ledgerFilter);

        OutstandingReport report = reportService.generate(
            companyId, reportType, asOnDate, ledgerFilter, CancellationToken.none());
        return ResponseEntity.ok(OutstandingResponse.from(report));
    }
}

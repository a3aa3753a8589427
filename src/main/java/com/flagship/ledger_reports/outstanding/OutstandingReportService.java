package com.flagship.ledger_reports.outstanding;

import com.flagship.ledger_reports.common.CancellationToken;
import com.flagship.ledger_reports.exception.DataIssue;
import com.flagship.ledger_reports.exception.InconsistencyPolicy;
import com.flagship.ledger_reports.exception.ReportException;
import com.flagship.ledger_reports.observability.CorrelationContext;
import com.flagship.ledger_reports.observability.ReportMetrics;
import com.flagship.ledger_reports.voucher.BillWiseTransactions;
import com.flagship.ledger_reports.voucher.LedgerPostings;
import com.flagship.ledger_reports.voucher.TransactionLoader;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the bill-wise outstanding schedule of a company.
 *
 * Phases: load, allocate, check data, classify, aggregate. The cancellation
 * token is checked between phases.
 */
@Service
@Slf4j
public class OutstandingReportService {

    static final String REPORT = "outstanding";

    private final TransactionLoader transactionLoader;
    private final BillAllocationEngine allocationEngine;
    private final AgeingClassifier ageingClassifier;
    private final OutstandingAggregator aggregator;
    private final InconsistencyPolicy inconsistencyPolicy;
    private final ReportMetrics reportMetrics;

    public OutstandingReportService(TransactionLoader transactionLoader,
                                    BillAllocationEngine allocationEngine,
                                    AgeingClassifier ageingClassifier,
                                    OutstandingAggregator aggregator,
                                    InconsistencyPolicy inconsistencyPolicy,
                                    ReportMetrics reportMetrics) {
        this.transactionLoader = transactionLoader;
        this.allocationEngine = allocationEngine;
        this.ageingClassifier = ageingClassifier;
        this.aggregator = aggregator;
        this.inconsistencyPolicy = inconsistencyPolicy;
        this.reportMetrics = reportMetrics;
    }

    /**
     * @param ledgerFilter restricts the report to one ledger; null for all
     * @throws com.flagship.ledger_reports.exception.NotFoundException unknown company or ledger
     * @throws com.flagship.ledger_reports.exception.InvalidRangeException as-on date before any data
     * @throws com.flagship.ledger_reports.exception.InconsistentDataException bad data under the FAIL policy
     * @throws com.flagship.ledger_reports.exception.StorageException store failure
     * @throws com.flagship.ledger_reports.exception.ReportCancelledException cancelled by the caller
     */
    public OutstandingReport generate(String companyGuid, ReportType reportType, LocalDate asOnDate,
                                      String ledgerFilter, CancellationToken cancellation) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.COMPANY_ID_MDC_KEY, companyGuid);
        if (ledgerFilter != null) {
            MDC.put(CorrelationContext.LEDGER_NAME_MDC_KEY, ledgerFilter);
        }

        log.info("Generating outstanding report: type={}, asOn={}, policy={}",
            reportType.getValue(), asOnDate, allocationEngine.getSettlementPolicy().name());

        try {
            cancellation.checkpoint("load");
            BillWiseTransactions transactions = transactionLoader.loadBillWise(companyGuid, asOnDate, ledgerFilter);

            cancellation.checkpoint("allocate");
            List<DataIssue> issues = new ArrayList<>(transactions.getIssues());
            List<LedgerAllocation> allocations = new ArrayList<>();
            for (LedgerPostings ledgerPostings : transactions.getLedgers()) {
                LedgerAllocation allocation = allocationEngine.allocate(ledgerPostings, asOnDate);
                issues.addAll(allocation.getIssues());
                allocations.add(allocation);
            }

            cancellation.checkpoint("validate");
            reportMetrics.recordDataIssues(REPORT, issues.size());
            inconsistencyPolicy.enforce(issues, context(companyGuid, reportType, asOnDate, ledgerFilter));

            cancellation.checkpoint("classify");
            List<LedgerOutstanding> classified = allocations.stream()
                .map(allocation -> new LedgerOutstanding(
                    allocation.getLedger(),
                    allocation.getOpenBills().stream()
                        .map(position -> ageingClassifier.classify(position, allocation.getLedger(), asOnDate))
                        .toList(),
                    allocation.getOnAccount()))
                .toList();

            cancellation.checkpoint("aggregate");
            OutstandingReport report = aggregator.aggregate(
                transactions.getCompany(), reportType, asOnDate, classified, issues);

            long duration = System.currentTimeMillis() - startTime;
            reportMetrics.recordGenerated(REPORT, issues.isEmpty() ? "success" : "with_issues", report.getCount());
            reportMetrics.recordLatency(REPORT, duration);

            log.info("Outstanding report generated: bills={}, ledgers={}, receivables={}, payables={}, duration={}ms",
                report.getCount(), report.getLedgerCount(), report.getTotalReceivables(),
                report.getTotalPayables(), duration);
            return report;

        } catch (ReportException e) {
            reportMetrics.recordFailure(REPORT, e.getKind().name());
            log.warn("Outstanding report failed: kind={}, error={}", e.getKind(), e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.COMPANY_ID_MDC_KEY);
            MDC.remove(CorrelationContext.LEDGER_NAME_MDC_KEY);
        }
    }

    private static Map<String, String> context(String companyGuid, ReportType reportType, LocalDate asOnDate,
                                               String ledgerFilter) {
        Map<String, String> context = new LinkedHashMap<>();
        context.put("company_id", companyGuid);
        context.put("report_type", reportType.getValue());
        context.put("as_on_date", asOnDate.toString());
        if (ledgerFilter != null) {
            context.put("ledger_name", ledgerFilter);
        }
        return context;
    }
}

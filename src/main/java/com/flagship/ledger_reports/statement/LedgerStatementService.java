package com.flagship.ledger_reports.statement;

import com.flagship.ledger_reports.common.CancellationToken;
import com.flagship.ledger_reports.exception.InconsistencyPolicy;
import com.flagship.ledger_reports.exception.ReportException;
import com.flagship.ledger_reports.observability.CorrelationContext;
import com.flagship.ledger_reports.observability.ReportMetrics;
import com.flagship.ledger_reports.voucher.LedgerTransactions;
import com.flagship.ledger_reports.voucher.TransactionLoader;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the running-balance statement of one ledger.
 *
 * Phases: load, check data, fold balances. The cancellation token is checked
 * between phases; none of them mutates shared state, so aborting is always
 * clean.
 */
@Service
@Slf4j
public class LedgerStatementService {

    static final String REPORT = "ledger_statement";

    private final TransactionLoader transactionLoader;
    private final RunningBalanceCalculator balanceCalculator;
    private final InconsistencyPolicy inconsistencyPolicy;
    private final ReportMetrics reportMetrics;

    public LedgerStatementService(TransactionLoader transactionLoader,
                                  RunningBalanceCalculator balanceCalculator,
                                  InconsistencyPolicy inconsistencyPolicy,
                                  ReportMetrics reportMetrics) {
        this.transactionLoader = transactionLoader;
        this.balanceCalculator = balanceCalculator;
        this.inconsistencyPolicy = inconsistencyPolicy;
        this.reportMetrics = reportMetrics;
    }

    /**
     * @throws com.flagship.ledger_reports.exception.NotFoundException unknown company or ledger
     * @throws com.flagship.ledger_reports.exception.InvalidRangeException from after to
     * @throws com.flagship.ledger_reports.exception.InconsistentDataException bad data under the FAIL policy
     * @throws com.flagship.ledger_reports.exception.StorageException store failure
     * @throws com.flagship.ledger_reports.exception.ReportCancelledException cancelled by the caller
     */
    public LedgerStatement generate(String companyGuid, String ledgerName, LocalDate from, LocalDate to,
                                    CancellationToken cancellation) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.COMPANY_ID_MDC_KEY, companyGuid);
        MDC.put(CorrelationContext.LEDGER_NAME_MDC_KEY, ledgerName);

        log.info("Generating ledger statement: from={}, to={}", from, to);

        try {
            cancellation.checkpoint("load");
            LedgerTransactions transactions = transactionLoader.loadLedger(companyGuid, ledgerName, from, to);

            cancellation.checkpoint("validate");
            reportMetrics.recordDataIssues(REPORT, transactions.getIssues().size());
            inconsistencyPolicy.enforce(transactions.getIssues(), context(companyGuid, ledgerName, from, to));

            cancellation.checkpoint("running-balance");
            LedgerStatement statement = balanceCalculator.calculate(transactions);

            cancellation.checkpoint("assemble");
            long duration = System.currentTimeMillis() - startTime;
            reportMetrics.recordGenerated(REPORT, statement.getIssues().isEmpty() ? "success" : "with_issues",
                statement.getRows().size());
            reportMetrics.recordLatency(REPORT, duration);

            log.info("Ledger statement generated: rows={}, closing={}, issues={}, duration={}ms",
                statement.getRows().size(), statement.getClosingBalance(), statement.getIssues().size(), duration);
            return statement;

        } catch (ReportException e) {
            reportMetrics.recordFailure(REPORT, e.getKind().name());
            log.warn("Ledger statement failed: kind={}, error={}", e.getKind(), e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.COMPANY_ID_MDC_KEY);
            MDC.remove(CorrelationContext.LEDGER_NAME_MDC_KEY);
        }
    }

    private static Map<String, String> context(String companyGuid, String ledgerName, LocalDate from, LocalDate to) {
        Map<String, String> context = new LinkedHashMap<>();
        context.put("company_id", companyGuid);
        context.put("ledger_name", ledgerName);
        context.put("from_date", from.toString());
        context.put("to_date", to.toString());
        return context;
    }
}

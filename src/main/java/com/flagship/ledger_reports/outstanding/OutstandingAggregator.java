package com.flagship.ledger_reports.outstanding;

import com.flagship.ledger_reports.common.Side;
import com.flagship.ledger_reports.directory.Company;
import com.flagship.ledger_reports.exception.DataIssue;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Rolls classified bills up into ledger subtotals, ageing totals and grand
 * totals. Rows keep the order they arrive in. Advances are totalled on their
 * own and stay out of the ageing columns.
 */
@Component
public class OutstandingAggregator {

    public OutstandingReport aggregate(Company company, ReportType reportType, LocalDate asOnDate,
                                       List<LedgerOutstanding> ledgers, List<DataIssue> issues) {
        List<OutstandingBill> rows = new ArrayList<>();
        List<LedgerSubtotal> subtotals = new ArrayList<>();
        List<OnAccountBalance> onAccount = new ArrayList<>();
        Map<AgeingBucket, BigDecimal[]> ageing = new EnumMap<>(AgeingBucket.class);
        for (AgeingBucket bucket : AgeingBucket.values()) {
            ageing.put(bucket, new BigDecimal[] {BigDecimal.ZERO, BigDecimal.ZERO});
        }
        BigDecimal totalReceivables = BigDecimal.ZERO;
        BigDecimal totalPayables = BigDecimal.ZERO;
        BigDecimal totalAdvances = BigDecimal.ZERO;

        for (LedgerOutstanding ledger : ledgers) {
            BigDecimal running = BigDecimal.ZERO;
            BigDecimal receivable = BigDecimal.ZERO;
            BigDecimal payable = BigDecimal.ZERO;
            BigDecimal advance = BigDecimal.ZERO;
            LocalDate oldest = null;
            int openBills = 0;

            for (OutstandingBill bill : ledger.getBills()) {
                if (!reportType.includes(bill)) {
                    continue;
                }
                running = running.add(bill.getSignedOutstanding());
                rows.add(bill.withBalance(running));
                openBills++;
                if (oldest == null || bill.getBillDate().isBefore(oldest)) {
                    oldest = bill.getBillDate();
                }

                BigDecimal[] bucketTotals = ageing.get(bill.getBucket());
                if (bill.isReceivable()) {
                    receivable = receivable.add(bill.getOutstandingAmount());
                    bucketTotals[0] = bucketTotals[0].add(bill.getOutstandingAmount());
                } else if (bill.isPayable()) {
                    payable = payable.add(bill.getOutstandingAmount());
                    bucketTotals[1] = bucketTotals[1].add(bill.getOutstandingAmount());
                } else if (bill.isAdvance()) {
                    advance = advance.add(bill.getOutstandingAmount());
                }
            }

            BigDecimal ledgerOnAccount = ledger.getOnAccount();
            boolean onAccountInScope = ledgerOnAccount.signum() != 0 && switch (reportType) {
                case RECEIVABLES -> Side.of(ledgerOnAccount, Side.DR) == Side.DR;
                case PAYABLES -> Side.of(ledgerOnAccount, Side.DR) == Side.CR;
                case BOTH -> true;
            };
            if (onAccountInScope) {
                onAccount.add(new OnAccountBalance(ledger.getLedger().getName(), ledgerOnAccount));
            }

            if (openBills > 0) {
                subtotals.add(new LedgerSubtotal(
                    ledger.getLedger().getName(),
                    receivable,
                    payable,
                    advance,
                    running,
                    openBills,
                    oldest,
                    ledgerOnAccount
                ));
                totalReceivables = totalReceivables.add(receivable);
                totalPayables = totalPayables.add(payable);
                totalAdvances = totalAdvances.add(advance);
            }
        }

        List<AgeingTotal> ageingTotals = new ArrayList<>();
        ageing.forEach((bucket, totals) -> ageingTotals.add(new AgeingTotal(bucket, totals[0], totals[1])));

        return new OutstandingReport(
            company,
            reportType,
            asOnDate,
            List.copyOf(rows),
            List.copyOf(subtotals),
            List.copyOf(ageingTotals),
            List.copyOf(onAccount),
            totalReceivables,
            totalPayables,
            totalAdvances,
            List.copyOf(issues)
        );
    }
}

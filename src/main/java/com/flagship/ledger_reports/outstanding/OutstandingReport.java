package com.flagship.ledger_reports.outstanding;

import com.flagship.ledger_reports.directory.Company;
import com.flagship.ledger_reports.exception.DataIssue;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Bill-wise outstanding schedule as of a date.
 *
 * {@code rows} are grouped by ledger in the order ledgers were first posted
 * to, and within a ledger in FIFO order.
 */
@Value
public class OutstandingReport {
    Company company;
    ReportType reportType;
    LocalDate asOnDate;
    List<OutstandingBill> rows;
    List<LedgerSubtotal> ledgers;
    List<AgeingTotal> ageing;
    List<OnAccountBalance> onAccount;
    BigDecimal totalReceivables;
    BigDecimal totalPayables;
    BigDecimal totalAdvances;
    List<DataIssue> issues;

    public int getCount() {
        return rows.size();
    }

    public int getLedgerCount() {
        return ledgers.size();
    }
}

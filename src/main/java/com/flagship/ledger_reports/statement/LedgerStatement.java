package com.flagship.ledger_reports.statement;

import com.flagship.ledger_reports.directory.Company;
import com.flagship.ledger_reports.directory.Ledger;
import com.flagship.ledger_reports.exception.DataIssue;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Running-balance statement of one ledger over a period.
 *
 * Invariant: closingBalance = openingBalance + totalDebit - totalCredit, all
 * signed debit positive.
 */
@Value
public class LedgerStatement {
    Company company;
    Ledger ledger;
    LocalDate from;
    LocalDate to;
    BigDecimal openingBalance;
    BigDecimal totalDebit;
    BigDecimal totalCredit;
    BigDecimal closingBalance;
    List<LedgerStatementRow> rows;
    List<DataIssue> issues;

    public BigDecimal getNetMovement() {
        return totalDebit.subtract(totalCredit);
    }
}

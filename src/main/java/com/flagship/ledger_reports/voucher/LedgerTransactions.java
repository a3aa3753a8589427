package com.flagship.ledger_reports.voucher;

import com.flagship.ledger_reports.directory.Company;
import com.flagship.ledger_reports.directory.Ledger;
import com.flagship.ledger_reports.exception.DataIssue;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Everything the statement needs for one ledger and period: the vouchers
 * dated within [from, to] in chronological order and the signed opening
 * balance as of {@code from}.
 */
@Value
public class LedgerTransactions {
    Company company;
    Ledger ledger;
    LocalDate from;
    LocalDate to;
    BigDecimal openingBalance;
    List<Voucher> vouchers;
    List<DataIssue> issues;
}

package com.flagship.ledger_reports.voucher;

import com.flagship.ledger_reports.directory.Company;
import com.flagship.ledger_reports.exception.DataIssue;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Postings of every bill-wise ledger up to the as-on date. Ledgers appear in
 * the order their first posting was made.
 */
@Value
public class BillWiseTransactions {
    Company company;
    LocalDate asOnDate;
    List<LedgerPostings> ledgers;
    List<DataIssue> issues;
}

package com.flagship.ledger_reports.voucher;

import com.flagship.ledger_reports.directory.Ledger;
import lombok.Value;

import java.util.List;

/**
 * The postings of one ledger, chronological.
 */
@Value
public class LedgerPostings {
    Ledger ledger;
    List<Posting> postings;
}

package com.flagship.ledger_reports.outstanding;

import com.flagship.ledger_reports.directory.Ledger;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Classified open bills of one ledger, in FIFO order, plus its signed
 * on-account amount.
 */
@Value
public class LedgerOutstanding {
    Ledger ledger;
    List<OutstandingBill> bills;
    BigDecimal onAccount;
}

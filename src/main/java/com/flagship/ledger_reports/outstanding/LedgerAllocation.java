package com.flagship.ledger_reports.outstanding;

import com.flagship.ledger_reports.directory.Ledger;
import com.flagship.ledger_reports.exception.DataIssue;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of allocating one ledger's settlements against its bills.
 *
 * {@code bills} is in FIFO order (bill date, then creation order) and includes
 * fully settled bills. {@code onAccount} is the signed amount that neither
 * raised a bill nor found one to settle.
 */
@Value
public class LedgerAllocation {
    Ledger ledger;
    List<BillPosition> bills;
    BigDecimal onAccount;
    List<DataIssue> issues;

    public List<BillPosition> getOpenBills() {
        return bills.stream().filter(BillPosition::isOpen).toList();
    }
}

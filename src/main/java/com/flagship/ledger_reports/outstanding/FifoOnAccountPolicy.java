package com.flagship.ledger_reports.outstanding;

import com.flagship.ledger_reports.directory.Ledger;
import com.flagship.ledger_reports.voucher.Posting;

/**
 * Every unreferenced settlement is applied to the oldest open bills.
 */
public class FifoOnAccountPolicy implements UnreferencedSettlementPolicy {

    public static final String NAME = "fifo-on-account";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean settlesOpenBills(Ledger ledger, Posting settlement, boolean ledgerSettlesByReference) {
        return true;
    }
}

package com.flagship.ledger_reports.outstanding;

import com.flagship.ledger_reports.directory.Ledger;
import com.flagship.ledger_reports.voucher.Posting;

/**
 * FIFO for ledgers that never settle by reference. On ledgers that do, an
 * unreferenced leg is a deliberate on-account entry and is left alone.
 */
public class FifoUnlessReferencedPolicy implements UnreferencedSettlementPolicy {

    public static final String NAME = "fifo-unless-referenced";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean settlesOpenBills(Ledger ledger, Posting settlement, boolean ledgerSettlesByReference) {
        return !ledgerSettlesByReference;
    }
}

package com.flagship.ledger_reports.outstanding;

import com.flagship.ledger_reports.directory.Ledger;
import com.flagship.ledger_reports.voucher.Posting;

/**
 * Only explicit references settle bills; everything else stays on account.
 */
public class OnAccountOnlyPolicy implements UnreferencedSettlementPolicy {

    public static final String NAME = "on-account-only";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean settlesOpenBills(Ledger ledger, Posting settlement, boolean ledgerSettlesByReference) {
        return false;
    }
}

package com.flagship.ledger_reports.outstanding;

import com.flagship.ledger_reports.directory.Ledger;
import com.flagship.ledger_reports.voucher.Posting;

/**
 * Decides whether a leg without a bill reference settles open bills (in FIFO
 * order) or stays on account.
 *
 * Kept apart from {@link BillAllocationEngine} so the choice can change
 * without touching the FIFO walk.
 */
public interface UnreferencedSettlementPolicy {

    /**
     * Name used in configuration ({@code reports.settlement-policy}).
     */
    String name();

    /**
     * @param ledger the ledger being allocated
     * @param settlement an unreferenced leg on the side opposite to at least one open bill
     * @param ledgerSettlesByReference whether any leg of this ledger settles a bill by naming it
     * @return true to consume open bills in FIFO order, false to leave the amount on account
     */
    boolean settlesOpenBills(Ledger ledger, Posting settlement, boolean ledgerSettlesByReference);
}

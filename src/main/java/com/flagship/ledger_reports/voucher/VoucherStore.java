package com.flagship.ledger_reports.voucher;

import com.flagship.ledger_reports.directory.Company;
import com.flagship.ledger_reports.directory.Ledger;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the transactional store filled by the import job.
 *
 * Each call is one consistent read: it returns the complete row set or fails
 * with a {@link com.flagship.ledger_reports.exception.StorageException}.
 */
public interface VoucherStore {

    List<Company> findCompanies();

    Optional<Company> findCompany(String companyGuid);

    List<Ledger> findLedgers(String companyGuid);

    /**
     * Case-insensitive, trimmed match on the ledger name.
     */
    Optional<Ledger> findLedger(String companyGuid, String ledgerName);

    /**
     * Every leg of every voucher that touches the ledger, in insertion order.
     */
    List<LegRow> findLegsForLedger(String companyGuid, String ledgerName);

    /**
     * Every leg posted to a party ledger or to a ledger that carries bill
     * references anywhere in its history, in insertion order.
     */
    List<LegRow> findBillWiseLegs(String companyGuid);
}

package com.flagship.ledger_reports.voucher;

import com.flagship.ledger_reports.directory.Company;
import com.flagship.ledger_reports.directory.Ledger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link VoucherStore} backed by lists, with the same selection rules as
 * {@link JdbcVoucherStore}.
 */
public class InMemoryVoucherStore implements VoucherStore {

    private final Map<String, Company> companies = new LinkedHashMap<>();
    private final List<Ledger> ledgers = new ArrayList<>();
    private final List<LegRow> rows = new ArrayList<>();

    public InMemoryVoucherStore addCompany(Company company) {
        companies.put(company.getGuid(), company);
        return this;
    }

    public InMemoryVoucherStore addLedger(Ledger ledger) {
        ledgers.add(ledger);
        return this;
    }

    public InMemoryVoucherStore addRows(LegRow... legRows) {
        rows.addAll(List.of(legRows));
        return this;
    }

    @Override
    public List<Company> findCompanies() {
        return companies.values().stream()
            .sorted(Comparator.comparing(Company::getName))
            .toList();
    }

    @Override
    public Optional<Company> findCompany(String companyGuid) {
        return Optional.ofNullable(companies.get(companyGuid));
    }

    @Override
    public List<Ledger> findLedgers(String companyGuid) {
        return ledgers.stream()
            .filter(l -> l.getCompanyGuid().equals(companyGuid))
            .sorted(Comparator.comparing(Ledger::getName))
            .toList();
    }

    @Override
    public Optional<Ledger> findLedger(String companyGuid, String ledgerName) {
        return findLedgers(companyGuid).stream()
            .filter(l -> l.isNamed(ledgerName))
            .findFirst();
    }

    @Override
    public List<LegRow> findLegsForLedger(String companyGuid, String ledgerName) {
        Set<String> voucherKeys = companyRows(companyGuid).stream()
            .filter(r -> Ledger.sameName(r.getLedgerName(), ledgerName))
            .map(InMemoryVoucherStore::voucherKey)
            .collect(Collectors.toSet());
        return companyRows(companyGuid).stream()
            .filter(r -> voucherKeys.contains(voucherKey(r)))
            .toList();
    }

    private static String voucherKey(LegRow row) {
        if (row.getVoucherId() != null && !row.getVoucherId().isBlank()) {
            return row.getVoucherId().trim();
        }
        String number = row.getVoucherNumber() == null ? "" : row.getVoucherNumber().trim();
        return (row.getVoucherDate() == null ? "" : row.getVoucherDate()) + "|" + number;
    }

    @Override
    public List<LegRow> findBillWiseLegs(String companyGuid) {
        Set<String> billWise = companyRows(companyGuid).stream()
            .filter(r -> r.getBillRef() != null && !r.getBillRef().isBlank())
            .map(r -> Ledger.normalizeName(r.getLedgerName()))
            .collect(Collectors.toSet());
        findLedgers(companyGuid).stream()
            .filter(l -> l.getNature().isParty())
            .forEach(l -> billWise.add(Ledger.normalizeName(l.getName())));
        return companyRows(companyGuid).stream()
            .filter(r -> billWise.contains(Ledger.normalizeName(r.getLedgerName())))
            .toList();
    }

    private List<LegRow> companyRows(String companyGuid) {
        return rows.stream()
            .filter(r -> companyGuid.equals(r.getCompanyGuid()))
            .sorted(Comparator.comparingLong(LegRow::getId))
            .toList();
    }
}

package com.flagship.ledger_reports.voucher;

import com.flagship.ledger_reports.directory.Company;
import com.flagship.ledger_reports.directory.Ledger;
import com.flagship.ledger_reports.exception.DataIssue;
import com.flagship.ledger_reports.exception.InvalidRangeException;
import com.flagship.ledger_reports.exception.NotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Reads raw legs from the {@link VoucherStore} and turns them into normalized
 * vouchers and postings.
 *
 * Problems found in the data (unparseable dates or amounts, unbalanced
 * vouchers) are collected as {@link DataIssue}s rather than thrown, so the
 * report service can apply the configured policy.
 *
 * Each load runs in one repeatable-read transaction so the company, ledger
 * masters and legs come from the same snapshot even while an import commits.
 */
@Service
@Slf4j
public class TransactionLoader {

    private final VoucherStore voucherStore;

    public TransactionLoader(VoucherStore voucherStore) {
        this.voucherStore = voucherStore;
    }

    /**
     * Loads the vouchers touching a ledger within [from, to] and the ledger's
     * opening balance as of {@code from}.
     *
     * @throws InvalidRangeException if from is after to
     * @throws NotFoundException if the company or the ledger is unknown
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public LedgerTransactions loadLedger(String companyGuid, String ledgerName, LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw new InvalidRangeException(
                String.format("From date %s is after to date %s", from, to),
                rangeContext(companyGuid, ledgerName, from, to));
        }

        Company company = requireCompany(companyGuid);
        List<LegRow> rows = voucherStore.findLegsForLedger(companyGuid, ledgerName);
        Ledger ledger = voucherStore.findLedger(companyGuid, ledgerName)
            .orElseGet(() -> unregisteredLedger(companyGuid, ledgerName, rows));

        List<DataIssue> issues = new ArrayList<>();
        List<Voucher> vouchers = assemble(normalize(rows, issues));

        BigDecimal openingBalance = ledger.getOpeningBalance();
        List<Voucher> inRange = new ArrayList<>();
        for (Voucher voucher : vouchers) {
            if (voucher.getDate().isAfter(to)) {
                continue;
            }
            if (!voucher.isBalanced()) {
                issues.add(new DataIssue(DataIssue.Type.UNBALANCED_VOUCHER, voucher.getId(),
                    "Voucher " + voucher.getVoucherNumber() + " is out of balance by " + voucher.imbalance()));
            }
            if (voucher.getDate().isBefore(from)) {
                openingBalance = openingBalance.add(voucher.amountFor(ledger.getName()));
            } else {
                inRange.add(voucher);
            }
        }

        log.debug("Loaded ledger transactions: ledger={}, vouchers={}, issues={}",
            ledger.getName(), inRange.size(), issues.size());
        return new LedgerTransactions(company, ledger, from, to, openingBalance, List.copyOf(inRange),
            List.copyOf(issues));
    }

    /**
     * Loads the postings of every bill-wise ledger dated on or before the
     * as-on date, optionally restricted to one ledger.
     *
     * @throws NotFoundException if the company, or the requested ledger, is unknown
     * @throws InvalidRangeException if the as-on date precedes all data of the company
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public BillWiseTransactions loadBillWise(String companyGuid, LocalDate asOnDate, String ledgerFilter) {
        Company company = requireCompany(companyGuid);
        List<LegRow> rows = voucherStore.findBillWiseLegs(companyGuid);
        Map<String, Ledger> registered = voucherStore.findLedgers(companyGuid).stream()
            .collect(Collectors.toMap(l -> Ledger.normalizeName(l.getName()), Function.identity(),
                (first, duplicate) -> first, LinkedHashMap::new));

        List<DataIssue> issues = new ArrayList<>();
        List<Posting> postings = normalize(rows, issues);

        postings.stream()
            .map(Posting::getDate)
            .min(LocalDate::compareTo)
            .filter(asOnDate::isBefore)
            .ifPresent(earliest -> {
                Map<String, String> context = new LinkedHashMap<>();
                context.put("company_id", companyGuid);
                context.put("as_on_date", asOnDate.toString());
                context.put("earliest_date", earliest.toString());
                throw new InvalidRangeException(
                    String.format("As-on date %s precedes the first transaction dated %s", asOnDate, earliest),
                    context);
            });

        if (ledgerFilter != null) {
            postings = postings.stream()
                .filter(p -> p.getLeg().isAgainst(ledgerFilter))
                .toList();
            if (postings.isEmpty() && !registered.containsKey(Ledger.normalizeName(ledgerFilter))) {
                throw NotFoundException.ledger(companyGuid, ledgerFilter);
            }
        }

        Map<String, List<Posting>> byLedger = new LinkedHashMap<>();
        postings.stream()
            .filter(p -> !p.getDate().isAfter(asOnDate))
            .sorted(Posting.CHRONOLOGICAL)
            .forEach(p -> byLedger
                .computeIfAbsent(Ledger.normalizeName(p.getLeg().getLedgerName()), key -> new ArrayList<>())
                .add(p));

        List<LedgerPostings> ledgers = new ArrayList<>();
        byLedger.forEach((key, ledgerPostings) -> {
            Ledger ledger = registered.get(key);
            if (ledger == null) {
                ledger = Ledger.unregistered(companyGuid, ledgerPostings.get(0).getLeg().getLedgerName());
            }
            ledgers.add(new LedgerPostings(ledger, List.copyOf(ledgerPostings)));
        });

        log.debug("Loaded bill-wise postings: company={}, ledgers={}, issues={}",
            companyGuid, ledgers.size(), issues.size());
        return new BillWiseTransactions(company, asOnDate, List.copyOf(ledgers), List.copyOf(issues));
    }

    private Company requireCompany(String companyGuid) {
        return voucherStore.findCompany(companyGuid)
            .orElseThrow(() -> NotFoundException.company(companyGuid));
    }

    private static Ledger unregisteredLedger(String companyGuid, String ledgerName, List<LegRow> rows) {
        return rows.stream()
            .map(LegRow::getLedgerName)
            .filter(name -> Ledger.sameName(name, ledgerName))
            .findFirst()
            .map(name -> Ledger.unregistered(companyGuid, name))
            .orElseThrow(() -> NotFoundException.ledger(companyGuid, ledgerName));
    }

    /**
     * Rows whose date or amount cannot be read are dropped and reported.
     */
    List<Posting> normalize(List<LegRow> rows, List<DataIssue> issues) {
        List<Posting> postings = new ArrayList<>(rows.size());
        for (LegRow row : rows) {
            String legRef = "leg:" + row.getId();
            LocalDate date;
            try {
                date = SourceDates.parse(row.getVoucherDate());
            } catch (IllegalArgumentException e) {
                issues.add(new DataIssue(DataIssue.Type.UNPARSEABLE_DATE, legRef, e.getMessage()));
                continue;
            }
            if (date == null) {
                issues.add(new DataIssue(DataIssue.Type.UNPARSEABLE_DATE, legRef, "Voucher date is missing"));
                continue;
            }

            BigDecimal amount;
            try {
                amount = SourceAmounts.signedAmount(row);
            } catch (IllegalArgumentException e) {
                issues.add(new DataIssue(DataIssue.Type.UNPARSEABLE_AMOUNT, legRef, e.getMessage()));
                continue;
            }

            Leg leg = new Leg(
                row.getId(),
                row.getLedgerName() == null ? "" : row.getLedgerName().trim(),
                amount,
                blankToNull(row.getBillRef()),
                blankToNull(row.getBillType()),
                optionalDate(row.getBillDate(), legRef, issues),
                optionalDate(row.getDueDate(), legRef, issues),
                row.getCreditPeriodDays()
            );
            postings.add(new Posting(
                voucherKey(row),
                row.getAlterId(),
                date,
                blankToEmpty(row.getVoucherType()),
                blankToEmpty(row.getVoucherNumber()),
                blankToNull(row.getNarration()),
                leg
            ));
        }
        return postings;
    }

    /**
     * Groups postings into vouchers, keeping leg insertion order, and sorts
     * the vouchers chronologically.
     */
    List<Voucher> assemble(List<Posting> postings) {
        Map<String, List<Posting>> byVoucher = new LinkedHashMap<>();
        for (Posting posting : postings) {
            byVoucher.computeIfAbsent(posting.getVoucherId(), key -> new ArrayList<>()).add(posting);
        }
        return byVoucher.values().stream()
            .map(TransactionLoader::toVoucher)
            .sorted(Voucher.CHRONOLOGICAL)
            .toList();
    }

    private static Voucher toVoucher(List<Posting> postings) {
        Posting header = postings.get(0);
        Long alterId = postings.stream()
            .map(Posting::getAlterId)
            .filter(id -> id != null)
            .findFirst()
            .orElse(null);
        String narration = postings.stream()
            .map(Posting::getNarration)
            .filter(text -> text != null)
            .findFirst()
            .orElse(null);
        return new Voucher(
            header.getVoucherId(),
            header.getDate(),
            alterId,
            header.getVoucherType(),
            header.getVoucherNumber(),
            narration,
            postings.stream().map(Posting::getLeg).toList()
        );
    }

    /**
     * The master id identifies a voucher; older imports left it blank, in which
     * case date and number together stand in for it.
     */
    private static String voucherKey(LegRow row) {
        if (row.getVoucherId() != null && !row.getVoucherId().isBlank()) {
            return row.getVoucherId().trim();
        }
        return row.getVoucherDate() + "|" + blankToEmpty(row.getVoucherNumber());
    }

    private static LocalDate optionalDate(String raw, String legRef, List<DataIssue> issues) {
        try {
            return SourceDates.parse(raw);
        } catch (IllegalArgumentException e) {
            issues.add(new DataIssue(DataIssue.Type.UNPARSEABLE_DATE, legRef, e.getMessage()));
            return null;
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static String blankToEmpty(String value) {
        return value == null ? "" : value.trim();
    }

    private static Map<String, String> rangeContext(String companyGuid, String ledgerName,
                                                    LocalDate from, LocalDate to) {
        Map<String, String> context = new LinkedHashMap<>();
        context.put("company_id", companyGuid);
        context.put("ledger_name", ledgerName);
        context.put("from_date", from.toString());
        context.put("to_date", to.toString());
        return context;
    }
}

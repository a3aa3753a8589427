package com.flagship.ledger_reports.outstanding;

import com.flagship.ledger_reports.common.Side;
import com.flagship.ledger_reports.directory.Ledger;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Works out due date, overdue days and receivable/payable for an open bill.
 * Receivable and payable depend on the ledger's nature as well as the bill's
 * side; bills on ledgers that are neither debtor-like nor creditor-like are
 * neither.
 *
 * Due date: the bill's own due date, else bill date + credit period, where the
 * credit period comes from the bill, then the ledger, then the configured
 * default.
 */
public class AgeingClassifier {

    private final int defaultCreditPeriodDays;

    public AgeingClassifier(int defaultCreditPeriodDays) {
        if (defaultCreditPeriodDays < 0) {
            throw new IllegalArgumentException("Default credit period cannot be negative");
        }
        this.defaultCreditPeriodDays = defaultCreditPeriodDays;
    }

    public OutstandingBill classify(BillPosition position, Ledger ledger, LocalDate asOnDate) {
        Bill bill = position.getBill();
        LocalDate dueDate = dueDate(bill, ledger);
        long overdueDays = overdueDays(dueDate, asOnDate);

        return new OutstandingBill(
            ledger.getName(),
            bill.getBillRef(),
            bill.getBillDate(),
            bill.getBillType(),
            bill.getVoucherType(),
            bill.getVoucherNumber(),
            bill.getOriginalAmount(),
            position.getOutstanding(),
            bill.getSide(),
            ledger.getNature().isDebtorLike() && bill.getSide() == Side.DR,
            ledger.getNature().isCreditorLike() && bill.getSide() == Side.CR,
            isAdvance(bill, ledger),
            dueDate,
            overdueDays,
            AgeingBucket.of(overdueDays),
            null
        );
    }

    LocalDate dueDate(Bill bill, Ledger ledger) {
        if (bill.getDueDate() != null) {
            return bill.getDueDate();
        }
        Integer creditDays = bill.getCreditPeriodDays() != null
            ? bill.getCreditPeriodDays()
            : ledger.getCreditPeriodDays();
        return bill.getBillDate().plusDays(creditDays != null ? creditDays : defaultCreditPeriodDays);
    }

    static long overdueDays(LocalDate dueDate, LocalDate asOnDate) {
        return asOnDate.isAfter(dueDate) ? ChronoUnit.DAYS.between(dueDate, asOnDate) : 0;
    }

    /**
     * A debit bill on a creditor (or a credit bill on a debtor) is money paid
     * or received ahead of the invoice.
     */
    private static boolean isAdvance(Bill bill, Ledger ledger) {
        if (ledger.getNature().isDebtorLike()) {
            return bill.getSide() == Side.CR;
        }
        if (ledger.getNature().isCreditorLike()) {
            return bill.getSide() == Side.DR;
        }
        return false;
    }
}

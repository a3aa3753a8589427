package com.flagship.ledger_reports.statement;

import com.flagship.ledger_reports.directory.Ledger;
import com.flagship.ledger_reports.voucher.LedgerTransactions;
import com.flagship.ledger_reports.voucher.Leg;
import com.flagship.ledger_reports.voucher.Voucher;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Folds vouchers into a running balance.
 *
 * Core invariants:
 * 1. One row per voucher, ordered by date, then alteration id, then voucher id
 * 2. A row never shows both a debit and a credit
 * 3. Closing balance = opening + total debit - total credit, in exact decimals
 */
@Component
public class RunningBalanceCalculator {

    private final CounterParticularsResolver particularsResolver;

    public RunningBalanceCalculator(CounterParticularsResolver particularsResolver) {
        this.particularsResolver = particularsResolver;
    }

    public LedgerStatement calculate(LedgerTransactions transactions) {
        Ledger ledger = transactions.getLedger();
        List<Voucher> vouchers = new ArrayList<>(transactions.getVouchers());
        vouchers.sort(Voucher.CHRONOLOGICAL);

        BigDecimal running = transactions.getOpeningBalance();
        BigDecimal totalDebit = BigDecimal.ZERO;
        BigDecimal totalCredit = BigDecimal.ZERO;
        List<LedgerStatementRow> rows = new ArrayList<>(vouchers.size());

        for (Voucher voucher : vouchers) {
            BigDecimal[] debitCredit = debitAndCredit(voucher, ledger.getName());
            BigDecimal debit = debitCredit[0];
            BigDecimal credit = debitCredit[1];

            running = running.add(debit).subtract(credit);
            totalDebit = totalDebit.add(debit);
            totalCredit = totalCredit.add(credit);

            rows.add(new LedgerStatementRow(
                voucher.getId(),
                voucher.getDate(),
                particularsResolver.resolve(voucher, ledger.getName()),
                voucher.getVoucherType(),
                voucher.getVoucherNumber(),
                voucher.getNarration(),
                debit,
                credit,
                running
            ));
        }

        BigDecimal closing = transactions.getOpeningBalance().add(totalDebit).subtract(totalCredit);
        if (closing.compareTo(running) != 0) {
            throw new IllegalStateException(String.format(
                "Running balance %s disagrees with closing balance %s for ledger %s", running, closing,
                ledger.getName()));
        }

        return new LedgerStatement(
            transactions.getCompany(),
            ledger,
            transactions.getFrom(),
            transactions.getTo(),
            transactions.getOpeningBalance(),
            totalDebit,
            totalCredit,
            closing,
            List.copyOf(rows),
            transactions.getIssues()
        );
    }

    /**
     * Sums the voucher's debit and credit legs against the ledger. When both
     * sides are present they are netted so the row shows one side only.
     */
    static BigDecimal[] debitAndCredit(Voucher voucher, String ledgerName) {
        BigDecimal debit = BigDecimal.ZERO;
        BigDecimal credit = BigDecimal.ZERO;
        for (Leg leg : voucher.getLegs()) {
            if (!leg.isAgainst(ledgerName)) {
                continue;
            }
            if (leg.isDebit()) {
                debit = debit.add(leg.getAmount());
            } else if (leg.isCredit()) {
                credit = credit.add(leg.getAmount().negate());
            }
        }
        if (debit.signum() != 0 && credit.signum() != 0) {
            BigDecimal net = debit.subtract(credit);
            debit = net.signum() > 0 ? net : BigDecimal.ZERO;
            credit = net.signum() < 0 ? net.negate() : BigDecimal.ZERO;
        }
        return new BigDecimal[] {debit, credit};
    }
}

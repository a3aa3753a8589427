package com.flagship.ledger_reports.statement;

import com.flagship.ledger_reports.directory.Ledger;
import com.flagship.ledger_reports.voucher.Leg;
import com.flagship.ledger_reports.voucher.Voucher;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides what to show in the "Particulars" column for a voucher seen from
 * one ledger: the other ledger(s) the voucher was posted against.
 */
@Component
public class CounterParticularsResolver {

    static final String SEPARATOR = ", ";
    static final String UNKNOWN = "Others";

    /**
     * Counter ledgers are listed once each, in leg order, skipping the
     * reported ledger and zero-amount legs. A voucher with no such leg (a
     * self-contra or rounding entry) shows its voucher type instead.
     */
    public String resolve(Voucher voucher, String reportedLedger) {
        Map<String, String> counterLedgers = new LinkedHashMap<>();
        for (Leg leg : voucher.getLegs()) {
            if (leg.isZero() || leg.isAgainst(reportedLedger) || leg.getLedgerName().isBlank()) {
                continue;
            }
            counterLedgers.putIfAbsent(Ledger.normalizeName(leg.getLedgerName()), leg.getLedgerName());
        }

        if (counterLedgers.isEmpty()) {
            return fallback(voucher);
        }
        List<String> names = new ArrayList<>(counterLedgers.values());
        return String.join(SEPARATOR, names);
    }

    private static String fallback(Voucher voucher) {
        if (!voucher.getVoucherType().isBlank()) {
            return voucher.getVoucherType();
        }
        return voucher.getNarration() != null ? voucher.getNarration() : UNKNOWN;
    }
}

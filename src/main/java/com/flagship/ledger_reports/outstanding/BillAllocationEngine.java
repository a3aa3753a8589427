package com.flagship.ledger_reports.outstanding;

import com.flagship.ledger_reports.common.Side;
import com.flagship.ledger_reports.directory.Ledger;
import com.flagship.ledger_reports.exception.DataIssue;
import com.flagship.ledger_reports.voucher.LedgerPostings;
import com.flagship.ledger_reports.voucher.Leg;
import com.flagship.ledger_reports.voucher.Posting;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Matches a ledger's settling legs against its bills, oldest bill first.
 *
 * The walk:
 * 1. The first leg naming a reference raises the bill (an "Agst Ref" leg only
 *    does so when nothing else ever raises that reference)
 * 2. Bills are queued by bill date, then by the position of the raising leg
 * 3. Same-side legs naming a bill add to it
 * 4. Legs naming a bill settle that bill, in chronological order
 * 5. Unreferenced legs are then walked chronologically. They go through the
 *    {@link UnreferencedSettlementPolicy} and, when allowed, consume what the
 *    named settlements left open on bills of the opposite side, in queue
 *    order, spanning as many bills as needed
 * 6. Whatever is left over is kept on account
 *
 * Named settlements take precedence, so an unreferenced receipt never takes
 * away the room a later named settlement needs. Allocations never exceed a
 * bill's amount: named settlements exceeding it are reported as a
 * {@link DataIssue} and the excess goes on account.
 */
@Component
@Slf4j
public class BillAllocationEngine {

    static final String AGAINST_REFERENCE = "AGST REF";
    static final String NEW_REFERENCE = "New Ref";

    private static final Comparator<OpenBill> FIFO = Comparator
        .comparing((OpenBill b) -> b.billDate)
        .thenComparingLong(b -> b.sequence);

    private final UnreferencedSettlementPolicy settlementPolicy;

    public BillAllocationEngine(UnreferencedSettlementPolicy settlementPolicy) {
        this.settlementPolicy = settlementPolicy;
    }

    public UnreferencedSettlementPolicy getSettlementPolicy() {
        return settlementPolicy;
    }

    /**
     * Allocates every posting of the ledger dated on or before the as-on date.
     */
    public LedgerAllocation allocate(LedgerPostings ledgerPostings, LocalDate asOnDate) {
        Ledger ledger = ledgerPostings.getLedger();
        List<Posting> postings = ledgerPostings.getPostings().stream()
            .filter(p -> !p.getDate().isAfter(asOnDate))
            .filter(p -> !p.getLeg().isZero())
            .sorted(Posting.CHRONOLOGICAL)
            .toList();

        Map<String, Posting> originators = findOriginators(postings);
        Map<Posting, Boolean> isOriginator = new IdentityHashMap<>();
        originators.values().forEach(p -> isOriginator.put(p, Boolean.TRUE));

        Map<String, OpenBill> bills = new HashMap<>();
        for (int i = 0; i < postings.size(); i++) {
            Posting posting = postings.get(i);
            if (isOriginator.containsKey(posting)) {
                bills.put(referenceKey(posting.getLeg()), new OpenBill(ledger, posting, i));
            }
        }

        List<Integer> named = new ArrayList<>();
        List<Integer> unreferenced = new ArrayList<>();
        for (int i = 0; i < postings.size(); i++) {
            Posting posting = postings.get(i);
            if (isOriginator.containsKey(posting)) {
                continue;
            }
            Leg leg = posting.getLeg();
            if (!leg.hasBillRef()) {
                unreferenced.add(i);
                continue;
            }
            OpenBill bill = bills.get(referenceKey(leg));
            if (Side.of(leg.getAmount(), Side.DR) == bill.side) {
                bill.raise(leg.getAmount().abs());
            } else {
                named.add(i);
            }
        }

        List<OpenBill> queue = new ArrayList<>(bills.values());
        queue.sort(FIFO);

        boolean settlesByReference = !named.isEmpty();
        BigDecimal onAccount = BigDecimal.ZERO;
        List<DataIssue> issues = new ArrayList<>();

        for (int index : named) {
            Posting settlement = postings.get(index);
            Leg leg = settlement.getLeg();
            Side side = Side.of(leg.getAmount(), Side.DR);
            BigDecimal amount = leg.getAmount().abs();
            OpenBill bill = bills.get(referenceKey(leg));
            BigDecimal left = bill.remaining;
            BigDecimal excess = amount.subtract(bill.apply(amount, settlement, index, true));
            if (excess.signum() > 0) {
                issues.add(new DataIssue(DataIssue.Type.OVER_ALLOCATED_BILL,
                    "bill:" + bill.billRef,
                    String.format("Voucher %s settles %s against bill %s of %s which had %s left",
                        settlement.getVoucherNumber(), amount, bill.billRef, bill.original, left)));
                onAccount = onAccount.add(signed(excess, side));
            }
        }

        for (int index : unreferenced) {
            Posting settlement = postings.get(index);
            Leg leg = settlement.getLeg();
            Side side = Side.of(leg.getAmount(), Side.DR);
            BigDecimal amount = leg.getAmount().abs();

            boolean anyOpposite = queue.stream().anyMatch(b -> b.isOpen() && b.side == side.opposite());
            if (!anyOpposite || !settlementPolicy.settlesOpenBills(ledger, settlement, settlesByReference)) {
                onAccount = onAccount.add(leg.getAmount());
                continue;
            }

            BigDecimal unapplied = amount;
            for (OpenBill bill : queue) {
                if (unapplied.signum() == 0) {
                    break;
                }
                if (bill.side != side.opposite() || !bill.isOpen()) {
                    continue;
                }
                unapplied = unapplied.subtract(bill.apply(unapplied, settlement, index, false));
            }
            if (unapplied.signum() > 0) {
                onAccount = onAccount.add(signed(unapplied, side));
            }
        }

        List<BillPosition> positions = queue.stream().map(OpenBill::toPosition).toList();
        log.debug("Allocated ledger bills: ledger={}, bills={}, open={}, onAccount={}, policy={}",
            ledger.getName(), positions.size(), positions.stream().filter(BillPosition::isOpen).count(),
            onAccount, settlementPolicy.name());
        return new LedgerAllocation(ledger, positions, onAccount, List.copyOf(issues));
    }

    /**
     * For each reference, the first leg that is not an "Agst Ref"; failing
     * that, the first leg naming it.
     */
    private static Map<String, Posting> findOriginators(List<Posting> postings) {
        Map<String, Posting> originators = new HashMap<>();
        Map<String, Posting> firstSeen = new HashMap<>();
        for (Posting posting : postings) {
            Leg leg = posting.getLeg();
            if (!leg.hasBillRef()) {
                continue;
            }
            String key = referenceKey(leg);
            firstSeen.putIfAbsent(key, posting);
            if (!isAgainstReference(leg)) {
                originators.putIfAbsent(key, posting);
            }
        }
        firstSeen.forEach(originators::putIfAbsent);
        return originators;
    }

    static boolean isAgainstReference(Leg leg) {
        return leg.getBillType() != null
            && leg.getBillType().trim().toUpperCase(Locale.ROOT).replace(".", "").startsWith(AGAINST_REFERENCE);
    }

    private static String referenceKey(Leg leg) {
        return leg.getBillRef().trim().toUpperCase(Locale.ROOT);
    }

    private static BigDecimal signed(BigDecimal amount, Side side) {
        return side == Side.DR ? amount : amount.negate();
    }

    /**
     * Mutable tracker for one bill while the walk runs.
     */
    private static final class OpenBill {
        private final Ledger ledger;
        private final Posting origin;
        private final String billRef;
        private final LocalDate billDate;
        private final Side side;
        private final long sequence;
        private final List<Slice> slices = new ArrayList<>();
        private BigDecimal original;
        private BigDecimal remaining;

        OpenBill(Ledger ledger, Posting origin, long sequence) {
            Leg leg = origin.getLeg();
            this.ledger = ledger;
            this.origin = origin;
            this.billRef = leg.getBillRef().trim();
            this.billDate = leg.getBillDate() != null ? leg.getBillDate() : origin.getDate();
            this.side = Side.of(leg.getAmount(), Side.DR);
            this.sequence = sequence;
            this.original = leg.getAmount().abs();
            this.remaining = this.original;
        }

        boolean isOpen() {
            return remaining.signum() > 0;
        }

        void raise(BigDecimal amount) {
            original = original.add(amount);
            remaining = remaining.add(amount);
        }

        /**
         * @param order chronological position of the settling posting
         * @return the part of {@code amount} actually applied to this bill
         */
        BigDecimal apply(BigDecimal amount, Posting settlement, int order, boolean byReference) {
            BigDecimal applied = amount.min(remaining);
            if (applied.signum() == 0) {
                return BigDecimal.ZERO;
            }
            remaining = remaining.subtract(applied);
            slices.add(new Slice(settlement, order, applied, byReference));
            return applied;
        }

        /**
         * Allocation history in date order, whatever order the passes applied it in.
         */
        private List<BillAllocation> allocations() {
            List<Slice> ordered = new ArrayList<>(slices);
            ordered.sort(Comparator.comparingInt(s -> s.order));
            List<BillAllocation> allocations = new ArrayList<>();
            BigDecimal left = original;
            for (Slice slice : ordered) {
                left = left.subtract(slice.amount);
                allocations.add(new BillAllocation(
                    billRef,
                    slice.amount,
                    slice.settlement.getDate(),
                    slice.settlement.getVoucherId(),
                    slice.settlement.getVoucherNumber(),
                    left,
                    slice.byReference
                ));
            }
            return List.copyOf(allocations);
        }

        BillPosition toPosition() {
            Leg leg = origin.getLeg();
            Bill bill = new Bill(
                ledger.getName(),
                billRef,
                leg.getBillType() != null ? leg.getBillType() : NEW_REFERENCE,
                billDate,
                leg.getDueDate(),
                leg.getCreditPeriodDays(),
                origin.getVoucherId(),
                origin.getVoucherType(),
                origin.getVoucherNumber(),
                side,
                original,
                sequence
            );
            return new BillPosition(bill, allocations(), remaining);
        }
    }

    private static final class Slice {
        private final Posting settlement;
        private final int order;
        private final BigDecimal amount;
        private final boolean byReference;

        Slice(Posting settlement, int order, BigDecimal amount, boolean byReference) {
            this.settlement = settlement;
            this.order = order;
            this.amount = amount;
            this.byReference = byReference;
        }
    }
}

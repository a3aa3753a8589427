package com.flagship.ledger_reports.outstanding;

import com.flagship.ledger_reports.common.Side;
import com.flagship.ledger_reports.directory.Ledger;
import com.flagship.ledger_reports.directory.LedgerNature;
import com.flagship.ledger_reports.exception.DataIssue;
import com.flagship.ledger_reports.voucher.LedgerPostings;
import com.flagship.ledger_reports.voucher.Leg;
import com.flagship.ledger_reports.voucher.Posting;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class BillAllocationEngineTest {

    private static final Ledger CUSTOMER =
        new Ledger("C-001", "Customer A", LedgerNature.DEBTOR, BigDecimal.ZERO, 30);
    private static final LocalDate AS_ON = LocalDate.of(2024, 6, 30);

    private final BillAllocationEngine fifo = new BillAllocationEngine(new FifoOnAccountPolicy());

    private long legIds = 1;

    private Posting posting(String date, String amount, String billRef, String billType) {
        long id = legIds++;
        Leg leg = new Leg(id, "Customer A", new BigDecimal(amount), billRef, billType, null, null, null);
        return new Posting("V" + id, id, LocalDate.parse(date), "Journal", "N" + id, null, leg);
    }

    private Posting bill(String date, String amount, String ref) {
        return posting(date, amount, ref, "New Ref");
    }

    private static LedgerPostings postings(Posting... postings) {
        return new LedgerPostings(CUSTOMER, List.of(postings));
    }

    private static Map<String, BigDecimal> outstandingByRef(LedgerAllocation allocation) {
        return allocation.getBills().stream()
            .collect(Collectors.toMap(p -> p.getBill().getBillRef(), BillPosition::getOutstanding));
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual),
            () -> "expected " + expected + " but was " + actual);
    }

    @Test
    @DisplayName("A settlement smaller than the oldest bill reduces only that bill")
    void fifoProperty() {
        // given
        LedgerPostings input = postings(
            bill("2024-04-01", "1000", "B1"),
            bill("2024-04-05", "500", "B2"),
            posting("2024-04-10", "-300", null, null));

        // when
        LedgerAllocation allocation = fifo.allocate(input, AS_ON);

        // then
        Map<String, BigDecimal> outstanding = outstandingByRef(allocation);
        assertAmount("700", outstanding.get("B1"));
        assertAmount("500", outstanding.get("B2"));
        assertAmount("0", allocation.getOnAccount());
        assertTrue(allocation.getIssues().isEmpty());
    }

    @Test
    @DisplayName("A settlement larger than the oldest bill spills into the next one")
    void settlementSpansBills() {
        LedgerPostings input = postings(
            bill("2024-04-01", "1000", "B1"),
            bill("2024-04-05", "500", "B2"),
            posting("2024-04-10", "-1200", null, null));

        LedgerAllocation allocation = fifo.allocate(input, AS_ON);

        assertEquals(List.of("B2"), allocation.getOpenBills().stream()
            .map(p -> p.getBill().getBillRef()).toList());
        assertAmount("300", allocation.getOpenBills().get(0).getOutstanding());
        BillPosition first = allocation.getBills().get(0);
        assertAmount("1000", first.getAllocated());
        assertFalse(first.getAllocations().get(0).isByReference());
    }

    @Test
    @DisplayName("Overpayment beyond every open bill is kept on account")
    void overpaymentGoesOnAccount() {
        LedgerPostings input = postings(
            bill("2024-04-01", "1000", "B1"),
            posting("2024-04-10", "-1500", null, null));

        LedgerAllocation allocation = fifo.allocate(input, AS_ON);

        assertTrue(allocation.getOpenBills().isEmpty());
        assertAmount("-500", allocation.getOnAccount());
    }

    @Test
    @DisplayName("A settlement naming a bill goes to that bill even when an older one is open")
    void explicitReferenceWins() {
        LedgerPostings input = postings(
            bill("2024-04-01", "1000", "B1"),
            bill("2024-04-05", "500", "INV-2"),
            posting("2024-04-20", "-300", "inv-2", "Agst. Ref"));

        LedgerAllocation allocation = fifo.allocate(input, AS_ON);

        Map<String, BigDecimal> outstanding = outstandingByRef(allocation);
        assertAmount("1000", outstanding.get("B1"));
        assertAmount("200", outstanding.get("INV-2"));
        BillAllocation settled = allocation.getBills().get(1).getAllocations().get(0);
        assertTrue(settled.isByReference());
        assertAmount("200", settled.getRemainingAfter());
    }

    @Test
    @DisplayName("Settling a named bill for more than it owes is flagged and the excess kept on account")
    void overAllocationReported() {
        LedgerPostings input = postings(
            bill("2024-04-01", "1000", "INV-1"),
            posting("2024-04-20", "-1500", "INV-1", "Agst Ref"));

        LedgerAllocation allocation = fifo.allocate(input, AS_ON);

        assertEquals(1, allocation.getIssues().size());
        DataIssue issue = allocation.getIssues().get(0);
        assertEquals(DataIssue.Type.OVER_ALLOCATED_BILL, issue.getType());
        assertEquals("bill:INV-1", issue.getReference());
        assertAmount("0", allocation.getBills().get(0).getOutstanding());
        assertAmount("1000", allocation.getBills().get(0).getAllocated());
        assertAmount("-500", allocation.getOnAccount());
    }

    @Test
    @DisplayName("An earlier unreferenced receipt leaves room for a later settlement naming the bill")
    void namedSettlementAfterFifoReceipt() {
        // given
        LedgerPostings input = postings(
            bill("2024-04-01", "1000", "INV-1"),
            bill("2024-04-02", "500", "INV-2"),
            posting("2024-04-03", "-1200", null, null),
            posting("2024-04-10", "-500", "INV-2", "Agst Ref"));

        // when
        LedgerAllocation allocation = fifo.allocate(input, AS_ON);

        // then
        assertTrue(allocation.getIssues().isEmpty());
        assertTrue(allocation.getOpenBills().isEmpty());
        Map<String, BillPosition> byRef = allocation.getBills().stream()
            .collect(Collectors.toMap(p -> p.getBill().getBillRef(), Function.identity()));
        assertAmount("1000", byRef.get("INV-1").getAllocated());
        assertAmount("500", byRef.get("INV-2").getAllocated());
        assertTrue(byRef.get("INV-2").getAllocations().get(0).isByReference());
        assertAmount("-200", allocation.getOnAccount());
    }

    @Test
    @DisplayName("Allocation history reads in date order with the running remainder")
    void allocationHistoryInDateOrder() {
        LedgerPostings input = postings(
            bill("2024-04-01", "1000", "B1"),
            posting("2024-04-03", "-300", null, null),
            posting("2024-04-10", "-200", "B1", "Agst Ref"));

        LedgerAllocation allocation = fifo.allocate(input, AS_ON);

        List<BillAllocation> history = allocation.getBills().get(0).getAllocations();
        assertEquals(2, history.size());
        assertEquals(LocalDate.of(2024, 4, 3), history.get(0).getAllocationDate());
        assertFalse(history.get(0).isByReference());
        assertAmount("700", history.get(0).getRemainingAfter());
        assertEquals(LocalDate.of(2024, 4, 10), history.get(1).getAllocationDate());
        assertTrue(history.get(1).isByReference());
        assertAmount("500", history.get(1).getRemainingAfter());
        assertAmount("500", allocation.getOpenBills().get(0).getOutstanding());
    }

    @Test
    @DisplayName("Bills queue by bill date, not by posting order")
    void queueOrderedByBillDate() {
        long id = legIds++;
        Posting backdated = new Posting("V" + id, id, LocalDate.of(2024, 4, 5), "Sales", "N" + id, null,
            new Leg(id, "Customer A", new BigDecimal("400"), "OLD", "New Ref", LocalDate.of(2024, 3, 1), null, null));
        LedgerPostings input = postings(
            bill("2024-04-01", "1000", "NEW"),
            backdated,
            posting("2024-04-10", "-100", null, null));

        LedgerAllocation allocation = fifo.allocate(input, AS_ON);

        assertEquals("OLD", allocation.getBills().get(0).getBill().getBillRef());
        Map<String, BigDecimal> outstanding = outstandingByRef(allocation);
        assertAmount("300", outstanding.get("OLD"));
        assertAmount("1000", outstanding.get("NEW"));
    }

    @Test
    @DisplayName("Postings after the as-on date are ignored")
    void asOnCutOff() {
        LedgerPostings input = postings(
            bill("2024-04-10", "1000", "INV-1"),
            posting("2024-05-01", "-1000", "INV-1", "Agst Ref"));

        LedgerAllocation before = fifo.allocate(input, LocalDate.of(2024, 4, 30));
        LedgerAllocation after = fifo.allocate(input, LocalDate.of(2024, 5, 2));

        assertEquals(1, before.getOpenBills().size());
        assertAmount("1000", before.getOpenBills().get(0).getOutstanding());
        assertTrue(after.getOpenBills().isEmpty());
    }

    @Test
    @DisplayName("Same-side legs naming a bill add to it; an unknown Agst Ref raises its own bill")
    void billAdjustments() {
        LedgerPostings input = postings(
            bill("2024-04-01", "1000", "INV-1"),
            posting("2024-04-03", "150", "INV-1", "Agst Ref"),
            posting("2024-04-04", "-200", "ADV-9", "Agst Ref"));

        LedgerAllocation allocation = fifo.allocate(input, AS_ON);

        Map<String, BillPosition> byRef = allocation.getBills().stream()
            .collect(Collectors.toMap(p -> p.getBill().getBillRef(), Function.identity()));
        assertAmount("1150", byRef.get("INV-1").getBill().getOriginalAmount());
        assertAmount("1150", byRef.get("INV-1").getOutstanding());
        assertEquals(Side.CR, byRef.get("ADV-9").getBill().getSide());
        assertAmount("200", byRef.get("ADV-9").getOutstanding());
    }

    @Test
    @DisplayName("on-account-only policy never applies unreferenced receipts to bills")
    void onAccountOnlyPolicy() {
        BillAllocationEngine engine = new BillAllocationEngine(new OnAccountOnlyPolicy());
        LedgerPostings input = postings(
            bill("2024-04-01", "1000", "B1"),
            posting("2024-04-10", "-300", null, null));

        LedgerAllocation allocation = engine.allocate(input, AS_ON);

        assertAmount("1000", allocation.getOpenBills().get(0).getOutstanding());
        assertAmount("-300", allocation.getOnAccount());
    }

    @Test
    @DisplayName("fifo-unless-referenced keeps unreferenced receipts on account once a ledger settles by reference")
    void fifoUnlessReferencedPolicy() {
        BillAllocationEngine engine = new BillAllocationEngine(new FifoUnlessReferencedPolicy());
        List<Posting> referenced = new ArrayList<>(List.of(
            bill("2024-04-01", "1000", "B1"),
            bill("2024-04-02", "500", "B2"),
            posting("2024-04-05", "-100", "B2", "Agst Ref"),
            posting("2024-04-10", "-300", null, null)));
        LedgerPostings unreferencedOnly = postings(
            bill("2024-04-01", "1000", "B1"),
            posting("2024-04-10", "-300", null, null));

        LedgerAllocation withRefs = engine.allocate(new LedgerPostings(CUSTOMER, referenced), AS_ON);
        LedgerAllocation withoutRefs = engine.allocate(unreferencedOnly, AS_ON);

        Map<String, BigDecimal> outstanding = outstandingByRef(withRefs);
        assertAmount("1000", outstanding.get("B1"));
        assertAmount("400", outstanding.get("B2"));
        assertAmount("-300", withRefs.getOnAccount());
        assertAmount("700", withoutRefs.getOpenBills().get(0).getOutstanding());
    }

    @Test
    @DisplayName("Allocations never exceed the original amount and outstanding is never negative")
    void allocationBounds() {
        LedgerPostings input = postings(
            bill("2024-04-01", "100", "B1"),
            bill("2024-04-02", "200", "B2"),
            posting("2024-04-03", "-150", null, null),
            posting("2024-04-04", "-150", "B1", "Agst Ref"),
            posting("2024-04-05", "-400", null, null));

        LedgerAllocation allocation = fifo.allocate(input, AS_ON);

        for (BillPosition position : allocation.getBills()) {
            assertTrue(position.getAllocated().compareTo(position.getBill().getOriginalAmount()) <= 0);
            assertTrue(position.getOutstanding().signum() >= 0);
        }
    }
}

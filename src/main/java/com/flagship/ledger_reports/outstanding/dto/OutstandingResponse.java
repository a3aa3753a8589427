package com.flagship.ledger_reports.outstanding.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_reports.common.DrCrAmount;
import com.flagship.ledger_reports.common.Side;
import com.flagship.ledger_reports.exception.DataIssue;
import com.flagship.ledger_reports.outstanding.AgeingBucket;
import com.flagship.ledger_reports.outstanding.AgeingTotal;
import com.flagship.ledger_reports.outstanding.LedgerSubtotal;
import com.flagship.ledger_reports.outstanding.OnAccountBalance;
import com.flagship.ledger_reports.outstanding.OutstandingBill;
import com.flagship.ledger_reports.outstanding.OutstandingReport;
import com.flagship.ledger_reports.outstanding.ReportType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Response DTO for the bill-wise outstanding report.
 */
@Value
@Builder
public class OutstandingResponse {

    @JsonProperty("company_id")
    String companyId;

    @JsonProperty("company_name")
    String companyName;

    @JsonProperty("report_type")
    ReportType reportType;

    @JsonProperty("as_on_date")
    LocalDate asOnDate;

    @JsonProperty("count")
    int count;

    @JsonProperty("ledger_count")
    int ledgerCount;

    @JsonProperty("total_outstanding_receivables")
    BigDecimal totalOutstandingReceivables;

    @JsonProperty("total_outstanding_payables")
    BigDecimal totalOutstandingPayables;

    @JsonProperty("total_advances")
    BigDecimal totalAdvances;

    @JsonProperty("data")
    List<BillRow> data;

    @JsonProperty("ledgers")
    List<LedgerRow> ledgers;

    @JsonProperty("ageing")
    List<AgeingRow> ageing;

    @JsonProperty("on_account")
    List<OnAccountRow> onAccount;

    @JsonProperty("warnings")
    List<DataIssue> warnings;

    public static OutstandingResponse from(OutstandingReport report) {
        return OutstandingResponse.builder()
            .companyId(report.getCompany().getGuid())
            .companyName(report.getCompany().getName())
            .reportType(report.getReportType())
            .asOnDate(report.getAsOnDate())
            .count(report.getCount())
            .ledgerCount(report.getLedgerCount())
            .totalOutstandingReceivables(report.getTotalReceivables())
            .totalOutstandingPayables(report.getTotalPayables())
            .totalAdvances(report.getTotalAdvances())
            .data(report.getRows().stream().map(BillRow::from).toList())
            .ledgers(report.getLedgers().stream().map(LedgerRow::from).toList())
            .ageing(report.getAgeing().stream().map(AgeingRow::from).toList())
            .onAccount(report.getOnAccount().stream().map(OnAccountRow::from).toList())
            .warnings(report.getIssues())
            .build();
    }

    /**
     * One open bill.
     */
    @Value
    @Builder
    public static class BillRow {

        @JsonProperty("ledger_name")
        String ledgerName;

        @JsonProperty("bill_ref")
        String billRef;

        @JsonProperty("bill_date")
        LocalDate billDate;

        @JsonProperty("bill_type")
        String billType;

        @JsonProperty("voucher_type")
        String voucherType;

        @JsonProperty("voucher_no")
        String voucherNo;

        @JsonProperty("original_amount")
        BigDecimal originalAmount;

        @JsonProperty("outstanding_amount")
        BigDecimal outstandingAmount;

        @JsonProperty("outstanding_type")
        Side outstandingType;

        @JsonProperty("balance")
        BigDecimal balance;

        @JsonProperty("balance_type")
        Side balanceType;

        @JsonProperty("is_receivable")
        boolean isReceivable;

        @JsonProperty("is_payable")
        boolean isPayable;

        @JsonProperty("is_advance")
        boolean isAdvance;

        @JsonProperty("due_date")
        LocalDate dueDate;

        @JsonProperty("overdue_days")
        long overdueDays;

        @JsonProperty("ageing_bucket")
        AgeingBucket ageingBucket;

        static BillRow from(OutstandingBill bill) {
            DrCrAmount balance = DrCrAmount.of(bill.getBalance(), bill.getSide());
            return BillRow.builder()
                .ledgerName(bill.getLedgerName())
                .billRef(bill.getBillRef())
                .billDate(bill.getBillDate())
                .billType(bill.getBillType())
                .voucherType(bill.getVoucherType())
                .voucherNo(bill.getVoucherNumber())
                .originalAmount(bill.getOriginalAmount())
                .outstandingAmount(bill.getOutstandingAmount())
                .outstandingType(bill.getSide())
                .balance(balance.getAmount())
                .balanceType(balance.getSide())
                .isReceivable(bill.isReceivable())
                .isPayable(bill.isPayable())
                .isAdvance(bill.isAdvance())
                .dueDate(bill.getDueDate())
                .overdueDays(bill.getOverdueDays())
                .ageingBucket(bill.getBucket())
                .build();
        }
    }

    /**
     * Party-wise subtotal.
     */
    @Value
    @Builder
    public static class LedgerRow {

        @JsonProperty("ledger_name")
        String ledgerName;

        @JsonProperty("receivable")
        BigDecimal receivable;

        @JsonProperty("payable")
        BigDecimal payable;

        @JsonProperty("advance")
        BigDecimal advance;

        @JsonProperty("net_balance")
        BigDecimal netBalance;

        @JsonProperty("net_balance_type")
        Side netBalanceType;

        @JsonProperty("open_bills")
        int openBills;

        @JsonProperty("oldest_bill_date")
        LocalDate oldestBillDate;

        @JsonProperty("on_account")
        BigDecimal onAccount;

        @JsonProperty("on_account_type")
        Side onAccountType;

        static LedgerRow from(LedgerSubtotal subtotal) {
            DrCrAmount net = DrCrAmount.of(subtotal.getNetBalance());
            DrCrAmount onAccount = DrCrAmount.of(subtotal.getOnAccount());
            return LedgerRow.builder()
                .ledgerName(subtotal.getLedgerName())
                .receivable(subtotal.getReceivable())
                .payable(subtotal.getPayable())
                .advance(subtotal.getAdvance())
                .netBalance(net.getAmount())
                .netBalanceType(net.getSide())
                .openBills(subtotal.getOpenBills())
                .oldestBillDate(subtotal.getOldestBillDate())
                .onAccount(onAccount.getAmount())
                .onAccountType(onAccount.getSide())
                .build();
        }
    }

    @Value
    @Builder
    public static class AgeingRow {

        @JsonProperty("bucket")
        AgeingBucket bucket;

        @JsonProperty("receivable")
        BigDecimal receivable;

        @JsonProperty("payable")
        BigDecimal payable;

        static AgeingRow from(AgeingTotal total) {
            return AgeingRow.builder()
                .bucket(total.getBucket())
                .receivable(total.getReceivable())
                .payable(total.getPayable())
                .build();
        }
    }

    @Value
    @Builder
    public static class OnAccountRow {

        @JsonProperty("ledger_name")
        String ledgerName;

        @JsonProperty("amount")
        BigDecimal amount;

        @JsonProperty("amount_type")
        Side amountType;

        static OnAccountRow from(OnAccountBalance balance) {
            DrCrAmount amount = DrCrAmount.of(balance.getAmount());
            return OnAccountRow.builder()
                .ledgerName(balance.getLedgerName())
                .amount(amount.getAmount())
                .amountType(amount.getSide())
                .build();
        }
    }
}

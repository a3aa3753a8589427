package com.flagship.ledger_reports.statement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_reports.common.DrCrAmount;
import com.flagship.ledger_reports.common.Side;
import com.flagship.ledger_reports.exception.DataIssue;
import com.flagship.ledger_reports.statement.LedgerStatement;
import com.flagship.ledger_reports.statement.LedgerStatementRow;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Response DTO for the ledger statement.
 *
 * Balances are unsigned with the Dr/Cr side in a separate field.
 */
@Value
@Builder
public class LedgerStatementResponse {

    @JsonProperty("company_id")
    String companyId;

    @JsonProperty("company_name")
    String companyName;

    @JsonProperty("ledger_name")
    String ledgerName;

    @JsonProperty("from_date")
    LocalDate fromDate;

    @JsonProperty("to_date")
    LocalDate toDate;

    @JsonProperty("opening_balance")
    BigDecimal openingBalance;

    @JsonProperty("opening_balance_type")
    Side openingBalanceType;

    @JsonProperty("total_debit")
    BigDecimal totalDebit;

    @JsonProperty("total_credit")
    BigDecimal totalCredit;

    @JsonProperty("net_movement")
    BigDecimal netMovement;

    @JsonProperty("closing_balance")
    BigDecimal closingBalance;

    @JsonProperty("closing_balance_type")
    Side closingBalanceType;

    @JsonProperty("total_transactions")
    int totalTransactions;

    @JsonProperty("transactions")
    List<TransactionRow> transactions;

    @JsonProperty("warnings")
    List<DataIssue> warnings;

    public static LedgerStatementResponse from(LedgerStatement statement) {
        Side naturalSide = statement.getLedger().getNature().getNaturalSide();
        DrCrAmount opening = DrCrAmount.of(statement.getOpeningBalance(), naturalSide);
        DrCrAmount closing = DrCrAmount.of(statement.getClosingBalance(), naturalSide);

        return LedgerStatementResponse.builder()
            .companyId(statement.getCompany().getGuid())
            .companyName(statement.getCompany().getName())
            .ledgerName(statement.getLedger().getName())
            .fromDate(statement.getFrom())
            .toDate(statement.getTo())
            .openingBalance(opening.getAmount())
            .openingBalanceType(opening.getSide())
            .totalDebit(statement.getTotalDebit())
            .totalCredit(statement.getTotalCredit())
            .netMovement(statement.getNetMovement())
            .closingBalance(closing.getAmount())
            .closingBalanceType(closing.getSide())
            .totalTransactions(statement.getRows().size())
            .transactions(statement.getRows().stream()
                .map(row -> TransactionRow.from(row, naturalSide))
                .toList())
            .warnings(statement.getIssues())
            .build();
    }

    /**
     * One voucher line of the statement.
     */
    @Value
    @Builder
    public static class TransactionRow {

        @JsonProperty("voucher_id")
        String voucherId;

        @JsonProperty("date")
        LocalDate date;

        @JsonProperty("particulars")
        String particulars;

        @JsonProperty("voucher_type")
        String voucherType;

        @JsonProperty("voucher_number")
        String voucherNumber;

        @JsonProperty("narration")
        String narration;

        @JsonProperty("debit")
        BigDecimal debit;

        @JsonProperty("credit")
        BigDecimal credit;

        @JsonProperty("balance")
        BigDecimal balance;

        @JsonProperty("balance_type")
        Side balanceType;

        static TransactionRow from(LedgerStatementRow row, Side naturalSide) {
            DrCrAmount balance = DrCrAmount.of(row.getBalance(), naturalSide);
            return TransactionRow.builder()
                .voucherId(row.getVoucherId())
                .date(row.getDate())
                .particulars(row.getParticulars())
                .voucherType(row.getVoucherType())
                .voucherNumber(row.getVoucherNumber())
                .narration(row.getNarration())
                .debit(row.getDebit())
                .credit(row.getCredit())
                .balance(balance.getAmount())
                .balanceType(balance.getSide())
                .build();
        }
    }
}

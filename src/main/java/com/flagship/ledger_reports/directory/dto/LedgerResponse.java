package com.flagship.ledger_reports.directory.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_reports.common.DrCrAmount;
import com.flagship.ledger_reports.common.Side;
import com.flagship.ledger_reports.directory.Ledger;
import com.flagship.ledger_reports.directory.LedgerNature;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Ledger master entry with its opening balance split into amount and side.
 */
@Value
@Builder
public class LedgerResponse {

    @JsonProperty("ledger_name")
    String ledgerName;

    @JsonProperty("nature")
    LedgerNature nature;

    @JsonProperty("opening_balance")
    BigDecimal openingBalance;

    @JsonProperty("opening_balance_type")
    Side openingBalanceType;

    @JsonProperty("credit_period_days")
    Integer creditPeriodDays;

    public static LedgerResponse from(Ledger ledger) {
        DrCrAmount opening = DrCrAmount.of(ledger.getOpeningBalance(), ledger.getNature().getNaturalSide());
        return LedgerResponse.builder()
            .ledgerName(ledger.getName())
            .nature(ledger.getNature())
            .openingBalance(opening.getAmount())
            .openingBalanceType(opening.getSide())
            .creditPeriodDays(ledger.getCreditPeriodDays())
            .build();
    }
}

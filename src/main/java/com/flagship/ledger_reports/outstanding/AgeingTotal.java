package com.flagship.ledger_reports.outstanding;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class AgeingTotal {
    AgeingBucket bucket;
    BigDecimal receivable;
    BigDecimal payable;
}

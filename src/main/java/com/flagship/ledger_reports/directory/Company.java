package com.flagship.ledger_reports.directory;

import lombok.Value;

/**
 * A company imported from the source accounting package.
 * {@code guid} is the identifier every report request is scoped by.
 */
@Value
public class Company {
    String guid;
    String alterId;
    String name;
}

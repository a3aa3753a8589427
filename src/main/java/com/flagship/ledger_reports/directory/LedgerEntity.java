package com.flagship.ledger_reports.directory;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;

/**
 * JPA Entity for the ledger master, read-only.
 */
@Entity
@Immutable
@Table(
    name = "ledgers",
    indexes = @Index(name = "idx_ledgers_company", columnList = "company_guid")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LedgerEntity {

    @Id
    private Long id;

    @Column(name = "company_guid", nullable = false)
    private String companyGuid;

    @Column(nullable = false)
    private String name;

    @Column(name = "parent_group")
    private String parentGroup;

    @Column
    private String nature;

    @Column(name = "opening_balance", precision = 19, scale = 4)
    private BigDecimal openingBalance;

    @Column(name = "credit_period_days")
    private Integer creditPeriodDays;

    /**
     * The explicit nature wins; the parent group is the fallback because the
     * import does not always fill the nature column.
     */
    public Ledger toDomain() {
        LedgerNature resolved = LedgerNature.fromStorage(nature);
        if (resolved == LedgerNature.UNCLASSIFIED) {
            resolved = LedgerNature.fromStorage(parentGroup);
        }
        return new Ledger(
            companyGuid,
            name.trim(),
            resolved,
            openingBalance != null ? openingBalance : BigDecimal.ZERO,
            creditPeriodDays
        );
    }
}

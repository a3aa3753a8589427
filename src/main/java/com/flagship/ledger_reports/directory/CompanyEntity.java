package com.flagship.ledger_reports.directory;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * JPA Entity for the companies master.
 *
 * Rows are written by the import job; this service only reads them, hence
 * {@link Immutable} and no factory.
 */
@Entity
@Immutable
@Table(name = "companies")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CompanyEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private String guid;

    @Column(name = "alterid")
    private String alterId;

    @Column(nullable = false)
    private String name;

    @Column(name = "created_at")
    private Instant createdAt;

    public Company toDomain() {
        return new Company(guid, alterId, name);
    }
}

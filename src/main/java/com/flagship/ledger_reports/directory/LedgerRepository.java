package com.flagship.ledger_reports.directory;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for the ledger master.
 */
@Repository
public interface LedgerRepository extends JpaRepository<LedgerEntity, Long> {

    /**
     * Ledger names are matched trimmed and case-insensitively, as the source
     * system does.
     */
    @Query("SELECT l FROM LedgerEntity l WHERE l.companyGuid = :companyGuid " +
           "AND UPPER(TRIM(l.name)) = UPPER(TRIM(:name))")
    Optional<LedgerEntity> findByCompanyAndName(@Param("companyGuid") String companyGuid,
                                                @Param("name") String name);

    List<LedgerEntity> findByCompanyGuidOrderByNameAsc(String companyGuid);
}

package com.flagship.ledger_reports.directory;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for the companies master.
 */
@Repository
public interface CompanyRepository extends JpaRepository<CompanyEntity, String> {

    List<CompanyEntity> findAllByOrderByNameAsc();
}

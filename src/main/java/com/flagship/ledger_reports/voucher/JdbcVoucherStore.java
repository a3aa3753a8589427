package com.flagship.ledger_reports.voucher;

import com.flagship.ledger_reports.directory.Company;
import com.flagship.ledger_reports.directory.CompanyEntity;
import com.flagship.ledger_reports.directory.CompanyRepository;
import com.flagship.ledger_reports.directory.Ledger;
import com.flagship.ledger_reports.directory.LedgerEntity;
import com.flagship.ledger_reports.directory.LedgerRepository;
import com.flagship.ledger_reports.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link VoucherStore} over the PostgreSQL tables filled by the import job.
 *
 * Masters (companies, ledgers) are read through JPA; voucher legs through
 * plain JDBC because they are only ever projected, never managed.
 */
@Repository
@Slf4j
public class JdbcVoucherStore implements VoucherStore {

    private static final String LEG_COLUMNS =
        "v.id, v.company_guid, v.voucher_id, v.alter_id, v.voucher_date, v.voucher_type, v.voucher_number, " +
        "v.ledger_name, v.debit_amount, v.credit_amount, v.ledger_amount, v.dr_cr, v.bill_ref, v.bill_type, " +
        "v.bill_date, v.due_date, v.credit_period_days, v.narration";

    // legacy rows without a voucher id are grouped by date and number
    private static final String VOUCHER_KEY =
        "COALESCE(NULLIF(TRIM(%1$s.voucher_id), ''), " +
        "COALESCE(%1$s.voucher_date, '') || '|' || COALESCE(TRIM(%1$s.voucher_number), ''))";

    private static final String LEGS_FOR_LEDGER =
        "SELECT " + LEG_COLUMNS + " FROM voucher_legs v " +
        "WHERE v.company_guid = ? AND " + String.format(VOUCHER_KEY, "v") + " IN (" +
        "  SELECT " + String.format(VOUCHER_KEY, "t") + " FROM voucher_legs t " +
        "  WHERE t.company_guid = ? AND UPPER(TRIM(t.ledger_name)) = UPPER(TRIM(?))) " +
        "ORDER BY v.id";

    private static final String BILL_WISE_LEGS =
        "SELECT " + LEG_COLUMNS + " FROM voucher_legs v " +
        "WHERE v.company_guid = ? AND UPPER(TRIM(v.ledger_name)) IN (" +
        "  SELECT UPPER(TRIM(b.ledger_name)) FROM voucher_legs b " +
        "  WHERE b.company_guid = ? AND b.bill_ref IS NOT NULL AND TRIM(b.bill_ref) <> '' " +
        "  UNION " +
        "  SELECT UPPER(TRIM(l.name)) FROM ledgers l " +
        "  WHERE l.company_guid = ? AND l.nature IN ('DEBTOR', 'CREDITOR')) " +
        "ORDER BY v.id";

    private final JdbcTemplate jdbcTemplate;
    private final CompanyRepository companyRepository;
    private final LedgerRepository ledgerRepository;

    public JdbcVoucherStore(JdbcTemplate jdbcTemplate,
                            CompanyRepository companyRepository,
                            LedgerRepository ledgerRepository) {
        this.jdbcTemplate = jdbcTemplate;
        this.companyRepository = companyRepository;
        this.ledgerRepository = ledgerRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Company> findCompanies() {
        return read(Map.of(), () -> companyRepository.findAllByOrderByNameAsc().stream()
            .map(CompanyEntity::toDomain)
            .toList());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Company> findCompany(String companyGuid) {
        return read(context(companyGuid, null), () -> companyRepository.findById(companyGuid)
            .map(CompanyEntity::toDomain));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Ledger> findLedgers(String companyGuid) {
        return read(context(companyGuid, null), () -> ledgerRepository.findByCompanyGuidOrderByNameAsc(companyGuid)
            .stream()
            .map(LedgerEntity::toDomain)
            .toList());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Ledger> findLedger(String companyGuid, String ledgerName) {
        return read(context(companyGuid, ledgerName), () -> ledgerRepository.findByCompanyAndName(companyGuid, ledgerName)
            .map(LedgerEntity::toDomain));
    }

    @Override
    @Transactional(readOnly = true)
    public List<LegRow> findLegsForLedger(String companyGuid, String ledgerName) {
        return read(context(companyGuid, ledgerName), () -> jdbcTemplate.query(
            LEGS_FOR_LEDGER, legRowMapper(), companyGuid, companyGuid, ledgerName));
    }

    @Override
    @Transactional(readOnly = true)
    public List<LegRow> findBillWiseLegs(String companyGuid) {
        return read(context(companyGuid, null), () -> jdbcTemplate.query(
            BILL_WISE_LEGS, legRowMapper(), companyGuid, companyGuid, companyGuid));
    }

    private <T> T read(Map<String, String> context, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            log.error("Voucher store read failed: context={}, error={}", context, e.getMessage());
            throw new StorageException("Voucher store read failed: " + e.getMostSpecificCause().getMessage(),
                context, e);
        }
    }

    private static Map<String, String> context(String companyGuid, String ledgerName) {
        Map<String, String> context = new LinkedHashMap<>();
        context.put("company_id", companyGuid);
        if (ledgerName != null) {
            context.put("ledger_name", ledgerName);
        }
        return context;
    }

    private RowMapper<LegRow> legRowMapper() {
        return (rs, rowNum) -> LegRow.builder()
            .id(rs.getLong("id"))
            .companyGuid(rs.getString("company_guid"))
            .voucherId(rs.getString("voucher_id"))
            .alterId(nullableLong(rs, "alter_id"))
            .voucherDate(rs.getString("voucher_date"))
            .voucherType(rs.getString("voucher_type"))
            .voucherNumber(rs.getString("voucher_number"))
            .ledgerName(rs.getString("ledger_name"))
            .debitAmount(rs.getBigDecimal("debit_amount"))
            .creditAmount(rs.getBigDecimal("credit_amount"))
            .ledgerAmount(rs.getBigDecimal("ledger_amount"))
            .drCr(rs.getString("dr_cr"))
            .billRef(rs.getString("bill_ref"))
            .billType(rs.getString("bill_type"))
            .billDate(rs.getString("bill_date"))
            .dueDate(rs.getString("due_date"))
            .creditPeriodDays(nullableInt(rs, "credit_period_days"))
            .narration(rs.getString("narration"))
            .build();
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }
}

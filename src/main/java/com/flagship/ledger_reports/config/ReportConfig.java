package com.flagship.ledger_reports.config;

import com.flagship.ledger_reports.exception.InconsistencyPolicy;
import com.flagship.ledger_reports.outstanding.AgeingClassifier;
import com.flagship.ledger_reports.outstanding.FifoOnAccountPolicy;
import com.flagship.ledger_reports.outstanding.FifoUnlessReferencedPolicy;
import com.flagship.ledger_reports.outstanding.OnAccountOnlyPolicy;
import com.flagship.ledger_reports.outstanding.UnreferencedSettlementPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Locale;

/**
 * Report policies, all switchable from {@code application.yml}:
 * - reports.inconsistency-policy: fail | report
 * - reports.settlement-policy: fifo-on-account | fifo-unless-referenced | on-account-only
 * - reports.default-credit-period-days: used when neither bill nor ledger has one
 */
@Configuration
@Slf4j
public class ReportConfig {

    @Value("${reports.inconsistency-policy:fail}")
    private String inconsistencyPolicy;

    @Value("${reports.settlement-policy:" + FifoOnAccountPolicy.NAME + "}")
    private String settlementPolicy;

    @Value("${reports.default-credit-period-days:0}")
    private int defaultCreditPeriodDays;

    @Bean
    public InconsistencyPolicy inconsistencyPolicy() {
        InconsistencyPolicy policy = InconsistencyPolicy.fromProperty(inconsistencyPolicy);
        log.info("Inconsistent data policy: {}", policy);
        return policy;
    }

    @Bean
    public UnreferencedSettlementPolicy unreferencedSettlementPolicy() {
        UnreferencedSettlementPolicy policy = switch (settlementPolicy.trim().toLowerCase(Locale.ROOT)) {
            case FifoOnAccountPolicy.NAME -> new FifoOnAccountPolicy();
            case FifoUnlessReferencedPolicy.NAME -> new FifoUnlessReferencedPolicy();
            case OnAccountOnlyPolicy.NAME -> new OnAccountOnlyPolicy();
            default -> throw new IllegalArgumentException(
                "Unknown reports.settlement-policy: " + settlementPolicy);
        };
        log.info("Unreferenced settlement policy: {}", policy.name());
        return policy;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public AgeingClassifier ageingClassifier() {
        return new AgeingClassifier(defaultCreditPeriodDays);
    }
}

package com.flagship.ledger_reports.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer metrics for report generation.
 *
 * Metrics exposed:
 * - reports.generated: reports completed, by report and outcome
 * - reports.failed: failures, by report and error kind
 * - reports.latency: generation time, by report
 * - reports.rows: rows emitted per report (distribution)
 * - reports.data_issues: inconsistencies found in imported data
 */
@Component
public class ReportMetrics {

    private final MeterRegistry registry;

    public ReportMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordGenerated(String report, String outcome, int rows) {
        registry.counter("reports.generated",
                "report", sanitizeTag(report),
                "outcome", sanitizeTag(outcome)
        ).increment();
        registry.summary("reports.rows", "report", sanitizeTag(report)).record(rows);
    }

    public void recordFailure(String report, String errorKind) {
        registry.counter("reports.failed",
                "report", sanitizeTag(report),
                "kind", sanitizeTag(errorKind)
        ).increment();
    }

    public void recordLatency(String report, long durationMs) {
        registry.timer("reports.latency",
                "report", sanitizeTag(report)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordDataIssues(String report, int count) {
        if (count > 0) {
            registry.counter("reports.data_issues", "report", sanitizeTag(report)).increment(count);
        }
    }

    /**
     * Keeps tag values short and free of special characters.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}

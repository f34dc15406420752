package com.xammer.s3baseline.service;

import com.xammer.s3baseline.domain.Dimension;
import com.xammer.s3baseline.domain.DimensionStatus;
import com.xammer.s3baseline.dto.BucketOutcome;
import com.xammer.s3baseline.dto.DimensionResult;
import com.xammer.s3baseline.dto.RunReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link RunReport} as per-bucket lines followed by a summary.
 */
@Component
@Slf4j
public class BaselineReporter {

    private static final String RULE = "=".repeat(80);

    public void report(RunReport report) {
        render(report).forEach(log::info);
    }

    public List<String> render(RunReport report) {
        List<String> lines = new ArrayList<>();
        lines.add(RULE);
        lines.add(report.isDryRun() ? "Baseline report (DRY RUN)" : "Baseline report");
        lines.add(RULE);

        for (BucketOutcome outcome : report.getOutcomes()) {
            lines.add(String.format("%s: %s", outcome.getBucketName(), stateLabel(outcome.getState())));
            for (Dimension dimension : Dimension.values()) {
                DimensionResult result = outcome.get(dimension);
                String line = String.format("  - %s: %s", dimension.getLabel(), statusLabel(result.getStatus()));
                if (result.getError() != null) {
                    line += " (" + result.getError() + ")";
                }
                lines.add(line);
            }
        }

        lines.add(RULE);
        lines.add("Summary");
        lines.add(RULE);
        lines.add(String.format("Buckets processed: %d", report.getTotal()));
        lines.add(String.format("  success: %d, partial failure: %d, failure: %d",
                report.count(BucketOutcome.State.SUCCESS),
                report.count(BucketOutcome.State.PARTIAL_FAILURE),
                report.count(BucketOutcome.State.FAILURE)));

        for (Dimension dimension : Dimension.values()) {
            Map<DimensionStatus, Integer> counts = report.countsFor(dimension);
            lines.add("");
            lines.add("[" + dimension.getLabel() + "]");
            int skipped = counts.get(DimensionStatus.SKIPPED);
            if (skipped > 0) {
                lines.add(String.format("  - skipped:      %3d buckets", skipped));
                continue;
            }
            lines.add(String.format("  applied:        %3d buckets", counts.get(DimensionStatus.APPLIED)));
            lines.add(String.format("  needs change:   %3d buckets", counts.get(DimensionStatus.NEEDS_CHANGE)));
            lines.add(String.format("  not applied:    %3d buckets", counts.get(DimensionStatus.NOT_APPLIED)));
            if (counts.get(DimensionStatus.ERROR) > 0) {
                lines.add(String.format("  error:          %3d buckets", counts.get(DimensionStatus.ERROR)));
            }
        }
        lines.add(RULE);
        return lines;
    }

    private String stateLabel(BucketOutcome.State state) {
        switch (state) {
            case SUCCESS:
                return "OK";
            case PARTIAL_FAILURE:
                return "PARTIAL FAILURE";
            default:
                return "FAILED";
        }
    }

    private String statusLabel(DimensionStatus status) {
        switch (status) {
            case APPLIED:
                return "applied";
            case NEEDS_CHANGE:
                return "needs change";
            case NOT_APPLIED:
                return "not applied";
            case SKIPPED:
                return "skipped";
            default:
                return "error";
        }
    }
}

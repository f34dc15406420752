package com.xammer.s3baseline.dto;

import com.xammer.s3baseline.domain.Dimension;
import com.xammer.s3baseline.domain.DimensionStatus;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcomes of one run in worklist order, with per-dimension status counts.
 */
@Getter
public class RunReport {

    private final boolean dryRun;
    private final List<BucketOutcome> outcomes;

    public RunReport(boolean dryRun, List<BucketOutcome> outcomes) {
        this.dryRun = dryRun;
        this.outcomes = Collections.unmodifiableList(new ArrayList<>(outcomes));
    }

    public int getTotal() {
        return outcomes.size();
    }

    public Map<DimensionStatus, Integer> countsFor(Dimension dimension) {
        Map<DimensionStatus, Integer> counts = new EnumMap<>(DimensionStatus.class);
        for (DimensionStatus status : DimensionStatus.values()) {
            counts.put(status, 0);
        }
        for (BucketOutcome outcome : outcomes) {
            counts.merge(outcome.get(dimension).getStatus(), 1, Integer::sum);
        }
        return counts;
    }

    public int count(BucketOutcome.State state) {
        return (int) outcomes.stream().filter(o -> o.getState() == state).count();
    }

    public boolean hasFailures() {
        return outcomes.stream().anyMatch(o -> o.getState() != BucketOutcome.State.SUCCESS);
    }
}

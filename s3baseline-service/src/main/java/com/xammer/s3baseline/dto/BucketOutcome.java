package com.xammer.s3baseline.dto;

import com.xammer.s3baseline.domain.Dimension;
import com.xammer.s3baseline.domain.DimensionStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.stream.Stream;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BucketOutcome {

    public enum State {
        SUCCESS,
        PARTIAL_FAILURE,
        FAILURE
    }

    private String bucketName;
    private DimensionResult policy;
    private DimensionResult logging;

    public DimensionResult get(Dimension dimension) {
        return dimension == Dimension.POLICY ? policy : logging;
    }

    /**
     * SUCCESS when every processed dimension ends APPLIED, FAILURE when every processed
     * dimension errored, PARTIAL_FAILURE otherwise. Skipped dimensions do not count.
     */
    public State getState() {
        long processed = processed().count();
        if (processed == 0 || processed().allMatch(r -> r.getStatus() == DimensionStatus.APPLIED)) {
            return State.SUCCESS;
        }
        if (processed().allMatch(r -> r.getStatus() == DimensionStatus.ERROR)) {
            return State.FAILURE;
        }
        return State.PARTIAL_FAILURE;
    }

    private Stream<DimensionResult> processed() {
        return Stream.of(policy, logging).filter(r -> !r.isSkipped());
    }
}

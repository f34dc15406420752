package com.xammer.s3baseline.dto;

import com.xammer.s3baseline.domain.Classification;
import com.xammer.s3baseline.domain.DimensionStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DimensionResult {

    private Classification observed;  // null when skipped or unreadable
    private DimensionStatus status;
    private boolean written;
    private String error;

    public static DimensionResult skipped() {
        return new DimensionResult(null, DimensionStatus.SKIPPED, false, null);
    }

    public static DimensionResult unchanged(Classification observed) {
        return new DimensionResult(observed, DimensionStatus.of(observed), false, null);
    }

    public static DimensionResult written(Classification observed, Classification after) {
        return new DimensionResult(observed, DimensionStatus.of(after), true, null);
    }

    public static DimensionResult failed(Classification observed, String error) {
        return new DimensionResult(observed, DimensionStatus.ERROR, false, error);
    }

    public boolean isSkipped() {
        return status == DimensionStatus.SKIPPED;
    }
}

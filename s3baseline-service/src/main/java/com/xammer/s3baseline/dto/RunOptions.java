package com.xammer.s3baseline.dto;

import com.xammer.s3baseline.domain.Dimension;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Mode flags for one run. Dry-run unless {@code apply} is set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunOptions {

    private boolean apply;
    private String bucket;
    @Builder.Default
    private Set<String> excludedBuckets = new LinkedHashSet<>();
    private boolean showPolicy;
    private boolean showLogging;
    private boolean policyOnly;
    private boolean loggingOnly;

    public boolean isDryRun() {
        return !apply;
    }

    public boolean isEnabled(Dimension dimension) {
        return dimension == Dimension.POLICY ? !loggingOnly : !policyOnly;
    }
}

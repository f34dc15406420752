package com.xammer.s3baseline.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Server access logging target of a bucket. A {@code null} config, or one without a
 * target bucket, means logging is disabled.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoggingConfig {

    @JsonProperty("TargetBucket")
    private String targetBucket;

    @JsonProperty("TargetPrefix")
    private String targetPrefix;

    @JsonIgnore
    public boolean isEnabled() {
        return targetBucket != null && !targetBucket.isEmpty();
    }
}

package com.xammer.s3baseline.service;

import com.xammer.s3baseline.domain.BaselineContext;
import com.xammer.s3baseline.domain.Classification;
import com.xammer.s3baseline.domain.LoggingConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LoggingClassifierTest {

    private final BaselineContext context = BaselineContext.forAccount("123");
    private final LoggingClassifier classifier = new LoggingClassifier();
    private final LoggingMerger merger = new LoggingMerger();

    @Test
    void disabledLoggingIsNotApplied() {
        assertThat(classifier.classify(null, context)).isEqualTo(Classification.NOT_APPLIED);
        assertThat(classifier.classify(new LoggingConfig(null, "logs/"), context)).isEqualTo(Classification.NOT_APPLIED);
    }

    @Test
    void otherDestinationNeedsChange() {
        LoggingConfig current = new LoggingConfig("other-bucket", "AWSLogs/123/S3/");

        assertThat(classifier.classify(current, context)).isEqualTo(Classification.NEEDS_CHANGE);
    }

    @Test
    void wrongPrefixNeedsChange() {
        LoggingConfig current = new LoggingConfig("access-logs-123", "");

        assertThat(classifier.classify(current, context)).isEqualTo(Classification.NEEDS_CHANGE);
    }

    @Test
    void canonicalTargetIsApplied() {
        LoggingConfig current = new LoggingConfig("access-logs-123", "AWSLogs/123/S3/");

        assertThat(classifier.classify(current, context)).isEqualTo(Classification.APPLIED);
    }

    @Test
    void mergerProposesCanonicalTargetUnlessApplied() {
        assertThat(merger.desired(Classification.APPLIED, context)).isEmpty();
        assertThat(merger.desired(Classification.NEEDS_CHANGE, context))
                .contains(new LoggingConfig("access-logs-123", "AWSLogs/123/S3/"));
        assertThat(merger.desired(Classification.NOT_APPLIED, context))
                .hasValueSatisfying(config -> assertThat(classifier.classify(config, context))
                        .isEqualTo(Classification.APPLIED));
    }
}

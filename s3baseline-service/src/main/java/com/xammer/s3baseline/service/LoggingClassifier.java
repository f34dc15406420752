package com.xammer.s3baseline.service;

import com.xammer.s3baseline.domain.BaselineContext;
import com.xammer.s3baseline.domain.Classification;
import com.xammer.s3baseline.domain.LoggingConfig;
import org.springframework.stereotype.Component;

import java.util.Objects;

@Component
public class LoggingClassifier {

    public Classification classify(LoggingConfig current, BaselineContext context) {
        if (current == null || !current.isEnabled()) {
            return Classification.NOT_APPLIED;
        }
        boolean sameTarget = Objects.equals(current.getTargetBucket(), context.getLogSinkName());
        boolean samePrefix = Objects.equals(current.getTargetPrefix(), context.getLogPrefix());
        return sameTarget && samePrefix ? Classification.APPLIED : Classification.NEEDS_CHANGE;
    }
}

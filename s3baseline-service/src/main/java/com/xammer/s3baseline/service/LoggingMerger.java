package com.xammer.s3baseline.service;

import com.xammer.s3baseline.domain.BaselineContext;
import com.xammer.s3baseline.domain.Classification;
import com.xammer.s3baseline.domain.LoggingConfig;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * A bucket has a single logging target, so the desired config is always the canonical
 * one. Empty when nothing needs to be written.
 */
@Component
public class LoggingMerger {

    public Optional<LoggingConfig> desired(Classification classification, BaselineContext context) {
        if (classification == Classification.APPLIED) {
            return Optional.empty();
        }
        return Optional.of(context.canonicalLogging());
    }
}

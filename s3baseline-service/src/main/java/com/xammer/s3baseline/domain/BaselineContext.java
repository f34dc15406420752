package com.xammer.s3baseline.domain;

import lombok.Getter;

/**
 * Account-scoped names every component of a run agrees on. Built once from the caller
 * identity and handed to each component explicitly.
 */
@Getter
public final class BaselineContext {

    private static final String LOG_SINK_PREFIX = "access-logs-";

    private final String accountId;
    private final String logSinkName;
    private final String logPrefix;

    private BaselineContext(String accountId) {
        this.accountId = accountId;
        this.logSinkName = LOG_SINK_PREFIX + accountId;
        this.logPrefix = String.format("AWSLogs/%s/S3/", accountId);
    }

    public static BaselineContext forAccount(String accountId) {
        if (accountId == null || accountId.isBlank()) {
            throw new IllegalArgumentException("Account id must not be blank");
        }
        return new BaselineContext(accountId);
    }

    public LoggingConfig canonicalLogging() {
        return new LoggingConfig(logSinkName, logPrefix);
    }

    public static String bucketArn(String bucketName) {
        return "arn:aws:s3:::" + bucketName;
    }

    public static String objectsArn(String bucketName) {
        return bucketArn(bucketName) + "/*";
    }
}

package com.xammer.s3baseline.service;

import com.xammer.s3baseline.domain.LoggingConfig;
import com.xammer.s3baseline.domain.PolicyDocument;

import java.util.List;

/**
 * Bucket operations the reconciler relies on. Read failures surface as
 * {@link com.xammer.s3baseline.exception.BucketReadException}, write failures as
 * {@link com.xammer.s3baseline.exception.BucketWriteException}.
 */
public interface BucketStore {

    /**
     * @throws com.xammer.s3baseline.exception.BucketListUnavailableException when listing fails
     */
    List<String> listBuckets();

    boolean bucketExists(String bucketName);

    /**
     * Creates the bucket with every public access block setting turned on.
     */
    void createBucket(String bucketName);

    /**
     * @return the attached policy, or {@code null} when the bucket has none
     */
    PolicyDocument getPolicy(String bucketName);

    /**
     * Replaces the whole bucket policy with {@code policy}.
     */
    void putPolicy(String bucketName, PolicyDocument policy);

    /**
     * @return the logging target, or {@code null} when logging is disabled
     */
    LoggingConfig getLogging(String bucketName);

    void putLogging(String bucketName, LoggingConfig logging);
}

package com.xammer.s3baseline.exception;

/**
 * Read or write failure against a single bucket. Recorded against that bucket and the
 * run moves on.
 */
public class BucketAccessException extends BaselineException {

    private final String bucketName;

    public BucketAccessException(String bucketName, String message, Throwable cause) {
        super(message, cause);
        this.bucketName = bucketName;
    }

    public String getBucketName() {
        return bucketName;
    }
}

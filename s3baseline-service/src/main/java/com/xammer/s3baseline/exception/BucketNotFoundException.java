package com.xammer.s3baseline.exception;

/**
 * The bucket requested with {@code --bucket} is not eligible: it does not exist, is
 * excluded, or is the log sink.
 */
public class BucketNotFoundException extends BaselineAbortException {

    private final String bucketName;

    public BucketNotFoundException(String bucketName, String reason) {
        super("Bucket " + bucketName + " cannot be processed: " + reason);
        this.bucketName = bucketName;
    }

    public String getBucketName() {
        return bucketName;
    }
}

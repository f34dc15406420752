package com.xammer.s3baseline.exception;

public class BucketListUnavailableException extends BaselineAbortException {

    public BucketListUnavailableException(Throwable cause) {
        super("Could not list S3 buckets: " + cause.getMessage(), cause);
    }
}

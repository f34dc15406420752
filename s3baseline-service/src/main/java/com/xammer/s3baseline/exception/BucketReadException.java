package com.xammer.s3baseline.exception;

public class BucketReadException extends BucketAccessException {

    public BucketReadException(String bucketName, String operation, Throwable cause) {
        super(bucketName, operation + " failed for bucket " + bucketName + ": " + cause.getMessage(), cause);
    }
}

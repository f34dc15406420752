package com.xammer.s3baseline.exception;

public class BucketWriteException extends BucketAccessException {

    public BucketWriteException(String bucketName, String operation, Throwable cause) {
        super(bucketName, operation + " failed for bucket " + bucketName + ": " + cause.getMessage(), cause);
    }
}

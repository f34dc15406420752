package com.xammer.s3baseline.exception;

public class IdentityUnavailableException extends BaselineAbortException {

    public IdentityUnavailableException(Throwable cause) {
        super("Could not determine the AWS account id: " + cause.getMessage(), cause);
    }
}

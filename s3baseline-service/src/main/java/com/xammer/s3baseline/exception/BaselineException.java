package com.xammer.s3baseline.exception;

/**
 * Root of every failure raised by the baseline run.
 */
public class BaselineException extends RuntimeException {

    public BaselineException(String message) {
        super(message);
    }

    public BaselineException(String message, Throwable cause) {
        super(message, cause);
    }
}

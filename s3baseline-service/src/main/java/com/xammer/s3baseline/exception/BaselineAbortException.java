package com.xammer.s3baseline.exception;

/**
 * Failure that stops the run before any bucket is processed.
 */
public class BaselineAbortException extends BaselineException {

    public BaselineAbortException(String message) {
        super(message);
    }

    public BaselineAbortException(String message, Throwable cause) {
        super(message, cause);
    }
}

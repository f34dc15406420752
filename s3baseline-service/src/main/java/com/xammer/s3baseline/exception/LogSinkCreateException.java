package com.xammer.s3baseline.exception;

public class LogSinkCreateException extends BaselineAbortException {

    private final String logSinkName;

    public LogSinkCreateException(String logSinkName, Throwable cause) {
        this(logSinkName, "Could not prepare log sink bucket " + logSinkName + ": " + cause.getMessage(), cause);
    }

    public LogSinkCreateException(String logSinkName, String message, Throwable cause) {
        super(message, cause);
        this.logSinkName = logSinkName;
    }

    public String getLogSinkName() {
        return logSinkName;
    }
}

package com.example.playout.exception;

public class ScheduleFillException extends RuntimeException {

    private final String errorCode;
    private final Object[] parameters;

    public ScheduleFillException(String message) {
        super(message);
        this.errorCode = "SCHEDULE_FILL_ERROR";
        this.parameters = new Object[0];
    }

    public ScheduleFillException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "SCHEDULE_FILL_ERROR";
        this.parameters = new Object[0];
    }

    public ScheduleFillException(String errorCode, String message, Object... parameters) {
        super(message);
        this.errorCode = errorCode;
        this.parameters = parameters;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Object[] getParameters() {
        return parameters;
    }
}

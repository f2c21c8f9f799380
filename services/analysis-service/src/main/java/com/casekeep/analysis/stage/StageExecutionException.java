package com.casekeep.analysis.stage;

public abstract class StageExecutionException extends RuntimeException {

    protected StageExecutionException(String message) {
        super(message);
    }

    protected StageExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}

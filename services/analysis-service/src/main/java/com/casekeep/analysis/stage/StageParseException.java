package com.casekeep.analysis.stage;

public class StageParseException extends StageExecutionException {

    public StageParseException(String message) {
        super(message);
    }

    public StageParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

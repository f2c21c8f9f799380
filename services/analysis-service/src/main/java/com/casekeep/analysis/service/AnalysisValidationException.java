package com.casekeep.analysis.service;

public class AnalysisValidationException extends IllegalArgumentException {

    public AnalysisValidationException(String message) {
        super(message);
    }

    public AnalysisValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}

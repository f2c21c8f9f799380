package com.casekeep.analysis.stage;

public class UpstreamServiceException extends StageExecutionException {

    private static final int TOO_MANY_REQUESTS = 429;

    private final Integer statusCode;

    public UpstreamServiceException(String message, Integer statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public UpstreamServiceException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = null;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public boolean isRateLimited() {
        return statusCode != null && statusCode == TOO_MANY_REQUESTS;
    }
}

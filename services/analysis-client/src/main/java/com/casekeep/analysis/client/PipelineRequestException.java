package com.casekeep.analysis.client;

public class PipelineRequestException extends RuntimeException {

    private final int statusCode;
    private final String responseBody;

    public PipelineRequestException(int statusCode, String responseBody) {
        super("Pipeline request failed: " + statusCode + " - " + responseBody);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}

package com.casekeep.analysis.client;

public interface ReasoningClient {

    String complete(ReasoningRequest request);
}

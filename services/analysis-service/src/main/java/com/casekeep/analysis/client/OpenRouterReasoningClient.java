package com.casekeep.analysis.client;

import com.casekeep.analysis.config.AnalysisProperties;
import com.casekeep.analysis.stage.StageParseException;
import com.casekeep.analysis.stage.UpstreamServiceException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Component
public class OpenRouterReasoningClient implements ReasoningClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenRouterReasoningClient.class);

    private final RestClient restClient;
    private final AnalysisProperties properties;

    public OpenRouterReasoningClient(
        @Qualifier("reasoningRestClient") RestClient restClient,
        AnalysisProperties properties
    ) {
        this.restClient = restClient;
        this.properties = properties;
    }

    @Override
    public String complete(ReasoningRequest request) {
        ChatCompletionRequest body = new ChatCompletionRequest(
            properties.getReasoningModel(),
            List.of(
                new ChatCompletionRequest.ChatMessage("system", request.systemPrompt()),
                new ChatCompletionRequest.ChatMessage("user", request.userPrompt())
            ),
            properties.getReasoningTemperature(),
            new ChatCompletionRequest.ResponseFormat("json_object")
        );

        ChatCompletionResponse response;
        try {
            response = restClient.post()
                .uri("/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(ChatCompletionResponse.class);
        } catch (RestClientResponseException ex) {
            int status = ex.getStatusCode().value();
            LOGGER.warn("Reasoning call for {} failed with status {}: {}",
                request.stageId(), status, truncate(ex.getResponseBodyAsString(), 300));
            throw new UpstreamServiceException("AI call failed: " + status, status);
        } catch (ResourceAccessException ex) {
            throw new UpstreamServiceException("AI call failed: " + ex.getMessage(), ex);
        } catch (RestClientException ex) {
            throw new StageParseException("Unreadable response from reasoning service", ex);
        }

        if (response == null) {
            throw new StageParseException("Empty response from reasoning service");
        }
        return response.firstContent()
            .orElseThrow(() -> new StageParseException("No content in AI response"));
    }

    private String truncate(String text, int max) {
        if (text == null || text.isBlank()) {
            return "";
        }
        return text.length() <= max ? text : text.substring(0, max);
    }
}

package com.casekeep.analysis.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class ClientConfig {

    @Bean
    RestClient reasoningRestClient(AnalysisProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getConnectTimeout());
        requestFactory.setReadTimeout(properties.getStageTimeout());

        RestClient.Builder builder = RestClient.builder()
            .baseUrl(properties.getReasoningBaseUrl())
            .requestFactory(requestFactory)
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getReasoningApiKey());
        if (properties.getReasoningReferer() != null && !properties.getReasoningReferer().isBlank()) {
            builder = builder.defaultHeader(HttpHeaders.REFERER, properties.getReasoningReferer());
        }
        return builder.build();
    }
}

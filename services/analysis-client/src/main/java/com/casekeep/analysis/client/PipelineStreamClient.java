package com.casekeep.analysis.client;

import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

public class PipelineStreamClient {

    static final String PIPELINE_PATH = "/v1/analysis/pipeline";

    private final WebClient webClient;
    private final PipelineStreamConsumer consumer;

    public PipelineStreamClient(WebClient webClient, PipelineStreamConsumer consumer) {
        this.webClient = webClient;
        this.consumer = consumer;
    }

    public static PipelineStreamClient create(String baseUrl) {
        return new PipelineStreamClient(WebClient.builder().baseUrl(baseUrl).build(), new PipelineStreamConsumer());
    }

    public Flux<byte[]> open(Object request) {
        return webClient.post()
            .uri(PIPELINE_PATH)
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.TEXT_EVENT_STREAM)
            .bodyValue(request)
            .exchangeToFlux(response -> {
                if (response.statusCode().is2xxSuccessful()) {
                    return response.bodyToFlux(DataBuffer.class).map(PipelineStreamClient::toBytes);
                }
                int status = response.statusCode().value();
                return response.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .flatMapMany(body -> Flux.<byte[]>error(new PipelineRequestException(status, body)));
            });
    }

    public Flux<PipelineEvent> events(Object request) {
        return consumer.events(open(request));
    }

    public PipelineSubscription run(Object request, PipelineStreamListener listener) {
        return consumer.consume(open(request), listener);
    }

    private static byte[] toBytes(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }
}

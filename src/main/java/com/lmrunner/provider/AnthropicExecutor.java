package com.lmrunner.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lmrunner.config.LmRunnerProperties;
import com.lmrunner.cost.PriceLookup;
import com.lmrunner.model.ChatCompletion;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.function.Consumer;

/**
 * Anthropic (Claude) executor over the Messages API.
 */
@Component
public class AnthropicExecutor extends AbstractWebClientExecutor {

    private static final String DEFAULT_BASE_URL = "https://api.anthropic.com";
    private static final String ANTHROPIC_VERSION = "2023-06-01";

    public AnthropicExecutor(
            WebClient webClient,
            LmRunnerProperties properties,
            ObjectMapper objectMapper,
            PriceLookup priceLookup) {
        super(webClient, properties, objectMapper, priceLookup);
    }

    @Override
    public ProviderName getProviderName() {
        return ProviderName.ANTHROPIC;
    }

    @Override
    public String dbProviderName() {
        return "anthropic";
    }

    @Override
    protected Mono<ChatCompletion> complete(CompletionCall call) {
        String apiKey = call.apiKey();
        return postJson(endpoint(), headers(apiKey), requestBody(call, false))
                .map(response -> AnthropicMessages.toCompletion(response, call));
    }

    @Override
    protected Flux<CompletionEvent> stream(CompletionCall call) {
        String apiKey = call.apiKey();
        String provider = getProviderName().getTag();
        return postForEvents(endpoint(), headers(apiKey), requestBody(call, true))
                .<CompletionEvent>handle((event, sink) -> {
                    CompletionEvent decoded = AnthropicMessages.toEvent(readJson(event.data()), provider);
                    if (decoded != null) {
                        sink.next(decoded);
                    }
                });
    }

    private ObjectNode requestBody(CompletionCall call, boolean stream) {
        ObjectNode body = AnthropicMessages.requestBody(objectMapper, call);
        body.put("model", call.getModel());
        if (stream) {
            body.put("stream", true);
        }
        return body;
    }

    private String endpoint() {
        return properties.baseUrl(ProviderName.ANTHROPIC.getTag(), DEFAULT_BASE_URL) + "/v1/messages";
    }

    private Consumer<HttpHeaders> headers(String apiKey) {
        return headers -> {
            headers.set("x-api-key", apiKey);
            headers.set("anthropic-version", properties.apiVersion(ProviderName.ANTHROPIC.getTag(), ANTHROPIC_VERSION));
        };
    }
}

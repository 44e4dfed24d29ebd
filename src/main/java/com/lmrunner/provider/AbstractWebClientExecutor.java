package com.lmrunner.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lmrunner.config.LmRunnerProperties;
import com.lmrunner.cost.PriceLookup;
import com.lmrunner.exception.BackendRejectedException;
import com.lmrunner.exception.BackendUnavailableException;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.function.Consumer;

/**
 * Base for executors that speak HTTP+JSON to their provider, with SSE for streaming.
 */
public abstract class AbstractWebClientExecutor extends AbstractLanguageModelExecutor {

    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
            new ParameterizedTypeReference<>() {
            };

    private static final int MAX_ERROR_BODY = 500;

    protected final WebClient webClient;

    protected AbstractWebClientExecutor(
            WebClient webClient,
            LmRunnerProperties properties,
            ObjectMapper objectMapper,
            PriceLookup priceLookup) {
        super(properties, objectMapper, priceLookup);
        this.webClient = webClient;
    }

    protected Mono<JsonNode> postJson(String uri, Consumer<HttpHeaders> headers, JsonNode body) {
        return webClient.post()
                .uri(uri)
                .headers(headers)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body.toString())
                .retrieve()
                .bodyToMono(JsonNode.class);
    }

    /**
     * POST and decode the response as server-sent events.
     * Comment and keep-alive events without data are dropped.
     */
    protected Flux<ServerSentEvent<String>> postForEvents(String uri, Consumer<HttpHeaders> headers, JsonNode body) {
        return webClient.post()
                .uri(uri)
                .headers(headers)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(body.toString())
                .retrieve()
                .bodyToFlux(SSE_TYPE)
                .filter(event -> event.data() != null && !event.data().isBlank());
    }

    @Override
    protected Throwable translateError(Throwable error) {
        String provider = getProviderName().getTag();
        if (error instanceof WebClientResponseException responseError) {
            return new BackendRejectedException(provider, responseError.getStatusCode().value(),
                    extractErrorDetail(responseError.getResponseBodyAsString()));
        }
        if (error instanceof WebClientRequestException requestError) {
            return new BackendUnavailableException(provider, requestError.getMessage(), requestError);
        }
        return super.translateError(error);
    }

    /**
     * Provider error message from an error body, falling back to the truncated body.
     */
    protected String extractErrorDetail(String body) {
        if (body == null || body.isBlank()) {
            return "empty error body";
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode error = root.isArray() && root.size() > 0 ? root.get(0).get("error") : root.get("error");
            if (error != null && error.isTextual()) {
                return error.asText();
            }
            if (error != null && error.hasNonNull("message")) {
                return error.get("message").asText();
            }
            if (root.hasNonNull("message")) {
                return root.get("message").asText();
            }
        } catch (Exception e) {
            // not JSON, fall through to the raw body
        }
        return body.length() > MAX_ERROR_BODY ? body.substring(0, MAX_ERROR_BODY) : body;
    }

    /**
     * Error object carried inside a stream event, if any.
     */
    protected static String streamError(JsonNode payload) {
        JsonNode error = payload.get("error");
        if (error == null || error.isNull()) {
            return null;
        }
        if (error.isTextual()) {
            return error.asText();
        }
        return error.hasNonNull("message") ? error.get("message").asText() : error.toString();
    }
}

package com.lmrunner.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lmrunner.config.LmRunnerProperties;
import com.lmrunner.cost.PriceLookup;
import com.lmrunner.exception.BackendRejectedException;
import com.lmrunner.model.ChatCompletion;
import com.lmrunner.model.ChatMessage;
import com.lmrunner.model.Usage;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Executor for providers exposing the OpenAI chat completions API.
 * Subclasses supply the endpoint and the authentication header.
 */
public abstract class OpenAICompatibleExecutor extends AbstractWebClientExecutor {

    private static final String DONE = "[DONE]";

    protected static final List<String> FORWARDED_PARAMS = List.of(
            "temperature", "top_p", "max_tokens", "max_completion_tokens", "stop", "n", "seed",
            "presence_penalty", "frequency_penalty", "logit_bias", "user", "response_format",
            "tools", "tool_choice", "parallel_tool_calls", "reasoning_effort");

    protected OpenAICompatibleExecutor(
            WebClient webClient,
            LmRunnerProperties properties,
            ObjectMapper objectMapper,
            PriceLookup priceLookup) {
        super(webClient, properties, objectMapper, priceLookup);
    }

    /**
     * Full chat completions URL for this call.
     */
    protected abstract String endpoint(CompletionCall call);

    protected abstract void authorize(HttpHeaders headers, String apiKey);

    /**
     * Whether the provider accepts {@code stream_options.include_usage}.
     */
    protected boolean supportsStreamUsageOption() {
        return true;
    }

    protected List<String> forwardedParams() {
        return FORWARDED_PARAMS;
    }

    @Override
    protected Mono<ChatCompletion> complete(CompletionCall call) {
        String apiKey = call.apiKey();
        return postJson(endpoint(call), headers -> authorize(headers, apiKey), requestBody(call, false))
                .map(response -> toCompletion(response, call));
    }

    @Override
    protected Flux<CompletionEvent> stream(CompletionCall call) {
        String apiKey = call.apiKey();
        return postForEvents(endpoint(call), headers -> authorize(headers, apiKey), requestBody(call, true))
                .takeWhile(event -> !DONE.equals(event.data().trim()))
                .map(event -> toEvent(readJson(event.data())));
    }

    protected ObjectNode requestBody(CompletionCall call, boolean stream) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", call.getModel());

        ArrayNode messages = body.putArray("messages");
        for (ChatMessage message : call.getMessages()) {
            messages.addObject()
                    .put("role", message.getRole())
                    .put("content", message.getContent());
        }

        copyParams(call, body, forwardedParams());

        if (stream) {
            body.put("stream", true);
            if (supportsStreamUsageOption()) {
                body.putObject("stream_options").put("include_usage", true);
            }
        }
        return body;
    }

    protected ChatCompletion toCompletion(JsonNode response, CompletionCall call) {
        JsonNode choice = response.path("choices").path(0);
        JsonNode message = choice.path("message");

        return ChatCompletion.builder()
                .id(response.hasNonNull("id")
                        ? response.get("id").asText()
                        : "chatcmpl-" + UUID.randomUUID().toString().substring(0, 8))
                .provider(call.getProvider().getTag())
                .model(call.getModel())
                .content(message.hasNonNull("content") ? message.get("content").asText() : "")
                .finishReason(choice.hasNonNull("finish_reason") ? choice.get("finish_reason").asText() : "stop")
                .usage(usage(response))
                .created(response.hasNonNull("created")
                        ? response.get("created").asLong()
                        : Instant.now().getEpochSecond())
                .build();
    }

    protected CompletionEvent toEvent(JsonNode chunk) {
        String error = streamError(chunk);
        if (error != null) {
            throw BackendRejectedException.midStream(getProviderName().getTag(), error);
        }

        JsonNode choice = chunk.path("choices").path(0);
        JsonNode content = choice.path("delta").path("content");

        return CompletionEvent.builder()
                .responseId(textValue(chunk, "id"))
                .text(content.isTextual() ? content.asText() : null)
                .finishReason(textValue(choice, "finish_reason"))
                .usage(usage(chunk))
                .build();
    }

    /**
     * Usage block, or null when the payload carries none.
     * Groq reports streaming usage under {@code x_groq.usage}.
     */
    protected Usage usage(JsonNode payload) {
        JsonNode usage = payload.get("usage");
        if (usage == null || usage.isNull()) {
            usage = payload.path("x_groq").get("usage");
        }
        if (usage == null || usage.isNull()) {
            return null;
        }
        Usage result = Usage.of(intValue(usage, "prompt_tokens"), intValue(usage, "completion_tokens"));
        result.setCacheReadTokens(intValue(usage.path("prompt_tokens_details"), "cached_tokens"));
        return result;
    }
}

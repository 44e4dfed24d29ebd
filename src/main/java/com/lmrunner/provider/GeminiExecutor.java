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
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Google Gemini executor over the generateContent API.
 */
@Component
public class GeminiExecutor extends AbstractWebClientExecutor {

    private static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta";

    // runner parameter name -> generationConfig field
    private static final Map<String, String> GENERATION_PARAMS = Map.of(
            "temperature", "temperature",
            "top_p", "topP",
            "top_k", "topK",
            "max_tokens", "maxOutputTokens",
            "stop", "stopSequences",
            "seed", "seed",
            "presence_penalty", "presencePenalty",
            "frequency_penalty", "frequencyPenalty",
            "response_mime_type", "responseMimeType");

    public GeminiExecutor(
            WebClient webClient,
            LmRunnerProperties properties,
            ObjectMapper objectMapper,
            PriceLookup priceLookup) {
        super(webClient, properties, objectMapper, priceLookup);
    }

    @Override
    public ProviderName getProviderName() {
        return ProviderName.GEMINI;
    }

    @Override
    public String dbProviderName() {
        return "gemini";
    }

    @Override
    protected Mono<ChatCompletion> complete(CompletionCall call) {
        String apiKey = call.apiKey();
        return postJson(modelUrl(call) + ":generateContent", headers(apiKey), requestBody(call))
                .map(response -> toCompletion(response, call));
    }

    @Override
    protected Flux<CompletionEvent> stream(CompletionCall call) {
        String apiKey = call.apiKey();
        return postForEvents(modelUrl(call) + ":streamGenerateContent?alt=sse", headers(apiKey), requestBody(call))
                .map(event -> toEvent(readJson(event.data())));
    }

    private String modelUrl(CompletionCall call) {
        return properties.baseUrl(ProviderName.GEMINI.getTag(), DEFAULT_BASE_URL) + "/models/" + call.getModel();
    }

    private Consumer<HttpHeaders> headers(String apiKey) {
        return headers -> headers.set("x-goog-api-key", apiKey);
    }

    /**
     * Gemini has no system role in contents and calls the assistant "model".
     */
    private ObjectNode requestBody(CompletionCall call) {
        ObjectNode body = objectMapper.createObjectNode();
        ArrayNode contents = body.putArray("contents");
        StringBuilder system = new StringBuilder();

        for (ChatMessage message : call.getMessages()) {
            if (message.isSystem()) {
                if (system.length() > 0) {
                    system.append("\n\n");
                }
                system.append(message.getContent());
                continue;
            }
            ObjectNode entry = contents.addObject();
            entry.put("role", ChatMessage.ROLE_ASSISTANT.equals(message.getRole()) ? "model" : "user");
            entry.putArray("parts").addObject().put("text", message.getContent());
        }

        if (system.length() > 0) {
            body.putObject("systemInstruction").putArray("parts").addObject().put("text", system.toString());
        }

        ObjectNode generationConfig = objectMapper.createObjectNode();
        GENERATION_PARAMS.forEach((param, field) -> call.param(param).ifPresent(value -> {
            // Gemini wants a list of stop sequences
            if ("stopSequences".equals(field) && value.isTextual()) {
                generationConfig.putArray(field).add(value.asText());
            } else {
                generationConfig.set(field, value);
            }
        }));
        if (!generationConfig.isEmpty()) {
            body.set("generationConfig", generationConfig);
        }
        return body;
    }

    private ChatCompletion toCompletion(JsonNode response, CompletionCall call) {
        JsonNode candidate = response.path("candidates").path(0);
        return ChatCompletion.builder()
                .id(response.hasNonNull("responseId")
                        ? response.get("responseId").asText()
                        : "gemini-" + UUID.randomUUID().toString().substring(0, 8))
                .provider(call.getProvider().getTag())
                .model(call.getModel())
                .content(candidateText(candidate))
                .finishReason(mapFinishReason(textValue(candidate, "finishReason")))
                .usage(usage(response.get("usageMetadata")))
                .created(Instant.now().getEpochSecond())
                .build();
    }

    private CompletionEvent toEvent(JsonNode chunk) {
        String error = streamError(chunk);
        if (error != null) {
            throw BackendRejectedException.midStream(getProviderName().getTag(), error);
        }
        JsonNode candidate = chunk.path("candidates").path(0);
        String finishReason = textValue(candidate, "finishReason");
        return CompletionEvent.builder()
                .responseId(textValue(chunk, "responseId"))
                .text(candidateText(candidate))
                .finishReason(finishReason != null ? mapFinishReason(finishReason) : null)
                .usage(usage(chunk.get("usageMetadata")))
                .build();
    }

    private static String candidateText(JsonNode candidate) {
        StringBuilder text = new StringBuilder();
        for (JsonNode part : candidate.path("content").path("parts")) {
            if (part.hasNonNull("text") && !part.path("thought").asBoolean(false)) {
                text.append(part.get("text").asText());
            }
        }
        return text.toString();
    }

    private static Usage usage(JsonNode metadata) {
        if (metadata == null || metadata.isNull()) {
            return null;
        }
        Usage usage = Usage.of(intValue(metadata, "promptTokenCount"), intValue(metadata, "candidatesTokenCount"));
        usage.setCacheReadTokens(intValue(metadata, "cachedContentTokenCount"));
        return usage;
    }

    private static String mapFinishReason(String finishReason) {
        if (finishReason == null) {
            return "stop";
        }
        return switch (finishReason) {
            case "MAX_TOKENS" -> "length";
            case "SAFETY", "RECITATION", "BLOCKLIST", "PROHIBITED_CONTENT", "SPII" -> "content_filter";
            default -> "stop";
        };
    }
}

package com.lmrunner.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lmrunner.exception.BackendRejectedException;
import com.lmrunner.model.ChatCompletion;
import com.lmrunner.model.ChatMessage;
import com.lmrunner.model.Usage;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Anthropic Messages format, used both by the Anthropic API and by Claude models on Bedrock.
 */
final class AnthropicMessages {

    static final int DEFAULT_MAX_TOKENS = 4096;

    static final List<String> FORWARDED_PARAMS = List.of(
            "temperature", "top_p", "top_k", "stop_sequences", "tools", "tool_choice", "thinking", "metadata");

    private AnthropicMessages() {
    }

    /**
     * Request body. System messages are lifted into the top-level {@code system} field.
     */
    static ObjectNode requestBody(ObjectMapper objectMapper, CompletionCall call) {
        ObjectNode body = objectMapper.createObjectNode();

        StringBuilder system = new StringBuilder();
        ArrayNode messages = objectMapper.createArrayNode();
        for (ChatMessage message : call.getMessages()) {
            if (message.isSystem()) {
                if (system.length() > 0) {
                    system.append("\n\n");
                }
                system.append(message.getContent());
                continue;
            }
            ObjectNode entry = messages.addObject();
            entry.put("role", message.getRole());
            entry.putArray("content").addObject()
                    .put("type", "text")
                    .put("text", message.getContent());
        }

        body.set("messages", messages);
        if (system.length() > 0) {
            body.put("system", system.toString());
        }
        body.put("max_tokens", call.param("max_tokens").map(JsonNode::asInt).orElse(DEFAULT_MAX_TOKENS));
        AbstractLanguageModelExecutor.copyParams(call, body, FORWARDED_PARAMS);
        return body;
    }

    static ChatCompletion toCompletion(JsonNode response, CompletionCall call) {
        StringBuilder content = new StringBuilder();
        for (JsonNode block : response.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                content.append(block.path("text").asText());
            }
        }

        return ChatCompletion.builder()
                .id(response.hasNonNull("id")
                        ? response.get("id").asText()
                        : "msg-" + UUID.randomUUID().toString().substring(0, 8))
                .provider(call.getProvider().getTag())
                .model(call.getModel())
                .content(content.toString())
                .finishReason(response.hasNonNull("stop_reason")
                        ? mapStopReason(response.get("stop_reason").asText())
                        : "stop")
                .usage(usage(response.get("usage")))
                .created(Instant.now().getEpochSecond())
                .build();
    }

    /**
     * Decode one stream event. Returns null for events that carry nothing (ping, block start/stop).
     *
     * @throws BackendRejectedException for an {@code error} event
     */
    static CompletionEvent toEvent(JsonNode event, String provider) {
        String type = event.path("type").asText();
        switch (type) {
            case "message_start" -> {
                JsonNode message = event.path("message");
                return CompletionEvent.builder()
                        .responseId(AbstractLanguageModelExecutor.textValue(message, "id"))
                        .usage(usage(message.get("usage")))
                        .build();
            }
            case "content_block_delta" -> {
                JsonNode delta = event.path("delta");
                if ("text_delta".equals(delta.path("type").asText())) {
                    return CompletionEvent.text(delta.path("text").asText());
                }
                return null;
            }
            case "message_delta" -> {
                JsonNode stopReason = event.path("delta").get("stop_reason");
                return CompletionEvent.builder()
                        .finishReason(stopReason != null && stopReason.isTextual()
                                ? mapStopReason(stopReason.asText())
                                : null)
                        .usage(usage(event.get("usage")))
                        .build();
            }
            case "error" -> throw BackendRejectedException.midStream(provider,
                    event.path("error").path("message").asText(event.path("error").toString()));
            default -> {
                return null;
            }
        }
    }

    /**
     * Anthropic reports regular input separately from cache writes and reads;
     * prompt tokens here are the sum of the three.
     */
    static Usage usage(JsonNode usage) {
        if (usage == null || usage.isNull()) {
            return null;
        }
        int regular = AbstractLanguageModelExecutor.intValue(usage, "input_tokens");
        int cacheWrite = AbstractLanguageModelExecutor.intValue(usage, "cache_creation_input_tokens");
        int cacheRead = AbstractLanguageModelExecutor.intValue(usage, "cache_read_input_tokens");

        Usage result = Usage.of(regular + cacheWrite + cacheRead,
                AbstractLanguageModelExecutor.intValue(usage, "output_tokens"));
        result.setCacheWriteTokens(cacheWrite);
        result.setCacheReadTokens(cacheRead);
        return result;
    }

    /**
     * Map Claude stop reasons to OpenAI finish reasons.
     */
    static String mapStopReason(String stopReason) {
        return switch (stopReason) {
            case "max_tokens" -> "length";
            case "tool_use" -> "tool_calls";
            case "refusal" -> "content_filter";
            default -> "stop";
        };
    }
}

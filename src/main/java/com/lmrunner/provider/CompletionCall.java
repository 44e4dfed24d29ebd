package com.lmrunner.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.lmrunner.model.ChatMessage;
import com.lmrunner.model.NodeInfo;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Arguments of one chat completion, as seen by an executor.
 */
@Value
@Builder
public class CompletionCall {

    String model;
    ProviderName provider;
    List<ChatMessage> messages;
    JsonNode params;
    Map<String, String> env;
    NodeInfo nodeInfo;

    public String apiKey() {
        return provider.apiKey(env);
    }

    public String envValue(String name) {
        return ProviderName.envValue(env, name);
    }

    /**
     * A parameter from the free-form bag; absent, null and missing bags all read as empty.
     */
    public Optional<JsonNode> param(String name) {
        if (params == null || !params.isObject()) {
            return Optional.empty();
        }
        JsonNode value = params.get(name);
        if (value == null || value instanceof NullNode) {
            return Optional.empty();
        }
        return Optional.of(value);
    }
}

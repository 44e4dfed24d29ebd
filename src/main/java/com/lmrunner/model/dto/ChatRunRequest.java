package com.lmrunner.model.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.lmrunner.model.ChatMessage;
import com.lmrunner.model.NodeInfo;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /v1/chat/completions}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatRunRequest {

    /**
     * {@code provider:model}, e.g. {@code anthropic:claude-3-5-sonnet-latest}.
     */
    @NotBlank
    private String model;

    @NotEmpty
    @Valid
    private List<ChatMessage> messages;

    /**
     * Sampling parameters forwarded to the provider; unknown keys are ignored.
     */
    private JsonNode params;

    /**
     * Credentials for this call, overlaid on the configured defaults.
     */
    private Map<String, String> env;

    private Boolean stream;

    private NodeInfo node;

    public boolean isStreaming() {
        return Boolean.TRUE.equals(stream);
    }
}

package com.lmrunner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a chat completion, normalized across providers.
 * For streaming calls this summarizes the full exchange.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatCompletion {

    @JsonProperty("id")
    private String id;

    @JsonProperty("provider")
    private String provider;

    @JsonProperty("model")
    private String model;

    @JsonProperty("content")
    private String content;

    @JsonProperty("finish_reason")
    private String finishReason; // stop, length, tool_calls, content_filter

    @JsonProperty("usage")
    private Usage usage;

    @JsonProperty("created")
    private Long created;
}

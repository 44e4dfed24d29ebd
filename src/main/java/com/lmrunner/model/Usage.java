package com.lmrunner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Token usage reported by a provider, plus the cost estimate derived from it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Usage {

    @JsonProperty("prompt_tokens")
    private int promptTokens;

    @JsonProperty("completion_tokens")
    private int completionTokens;

    @JsonProperty("total_tokens")
    private int totalTokens;

    @JsonProperty("cache_write_tokens")
    private int cacheWriteTokens;

    @JsonProperty("cache_read_tokens")
    private int cacheReadTokens;

    // null when no price is on file for the provider/model pair
    @JsonProperty("approximate_cost")
    private Double approximateCost;

    public static Usage of(int promptTokens, int completionTokens) {
        return Usage.builder()
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .totalTokens(promptTokens + completionTokens)
                .build();
    }

    public static Usage empty() {
        return of(0, 0);
    }

    /**
     * Input tokens split for pricing. Prompt tokens include cached tokens, so they are subtracted out.
     */
    public InputTokens inputTokens() {
        return InputTokens.builder()
                .regularInputTokens(Math.max(0, promptTokens - cacheWriteTokens - cacheReadTokens))
                .cacheWriteTokens(cacheWriteTokens)
                .cacheReadTokens(cacheReadTokens)
                .build();
    }
}

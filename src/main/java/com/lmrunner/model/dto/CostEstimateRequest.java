package com.lmrunner.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lmrunner.model.InputTokens;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CostEstimateRequest {

    @NotBlank
    private String model;

    @PositiveOrZero
    @JsonProperty("input_tokens")
    private long inputTokens;

    @PositiveOrZero
    @JsonProperty("cache_write_tokens")
    private long cacheWriteTokens;

    @PositiveOrZero
    @JsonProperty("cache_read_tokens")
    private long cacheReadTokens;

    @PositiveOrZero
    @JsonProperty("output_tokens")
    private long outputTokens;

    public InputTokens toInputTokens() {
        return new InputTokens(inputTokens, cacheWriteTokens, cacheReadTokens);
    }
}

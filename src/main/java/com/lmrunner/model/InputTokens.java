package com.lmrunner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Input token counts split by how providers bill them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InputTokens {

    @JsonProperty("regular_input_tokens")
    private long regularInputTokens;

    @JsonProperty("cache_write_tokens")
    private long cacheWriteTokens;

    @JsonProperty("cache_read_tokens")
    private long cacheReadTokens;

    public static InputTokens regular(long tokens) {
        return new InputTokens(tokens, 0L, 0L);
    }
}

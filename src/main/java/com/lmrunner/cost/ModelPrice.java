package com.lmrunner.cost;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Optional;

/**
 * Per-token prices for one provider/model pair.
 * Input and output rates are looked up independently and either may be missing.
 * Cache rates are optional; when absent the regular input rate applies.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModelPrice {

    @JsonProperty("input_rate")
    private Double inputRate;

    @JsonProperty("output_rate")
    private Double outputRate;

    @JsonProperty("cache_write_rate")
    private Double cacheWriteRate;

    @JsonProperty("cache_read_rate")
    private Double cacheReadRate;

    public Optional<Double> output() {
        return Optional.ofNullable(outputRate);
    }

    public double effectiveCacheWriteRate() {
        return cacheWriteRate != null ? cacheWriteRate : inputRate;
    }

    public double effectiveCacheReadRate() {
        return cacheReadRate != null ? cacheReadRate : inputRate;
    }
}

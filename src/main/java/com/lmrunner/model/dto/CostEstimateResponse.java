package com.lmrunner.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Estimated cost of a call. A null cost means no usable price is stored for the model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CostEstimateResponse {

    private String model;

    @JsonProperty("approximate_cost")
    private Double approximateCost;

    private boolean priced;
}

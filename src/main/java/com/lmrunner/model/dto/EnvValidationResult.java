package com.lmrunner.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Outcome of checking an environment map against a provider's required variables.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnvValidationResult {

    private String provider;

    private Set<String> missing;

    private boolean ready;
}

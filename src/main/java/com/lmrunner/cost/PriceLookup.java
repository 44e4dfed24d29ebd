package com.lmrunner.cost;

import java.util.Optional;

/**
 * Source of model prices. An unpriced model is an expected condition and yields empty.
 */
@FunctionalInterface
public interface PriceLookup {

    /**
     * @param providerName pricing-table key of the provider, see {@link CostEstimating#dbProviderName()}
     * @param model        provider-local model name
     */
    Optional<ModelPrice> getPrice(String providerName, String model);
}

package com.lmrunner.cost;

import com.lmrunner.model.InputTokens;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Cost estimation shared by every executor.
 * Implementors only name their pricing-table key; the estimates are derived from it.
 */
public interface CostEstimating {

    Logger COST_LOG = LoggerFactory.getLogger(CostEstimating.class);

    /**
     * Provider key in the pricing table, e.g. {@code "openai"} or {@code "bedrock-anthropic"}.
     */
    String dbProviderName();

    /**
     * Input cost with regular, cache-write and cache-read tokens priced independently.
     *
     * @return empty when no price is stored for the model
     */
    default Optional<Double> estimateInputCost(PriceLookup prices, String model, InputTokens tokens) {
        return prices.getPrice(dbProviderName(), model).flatMap(price -> inputCost(price, tokens));
    }

    default Optional<Double> estimateOutputCost(PriceLookup prices, String model, long outputTokens) {
        return prices.getPrice(dbProviderName(), model).flatMap(price -> outputCost(price, outputTokens));
    }

    default Optional<Double> estimateCost(PriceLookup prices, String model, long inputTokens, long outputTokens) {
        return estimateCost(prices, model, InputTokens.regular(inputTokens), outputTokens);
    }

    /**
     * Sum of input and output cost, from a single price lookup.
     * A missing input price is logged and makes the whole estimate empty, whatever the output price.
     */
    default Optional<Double> estimateCost(PriceLookup prices, String model, InputTokens inputTokens,
                                          long outputTokens) {
        Optional<ModelPrice> price = prices.getPrice(dbProviderName(), model);
        Optional<Double> inputCost = price.flatMap(p -> inputCost(p, inputTokens));
        if (inputCost.isEmpty()) {
            COST_LOG.warn("No stored price found for provider: {}, model: {}", dbProviderName(), model);
            return Optional.empty();
        }
        return price.flatMap(p -> outputCost(p, outputTokens))
                .map(outputCost -> inputCost.get() + outputCost);
    }

    private static Optional<Double> inputCost(ModelPrice price, InputTokens tokens) {
        if (price.getInputRate() == null) {
            return Optional.empty();
        }
        return Optional.of(tokens.getRegularInputTokens() * price.getInputRate()
                + tokens.getCacheWriteTokens() * price.effectiveCacheWriteRate()
                + tokens.getCacheReadTokens() * price.effectiveCacheReadRate());
    }

    private static Optional<Double> outputCost(ModelPrice price, long outputTokens) {
        return price.output().map(rate -> outputTokens * rate);
    }
}

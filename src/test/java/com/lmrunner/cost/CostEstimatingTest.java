package com.lmrunner.cost;

import com.lmrunner.model.InputTokens;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the default cost estimation methods.
 */
class CostEstimatingTest {

    private final CostEstimating estimator = () -> "openai";

    private static PriceLookup priced(ModelPrice price) {
        return (provider, model) -> "openai".equals(provider) && "gpt-4o".equals(model)
                ? Optional.of(price)
                : Optional.empty();
    }

    @Test
    void testInputPlusOutput() {
        PriceLookup prices = priced(ModelPrice.builder().inputRate(0.5).outputRate(0.25).build());

        assertEquals(Optional.of(62.5), estimator.estimateCost(prices, "gpt-4o", 100, 50));
        assertEquals(Optional.of(50.0), estimator.estimateInputCost(prices, "gpt-4o", InputTokens.regular(100)));
        assertEquals(Optional.of(12.5), estimator.estimateOutputCost(prices, "gpt-4o", 50));
    }

    @Test
    void testUnknownModelHasNoEstimate() {
        PriceLookup prices = priced(ModelPrice.builder().inputRate(0.5).outputRate(0.25).build());

        assertTrue(estimator.estimateCost(prices, "gpt-5", 100, 50).isEmpty());
    }

    @Test
    void testMissingInputPriceEmptiesTheWholeEstimate() {
        PriceLookup prices = priced(ModelPrice.builder().outputRate(0.25).build());

        assertTrue(estimator.estimateInputCost(prices, "gpt-4o", InputTokens.regular(100)).isEmpty());
        assertEquals(Optional.of(12.5), estimator.estimateOutputCost(prices, "gpt-4o", 50));
        assertTrue(estimator.estimateCost(prices, "gpt-4o", 100, 50).isEmpty());
    }

    @Test
    void testMissingOutputPriceEmptiesTheWholeEstimate() {
        PriceLookup prices = priced(ModelPrice.builder().inputRate(0.5).build());

        assertEquals(Optional.of(50.0), estimator.estimateInputCost(prices, "gpt-4o", InputTokens.regular(100)));
        assertTrue(estimator.estimateCost(prices, "gpt-4o", 100, 50).isEmpty());
    }

    @Test
    void testCacheTokensPricedSeparately() {
        PriceLookup prices = priced(ModelPrice.builder()
                .inputRate(0.5)
                .outputRate(0.25)
                .cacheWriteRate(1.0)
                .cacheReadRate(0.125)
                .build());
        InputTokens tokens = new InputTokens(100, 10, 16);

        // 100 * 0.5 + 10 * 1.0 + 16 * 0.125 + 50 * 0.25
        assertEquals(Optional.of(74.5), estimator.estimateCost(prices, "gpt-4o", tokens, 50));
    }

    @Test
    void testCacheRatesFallBackToInputRate() {
        PriceLookup prices = priced(ModelPrice.builder().inputRate(0.5).outputRate(0.25).build());

        assertEquals(Optional.of(63.0), estimator.estimateInputCost(prices, "gpt-4o", new InputTokens(100, 20, 6)));
    }

    @Test
    void testLookupUsesPricingKey() {
        CostEstimating bedrock = () -> "bedrock-anthropic";
        PriceLookup prices = (provider, model) -> "bedrock-anthropic".equals(provider)
                ? Optional.of(ModelPrice.builder().inputRate(1.0).outputRate(2.0).build())
                : Optional.empty();

        assertEquals(Optional.of(5.0), bedrock.estimateCost(prices, "anthropic.claude-3-haiku", 1, 2));
        assertTrue(estimator.estimateCost(prices, "anthropic.claude-3-haiku", 1, 2).isEmpty());
    }

    @Test
    void testEstimateLooksThePriceUpOnce() {
        AtomicInteger lookups = new AtomicInteger();
        PriceLookup prices = (provider, model) -> {
            lookups.incrementAndGet();
            return Optional.of(ModelPrice.builder().inputRate(0.5).outputRate(0.25).build());
        };

        assertEquals(Optional.of(62.5), estimator.estimateCost(prices, "gpt-4o", 100, 50));
        assertEquals(1, lookups.get());

        lookups.set(0);
        assertTrue(estimator.estimateCost((provider, model) -> {
            lookups.incrementAndGet();
            return Optional.empty();
        }, "gpt-4o", 100, 50).isEmpty());
        assertEquals(1, lookups.get());
    }
}

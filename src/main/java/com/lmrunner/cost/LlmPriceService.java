package com.lmrunner.cost;

import com.lmrunner.entity.LlmPriceEntity;
import com.lmrunner.repository.LlmPriceRepository;
import com.lmrunner.repository.RedisPriceCacheRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Read-through price lookup: Redis first, then the pricing table.
 * A table hit populates the cache; a table miss is returned as empty and not cached.
 */
@Slf4j
@Service
public class LlmPriceService implements PriceLookup {

    private final RedisPriceCacheRepository priceCache;
    private final LlmPriceRepository priceRepository;

    public LlmPriceService(RedisPriceCacheRepository priceCache, LlmPriceRepository priceRepository) {
        this.priceCache = priceCache;
        this.priceRepository = priceRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ModelPrice> getPrice(String providerName, String model) {
        Optional<ModelPrice> cached = priceCache.get(providerName, model);
        if (cached.isPresent()) {
            return cached;
        }

        Optional<ModelPrice> stored = priceRepository.findByProviderAndModel(providerName, model)
                .map(LlmPriceEntity::toModelPrice);
        stored.ifPresentOrElse(
                price -> priceCache.put(providerName, model, price),
                () -> log.debug("No price row for provider={}, model={}", providerName, model));
        return stored;
    }
}

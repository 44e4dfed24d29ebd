package com.lmrunner.cost;

import com.lmrunner.entity.LlmPriceEntity;
import com.lmrunner.repository.LlmPriceRepository;
import com.lmrunner.repository.RedisPriceCacheRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LlmPriceServiceTest {

    @Mock
    private RedisPriceCacheRepository priceCache;

    @Mock
    private LlmPriceRepository priceRepository;

    private LlmPriceService priceService;

    @BeforeEach
    void setUp() {
        priceService = new LlmPriceService(priceCache, priceRepository);
    }

    @Test
    void testCachedPriceSkipsTheTable() {
        ModelPrice cached = ModelPrice.builder().inputRate(1e-6).outputRate(2e-6).build();
        when(priceCache.get("openai", "gpt-4o")).thenReturn(Optional.of(cached));

        assertEquals(Optional.of(cached), priceService.getPrice("openai", "gpt-4o"));
        verifyNoInteractions(priceRepository);
    }

    @Test
    void testTableHitIsConvertedAndCached() {
        when(priceCache.get("anthropic", "claude-3-5-sonnet")).thenReturn(Optional.empty());
        when(priceRepository.findByProviderAndModel("anthropic", "claude-3-5-sonnet")).thenReturn(Optional.of(
                LlmPriceEntity.builder()
                        .provider("anthropic")
                        .model("claude-3-5-sonnet")
                        .inputPricePerMillion(3.0)
                        .outputPricePerMillion(15.0)
                        .inputCacheReadPricePerMillion(0.3)
                        .build()));

        ModelPrice price = priceService.getPrice("anthropic", "claude-3-5-sonnet").orElseThrow();

        assertEquals(3.0e-6, price.getInputRate(), 1e-15);
        assertEquals(15.0e-6, price.getOutputRate(), 1e-15);
        assertNull(price.getCacheWriteRate());
        assertEquals(0.3e-6, price.getCacheReadRate(), 1e-15);

        ArgumentCaptor<ModelPrice> stored = ArgumentCaptor.forClass(ModelPrice.class);
        verify(priceCache).put(eq("anthropic"), eq("claude-3-5-sonnet"), stored.capture());
        assertSame(price, stored.getValue());
    }

    @Test
    void testMissingRowIsNotCached() {
        when(priceCache.get(anyString(), anyString())).thenReturn(Optional.empty());
        when(priceRepository.findByProviderAndModel("groq", "unknown")).thenReturn(Optional.empty());

        assertTrue(priceService.getPrice("groq", "unknown").isEmpty());
        verify(priceCache, never()).put(anyString(), anyString(), any());
    }
}

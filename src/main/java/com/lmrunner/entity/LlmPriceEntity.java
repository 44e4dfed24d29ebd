package com.lmrunner.entity;

import com.lmrunner.cost.ModelPrice;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the llm_prices table.
 * Prices are stored per million tokens, the way providers publish them.
 * Rows are written by the pricing ingestion job; this service only reads them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "llm_prices", uniqueConstraints = {
        @UniqueConstraint(name = "uq_llm_prices_provider_model", columnNames = {"provider", "model"})
})
public class LlmPriceEntity {

    private static final double TOKENS_PER_UNIT = 1_000_000d;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "provider", nullable = false, length = 64)
    private String provider;

    @Column(name = "model", nullable = false, length = 256)
    private String model;

    @Column(name = "input_price_per_million")
    private Double inputPricePerMillion;

    @Column(name = "output_price_per_million")
    private Double outputPricePerMillion;

    @Column(name = "input_cache_write_price_per_million")
    private Double inputCacheWritePricePerMillion;

    @Column(name = "input_cache_read_price_per_million")
    private Double inputCacheReadPricePerMillion;

    @Column(name = "updated_at")
    private Instant updatedAt;

    /**
     * Convert to per-token rates.
     */
    public ModelPrice toModelPrice() {
        return ModelPrice.builder()
                .inputRate(perToken(inputPricePerMillion))
                .outputRate(perToken(outputPricePerMillion))
                .cacheWriteRate(perToken(inputCacheWritePricePerMillion))
                .cacheReadRate(perToken(inputCacheReadPricePerMillion))
                .build();
    }

    private static Double perToken(Double pricePerMillion) {
        return pricePerMillion != null ? pricePerMillion / TOKENS_PER_UNIT : null;
    }
}

package com.lmrunner.repository;

import com.lmrunner.entity.LlmPriceEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Durable pricing store.
 */
@Repository
public interface LlmPriceRepository extends JpaRepository<LlmPriceEntity, UUID> {

    Optional<LlmPriceEntity> findByProviderAndModel(String provider, String model);
}

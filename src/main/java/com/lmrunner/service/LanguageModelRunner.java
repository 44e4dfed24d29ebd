package com.lmrunner.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.lmrunner.cost.PriceLookup;
import com.lmrunner.model.ChatCompletion;
import com.lmrunner.model.ChatMessage;
import com.lmrunner.model.InputTokens;
import com.lmrunner.model.NodeInfo;
import com.lmrunner.provider.LanguageModelExecutor;
import com.lmrunner.provider.ModelIdentifier;
import com.lmrunner.provider.ProviderName;
import com.lmrunner.stream.ChunkChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point for chat completions: resolves a {@code provider:model} identifier to the
 * registered executor and delegates to it.
 * Each call is a single attempt; there are no retries or fallback providers at this layer.
 */
@Slf4j
@Service
public class LanguageModelRunner {

    private final Map<ProviderName, LanguageModelExecutor> executors;
    private final PriceLookup priceLookup;

    /**
     * Build the executor registry. Every provider must have exactly one executor.
     *
     * @throws IllegalStateException if a provider is missing or registered twice
     */
    public LanguageModelRunner(List<LanguageModelExecutor> executors, PriceLookup priceLookup) {
        EnumMap<ProviderName, LanguageModelExecutor> registry = new EnumMap<>(ProviderName.class);
        for (LanguageModelExecutor executor : executors) {
            LanguageModelExecutor previous = registry.put(executor.getProviderName(), executor);
            if (previous != null) {
                throw new IllegalStateException("Duplicate executors for provider " + executor.getProviderName()
                        + ": " + previous.getClass().getSimpleName() + ", " + executor.getClass().getSimpleName());
            }
        }
        for (ProviderName provider : ProviderName.values()) {
            if (!registry.containsKey(provider)) {
                throw new IllegalStateException("No executor registered for provider: " + provider);
            }
        }
        this.executors = Collections.unmodifiableMap(registry);
        this.priceLookup = priceLookup;

        log.info("Initialized LanguageModelRunner with {} executors: {}", registry.size(), registry.keySet());
    }

    /**
     * Run a chat completion.
     *
     * @param model    identifier of the form {@code provider:model}, e.g. {@code openai:gpt-4o-mini}
     * @param messages if a system message is passed it must come first; the rest alternate
     *                 user and assistant, starting with user
     * @param sink     channel for streamed chunks, or null for a single response
     */
    public Mono<ChatCompletion> chatCompletion(
            String model,
            List<ChatMessage> messages,
            JsonNode params,
            Map<String, String> env,
            @Nullable ChunkChannel sink,
            NodeInfo nodeInfo) {
        ModelIdentifier identifier;
        ProviderName provider;
        try {
            Objects.requireNonNull(nodeInfo, "nodeInfo is required");
            identifier = ModelIdentifier.parse(model);
            provider = identifier.providerName();
        } catch (RuntimeException e) {
            if (sink != null) {
                sink.fail(e);
            }
            return Mono.error(e);
        }

        log.debug("Routing model '{}' to provider '{}' for node {}", identifier.getModel(), provider,
                nodeInfo.getNodeId());

        return executorFor(provider).chatCompletion(
                identifier.getModel(), provider, messages, params, env, sink, nodeInfo);
    }

    /**
     * Cost estimate for a call that already happened, e.g. for usage reported elsewhere.
     */
    public Optional<Double> estimateCost(String model, InputTokens inputTokens, long outputTokens) {
        ModelIdentifier identifier = ModelIdentifier.parse(model);
        return executorFor(identifier.providerName())
                .estimateCost(priceLookup, identifier.getModel(), inputTokens, outputTokens);
    }

    public Set<String> requiredEnvVars(String providerTag) {
        return ProviderName.fromTag(providerTag).requiredEnvVars();
    }

    /**
     * Pre-flight check of an environment against a provider's requirements.
     *
     * @return the variables that are missing, empty if the environment is complete
     */
    public Set<String> missingEnvVars(String providerTag, Map<String, String> env) {
        Set<String> missing = new LinkedHashSet<>();
        for (String name : requiredEnvVars(providerTag)) {
            if (env == null || env.get(name) == null) {
                missing.add(name);
            }
        }
        return missing;
    }

    LanguageModelExecutor executorFor(ProviderName provider) {
        LanguageModelExecutor executor = executors.get(provider);
        if (executor == null) {
            // cannot happen once the constructor has validated the registry
            throw new IllegalStateException("No executor registered for provider: " + provider);
        }
        return executor;
    }
}

package com.lmrunner.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties for the runner.
 */
@Data
@Component
@ConfigurationProperties(prefix = "lmrunner")
public class LmRunnerProperties {

    private Map<String, ProviderConfig> providers = new HashMap<>();
    private ProxyConfig proxy = new ProxyConfig();
    private StreamConfig stream = new StreamConfig();
    private PricingConfig pricing = new PricingConfig();
    private BedrockConfig bedrock = new BedrockConfig();

    /**
     * Operator-supplied credential defaults, overlaid by the env sent with each request.
     */
    private Map<String, String> env = new HashMap<>();

    @Data
    public static class ProviderConfig {
        private String baseUrl;
        private String apiVersion;
    }

    @Data
    public static class ProxyConfig {
        private Duration timeout = Duration.ofSeconds(120);
        private int maxInMemorySize = 16 * 1024 * 1024;
    }

    @Data
    public static class StreamConfig {
        private int channelCapacity = 32;
    }

    @Data
    public static class PricingConfig {
        private Duration cacheTtl = Duration.ofHours(6);
    }

    @Data
    public static class BedrockConfig {
        private int clientCacheSize = 64;
        private Duration clientIdleTimeout = Duration.ofMinutes(30);
    }

    /**
     * Configured base URL for a provider tag, or the given default.
     */
    public String baseUrl(String providerTag, String defaultBaseUrl) {
        ProviderConfig config = providers.get(providerTag);
        if (config == null || config.getBaseUrl() == null || config.getBaseUrl().isBlank()) {
            return defaultBaseUrl;
        }
        return config.getBaseUrl();
    }

    public String apiVersion(String providerTag, String defaultVersion) {
        ProviderConfig config = providers.get(providerTag);
        if (config == null || config.getApiVersion() == null || config.getApiVersion().isBlank()) {
            return defaultVersion;
        }
        return config.getApiVersion();
    }
}

package com.lmrunner.provider;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.lmrunner.config.LmRunnerProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeAsyncClient;

import jakarta.annotation.PreDestroy;

/**
 * Bedrock runtime clients, one per region and credential set.
 * Credentials arrive with each call, so clients are built lazily and closed when evicted.
 */
@Slf4j
@Component
public class BedrockClientCache {

    private final Cache<String, BedrockRuntimeAsyncClient> clients;

    public BedrockClientCache(LmRunnerProperties properties) {
        this.clients = Caffeine.newBuilder()
                .maximumSize(properties.getBedrock().getClientCacheSize())
                .expireAfterAccess(properties.getBedrock().getClientIdleTimeout())
                .removalListener((String key, BedrockRuntimeAsyncClient client, RemovalCause cause) -> {
                    if (client != null) {
                        log.debug("Closing Bedrock client ({})", cause);
                        client.close();
                    }
                })
                .build();
    }

    public BedrockRuntimeAsyncClient clientFor(String region, String accessKeyId, String secretAccessKey) {
        // the secret never appears in the key in clear text
        String key = region + ":" + accessKeyId + ":" + DigestUtils.sha256Hex(secretAccessKey);
        return clients.get(key, ignored -> {
            log.info("Initializing Bedrock client for region: {}", region);
            return BedrockRuntimeAsyncClient.builder()
                    .region(Region.of(region))
                    .credentialsProvider(StaticCredentialsProvider.create(
                            AwsBasicCredentials.create(accessKeyId, secretAccessKey)))
                    .build();
        });
    }

    @PreDestroy
    public void closeAll() {
        clients.invalidateAll();
        clients.cleanUp();
    }
}

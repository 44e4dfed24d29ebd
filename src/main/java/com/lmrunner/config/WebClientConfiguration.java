package com.lmrunner.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient configuration for HTTP calls to providers.
 * Streaming responses can run long, so the response timeout is generous.
 */
@Configuration
public class WebClientConfiguration {

    private static final int CONNECT_TIMEOUT_MILLIS = 10_000;

    private final LmRunnerProperties properties;

    public WebClientConfiguration(LmRunnerProperties properties) {
        this.properties = properties;
    }

    @Bean
    public WebClient webClient() {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
                .responseTimeout(properties.getProxy().getTimeout());

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> configurer.defaultCodecs()
                        .maxInMemorySize(properties.getProxy().getMaxInMemorySize()))
                .build();
    }
}

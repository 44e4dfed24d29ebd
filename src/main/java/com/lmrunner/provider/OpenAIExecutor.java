package com.lmrunner.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lmrunner.config.LmRunnerProperties;
import com.lmrunner.cost.PriceLookup;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * OpenAI chat completion executor.
 */
@Component
public class OpenAIExecutor extends OpenAICompatibleExecutor {

    private static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";

    public OpenAIExecutor(
            WebClient webClient,
            LmRunnerProperties properties,
            ObjectMapper objectMapper,
            PriceLookup priceLookup) {
        super(webClient, properties, objectMapper, priceLookup);
    }

    @Override
    public ProviderName getProviderName() {
        return ProviderName.OPENAI;
    }

    @Override
    public String dbProviderName() {
        return "openai";
    }

    @Override
    protected String endpoint(CompletionCall call) {
        return properties.baseUrl(ProviderName.OPENAI.getTag(), DEFAULT_BASE_URL) + "/chat/completions";
    }

    @Override
    protected void authorize(HttpHeaders headers, String apiKey) {
        headers.setBearerAuth(apiKey);
    }
}

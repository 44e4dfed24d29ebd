package com.lmrunner.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lmrunner.config.LmRunnerProperties;
import com.lmrunner.cost.PriceLookup;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * Mistral executor. Mistral rejects unknown request fields, so only its own parameters are sent.
 */
@Component
public class MistralExecutor extends OpenAICompatibleExecutor {

    private static final String DEFAULT_BASE_URL = "https://api.mistral.ai/v1";

    private static final List<String> MISTRAL_PARAMS = List.of(
            "temperature", "top_p", "max_tokens", "stop", "random_seed", "safe_prompt",
            "presence_penalty", "frequency_penalty", "response_format", "tools", "tool_choice",
            "parallel_tool_calls");

    public MistralExecutor(
            WebClient webClient,
            LmRunnerProperties properties,
            ObjectMapper objectMapper,
            PriceLookup priceLookup) {
        super(webClient, properties, objectMapper, priceLookup);
    }

    @Override
    public ProviderName getProviderName() {
        return ProviderName.MISTRAL;
    }

    @Override
    public String dbProviderName() {
        return "mistral";
    }

    @Override
    protected String endpoint(CompletionCall call) {
        return properties.baseUrl(ProviderName.MISTRAL.getTag(), DEFAULT_BASE_URL) + "/chat/completions";
    }

    @Override
    protected void authorize(HttpHeaders headers, String apiKey) {
        headers.setBearerAuth(apiKey);
    }

    @Override
    protected boolean supportsStreamUsageOption() {
        return false;
    }

    @Override
    protected List<String> forwardedParams() {
        return MISTRAL_PARAMS;
    }
}

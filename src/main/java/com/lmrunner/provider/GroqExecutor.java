package com.lmrunner.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lmrunner.config.LmRunnerProperties;
import com.lmrunner.cost.PriceLookup;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * Groq executor, OpenAI-compatible endpoint.
 */
@Component
public class GroqExecutor extends OpenAICompatibleExecutor {

    private static final String DEFAULT_BASE_URL = "https://api.groq.com/openai/v1";

    private static final List<String> GROQ_PARAMS = List.of(
            "temperature", "top_p", "max_tokens", "max_completion_tokens", "stop", "seed",
            "presence_penalty", "frequency_penalty", "user", "response_format",
            "tools", "tool_choice", "parallel_tool_calls");

    public GroqExecutor(
            WebClient webClient,
            LmRunnerProperties properties,
            ObjectMapper objectMapper,
            PriceLookup priceLookup) {
        super(webClient, properties, objectMapper, priceLookup);
    }

    @Override
    public ProviderName getProviderName() {
        return ProviderName.GROQ;
    }

    @Override
    public String dbProviderName() {
        return "groq";
    }

    @Override
    protected String endpoint(CompletionCall call) {
        return properties.baseUrl(ProviderName.GROQ.getTag(), DEFAULT_BASE_URL) + "/chat/completions";
    }

    @Override
    protected void authorize(HttpHeaders headers, String apiKey) {
        headers.setBearerAuth(apiKey);
    }

    // usage arrives under x_groq on the last chunk
    @Override
    protected boolean supportsStreamUsageOption() {
        return false;
    }

    @Override
    protected List<String> forwardedParams() {
        return GROQ_PARAMS;
    }
}

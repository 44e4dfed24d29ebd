package com.lmrunner.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lmrunner.config.LmRunnerProperties;
import com.lmrunner.cost.PriceLookup;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Azure OpenAI executor. The deployment named in the environment selects the model;
 * the model name is still used for pricing.
 */
@Component
public class OpenAIAzureExecutor extends OpenAICompatibleExecutor {

    private static final String DEFAULT_API_VERSION = "2024-10-21";

    public OpenAIAzureExecutor(
            WebClient webClient,
            LmRunnerProperties properties,
            ObjectMapper objectMapper,
            PriceLookup priceLookup) {
        super(webClient, properties, objectMapper, priceLookup);
    }

    @Override
    public ProviderName getProviderName() {
        return ProviderName.OPENAI_AZURE;
    }

    @Override
    public String dbProviderName() {
        return "azure-openai";
    }

    @Override
    protected String endpoint(CompletionCall call) {
        String resourceId = call.envValue(ProviderName.OPENAI_AZURE_RESOURCE_ID);
        String deployment = call.envValue(ProviderName.OPENAI_AZURE_DEPLOYMENT_NAME);
        String tag = ProviderName.OPENAI_AZURE.getTag();

        String baseUrl = properties.baseUrl(tag, "https://" + resourceId + ".openai.azure.com");
        return baseUrl + "/openai/deployments/" + deployment + "/chat/completions?api-version="
                + properties.apiVersion(tag, DEFAULT_API_VERSION);
    }

    @Override
    protected void authorize(HttpHeaders headers, String apiKey) {
        headers.set("api-key", apiKey);
    }
}

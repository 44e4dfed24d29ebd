package com.lmrunner.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.lmrunner.cost.CostEstimating;
import com.lmrunner.model.ChatCompletion;
import com.lmrunner.model.ChatMessage;
import com.lmrunner.model.NodeInfo;
import com.lmrunner.stream.ChunkChannel;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Backend executor for one provider.
 * Implementations are stateless singletons; all per-request state lives in the call.
 */
public interface LanguageModelExecutor extends CostEstimating {

    /**
     * Provider this executor is registered for.
     */
    ProviderName getProviderName();

    /**
     * Run a chat completion.
     *
     * @param model        provider-local model name
     * @param providerName provider resolved from the model identifier
     * @param messages     conversation, optional system message first
     * @param params       free-form parameters; keys the provider does not know are ignored
     * @param env          credential snapshot for this call
     * @param sink         when present, text deltas are sent here in emission order
     * @param nodeInfo     pipeline position, stamped on every chunk
     * @return the full completion; for streaming calls, a summary once the provider closes the stream
     */
    Mono<ChatCompletion> chatCompletion(
            String model,
            ProviderName providerName,
            List<ChatMessage> messages,
            JsonNode params,
            Map<String, String> env,
            @Nullable ChunkChannel sink,
            NodeInfo nodeInfo);
}

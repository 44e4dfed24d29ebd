package com.lmrunner.controller;

import com.lmrunner.config.LmRunnerProperties;
import com.lmrunner.exception.GlobalExceptionHandler;
import com.lmrunner.model.ChatCompletion;
import com.lmrunner.model.NodeInfo;
import com.lmrunner.model.dto.ChatRunRequest;
import com.lmrunner.model.dto.CostEstimateRequest;
import com.lmrunner.model.dto.CostEstimateResponse;
import com.lmrunner.model.dto.EnvValidationResult;
import com.lmrunner.model.dto.ProviderInfo;
import com.lmrunner.provider.ProviderName;
import com.lmrunner.service.LanguageModelRunner;
import com.lmrunner.stream.ChunkChannel;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * HTTP surface over the language model runner.
 * Chat completions are returned as JSON or, when {@code stream} is set, as server-sent events.
 */
@Slf4j
@RestController
@RequestMapping("/v1")
public class RunnerController {

    static final String CHUNK_EVENT = "chunk";
    static final String COMPLETION_EVENT = "completion";
    static final String ERROR_EVENT = "error";

    private final LanguageModelRunner runner;
    private final LmRunnerProperties properties;

    public RunnerController(LanguageModelRunner runner, LmRunnerProperties properties) {
        this.runner = runner;
        this.properties = properties;
    }

    @PostMapping(value = "/chat/completions",
                 consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<?>> createChatCompletion(@Valid @RequestBody ChatRunRequest request) {
        log.info("Received chat completion request for model: {}, stream: {}",
                request.getModel(), request.isStreaming());

        NodeInfo nodeInfo = request.getNode() != null ? request.getNode() : NodeInfo.detached();
        Map<String, String> env = mergedEnv(request.getEnv());

        if (request.isStreaming()) {
            return Mono.<ResponseEntity<?>>just(ResponseEntity.ok()
                    .contentType(MediaType.TEXT_EVENT_STREAM)
                    .header(HttpHeaders.CACHE_CONTROL, "no-cache")
                    .body(streamEvents(request, env, nodeInfo)));
        }
        return runner.chatCompletion(request.getModel(), request.getMessages(), request.getParams(),
                        env, null, nodeInfo)
                .<ResponseEntity<?>>map(ResponseEntity::ok);
    }

    /**
     * Chunk events as the provider produces them, then one {@code completion} or {@code error} event.
     * Dropping the connection closes the channel, which stops the provider call.
     */
    private Flux<ServerSentEvent<Object>> streamEvents(ChatRunRequest request, Map<String, String> env,
                                                      NodeInfo nodeInfo) {
        ChunkChannel channel = new ChunkChannel(properties.getStream().getChannelCapacity());

        Mono<ChatCompletion> call = runner.chatCompletion(request.getModel(), request.getMessages(),
                request.getParams(), env, channel, nodeInfo);

        // errors surface once, through the final event
        Flux<ServerSentEvent<Object>> chunks = channel.asFlux()
                .map(chunk -> ServerSentEvent.<Object>builder(chunk).event(CHUNK_EVENT).build())
                .onErrorResume(e -> Flux.empty());

        Mono<ServerSentEvent<Object>> outcome = call
                .map(completion -> ServerSentEvent.<Object>builder(completion).event(COMPLETION_EVENT).build())
                .onErrorResume(e -> Mono.just(ServerSentEvent.<Object>builder(
                        GlobalExceptionHandler.toErrorResponse(e)).event(ERROR_EVENT).build()));

        // both sides are subscribed up front; the outcome is emitted after the last chunk
        return Flux.mergeSequential(chunks, outcome);
    }

    @GetMapping("/providers")
    public List<ProviderInfo> listProviders() {
        List<ProviderInfo> providers = new ArrayList<>();
        for (ProviderName provider : ProviderName.values()) {
            providers.add(ProviderInfo.builder()
                    .tag(provider.getTag())
                    .requiredEnv(provider.requiredEnvVars())
                    .build());
        }
        return providers;
    }

    /**
     * Check an environment, overlaid on the configured defaults, against a provider's requirements.
     */
    @PostMapping("/providers/{tag}/validate")
    public EnvValidationResult validateEnv(@PathVariable String tag,
                                           @RequestBody(required = false) Map<String, String> env) {
        Set<String> missing = runner.missingEnvVars(tag, mergedEnv(env));
        log.info("Validated env for provider {}: {} missing", tag, missing.size());
        return EnvValidationResult.builder()
                .provider(tag)
                .missing(missing)
                .ready(missing.isEmpty())
                .build();
    }

    @PostMapping("/costs/estimate")
    public Mono<CostEstimateResponse> estimateCost(@Valid @RequestBody CostEstimateRequest request) {
        // price lookup hits Redis and Postgres
        return Mono.fromCallable(() -> {
            Optional<Double> cost = runner.estimateCost(request.getModel(), request.toInputTokens(),
                    request.getOutputTokens());
            return CostEstimateResponse.builder()
                    .model(request.getModel())
                    .approximateCost(cost.orElse(null))
                    .priced(cost.isPresent())
                    .build();
        }).subscribeOn(Schedulers.boundedElastic());
    }

    Map<String, String> mergedEnv(Map<String, String> requestEnv) {
        Map<String, String> env = new HashMap<>(properties.getEnv());
        if (requestEnv != null) {
            requestEnv.forEach((name, value) -> {
                if (value != null) {
                    env.put(name, value);
                }
            });
        }
        return env;
    }
}

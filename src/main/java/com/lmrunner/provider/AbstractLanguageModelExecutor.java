package com.lmrunner.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lmrunner.config.LmRunnerProperties;
import com.lmrunner.cost.PriceLookup;
import com.lmrunner.exception.BackendUnavailableException;
import com.lmrunner.exception.LanguageModelException;
import com.lmrunner.exception.SinkClosedException;
import com.lmrunner.model.ChatCompletion;
import com.lmrunner.model.ChatMessage;
import com.lmrunner.model.NodeInfo;
import com.lmrunner.model.StreamChunk;
import com.lmrunner.model.Usage;
import com.lmrunner.stream.ChunkChannel;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shared dispatch for every executor: single-shot versus streaming, chunk delivery,
 * error translation and cost attribution. Subclasses only talk to their provider.
 */
@Slf4j
public abstract class AbstractLanguageModelExecutor implements LanguageModelExecutor {

    protected final LmRunnerProperties properties;
    protected final ObjectMapper objectMapper;
    private final PriceLookup priceLookup;

    protected AbstractLanguageModelExecutor(
            LmRunnerProperties properties,
            ObjectMapper objectMapper,
            PriceLookup priceLookup) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.priceLookup = priceLookup;
    }

    @Override
    public Mono<ChatCompletion> chatCompletion(
            String model,
            ProviderName providerName,
            List<ChatMessage> messages,
            JsonNode params,
            Map<String, String> env,
            ChunkChannel sink,
            NodeInfo nodeInfo) {
        if (nodeInfo == null) {
            NullPointerException error = new NullPointerException("nodeInfo is required");
            if (sink != null) {
                sink.fail(error);
            }
            return Mono.error(error);
        }
        CompletionCall call = CompletionCall.builder()
                .model(model)
                .provider(providerName)
                .messages(messages)
                .params(params)
                .env(env)
                .nodeInfo(nodeInfo)
                .build();

        log.info("Forwarding request to {}: model={}, stream={}, node={}",
                getProviderName(), model, sink != null, nodeInfo.getNodeName());

        Mono<ChatCompletion> completion = Mono.defer(() -> sink == null ? complete(call) : streamInto(call, sink))
                .onErrorMap(this::translateError);
        if (sink != null) {
            // the producer side ends with the call, whatever the outcome
            completion = completion
                    .doOnSuccess(result -> sink.complete())
                    .doOnError(sink::fail)
                    .doOnCancel(sink::complete);
        }

        return completion
                .flatMap(result -> withCost(call, result))
                .doOnSuccess(result -> log.debug("Completion from {} finished: model={}, finishReason={}",
                        getProviderName(), model, result.getFinishReason()))
                .doOnError(error -> log.error("Completion from {} failed: model={}: {}",
                        getProviderName(), model, error.getMessage()));
    }

    /**
     * Single request, single response.
     */
    protected abstract Mono<ChatCompletion> complete(CompletionCall call);

    /**
     * Provider events in emission order. Cancelling the subscription must release the connection.
     */
    protected abstract Flux<CompletionEvent> stream(CompletionCall call);

    /**
     * Deliver text deltas to the sink one at a time on a worker thread, so a full channel
     * blocks the delivery thread and backpressure reaches the provider read.
     */
    private Mono<ChatCompletion> streamInto(CompletionCall call, ChunkChannel sink) {
        StreamAccumulator accumulator = new StreamAccumulator(call);
        // set only when the provider stream ran to its end rather than being cut by the receiver
        AtomicBoolean upstreamCompleted = new AtomicBoolean();

        return stream(call)
                .doOnComplete(() -> upstreamCompleted.set(true))
                .takeUntilOther(sink.whenClosed())
                .publishOn(Schedulers.boundedElastic(), 1)
                .doOnNext(event -> {
                    accumulator.add(event);
                    if (event.hasText()) {
                        deliver(sink, StreamChunk.of(call.getNodeInfo(), event.getText()));
                    }
                })
                .then(Mono.fromCallable(() -> {
                    if (!upstreamCompleted.get()) {
                        throw new SinkClosedException();
                    }
                    return accumulator.toCompletion();
                }))
                .onErrorMap(this::translateError);
    }

    private static void deliver(ChunkChannel sink, StreamChunk chunk) {
        try {
            sink.send(chunk);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SinkClosedException();
        }
    }

    /**
     * Attach the cost estimate to the usage. Pricing problems never fail the call.
     */
    private Mono<ChatCompletion> withCost(CompletionCall call, ChatCompletion completion) {
        Usage usage = completion.getUsage();
        if (usage == null) {
            return Mono.just(completion);
        }
        return Mono.fromCallable(() -> estimateCost(priceLookup, call.getModel(), usage.inputTokens(),
                        usage.getCompletionTokens()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(cost -> {
                    usage.setApproximateCost(cost.orElse(null));
                    return completion;
                })
                .onErrorResume(error -> {
                    log.warn("Cost estimation failed for provider: {}, model: {}: {}",
                            dbProviderName(), call.getModel(), error.getMessage());
                    return Mono.just(completion);
                });
    }

    /**
     * Map provider and transport failures onto the runner's error kinds.
     * Anything else is a local fault and propagates unchanged.
     * Subclasses extend this for client-library exceptions.
     */
    protected Throwable translateError(Throwable error) {
        if (error instanceof LanguageModelException) {
            return error;
        }
        if (isTransportFailure(error)) {
            return unavailable(error);
        }
        return error;
    }

    protected BackendUnavailableException unavailable(Throwable error) {
        return new BackendUnavailableException(getProviderName().getTag(),
                error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName(), error);
    }

    /**
     * I/O errors, timeouts and malformed provider payloads, directly or as the immediate cause.
     */
    protected static boolean isTransportFailure(Throwable error) {
        Throwable cause = error.getCause();
        return isTransportError(error) || (cause != null && cause != error && isTransportError(cause));
    }

    private static boolean isTransportError(Throwable error) {
        return error instanceof IOException
                || error instanceof UncheckedIOException
                || error instanceof TimeoutException;
    }

    protected JsonNode readJson(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Malformed " + getProviderName() + " payload", e);
        }
    }

    /**
     * Copy the named parameters that are present in the bag; everything else is ignored.
     */
    protected static void copyParams(CompletionCall call, ObjectNode target, List<String> names) {
        for (String name : names) {
            call.param(name).ifPresent(value -> target.set(name, value));
        }
    }

    protected static int intValue(JsonNode node, String field) {
        JsonNode value = node != null ? node.get(field) : null;
        return value != null && value.isNumber() ? value.asInt() : 0;
    }

    protected static String textValue(JsonNode node, String field) {
        JsonNode value = node != null ? node.get(field) : null;
        return value != null && value.isTextual() ? value.asText() : null;
    }
}

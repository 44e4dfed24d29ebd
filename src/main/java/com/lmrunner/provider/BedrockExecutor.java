package com.lmrunner.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lmrunner.config.LmRunnerProperties;
import com.lmrunner.cost.PriceLookup;
import com.lmrunner.exception.BackendRejectedException;
import com.lmrunner.model.ChatCompletion;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.async.SdkPublisher;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeAsyncClient;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelWithResponseStreamRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelWithResponseStreamResponseHandler;
import software.amazon.awssdk.services.bedrockruntime.model.PayloadPart;
import software.amazon.awssdk.services.bedrockruntime.model.ResponseStream;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;

/**
 * AWS Bedrock executor for Claude models, through the Bedrock Runtime SDK.
 * The model name is the Bedrock model id, e.g. {@code anthropic.claude-3-haiku-20240307-v1:0}.
 */
@Component
public class BedrockExecutor extends AbstractLanguageModelExecutor {

    private static final String ANTHROPIC_VERSION = "bedrock-2023-05-31";

    private final BedrockClientCache clientCache;

    public BedrockExecutor(
            BedrockClientCache clientCache,
            LmRunnerProperties properties,
            ObjectMapper objectMapper,
            PriceLookup priceLookup) {
        super(properties, objectMapper, priceLookup);
        this.clientCache = clientCache;
    }

    @Override
    public ProviderName getProviderName() {
        return ProviderName.BEDROCK;
    }

    @Override
    public String dbProviderName() {
        return "bedrock-anthropic";
    }

    @Override
    protected Mono<ChatCompletion> complete(CompletionCall call) {
        BedrockRuntimeAsyncClient client = client(call);
        InvokeModelRequest request = InvokeModelRequest.builder()
                .modelId(call.getModel())
                .contentType("application/json")
                .accept("application/json")
                .body(SdkBytes.fromString(requestBody(call).toString(), StandardCharsets.UTF_8))
                .build();

        return Mono.fromFuture(() -> client.invokeModel(request))
                .map(response -> AnthropicMessages.toCompletion(readJson(response.body().asUtf8String()), call));
    }

    @Override
    protected Flux<CompletionEvent> stream(CompletionCall call) {
        BedrockRuntimeAsyncClient client = client(call);
        InvokeModelWithResponseStreamRequest request = InvokeModelWithResponseStreamRequest.builder()
                .modelId(call.getModel())
                .contentType("application/json")
                .accept("application/json")
                .body(SdkBytes.fromString(requestBody(call).toString(), StandardCharsets.UTF_8))
                .build();
        String provider = getProviderName().getTag();

        return Flux.defer(() -> {
            CompletableFuture<SdkPublisher<ResponseStream>> eventStream = new CompletableFuture<>();
            Sinks.Empty<Void> callFailure = Sinks.empty();
            Consumer<Throwable> onFailure = error -> {
                eventStream.completeExceptionally(error);
                callFailure.tryEmitError(error);
            };
            InvokeModelWithResponseStreamResponseHandler handler = InvokeModelWithResponseStreamResponseHandler.builder()
                    .onEventStream(eventStream::complete)
                    .onError(onFailure)
                    .build();

            CompletableFuture<Void> invocation = client.invokeModelWithResponseStream(request, handler);
            invocation.whenComplete((ignored, error) -> {
                if (error != null) {
                    onFailure.accept(error);
                }
            });

            // events are pulled from the SDK publisher as the delivery side requests them
            return Mono.fromFuture(eventStream)
                    .flatMapMany(publisher -> Flux.from(publisher))
                    .takeUntilOther(callFailure.asMono())
                    .<CompletionEvent>handle((event, sink) -> {
                        if (event instanceof PayloadPart part) {
                            CompletionEvent decoded = AnthropicMessages.toEvent(
                                    readJson(part.bytes().asUtf8String()), provider);
                            if (decoded != null) {
                                sink.next(decoded);
                            }
                        }
                    })
                    .doOnCancel(() -> invocation.cancel(true));
        });
    }

    private BedrockRuntimeAsyncClient client(CompletionCall call) {
        String region = call.envValue(ProviderName.AWS_REGION);
        String accessKeyId = call.envValue(ProviderName.AWS_ACCESS_KEY_ID);
        String secretAccessKey = call.apiKey();
        return clientCache.clientFor(region, accessKeyId, secretAccessKey);
    }

    private ObjectNode requestBody(CompletionCall call) {
        ObjectNode body = AnthropicMessages.requestBody(objectMapper, call);
        body.put("anthropic_version", ANTHROPIC_VERSION);
        return body;
    }

    @Override
    protected Throwable translateError(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        String provider = getProviderName().getTag();

        if (cause instanceof AwsServiceException serviceError) {
            String detail = serviceError.awsErrorDetails() != null && serviceError.awsErrorDetails().errorMessage() != null
                    ? serviceError.awsErrorDetails().errorMessage()
                    : serviceError.getMessage();
            return new BackendRejectedException(provider, serviceError.statusCode(), detail);
        }
        if (cause instanceof SdkClientException clientError) {
            return unavailable(clientError);
        }
        return super.translateError(cause);
    }
}

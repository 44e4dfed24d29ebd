package com.lmrunner.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lmrunner.config.JacksonConfiguration;
import com.lmrunner.config.LmRunnerProperties;
import com.lmrunner.cost.PriceLookup;
import com.lmrunner.model.ChatCompletion;
import com.lmrunner.model.ChatMessage;
import com.lmrunner.model.NodeInfo;
import com.lmrunner.stream.ChunkChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class GeminiExecutorTest {

    private static final Map<String, String> ENV = Map.of("GEMINI_API_KEY", "gm-key");
    private static final List<ChatMessage> MESSAGES = List.of(ChatMessage.user("Name a colour"));

    private ObjectMapper objectMapper;
    private LmRunnerProperties properties;
    private final PriceLookup prices = (provider, model) -> Optional.empty();

    @BeforeEach
    void setUp() {
        objectMapper = JacksonConfiguration.createObjectMapper();
        properties = new LmRunnerProperties();
    }

    @Test
    void testCompleteIgnoresThoughtParts() {
        StubWebClient stub = StubWebClient.json("{\"responseId\":\"r-1\",\"candidates\":[{\"content\":{\"parts\":["
                + "{\"text\":\"thinking...\",\"thought\":true},{\"text\":\"Blue\"}],\"role\":\"model\"},"
                + "\"finishReason\":\"STOP\"}],"
                + "\"usageMetadata\":{\"promptTokenCount\":4,\"candidatesTokenCount\":1,\"totalTokenCount\":5}}");
        GeminiExecutor executor = new GeminiExecutor(stub.webClient(), properties, objectMapper, prices);

        ChatCompletion completion = executor.chatCompletion("gemini-1.5-flash", ProviderName.GEMINI, MESSAGES,
                null, ENV, null, NodeInfo.detached()).block();

        assertNotNull(completion);
        assertEquals("r-1", completion.getId());
        assertEquals("Blue", completion.getContent());
        assertEquals("stop", completion.getFinishReason());
        assertEquals(5, completion.getUsage().getTotalTokens());

        assertEquals("https://generativelanguage.googleapis.com/v1beta/models/gemini-1.5-flash:generateContent",
                stub.lastRequest().url().toString());
        assertEquals("gm-key", stub.lastRequest().headers().getFirst("x-goog-api-key"));
    }

    @Test
    void testStreamingUsesSseEndpoint() throws InterruptedException {
        StubWebClient stub = StubWebClient.events(
                "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"Gre\"}]}}]}",
                "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"en\"}]},\"finishReason\":\"MAX_TOKENS\"}],"
                        + "\"usageMetadata\":{\"promptTokenCount\":4,\"candidatesTokenCount\":2}}");
        GeminiExecutor executor = new GeminiExecutor(stub.webClient(), properties, objectMapper, prices);
        ChunkChannel channel = new ChunkChannel();

        ChatCompletion completion = executor.chatCompletion("gemini-1.5-flash", ProviderName.GEMINI, MESSAGES,
                null, ENV, channel, NodeInfo.detached()).block(Duration.ofSeconds(10));

        assertNotNull(completion);
        assertEquals("Green", completion.getContent());
        assertEquals("length", completion.getFinishReason());
        assertEquals(6, completion.getUsage().getTotalTokens());
        assertEquals("Gre", channel.receive().orElseThrow().getContent());
        assertEquals("en", channel.receive().orElseThrow().getContent());
        assertTrue(channel.receive().isEmpty());

        assertTrue(stub.lastRequest().url().toString().endsWith(":streamGenerateContent?alt=sse"));
    }

    @Test
    void testConfiguredBaseUrlIsUsed() {
        LmRunnerProperties.ProviderConfig config = new LmRunnerProperties.ProviderConfig();
        config.setBaseUrl("http://localhost:9999/v1beta");
        properties.getProviders().put("gemini", config);
        StubWebClient stub = StubWebClient.json("{\"candidates\":[]}");
        GeminiExecutor executor = new GeminiExecutor(stub.webClient(), properties, objectMapper, prices);

        ChatCompletion completion = executor.chatCompletion("gemini-pro", ProviderName.GEMINI, MESSAGES,
                null, ENV, null, NodeInfo.detached()).block();

        assertNotNull(completion);
        assertEquals("", completion.getContent());
        assertEquals("http://localhost:9999/v1beta/models/gemini-pro:generateContent",
                stub.lastRequest().url().toString());
    }
}

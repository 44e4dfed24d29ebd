package com.lmrunner.provider;

import com.lmrunner.config.JacksonConfiguration;
import com.lmrunner.config.LmRunnerProperties;
import com.lmrunner.exception.BackendRejectedException;
import com.lmrunner.model.ChatCompletion;
import com.lmrunner.model.ChatMessage;
import com.lmrunner.model.NodeInfo;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MistralExecutorTest {

    private static final Map<String, String> ENV = Map.of("MISTRAL_API_KEY", "ms-key");
    private static final List<ChatMessage> MESSAGES = List.of(ChatMessage.user("Bonjour"));

    private MistralExecutor executor(StubWebClient stub) {
        return new MistralExecutor(stub.webClient(), new LmRunnerProperties(),
                JacksonConfiguration.createObjectMapper(), (provider, model) -> Optional.empty());
    }

    @Test
    void testComplete() {
        StubWebClient stub = StubWebClient.json("{\"id\":\"m-1\",\"choices\":[{\"message\":{\"content\":\"Salut\"},"
                + "\"finish_reason\":\"length\"}],\"usage\":{\"prompt_tokens\":5,\"completion_tokens\":2}}");

        ChatCompletion completion = executor(stub).chatCompletion("mistral-small-latest", ProviderName.MISTRAL,
                MESSAGES, null, ENV, null, NodeInfo.detached()).block();

        assertNotNull(completion);
        assertEquals("Salut", completion.getContent());
        assertEquals("length", completion.getFinishReason());
        assertEquals("https://api.mistral.ai/v1/chat/completions", stub.lastRequest().url().toString());
        assertEquals("Bearer ms-key", stub.lastRequest().headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void testMessageFieldUsedForErrorDetail() {
        StubWebClient stub = StubWebClient.error(HttpStatus.UNAUTHORIZED, "{\"message\":\"Unauthorized\"}");

        BackendRejectedException e = assertThrows(BackendRejectedException.class, () -> executor(stub)
                .chatCompletion("mistral-small-latest", ProviderName.MISTRAL, MESSAGES, null, ENV, null,
                        NodeInfo.detached())
                .block());

        assertEquals(401, e.getStatus());
        assertEquals("Unauthorized", e.getDetail());
    }
}

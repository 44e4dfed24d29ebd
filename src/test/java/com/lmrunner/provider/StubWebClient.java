package com.lmrunner.provider;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.List;

/**
 * WebClient answering every request with one canned response and recording what was sent.
 */
class StubWebClient {

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();
    private final WebClient webClient;

    private StubWebClient(HttpStatus status, MediaType contentType, String body) {
        this.webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, contentType.toString())
                            .body(body)
                            .build());
                })
                .build();
    }

    static StubWebClient json(String body) {
        return new StubWebClient(HttpStatus.OK, MediaType.APPLICATION_JSON, body);
    }

    static StubWebClient error(HttpStatus status, String body) {
        return new StubWebClient(status, MediaType.APPLICATION_JSON, body);
    }

    /**
     * Server-sent events, one {@code data:} line per payload.
     */
    static StubWebClient events(String... payloads) {
        StringBuilder body = new StringBuilder();
        for (String payload : payloads) {
            body.append("data: ").append(payload).append("\n\n");
        }
        return new StubWebClient(HttpStatus.OK, MediaType.TEXT_EVENT_STREAM, body.toString());
    }

    WebClient webClient() {
        return webClient;
    }

    ClientRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }

    int requestCount() {
        return requests.size();
    }
}

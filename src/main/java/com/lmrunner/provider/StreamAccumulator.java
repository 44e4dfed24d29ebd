package com.lmrunner.provider;

import com.lmrunner.model.ChatCompletion;
import com.lmrunner.model.Usage;

import java.time.Instant;
import java.util.UUID;

/**
 * Folds the events of one streaming call into the final completion.
 * Token counts are cumulative on every provider, so the largest value seen wins.
 */
class StreamAccumulator {

    private final CompletionCall call;
    private final StringBuilder content = new StringBuilder();
    private final Usage usage = Usage.empty();
    private String responseId;
    private String finishReason;

    StreamAccumulator(CompletionCall call) {
        this.call = call;
    }

    void add(CompletionEvent event) {
        if (event.getResponseId() != null && responseId == null) {
            responseId = event.getResponseId();
        }
        if (event.hasText()) {
            content.append(event.getText());
        }
        if (event.getFinishReason() != null) {
            finishReason = event.getFinishReason();
        }
        if (event.getUsage() != null) {
            merge(event.getUsage());
        }
    }

    private void merge(Usage update) {
        usage.setPromptTokens(Math.max(usage.getPromptTokens(), update.getPromptTokens()));
        usage.setCompletionTokens(Math.max(usage.getCompletionTokens(), update.getCompletionTokens()));
        usage.setCacheWriteTokens(Math.max(usage.getCacheWriteTokens(), update.getCacheWriteTokens()));
        usage.setCacheReadTokens(Math.max(usage.getCacheReadTokens(), update.getCacheReadTokens()));
        usage.setTotalTokens(usage.getPromptTokens() + usage.getCompletionTokens());
    }

    ChatCompletion toCompletion() {
        return ChatCompletion.builder()
                .id(responseId != null ? responseId : "chatcmpl-" + UUID.randomUUID().toString().substring(0, 8))
                .provider(call.getProvider().getTag())
                .model(call.getModel())
                .content(content.toString())
                .finishReason(finishReason != null ? finishReason : "stop")
                .usage(usage)
                .created(Instant.now().getEpochSecond())
                .build();
    }
}

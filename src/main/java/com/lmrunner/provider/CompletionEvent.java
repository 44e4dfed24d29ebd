package com.lmrunner.provider;

import com.lmrunner.model.Usage;
import lombok.Builder;
import lombok.Value;

/**
 * One decoded event from a provider stream. Any field may be absent.
 */
@Value
@Builder
public class CompletionEvent {

    String responseId;
    String text;
    String finishReason;
    Usage usage;

    public static CompletionEvent text(String text) {
        return CompletionEvent.builder().text(text).build();
    }

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }
}

package com.lmrunner.exception;

import lombok.Getter;

/**
 * Transport-level failure talking to a provider. Callers above the runner may retry.
 */
@Getter
public class BackendUnavailableException extends LanguageModelException {

    private final String provider;

    public BackendUnavailableException(String provider, String message, Throwable cause) {
        super(ErrorKind.BACKEND_UNAVAILABLE, provider + " unavailable: " + message, cause);
        this.provider = provider;
    }
}

package com.lmrunner.exception;

import lombok.Getter;

/**
 * Structured refusal from a provider: invalid parameters, quota, content filtering.
 * The provider's detail is surfaced verbatim.
 */
@Getter
public class BackendRejectedException extends LanguageModelException {

    private final String provider;
    private final int status;
    private final String detail;

    public BackendRejectedException(String provider, int status, String detail) {
        super(ErrorKind.BACKEND_REJECTED, provider + " rejected request (" + status + "): " + detail);
        this.provider = provider;
        this.status = status;
        this.detail = detail;
    }

    /**
     * Error reported inside an open stream, where no HTTP status applies.
     */
    public static BackendRejectedException midStream(String provider, String detail) {
        return new BackendRejectedException(provider, 0, detail);
    }
}

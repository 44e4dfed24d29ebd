package com.lmrunner.exception;

import lombok.Getter;

/**
 * Base class for every error raised by the language model runner.
 */
@Getter
public abstract class LanguageModelException extends RuntimeException {

    private final ErrorKind kind;

    protected LanguageModelException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected LanguageModelException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}

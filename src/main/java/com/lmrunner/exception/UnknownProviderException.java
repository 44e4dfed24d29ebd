package com.lmrunner.exception;

import lombok.Getter;

@Getter
public class UnknownProviderException extends LanguageModelException {

    private final String tag;

    public UnknownProviderException(String tag) {
        super(ErrorKind.UNKNOWN_PROVIDER, "Invalid language model provider: " + tag);
        this.tag = tag;
    }
}

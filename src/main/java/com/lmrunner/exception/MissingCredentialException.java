package com.lmrunner.exception;

import lombok.Getter;

/**
 * A required environment variable is absent for the selected provider.
 */
@Getter
public class MissingCredentialException extends LanguageModelException {

    private final String variable;

    public MissingCredentialException(String variable) {
        super(ErrorKind.MISSING_CREDENTIAL, "Env variables don't contain: " + variable);
        this.variable = variable;
    }
}

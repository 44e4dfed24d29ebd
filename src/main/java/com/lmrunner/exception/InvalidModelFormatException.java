package com.lmrunner.exception;

import lombok.Getter;

/**
 * Model identifier is not of the form {@code provider:model}.
 */
@Getter
public class InvalidModelFormatException extends LanguageModelException {

    private final String identifier;

    public InvalidModelFormatException(String identifier) {
        super(ErrorKind.INVALID_FORMAT, "Invalid model format: '" + identifier
                + "', expected '<provider>:<model>'");
        this.identifier = identifier;
    }
}

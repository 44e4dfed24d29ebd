package com.lmrunner.provider;

import com.lmrunner.exception.InvalidModelFormatException;
import lombok.Value;

/**
 * Caller-facing model identifier of the form {@code <provider-tag>:<model-name>}.
 * The model name may itself contain the separator, e.g.
 * {@code bedrock:anthropic.claude-3-haiku-20240307-v1:0}.
 */
@Value
public class ModelIdentifier {

    public static final char SEPARATOR = ':';

    String provider;
    String model;

    /**
     * Split on the first separator.
     *
     * @throws InvalidModelFormatException when there is no separator or the model part is blank
     */
    public static ModelIdentifier parse(String identifier) {
        if (identifier == null) {
            throw new InvalidModelFormatException(null);
        }
        int index = identifier.indexOf(SEPARATOR);
        if (index < 0) {
            throw new InvalidModelFormatException(identifier);
        }
        String model = identifier.substring(index + 1);
        if (model.trim().isEmpty()) {
            throw new InvalidModelFormatException(identifier);
        }
        return new ModelIdentifier(identifier.substring(0, index), model);
    }

    public ProviderName providerName() {
        return ProviderName.fromTag(provider);
    }

    @Override
    public String toString() {
        return provider + SEPARATOR + model;
    }
}

package com.lmrunner.provider;

import com.lmrunner.exception.MissingCredentialException;
import com.lmrunner.exception.UnknownProviderException;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Closed set of supported language model backends.
 * The tag is the prefix used in model identifiers, e.g. {@code "openai:gpt-4o"}.
 */
public enum ProviderName {

    ANTHROPIC("anthropic"),
    MISTRAL("mistral"),
    OPENAI("openai"),
    OPENAI_AZURE("openai-azure"),
    GEMINI("gemini"),
    GROQ("groq"),
    BEDROCK("bedrock");

    public static final String AWS_SECRET_ACCESS_KEY = "AWS_SECRET_ACCESS_KEY";
    public static final String AWS_ACCESS_KEY_ID = "AWS_ACCESS_KEY_ID";
    public static final String AWS_REGION = "AWS_REGION";
    public static final String OPENAI_AZURE_RESOURCE_ID = "OPENAI_AZURE_RESOURCE_ID";
    public static final String OPENAI_AZURE_DEPLOYMENT_NAME = "OPENAI_AZURE_DEPLOYMENT_NAME";

    private final String tag;

    ProviderName(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Exact, case-sensitive match against the known tags.
     *
     * @throws UnknownProviderException for any other tag
     */
    public static ProviderName fromTag(String tag) {
        for (ProviderName provider : values()) {
            if (provider.tag.equals(tag)) {
                return provider;
            }
        }
        throw new UnknownProviderException(tag);
    }

    /**
     * Name of the environment variable holding the primary API key.
     */
    public String apiKeyName() {
        return switch (this) {
            case ANTHROPIC -> "ANTHROPIC_API_KEY";
            case MISTRAL -> "MISTRAL_API_KEY";
            case OPENAI -> "OPENAI_API_KEY";
            case OPENAI_AZURE -> "AZURE_API_KEY";
            case GEMINI -> "GEMINI_API_KEY";
            case GROQ -> "GROQ_API_KEY";
            case BEDROCK -> AWS_SECRET_ACCESS_KEY;
        };
    }

    /**
     * Variables an environment must define before requests to this provider can succeed.
     * This is a pre-flight check for callers; the completion call does not enforce it up front.
     */
    public Set<String> requiredEnvVars() {
        Set<String> vars = new LinkedHashSet<>();
        vars.add(apiKeyName());

        switch (this) {
            case BEDROCK -> {
                vars.add(AWS_REGION);
                vars.add(AWS_ACCESS_KEY_ID);
            }
            case OPENAI_AZURE -> {
                vars.add(OPENAI_AZURE_RESOURCE_ID);
                vars.add(OPENAI_AZURE_DEPLOYMENT_NAME);
            }
            default -> {
            }
        }
        return vars;
    }

    /**
     * Primary API key from the supplied environment snapshot.
     *
     * @throws MissingCredentialException when the variable is absent
     */
    public String apiKey(Map<String, String> env) {
        return envValue(env, apiKeyName());
    }

    public static String envValue(Map<String, String> env, String name) {
        String value = env != null ? env.get(name) : null;
        if (value == null) {
            throw new MissingCredentialException(name);
        }
        return value;
    }

    @Override
    public String toString() {
        return tag;
    }
}

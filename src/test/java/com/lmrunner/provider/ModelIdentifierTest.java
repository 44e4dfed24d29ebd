package com.lmrunner.provider;

import com.lmrunner.exception.InvalidModelFormatException;
import com.lmrunner.exception.UnknownProviderException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModelIdentifierTest {

    @Test
    void testParseSplitsOnFirstSeparator() {
        ModelIdentifier identifier = ModelIdentifier.parse("openai:gpt-4o-mini");

        assertEquals("openai", identifier.getProvider());
        assertEquals("gpt-4o-mini", identifier.getModel());
        assertEquals(ProviderName.OPENAI, identifier.providerName());
    }

    @Test
    void testModelMayContainSeparator() {
        ModelIdentifier identifier = ModelIdentifier.parse("bedrock:anthropic.claude-3-haiku-20240307-v1:0");

        assertEquals(ProviderName.BEDROCK, identifier.providerName());
        assertEquals("anthropic.claude-3-haiku-20240307-v1:0", identifier.getModel());
        assertEquals("bedrock:anthropic.claude-3-haiku-20240307-v1:0", identifier.toString());
    }

    @Test
    void testMissingSeparatorIsInvalid() {
        assertThrows(InvalidModelFormatException.class, () -> ModelIdentifier.parse("gpt-4o"));
    }

    @Test
    void testBlankModelIsInvalid() {
        assertThrows(InvalidModelFormatException.class, () -> ModelIdentifier.parse("openai:"));
        assertThrows(InvalidModelFormatException.class, () -> ModelIdentifier.parse("openai:  "));
        assertThrows(InvalidModelFormatException.class, () -> ModelIdentifier.parse(null));
    }

    @Test
    void testUnknownProviderIsReportedOnResolution() {
        ModelIdentifier identifier = ModelIdentifier.parse("cohere:command-r");

        assertEquals("cohere", identifier.getProvider());
        assertThrows(UnknownProviderException.class, identifier::providerName);
    }
}

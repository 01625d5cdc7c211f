package com.github.ldtransform.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class JsonLdErrorTest {

    @ParameterizedTest
    @EnumSource(JsonLdError.Error.class)
    void testCodesRoundTrip(JsonLdError.Error error) {
        assertSame(error, JsonLdError.Error.fromCode(error.toString()));
    }

    @Test
    void testUnknownCode() {
        assertNull(JsonLdError.Error.fromCode("no such error"));
    }

    @Test
    void testCodeStrings() {
        assertEquals("recursive context inclusion",
                JsonLdError.Error.RECURSIVE_CONTEXT_INCLUSION.toString());
        assertEquals("invalid @id value", JsonLdError.Error.INVALID_ID_VALUE.toString());
        assertEquals("IRI confused with prefix",
                JsonLdError.Error.IRI_CONFUSED_WITH_PREFIX.toString());
    }

    @Test
    void testMessageCarriesTypeAndDetails() {
        final JsonLdError e = new JsonLdError(JsonLdError.Error.INVALID_TERM, "name")
                .setDetail("policy", ExpansionPolicy.STRICT);

        assertEquals("invalid term: name {policy:STRICT}", e.getMessage());
        assertEquals(ExpansionPolicy.STRICT, e.getDetails().get("policy"));
    }

    @Test
    void testCauseIsKept() {
        final JsonLdError cause = new JsonLdError(JsonLdError.Error.LOADING_DOCUMENT_FAILED);
        final JsonLdError e = new JsonLdError(JsonLdError.Error.LOADING_REMOTE_CONTEXT_FAILED,
                "http://example.org/ctx", cause);

        assertSame(cause, e.getCause());
        assertEquals("loading document failed", cause.getMessage());
    }
}

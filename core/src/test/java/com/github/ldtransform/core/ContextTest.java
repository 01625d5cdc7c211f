package com.github.ldtransform.core;

import static com.github.ldtransform.core.ExpansionTest.json;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.node.ArrayNode;

class ContextTest {

    private static JsonLdOptions withLoader(DocumentLoader loader) {
        final JsonLdOptions opts = new JsonLdOptions("");
        opts.setDocumentLoader(loader);
        return opts;
    }

    @Test
    void testParseSimpleTerms() throws Exception {
        final Context ctx = new Context().parse(json("{'@vocab': 'http://example.org/',"
                + " 'name': 'http://schema.org/name', 'knows': {'@type': '@id'}}"));

        assertEquals("http://example.org/", ctx.getVocab());
        assertEquals("http://schema.org/name", ctx.getTermDefinition("name").getId());
        assertEquals("http://example.org/knows", ctx.getTermDefinition("knows").getId());
        assertEquals("@id", ctx.getTypeMapping("knows"));
        assertFalse(ctx.getTermDefinition("name").isPrefix());
    }

    @Test
    void testContextsAreImmutableSnapshots() throws Exception {
        final Context base = new Context().parse(json("{'name': 'http://schema.org/name'}"));
        final Context derived = base.parse(json("{'age': 'http://schema.org/age'}"));

        assertNull(base.getTermDefinition("age"));
        assertSame(base.getTermDefinition("name"), derived.getTermDefinition("name"));
    }

    @Test
    void testExpandIriWithPrefix() throws Exception {
        final Context ctx = new Context().parse(json("{'schema': 'http://schema.org/'}"));

        assertTrue(ctx.getTermDefinition("schema").isPrefix());
        assertEquals("http://schema.org/name", ctx.expandIri("schema:name", false, true));
        assertEquals("_:b1", ctx.expandIri("_:b1", true, false));
        assertEquals("@type", ctx.expandIri("@type", false, true));
    }

    @Test
    void testKeywordFormIsIgnored() throws Exception {
        final Context ctx = new Context();

        assertNull(ctx.expandIri("@ignoreMe", false, true));
        assertNull(ctx.expandIri("@ignoreMe", false, true));
        assertEquals(1, ctx.getOptions().getWarnings().size());
    }

    @Test
    void testKeywordFormTermIsReportedAsWarning() throws Exception {
        final Context ctx = new Context().parse(json("{'@custom': 'http://example.org/c',"
                + " 'name': 'http://schema.org/name'}"));

        assertNull(ctx.getTermDefinition("@custom"));
        assertEquals("http://schema.org/name", ctx.getTermDefinition("name").getId());
        assertEquals(1, ctx.getOptions().getWarnings().size());
        assertTrue(ctx.getOptions().getWarnings().get(0).contains("@custom"));
    }

    @Test
    void testProtectedTermCannotBeRedefined() throws Exception {
        final JsonLdError e = assertThrows(JsonLdError.class,
                () -> JsonLdProcessor.expand(json("{'@context': ["
                        + "{'@protected': true, 'name': 'http://schema.org/name'},"
                        + "{'name': 'http://example.org/other'}], 'name': 'x'}")));
        assertEquals(JsonLdError.Error.PROTECTED_TERM_REDEFINITION, e.getType());
    }

    @Test
    void testProtectedTermAcceptsIdenticalDefinition() throws Exception {
        final ArrayNode expanded = JsonLdProcessor.expand(json("{'@context': ["
                + "{'@protected': true, 'name': 'http://schema.org/name'},"
                + "{'name': 'http://schema.org/name'}], 'name': 'x'}"));

        assertEquals(json("[{'http://schema.org/name': [{'@value': 'x'}]}]"), expanded);
    }

    @Test
    void testProtectedContextCannotBeCleared() throws Exception {
        final JsonLdError e = assertThrows(JsonLdError.class,
                () -> JsonLdProcessor.expand(json("{'@context': ["
                        + "{'@protected': true, 'name': 'http://schema.org/name'}, null],"
                        + "'name': 'x'}")));
        assertEquals(JsonLdError.Error.INVALID_CONTEXT_NULLIFICATION, e.getType());
    }

    @Test
    void testPropertyScopedContextMayOverrideProtectedTerm() throws Exception {
        final ArrayNode expanded = JsonLdProcessor.expand(json("{'@context': {"
                + "'@protected': true, 'name': 'http://schema.org/name',"
                + "'knows': {'@id': 'http://example.org/knows',"
                + " '@context': {'name': 'http://example.org/otherName'}}},"
                + "'knows': {'name': 'Bob'}}"));

        assertEquals(json("[{'http://example.org/knows': ["
                + "{'http://example.org/otherName': [{'@value': 'Bob'}]}]}]"), expanded);
    }

    @Test
    void testNonPropagatedContextReverts() throws Exception {
        final ArrayNode expanded = JsonLdProcessor.expand(json("{'@context': {"
                + "'@vocab': 'http://example.org/'},"
                + "'child': {'@context': {'@propagate': false, 'name': 'http://schema.org/name'},"
                + " 'name': 'X', 'grand': {'name': 'Y'}}}"));

        assertEquals(json("[{'http://example.org/child': [{"
                + "'http://schema.org/name': [{'@value': 'X'}],"
                + "'http://example.org/grand': [{'http://example.org/name': [{'@value': 'Y'}]}]"
                + "}]}]"), expanded);
    }

    @Test
    void testSelfReferencingRemoteContext() throws Exception {
        final InMemoryDocumentLoader loader = new InMemoryDocumentLoader()
                .addDocument("http://example.org/ctx", json("{'@context': 'http://example.org/ctx'}"));

        final JsonLdError e = assertThrows(JsonLdError.class,
                () -> JsonLdProcessor.expand(
                        json("{'@context': 'http://example.org/ctx', 'name': 'x'}"),
                        withLoader(loader)));
        assertEquals(JsonLdError.Error.RECURSIVE_CONTEXT_INCLUSION, e.getType());
    }

    @Test
    void testRemoteContextIsLoadedOncePerRun() throws Exception {
        final InMemoryDocumentLoader documents = new InMemoryDocumentLoader()
                .addDocument("http://example.org/ctx", json("{'@context': {"
                        + "'name': 'http://schema.org/name', 'knows': 'http://schema.org/knows'}}"));
        final AtomicInteger loads = new AtomicInteger();
        final DocumentLoader counting = url -> {
            loads.incrementAndGet();
            return documents.loadDocument(url);
        };

        final ArrayNode expanded = JsonLdProcessor.expand(json("{"
                + "'@context': 'http://example.org/ctx', 'name': 'Alice',"
                + "'knows': {'@context': 'http://example.org/ctx', 'name': 'Bob'}}"),
                withLoader(counting));

        assertEquals(json("[{'http://schema.org/name': [{'@value': 'Alice'}],"
                + "'http://schema.org/knows': [{'http://schema.org/name': [{'@value': 'Bob'}]}]}]"),
                expanded);
        assertEquals(1, loads.get());
    }

    @Test
    void testMissingRemoteContext() throws Exception {
        final JsonLdError e = assertThrows(JsonLdError.class,
                () -> JsonLdProcessor.expand(
                        json("{'@context': 'http://example.org/missing', 'name': 'x'}"),
                        withLoader(new InMemoryDocumentLoader())));
        assertEquals(JsonLdError.Error.LOADING_REMOTE_CONTEXT_FAILED, e.getType());
        assertTrue(e.getCause() instanceof JsonLdError);
    }

    @Test
    void testRemoteDocumentWithoutContext() throws Exception {
        final InMemoryDocumentLoader loader = new InMemoryDocumentLoader()
                .addDocument("http://example.org/ctx", json("{'name': 'http://schema.org/name'}"));

        final JsonLdError e = assertThrows(JsonLdError.class,
                () -> JsonLdProcessor.expand(
                        json("{'@context': 'http://example.org/ctx', 'name': 'x'}"),
                        withLoader(loader)));
        assertEquals(JsonLdError.Error.INVALID_REMOTE_CONTEXT, e.getType());
    }

    @Test
    void testImportedContext() throws Exception {
        final InMemoryDocumentLoader loader = new InMemoryDocumentLoader()
                .addDocument("http://example.org/base",
                        json("{'@context': {'name': 'http://schema.org/name'}}"));

        final ArrayNode expanded = JsonLdProcessor.expand(json("{'@context': {"
                + "'@import': 'http://example.org/base', 'age': 'http://schema.org/age'},"
                + "'name': 'A', 'age': 1}"), withLoader(loader));

        assertEquals(json("[{'http://schema.org/name': [{'@value': 'A'}],"
                + "'http://schema.org/age': [{'@value': 1}]}]"), expanded);
    }

    @Test
    void testKeywordRedefinition() throws Exception {
        final JsonLdError e = assertThrows(JsonLdError.class,
                () -> new Context().parse(json("{'@id': 'http://example.org/id'}")));
        assertEquals(JsonLdError.Error.KEYWORD_REDEFINITION, e.getType());
    }

    @Test
    void testCyclicIriMapping() throws Exception {
        final JsonLdError e = assertThrows(JsonLdError.class,
                () -> new Context().parse(json("{'a': 'b:x', 'b': 'a:y'}")));
        assertEquals(JsonLdError.Error.CYCLIC_IRI_MAPPING, e.getType());
    }

    @Test
    void testInvalidContainer() throws Exception {
        final JsonLdError e = assertThrows(JsonLdError.class,
                () -> new Context().parse(json("{'p': {'@id': 'http://example.org/p',"
                        + " '@container': '@bogus'}}")));
        assertEquals(JsonLdError.Error.INVALID_CONTAINER_MAPPING, e.getType());
    }

    @Test
    void testVersionConflictsWithLegacyMode() throws Exception {
        final JsonLdOptions opts = new JsonLdOptions("");
        opts.setProcessingMode(ProcessingMode.JSON_LD_1_0);

        final JsonLdError e = assertThrows(JsonLdError.class,
                () -> new Context(opts).parse(json("{'@version': 1.1}")));
        assertEquals(JsonLdError.Error.PROCESSING_MODE_CONFLICT, e.getType());
    }

    @Test
    void testInverseContextSelectsShortestTerm() throws Exception {
        final Context ctx = new Context().parse(json("{'nm': 'http://schema.org/name',"
                + " 'name': 'http://schema.org/name'}"));

        assertEquals("nm", ctx.compactIri("http://schema.org/name", true));
    }
}

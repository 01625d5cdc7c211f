package com.github.ldtransform.core;

import static com.github.ldtransform.core.ExpansionTest.json;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Iterator;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

class CompactionTest {

    @Test
    void testCompactNameTerm() throws Exception {
        final JsonNode context = json("{'@context': {'name': 'http://schema.org/name'}}");

        final ObjectNode compacted = JsonLdProcessor
                .compact(json("{'http://schema.org/name': 'Alice'}"), context);

        assertEquals(json("{'@context': {'name': 'http://schema.org/name'}, 'name': 'Alice'}"),
                compacted);
    }

    @Test
    void testContextComesFirst() throws Exception {
        final ObjectNode compacted = JsonLdProcessor.compact(
                json("{'http://schema.org/name': 'Alice'}"),
                json("{'name': 'http://schema.org/name'}"));

        assertEquals("@context", compacted.fieldNames().next());
    }

    @Test
    void testCompactListContainer() throws Exception {
        final JsonNode context = json("{'list': {'@id': 'http://example.org/list',"
                + " '@container': '@list'}}");

        final ObjectNode compacted = JsonLdProcessor.compact(
                json("{'http://example.org/list': {'@list': [1, 2]}}"), context);

        assertEquals(json("{'@context': {'list': {'@id': 'http://example.org/list',"
                + " '@container': '@list'}}, 'list': [1, 2]}"), compacted);
    }

    @Test
    void testListContainerRoundTrip() throws Exception {
        final JsonNode context = json("{'list': {'@id': 'http://example.org/list',"
                + " '@container': '@list'}}");
        final ObjectNode document = (ObjectNode) json("{'list': ['a', 'b']}");
        document.set("@context", context);

        final JsonNode expanded = JsonLdProcessor.expand(document);
        assertEquals(json("[{'http://example.org/list':"
                + " [{'@list': [{'@value': 'a'}, {'@value': 'b'}]}]}]"), expanded);

        final ObjectNode compacted = JsonLdProcessor.compact(expanded, context);
        assertEquals(json("{'@context': {'list': {'@id': 'http://example.org/list',"
                + " '@container': '@list'}}, 'list': ['a', 'b']}"), compacted);
    }

    @Test
    void testLoneIdNodeCompacts() throws Exception {
        final ObjectNode compacted = JsonLdProcessor.compact(
                json("{'@id': 'http://example.org/a'}"), json("{}"));

        assertEquals(json("{'@id': 'http://example.org/a'}"), compacted);
    }

    @Test
    void testListWithoutListTermKeepsListObject() throws Exception {
        final ObjectNode compacted = JsonLdProcessor.compact(
                json("{'http://example.org/list': {'@list': [1, 2]}}"),
                json("{'list': 'http://example.org/list'}"));

        assertEquals(json("{'@context': {'list': 'http://example.org/list'},"
                + " 'list': {'@list': [1, 2]}}"), compacted);
    }

    @Test
    void testRoundTrip() throws Exception {
        final JsonNode context = json("{'@vocab': 'http://example.org/',"
                + " 'knows': {'@type': '@id'}}");
        final ObjectNode document = (ObjectNode) json("{'@id': 'http://example.org/a',"
                + " '@type': 'Person', 'name': 'A', 'knows': 'http://example.org/b'}");
        document.set("@context", context);

        final ObjectNode compacted = JsonLdProcessor.compact(JsonLdProcessor.expand(document),
                context);

        assertEquals(document, compacted);
    }

    @Test
    void testLanguageMapRoundTrip() throws Exception {
        final JsonNode context = json("{'label': {'@id': 'http://example.org/label',"
                + " '@container': '@language'}}");
        final ObjectNode document = (ObjectNode) json("{'label': {'en': 'Hi', 'de': 'Hallo'}}");
        document.set("@context", context);

        final ObjectNode compacted = JsonLdProcessor.compact(JsonLdProcessor.expand(document),
                context);

        assertEquals(document, compacted);
    }

    @Test
    void testIndexMapRoundTrip() throws Exception {
        final JsonNode context = json("{'post': {'@id': 'http://example.org/post',"
                + " '@container': '@index'}}");
        final ObjectNode document = (ObjectNode) json(
                "{'post': {'en': {'@id': 'http://example.org/p1'}}}");
        document.set("@context", context);

        final ObjectNode compacted = JsonLdProcessor.compact(JsonLdProcessor.expand(document),
                context);

        assertEquals(document, compacted);
    }

    @Test
    void testCompactArraysDisabled() throws Exception {
        final JsonLdOptions opts = new JsonLdOptions("");
        opts.setCompactArrays(false);

        final ObjectNode compacted = JsonLdProcessor.compact(
                json("{'http://schema.org/name': 'Alice'}"),
                json("{'name': 'http://schema.org/name'}"), opts);

        assertEquals(json("{'@context': {'name': 'http://schema.org/name'},"
                + " '@graph': [{'name': ['Alice']}]}"), compacted);
    }

    @Test
    void testEmptyDocumentKeepsOnlyContext() throws Exception {
        final ObjectNode compacted = JsonLdProcessor.compact(json("[]"),
                json("{'name': 'http://schema.org/name'}"));

        assertEquals(json("{'@context': {'name': 'http://schema.org/name'}}"), compacted);
    }

    @Test
    void testEmptyContextIsOmitted() throws Exception {
        final ObjectNode compacted = JsonLdProcessor.compact(
                json("{'http://schema.org/name': 'Alice'}"), json("{}"));

        assertEquals(json("{'http://schema.org/name': 'Alice'}"), compacted);
    }

    @Test
    void testMultipleNodesUseGraph() throws Exception {
        final ObjectNode compacted = JsonLdProcessor.compact(json("["
                + "{'@id': 'http://example.org/a', 'http://schema.org/name': 'A'},"
                + "{'@id': 'http://example.org/b', 'http://schema.org/name': 'B'}]"),
                json("{'name': 'http://schema.org/name'}"));

        assertEquals(2, compacted.get("@graph").size());
        assertEquals("A", compacted.get("@graph").get(0).get("name").asText());
    }

    @Test
    void testRelativeIdsAgainstBase() throws Exception {
        final ObjectNode compacted = JsonLdProcessor.compact(
                json("{'@id': 'http://example.org/doc/item', 'http://schema.org/name': 'A'}"),
                json("{'name': 'http://schema.org/name'}"),
                new JsonLdOptions("http://example.org/doc/"));

        assertEquals("item", compacted.get("@id").asText());
    }

    @Test
    void testCompactIriFromPrefix() throws Exception {
        final ObjectNode compacted = JsonLdProcessor.compact(
                json("{'http://schema.org/name': 'A'}"),
                json("{'schema': 'http://schema.org/'}"));

        assertEquals("A", compacted.get("schema:name").asText());
    }

    @Test
    void testIriConfusedWithPrefix() throws Exception {
        final JsonLdError e = assertThrows(JsonLdError.class,
                () -> JsonLdProcessor.compact(
                        json("{'@id': 'ex:foo', 'http://example.org/p': 'x'}"),
                        json("{'ex': 'http://example.org/'}")));
        assertEquals(JsonLdError.Error.IRI_CONFUSED_WITH_PREFIX, e.getType());
    }

    @Test
    void testTypeAliasAndReverse() throws Exception {
        final JsonNode context = json("{'type': '@type',"
                + " 'children': {'@reverse': 'http://example.org/parent', '@type': '@id'}}");
        final ObjectNode document = (ObjectNode) json("{'@id': 'http://example.org/alice',"
                + " 'type': 'http://example.org/Person',"
                + " 'children': 'http://example.org/bob'}");
        document.set("@context", context);

        final ObjectNode compacted = JsonLdProcessor.compact(JsonLdProcessor.expand(document),
                context);

        assertEquals(document, compacted);
    }

    @Test
    void testCompactionIsDeterministic() throws Exception {
        final JsonNode input = json("{'@context': {'@vocab': 'http://example.org/'},"
                + " 'b': 1, 'a': {'c': 'x', '@type': ['T2', 'T1']}}");
        final JsonNode context = json("{'@vocab': 'http://example.org/'}");

        final ObjectNode first = JsonLdProcessor.compact(input, context);
        final ObjectNode second = JsonLdProcessor.compact(input, context);

        final Iterator<String> a = first.fieldNames();
        final Iterator<String> b = second.fieldNames();
        while (a.hasNext()) {
            assertEquals(a.next(), b.next());
        }
        assertEquals(first, second);
    }
}

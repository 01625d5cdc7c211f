package com.github.ldtransform.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Iterator;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.github.ldtransform.utils.JsonUtils;

class ExpansionTest {

    static JsonNode json(String text) throws JsonProcessingException {
        return JsonUtils.fromString(text.replace('\'', '"'));
    }

    @Test
    void testExpandNameTerm() throws Exception {
        final ArrayNode expanded = JsonLdProcessor.expand(json(
                "{'@context': {'name': 'http://schema.org/name'}, 'name': 'Alice'}"));

        assertEquals(json("[{'http://schema.org/name': [{'@value': 'Alice'}]}]"), expanded);
    }

    @Test
    void testUnmappedKeyDroppedByDefault() throws Exception {
        final ArrayNode expanded = JsonLdProcessor.expand(json(
                "{'@context': {}, 'name': 'Alice', 'http://schema.org/age': 5}"));

        assertEquals(json("[{'http://schema.org/age': [{'@value': 5}]}]"), expanded);
    }

    @Test
    void testUnmappedKeyFailsUnderStrictPolicy() throws Exception {
        final JsonLdOptions opts = new JsonLdOptions("");
        opts.setExpansionPolicy(ExpansionPolicy.STRICT);

        final JsonLdError e = assertThrows(JsonLdError.class,
                () -> JsonLdProcessor.expand(json("{'name': 'Alice'}"), opts));
        assertEquals(JsonLdError.Error.INVALID_TERM, e.getType());
    }

    @Test
    void testUnmappedKeyFailsUnderStrictestPolicy() throws Exception {
        final JsonLdOptions opts = new JsonLdOptions("");
        opts.setExpansionPolicy(ExpansionPolicy.STRICTEST);

        final JsonLdError e = assertThrows(JsonLdError.class,
                () -> JsonLdProcessor.expand(json("{'name': 'Alice'}"), opts));
        assertEquals(JsonLdError.Error.INVALID_TERM, e.getType());
    }

    @Test
    void testUnmappedKeyKeptUnderRelaxedPolicy() throws Exception {
        final JsonLdOptions opts = new JsonLdOptions("");
        opts.setExpansionPolicy(ExpansionPolicy.RELAXED);

        final ArrayNode expanded = JsonLdProcessor.expand(json("{'name': 'Alice'}"), opts);

        assertEquals(json("[{'name': [{'@value': 'Alice'}]}]"), expanded);
    }

    @Test
    void testColonKeyKeptUnderStandardPolicy() throws Exception {
        final ArrayNode expanded = JsonLdProcessor.expand(json("{'@id': 'http://example.org/a',"
                + " '1x:foo': 'v', 'name': 'dropped', 'http://example.org/p': 1}"));

        assertEquals(json("[{'@id': 'http://example.org/a', '1x:foo': [{'@value': 'v'}],"
                + " 'http://example.org/p': [{'@value': 1}]}]"), expanded);
    }

    @Test
    void testColonKeyKeptUnderStrictPolicy() throws Exception {
        final JsonLdOptions opts = new JsonLdOptions("");
        opts.setExpansionPolicy(ExpansionPolicy.STRICT);

        final ArrayNode expanded = JsonLdProcessor.expand(
                json("{'@id': 'http://example.org/a', '1x:foo': 'v'}"), opts);

        assertEquals(json("[{'@id': 'http://example.org/a', '1x:foo': [{'@value': 'v'}]}]"),
                expanded);
    }

    @Test
    void testColonKeyFailsUnderStrictestPolicy() throws Exception {
        final JsonLdOptions opts = new JsonLdOptions("");
        opts.setExpansionPolicy(ExpansionPolicy.STRICTEST);

        final JsonLdError e = assertThrows(JsonLdError.class,
                () -> JsonLdProcessor.expand(json("{'1x:foo': 'v'}"), opts));
        assertEquals(JsonLdError.Error.INVALID_TERM, e.getType());
        assertEquals(ExpansionPolicy.STRICTEST, e.getDetails().get("policy"));
    }

    @Test
    void testLoneIdNodeIsKept() throws Exception {
        final ArrayNode expanded = JsonLdProcessor.expand(json("{'@id': 'http://example.org/a'}"));

        assertEquals(json("[{'@id': 'http://example.org/a'}]"), expanded);
    }

    @Test
    void testLoneIdNodesInGraphAreKept() throws Exception {
        final ArrayNode expanded = JsonLdProcessor.expand(json("{'@graph': ["
                + "{'@id': 'http://example.org/a'}, {'@id': 'http://example.org/b'}]}"));

        assertEquals(json("[{'@id': 'http://example.org/a'}, {'@id': 'http://example.org/b'}]"),
                expanded);
    }

    @Test
    void testScalarDocumentExpandsToNothing() throws Exception {
        assertEquals(0, JsonLdProcessor.expand(json("[1, 'x']")).size());
    }

    @Test
    void testNullValueIsRejected() throws Exception {
        final JsonLdError e = assertThrows(JsonLdError.class, () -> JsonLdProcessor
                .expand(json("{'http://example.org/p': {'@value': null}}")));
        assertEquals(JsonLdError.Error.INVALID_VALUE_OBJECT_VALUE, e.getType());
    }

    @Test
    void testNullPropertyValueIsDropped() throws Exception {
        final ArrayNode expanded = JsonLdProcessor.expand(json("{'@id': 'http://example.org/a',"
                + " 'http://example.org/p': null, 'http://example.org/q': 1}"));

        assertEquals(json("[{'@id': 'http://example.org/a',"
                + " 'http://example.org/q': [{'@value': 1}]}]"), expanded);
    }

    @Test
    void testKeywordFormKeysAreReportedAsWarnings() throws Exception {
        final JsonLdOptions opts = new JsonLdOptions("");

        final ArrayNode expanded = JsonLdProcessor.expand(json("{'@id': 'http://example.org/a',"
                + " '@ignoreMe': 'x', 'http://example.org/p': 1}"), opts);

        assertEquals(json("[{'@id': 'http://example.org/a',"
                + " 'http://example.org/p': [{'@value': 1}]}]"), expanded);
        assertEquals(1, opts.getWarnings().size());
        assertTrue(opts.getWarnings().get(0).contains("@ignoreMe"));
    }

    @Test
    void testEveryPropertyValueIsAnArray() throws Exception {
        final ArrayNode expanded = JsonLdProcessor.expand(json("{'@context': {"
                + "'@vocab': 'http://example.org/', 'knows': {'@type': '@id'}},"
                + "'@id': 'http://example.org/alice', '@type': 'Person', 'name': 'Alice',"
                + "'knows': {'@id': 'http://example.org/bob', 'name': 'Bob', 'age': 42}}"));

        assertEquals(1, expanded.size());
        assertPropertiesAreArrays(expanded.get(0));
    }

    private static void assertPropertiesAreArrays(JsonNode node) {
        final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            if (field.getKey().startsWith("@") && !JsonLdConsts.TYPE.equals(field.getKey())) {
                continue;
            }
            assertTrue(field.getValue().isArray(), field.getKey() + " is not an array");
            for (final JsonNode item : field.getValue()) {
                if (item.isObject() && !item.has(JsonLdConsts.VALUE)) {
                    assertPropertiesAreArrays(item);
                }
            }
        }
    }

    @Test
    void testExpansionIsIdempotent() throws Exception {
        final ArrayNode once = JsonLdProcessor.expand(json("{'@context': {"
                + "'@vocab': 'http://example.org/', 'knows': {'@type': '@id'},"
                + "'tags': {'@container': '@set'}},"
                + "'@id': 'http://example.org/a', '@type': 'Person', 'name': 'A',"
                + "'knows': 'http://example.org/b', 'tags': ['x', 'y'], 'age': 3}"));
        final ArrayNode twice = JsonLdProcessor.expand(once);

        assertEquals(once, twice);
    }

    @Test
    void testExpansionIsDeterministic() throws Exception {
        final String doc = "{'@context': {'@vocab': 'http://example.org/'},"
                + "'b': 1, 'a': {'c': 'x', '@type': ['T2', 'T1']}, '@id': '_:n'}";

        final String first = JsonUtils.toString(JsonLdProcessor.expand(json(doc)));
        final String second = JsonUtils.toString(JsonLdProcessor.expand(json(doc)));

        assertEquals(first, second);
    }

    @Test
    void testOrderedExpansionSortsKeys() throws Exception {
        final JsonLdOptions opts = new JsonLdOptions("");
        opts.setOrdered(true);

        final ArrayNode expanded = JsonLdProcessor.expand(json("{'@context': {"
                + "'@vocab': 'http://example.org/'}, 'b': 1, 'a': 2}"), opts);

        final Iterator<String> keys = expanded.get(0).fieldNames();
        assertEquals("http://example.org/a", keys.next());
        assertEquals("http://example.org/b", keys.next());
    }

    @Test
    void testListContainer() throws Exception {
        final ArrayNode expanded = JsonLdProcessor.expand(json("{'@context': {"
                + "'list': {'@id': 'http://example.org/list', '@container': '@list'}},"
                + "'list': [1, 2]}"));

        assertEquals(json("[{'http://example.org/list':"
                + " [{'@list': [{'@value': 1}, {'@value': 2}]}]}]"), expanded);
    }

    @Test
    void testListOfListsExpandsInDefaultMode() throws Exception {
        final ArrayNode expanded = JsonLdProcessor.expand(json("{'@context': {"
                + "'l': {'@id': 'http://example.org/l', '@container': '@list'}}, 'l': [[1]]}"));

        assertEquals(json("[{'http://example.org/l':"
                + " [{'@list': [{'@list': [{'@value': 1}]}]}]}]"), expanded);
    }

    @Test
    void testListOfListsRejectedInLegacyMode() throws Exception {
        final JsonLdOptions opts = new JsonLdOptions("");
        opts.setProcessingMode(ProcessingMode.JSON_LD_1_0);

        final JsonLdError e = assertThrows(JsonLdError.class,
                () -> JsonLdProcessor.expand(json("{'@context': {"
                        + "'l': {'@id': 'http://example.org/l', '@container': '@list'}},"
                        + "'l': [[1]]}"), opts));
        assertEquals(JsonLdError.Error.LIST_OF_LISTS, e.getType());
    }

    @Test
    void testLanguageMap() throws Exception {
        final ArrayNode expanded = JsonLdProcessor.expand(json("{'@context': {"
                + "'label': {'@id': 'http://example.org/label', '@container': '@language'}},"
                + "'label': {'en': 'Hi', 'DE': 'Hallo'}}"));

        assertEquals(json("[{'http://example.org/label': ["
                + "{'@value': 'Hi', '@language': 'en'},"
                + "{'@value': 'Hallo', '@language': 'de'}]}]"), expanded);
    }

    @Test
    void testReverseProperty() throws Exception {
        final ArrayNode expanded = JsonLdProcessor.expand(json("{'@context': {"
                + "'children': {'@reverse': 'http://example.org/parent'}},"
                + "'@id': 'http://example.org/alice',"
                + "'children': {'@id': 'http://example.org/bob'}}"));

        assertEquals(json("[{'@id': 'http://example.org/alice', '@reverse': {"
                + "'http://example.org/parent': [{'@id': 'http://example.org/bob'}]}}]"),
                expanded);
    }

    @Test
    void testTypeScopedContext() throws Exception {
        final ArrayNode expanded = JsonLdProcessor.expand(json("{'@context': {"
                + "'@vocab': 'http://example.org/',"
                + "'Person': {'@context': {'name': 'http://schema.org/name'}}},"
                + "'@type': 'Person', 'name': 'A'}"));

        assertEquals(json("[{'@type': ['http://example.org/Person'],"
                + "'http://schema.org/name': [{'@value': 'A'}]}]"), expanded);
    }

    @Test
    void testNestedProperties() throws Exception {
        final ArrayNode expanded = JsonLdProcessor.expand(json("{'@context': {"
                + "'meta': '@nest',"
                + "'created': {'@id': 'http://example.org/created', '@nest': 'meta'}},"
                + "'@id': 'http://example.org/doc', 'meta': {'created': '2020'}}"));

        assertEquals(json("[{'@id': 'http://example.org/doc',"
                + "'http://example.org/created': [{'@value': '2020'}]}]"), expanded);
    }

    @Test
    void testBaseOptionResolvesIds() throws Exception {
        final ArrayNode expanded = JsonLdProcessor.expand(
                json("{'@id': 'item', 'http://example.org/p': 'x'}"),
                new JsonLdOptions("http://example.org/doc/"));

        assertEquals("http://example.org/doc/item", expanded.get(0).get("@id").asText());
    }

    @Test
    void testExpandContextOption() throws Exception {
        final JsonLdOptions opts = new JsonLdOptions("");
        opts.setExpandContext(json("{'@context': {'name': 'http://schema.org/name'}}"));

        final ArrayNode expanded = JsonLdProcessor.expand(json("{'name': 'Alice'}"), opts);

        assertEquals(json("[{'http://schema.org/name': [{'@value': 'Alice'}]}]"), expanded);
    }

    @Test
    void testTopLevelGraphIsUnwrapped() throws Exception {
        final ArrayNode expanded = JsonLdProcessor.expand(json("{'@graph': ["
                + "{'@id': 'http://example.org/a', 'http://example.org/p': 1},"
                + "{'@id': 'http://example.org/b', 'http://example.org/p': 2}]}"));

        assertEquals(2, expanded.size());
    }

    @Test
    void testFreeFloatingValuesAreDropped() throws Exception {
        final ArrayNode expanded = JsonLdProcessor.expand(json("['text', {'@value': 1}]"));

        assertEquals(0, expanded.size());
    }

    @Test
    void testTypedValueAndLanguageConflict() throws Exception {
        final JsonLdError e = assertThrows(JsonLdError.class,
                () -> JsonLdProcessor.expand(json("{'http://example.org/p': {"
                        + "'@value': 'x', '@type': 'http://example.org/t', '@language': 'en'}}")));
        assertEquals(JsonLdError.Error.INVALID_VALUE_OBJECT, e.getType());
    }

    @Test
    void testRecursionDepthIsBounded() throws Exception {
        final JsonLdOptions opts = new JsonLdOptions("");
        opts.setMaxDepth(3);

        final JsonLdError e = assertThrows(JsonLdError.class,
                () -> JsonLdProcessor.expand(json("{'http://example.org/p': {"
                        + "'http://example.org/p': {'http://example.org/p': {"
                        + "'http://example.org/p': 'x'}}}}"), opts));
        assertEquals(JsonLdError.Error.RECURSION_DEPTH_EXCEEDED, e.getType());
    }

    @Test
    void testLabelBlankNodes() throws Exception {
        final JsonLdOptions opts = new JsonLdOptions("");
        opts.setLabelBlankNodes(true);

        final ArrayNode expanded = JsonLdProcessor.expand(json("["
                + "{'@id': '_:x', 'http://example.org/p': {'@id': '_:x'}},"
                + "{'http://example.org/q': 'v'}]"), opts);

        assertEquals("_:b0", expanded.get(0).get("@id").asText());
        assertEquals("_:b0", expanded.get(0).get("http://example.org/p").get(0).get("@id").asText());
        assertEquals("_:b1", expanded.get(1).get("@id").asText());
    }

    @Test
    void testJsonLiteral() throws Exception {
        final ArrayNode expanded = JsonLdProcessor.expand(json("{'@context': {"
                + "'data': {'@id': 'http://example.org/data', '@type': '@json'}},"
                + "'data': {'a': [1, 2]}}"));

        assertEquals(json("[{'http://example.org/data':"
                + " [{'@value': {'a': [1, 2]}, '@type': '@json'}]}]"), expanded);
    }

    @Test
    void testIndexMap() throws Exception {
        final ArrayNode expanded = JsonLdProcessor.expand(json("{'@context': {"
                + "'post': {'@id': 'http://example.org/post', '@container': '@index'}},"
                + "'post': {'en': {'@id': 'http://example.org/p1'}}}"));

        assertEquals(json("[{'http://example.org/post':"
                + " [{'@id': 'http://example.org/p1', '@index': 'en'}]}]"), expanded);
    }
}

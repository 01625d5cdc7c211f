package com.github.ldtransform.utils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

class JsonLdUrlTest {

    private static final String BASE = "http://a/b/c/d;p?q";

    @ParameterizedTest
    @CsvSource({
        "g, http://a/b/c/g",
        "./g, http://a/b/c/g",
        "g/, http://a/b/c/g/",
        "/g, http://a/g",
        "//g, http://g",
        "?y, http://a/b/c/d;p?y",
        "g?y, http://a/b/c/g?y",
        "'#s', http://a/b/c/d;p?q#s",
        "g#s, http://a/b/c/g#s",
        "., http://a/b/c/",
        "./, http://a/b/c/",
        ".., http://a/b/",
        "../g, http://a/b/g",
        "../.., http://a/",
        "../../g, http://a/g",
        "../../../g, http://a/g",
        "/./g, http://a/g",
        "g., http://a/b/c/g.",
        "g/../h, http://a/b/c/h",
        "g:h, g:h"
    })
    void testResolveReferences(String reference, String expected) {
        assertEquals(expected, JsonLdUrl.resolve(BASE, reference));
    }

    @Test
    void testResolveEmptyReferenceDropsFragment() {
        assertEquals("http://a/b/c/d;p?q", JsonLdUrl.resolve(BASE + "#frag", ""));
    }

    @Test
    void testResolveWithoutBase() {
        assertEquals("relative", JsonLdUrl.resolve(null, "relative"));
    }

    @ParameterizedTest
    @CsvSource({
        "http://a/b/c, http://a/b/d, d",
        "http://a/b/c, http://a/x, ../x",
        "http://a/b/c, http://a/b/c, c",
        "http://a/b/, http://a/b/, ./",
        "http://a/b/c, http://a/b/c#frag, #frag",
        "http://a/b/c, http://a/b/c?x=1, ?x=1",
        "http://a/b/c, https://a/b/c, https://a/b/c",
        "http://a/b/c, http://other/b/c, http://other/b/c"
    })
    void testRemoveBase(String base, String iri, String expected) {
        assertEquals(expected, JsonLdUrl.removeBase(base, iri));
    }

    @Test
    void testRemoveBaseGuardsColonInFirstSegment() {
        assertEquals("./x:y", JsonLdUrl.removeBase("http://a/b/c", "http://a/b/x:y"));
    }

    @Test
    void testRemoveBaseIsInverseOfResolve() {
        final String base = "http://example.org/dir/doc";
        final String iri = "http://example.org/other/item#frag";

        assertEquals(iri, JsonLdUrl.resolve(base, JsonLdUrl.removeBase(base, iri)));
    }

    @Test
    void testParseComponents() {
        final JsonLdUrl url = JsonLdUrl.parse("http://user@host:8080/p/q?x=1#f");

        assertEquals("http", url.scheme);
        assertEquals("user@host:8080", url.authority);
        assertEquals("/p/q", url.path);
        assertEquals("x=1", url.query);
        assertEquals("f", url.fragment);
        assertNull(JsonLdUrl.parse("rel/path").scheme);
    }

    @Test
    void testAbsoluteIri() {
        assertTrue(JsonLdUrl.isAbsoluteIri("http://example.org/"));
        assertTrue(JsonLdUrl.isAbsoluteIri("urn:isbn:123"));
        assertFalse(JsonLdUrl.isAbsoluteIri("relative/path"));
        assertFalse(JsonLdUrl.isAbsoluteIri(null));
    }

    @Test
    void testRemoveDotSegments() {
        assertEquals("/a/g", JsonLdUrl.removeDotSegments("/a/b/c/./../../g"));
        assertEquals("mid/6", JsonLdUrl.removeDotSegments("mid/content=5/../6"));
    }
}

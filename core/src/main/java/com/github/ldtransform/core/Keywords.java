package com.github.ldtransform.core;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The reserved keys of the language and where each one may appear.
 */
public final class Keywords {

    private static final Pattern KEYWORD_FORM = Pattern.compile("@[a-zA-Z]+");

    private static final Set<String> KEYWORDS = unmodifiable(JsonLdConsts.BASE,
            JsonLdConsts.CONTAINER, JsonLdConsts.CONTEXT,
            JsonLdConsts.DIRECTION, JsonLdConsts.GRAPH, JsonLdConsts.ID, JsonLdConsts.IMPORT,
            JsonLdConsts.INCLUDED, JsonLdConsts.INDEX, JsonLdConsts.JSON,
            JsonLdConsts.LANGUAGE, JsonLdConsts.LIST, JsonLdConsts.NEST, JsonLdConsts.NONE,
            JsonLdConsts.PREFIX, JsonLdConsts.PROPAGATE, JsonLdConsts.PROTECTED,
            JsonLdConsts.REVERSE, JsonLdConsts.SET, JsonLdConsts.TYPE, JsonLdConsts.VALUE,
            JsonLdConsts.VERSION, JsonLdConsts.VOCAB);

    /** Keys a value object may hold once expanded. */
    static final Set<String> VALUE_OBJECT_KEYS = unmodifiable(JsonLdConsts.VALUE,
            JsonLdConsts.TYPE, JsonLdConsts.LANGUAGE, JsonLdConsts.DIRECTION,
            JsonLdConsts.INDEX);

    /** Keys allowed in an expanded term definition. */
    static final Set<String> TERM_DEFINITION_KEYS = unmodifiable(JsonLdConsts.ID,
            JsonLdConsts.REVERSE, JsonLdConsts.CONTAINER, JsonLdConsts.CONTEXT,
            JsonLdConsts.DIRECTION, JsonLdConsts.INDEX, JsonLdConsts.LANGUAGE,
            JsonLdConsts.NEST, JsonLdConsts.PREFIX, JsonLdConsts.PROTECTED, JsonLdConsts.TYPE);

    /** Keys of a local context that are not term definitions. */
    static final Set<String> CONTEXT_KEYS = unmodifiable(JsonLdConsts.BASE,
            JsonLdConsts.DIRECTION, JsonLdConsts.IMPORT, JsonLdConsts.LANGUAGE,
            JsonLdConsts.PROPAGATE, JsonLdConsts.PROTECTED, JsonLdConsts.VERSION,
            JsonLdConsts.VOCAB);

    /** Container keywords a term definition may declare. */
    static final Set<String> CONTAINER_KEYWORDS = unmodifiable(JsonLdConsts.GRAPH,
            JsonLdConsts.ID, JsonLdConsts.INDEX, JsonLdConsts.LANGUAGE, JsonLdConsts.LIST,
            JsonLdConsts.SET, JsonLdConsts.TYPE);

    private Keywords() {
    }

    private static Set<String> unmodifiable(String... values) {
        return Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(values)));
    }

    /**
     * Returns whether or not the given value is a keyword.
     *
     * @param key
     *            the value to check.
     * @return true if the value is a keyword, false if not.
     */
    public static boolean isKeyword(String key) {
        return key != null && KEYWORDS.contains(key);
    }

    /**
     * Values of the form "@" followed by one or more ALPHA characters are
     * reserved for future keywords and are ignored by both algorithms.
     */
    public static boolean hasKeywordForm(String key) {
        return key != null && KEYWORD_FORM.matcher(key).matches();
    }

    public static Set<String> all() {
        return KEYWORDS;
    }
}

package com.github.ldtransform.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Index from IRI to container to type/language marker to value to the term
 * that best compacts it. Built once per active context.
 */
public final class InverseContext {

    private final Map<String, Map<String, Map<String, Map<String, String>>>> inverse = new HashMap<String, Map<String, Map<String, Map<String, String>>>>();

    /**
     * Inverse Context Creation
     *
     * https://www.w3.org/TR/json-ld11-api/#inverse-context-creation
     */
    InverseContext(Context activeCtx) {
        // 2)
        final String defaultLanguage = activeCtx.getDefaultLanguage() == null
                ? JsonLdConsts.NONE
                : activeCtx.getDefaultLanguage().toLowerCase();
        final String defaultDirection = activeCtx.getDefaultDirection();

        // 3)
        final List<String> terms = new ArrayList<String>(activeCtx.getTermDefinitions().keySet());
        Collections.sort(terms, new Comparator<String>() {
            @Override
            public int compare(String a, String b) {
                return JsonLdUtils.compareShortestLeast(a, b);
            }
        });
        for (final String term : terms) {
            final TermDefinition definition = activeCtx.getTermDefinition(term);
            // 3.1)
            if (definition.getId() == null) {
                continue;
            }
            // 3.2)
            final String container = definition.containerKey();
            // 3.3)
            final String iri = definition.getId();
            // 3.4)
            Map<String, Map<String, Map<String, String>>> containerMap = inverse.get(iri);
            if (containerMap == null) {
                containerMap = new HashMap<String, Map<String, Map<String, String>>>();
                inverse.put(iri, containerMap);
            }
            // 3.6)
            Map<String, Map<String, String>> typeLanguageMap = containerMap.get(container);
            if (typeLanguageMap == null) {
                typeLanguageMap = new HashMap<String, Map<String, String>>();
                typeLanguageMap.put(JsonLdConsts.LANGUAGE, new HashMap<String, String>());
                typeLanguageMap.put(JsonLdConsts.TYPE, new HashMap<String, String>());
                final Map<String, String> any = new HashMap<String, String>();
                any.put(JsonLdConsts.NONE, term);
                typeLanguageMap.put(JsonLdConsts.ANY, any);
                containerMap.put(container, typeLanguageMap);
            }
            // 3.8)
            final Map<String, String> typeMap = typeLanguageMap.get(JsonLdConsts.TYPE);
            // 3.9)
            final Map<String, String> languageMap = typeLanguageMap.get(JsonLdConsts.LANGUAGE);

            // 3.10)
            if (definition.isReverse()) {
                putIfAbsent(typeMap, JsonLdConsts.REVERSE, term);
            }
            // 3.11)
            else if (JsonLdConsts.NONE.equals(definition.getTypeMapping())) {
                putIfAbsent(languageMap, JsonLdConsts.ANY, term);
                putIfAbsent(typeMap, JsonLdConsts.ANY, term);
            }
            // 3.12)
            else if (definition.getTypeMapping() != null) {
                putIfAbsent(typeMap, definition.getTypeMapping(), term);
            }
            // 3.13)
            else if (definition.hasLanguageMapping() && definition.hasDirectionMapping()) {
                final String language = definition.getLanguageMapping();
                final String direction = definition.getDirectionMapping();
                final String langDir;
                if (language != null && direction != null) {
                    langDir = (language + "_" + direction).toLowerCase();
                } else if (language != null) {
                    langDir = language.toLowerCase();
                } else if (direction != null) {
                    langDir = "_" + direction.toLowerCase();
                } else {
                    langDir = JsonLdConsts.NULL;
                }
                putIfAbsent(languageMap, langDir, term);
            }
            // 3.14)
            else if (definition.hasLanguageMapping()) {
                final String language = definition.getLanguageMapping() == null
                        ? JsonLdConsts.NULL
                        : definition.getLanguageMapping().toLowerCase();
                putIfAbsent(languageMap, language, term);
            }
            // 3.15)
            else if (definition.hasDirectionMapping()) {
                final String direction = definition.getDirectionMapping() == null
                        ? JsonLdConsts.NONE
                        : "_" + definition.getDirectionMapping().toLowerCase();
                putIfAbsent(languageMap, direction, term);
            }
            // 3.16)
            else if (defaultDirection != null) {
                final String langDir = ((activeCtx.getDefaultLanguage() == null ? ""
                        : activeCtx.getDefaultLanguage()) + "_" + defaultDirection).toLowerCase();
                putIfAbsent(languageMap, langDir, term);
                putIfAbsent(languageMap, JsonLdConsts.NONE, term);
                putIfAbsent(typeMap, JsonLdConsts.NONE, term);
            }
            // 3.17)
            else {
                putIfAbsent(languageMap, defaultLanguage, term);
                putIfAbsent(languageMap, JsonLdConsts.NONE, term);
                putIfAbsent(typeMap, JsonLdConsts.NONE, term);
            }
        }
    }

    private static void putIfAbsent(Map<String, String> map, String key, String term) {
        if (!map.containsKey(key)) {
            map.put(key, term);
        }
    }

    public boolean containsIri(String iri) {
        return inverse.containsKey(iri);
    }

    /**
     * Term Selection
     *
     * https://www.w3.org/TR/json-ld11-api/#term-selection
     *
     * @return the selected term, or null if no term matches
     */
    public String selectTerm(String iri, List<String> containers, String typeLanguage,
            List<String> preferredValues) {
        // 2)
        final Map<String, Map<String, Map<String, String>>> containerMap = inverse.get(iri);
        if (containerMap == null) {
            return null;
        }
        // 3)
        for (final String container : containers) {
            // 3.1)
            final Map<String, Map<String, String>> typeLanguageMap = containerMap.get(container);
            if (typeLanguageMap == null) {
                continue;
            }
            // 3.3)
            final Map<String, String> valueMap = typeLanguageMap.get(typeLanguage);
            if (valueMap == null) {
                continue;
            }
            // 3.4)
            for (final String item : preferredValues) {
                final String term = valueMap.get(item);
                if (term != null) {
                    return term;
                }
            }
        }
        // 4)
        return null;
    }
}

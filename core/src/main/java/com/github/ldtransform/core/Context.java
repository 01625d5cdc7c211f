package com.github.ldtransform.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.github.ldtransform.core.JsonLdError.Error;
import com.github.ldtransform.utils.JsonLdUrl;
import com.github.ldtransform.utils.JsonUtils;

/**
 * An active context: the term definitions and defaults in force at one point
 * of a document. Contexts are immutable; processing a local context against
 * one produces a new context that shares the unchanged term definitions.
 *
 * @author tristan
 *
 */
public class Context {

    private static final Logger LOG = LoggerFactory.getLogger(Context.class);

    private final JsonLdOptions options;
    private final String base;
    private final String originalBase;
    private final String vocab;
    private final String defaultLanguage;
    private final String defaultDirection;
    private final Context previousContext;
    private final Map<String, TermDefinition> termDefinitions;

    private volatile InverseContext inverse = null;

    public Context() {
        this(new JsonLdOptions());
    }

    /**
     * Creates an initial context whose base IRI is the base of the options.
     */
    public Context(JsonLdOptions options) {
        this.options = options;
        final String b = options.getBase();
        this.base = b == null || b.isEmpty() ? null : JsonLdUrl.parse(b).toString();
        this.originalBase = this.base;
        this.vocab = null;
        this.defaultLanguage = null;
        this.defaultDirection = null;
        this.previousContext = null;
        this.termDefinitions = Collections.emptyMap();
    }

    private Context(Builder b) {
        this.options = b.options;
        this.base = b.base;
        this.originalBase = b.originalBase;
        this.vocab = b.vocab;
        this.defaultLanguage = b.defaultLanguage;
        this.defaultDirection = b.defaultDirection;
        this.previousContext = b.previousContext;
        this.termDefinitions = Collections
                .unmodifiableMap(new LinkedHashMap<String, TermDefinition>(b.terms));
    }

    /**
     * Processes a local context against this one.
     *
     * @param localContext
     *            a context IRI, a context map, null or an array of those
     * @return the resulting active context
     * @throws JsonLdError
     *             if the local context is invalid or cannot be loaded
     */
    public Context parse(JsonNode localContext) throws JsonLdError {
        return new ContextProcessor(options).process(this, localContext, base);
    }

    public JsonLdOptions getOptions() {
        return options;
    }

    public String getBase() {
        return base;
    }

    public String getOriginalBase() {
        return originalBase;
    }

    public String getVocab() {
        return vocab;
    }

    public String getDefaultLanguage() {
        return defaultLanguage;
    }

    public String getDefaultDirection() {
        return defaultDirection;
    }

    /**
     * @return the context to revert to when entering a new node object, or
     *         null if this context propagates
     */
    public Context getPreviousContext() {
        return previousContext;
    }

    public Map<String, TermDefinition> getTermDefinitions() {
        return termDefinitions;
    }

    public TermDefinition getTermDefinition(String term) {
        return term == null ? null : termDefinitions.get(term);
    }

    /**
     * @return the container mapping of the term, empty if it has none
     */
    public Set<String> getContainer(String property) {
        final TermDefinition td = getTermDefinition(property);
        return td == null ? Collections.<String> emptySet() : td.getContainer();
    }

    public boolean hasContainer(String property, String keyword) {
        return getContainer(property).contains(keyword);
    }

    public String getTypeMapping(String property) {
        final TermDefinition td = getTermDefinition(property);
        return td == null ? null : td.getTypeMapping();
    }

    public boolean isReverseProperty(String property) {
        final TermDefinition td = getTermDefinition(property);
        return td != null && td.isReverse();
    }

    public boolean hasProtectedTerms() {
        for (final TermDefinition td : termDefinitions.values()) {
            if (td.isProtected()) {
                return true;
            }
        }
        return false;
    }

    /**
     * IRI Expansion
     *
     * https://www.w3.org/TR/json-ld11-api/#iri-expansion
     *
     * @param value
     *            the string to expand
     * @param relative
     *            resolve against the base IRI when nothing else applies
     * @param vocab
     *            the value is in vocabulary position
     * @return the expanded IRI, a keyword, the value unchanged, or null if
     *         the value is dropped
     */
    public String expandIri(String value, boolean relative, boolean vocab) {
        return expandIri(value, relative, vocab, termDefinitions, this.vocab, base, options);
    }

    /**
     * The part of IRI expansion that only reads already created term
     * definitions.
     */
    static String expandIri(String value, boolean relative, boolean vocab,
            Map<String, TermDefinition> terms, String vocabMapping, String base,
            JsonLdOptions options) {
        final boolean anyTermIsPrefix = options.processingMode(ProcessingMode.JSON_LD_1_0);
        // 1)
        if (value == null || Keywords.isKeyword(value)) {
            return value;
        }
        // 2)
        if (Keywords.hasKeywordForm(value)) {
            final String warning = "Ignoring " + value + " which has the form of a keyword";
            if (options.addWarning(warning)) {
                LOG.warn(warning);
            }
            return null;
        }
        final TermDefinition td = terms.get(value);
        // 4)
        if (td != null && Keywords.isKeyword(td.getId())) {
            return td.getId();
        }
        // 5)
        if (vocab && td != null) {
            return td.getId();
        }
        // 6)
        final int colon = value.indexOf(':', 1);
        if (colon > 0) {
            // 6.1)
            final String prefix = value.substring(0, colon);
            final String suffix = value.substring(colon + 1);
            // 6.2)
            if ("_".equals(prefix) || suffix.startsWith("//")) {
                return value;
            }
            // 6.4)
            final TermDefinition ptd = terms.get(prefix);
            if (ptd != null && ptd.getId() != null && (ptd.isPrefix() || anyTermIsPrefix)) {
                return ptd.getId() + suffix;
            }
            // 6.5)
            if (JsonLdUrl.isAbsoluteIri(value)) {
                return value;
            }
        }
        // 7)
        if (vocab && vocabMapping != null) {
            return vocabMapping + value;
        }
        // 8)
        if (relative) {
            return JsonLdUrl.resolve(base, value);
        }
        // 9)
        return value;
    }

    /**
     * Value Expansion
     *
     * https://www.w3.org/TR/json-ld11-api/#value-expansion
     *
     * @param activeProperty
     *            the term the value appears under
     * @param value
     *            a scalar
     * @return a value object or node reference
     */
    public ObjectNode expandValue(String activeProperty, JsonNode value) {
        final ObjectNode rval = JsonUtils.newObject();
        final TermDefinition td = getTermDefinition(activeProperty);
        final String type = td == null ? null : td.getTypeMapping();
        // 1)
        if (JsonLdConsts.ID.equals(type) && value.isTextual()) {
            rval.put(JsonLdConsts.ID, expandIri(value.asText(), true, false));
            return rval;
        }
        // 2)
        if (JsonLdConsts.VOCAB.equals(type) && value.isTextual()) {
            rval.put(JsonLdConsts.ID, expandIri(value.asText(), true, true));
            return rval;
        }
        // 3)
        rval.set(JsonLdConsts.VALUE, value);
        // 4)
        if (type != null && !JsonLdConsts.ID.equals(type) && !JsonLdConsts.VOCAB.equals(type)
                && !JsonLdConsts.NONE.equals(type)) {
            rval.put(JsonLdConsts.TYPE, type);
        }
        // 5)
        else if (value.isTextual()) {
            final String language = td != null && td.hasLanguageMapping()
                    ? td.getLanguageMapping()
                    : defaultLanguage;
            final String direction = td != null && td.hasDirectionMapping()
                    ? td.getDirectionMapping()
                    : defaultDirection;
            if (language != null) {
                rval.put(JsonLdConsts.LANGUAGE, language);
            }
            if (direction != null) {
                rval.put(JsonLdConsts.DIRECTION, direction);
            }
        }
        return rval;
    }

    /**
     * @return the inverse context, created on first use
     */
    public InverseContext getInverse() {
        InverseContext result = inverse;
        if (result == null) {
            synchronized (this) {
                result = inverse;
                if (result == null) {
                    result = inverse = new InverseContext(this);
                }
            }
        }
        return result;
    }

    public String compactIri(String iri, boolean vocab) throws JsonLdError {
        return compactIri(iri, null, vocab, false);
    }

    /**
     * IRI Compaction
     *
     * https://www.w3.org/TR/json-ld11-api/#iri-compaction
     *
     * @param iri
     *            the IRI to compact
     * @param value
     *            the value the IRI is used with, or null
     * @param vocab
     *            the IRI is in vocabulary position
     * @param reverse
     *            the value is a reverse property value
     * @return the compacted IRI
     * @throws JsonLdError
     *             if the result could be mistaken for a compact IRI
     */
    public String compactIri(String iri, JsonNode value, boolean vocab, boolean reverse)
            throws JsonLdError {
        // 1)
        if (iri == null) {
            return null;
        }
        final InverseContext inv = getInverse();
        final boolean legacy = options.processingMode(ProcessingMode.JSON_LD_1_0);

        // 4)
        if (vocab && inv.containsIri(iri)) {
            // 4.1)
            final String defaultLang;
            if (defaultDirection != null) {
                defaultLang = ((defaultLanguage == null ? "" : defaultLanguage) + "_"
                        + defaultDirection).toLowerCase();
            } else {
                defaultLang = defaultLanguage == null ? JsonLdConsts.NONE
                        : defaultLanguage.toLowerCase();
            }
            // 4.3)
            final List<String> containers = new ArrayList<String>();
            // 4.4)
            String typeLanguage = JsonLdConsts.LANGUAGE;
            String typeLanguageValue = JsonLdConsts.NULL;

            // 4.5)
            if (value != null && value.isObject() && value.has(JsonLdConsts.INDEX)
                    && !JsonLdUtils.isGraph(value)) {
                containers.add(JsonLdConsts.INDEX);
                containers.add(JsonLdConsts.INDEX + JsonLdConsts.SET);
            }

            // 4.6)
            if (reverse) {
                typeLanguage = JsonLdConsts.TYPE;
                typeLanguageValue = JsonLdConsts.REVERSE;
                containers.add(JsonLdConsts.SET);
            }
            // 4.7)
            else if (JsonLdUtils.isList(value)) {
                // 4.7.1)
                if (!value.has(JsonLdConsts.INDEX)) {
                    containers.add(JsonLdConsts.LIST);
                }
                // 4.7.2)
                final JsonNode list = value.get(JsonLdConsts.LIST);
                // 4.7.3)
                String commonType = null;
                String commonLanguage = list.size() == 0 ? defaultLang : null;
                // 4.7.4)
                for (final JsonNode item : list) {
                    String itemLanguage = JsonLdConsts.NONE;
                    String itemType = JsonLdConsts.NONE;
                    if (JsonLdUtils.isValue(item)) {
                        if (item.has(JsonLdConsts.DIRECTION)) {
                            itemLanguage = ((item.has(JsonLdConsts.LANGUAGE)
                                    ? item.get(JsonLdConsts.LANGUAGE).asText()
                                    : "") + "_" + item.get(JsonLdConsts.DIRECTION).asText())
                                            .toLowerCase();
                        } else if (item.has(JsonLdConsts.LANGUAGE)) {
                            itemLanguage = item.get(JsonLdConsts.LANGUAGE).asText().toLowerCase();
                        } else if (item.has(JsonLdConsts.TYPE)) {
                            itemType = item.get(JsonLdConsts.TYPE).asText();
                        } else {
                            itemLanguage = JsonLdConsts.NULL;
                        }
                    } else {
                        itemType = JsonLdConsts.ID;
                    }
                    if (commonLanguage == null) {
                        commonLanguage = itemLanguage;
                    } else if (!commonLanguage.equals(itemLanguage) && JsonLdUtils.isValue(item)) {
                        commonLanguage = JsonLdConsts.NONE;
                    }
                    if (commonType == null) {
                        commonType = itemType;
                    } else if (!commonType.equals(itemType)) {
                        commonType = JsonLdConsts.NONE;
                    }
                    if (JsonLdConsts.NONE.equals(commonLanguage)
                            && JsonLdConsts.NONE.equals(commonType)) {
                        break;
                    }
                }
                // 4.7.5)
                if (commonLanguage == null) {
                    commonLanguage = JsonLdConsts.NONE;
                }
                if (commonType == null) {
                    commonType = JsonLdConsts.NONE;
                }
                // 4.7.6)
                if (!JsonLdConsts.NONE.equals(commonType)) {
                    typeLanguage = JsonLdConsts.TYPE;
                    typeLanguageValue = commonType;
                } else {
                    typeLanguageValue = commonLanguage;
                }
            }
            // 4.8)
            else if (JsonLdUtils.isGraph(value)) {
                if (value.has(JsonLdConsts.INDEX)) {
                    containers.add(JsonLdConsts.GRAPH + JsonLdConsts.INDEX);
                    containers.add(JsonLdConsts.GRAPH + JsonLdConsts.INDEX + JsonLdConsts.SET);
                }
                if (value.has(JsonLdConsts.ID)) {
                    containers.add(JsonLdConsts.GRAPH + JsonLdConsts.ID);
                    containers.add(JsonLdConsts.GRAPH + JsonLdConsts.ID + JsonLdConsts.SET);
                }
                containers.add(JsonLdConsts.GRAPH);
                containers.add(JsonLdConsts.GRAPH + JsonLdConsts.SET);
                containers.add(JsonLdConsts.SET);
                if (!value.has(JsonLdConsts.INDEX)) {
                    containers.add(JsonLdConsts.GRAPH + JsonLdConsts.INDEX);
                    containers.add(JsonLdConsts.GRAPH + JsonLdConsts.INDEX + JsonLdConsts.SET);
                }
                if (!value.has(JsonLdConsts.ID)) {
                    containers.add(JsonLdConsts.GRAPH + JsonLdConsts.ID);
                    containers.add(JsonLdConsts.GRAPH + JsonLdConsts.ID + JsonLdConsts.SET);
                }
                containers.add(JsonLdConsts.INDEX);
                containers.add(JsonLdConsts.INDEX + JsonLdConsts.SET);
                typeLanguage = JsonLdConsts.TYPE;
                typeLanguageValue = JsonLdConsts.ID;
            }
            // 4.9)
            else {
                // 4.9.1)
                if (JsonLdUtils.isValue(value)) {
                    if (value.has(JsonLdConsts.DIRECTION) && !value.has(JsonLdConsts.INDEX)) {
                        typeLanguageValue = ((value.has(JsonLdConsts.LANGUAGE)
                                ? value.get(JsonLdConsts.LANGUAGE).asText()
                                : "") + "_" + value.get(JsonLdConsts.DIRECTION).asText())
                                        .toLowerCase();
                        containers.add(JsonLdConsts.LANGUAGE);
                        containers.add(JsonLdConsts.LANGUAGE + JsonLdConsts.SET);
                    } else if (value.has(JsonLdConsts.LANGUAGE) && !value.has(JsonLdConsts.INDEX)) {
                        typeLanguageValue = value.get(JsonLdConsts.LANGUAGE).asText().toLowerCase();
                        containers.add(JsonLdConsts.LANGUAGE);
                        containers.add(JsonLdConsts.LANGUAGE + JsonLdConsts.SET);
                    } else if (value.has(JsonLdConsts.TYPE)) {
                        typeLanguage = JsonLdConsts.TYPE;
                        typeLanguageValue = value.get(JsonLdConsts.TYPE).asText();
                    }
                }
                // 4.9.2)
                else {
                    typeLanguage = JsonLdConsts.TYPE;
                    typeLanguageValue = JsonLdConsts.ID;
                    containers.add(JsonLdConsts.ID);
                    containers.add(JsonLdConsts.ID + JsonLdConsts.SET);
                    containers.add(JsonLdConsts.TYPE);
                    containers.add(JsonLdConsts.SET + JsonLdConsts.TYPE);
                }
                // 4.9.3)
                containers.add(JsonLdConsts.SET);
            }

            // 4.10)
            containers.add(JsonLdConsts.NONE);
            if (!legacy) {
                // 4.11)
                if (value == null || !value.isObject() || !value.has(JsonLdConsts.INDEX)) {
                    containers.add(JsonLdConsts.INDEX);
                    containers.add(JsonLdConsts.INDEX + JsonLdConsts.SET);
                }
                // 4.12)
                if (JsonLdUtils.isValue(value) && value.size() == 1) {
                    containers.add(JsonLdConsts.LANGUAGE);
                    containers.add(JsonLdConsts.LANGUAGE + JsonLdConsts.SET);
                }
            }

            // 4.14)
            final List<String> preferredValues = new ArrayList<String>();
            // 4.15)
            if (JsonLdConsts.REVERSE.equals(typeLanguageValue)) {
                preferredValues.add(JsonLdConsts.REVERSE);
            }
            // 4.16)
            if ((JsonLdConsts.REVERSE.equals(typeLanguageValue)
                    || JsonLdConsts.ID.equals(typeLanguageValue)) && value != null
                    && value.isObject() && value.has(JsonLdConsts.ID)) {
                final String id = value.get(JsonLdConsts.ID).asText();
                final TermDefinition td = getTermDefinition(compactIri(id, null, true, false));
                if (td != null && id.equals(td.getId())) {
                    preferredValues.add(JsonLdConsts.VOCAB);
                    preferredValues.add(JsonLdConsts.ID);
                    preferredValues.add(JsonLdConsts.NONE);
                } else {
                    preferredValues.add(JsonLdConsts.ID);
                    preferredValues.add(JsonLdConsts.VOCAB);
                    preferredValues.add(JsonLdConsts.NONE);
                }
            }
            // 4.17)
            else {
                preferredValues.add(typeLanguageValue);
                preferredValues.add(JsonLdConsts.NONE);
                if (JsonLdUtils.isList(value) && value.get(JsonLdConsts.LIST).size() == 0) {
                    typeLanguage = JsonLdConsts.ANY;
                }
            }
            // 4.18)
            preferredValues.add(JsonLdConsts.ANY);
            // 4.19)
            for (final String pv : new ArrayList<String>(preferredValues)) {
                final int idx = pv.indexOf('_');
                if (idx >= 0) {
                    preferredValues.add(pv.substring(idx));
                    break;
                }
            }

            // 4.20)
            final String term = inv.selectTerm(iri, containers, typeLanguage, preferredValues);
            // 4.21)
            if (term != null) {
                return term;
            }
        }

        // 5)
        if (vocab && this.vocab != null) {
            if (iri.startsWith(this.vocab) && iri.length() > this.vocab.length()) {
                final String suffix = iri.substring(this.vocab.length());
                if (!termDefinitions.containsKey(suffix)) {
                    return suffix;
                }
            }
        }

        // 6)
        String compactIri = null;
        // 7)
        for (final Map.Entry<String, TermDefinition> entry : termDefinitions.entrySet()) {
            final String term = entry.getKey();
            final TermDefinition td = entry.getValue();
            final String termIri = td.getId();
            // 7.1)
            if (termIri == null || termIri.equals(iri) || !iri.startsWith(termIri)) {
                continue;
            }
            if (legacy ? term.contains(":") : !td.isPrefix()) {
                continue;
            }
            // 7.2)
            final String candidate = term + ":" + iri.substring(termIri.length());
            // 7.3)
            final TermDefinition candidateDef = termDefinitions.get(candidate);
            final boolean better = compactIri == null
                    || JsonLdUtils.compareShortestLeast(candidate, compactIri) < 0;
            if (better && (candidateDef == null
                    || (iri.equals(candidateDef.getId()) && value == null))) {
                compactIri = candidate;
            }
        }
        // 8)
        if (compactIri != null) {
            return compactIri;
        }

        // 9)
        final int colon = iri.indexOf(':');
        if (colon > 0 && !iri.startsWith("//", colon + 1)) {
            final TermDefinition td = termDefinitions.get(iri.substring(0, colon));
            if (td != null && td.isPrefix()) {
                throw new JsonLdError(Error.IRI_CONFUSED_WITH_PREFIX, iri);
            }
        }

        // 10)
        if (!vocab && options.getCompactToRelative()) {
            return JsonLdUrl.removeBase(base, iri);
        }
        // 11)
        return iri;
    }

    /**
     * Value Compaction
     *
     * https://www.w3.org/TR/json-ld11-api/#value-compaction
     *
     * @param activeProperty
     *            the term the value appears under
     * @param value
     *            an expanded value object or node reference
     * @return a scalar when the value can be reduced to one, otherwise the
     *         value with its keys compacted
     */
    public JsonNode compactValue(String activeProperty, ObjectNode value) throws JsonLdError {
        final TermDefinition td = getTermDefinition(activeProperty);
        final String typeMapping = td == null ? null : td.getTypeMapping();
        // 3)
        final String language = td != null && td.hasLanguageMapping() ? td.getLanguageMapping()
                : defaultLanguage;
        // 4)
        final String direction = td != null && td.hasDirectionMapping()
                ? td.getDirectionMapping()
                : defaultDirection;
        final boolean preserveIndex = value.has(JsonLdConsts.INDEX)
                && !getContainer(activeProperty).contains(JsonLdConsts.INDEX);

        // 5)
        if (value.has(JsonLdConsts.ID) && (value.size() == 1
                || (value.size() == 2 && value.has(JsonLdConsts.INDEX) && !preserveIndex))) {
            final String id = value.get(JsonLdConsts.ID).asText();
            if (JsonLdConsts.ID.equals(typeMapping)) {
                return TextNode.valueOf(compactIri(id, null, false, false));
            }
            if (JsonLdConsts.VOCAB.equals(typeMapping)) {
                return TextNode.valueOf(compactIri(id, null, true, false));
            }
        } else if (value.has(JsonLdConsts.VALUE) && !preserveIndex) {
            final JsonNode v = value.get(JsonLdConsts.VALUE);
            final JsonNode type = value.get(JsonLdConsts.TYPE);
            // 6)
            if (type != null) {
                if (type.isTextual() && type.asText().equals(typeMapping)) {
                    return v;
                }
            }
            // 7)
            else if (typeMapping == null) {
                // 8)
                if (!v.isTextual()) {
                    return v;
                }
                // 9)
                final String valueLanguage = value.has(JsonLdConsts.LANGUAGE)
                        ? value.get(JsonLdConsts.LANGUAGE).asText()
                        : null;
                final String valueDirection = value.has(JsonLdConsts.DIRECTION)
                        ? value.get(JsonLdConsts.DIRECTION).asText()
                        : null;
                final boolean languageMatches = language == null ? valueLanguage == null
                        : language.equalsIgnoreCase(valueLanguage);
                final boolean directionMatches = direction == null ? valueDirection == null
                        : direction.equals(valueDirection);
                if (languageMatches && directionMatches) {
                    return v;
                }
            }
        }

        // 10)
        final ObjectNode rval = JsonUtils.newObject();
        final Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            final String key = field.getKey();
            if (JsonLdConsts.INDEX.equals(key) && !preserveIndex) {
                continue;
            }
            JsonNode v = field.getValue();
            if (JsonLdConsts.TYPE.equals(key) && v.isTextual()) {
                v = TextNode.valueOf(compactIri(v.asText(), null, true, false));
            } else if (JsonLdConsts.ID.equals(key) && v.isTextual()) {
                v = TextNode.valueOf(compactIri(v.asText(), null, false, false));
            }
            rval.set(compactIri(key, null, true, false), v);
        }
        return rval;
    }

    @Override
    public String toString() {
        return "Context{base=" + base + ", vocab=" + vocab + ", language=" + defaultLanguage
                + ", direction=" + defaultDirection + ", terms=" + termDefinitions.keySet()
                + (previousContext == null ? "" : ", non-propagated") + "}";
    }

    Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * A mutable working copy used while a local context is processed.
     */
    static final class Builder {
        private final JsonLdOptions options;
        String base;
        String originalBase;
        String vocab;
        String defaultLanguage;
        String defaultDirection;
        Context previousContext;
        final Map<String, TermDefinition> terms;

        private Builder(Context from) {
            this.options = from.options;
            this.base = from.base;
            this.originalBase = from.originalBase;
            this.vocab = from.vocab;
            this.defaultLanguage = from.defaultLanguage;
            this.defaultDirection = from.defaultDirection;
            this.previousContext = from.previousContext;
            this.terms = new LinkedHashMap<String, TermDefinition>(from.termDefinitions);
        }

        JsonLdOptions options() {
            return options;
        }

        boolean hasProtectedTerms() {
            for (final TermDefinition td : terms.values()) {
                if (td.isProtected()) {
                    return true;
                }
            }
            return false;
        }

        Context build() {
            return new Context(this);
        }
    }
}

package com.github.ldtransform.core;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.ldtransform.core.JsonLdError.Error;
import com.github.ldtransform.utils.JsonLdUrl;
import com.github.ldtransform.utils.JsonUtils;

/**
 * Runs the context processing algorithms for one expansion or compaction.
 * Remote contexts are dereferenced at most once per processor.
 */
class ContextProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(ContextProcessor.class);

    private static final BigDecimal VERSION_1_1 = new BigDecimal("1.1");

    private final JsonLdOptions options;
    private final Map<String, RemoteDocument> dereferenced = new HashMap<String, RemoteDocument>();

    ContextProcessor(JsonLdOptions options) {
        this.options = options;
    }

    private boolean legacy() {
        return options.processingMode(ProcessingMode.JSON_LD_1_0);
    }

    Context process(Context activeCtx, JsonNode localContext, String baseUrl)
            throws JsonLdError {
        return process(activeCtx, localContext, baseUrl, new ArrayList<String>(), false, true,
                true);
    }

    Context process(Context activeCtx, JsonNode localContext, String baseUrl,
            boolean overrideProtected, boolean propagate) throws JsonLdError {
        return process(activeCtx, localContext, baseUrl, new ArrayList<String>(),
                overrideProtected, propagate, true);
    }

    /**
     * Context Processing Algorithm
     *
     * https://www.w3.org/TR/json-ld11-api/#context-processing-algorithm
     *
     * @param activeCtx
     *            the context the local context is applied to
     * @param localContext
     *            a context IRI, a context map, null or an array of those
     * @param baseUrl
     *            the IRI relative context references resolve against
     * @param remoteContexts
     *            the remote contexts currently being resolved, outermost
     *            first
     * @param overrideProtected
     *            allow protected terms to be redefined or cleared
     * @param propagate
     *            false if the result applies to the current node object only
     * @param validateScopedContext
     *            false while a scoped context is only being validated
     * @return the new active context
     */
    Context process(Context activeCtx, JsonNode localContext, String baseUrl,
            List<String> remoteContexts, boolean overrideProtected, boolean propagate,
            boolean validateScopedContext) throws JsonLdError {
        // 1)
        Context.Builder result = activeCtx.toBuilder();

        // 2)
        if (localContext != null && localContext.isObject()
                && localContext.has(JsonLdConsts.PROPAGATE)) {
            final JsonNode p = localContext.get(JsonLdConsts.PROPAGATE);
            if (!p.isBoolean()) {
                throw new JsonLdError(Error.INVALID_PROPAGATE_VALUE, p);
            }
            propagate = p.booleanValue();
        }

        // 3)
        if (!propagate && result.previousContext == null) {
            result.previousContext = activeCtx;
        }

        // 4)
        final List<JsonNode> contexts = new ArrayList<JsonNode>();
        if (localContext != null && localContext.isArray()) {
            for (final JsonNode c : localContext) {
                contexts.add(c);
            }
        } else {
            contexts.add(localContext);
        }

        // 5)
        for (JsonNode context : contexts) {
            // 5.1)
            if (context == null || context.isNull()) {
                // 5.1.1)
                if (!overrideProtected && result.hasProtectedTerms()) {
                    throw new JsonLdError(Error.INVALID_CONTEXT_NULLIFICATION,
                            "Cannot clear a context holding protected terms");
                }
                // 5.1.2)
                final Context.Builder fresh = new Context(options).toBuilder();
                fresh.base = activeCtx.getOriginalBase();
                fresh.originalBase = activeCtx.getOriginalBase();
                if (!propagate) {
                    fresh.previousContext = result.build();
                }
                result = fresh;
                continue;
            }

            // 5.2)
            if (context.isTextual()) {
                // 5.2.1)
                final String url = JsonLdUrl.resolve(baseUrl, context.asText());
                if (!JsonLdUrl.isAbsoluteIri(url)) {
                    throw new JsonLdError(Error.LOADING_DOCUMENT_FAILED,
                            "Context reference does not resolve to an IRI: " + context.asText());
                }
                // 5.2.2)
                if (!validateScopedContext && remoteContexts.contains(url)) {
                    continue;
                }
                // 5.2.3)
                if (remoteContexts.contains(url)) {
                    throw new JsonLdError(Error.RECURSIVE_CONTEXT_INCLUSION, url)
                            .setDetail("chain", new ArrayList<String>(remoteContexts));
                }
                if (remoteContexts.size() >= JsonLdOptions.MAX_REMOTE_CONTEXTS) {
                    throw new JsonLdError(Error.CONTEXT_OVERFLOW, url).setDetail("limit",
                            JsonLdOptions.MAX_REMOTE_CONTEXTS);
                }
                // 5.2.4)
                final RemoteDocument remote = loadContext(url);
                final List<String> chain = new ArrayList<String>(remoteContexts);
                chain.add(url);
                // 5.2.5)
                result = process(result.build(), remote.getDocument().get(JsonLdConsts.CONTEXT),
                        remote.getDocumentUrl(), chain, false, true, validateScopedContext)
                                .toBuilder();
                // 5.2.6)
                continue;
            }

            // 5.3)
            if (!context.isObject()) {
                throw new JsonLdError(Error.INVALID_LOCAL_CONTEXT, context);
            }

            // 5.5)
            if (context.has(JsonLdConsts.VERSION)) {
                final JsonNode version = context.get(JsonLdConsts.VERSION);
                // 5.5.1)
                if (!version.isNumber() || version.decimalValue().compareTo(VERSION_1_1) != 0) {
                    throw new JsonLdError(Error.INVALID_VERSION_VALUE, version);
                }
                // 5.5.2)
                if (legacy()) {
                    throw new JsonLdError(Error.PROCESSING_MODE_CONFLICT,
                            "@version 1.1 used in json-ld-1.0 mode");
                }
            }

            // 5.6)
            if (context.has(JsonLdConsts.IMPORT)) {
                context = importContext(baseUrl, (ObjectNode) context);
            }

            // 5.7)
            if (context.has(JsonLdConsts.BASE) && remoteContexts.isEmpty()) {
                final JsonNode value = context.get(JsonLdConsts.BASE);
                if (value.isNull()) {
                    result.base = null;
                } else if (!value.isTextual()) {
                    throw new JsonLdError(Error.INVALID_BASE_IRI, value);
                } else if (JsonLdUrl.isAbsoluteIri(value.asText())) {
                    result.base = value.asText();
                } else if (result.base != null) {
                    result.base = JsonLdUrl.resolve(result.base, value.asText());
                } else {
                    throw new JsonLdError(Error.INVALID_BASE_IRI,
                            "Relative @base without a base IRI: " + value.asText());
                }
            }

            // 5.8)
            if (context.has(JsonLdConsts.VOCAB)) {
                final JsonNode value = context.get(JsonLdConsts.VOCAB);
                if (value.isNull()) {
                    result.vocab = null;
                } else if (!value.isTextual()) {
                    throw new JsonLdError(Error.INVALID_VOCAB_MAPPING, value);
                } else {
                    final String vocab = Context.expandIri(value.asText(), true, true,
                            result.terms, result.vocab, result.base, options);
                    if (legacy() && !JsonLdUrl.isAbsoluteIri(vocab)
                            && !JsonLdUtils.isBlankNodeId(vocab)) {
                        throw new JsonLdError(Error.INVALID_VOCAB_MAPPING, value);
                    }
                    result.vocab = vocab;
                }
            }

            // 5.9)
            if (context.has(JsonLdConsts.LANGUAGE)) {
                final JsonNode value = context.get(JsonLdConsts.LANGUAGE);
                if (value.isNull()) {
                    result.defaultLanguage = null;
                } else if (value.isTextual()) {
                    result.defaultLanguage = value.asText().toLowerCase();
                } else {
                    throw new JsonLdError(Error.INVALID_DEFAULT_LANGUAGE, value);
                }
            }

            // 5.10)
            if (context.has(JsonLdConsts.DIRECTION)) {
                if (legacy()) {
                    throw new JsonLdError(Error.INVALID_CONTEXT_ENTRY, JsonLdConsts.DIRECTION);
                }
                final JsonNode value = context.get(JsonLdConsts.DIRECTION);
                if (value.isNull()) {
                    result.defaultDirection = null;
                } else if (isDirection(value)) {
                    result.defaultDirection = value.asText();
                } else {
                    throw new JsonLdError(Error.INVALID_BASE_DIRECTION, value);
                }
            }

            // 5.11)
            if (context.has(JsonLdConsts.PROPAGATE)) {
                if (legacy()) {
                    throw new JsonLdError(Error.INVALID_CONTEXT_ENTRY, JsonLdConsts.PROPAGATE);
                }
                if (!context.get(JsonLdConsts.PROPAGATE).isBoolean()) {
                    throw new JsonLdError(Error.INVALID_PROPAGATE_VALUE,
                            context.get(JsonLdConsts.PROPAGATE));
                }
            }

            boolean protectedFlag = false;
            if (context.has(JsonLdConsts.PROTECTED)) {
                final JsonNode value = context.get(JsonLdConsts.PROTECTED);
                if (!value.isBoolean()) {
                    throw new JsonLdError(Error.INVALID_PROTECTED_VALUE, value);
                }
                protectedFlag = value.booleanValue();
            }

            // 5.12)
            final Scope scope = new Scope((ObjectNode) context, baseUrl, protectedFlag,
                    overrideProtected, remoteContexts);

            // 5.13)
            final Iterator<String> keys = context.fieldNames();
            while (keys.hasNext()) {
                final String key = keys.next();
                if (!Keywords.CONTEXT_KEYS.contains(key)) {
                    createTermDefinition(result, scope, key);
                }
            }
        }

        // 6)
        return result.build();
    }

    /**
     * Merges the context referenced by {@code @import} under the entries of
     * the importing context.
     */
    private ObjectNode importContext(String baseUrl, ObjectNode context) throws JsonLdError {
        // 5.6.1)
        if (legacy()) {
            throw new JsonLdError(Error.INVALID_CONTEXT_ENTRY, JsonLdConsts.IMPORT);
        }
        // 5.6.2)
        final JsonNode value = context.get(JsonLdConsts.IMPORT);
        if (!value.isTextual()) {
            throw new JsonLdError(Error.INVALID_IMPORT_VALUE, value);
        }
        // 5.6.3)
        final String url = JsonLdUrl.resolve(baseUrl, value.asText());
        // 5.6.4)
        final RemoteDocument remote = loadContext(url);
        // 5.6.6)
        final JsonNode imported = remote.getDocument().get(JsonLdConsts.CONTEXT);
        if (!imported.isObject()) {
            throw new JsonLdError(Error.INVALID_REMOTE_CONTEXT,
                    "Imported context is not a map: " + url);
        }
        // 5.6.7)
        if (imported.has(JsonLdConsts.IMPORT)) {
            throw new JsonLdError(Error.INVALID_CONTEXT_ENTRY,
                    "Imported context itself has an @import: " + url);
        }
        // 5.6.8)
        final ObjectNode merged = ((ObjectNode) imported).deepCopy();
        merged.setAll(context);
        merged.remove(JsonLdConsts.IMPORT);
        return merged;
    }

    /**
     * Dereferences a context document, reusing documents already loaded by
     * this processor.
     */
    private RemoteDocument loadContext(String url) throws JsonLdError {
        final RemoteDocument cached = dereferenced.get(url);
        if (cached != null) {
            LOG.debug("Using already dereferenced context {}", url);
            return cached;
        }
        LOG.debug("Loading remote context {}", url);
        final RemoteDocument remote;
        try {
            remote = options.getDocumentLoader().loadDocument(url);
        } catch (final JsonLdError e) {
            throw new JsonLdError(Error.LOADING_REMOTE_CONTEXT_FAILED, url, e)
                    .setDetail("reason", e.getType().toString());
        }
        final JsonNode document = remote.getDocument();
        if (document == null || !document.isObject() || !document.has(JsonLdConsts.CONTEXT)) {
            throw new JsonLdError(Error.INVALID_REMOTE_CONTEXT,
                    "Remote document has no top-level @context: " + url);
        }
        dereferenced.put(url, remote);
        return remote;
    }

    /**
     * Create Term Definition
     *
     * https://www.w3.org/TR/json-ld11-api/#create-term-definition
     */
    private void createTermDefinition(Context.Builder result, Scope scope, String term)
            throws JsonLdError {
        final Map<String, Boolean> defined = scope.defined;
        // 1)
        if (defined.containsKey(term)) {
            if (Boolean.TRUE.equals(defined.get(term))) {
                return;
            }
            throw new JsonLdError(Error.CYCLIC_IRI_MAPPING, term);
        }
        // 2)
        if (term.isEmpty()) {
            throw new JsonLdError(Error.INVALID_TERM_DEFINITION, "The empty string is not a term");
        }
        defined.put(term, false);

        // 3)
        final JsonNode value = scope.local.get(term);

        // 4)
        if (JsonLdConsts.TYPE.equals(term)) {
            if (legacy() || !isTypeKeywordDefinition(value)) {
                throw new JsonLdError(Error.KEYWORD_REDEFINITION, term);
            }
        } else if (Keywords.isKeyword(term)) {
            throw new JsonLdError(Error.KEYWORD_REDEFINITION, term);
        } else if (Keywords.hasKeywordForm(term)) {
            warn("Ignoring term " + term + " which has the form of a keyword");
            defined.put(term, true);
            return;
        }

        // 5)
        final TermDefinition previous = result.terms.remove(term);

        // 6-8)
        final ObjectNode def;
        boolean simpleTerm = false;
        if (value == null || value.isNull()) {
            def = JsonUtils.newObject();
            def.putNull(JsonLdConsts.ID);
        } else if (value.isTextual()) {
            def = JsonUtils.newObject();
            def.set(JsonLdConsts.ID, value);
            simpleTerm = true;
        } else if (value.isObject()) {
            def = (ObjectNode) value;
        } else {
            throw new JsonLdError(Error.INVALID_TERM_DEFINITION, term)
                    .setDetail("definition", value);
        }

        // 9)
        final TermDefinition.Builder definition = TermDefinition.builder()
                .protectedTerm(scope.protectedFlag);

        // 10)
        if (def.has(JsonLdConsts.PROTECTED)) {
            if (legacy()) {
                throw new JsonLdError(Error.INVALID_TERM_DEFINITION, term);
            }
            final JsonNode p = def.get(JsonLdConsts.PROTECTED);
            if (!p.isBoolean()) {
                throw new JsonLdError(Error.INVALID_PROTECTED_VALUE, p);
            }
            definition.protectedTerm(p.booleanValue());
        }

        // 11)
        if (def.has(JsonLdConsts.TYPE)) {
            final JsonNode type = def.get(JsonLdConsts.TYPE);
            // 11.1)
            if (!type.isTextual()) {
                throw new JsonLdError(Error.INVALID_TYPE_MAPPING, type);
            }
            // 11.2)
            final String expanded = expandIri(result, scope, type.asText(), false, true);
            // 11.3)
            if (legacy() && (JsonLdConsts.NONE.equals(expanded)
                    || JsonLdConsts.JSON.equals(expanded))) {
                throw new JsonLdError(Error.INVALID_TYPE_MAPPING, expanded);
            }
            if (!JsonLdConsts.ID.equals(expanded) && !JsonLdConsts.JSON.equals(expanded)
                    && !JsonLdConsts.NONE.equals(expanded)
                    && !JsonLdConsts.VOCAB.equals(expanded)
                    && !JsonLdUrl.isAbsoluteIri(expanded)) {
                throw new JsonLdError(Error.INVALID_TYPE_MAPPING, type);
            }
            // 11.4)
            definition.typeMapping(expanded);
        }

        // 12)
        if (def.has(JsonLdConsts.REVERSE)) {
            // 12.1)
            if (def.has(JsonLdConsts.ID) || def.has(JsonLdConsts.NEST)) {
                throw new JsonLdError(Error.INVALID_REVERSE_PROPERTY, term);
            }
            // 12.2)
            final JsonNode reverse = def.get(JsonLdConsts.REVERSE);
            if (!reverse.isTextual()) {
                throw new JsonLdError(Error.INVALID_IRI_MAPPING, reverse);
            }
            // 12.3)
            if (Keywords.hasKeywordForm(reverse.asText())) {
                warn("Ignoring @reverse " + reverse.asText() + " of term " + term
                        + " which has the form of a keyword");
                defined.put(term, true);
                return;
            }
            // 12.4)
            final String id = expandIri(result, scope, reverse.asText(), false, true);
            if (!JsonLdUrl.isAbsoluteIri(id) && !JsonLdUtils.isBlankNodeId(id)) {
                throw new JsonLdError(Error.INVALID_IRI_MAPPING, reverse);
            }
            definition.id(id);
            // 12.5)
            if (def.has(JsonLdConsts.CONTAINER)) {
                final JsonNode container = def.get(JsonLdConsts.CONTAINER);
                if (container.isTextual() && (JsonLdConsts.SET.equals(container.asText())
                        || JsonLdConsts.INDEX.equals(container.asText()))) {
                    definition.container(container.asText());
                } else if (!container.isNull()) {
                    throw new JsonLdError(Error.INVALID_REVERSE_PROPERTY, container);
                }
            }
            // 12.6)
            definition.reverse(true);
            // 12.7)
            finish(result, scope, term, previous, definition.build());
            return;
        }

        // 13)
        final JsonNode idValue = def.get(JsonLdConsts.ID);
        if (idValue != null && !(idValue.isTextual() && term.equals(idValue.asText()))) {
            // 13.1)
            if (idValue.isNull()) {
                definition.id(null);
            } else {
                // 13.2)
                if (!idValue.isTextual()) {
                    throw new JsonLdError(Error.INVALID_IRI_MAPPING, idValue);
                }
                final String idString = idValue.asText();
                // 13.3)
                if (!Keywords.isKeyword(idString) && Keywords.hasKeywordForm(idString)) {
                    warn("Ignoring @id " + idString + " of term " + term
                            + " which has the form of a keyword");
                    defined.put(term, true);
                    return;
                }
                // 13.4)
                final String id = expandIri(result, scope, idString, false, true);
                if (!Keywords.isKeyword(id) && !JsonLdUrl.isAbsoluteIri(id)
                        && !JsonLdUtils.isBlankNodeId(id)) {
                    throw new JsonLdError(Error.INVALID_IRI_MAPPING, idValue);
                }
                if (JsonLdConsts.CONTEXT.equals(id)) {
                    throw new JsonLdError(Error.INVALID_KEYWORD_ALIAS, term);
                }
                definition.id(id);
                // 13.5)
                final int colon = term.indexOf(':', 1);
                if ((colon > 0 && colon < term.length() - 1) || term.contains("/")) {
                    defined.put(term, true);
                    final String termIri = expandIri(result, scope, term, false, true);
                    if (!id.equals(termIri)) {
                        throw new JsonLdError(Error.INVALID_IRI_MAPPING, term).setDetail("iri",
                                id);
                    }
                }
                // 13.6)
                if (!term.contains(":") && !term.contains("/") && simpleTerm
                        && (endsWithGenDelim(id) || JsonLdUtils.isBlankNodeId(id))) {
                    definition.prefix(true);
                }
            }
        }
        // 14)
        else if (term.indexOf(':', 1) > 0) {
            final int colon = term.indexOf(':', 1);
            final String prefix = term.substring(0, colon);
            final String suffix = term.substring(colon + 1);
            if ("_".equals(prefix) || suffix.startsWith("//")) {
                definition.id(term);
            } else {
                // 14.1)
                if (scope.local.has(prefix)) {
                    createTermDefinition(result, scope, prefix);
                }
                // 14.2)
                final TermDefinition prefixDef = result.terms.get(prefix);
                if (prefixDef != null && prefixDef.getId() != null) {
                    definition.id(prefixDef.getId() + suffix);
                }
                // 14.3)
                else {
                    definition.id(term);
                }
            }
        }
        // 15)
        else if (term.contains("/")) {
            final String id = expandIri(result, scope, term, false, true);
            if (!JsonLdUrl.isAbsoluteIri(id)) {
                throw new JsonLdError(Error.INVALID_IRI_MAPPING, term);
            }
            definition.id(id);
        }
        // 16)
        else if (JsonLdConsts.TYPE.equals(term)) {
            definition.id(JsonLdConsts.TYPE);
        }
        // 17)
        else if (result.vocab != null) {
            definition.id(result.vocab + term);
        } else {
            throw new JsonLdError(Error.INVALID_IRI_MAPPING,
                    "Relative term definition without vocab mapping: " + term);
        }

        // 18)
        if (def.has(JsonLdConsts.CONTAINER)) {
            final Set<String> container = readContainer(def.get(JsonLdConsts.CONTAINER));
            for (final String c : container) {
                definition.container(c);
            }
            // 18.3)
            if (container.contains(JsonLdConsts.TYPE)) {
                if (definition.typeMapping() == null) {
                    definition.typeMapping(JsonLdConsts.ID);
                }
                if (!JsonLdConsts.ID.equals(definition.typeMapping())
                        && !JsonLdConsts.VOCAB.equals(definition.typeMapping())) {
                    throw new JsonLdError(Error.INVALID_TYPE_MAPPING, definition.typeMapping());
                }
            }
        }

        // 19)
        if (def.has(JsonLdConsts.INDEX)) {
            if (legacy() || !definition.container().contains(JsonLdConsts.INDEX)) {
                throw new JsonLdError(Error.INVALID_TERM_DEFINITION,
                        "@index without an @index container: " + term);
            }
            final JsonNode index = def.get(JsonLdConsts.INDEX);
            if (!index.isTextual() || !JsonLdUrl
                    .isAbsoluteIri(expandIri(result, scope, index.asText(), false, true))) {
                throw new JsonLdError(Error.INVALID_TERM_DEFINITION, index);
            }
            definition.index(index.asText());
        }

        // 20)
        if (def.has(JsonLdConsts.CONTEXT)) {
            if (legacy()) {
                throw new JsonLdError(Error.INVALID_TERM_DEFINITION, term);
            }
            final JsonNode context = def.get(JsonLdConsts.CONTEXT);
            // 20.3)
            try {
                process(result.build(), context, scope.baseUrl,
                        new ArrayList<String>(scope.remoteContexts), true, true, false);
            } catch (final JsonLdError e) {
                throw new JsonLdError(Error.INVALID_SCOPED_CONTEXT, term, e);
            }
            // 20.4)
            definition.context(context, scope.baseUrl);
        }

        // 21)
        if (def.has(JsonLdConsts.LANGUAGE) && !def.has(JsonLdConsts.TYPE)) {
            final JsonNode language = def.get(JsonLdConsts.LANGUAGE);
            if (language.isNull()) {
                definition.languageMapping(null);
            } else if (language.isTextual()) {
                definition.languageMapping(language.asText().toLowerCase());
            } else {
                throw new JsonLdError(Error.INVALID_LANGUAGE_MAPPING, language);
            }
        }

        // 22)
        if (def.has(JsonLdConsts.DIRECTION) && !def.has(JsonLdConsts.TYPE)) {
            final JsonNode direction = def.get(JsonLdConsts.DIRECTION);
            if (direction.isNull()) {
                definition.directionMapping(null);
            } else if (isDirection(direction)) {
                definition.directionMapping(direction.asText());
            } else {
                throw new JsonLdError(Error.INVALID_BASE_DIRECTION, direction);
            }
        }

        // 23)
        if (def.has(JsonLdConsts.NEST)) {
            if (legacy()) {
                throw new JsonLdError(Error.INVALID_TERM_DEFINITION, term);
            }
            final JsonNode nest = def.get(JsonLdConsts.NEST);
            if (!nest.isTextual() || (Keywords.isKeyword(nest.asText())
                    && !JsonLdConsts.NEST.equals(nest.asText()))) {
                throw new JsonLdError(Error.INVALID_NEST_VALUE, nest);
            }
            definition.nest(nest.asText());
        }

        // 24)
        if (def.has(JsonLdConsts.PREFIX)) {
            if (legacy() || term.contains(":") || term.contains("/")) {
                throw new JsonLdError(Error.INVALID_TERM_DEFINITION,
                        "@prefix not allowed on " + term);
            }
            final JsonNode prefix = def.get(JsonLdConsts.PREFIX);
            if (!prefix.isBoolean()) {
                throw new JsonLdError(Error.INVALID_PREFIX_VALUE, prefix);
            }
            definition.prefix(prefix.booleanValue());
            if (prefix.booleanValue() && Keywords.isKeyword(definition.id())) {
                throw new JsonLdError(Error.INVALID_TERM_DEFINITION,
                        "A keyword alias cannot be a prefix: " + term);
            }
        }

        // 25)
        final Iterator<String> keys = def.fieldNames();
        while (keys.hasNext()) {
            final String key = keys.next();
            if (!Keywords.TERM_DEFINITION_KEYS.contains(key)) {
                throw new JsonLdError(Error.INVALID_TERM_DEFINITION, term).setDetail("entry",
                        key);
            }
        }

        finish(result, scope, term, previous, definition.build());
    }

    private void finish(Context.Builder result, Scope scope, String term,
            TermDefinition previous, TermDefinition definition) throws JsonLdError {
        TermDefinition rval = definition;
        // 26)
        if (!scope.overrideProtected && previous != null && previous.isProtected()) {
            if (!definition.sameDefinitionAs(previous)) {
                throw new JsonLdError(Error.PROTECTED_TERM_REDEFINITION, term);
            }
            rval = previous;
        }
        // 27)
        result.terms.put(term, rval);
        scope.defined.put(term, true);
    }

    /**
     * IRI expansion while a local context is processed: terms of the local
     * context are defined on demand before they are used.
     */
    private String expandIri(Context.Builder result, Scope scope, String value,
            boolean relative, boolean vocab) throws JsonLdError {
        if (value == null || Keywords.isKeyword(value) || Keywords.hasKeywordForm(value)) {
            return Context.expandIri(value, relative, vocab, result.terms, result.vocab,
                    result.base, options);
        }
        // 3)
        if (scope.local.has(value) && !Boolean.TRUE.equals(scope.defined.get(value))) {
            createTermDefinition(result, scope, value);
        }
        final TermDefinition td = result.terms.get(value);
        if (td == null || !(vocab || Keywords.isKeyword(td.getId()))) {
            // 6.3)
            final int colon = value.indexOf(':', 1);
            if (colon > 0) {
                final String prefix = value.substring(0, colon);
                if (!"_".equals(prefix) && !value.startsWith("//", colon + 1)
                        && scope.local.has(prefix)
                        && !Boolean.TRUE.equals(scope.defined.get(prefix))) {
                    createTermDefinition(result, scope, prefix);
                }
            }
        }
        return Context.expandIri(value, relative, vocab, result.terms, result.vocab, result.base,
                options);
    }

    private void warn(String warning) {
        if (options.addWarning(warning)) {
            LOG.warn(warning);
        }
    }

    private Set<String> readContainer(JsonNode value) throws JsonLdError {
        final Set<String> rval = new HashSet<String>();
        if (value.isTextual()) {
            rval.add(value.asText());
        } else if (value.isArray() && !legacy()) {
            for (final JsonNode c : value) {
                if (!c.isTextual()) {
                    throw new JsonLdError(Error.INVALID_CONTAINER_MAPPING, value);
                }
                rval.add(c.asText());
            }
        } else {
            throw new JsonLdError(Error.INVALID_CONTAINER_MAPPING, value);
        }
        if (!Keywords.CONTAINER_KEYWORDS.containsAll(rval) || !isValidContainer(rval)) {
            throw new JsonLdError(Error.INVALID_CONTAINER_MAPPING, value);
        }
        if (legacy() && (rval.contains(JsonLdConsts.GRAPH) || rval.contains(JsonLdConsts.ID)
                || rval.contains(JsonLdConsts.TYPE))) {
            throw new JsonLdError(Error.INVALID_CONTAINER_MAPPING, value);
        }
        return rval;
    }

    /**
     * {@code @graph} combines with {@code @id} or {@code @index} and
     * {@code @set}; otherwise {@code @set} combines with any single keyword
     * except {@code @list}.
     */
    private static boolean isValidContainer(Set<String> container) {
        if (container.size() == 1) {
            return true;
        }
        if (container.contains(JsonLdConsts.GRAPH)) {
            if (container.contains(JsonLdConsts.ID) && container.contains(JsonLdConsts.INDEX)) {
                return false;
            }
            for (final String c : container) {
                if (!JsonLdConsts.GRAPH.equals(c) && !JsonLdConsts.ID.equals(c)
                        && !JsonLdConsts.INDEX.equals(c) && !JsonLdConsts.SET.equals(c)) {
                    return false;
                }
            }
            return true;
        }
        return container.size() == 2 && container.contains(JsonLdConsts.SET)
                && !container.contains(JsonLdConsts.LIST);
    }

    private static boolean isTypeKeywordDefinition(JsonNode value) {
        if (value == null || !value.isObject() || value.size() == 0) {
            return false;
        }
        final Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            if (JsonLdConsts.CONTAINER.equals(field.getKey())) {
                if (!JsonLdConsts.SET.equals(field.getValue().asText(null))) {
                    return false;
                }
            } else if (!JsonLdConsts.PROTECTED.equals(field.getKey())) {
                return false;
            }
        }
        return true;
    }

    private static boolean endsWithGenDelim(String iri) {
        if (iri == null || iri.isEmpty()) {
            return false;
        }
        return ":/?#[]@".indexOf(iri.charAt(iri.length() - 1)) >= 0;
    }

    static boolean isDirection(JsonNode value) {
        return value.isTextual()
                && ("ltr".equals(value.asText()) || "rtl".equals(value.asText()));
    }

    /** The state shared by the term definitions of one local context map. */
    private static final class Scope {
        final ObjectNode local;
        final String baseUrl;
        final boolean protectedFlag;
        final boolean overrideProtected;
        final List<String> remoteContexts;
        final Map<String, Boolean> defined = new HashMap<String, Boolean>();

        Scope(ObjectNode local, String baseUrl, boolean protectedFlag, boolean overrideProtected,
                List<String> remoteContexts) {
            this.local = local;
            this.baseUrl = baseUrl;
            this.protectedFlag = protectedFlag;
            this.overrideProtected = overrideProtected;
            this.remoteContexts = remoteContexts;
        }
    }
}

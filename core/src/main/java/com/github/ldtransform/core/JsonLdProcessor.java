package com.github.ldtransform.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.github.ldtransform.utils.JsonUtils;

/**
 * https://www.w3.org/TR/json-ld11-api/#the-jsonldprocessor-interface
 *
 * @author tristan
 *
 */
public class JsonLdProcessor {

    /**
     * Compacts a document with the given context.
     *
     * @param input
     *            the document, or a string holding the IRI to load it from
     * @param context
     *            the context to compact with; a map holding an
     *            {@code @context} entry is unwrapped
     * @param opts
     *            processing options
     * @return the compacted document, carrying the context when it is not
     *         empty
     * @throws JsonLdError
     *             if expansion or compaction fails
     */
    public static ObjectNode compact(JsonNode input, JsonNode context, JsonLdOptions opts)
            throws JsonLdError {
        // 2-6) the same steps as in expand
        final RemoteDocument remote = load(input, opts);
        final JsonLdOptions effective = withDocumentBase(opts, remote);
        final JsonLdApi api = new JsonLdApi(effective);
        final ArrayNode expanded = expand(api, remote, effective);

        // 7)
        if (context != null && context.isObject() && context.has(JsonLdConsts.CONTEXT)) {
            context = context.get(JsonLdConsts.CONTEXT);
        }
        final Context activeCtx = api.processContext(new Context(effective), context,
                effective.getBase());

        // 8)
        final JsonNode compacted = api.compact(activeCtx, null, expanded);

        // final step of Compaction Algorithm
        ObjectNode rval;
        if (compacted.isObject()) {
            rval = (ObjectNode) compacted;
        } else {
            rval = JsonUtils.newObject();
            final ArrayNode items = JsonLdUtils.asArray(compacted);
            if (items.size() > 0) {
                rval.set(activeCtx.compactIri(JsonLdConsts.GRAPH, true), items);
            }
        }
        if (context != null && !context.isNull() && !(context.isContainerNode() && context.size() == 0)) {
            final ObjectNode withContext = JsonUtils.newObject();
            withContext.set(JsonLdConsts.CONTEXT, context);
            withContext.setAll(rval);
            rval = withContext;
        }

        // 9)
        return rval;
    }

    public static ObjectNode compact(JsonNode input, JsonNode context) throws JsonLdError {
        return compact(input, context, new JsonLdOptions(""));
    }

    /**
     * Expands a document.
     *
     * @param input
     *            the document, or a string holding the IRI to load it from
     * @param opts
     *            processing options
     * @return the expanded document, always an array
     * @throws JsonLdError
     *             if the document is not valid JSON-LD or a referenced
     *             document cannot be loaded
     */
    public static ArrayNode expand(JsonNode input, JsonLdOptions opts) throws JsonLdError {
        final RemoteDocument remote = load(input, opts);
        final JsonLdOptions effective = withDocumentBase(opts, remote);
        return expand(new JsonLdApi(effective), remote, effective);
    }

    public static ArrayNode expand(JsonNode input) throws JsonLdError {
        return expand(input, new JsonLdOptions(""));
    }

    // 2)
    private static RemoteDocument load(JsonNode input, JsonLdOptions opts) throws JsonLdError {
        if (input != null && input.isTextual() && input.asText().contains(":")) {
            return opts.getDocumentLoader().loadDocument(input.asText());
        }
        return new RemoteDocument(null, input);
    }

    /**
     * If set, the base in the options overrides the IRI the document was
     * loaded from.
     */
    private static JsonLdOptions withDocumentBase(JsonLdOptions opts, RemoteDocument remote) {
        if (remote.getDocumentUrl() == null
                || (opts.getBase() != null && !opts.getBase().isEmpty())) {
            return opts;
        }
        final JsonLdOptions rval = opts.copy();
        rval.setBase(remote.getDocumentUrl());
        return rval;
    }

    private static ArrayNode expand(JsonLdApi api, RemoteDocument remote, JsonLdOptions opts)
            throws JsonLdError {
        // 3)
        Context activeCtx = new Context(opts);
        final String baseUrl = remote.getDocumentUrl() != null ? remote.getDocumentUrl()
                : activeCtx.getBase();
        // 4)
        if (opts.getExpandContext() != null) {
            JsonNode exCtx = opts.getExpandContext();
            if (exCtx.isObject() && exCtx.has(JsonLdConsts.CONTEXT)) {
                exCtx = exCtx.get(JsonLdConsts.CONTEXT);
            }
            activeCtx = api.processContext(activeCtx, exCtx, baseUrl);
        }
        // 5)
        if (remote.getContextUrl() != null) {
            activeCtx = api.processContext(activeCtx, TextNode.valueOf(remote.getContextUrl()),
                    remote.getDocumentUrl());
        }

        // 6)
        JsonNode expanded = api.expand(activeCtx, null, remote.getDocument(), baseUrl, false);

        // final step of Expansion Algorithm
        if (expanded != null && expanded.isObject() && expanded.size() == 1
                && expanded.has(JsonLdConsts.GRAPH)) {
            expanded = expanded.get(JsonLdConsts.GRAPH);
        }
        final ArrayNode rval = expanded == null ? JsonUtils.newArray()
                : JsonLdUtils.asArray(expanded);
        if (opts.getLabelBlankNodes()) {
            api.labelBlankNodes(rval);
        }
        return rval;
    }
}

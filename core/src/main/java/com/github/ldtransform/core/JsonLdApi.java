package com.github.ldtransform.core;

import static com.github.ldtransform.core.JsonLdUtils.addValue;
import static com.github.ldtransform.core.JsonLdUtils.asArray;
import static com.github.ldtransform.core.JsonLdUtils.isGraph;
import static com.github.ldtransform.core.JsonLdUtils.isList;
import static com.github.ldtransform.core.JsonLdUtils.isScalar;
import static com.github.ldtransform.core.JsonLdUtils.isValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.github.ldtransform.core.JsonLdError.Error;
import com.github.ldtransform.utils.JsonLdUrl;
import com.github.ldtransform.utils.JsonUtils;

/**
 * The expansion and compaction algorithms. An instance carries the state of
 * one run (recursion depth, blank node labels, dereferenced contexts) and is
 * not meant to be shared between threads.
 */
public class JsonLdApi {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLdApi.class);

    final JsonLdOptions opts;
    private final ContextProcessor processor;
    private final BlankNodeIdGenerator generator = new BlankNodeIdGenerator();
    private int depth = 0;

    public JsonLdApi() {
        this(new JsonLdOptions(""));
    }

    public JsonLdApi(JsonLdOptions opts) {
        this.opts = opts == null ? new JsonLdOptions("") : opts;
        this.processor = new ContextProcessor(this.opts);
    }

    /**
     * Processes a local context, sharing this run's dereferenced remote
     * contexts.
     */
    public Context processContext(Context activeCtx, JsonNode localContext, String baseUrl)
            throws JsonLdError {
        return processor.process(activeCtx, localContext, baseUrl);
    }

    private boolean legacy() {
        return opts.processingMode(ProcessingMode.JSON_LD_1_0);
    }

    private void enter() throws JsonLdError {
        if (++depth > opts.getMaxDepth()) {
            depth--;
            throw new JsonLdError(Error.RECURSION_DEPTH_EXCEEDED,
                    "Document nested deeper than " + opts.getMaxDepth() + " levels")
                            .setDetail("maxDepth", opts.getMaxDepth());
        }
    }

    private List<String> keys(JsonNode map) {
        final List<String> rval = new ArrayList<String>();
        final Iterator<String> it = map.fieldNames();
        while (it.hasNext()) {
            rval.add(it.next());
        }
        if (opts.getOrdered()) {
            Collections.sort(rval);
        }
        return rval;
    }

    private static List<String> sortedKeys(JsonNode map) {
        final List<String> rval = new ArrayList<String>();
        final Iterator<String> it = map.fieldNames();
        while (it.hasNext()) {
            rval.add(it.next());
        }
        Collections.sort(rval);
        return rval;
    }

    private static ObjectNode getOrCreateObject(ObjectNode parent, String key) {
        final JsonNode existing = parent.get(key);
        if (existing != null && existing.isObject()) {
            return (ObjectNode) existing;
        }
        return parent.putObject(key);
    }

    private static boolean isIriOrBlankNode(String value) {
        return JsonLdUrl.isAbsoluteIri(value) || JsonLdUtils.isBlankNodeId(value);
    }

    /**
     * Expansion Algorithm
     *
     * https://www.w3.org/TR/json-ld11-api/#expansion-algorithm
     *
     * @param activeCtx
     *            the active context
     * @param activeProperty
     *            the property the element is the value of, null at the top
     * @param element
     *            the element to expand
     * @param baseUrl
     *            the IRI scoped contexts are resolved against
     * @param fromMap
     *            the element is a value of an index, id or type map
     * @return the expanded element, or null if it was dropped
     * @throws JsonLdError
     *             if the element is not valid JSON-LD
     */
    public JsonNode expand(Context activeCtx, String activeProperty, JsonNode element,
            String baseUrl, boolean fromMap) throws JsonLdError {
        // 1)
        if (element == null || element.isNull()) {
            return null;
        }
        enter();
        try {
            return expandElement(activeCtx, activeProperty, element, baseUrl, fromMap);
        } finally {
            depth--;
        }
    }

    public JsonNode expand(Context activeCtx, JsonNode element) throws JsonLdError {
        return expand(activeCtx, null, element, activeCtx.getBase(), false);
    }

    private JsonNode expandElement(Context activeCtx, String activeProperty, JsonNode element,
            String baseUrl, boolean fromMap) throws JsonLdError {
        // 3)
        final TermDefinition activeDef = activeCtx.getTermDefinition(activeProperty);
        final JsonNode propertyScopedContext = activeDef != null && activeDef.hasContext()
                ? activeDef.getContext()
                : null;

        // 4)
        if (isScalar(element)) {
            // 4.1)
            if (activeProperty == null || JsonLdConsts.GRAPH.equals(activeProperty)) {
                return null;
            }
            // 4.2)
            if (propertyScopedContext != null) {
                activeCtx = processor.process(activeCtx, propertyScopedContext,
                        activeDef.getBaseUrl(), true, true);
            }
            // 4.3)
            return activeCtx.expandValue(activeProperty, element);
        }

        // 5)
        if (element.isArray()) {
            // 5.1)
            final ArrayNode result = JsonUtils.newArray();
            final boolean listContainer = activeCtx.hasContainer(activeProperty,
                    JsonLdConsts.LIST);
            // 5.2)
            for (final JsonNode item : element) {
                // 5.2.1)
                JsonNode expandedItem = expand(activeCtx, activeProperty, item, baseUrl, fromMap);
                if (legacy() && (JsonLdConsts.LIST.equals(activeProperty) || listContainer)
                        && expandedItem != null
                        && (expandedItem.isArray() || isList(expandedItem))) {
                    throw new JsonLdError(Error.LIST_OF_LISTS,
                            "A list may not contain another list in json-ld-1.0 mode");
                }
                // 5.2.2)
                if (listContainer && expandedItem != null && expandedItem.isArray()) {
                    final ObjectNode list = JsonUtils.newObject();
                    list.set(JsonLdConsts.LIST, expandedItem);
                    expandedItem = list;
                }
                // 5.2.3)
                if (expandedItem == null) {
                    continue;
                }
                if (expandedItem.isArray()) {
                    result.addAll((ArrayNode) expandedItem);
                } else {
                    result.add(expandedItem);
                }
            }
            // 5.3)
            return result;
        }

        // 6)
        if (!element.isObject()) {
            return null;
        }
        final ObjectNode elem = (ObjectNode) element;

        // 7)
        if (activeCtx.getPreviousContext() != null && !fromMap) {
            boolean hasValue = false;
            for (final String key : sortedKeys(elem)) {
                if (JsonLdConsts.VALUE.equals(activeCtx.expandIri(key, false, true))) {
                    hasValue = true;
                }
            }
            final boolean onlyId = elem.size() == 1 && JsonLdConsts.ID
                    .equals(activeCtx.expandIri(elem.fieldNames().next(), false, true));
            if (!hasValue && !onlyId) {
                activeCtx = activeCtx.getPreviousContext();
            }
        }

        // 8)
        if (propertyScopedContext != null) {
            activeCtx = processor.process(activeCtx, propertyScopedContext,
                    activeDef.getBaseUrl(), true, true);
        }

        // 9)
        if (elem.has(JsonLdConsts.CONTEXT)) {
            activeCtx = processor.process(activeCtx, elem.get(JsonLdConsts.CONTEXT), baseUrl);
        }

        // 10)
        final Context typeScopedContext = activeCtx;

        // 11)
        String typeKey = null;
        for (final String key : sortedKeys(elem)) {
            if (!JsonLdConsts.TYPE.equals(activeCtx.expandIri(key, false, true))) {
                continue;
            }
            if (typeKey == null) {
                typeKey = key;
            }
            // 11.1)
            final List<String> terms = new ArrayList<String>();
            for (final JsonNode t : asArray(elem.get(key))) {
                if (t.isTextual()) {
                    terms.add(t.asText());
                }
            }
            Collections.sort(terms);
            // 11.2)
            for (final String term : terms) {
                final TermDefinition td = typeScopedContext.getTermDefinition(term);
                if (td != null && td.hasContext()) {
                    activeCtx = processor.process(activeCtx, td.getContext(), td.getBaseUrl(),
                            false, false);
                }
            }
        }

        // 12)
        String inputType = null;
        if (typeKey != null) {
            final ArrayNode types = asArray(elem.get(typeKey));
            final JsonNode last = types.size() > 0 ? types.get(types.size() - 1) : null;
            if (last != null && last.isTextual()) {
                inputType = activeCtx.expandIri(last.asText(), false, true);
            }
        }
        final ObjectNode result = JsonUtils.newObject();

        // 13-14)
        expandObject(activeCtx, typeScopedContext, activeProperty, elem, result, inputType,
                baseUrl);

        JsonNode rval = result;
        // 15)
        if (result.has(JsonLdConsts.VALUE)) {
            // 15.1)
            final Iterator<String> it = result.fieldNames();
            while (it.hasNext()) {
                final String key = it.next();
                if (!Keywords.VALUE_OBJECT_KEYS.contains(key)) {
                    throw new JsonLdError(Error.INVALID_VALUE_OBJECT,
                            "Unexpected entry in value object: " + key);
                }
            }
            if (result.has(JsonLdConsts.TYPE) && (result.has(JsonLdConsts.LANGUAGE)
                    || result.has(JsonLdConsts.DIRECTION))) {
                throw new JsonLdError(Error.INVALID_VALUE_OBJECT,
                        "A value object may not have both @type and @language or @direction");
            }
            final JsonNode type = result.get(JsonLdConsts.TYPE);
            // 15.2)
            if (type == null || !JsonLdConsts.JSON.equals(type.asText(null))) {
                final JsonNode value = result.get(JsonLdConsts.VALUE);
                // 15.4)
                if (!value.isTextual() && result.has(JsonLdConsts.LANGUAGE)) {
                    throw new JsonLdError(Error.INVALID_LANGUAGE_TAGGED_VALUE, value);
                }
                // 15.5)
                if (type != null && (!type.isTextual()
                        || !JsonLdUrl.isAbsoluteIri(type.asText()))) {
                    throw new JsonLdError(Error.INVALID_TYPED_VALUE, type);
                }
            }
        } else {
            // 16)
            if (result.has(JsonLdConsts.TYPE) && !result.get(JsonLdConsts.TYPE).isArray()) {
                result.set(JsonLdConsts.TYPE, asArray(result.get(JsonLdConsts.TYPE)));
            }
            // 17)
            if (result.has(JsonLdConsts.SET) || result.has(JsonLdConsts.LIST)) {
                // 17.1)
                if (result.size() > 2
                        || (result.size() == 2 && !result.has(JsonLdConsts.INDEX))) {
                    throw new JsonLdError(Error.INVALID_SET_OR_LIST_OBJECT,
                            "Only @index may accompany @set or @list");
                }
                // 17.2)
                if (result.has(JsonLdConsts.SET)) {
                    rval = result.get(JsonLdConsts.SET);
                }
            }
        }

        // 18)
        if (rval.isObject() && rval.size() == 1 && rval.has(JsonLdConsts.LANGUAGE)) {
            return null;
        }

        // 19)
        if (rval.isObject()
                && (activeProperty == null || JsonLdConsts.GRAPH.equals(activeProperty))) {
            // 19.1)
            // a node holding only @id is kept
            if (rval.size() == 0 || rval.has(JsonLdConsts.VALUE) || rval.has(JsonLdConsts.LIST)) {
                return null;
            }
        }

        // 20)
        return rval;
    }

    /**
     * Steps 13 and 14 of the expansion algorithm, which also expand the
     * members of nested properties into the same result.
     */
    private void expandObject(Context activeCtx, Context typeScopedContext,
            String activeProperty, ObjectNode element, ObjectNode result, String inputType,
            String baseUrl) throws JsonLdError {
        final List<String> nests = new ArrayList<String>();

        // 13)
        for (final String key : keys(element)) {
            final JsonNode value = element.get(key);
            // 13.1)
            if (JsonLdConsts.CONTEXT.equals(key)) {
                continue;
            }
            // 13.2)
            String expandedProperty = activeCtx.expandIri(key, false, true);

            // 13.3)
            if (expandedProperty == null) {
                LOG.trace("Dropping {} which is not mapped to an IRI", key);
                continue;
            }
            if (!Keywords.isKeyword(expandedProperty) && !isIriOrBlankNode(expandedProperty)) {
                final ExpansionPolicy policy = opts.getExpansionPolicy();
                if (policy == ExpansionPolicy.RELAXED || (key.contains(":")
                        && policy != ExpansionPolicy.STRICTEST)) {
                    expandedProperty = key;
                } else if (policy == ExpansionPolicy.STANDARD) {
                    LOG.trace("Dropping {} which does not expand to an IRI", key);
                    continue;
                } else {
                    throw new JsonLdError(Error.INVALID_TERM, key).setDetail("policy", policy);
                }
            }

            // 13.4)
            if (Keywords.isKeyword(expandedProperty)) {
                // 13.4.1)
                if (JsonLdConsts.REVERSE.equals(activeProperty)) {
                    throw new JsonLdError(Error.INVALID_REVERSE_PROPERTY_MAP,
                            "A keyword cannot be used as a reverse property: " + key);
                }
                // 13.4.2)
                if (result.has(expandedProperty) && !JsonLdConsts.INCLUDED.equals(expandedProperty)
                        && !JsonLdConsts.TYPE.equals(expandedProperty)) {
                    throw new JsonLdError(Error.COLLIDING_KEYWORDS, expandedProperty);
                }
                JsonNode expandedValue = null;

                // 13.4.3)
                if (JsonLdConsts.ID.equals(expandedProperty)) {
                    if (!value.isTextual()) {
                        throw new JsonLdError(Error.INVALID_ID_VALUE, value);
                    }
                    final String id = activeCtx.expandIri(value.asText(), true, false);
                    expandedValue = id == null ? null : TextNode.valueOf(id);
                }
                // 13.4.4)
                else if (JsonLdConsts.TYPE.equals(expandedProperty)) {
                    boolean valid = value.isTextual() || value.isArray();
                    if (value.isArray()) {
                        for (final JsonNode t : value) {
                            valid &= t.isTextual();
                        }
                    }
                    if (!valid) {
                        throw new JsonLdError(Error.INVALID_TYPE_VALUE, value);
                    }
                    if (value.isTextual()) {
                        final String type = typeScopedContext.expandIri(value.asText(), true, true);
                        expandedValue = type == null ? null : TextNode.valueOf(type);
                    } else {
                        final ArrayNode types = JsonUtils.newArray();
                        for (final JsonNode t : value) {
                            final String type = typeScopedContext.expandIri(t.asText(), true, true);
                            if (type != null) {
                                types.add(type);
                            }
                        }
                        expandedValue = types;
                    }
                    // 13.4.4.5)
                    if (result.has(JsonLdConsts.TYPE) && expandedValue != null) {
                        final ArrayNode merged = JsonUtils.newArray();
                        merged.addAll(asArray(result.get(JsonLdConsts.TYPE)));
                        merged.addAll(asArray(expandedValue));
                        expandedValue = merged;
                    }
                }
                // 13.4.5)
                else if (JsonLdConsts.GRAPH.equals(expandedProperty)) {
                    final JsonNode graph = expand(activeCtx, JsonLdConsts.GRAPH, value, baseUrl,
                            false);
                    expandedValue = graph == null ? JsonUtils.newArray() : asArray(graph);
                }
                // 13.4.6)
                else if (JsonLdConsts.INCLUDED.equals(expandedProperty)) {
                    if (legacy()) {
                        continue;
                    }
                    final JsonNode included = expand(activeCtx, null, value, baseUrl, false);
                    final ArrayNode items = included == null ? JsonUtils.newArray()
                            : asArray(included);
                    for (final JsonNode item : items) {
                        if (!item.isObject() || item.has(JsonLdConsts.VALUE)
                                || item.has(JsonLdConsts.LIST) || item.has(JsonLdConsts.SET)) {
                            throw new JsonLdError(Error.INVALID_INCLUDED_VALUE, item);
                        }
                    }
                    if (result.has(JsonLdConsts.INCLUDED)) {
                        final ArrayNode merged = JsonUtils.newArray();
                        merged.addAll(asArray(result.get(JsonLdConsts.INCLUDED)));
                        merged.addAll(items);
                        expandedValue = merged;
                    } else {
                        expandedValue = items;
                    }
                }
                // 13.4.7)
                else if (JsonLdConsts.VALUE.equals(expandedProperty)) {
                    if (JsonLdConsts.JSON.equals(inputType)) {
                        if (legacy()) {
                            throw new JsonLdError(Error.INVALID_VALUE_OBJECT_VALUE, value);
                        }
                        expandedValue = value;
                    } else if (value.isNull()) {
                        throw new JsonLdError(Error.INVALID_VALUE_OBJECT_VALUE,
                                "@value may not be null");
                    } else if (!isScalar(value)) {
                        throw new JsonLdError(Error.INVALID_VALUE_OBJECT_VALUE, value);
                    } else {
                        expandedValue = value;
                    }
                }
                // 13.4.8)
                else if (JsonLdConsts.LANGUAGE.equals(expandedProperty)) {
                    if (!value.isTextual()) {
                        throw new JsonLdError(Error.INVALID_LANGUAGE_TAGGED_STRING, value);
                    }
                    expandedValue = TextNode.valueOf(value.asText().toLowerCase());
                }
                // 13.4.9)
                else if (JsonLdConsts.DIRECTION.equals(expandedProperty)) {
                    if (legacy()) {
                        continue;
                    }
                    if (!ContextProcessor.isDirection(value)) {
                        throw new JsonLdError(Error.INVALID_BASE_DIRECTION, value);
                    }
                    expandedValue = value;
                }
                // 13.4.10)
                else if (JsonLdConsts.INDEX.equals(expandedProperty)) {
                    if (!value.isTextual()) {
                        throw new JsonLdError(Error.INVALID_INDEX_VALUE, value);
                    }
                    expandedValue = value;
                }
                // 13.4.11)
                else if (JsonLdConsts.LIST.equals(expandedProperty)) {
                    // 13.4.11.1)
                    if (activeProperty == null || JsonLdConsts.GRAPH.equals(activeProperty)) {
                        continue;
                    }
                    // 13.4.11.2)
                    final JsonNode list = expand(activeCtx, activeProperty, value, baseUrl, false);
                    final ArrayNode items = list == null ? JsonUtils.newArray() : asArray(list);
                    if (legacy()) {
                        for (final JsonNode item : items) {
                            if (isList(item)) {
                                throw new JsonLdError(Error.LIST_OF_LISTS,
                                        "A list may not contain another list in json-ld-1.0 mode");
                            }
                        }
                    }
                    expandedValue = items;
                }
                // 13.4.12)
                else if (JsonLdConsts.SET.equals(expandedProperty)) {
                    expandedValue = expand(activeCtx, activeProperty, value, baseUrl, false);
                }
                // 13.4.13)
                else if (JsonLdConsts.REVERSE.equals(expandedProperty)) {
                    // 13.4.13.1)
                    if (!value.isObject()) {
                        throw new JsonLdError(Error.INVALID_REVERSE_VALUE, value);
                    }
                    // 13.4.13.2)
                    final JsonNode reverse = expand(activeCtx, JsonLdConsts.REVERSE, value,
                            baseUrl, false);
                    if (reverse != null && reverse.isObject()) {
                        // 13.4.13.3)
                        if (reverse.has(JsonLdConsts.REVERSE)) {
                            final Iterator<Map.Entry<String, JsonNode>> fields = reverse
                                    .get(JsonLdConsts.REVERSE).fields();
                            while (fields.hasNext()) {
                                final Map.Entry<String, JsonNode> field = fields.next();
                                addValue(result, field.getKey(), field.getValue(), true);
                            }
                        }
                        // 13.4.13.4)
                        final Iterator<Map.Entry<String, JsonNode>> fields = reverse.fields();
                        while (fields.hasNext()) {
                            final Map.Entry<String, JsonNode> field = fields.next();
                            if (JsonLdConsts.REVERSE.equals(field.getKey())) {
                                continue;
                            }
                            final ObjectNode reverseMap = getOrCreateObject(result,
                                    JsonLdConsts.REVERSE);
                            for (final JsonNode item : asArray(field.getValue())) {
                                if (isValue(item) || isList(item)) {
                                    throw new JsonLdError(Error.INVALID_REVERSE_PROPERTY_VALUE,
                                            item);
                                }
                                addValue(reverseMap, field.getKey(), item, true);
                            }
                        }
                    }
                    // 13.4.13.5)
                    continue;
                }
                // 13.4.14)
                else if (JsonLdConsts.NEST.equals(expandedProperty)) {
                    nests.add(key);
                    continue;
                }

                // 13.4.16)
                if (expandedValue != null) {
                    result.set(expandedProperty, expandedValue);
                }
                // 13.4.17)
                continue;
            }

            // 13.5)
            final TermDefinition keyDef = activeCtx.getTermDefinition(key);
            final Set<String> container = activeCtx.getContainer(key);
            JsonNode expandedValue;

            // 13.6)
            if (keyDef != null && JsonLdConsts.JSON.equals(keyDef.getTypeMapping())) {
                final ObjectNode json = JsonUtils.newObject();
                json.set(JsonLdConsts.VALUE, value);
                json.put(JsonLdConsts.TYPE, JsonLdConsts.JSON);
                expandedValue = json;
            }
            // 13.7)
            else if (container.contains(JsonLdConsts.LANGUAGE) && value.isObject()) {
                expandedValue = expandLanguageMap(activeCtx, keyDef, value);
            }
            // 13.8)
            else if ((container.contains(JsonLdConsts.INDEX)
                    || container.contains(JsonLdConsts.TYPE) || container.contains(JsonLdConsts.ID))
                    && value.isObject()) {
                expandedValue = expandIndexMap(activeCtx, key, keyDef, container, value, baseUrl);
            }
            // 13.9)
            else {
                expandedValue = expand(activeCtx, key, value, baseUrl, false);
            }

            // 13.10)
            if (expandedValue == null) {
                continue;
            }
            // 13.11)
            if (container.contains(JsonLdConsts.LIST) && !isList(expandedValue)) {
                final ObjectNode list = JsonUtils.newObject();
                list.set(JsonLdConsts.LIST, asArray(expandedValue));
                expandedValue = list;
            }
            // 13.12)
            if (container.contains(JsonLdConsts.GRAPH) && !container.contains(JsonLdConsts.ID)
                    && !container.contains(JsonLdConsts.INDEX)) {
                final ArrayNode graphs = JsonUtils.newArray();
                for (final JsonNode ev : asArray(expandedValue)) {
                    final ObjectNode graph = JsonUtils.newObject();
                    graph.set(JsonLdConsts.GRAPH, asArray(ev));
                    graphs.add(graph);
                }
                expandedValue = graphs;
            }
            // 13.13)
            if (keyDef != null && keyDef.isReverse()) {
                final ObjectNode reverseMap = getOrCreateObject(result, JsonLdConsts.REVERSE);
                for (final JsonNode item : asArray(expandedValue)) {
                    if (isValue(item) || isList(item)) {
                        throw new JsonLdError(Error.INVALID_REVERSE_PROPERTY_VALUE, item);
                    }
                    addValue(reverseMap, expandedProperty, item, true);
                }
            }
            // 13.14)
            else {
                addValue(result, expandedProperty, expandedValue, true);
            }
        }

        // 14)
        final List<String> nestKeys = new ArrayList<String>(nests);
        if (opts.getOrdered()) {
            Collections.sort(nestKeys);
        }
        for (final String nestingKey : nestKeys) {
            // 14.1)
            for (final JsonNode nestedValue : asArray(element.get(nestingKey))) {
                // 14.2)
                if (!nestedValue.isObject()) {
                    throw new JsonLdError(Error.INVALID_NEST_VALUE, nestedValue);
                }
                for (final String k : sortedKeys(nestedValue)) {
                    if (JsonLdConsts.VALUE.equals(activeCtx.expandIri(k, false, true))) {
                        throw new JsonLdError(Error.INVALID_NEST_VALUE,
                                "Nested values may not be value objects");
                    }
                }
                expandObject(activeCtx, typeScopedContext, activeProperty,
                        (ObjectNode) nestedValue, result, inputType, baseUrl);
            }
        }
    }

    /** Step 13.7: a language map becomes language-tagged strings. */
    private ArrayNode expandLanguageMap(Context activeCtx, TermDefinition keyDef, JsonNode value)
            throws JsonLdError {
        // 13.7.1)
        final ArrayNode rval = JsonUtils.newArray();
        // 13.7.2-3)
        final String direction = keyDef != null && keyDef.hasDirectionMapping()
                ? keyDef.getDirectionMapping()
                : activeCtx.getDefaultDirection();
        // 13.7.4)
        for (final String language : keys(value)) {
            for (final JsonNode item : asArray(value.get(language))) {
                if (item.isNull()) {
                    continue;
                }
                if (!item.isTextual()) {
                    throw new JsonLdError(Error.INVALID_LANGUAGE_MAP_VALUE, item);
                }
                final ObjectNode v = JsonUtils.newObject();
                v.set(JsonLdConsts.VALUE, item);
                if (!JsonLdConsts.NONE.equals(language)
                        && !JsonLdConsts.NONE.equals(activeCtx.expandIri(language, false, true))) {
                    v.put(JsonLdConsts.LANGUAGE, language.toLowerCase());
                }
                if (direction != null) {
                    v.put(JsonLdConsts.DIRECTION, direction);
                }
                rval.add(v);
            }
        }
        return rval;
    }

    /** Step 13.8: index, id and type maps. */
    private ArrayNode expandIndexMap(Context activeCtx, String key, TermDefinition keyDef,
            Set<String> container, JsonNode value, String baseUrl) throws JsonLdError {
        // 13.8.1)
        final ArrayNode rval = JsonUtils.newArray();
        // 13.8.2)
        final String indexKey = keyDef != null && keyDef.getIndex() != null ? keyDef.getIndex()
                : JsonLdConsts.INDEX;
        // 13.8.3)
        for (final String index : keys(value)) {
            final JsonNode indexValue = value.get(index);
            // 13.8.3.1-3)
            Context mapContext = activeCtx;
            if (container.contains(JsonLdConsts.ID) || container.contains(JsonLdConsts.TYPE)) {
                if (activeCtx.getPreviousContext() != null) {
                    mapContext = activeCtx.getPreviousContext();
                }
                final TermDefinition indexDef = mapContext.getTermDefinition(index);
                if (container.contains(JsonLdConsts.TYPE) && indexDef != null
                        && indexDef.hasContext()) {
                    mapContext = processor.process(mapContext, indexDef.getContext(),
                            indexDef.getBaseUrl(), false, true);
                }
            }
            // 13.8.3.4)
            final String expandedIndex = activeCtx.expandIri(index, false, true);
            // 13.8.3.5-6)
            final JsonNode items = expand(mapContext, key, asArray(indexValue), baseUrl, true);
            if (items == null) {
                continue;
            }
            // 13.8.3.7)
            for (final JsonNode itemNode : asArray(items)) {
                if (!itemNode.isObject()) {
                    continue;
                }
                ObjectNode item = (ObjectNode) itemNode;
                // 13.8.3.7.1)
                if (container.contains(JsonLdConsts.GRAPH) && !isGraph(item)) {
                    final ObjectNode graph = JsonUtils.newObject();
                    graph.set(JsonLdConsts.GRAPH, asArray(item));
                    item = graph;
                }
                // 13.8.3.7.2)
                if (container.contains(JsonLdConsts.INDEX) && !JsonLdConsts.INDEX.equals(indexKey)
                        && !JsonLdConsts.NONE.equals(expandedIndex)) {
                    final JsonNode reExpandedIndex = activeCtx.expandValue(indexKey,
                            TextNode.valueOf(index));
                    final String expandedIndexKey = activeCtx.expandIri(indexKey, false, true);
                    final ArrayNode indexPropertyValues = JsonUtils.newArray();
                    indexPropertyValues.add(reExpandedIndex);
                    if (item.has(expandedIndexKey)) {
                        indexPropertyValues.addAll(asArray(item.get(expandedIndexKey)));
                    }
                    item.set(expandedIndexKey, indexPropertyValues);
                    if (isValue(item)) {
                        throw new JsonLdError(Error.INVALID_VALUE_OBJECT,
                                "A value object cannot be indexed by a property: " + index);
                    }
                }
                // 13.8.3.7.3)
                else if (container.contains(JsonLdConsts.INDEX) && !item.has(JsonLdConsts.INDEX)
                        && !JsonLdConsts.NONE.equals(expandedIndex)) {
                    item.put(JsonLdConsts.INDEX, index);
                }
                // 13.8.3.7.4)
                else if (container.contains(JsonLdConsts.ID) && !item.has(JsonLdConsts.ID)
                        && !JsonLdConsts.NONE.equals(expandedIndex)) {
                    item.put(JsonLdConsts.ID, activeCtx.expandIri(index, true, false));
                }
                // 13.8.3.7.5)
                else if (container.contains(JsonLdConsts.TYPE)
                        && !JsonLdConsts.NONE.equals(expandedIndex)) {
                    final ArrayNode types = JsonUtils.newArray();
                    types.add(expandedIndex);
                    if (item.has(JsonLdConsts.TYPE)) {
                        types.addAll(asArray(item.get(JsonLdConsts.TYPE)));
                    }
                    item.set(JsonLdConsts.TYPE, types);
                }
                // 13.8.3.7.6)
                rval.add(item);
            }
        }
        return rval;
    }

    /**
     * Compaction Algorithm
     *
     * https://www.w3.org/TR/json-ld11-api/#compaction-algorithm
     *
     * @param activeCtx
     *            the active context
     * @param activeProperty
     *            the compacted property the element is the value of, null at
     *            the top
     * @param element
     *            the expanded element
     * @return the compacted element
     * @throws JsonLdError
     *             if the element cannot be compacted with the context
     */
    public JsonNode compact(Context activeCtx, String activeProperty, JsonNode element)
            throws JsonLdError {
        enter();
        try {
            return compactElement(activeCtx, activeProperty, element);
        } finally {
            depth--;
        }
    }

    private JsonNode compactElement(Context activeCtx, String activeProperty, JsonNode element)
            throws JsonLdError {
        // 1)
        final Context typeScopedContext = activeCtx;

        // 2)
        if (element == null || element.isNull() || isScalar(element)) {
            return element;
        }

        // 3)
        if (element.isArray()) {
            // 3.1)
            final ArrayNode result = JsonUtils.newArray();
            // 3.2)
            for (final JsonNode item : element) {
                final JsonNode compactedItem = compact(activeCtx, activeProperty, item);
                if (compactedItem != null) {
                    result.add(compactedItem);
                }
            }
            // 3.3)
            final Set<String> container = activeCtx.getContainer(activeProperty);
            if (result.size() != 1 || !opts.getCompactArrays()
                    || JsonLdConsts.GRAPH.equals(activeProperty)
                    || JsonLdConsts.SET.equals(activeProperty)
                    || container.contains(JsonLdConsts.LIST)
                    || container.contains(JsonLdConsts.SET)) {
                return result;
            }
            // 3.4)
            return result.get(0);
        }

        // 4)
        final ObjectNode elem = (ObjectNode) element;

        // 5)
        if (activeCtx.getPreviousContext() != null && !elem.has(JsonLdConsts.VALUE)
                && !(elem.size() == 1 && elem.has(JsonLdConsts.ID))) {
            activeCtx = activeCtx.getPreviousContext();
        }

        // 6)
        final TermDefinition activeDef = activeCtx.getTermDefinition(activeProperty);
        if (activeDef != null && activeDef.hasContext()) {
            activeCtx = processor.process(activeCtx, activeDef.getContext(),
                    activeDef.getBaseUrl(), true, true);
        }

        // 7)
        if (elem.has(JsonLdConsts.VALUE) || elem.has(JsonLdConsts.ID)) {
            final JsonNode compactedValue = activeCtx.compactValue(activeProperty, elem);
            if (isScalar(compactedValue)
                    || JsonLdConsts.JSON.equals(activeCtx.getTypeMapping(activeProperty))) {
                return compactedValue;
            }
        }

        // 8)
        if (isList(elem) && activeCtx.hasContainer(activeProperty, JsonLdConsts.LIST)) {
            return compact(activeCtx, activeProperty, elem.get(JsonLdConsts.LIST));
        }

        // 9)
        final boolean insideReverse = JsonLdConsts.REVERSE.equals(activeProperty);

        // 10)
        final ObjectNode result = JsonUtils.newObject();

        // 11)
        if (elem.has(JsonLdConsts.TYPE)) {
            final List<String> compactedTypes = new ArrayList<String>();
            for (final JsonNode type : asArray(elem.get(JsonLdConsts.TYPE))) {
                compactedTypes.add(activeCtx.compactIri(type.asText(), true));
            }
            Collections.sort(compactedTypes);
            for (final String term : compactedTypes) {
                final TermDefinition td = typeScopedContext.getTermDefinition(term);
                if (td != null && td.hasContext()) {
                    activeCtx = processor.process(activeCtx, td.getContext(), td.getBaseUrl(),
                            false, false);
                }
            }
        }

        // 12)
        for (final String expandedProperty : keys(elem)) {
            final JsonNode expandedValue = elem.get(expandedProperty);

            // 12.1)
            if (JsonLdConsts.ID.equals(expandedProperty)) {
                final JsonNode compactedValue = expandedValue.isTextual()
                        ? TextNode.valueOf(activeCtx.compactIri(expandedValue.asText(), false))
                        : expandedValue;
                result.set(activeCtx.compactIri(JsonLdConsts.ID, true), compactedValue);
                continue;
            }

            // 12.2)
            if (JsonLdConsts.TYPE.equals(expandedProperty)) {
                final JsonNode compactedValue;
                if (expandedValue.isTextual()) {
                    compactedValue = TextNode
                            .valueOf(typeScopedContext.compactIri(expandedValue.asText(), true));
                } else {
                    final ArrayNode types = JsonUtils.newArray();
                    for (final JsonNode type : expandedValue) {
                        types.add(typeScopedContext.compactIri(type.asText(), true));
                    }
                    compactedValue = types;
                }
                final String alias = activeCtx.compactIri(JsonLdConsts.TYPE, true);
                final boolean asArray = (!legacy()
                        && activeCtx.hasContainer(alias, JsonLdConsts.SET))
                        || !opts.getCompactArrays();
                addValue(result, alias, compactedValue, asArray);
                continue;
            }

            // 12.3)
            if (JsonLdConsts.REVERSE.equals(expandedProperty)) {
                final JsonNode compacted = compact(activeCtx, JsonLdConsts.REVERSE, expandedValue);
                if (compacted.isObject()) {
                    final ObjectNode compactedValue = (ObjectNode) compacted;
                    for (final String property : sortedKeys(compactedValue)) {
                        if (activeCtx.isReverseProperty(property)) {
                            final boolean asArray = activeCtx.hasContainer(property,
                                    JsonLdConsts.SET) || !opts.getCompactArrays();
                            addValue(result, property, compactedValue.get(property), asArray);
                            compactedValue.remove(property);
                        }
                    }
                    if (compactedValue.size() > 0) {
                        result.set(activeCtx.compactIri(JsonLdConsts.REVERSE, true),
                                compactedValue);
                    }
                }
                continue;
            }

            // 12.5)
            if (JsonLdConsts.INDEX.equals(expandedProperty)
                    && activeCtx.hasContainer(activeProperty, JsonLdConsts.INDEX)) {
                continue;
            }

            // 12.6)
            if (JsonLdConsts.DIRECTION.equals(expandedProperty)
                    || JsonLdConsts.INDEX.equals(expandedProperty)
                    || JsonLdConsts.LANGUAGE.equals(expandedProperty)
                    || JsonLdConsts.VALUE.equals(expandedProperty)) {
                result.set(activeCtx.compactIri(expandedProperty, true), expandedValue);
                continue;
            }

            // 12.7)
            if (expandedValue.isArray() && expandedValue.size() == 0) {
                final String itemActiveProperty = activeCtx.compactIri(expandedProperty,
                        expandedValue, true, insideReverse);
                final ObjectNode nestResult = nestResult(activeCtx, result, itemActiveProperty);
                addValue(nestResult, itemActiveProperty, JsonUtils.newArray(), true);
            }

            // 12.8)
            for (final JsonNode expandedItem : asArray(expandedValue)) {
                compactItem(activeCtx, result, expandedProperty, expandedItem, insideReverse);
            }
        }

        // 13)
        return result;
    }

    /** Step 12.8 of the compaction algorithm for one item of a property. */
    private void compactItem(Context activeCtx, ObjectNode result, String expandedProperty,
            JsonNode expandedItem, boolean insideReverse) throws JsonLdError {
        // 12.8.1)
        final String itemActiveProperty = activeCtx.compactIri(expandedProperty, expandedItem,
                true, insideReverse);
        // 12.8.2)
        final ObjectNode nestResult = nestResult(activeCtx, result, itemActiveProperty);
        // 12.8.3)
        final Set<String> container = activeCtx.getContainer(itemActiveProperty);
        // 12.8.4)
        final boolean asArray = container.contains(JsonLdConsts.SET)
                || JsonLdConsts.GRAPH.equals(itemActiveProperty)
                || JsonLdConsts.LIST.equals(itemActiveProperty) || !opts.getCompactArrays();
        // 12.8.5)
        final JsonNode inner;
        if (isList(expandedItem)) {
            inner = expandedItem.get(JsonLdConsts.LIST);
        } else if (isGraph(expandedItem)) {
            inner = expandedItem.get(JsonLdConsts.GRAPH);
        } else {
            inner = expandedItem;
        }
        JsonNode compactedItem = compact(activeCtx, itemActiveProperty, inner);

        // 12.8.6)
        if (isList(expandedItem)) {
            final ArrayNode items = asArray(compactedItem);
            if (!container.contains(JsonLdConsts.LIST)) {
                final ObjectNode list = JsonUtils.newObject();
                list.set(activeCtx.compactIri(JsonLdConsts.LIST, true), items);
                if (expandedItem.has(JsonLdConsts.INDEX)) {
                    list.set(activeCtx.compactIri(JsonLdConsts.INDEX, true),
                            expandedItem.get(JsonLdConsts.INDEX));
                }
                addValue(nestResult, itemActiveProperty, list, asArray);
            } else {
                if (legacy() && nestResult.has(itemActiveProperty)) {
                    throw new JsonLdError(Error.COMPACTION_TO_LIST_OF_LISTS, itemActiveProperty);
                }
                nestResult.set(itemActiveProperty, items);
            }
            return;
        }

        // 12.8.7)
        if (isGraph(expandedItem)) {
            // 12.8.7.1)
            if (container.contains(JsonLdConsts.GRAPH) && container.contains(JsonLdConsts.ID)) {
                final ObjectNode mapObject = getOrCreateObject(nestResult, itemActiveProperty);
                final String mapKey = expandedItem.has(JsonLdConsts.ID)
                        ? activeCtx.compactIri(expandedItem.get(JsonLdConsts.ID).asText(), false)
                        : activeCtx.compactIri(JsonLdConsts.NONE, true);
                addValue(mapObject, mapKey, compactedItem, asArray);
            }
            // 12.8.7.2)
            else if (container.contains(JsonLdConsts.GRAPH)
                    && container.contains(JsonLdConsts.INDEX)
                    && JsonLdUtils.isSimpleGraph(expandedItem)) {
                final ObjectNode mapObject = getOrCreateObject(nestResult, itemActiveProperty);
                final String mapKey = expandedItem.has(JsonLdConsts.INDEX)
                        ? expandedItem.get(JsonLdConsts.INDEX).asText()
                        : activeCtx.compactIri(JsonLdConsts.NONE, true);
                addValue(mapObject, mapKey, compactedItem, asArray);
            }
            // 12.8.7.3)
            else if (container.contains(JsonLdConsts.GRAPH)
                    && JsonLdUtils.isSimpleGraph(expandedItem)) {
                if (compactedItem.isArray() && compactedItem.size() > 1) {
                    final ObjectNode included = JsonUtils.newObject();
                    included.set(activeCtx.compactIri(JsonLdConsts.INCLUDED, true), compactedItem);
                    compactedItem = included;
                }
                addValue(nestResult, itemActiveProperty, compactedItem, asArray);
            }
            // 12.8.7.4)
            else {
                final ObjectNode graph = JsonUtils.newObject();
                graph.set(activeCtx.compactIri(JsonLdConsts.GRAPH, true), compactedItem);
                if (expandedItem.has(JsonLdConsts.ID)) {
                    graph.put(activeCtx.compactIri(JsonLdConsts.ID, true), activeCtx
                            .compactIri(expandedItem.get(JsonLdConsts.ID).asText(), false));
                }
                if (expandedItem.has(JsonLdConsts.INDEX)) {
                    graph.set(activeCtx.compactIri(JsonLdConsts.INDEX, true),
                            expandedItem.get(JsonLdConsts.INDEX));
                }
                addValue(nestResult, itemActiveProperty, graph, asArray);
            }
            return;
        }

        // 12.8.8)
        if (!container.contains(JsonLdConsts.GRAPH) && (container.contains(JsonLdConsts.LANGUAGE)
                || container.contains(JsonLdConsts.INDEX) || container.contains(JsonLdConsts.ID)
                || container.contains(JsonLdConsts.TYPE))) {
            // 12.8.8.1)
            final ObjectNode mapObject = getOrCreateObject(nestResult, itemActiveProperty);
            // 12.8.8.2)
            final String containerKeyword = container.contains(JsonLdConsts.LANGUAGE)
                    ? JsonLdConsts.LANGUAGE
                    : container.contains(JsonLdConsts.INDEX) ? JsonLdConsts.INDEX
                            : container.contains(JsonLdConsts.ID) ? JsonLdConsts.ID
                                    : JsonLdConsts.TYPE;
            String containerKey = activeCtx.compactIri(containerKeyword, true);
            // 12.8.8.3)
            final TermDefinition itemDef = activeCtx.getTermDefinition(itemActiveProperty);
            final String indexKey = itemDef != null && itemDef.getIndex() != null
                    ? itemDef.getIndex()
                    : JsonLdConsts.INDEX;
            String mapKey = null;

            // 12.8.8.4)
            if (container.contains(JsonLdConsts.LANGUAGE) && expandedItem.has(JsonLdConsts.VALUE)) {
                compactedItem = expandedItem.get(JsonLdConsts.VALUE);
                if (expandedItem.has(JsonLdConsts.LANGUAGE)) {
                    mapKey = expandedItem.get(JsonLdConsts.LANGUAGE).asText();
                }
            }
            // 12.8.8.5)
            else if (container.contains(JsonLdConsts.INDEX)
                    && JsonLdConsts.INDEX.equals(indexKey)) {
                if (expandedItem.has(JsonLdConsts.INDEX)) {
                    mapKey = expandedItem.get(JsonLdConsts.INDEX).asText();
                }
            }
            // 12.8.8.6)
            else if (container.contains(JsonLdConsts.INDEX)) {
                containerKey = activeCtx.compactIri(activeCtx.expandIri(indexKey, false, true),
                        true);
                mapKey = takeFirstString(compactedItem, containerKey);
            }
            // 12.8.8.7)
            else if (container.contains(JsonLdConsts.ID)) {
                if (compactedItem.isObject() && compactedItem.has(containerKey)) {
                    mapKey = compactedItem.get(containerKey).asText();
                    ((ObjectNode) compactedItem).remove(containerKey);
                }
            }
            // 12.8.8.8)
            else {
                mapKey = takeFirstString(compactedItem, containerKey);
                // 12.8.8.8.4)
                if (mapKey != null && compactedItem.size() == 1 && expandedItem.has(JsonLdConsts.ID)
                        && JsonLdConsts.ID.equals(activeCtx
                                .expandIri(compactedItem.fieldNames().next(), false, true))) {
                    final ObjectNode reference = JsonUtils.newObject();
                    reference.set(JsonLdConsts.ID, expandedItem.get(JsonLdConsts.ID));
                    compactedItem = compact(activeCtx, itemActiveProperty, reference);
                }
            }
            // 12.8.8.9)
            if (mapKey == null) {
                mapKey = activeCtx.compactIri(JsonLdConsts.NONE, true);
            }
            // 12.8.8.10)
            addValue(mapObject, mapKey, compactedItem, asArray);
            return;
        }

        // 12.8.9)
        addValue(nestResult, itemActiveProperty, compactedItem, asArray);
    }

    /**
     * Removes the first value of {@code key} from a compacted map and returns
     * it if it is a string. Remaining values stay in place.
     */
    private static String takeFirstString(JsonNode compactedItem, String key) {
        if (!compactedItem.isObject() || !compactedItem.has(key)) {
            return null;
        }
        final ObjectNode item = (ObjectNode) compactedItem;
        final List<JsonNode> values = new ArrayList<JsonNode>();
        for (final JsonNode v : asArray(item.get(key))) {
            values.add(v);
        }
        if (values.isEmpty() || !values.get(0).isTextual()) {
            return null;
        }
        final String first = values.remove(0).asText();
        if (values.isEmpty()) {
            item.remove(key);
        } else if (values.size() == 1) {
            item.set(key, values.get(0));
        } else {
            final ArrayNode rest = JsonUtils.newArray();
            rest.addAll(values);
            item.set(key, rest);
        }
        return first;
    }

    /**
     * @return the map a compacted property is added to: the result itself or
     *         the nesting map named by the term's {@code @nest}
     */
    private ObjectNode nestResult(Context activeCtx, ObjectNode result, String itemActiveProperty)
            throws JsonLdError {
        final TermDefinition td = activeCtx.getTermDefinition(itemActiveProperty);
        if (td == null || td.getNest() == null) {
            return result;
        }
        final String nestTerm = td.getNest();
        if (!JsonLdConsts.NEST.equals(nestTerm)
                && !JsonLdConsts.NEST.equals(activeCtx.expandIri(nestTerm, false, true))) {
            throw new JsonLdError(Error.INVALID_NEST_VALUE, nestTerm);
        }
        final JsonNode existing = result.get(nestTerm);
        if (existing != null && !existing.isObject()) {
            throw new JsonLdError(Error.INVALID_NEST_VALUE,
                    "Nesting property already holds a non-map value: " + nestTerm);
        }
        return getOrCreateObject(result, nestTerm);
    }

    /**
     * Gives every node object of an expanded document a blank node
     * identifier, relabelling existing blank node identifiers consistently.
     */
    public void labelBlankNodes(JsonNode element) {
        if (element == null) {
            return;
        }
        if (element.isArray()) {
            for (final JsonNode item : element) {
                labelBlankNodes(item);
            }
            return;
        }
        if (!element.isObject() || isValue(element)) {
            return;
        }
        final ObjectNode node = (ObjectNode) element;
        if (isList(node)) {
            labelBlankNodes(node.get(JsonLdConsts.LIST));
            return;
        }
        for (final String key : sortedKeys(node)) {
            final JsonNode value = node.get(key);
            if (JsonLdConsts.ID.equals(key)) {
                if (value.isTextual() && JsonLdUtils.isBlankNodeId(value.asText())) {
                    node.put(JsonLdConsts.ID, generator.generate(value.asText()));
                }
            } else if (JsonLdConsts.TYPE.equals(key)) {
                final ArrayNode types = JsonUtils.newArray();
                for (final JsonNode type : asArray(value)) {
                    types.add(JsonLdUtils.isBlankNodeId(type.asText())
                            ? TextNode.valueOf(generator.generate(type.asText()))
                            : type);
                }
                node.set(JsonLdConsts.TYPE, types);
            } else if (JsonLdConsts.REVERSE.equals(key)) {
                final Iterator<JsonNode> values = value.elements();
                while (values.hasNext()) {
                    labelBlankNodes(values.next());
                }
            } else if (value.isContainerNode()) {
                labelBlankNodes(value);
            }
        }
        if (JsonLdUtils.isNode(node) && !node.has(JsonLdConsts.ID)) {
            node.put(JsonLdConsts.ID, generator.generate());
        }
    }
}

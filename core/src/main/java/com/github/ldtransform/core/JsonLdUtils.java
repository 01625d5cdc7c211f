package com.github.ldtransform.core;

import java.util.Iterator;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.ldtransform.utils.JsonUtils;

/**
 * Shape predicates and small tree helpers shared by the algorithms.
 */
public class JsonLdUtils {

    private JsonLdUtils() {
    }

    /**
     * Returns true if the given value is a value object.
     *
     * @param v
     *            the value to check.
     */
    public static boolean isValue(JsonNode v) {
        return v != null && v.isObject() && v.has(JsonLdConsts.VALUE);
    }

    public static boolean isList(JsonNode v) {
        return v != null && v.isObject() && v.has(JsonLdConsts.LIST);
    }

    /**
     * A graph object has a {@code @graph} entry and may otherwise only hold
     * {@code @id}, {@code @index} and {@code @context}.
     */
    public static boolean isGraph(JsonNode v) {
        if (v == null || !v.isObject() || !v.has(JsonLdConsts.GRAPH)) {
            return false;
        }
        final Iterator<String> keys = v.fieldNames();
        while (keys.hasNext()) {
            final String key = keys.next();
            if (!JsonLdConsts.GRAPH.equals(key) && !JsonLdConsts.ID.equals(key)
                    && !JsonLdConsts.INDEX.equals(key) && !JsonLdConsts.CONTEXT.equals(key)) {
                return false;
            }
        }
        return true;
    }

    /** A graph object without an {@code @id}. */
    public static boolean isSimpleGraph(JsonNode v) {
        return isGraph(v) && !v.has(JsonLdConsts.ID);
    }

    /**
     * A node object is a map that is not a value, list, set or graph object.
     */
    public static boolean isNode(JsonNode v) {
        return v != null && v.isObject() && !v.has(JsonLdConsts.VALUE) && !v.has(JsonLdConsts.LIST)
                && !v.has(JsonLdConsts.SET) && !isGraph(v);
    }

    /** A node reference is a map holding nothing but an {@code @id}. */
    public static boolean isNodeReference(JsonNode v) {
        return v != null && v.isObject() && v.size() == 1 && v.has(JsonLdConsts.ID);
    }

    public static boolean isBlankNodeId(String v) {
        return v != null && v.startsWith("_:");
    }

    public static boolean isScalar(JsonNode v) {
        return v != null && (v.isTextual() || v.isNumber() || v.isBoolean());
    }

    /**
     * @return the value itself if it is an array, otherwise a new array holding
     *         it
     */
    public static ArrayNode asArray(JsonNode v) {
        if (v.isArray()) {
            return (ArrayNode) v;
        }
        final ArrayNode rval = JsonUtils.newArray();
        rval.add(v);
        return rval;
    }

    /**
     * Adds a value to a subject's property. If the value is an array all its
     * items are added.
     *
     * @param subject
     *            the subject to add the value to.
     * @param property
     *            the property that relates the value to the subject.
     * @param value
     *            the value to add.
     * @param asArray
     *            true to keep the property an array even when it holds a
     *            single value.
     */
    public static void addValue(ObjectNode subject, String property, JsonNode value, boolean asArray) {
        if (asArray && !subject.has(property)) {
            subject.set(property, JsonUtils.newArray());
        } else if (asArray && !subject.get(property).isArray()) {
            subject.set(property, asArray(subject.get(property)));
        }
        if (value.isArray()) {
            for (final JsonNode item : value) {
                addValue(subject, property, item, asArray);
            }
            return;
        }
        final JsonNode existing = subject.get(property);
        if (existing == null) {
            subject.set(property, value);
        } else if (existing.isArray()) {
            ((ArrayNode) existing).add(value);
        } else {
            final ArrayNode tmp = JsonUtils.newArray();
            tmp.add(existing);
            tmp.add(value);
            subject.set(property, tmp);
        }
    }

    /**
     * Compares two strings first based on length and then lexicographically.
     *
     * @return -1 if a < b, 1 if a > b, 0 if a == b.
     */
    public static int compareShortestLeast(String a, String b) {
        if (a.length() < b.length()) {
            return -1;
        } else if (b.length() < a.length()) {
            return 1;
        }
        return Integer.signum(a.compareTo(b));
    }

    /**
     * Structural equality of two JSON-LD trees. Arrays compare as multisets,
     * except the arrays of {@code @list} entries which compare in order. Maps
     * compare regardless of key order and numbers by numeric value.
     */
    public static boolean deepCompare(JsonNode a, JsonNode b) {
        if (a == null || b == null) {
            return a == b;
        }
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue()) == 0;
        }
        if (a.getNodeType() != b.getNodeType()) {
            return false;
        }
        switch (a.getNodeType()) {
        case ARRAY:
            return compareUnordered(a, b);
        case OBJECT:
            if (a.size() != b.size()) {
                return false;
            }
            final Iterator<Map.Entry<String, JsonNode>> fields = a.fields();
            while (fields.hasNext()) {
                final Map.Entry<String, JsonNode> field = fields.next();
                final JsonNode other = b.get(field.getKey());
                if (other == null) {
                    return false;
                }
                if (JsonLdConsts.LIST.equals(field.getKey()) && field.getValue().isArray()
                        && other.isArray()) {
                    if (!compareOrdered(field.getValue(), other)) {
                        return false;
                    }
                } else if (!deepCompare(field.getValue(), other)) {
                    return false;
                }
            }
            return true;
        default:
            return a.equals(b);
        }
    }

    private static boolean compareOrdered(JsonNode a, JsonNode b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (!deepCompare(a.get(i), b.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean compareUnordered(JsonNode a, JsonNode b) {
        if (a.size() != b.size()) {
            return false;
        }
        final boolean[] selected = new boolean[b.size()];
        for (final JsonNode item : a) {
            boolean found = false;
            for (int i = 0; i < b.size(); i++) {
                if (!selected[i] && deepCompare(item, b.get(i))) {
                    selected[i] = true;
                    found = true;
                    break;
                }
            }
            if (!found) {
                return false;
            }
        }
        return true;
    }
}

package com.github.ldtransform.core;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The single failure type of both algorithms. The {@link Error} is always set;
 * the message carries the human-readable detail.
 *
 * @author tristan
 */
public class JsonLdError extends Exception {

    private static final long serialVersionUID = -8685402790466459014L;

    private final Map<String, Object> details = new LinkedHashMap<String, Object>();
    private final Error type;

    public JsonLdError(Error type, Object detail) {
        super(detail == null ? "" : detail.toString());
        this.type = type;
    }

    public JsonLdError(Error type, Object detail, Throwable cause) {
        super(detail == null ? "" : detail.toString(), cause);
        this.type = type;
    }

    public JsonLdError(Error type) {
        super("");
        this.type = type;
    }

    public JsonLdError setDetail(String key, Object val) {
        details.put(key, val);
        return this;
    }

    /**
     * The closed set of failure conditions. {@link #toString()} yields the
     * error code string of the JSON-LD API.
     */
    public enum Error {
        COLLIDING_KEYWORDS("colliding keywords"),

        CONFLICTING_INDEXES("conflicting indexes"),

        CONTEXT_OVERFLOW("context overflow"),

        CYCLIC_IRI_MAPPING("cyclic IRI mapping"),

        INVALID_ID_VALUE("invalid @id value"),

        INVALID_IMPORT_VALUE("invalid @import value"),

        INVALID_INCLUDED_VALUE("invalid @included value"),

        INVALID_INDEX_VALUE("invalid @index value"),

        INVALID_NEST_VALUE("invalid @nest value"),

        INVALID_PREFIX_VALUE("invalid @prefix value"),

        INVALID_PROPAGATE_VALUE("invalid @propagate value"),

        INVALID_PROTECTED_VALUE("invalid @protected value"),

        INVALID_REVERSE_VALUE("invalid @reverse value"),

        INVALID_VERSION_VALUE("invalid @version value"),

        INVALID_BASE_DIRECTION("invalid base direction"),

        INVALID_BASE_IRI("invalid base IRI"),

        INVALID_CONTAINER_MAPPING("invalid container mapping"),

        INVALID_CONTEXT_ENTRY("invalid context entry"),

        INVALID_CONTEXT_NULLIFICATION("invalid context nullification"),

        INVALID_DEFAULT_LANGUAGE("invalid default language"),

        INVALID_IRI_MAPPING("invalid IRI mapping"),

        INVALID_JSON_LITERAL("invalid JSON literal"),

        INVALID_KEYWORD_ALIAS("invalid keyword alias"),

        INVALID_LANGUAGE_MAP_VALUE("invalid language map value"),

        INVALID_LANGUAGE_MAPPING("invalid language mapping"),

        INVALID_LANGUAGE_TAGGED_STRING("invalid language-tagged string"),

        INVALID_LANGUAGE_TAGGED_VALUE("invalid language-tagged value"),

        INVALID_LOCAL_CONTEXT("invalid local context"),

        INVALID_REMOTE_CONTEXT("invalid remote context"),

        INVALID_REVERSE_PROPERTY("invalid reverse property"),

        INVALID_REVERSE_PROPERTY_MAP("invalid reverse property map"),

        INVALID_REVERSE_PROPERTY_VALUE("invalid reverse property value"),

        INVALID_SCOPED_CONTEXT("invalid scoped context"),

        INVALID_SCRIPT_ELEMENT("invalid script element"),

        INVALID_SET_OR_LIST_OBJECT("invalid set or list object"),

        INVALID_TERM("invalid term"),

        INVALID_TERM_DEFINITION("invalid term definition"),

        INVALID_TYPE_MAPPING("invalid type mapping"),

        INVALID_TYPE_VALUE("invalid type value"),

        INVALID_TYPED_VALUE("invalid typed value"),

        INVALID_VALUE_OBJECT("invalid value object"),

        INVALID_VALUE_OBJECT_VALUE("invalid value object value"),

        INVALID_VOCAB_MAPPING("invalid vocab mapping"),

        IRI_CONFUSED_WITH_PREFIX("IRI confused with prefix"),

        KEYWORD_REDEFINITION("keyword redefinition"),

        LOADING_DOCUMENT_FAILED("loading document failed"),

        LOADING_REMOTE_CONTEXT_FAILED("loading remote context failed"),

        PROCESSING_MODE_CONFLICT("processing mode conflict"),

        PROTECTED_TERM_REDEFINITION("protected term redefinition"),

        RECURSIVE_CONTEXT_INCLUSION("recursive context inclusion"),

        COMPACTION_TO_LIST_OF_LISTS("compaction to list of lists"),

        LIST_OF_LISTS("list of lists"),

        RECURSION_DEPTH_EXCEEDED("recursion depth exceeded");

        private final String error;

        private Error(String error) {
            this.error = error;
        }

        @Override
        public String toString() {
            return error;
        }

        /**
         * Looks up a constant by its error code string, as used by
         * conformance fixtures.
         *
         * @return the matching constant, or null
         */
        public static Error fromCode(String code) {
            for (final Error e : values()) {
                if (e.error.equals(code)) {
                    return e;
                }
            }
            return null;
        }
    }

    public Error getType() {
        return type;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    @Override
    public String getMessage() {
        final String msg = super.getMessage();
        final StringBuilder sb = new StringBuilder(type.toString());
        if (msg != null && !"".equals(msg)) {
            sb.append(": ").append(msg);
        }
        for (final Map.Entry<String, Object> entry : details.entrySet()) {
            sb.append(" {").append(entry.getKey()).append(":").append(entry.getValue()).append("}");
        }
        return sb.toString();
    }
}

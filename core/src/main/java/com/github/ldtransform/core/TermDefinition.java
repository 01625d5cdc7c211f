package com.github.ldtransform.core;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The resolved meaning of a term within an active context. Instances are
 * immutable and are shared between a context and the contexts derived from
 * it.
 */
public final class TermDefinition {

    private final String id;
    private final boolean prefix;
    private final boolean protectedTerm;
    private final boolean reverse;
    private final String baseUrl;
    private final JsonNode context;
    private final Set<String> container;
    private final String typeMapping;
    private final boolean hasLanguageMapping;
    private final String languageMapping;
    private final boolean hasDirectionMapping;
    private final String directionMapping;
    private final String nest;
    private final String index;

    private TermDefinition(Builder b) {
        this.id = b.id;
        this.prefix = b.prefix;
        this.protectedTerm = b.protectedTerm;
        this.reverse = b.reverse;
        this.baseUrl = b.baseUrl;
        this.context = b.context;
        this.container = Collections.unmodifiableSet(new LinkedHashSet<String>(b.container));
        this.typeMapping = b.typeMapping;
        this.hasLanguageMapping = b.hasLanguageMapping;
        this.languageMapping = b.languageMapping;
        this.hasDirectionMapping = b.hasDirectionMapping;
        this.directionMapping = b.directionMapping;
        this.nest = b.nest;
        this.index = b.index;
    }

    /**
     * @return the IRI mapping; a keyword for keyword aliases, or null for a
     *         term explicitly decoupled from IRI expansion
     */
    public String getId() {
        return id;
    }

    public boolean isPrefix() {
        return prefix;
    }

    public boolean isProtected() {
        return protectedTerm;
    }

    public boolean isReverse() {
        return reverse;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * @return the scoped context, or null if none was declared. A declared
     *         {@code "@context": null} is a NullNode.
     */
    public JsonNode getContext() {
        return context;
    }

    public boolean hasContext() {
        return context != null;
    }

    /**
     * @return the container mapping, empty when there is none
     */
    public Set<String> getContainer() {
        return container;
    }

    public boolean hasContainer(String keyword) {
        return container.contains(keyword);
    }

    public String getTypeMapping() {
        return typeMapping;
    }

    public boolean hasLanguageMapping() {
        return hasLanguageMapping;
    }

    public String getLanguageMapping() {
        return languageMapping;
    }

    public boolean hasDirectionMapping() {
        return hasDirectionMapping;
    }

    public String getDirectionMapping() {
        return directionMapping;
    }

    public String getNest() {
        return nest;
    }

    public String getIndex() {
        return index;
    }

    /**
     * Compares every aspect of two definitions except the protected flag.
     */
    public boolean sameDefinitionAs(TermDefinition other) {
        return other != null && Objects.equals(id, other.id) && prefix == other.prefix
                && reverse == other.reverse && Objects.equals(context, other.context)
                && container.equals(other.container)
                && Objects.equals(typeMapping, other.typeMapping)
                && hasLanguageMapping == other.hasLanguageMapping
                && Objects.equals(languageMapping, other.languageMapping)
                && hasDirectionMapping == other.hasDirectionMapping
                && Objects.equals(directionMapping, other.directionMapping)
                && Objects.equals(nest, other.nest) && Objects.equals(index, other.index);
    }

    /**
     * @return the container mapping as a single key, the sorted keywords
     *         concatenated ({@code @index@set}), or {@code @none}
     */
    String containerKey() {
        if (container.isEmpty()) {
            return JsonLdConsts.NONE;
        }
        final StringBuilder sb = new StringBuilder();
        for (final String c : new TreeSet<String>(container)) {
            sb.append(c);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "TermDefinition{@id=" + id + (reverse ? ", @reverse" : "")
                + (container.isEmpty() ? "" : ", @container=" + container)
                + (typeMapping == null ? "" : ", @type=" + typeMapping)
                + (hasLanguageMapping ? ", @language=" + languageMapping : "")
                + (hasDirectionMapping ? ", @direction=" + directionMapping : "")
                + (protectedTerm ? ", @protected" : "") + "}";
    }

    static Builder builder() {
        return new Builder();
    }

    static final class Builder {
        private String id;
        private boolean prefix;
        private boolean protectedTerm;
        private boolean reverse;
        private String baseUrl;
        private JsonNode context;
        private final Set<String> container = new LinkedHashSet<String>();
        private String typeMapping;
        private boolean hasLanguageMapping;
        private String languageMapping;
        private boolean hasDirectionMapping;
        private String directionMapping;
        private String nest;
        private String index;

        Builder id(String id) {
            this.id = id;
            return this;
        }

        String id() {
            return id;
        }

        Builder prefix(boolean prefix) {
            this.prefix = prefix;
            return this;
        }

        boolean prefix() {
            return prefix;
        }

        Builder protectedTerm(boolean protectedTerm) {
            this.protectedTerm = protectedTerm;
            return this;
        }

        Builder reverse(boolean reverse) {
            this.reverse = reverse;
            return this;
        }

        Builder context(JsonNode context, String baseUrl) {
            this.context = context;
            this.baseUrl = baseUrl;
            return this;
        }

        Builder container(String value) {
            this.container.add(value);
            return this;
        }

        Set<String> container() {
            return container;
        }

        Builder typeMapping(String typeMapping) {
            this.typeMapping = typeMapping;
            return this;
        }

        String typeMapping() {
            return typeMapping;
        }

        Builder languageMapping(String language) {
            this.hasLanguageMapping = true;
            this.languageMapping = language;
            return this;
        }

        Builder directionMapping(String direction) {
            this.hasDirectionMapping = true;
            this.directionMapping = direction;
            return this;
        }

        Builder nest(String nest) {
            this.nest = nest;
            return this;
        }

        Builder index(String index) {
            this.index = index;
            return this;
        }

        TermDefinition build() {
            return new TermDefinition(this);
        }
    }
}

package com.github.ldtransform.core;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Serves documents registered up front, such as well-known contexts shipped
 * with an application. Unknown IRIs go to the fallback loader, if any.
 */
public class InMemoryDocumentLoader implements DocumentLoader {

    private final Map<String, JsonNode> documents = new ConcurrentHashMap<String, JsonNode>();
    private final DocumentLoader fallback;

    public InMemoryDocumentLoader() {
        this(null);
    }

    public InMemoryDocumentLoader(DocumentLoader fallback) {
        this.fallback = fallback;
    }

    public InMemoryDocumentLoader addDocument(String url, JsonNode document) {
        documents.put(url, document);
        return this;
    }

    @Override
    public RemoteDocument loadDocument(String url) throws JsonLdError {
        final JsonNode document = documents.get(url);
        if (document != null) {
            return new RemoteDocument(url, document);
        }
        if (fallback != null) {
            return fallback.loadDocument(url);
        }
        throw DocumentLoader.failure(url, Failure.NOT_FOUND, null, null);
    }
}

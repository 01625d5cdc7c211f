package com.github.ldtransform.core;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A document returned by a {@link DocumentLoader}.
 */
public class RemoteDocument {

    private final String documentUrl;
    private final JsonNode document;
    private final String contextUrl;

    public RemoteDocument(String documentUrl, JsonNode document) {
        this(documentUrl, document, null);
    }

    public RemoteDocument(String documentUrl, JsonNode document, String contextUrl) {
        this.documentUrl = documentUrl;
        this.document = document;
        this.contextUrl = contextUrl;
    }

    /**
     * @return the final IRI of the document, after any redirects
     */
    public String getDocumentUrl() {
        return documentUrl;
    }

    public JsonNode getDocument() {
        return document;
    }

    /**
     * @return the IRI of a context linked through an HTTP Link header, or null
     */
    public String getContextUrl() {
        return contextUrl;
    }
}

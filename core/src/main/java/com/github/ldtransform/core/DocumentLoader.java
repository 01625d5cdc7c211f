package com.github.ldtransform.core;

/**
 * Retrieves remote documents, most often contexts referenced by IRI.
 * Implementations must return the same result for the same IRI within one
 * logical run; they may cache, follow redirects or time out as they see fit.
 */
public interface DocumentLoader {

    /** Detail key under which a failed load reports its {@link Failure}. */
    String FAILURE_DETAIL = "failure";

    /**
     * Why a document could not be loaded.
     */
    enum Failure {
        NOT_FOUND,

        LOADING_FAILED
    }

    /**
     * Loads the document at the given IRI.
     *
     * @param url
     *            an absolute IRI
     * @return the parsed document together with its final IRI
     * @throws JsonLdError
     *             of type {@link JsonLdError.Error#LOADING_DOCUMENT_FAILED},
     *             with a {@link Failure} under {@link #FAILURE_DETAIL}
     */
    RemoteDocument loadDocument(String url) throws JsonLdError;

    /**
     * Builds the error a loader raises when {@code url} cannot be loaded.
     */
    static JsonLdError failure(String url, Failure failure, String message, Throwable cause) {
        final String detail = message == null ? url : url + " (" + message + ")";
        return new JsonLdError(JsonLdError.Error.LOADING_DOCUMENT_FAILED, detail, cause)
                .setDetail(FAILURE_DETAIL, failure);
    }
}

package com.github.ldtransform.core;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Remembers every document its delegate loads. Concurrent requests for the
 * same IRI share one in-flight load; requests for distinct IRIs proceed in
 * parallel. Failed loads are forgotten so that a later request retries.
 */
public class CachingDocumentLoader implements DocumentLoader {

    private static final Logger LOG = LoggerFactory.getLogger(CachingDocumentLoader.class);

    private final DocumentLoader delegate;
    private final ConcurrentMap<String, CompletableFuture<RemoteDocument>> cache = new ConcurrentHashMap<String, CompletableFuture<RemoteDocument>>();

    public CachingDocumentLoader(DocumentLoader delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate loader is required");
        }
        this.delegate = delegate;
    }

    @Override
    public RemoteDocument loadDocument(String url) throws JsonLdError {
        final CompletableFuture<RemoteDocument> created = new CompletableFuture<RemoteDocument>();
        final CompletableFuture<RemoteDocument> existing = cache.putIfAbsent(url, created);
        if (existing != null) {
            LOG.debug("Cache hit for {}", url);
            return await(url, existing);
        }
        try {
            final RemoteDocument document = delegate.loadDocument(url);
            created.complete(document);
            return document;
        } catch (final JsonLdError | RuntimeException e) {
            cache.remove(url, created);
            created.completeExceptionally(e);
            throw e;
        }
    }

    private static RemoteDocument await(String url, CompletableFuture<RemoteDocument> future)
            throws JsonLdError {
        try {
            return future.get();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw DocumentLoader.failure(url, Failure.LOADING_FAILED, "interrupted", e);
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof JsonLdError) {
                throw (JsonLdError) cause;
            }
            throw DocumentLoader.failure(url, Failure.LOADING_FAILED, String.valueOf(cause), cause);
        }
    }

    public int size() {
        return cache.size();
    }

    public void clear() {
        cache.clear();
    }
}

package com.github.ldtransform.core;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.nio.file.NoSuchFileException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.HttpStatus;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.protocol.HttpClientContext;
import org.apache.http.impl.client.CloseableHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.ldtransform.utils.JsonLdUrl;
import com.github.ldtransform.utils.JsonUtils;

/**
 * Loads documents over HTTP(S) with a caching Apache HttpClient, and from any
 * other URL scheme the JVM understands ({@code file:}, {@code jar:}).
 */
public class DefaultDocumentLoader implements DocumentLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultDocumentLoader.class);

    /**
     * System property which, when {@code true}, makes every HTTP(S) load fail.
     */
    public static final String DISALLOW_REMOTE_CONTEXT_LOADING = "com.github.ldtransform.disallowRemoteContextLoading";

    private static final String LINK_CONTEXT_REL = "http://www.w3.org/ns/json-ld#context";

    private static final Pattern LINK_HEADER = Pattern.compile("<([^>]*)>\\s*;(.*)");

    private volatile CloseableHttpClient httpClient;

    public DefaultDocumentLoader() {
    }

    public DefaultDocumentLoader(CloseableHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public RemoteDocument loadDocument(String url) throws JsonLdError {
        final URL parsed;
        try {
            parsed = new URL(url);
        } catch (final MalformedURLException e) {
            throw DocumentLoader.failure(url, Failure.LOADING_FAILED, e.getMessage(), e);
        }
        final String protocol = parsed.getProtocol().toLowerCase(Locale.ROOT);
        if ("http".equals(protocol) || "https".equals(protocol)) {
            if (Boolean.getBoolean(DISALLOW_REMOTE_CONTEXT_LOADING)) {
                throw DocumentLoader.failure(url, Failure.LOADING_FAILED,
                        "remote document loading is disabled", null);
            }
            return loadHttp(url);
        }
        LOG.debug("Loading {} from {}", url, protocol);
        try (InputStream in = parsed.openStream()) {
            return new RemoteDocument(url, JsonUtils.fromInputStream(in));
        } catch (final FileNotFoundException | NoSuchFileException e) {
            throw DocumentLoader.failure(url, Failure.NOT_FOUND, e.getMessage(), e);
        } catch (final IOException e) {
            throw DocumentLoader.failure(url, Failure.LOADING_FAILED, e.getMessage(), e);
        }
    }

    private RemoteDocument loadHttp(String url) throws JsonLdError {
        final HttpGet request = new HttpGet(url);
        request.addHeader("Accept", JsonUtils.ACCEPT_HEADER);
        final HttpClientContext context = HttpClientContext.create();
        LOG.debug("Fetching {}", url);
        try (CloseableHttpResponse response = getHttpClient().execute(request, context)) {
            final int status = response.getStatusLine().getStatusCode();
            if (status == HttpStatus.SC_NOT_FOUND || status == HttpStatus.SC_GONE) {
                throw DocumentLoader.failure(url, Failure.NOT_FOUND, "HTTP " + status, null);
            }
            if (status != HttpStatus.SC_OK) {
                throw DocumentLoader.failure(url, Failure.LOADING_FAILED, "HTTP " + status, null);
            }
            final HttpEntity entity = response.getEntity();
            if (entity == null) {
                throw DocumentLoader.failure(url, Failure.LOADING_FAILED, "empty response", null);
            }
            final JsonNode document;
            try (InputStream in = entity.getContent()) {
                document = JsonUtils.fromInputStream(in);
            }

            String finalUrl = url;
            final List<URI> redirects = context.getRedirectLocations();
            if (redirects != null && !redirects.isEmpty()) {
                finalUrl = redirects.get(redirects.size() - 1).toString();
            }

            String contextUrl = null;
            final Header contentType = entity.getContentType();
            if (contentType == null || !contentType.getValue().startsWith("application/ld+json")) {
                contextUrl = linkedContext(finalUrl, response.getHeaders("Link"));
            }
            return new RemoteDocument(finalUrl, document, contextUrl);
        } catch (final IOException e) {
            throw DocumentLoader.failure(url, Failure.LOADING_FAILED, e.getMessage(), e);
        }
    }

    private static String linkedContext(String baseUrl, Header[] links) {
        for (final Header header : links) {
            for (final String link : header.getValue().split(",")) {
                final Matcher matcher = LINK_HEADER.matcher(link.trim());
                if (matcher.matches() && matcher.group(2).contains("rel=\"" + LINK_CONTEXT_REL + "\"")) {
                    return JsonLdUrl.resolve(baseUrl, matcher.group(1));
                }
            }
        }
        return null;
    }

    private CloseableHttpClient getHttpClient() {
        CloseableHttpClient result = httpClient;
        if (result == null) {
            result = httpClient = JsonUtils.getDefaultHttpClient();
        }
        return result;
    }
}

package com.github.ldtransform.utils;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.cache.CacheConfig;
import org.apache.http.impl.client.cache.CachingHttpClientBuilder;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A bunch of functions to make loading and printing JSON trees easy.
 *
 * @author tristan
 *
 */
public class JsonUtils {

    /**
     * An HTTP Accept header that prefers JSONLD.
     */
    public static final String ACCEPT_HEADER = "application/ld+json, application/json;q=0.9, */*;q=0.1";

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    static {
        JSON_MAPPER.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        JSON_MAPPER.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        // numbers keep the representation they were parsed with
        JSON_MAPPER.disable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        JSON_MAPPER.disable(DeserializationFeature.USE_BIG_INTEGER_FOR_INTS);
    }

    private static volatile CloseableHttpClient DEFAULT_HTTP_CLIENT;

    /**
     * Parses a JSON document held in a string.
     *
     * @param jsonString
     *            the JSON text
     * @return the parsed tree; a {@code null} literal parses to a NullNode
     * @throws JsonParseException
     *             if the text is not well-formed JSON
     * @throws JsonProcessingException
     *             if the text could not be read for another reason
     */
    public static JsonNode fromString(String jsonString) throws JsonProcessingException {
        final JsonNode rval = JSON_MAPPER.readTree(jsonString);
        if (rval == null || rval.isMissingNode()) {
            throw new JsonParseException(null, "document is empty");
        }
        return rval;
    }

    public static JsonNode fromReader(Reader r) throws IOException {
        final JsonNode rval = JSON_MAPPER.readTree(r);
        if (rval == null || rval.isMissingNode()) {
            throw new JsonParseException(null, "document is empty");
        }
        return rval;
    }

    public static JsonNode fromInputStream(InputStream content) throws IOException {
        // no readers from inputstreams w.o. encoding!!
        return fromInputStream(content, StandardCharsets.UTF_8);
    }

    public static JsonNode fromInputStream(InputStream content, Charset enc) throws IOException {
        try (final Reader in = new InputStreamReader(content, enc)) {
            return fromReader(in);
        }
    }

    public static void write(Writer w, JsonNode jsonObject) throws IOException {
        JSON_MAPPER.writeValue(w, jsonObject);
    }

    public static void writePrettyPrint(Writer w, JsonNode jsonObject) throws IOException {
        final ObjectWriter objectWriter = JSON_MAPPER.writerWithDefaultPrettyPrinter();
        objectWriter.writeValue(w, jsonObject);
    }

    public static String toPrettyString(JsonNode obj) {
        final StringWriter sw = new StringWriter();
        try {
            writePrettyPrint(sw, obj);
        } catch (final IOException e) {
            // a StringWriter never fails, so this is a serialization bug
            throw new IllegalStateException("Could not serialize " + obj.getNodeType(), e);
        }
        return sw.toString();
    }

    public static String toString(JsonNode obj) {
        final StringWriter sw = new StringWriter();
        try {
            write(sw, obj);
        } catch (final IOException e) {
            throw new IllegalStateException("Could not serialize " + obj.getNodeType(), e);
        }
        return sw.toString();
    }

    public static ObjectNode newObject() {
        return JsonNodeFactory.instance.objectNode();
    }

    public static ArrayNode newArray() {
        return JsonNodeFactory.instance.arrayNode();
    }

    /**
     * Returns a shared caching HTTP client, created on first use.
     *
     * @return the default client used to dereference remote documents
     */
    public static CloseableHttpClient getDefaultHttpClient() {
        CloseableHttpClient result = DEFAULT_HTTP_CLIENT;
        if (result == null) {
            synchronized (JsonUtils.class) {
                result = DEFAULT_HTTP_CLIENT;
                if (result == null) {
                    result = DEFAULT_HTTP_CLIENT = createDefaultHttpClient();
                }
            }
        }
        return result;
    }

    public static CloseableHttpClient createDefaultHttpClient() {
        final CacheConfig cacheConfig = CacheConfig.custom().setMaxCacheEntries(500)
                .setMaxObjectSize(1024 * 256).setSharedCache(false).build();
        final RequestConfig requestConfig = RequestConfig.custom().setConnectTimeout(10000)
                .setSocketTimeout(30000).build();
        return CachingHttpClientBuilder.create()
                // allow caching
                .setCacheConfig(cacheConfig)
                .setDefaultRequestConfig(requestConfig)
                // Wrap the local JVM proxy settings
                .useSystemProperties().build();
    }
}

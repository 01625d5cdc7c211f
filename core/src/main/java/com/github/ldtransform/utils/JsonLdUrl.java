package com.github.ldtransform.utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * IRI reference parsing, resolution and relativization following RFC 3986.
 */
public class JsonLdUrl {

    private static final Pattern PARSER = Pattern
            .compile("^(?:([^:/?#]+):)?(?://([^/?#]*))?([^?#]*)(?:\\?([^#]*))?(?:#(.*))?$",
                    Pattern.DOTALL);

    private static final Pattern SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.\\-]*:.*",
            Pattern.DOTALL);

    public String scheme = null;
    public String authority = null;
    public String path = "";
    public String query = null;
    public String fragment = null;

    private JsonLdUrl() {
    }

    /**
     * Splits an IRI reference into its five components. Absent components
     * are null; the path is never null.
     */
    public static JsonLdUrl parse(String url) {
        final JsonLdUrl rval = new JsonLdUrl();
        final Matcher matcher = PARSER.matcher(url);
        if (matcher.matches()) {
            rval.scheme = matcher.group(1);
            rval.authority = matcher.group(2);
            rval.path = matcher.group(3) == null ? "" : matcher.group(3);
            rval.query = matcher.group(4);
            rval.fragment = matcher.group(5);
        }
        return rval;
    }

    public static boolean isAbsoluteIri(String value) {
        return value != null && SCHEME.matcher(value).matches();
    }

    /**
     * Removes dot segments from a URL path (RFC 3986 section 5.2.4).
     *
     * @param path
     *            the path to normalize.
     * @return the normalized path.
     */
    public static String removeDotSegments(String path) {
        String input = path;
        final StringBuilder output = new StringBuilder();
        while (input.length() > 0) {
            if (input.startsWith("../")) {
                input = input.substring(3);
            } else if (input.startsWith("./")) {
                input = input.substring(2);
            } else if (input.startsWith("/./")) {
                input = input.substring(2);
            } else if ("/.".equals(input)) {
                input = "/";
            } else if (input.startsWith("/../")) {
                input = input.substring(3);
                removeLastSegment(output);
            } else if ("/..".equals(input)) {
                input = "/";
                removeLastSegment(output);
            } else if (".".equals(input) || "..".equals(input)) {
                input = "";
            } else {
                int end = input.indexOf('/', input.startsWith("/") ? 1 : 0);
                if (end < 0) {
                    end = input.length();
                }
                output.append(input, 0, end);
                input = input.substring(end);
            }
        }
        return output.toString();
    }

    private static void removeLastSegment(StringBuilder output) {
        final int idx = output.lastIndexOf("/");
        output.setLength(idx < 0 ? 0 : idx);
    }

    /**
     * Resolves a reference against a base IRI (RFC 3986 section 5.2.2).
     *
     * @param baseUri
     *            the base IRI, or null
     * @param pathToResolve
     *            the reference
     * @return the target IRI, or the reference unchanged if there is no base
     */
    public static String resolve(String baseUri, String pathToResolve) {
        if (baseUri == null) {
            return pathToResolve;
        }
        if (pathToResolve == null) {
            return baseUri;
        }
        final JsonLdUrl base = parse(baseUri);
        final JsonLdUrl ref = parse(pathToResolve);
        final JsonLdUrl target = new JsonLdUrl();

        if (ref.scheme != null) {
            target.scheme = ref.scheme;
            target.authority = ref.authority;
            target.path = removeDotSegments(ref.path);
            target.query = ref.query;
        } else {
            if (ref.authority != null) {
                target.authority = ref.authority;
                target.path = removeDotSegments(ref.path);
                target.query = ref.query;
            } else {
                if ("".equals(ref.path)) {
                    target.path = base.path;
                    target.query = ref.query != null ? ref.query : base.query;
                } else {
                    if (ref.path.startsWith("/")) {
                        target.path = removeDotSegments(ref.path);
                    } else {
                        target.path = removeDotSegments(merge(base, ref.path));
                    }
                    target.query = ref.query;
                }
                target.authority = base.authority;
            }
            target.scheme = base.scheme;
        }
        target.fragment = ref.fragment;
        return target.toString();
    }

    private static String merge(JsonLdUrl base, String refPath) {
        if (base.authority != null && "".equals(base.path)) {
            return "/" + refPath;
        }
        final int idx = base.path.lastIndexOf('/');
        return base.path.substring(0, idx + 1) + refPath;
    }

    /**
     * Removes a base IRI from the given absolute IRI, producing the relative
     * reference that resolves back to it.
     *
     * @param baseUri
     *            the base IRI, or null
     * @param iri
     *            the absolute IRI
     * @return the relative IRI if relative to base, otherwise the absolute
     *         IRI.
     */
    public static String removeBase(String baseUri, String iri) {
        if (baseUri == null) {
            return iri;
        }
        final JsonLdUrl base = parse(baseUri);
        final JsonLdUrl rel = parse(iri);

        // only IRIs sharing the base's scheme and authority can be relative
        if (base.scheme == null || !base.scheme.equals(rel.scheme)
                || !Objects.equals(base.authority, rel.authority)) {
            return iri;
        }

        // remove path segments that match (do not remove last segment unless
        // there is a hash or query)
        final List<String> baseSegments = new ArrayList<String>(
                Arrays.asList(removeDotSegments(base.path).split("/", -1)));
        final List<String> iriSegments = new ArrayList<String>(
                Arrays.asList(removeDotSegments(rel.path).split("/", -1)));
        final int last = (rel.query == null && rel.fragment == null) ? 1 : 0;
        while (baseSegments.size() > 0 && iriSegments.size() > last
                && baseSegments.get(0).equals(iriSegments.get(0))) {
            baseSegments.remove(0);
            iriSegments.remove(0);
        }

        // use '../' for each non-matching base segment
        final StringBuilder rval = new StringBuilder();
        if (baseSegments.size() > 0) {
            // the last base segment is a file name, not a directory
            baseSegments.remove(baseSegments.size() - 1);
            for (int i = 0; i < baseSegments.size(); ++i) {
                rval.append("../");
            }
        }

        // prepend remaining segments
        for (int i = 0; i < iriSegments.size(); i++) {
            if (i > 0) {
                rval.append('/');
            }
            rval.append(iriSegments.get(i));
        }

        // identical paths with a query on the base keep the target's query
        if (rel.query != null) {
            rval.append('?').append(rel.query);
        } else if (base.query != null && rval.length() == 0) {
            rval.append(lastSegment(rel.path));
        }
        if (rel.fragment != null) {
            rval.append('#').append(rel.fragment);
        }

        if (rval.length() == 0) {
            return "./";
        }
        // a first segment holding a colon would read as a scheme
        final String result = rval.toString();
        final int colon = result.indexOf(':');
        final int slash = result.indexOf('/');
        if (colon >= 0 && (slash < 0 || colon < slash)) {
            return "./" + result;
        }
        return result;
    }

    private static String lastSegment(String path) {
        final int idx = path.lastIndexOf('/');
        final String segment = path.substring(idx + 1);
        return "".equals(segment) ? "./" : segment;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        if (scheme != null) {
            sb.append(scheme).append(':');
        }
        if (authority != null) {
            sb.append("//").append(authority);
        }
        sb.append(path);
        if (query != null) {
            sb.append('?').append(query);
        }
        if (fragment != null) {
            sb.append('#').append(fragment);
        }
        return sb.toString();
    }
}

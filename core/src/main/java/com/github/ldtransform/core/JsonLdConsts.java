package com.github.ldtransform.core;

/**
 * Keyword and well-known IRI constants.
 *
 * @author tristan
 */
public final class JsonLdConsts {

    private JsonLdConsts() {
    }

    public static final String RDF_SYNTAX_NS = "http://www.w3.org/1999/02/22-rdf-syntax-ns#";
    public static final String RDF_JSON_LITERAL = RDF_SYNTAX_NS + "JSON";
    public static final String XSD_STRING = "http://www.w3.org/2001/XMLSchema#string";

    public static final String BASE = "@base";
    public static final String CONTAINER = "@container";
    public static final String CONTEXT = "@context";
    public static final String DIRECTION = "@direction";
    public static final String GRAPH = "@graph";
    public static final String ID = "@id";
    public static final String IMPORT = "@import";
    public static final String INCLUDED = "@included";
    public static final String INDEX = "@index";
    public static final String JSON = "@json";
    public static final String LANGUAGE = "@language";
    public static final String LIST = "@list";
    public static final String NEST = "@nest";
    public static final String NONE = "@none";
    public static final String PREFIX = "@prefix";
    public static final String PROPAGATE = "@propagate";
    public static final String PROTECTED = "@protected";
    public static final String REVERSE = "@reverse";
    public static final String SET = "@set";
    public static final String TYPE = "@type";
    public static final String VALUE = "@value";
    public static final String VERSION = "@version";
    public static final String VOCAB = "@vocab";

    // markers used only inside the inverse context
    static final String ANY = "@any";
    static final String NULL = "@null";
}

package com.github.ldtransform.core;

/**
 * What expansion does with a key that cannot be expanded into a keyword, an
 * IRI or a blank node identifier.
 */
public enum ExpansionPolicy {
    /** Undefined keys are kept verbatim in the expanded document. */
    RELAXED,

    /** Undefined keys are dropped unless they contain a ':', then they are kept. */
    STANDARD,

    /**
     * Undefined keys raise an error unless they contain a ':', then they are
     * kept.
     */
    STRICT,

    /** Undefined keys always raise an error. */
    STRICTEST
}

package com.github.ldtransform.core;

import java.util.HashMap;
import java.util.Map;

/**
 * Issues blank node identifiers {@code _:b0}, {@code _:b1}, ... for one run.
 * An existing identifier is always mapped to the same new identifier.
 */
public class BlankNodeIdGenerator {

    private final Map<String, String> identifierMap = new HashMap<String, String>();
    private final String prefix;
    private int counter = 0;

    public BlankNodeIdGenerator() {
        this("_:b");
    }

    public BlankNodeIdGenerator(String prefix) {
        this.prefix = prefix;
    }

    /**
     * Generates a blank node identifier for the given key.
     *
     * @param id
     *            the identifier being relabelled, or null for a fresh one
     * @return the new identifier
     */
    public String generate(String id) {
        if (id != null && identifierMap.containsKey(id)) {
            return identifierMap.get(id);
        }
        final String bid = prefix + counter++;
        if (id != null) {
            identifierMap.put(id, bid);
        }
        return bid;
    }

    public String generate() {
        return generate(null);
    }
}

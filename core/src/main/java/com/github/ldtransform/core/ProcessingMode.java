package com.github.ldtransform.core;

/**
 * Processing mode. Features introduced by JSON-LD 1.1 are available unless
 * the mode is {@link #JSON_LD_1_0}.
 */
public enum ProcessingMode {
    JSON_LD_1_0("json-ld-1.0"),

    JSON_LD_1_1("json-ld-1.1");

    private final String name;

    private ProcessingMode(String name) {
        this.name = name;
    }

    /**
     * @return the mode matching the given name, as written in test manifests
     *         and the {@code processingMode} API option
     * @throws IllegalArgumentException
     *             if the name is not a known mode
     */
    public static ProcessingMode fromName(String name) {
        for (final ProcessingMode mode : values()) {
            if (mode.name.equals(name)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown processing mode: " + name);
    }

    @Override
    public String toString() {
        return name;
    }
}

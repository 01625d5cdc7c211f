package com.github.ldtransform.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * https://www.w3.org/TR/json-ld11-api/#the-jsonldoptions-type
 *
 * @author tristan
 *
 */
public class JsonLdOptions {

    /** Longest chain of remote contexts followed before giving up. */
    public static final int MAX_REMOTE_CONTEXTS = 32;

    public static final int DEFAULT_MAX_DEPTH = 512;

    public JsonLdOptions() {
        this("");
    }

    public JsonLdOptions(String base) {
        this.setBase(base);
    }

    private String base = null;
    private boolean compactArrays = true;
    private boolean compactToRelative = true;
    private JsonNode expandContext = null;
    private ProcessingMode processingMode = ProcessingMode.JSON_LD_1_1;
    private boolean ordered = false;
    private ExpansionPolicy expansionPolicy = ExpansionPolicy.STANDARD;
    private boolean labelBlankNodes = false;
    private int maxDepth = DEFAULT_MAX_DEPTH;
    private DocumentLoader documentLoader = new DefaultDocumentLoader();
    private List<String> warnings = new ArrayList<String>();

    /**
     * @return a copy of these options that can be changed independently. The
     *         document loader and the warnings are shared.
     */
    public JsonLdOptions copy() {
        final JsonLdOptions rval = new JsonLdOptions(getBase());
        rval.compactArrays = compactArrays;
        rval.compactToRelative = compactToRelative;
        rval.expandContext = expandContext;
        rval.processingMode = processingMode;
        rval.ordered = ordered;
        rval.expansionPolicy = expansionPolicy;
        rval.labelBlankNodes = labelBlankNodes;
        rval.maxDepth = maxDepth;
        rval.documentLoader = documentLoader;
        rval.warnings = warnings;
        return rval;
    }

    public boolean getCompactArrays() {
        return compactArrays;
    }

    public void setCompactArrays(boolean compactArrays) {
        this.compactArrays = compactArrays;
    }

    public boolean getCompactToRelative() {
        return compactToRelative;
    }

    public void setCompactToRelative(boolean compactToRelative) {
        this.compactToRelative = compactToRelative;
    }

    public JsonNode getExpandContext() {
        return expandContext;
    }

    public void setExpandContext(JsonNode expandContext) {
        this.expandContext = expandContext;
    }

    public ProcessingMode getProcessingMode() {
        return processingMode;
    }

    public void setProcessingMode(ProcessingMode processingMode) {
        this.processingMode = processingMode;
    }

    public boolean processingMode(ProcessingMode mode) {
        return this.processingMode == mode;
    }

    public String getBase() {
        return base;
    }

    public void setBase(String base) {
        this.base = base;
    }

    public boolean getOrdered() {
        return ordered;
    }

    public void setOrdered(boolean ordered) {
        this.ordered = ordered;
    }

    public ExpansionPolicy getExpansionPolicy() {
        return expansionPolicy;
    }

    public void setExpansionPolicy(ExpansionPolicy expansionPolicy) {
        this.expansionPolicy = expansionPolicy;
    }

    public boolean getLabelBlankNodes() {
        return labelBlankNodes;
    }

    public void setLabelBlankNodes(boolean labelBlankNodes) {
        this.labelBlankNodes = labelBlankNodes;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, was " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public DocumentLoader getDocumentLoader() {
        return documentLoader;
    }

    public void setDocumentLoader(DocumentLoader documentLoader) {
        this.documentLoader = documentLoader;
    }

    /**
     * @return the distinct warnings raised by the runs that used these
     *         options, oldest first. Keys and terms that have the form of a
     *         keyword are ignored with a warning.
     */
    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public void clearWarnings() {
        warnings.clear();
    }

    /**
     * @return false if the same warning was already raised
     */
    boolean addWarning(String warning) {
        if (warnings.contains(warning)) {
            return false;
        }
        return warnings.add(warning);
    }
}

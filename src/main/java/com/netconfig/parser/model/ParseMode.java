package com.netconfig.parser.model;

/**
 * How a document's hierarchy is inferred.
 */
public enum ParseMode {
    /**
     * Leading spaces define nesting (IOS, IOS-XR, EOS style).
     */
    INDENTATION,

    /**
     * Trailing braces define nesting (Junos style).
     */
    BRACED,

    /**
     * Sniff the first lines of the document and pick one of the above.
     */
    AUTO
}

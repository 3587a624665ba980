package com.hypothesis.client;

/**
 * Shape hint passed with every completion request.
 */
public enum OutputFormat {

    /**
     * A single JSON object; providers switch on their native JSON mode where they have one.
     */
    JSON,

    /**
     * Free text.
     */
    TEXT
}

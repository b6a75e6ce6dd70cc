package org.bpmnlite.compiler.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Root of the compiler configuration file.
 * <p>
 * Example:
 * {
 * "strictSchema": false,
 * "failOnUnresolvedErrorRef": false,
 * "prettyPrintOutput": true
 * }
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CompilerConfig {
    /**
     * Validate the document against the BPMN 2.0 XSD before compiling.
     */
    public Boolean strictSchema;

    /**
     * Reject boundary error events whose errorRef names no {@code <error>} element
     * instead of compiling them as catch-all boundaries.
     */
    public Boolean failOnUnresolvedErrorRef;

    /**
     * Indent the program JSON written by the command line tool.
     */
    public Boolean prettyPrintOutput;
}

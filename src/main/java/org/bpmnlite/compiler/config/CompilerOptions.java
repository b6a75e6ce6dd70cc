package org.bpmnlite.compiler.config;

import lombok.Builder;

/**
 * Immutable switches for one compiler instance.
 */
@Builder
public record CompilerOptions(
        boolean strictSchema,
        boolean failOnUnresolvedErrorRef,
        boolean prettyPrintOutput
) {
    public static CompilerOptions defaults() {
        return CompilerOptions.builder().build();
    }
}

package org.bpmnlite.compiler.bytecode.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Where execution resumes when the activity fails with a matching error.
 *
 * @param errorCode the matched code, or null for a catch-all route
 */
public record ErrorRoute(String errorCode, int resumeAt, String boundaryElementId) {

    @JsonIgnore
    public boolean isCatchAll() {
        return errorCode == null;
    }
}

package org.bpmnlite.compiler.bpmn.models;

/**
 * Payload of a resolved sequence flow.
 *
 * @param id        the sequence flow id
 * @param condition the parsed condition, or null for an unconditioned (default) flow
 */
public record IREdge(
        String id,
        ConditionExpr condition
) {
    public IREdge(String id) {
        this(id, null);
    }

    public boolean isConditional() {
        return condition != null;
    }
}

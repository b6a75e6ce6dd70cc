package org.bpmnlite.compiler.bpmn.models;

/**
 * A parsed sequence-flow condition such as {@code approved == true} or {@code count > 5}.
 *
 * @param flagName the run-time flag the condition reads
 * @param op       the comparison
 * @param literal  the value the flag is compared against
 */
public record ConditionExpr(
        String flagName,
        ConditionOp op,
        ConditionLiteral literal
) {
    @Override
    public String toString() {
        return flagName + " " + op.symbol() + " " + literal;
    }
}

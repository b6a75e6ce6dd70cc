package org.bpmnlite.compiler.bytecode.models;

import org.bpmnlite.compiler.bpmn.models.ConditionExpr;

/**
 * @param condition the branch guard, or null for a branch that is always taken
 */
public record InclusiveBranch(ConditionExpr condition, int target) {
}

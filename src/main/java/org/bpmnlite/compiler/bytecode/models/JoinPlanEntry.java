package org.bpmnlite.compiler.bytecode.models;

/**
 * @param dynamic true for an inclusive join, whose arrival count is decided by the paired fork at run time
 */
public record JoinPlanEntry(String gatewayId, int expected, int next, boolean dynamic) {
}

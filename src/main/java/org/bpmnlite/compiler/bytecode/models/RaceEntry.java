package org.bpmnlite.compiler.bytecode.models;

import java.util.List;

/**
 * The race run while the activity at {@code activityAddr} is in flight.
 * Arm 0 is always {@link WaitArm.Internal}, followed by one arm per boundary event in boundary id order.
 */
public record RaceEntry(int activityAddr, List<WaitArm> arms) {
    public RaceEntry {
        arms = List.copyOf(arms);
    }
}

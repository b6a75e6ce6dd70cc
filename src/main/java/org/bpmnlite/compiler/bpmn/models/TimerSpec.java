package org.bpmnlite.compiler.bpmn.models;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TimerSpec.Duration.class, name = "Duration"),
        @JsonSubTypes.Type(value = TimerSpec.Date.class, name = "Date"),
        @JsonSubTypes.Type(value = TimerSpec.Cycle.class, name = "Cycle")
})
public interface TimerSpec {

    /**
     * Relative delay in milliseconds.
     */
    record Duration(long ms) implements TimerSpec {
    }

    /**
     * Absolute deadline in epoch milliseconds.
     */
    record Date(long deadlineMs) implements TimerSpec {
    }

    /**
     * Repeating interval: fires every {@code intervalMs}, at most {@code maxFires} times.
     */
    record Cycle(long intervalMs, int maxFires) implements TimerSpec {
    }
}

package org.bpmnlite.compiler.bpmn.models;

/**
 * Which timer child element carried the timer literal.
 */
public enum TimerKind {
    DURATION,  // <timeDuration>
    DATE,      // <timeDate>
    CYCLE      // <timeCycle>
}

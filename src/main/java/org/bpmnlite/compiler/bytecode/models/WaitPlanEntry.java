package org.bpmnlite.compiler.bytecode.models;

public record WaitPlanEntry(WaitType waitType, String name, String corrKeySource, String elementId) {
}

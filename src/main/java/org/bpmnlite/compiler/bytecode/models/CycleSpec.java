package org.bpmnlite.compiler.bytecode.models;

public record CycleSpec(long intervalMs, int maxFires) {
}

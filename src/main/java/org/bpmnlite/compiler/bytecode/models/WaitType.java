package org.bpmnlite.compiler.bytecode.models;

public enum WaitType {
    MESSAGE,
    HUMAN
}

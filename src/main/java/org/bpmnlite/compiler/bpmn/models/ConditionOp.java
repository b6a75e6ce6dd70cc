package org.bpmnlite.compiler.bpmn.models;

public enum ConditionOp {
    EQ("=="),
    NEQ("!="),
    GT(">"),
    LT("<");

    private final String symbol;

    ConditionOp(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}

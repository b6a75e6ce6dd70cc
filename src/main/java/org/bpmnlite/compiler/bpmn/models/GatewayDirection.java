package org.bpmnlite.compiler.bpmn.models;

public enum GatewayDirection {
    DIVERGING,
    CONVERGING;

    /**
     * Only an explicit {@code gatewayDirection="Converging"} converges; anything else diverges.
     */
    public static GatewayDirection fromAttribute(String value) {
        return "Converging".equals(value) ? CONVERGING : DIVERGING;
    }
}

package org.bpmnlite.compiler.bpmn.models;

/**
 * A workflow node of the intermediate representation, one record per supported BPMN element kind.
 * Every node keeps the BPMN id it was parsed from.
 */
public interface IRNode {

    String id();

    /**
     * Activities are the nodes a boundary event may be attached to.
     */
    default boolean isActivity() {
        return this instanceof ServiceTask || this instanceof HumanWait;
    }

    default boolean isBoundary() {
        return this instanceof BoundaryTimer || this instanceof BoundaryError;
    }

    default boolean isGateway() {
        return this instanceof GatewayXor || this instanceof GatewayAnd || this instanceof GatewayInclusive;
    }

    /**
     * The activity id a boundary node is attached to, or null for any other node.
     */
    default String attachedTo() {
        return null;
    }

    record Start(String id) implements IRNode {
    }

    /**
     * @param terminate true for a terminate end event, which ends the whole process instance
     */
    record End(String id, boolean terminate) implements IRNode {
    }

    record ServiceTask(String id, String name, String taskType) implements IRNode {
    }

    /**
     * A user task: the process waits for a human decision delivered as a correlated message.
     */
    record HumanWait(String id, String name, String taskKind, String corrKeySource) implements IRNode {
    }

    record GatewayXor(String id, String name) implements IRNode {
    }

    record GatewayAnd(String id, String name, GatewayDirection direction) implements IRNode {
    }

    record GatewayInclusive(String id, String name, GatewayDirection direction) implements IRNode {
    }

    record TimerWait(String id, TimerSpec spec) implements IRNode {
    }

    record MessageWait(String id, String name, String corrKeySource) implements IRNode {
    }

    record BoundaryTimer(String id, String attachedTo, TimerSpec spec, boolean interrupting) implements IRNode {
    }

    /**
     * @param errorCode the resolved error code, or null when the boundary catches any error
     */
    record BoundaryError(String id, String attachedTo, String errorCode) implements IRNode {
    }
}

package org.bpmnlite.compiler.bpmn;

/**
 * An element whose node (or flow) can only be finalized once its children have been seen.
 * The parser holds at most one of these at a time.
 */
interface ElementContext {

    String id();

    record ServiceTask(String id, String name) implements ElementContext {
    }

    record UserTask(String id, String name) implements ElementContext {
    }

    record IntermediateCatch(String id, String name) implements ElementContext {
    }

    record SequenceFlow(String id, String source, String target) implements ElementContext {
    }

    record BoundaryEvent(String id, String attachedTo, boolean cancelActivity) implements ElementContext {
    }

    record EndEvent(String id) implements ElementContext {
    }
}

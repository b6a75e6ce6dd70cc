package org.bpmnlite.compiler.bpmn;

/**
 * The event definition child seen inside the element currently awaiting close.
 */
interface EventDefinition {

    String elementName();

    record Timer() implements EventDefinition {
        @Override
        public String elementName() {
            return "timerEventDefinition";
        }
    }

    record Message() implements EventDefinition {
        @Override
        public String elementName() {
            return "messageEventDefinition";
        }
    }

    record Terminate() implements EventDefinition {
        @Override
        public String elementName() {
            return "terminateEventDefinition";
        }
    }

    /**
     * @param errorRef id of the referenced {@code <error>} element, or null
     */
    record Error(String errorRef) implements EventDefinition {
        @Override
        public String elementName() {
            return "errorEventDefinition";
        }
    }
}

package org.bpmnlite.compiler.errors;

/**
 * Thrown by every compiler phase on the first problem it finds.
 * There is no partial result: callers either get a program or this exception.
 */
public class BpmnCompileException extends RuntimeException {

    private final ErrorKind kind;

    public BpmnCompileException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public BpmnCompileException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static BpmnCompileException xmlSyntax(String detail, Throwable cause) {
        return new BpmnCompileException(ErrorKind.XML_SYNTAX_ERROR, "XML parse error: " + detail, cause);
    }

    public static BpmnCompileException missingAttribute(String element, String attribute) {
        return new BpmnCompileException(ErrorKind.MISSING_REQUIRED_ATTRIBUTE,
                "Missing required attribute '" + attribute + "' on <" + element + ">");
    }

    /**
     * @param ownerId the flow (or boundary event) holding the dangling reference
     * @param refKind which attribute held it, e.g. "sourceRef", "targetRef" or "errorRef"
     * @param refId   the value that could not be resolved
     */
    public static BpmnCompileException unresolvedReference(String ownerId, String refKind, String refId) {
        return new BpmnCompileException(ErrorKind.UNRESOLVED_REFERENCE,
                "'" + ownerId + "' references unknown " + refKind + " '" + refId + "'");
    }

    public static BpmnCompileException unsupportedElement(String tag, String id) {
        return new BpmnCompileException(ErrorKind.UNSUPPORTED_ELEMENT,
                "Unsupported BPMN element: <" + tag + "> (id=" + id + ")");
    }

    public static BpmnCompileException misplacedEventDefinition(String kind, String context) {
        return new BpmnCompileException(ErrorKind.MISPLACED_EVENT_DEFINITION,
                context + ": " + kind + " is not allowed here");
    }

    public static BpmnCompileException missingEventDefinition(String elementId, String expected) {
        return new BpmnCompileException(ErrorKind.MISSING_EVENT_DEFINITION,
                "'" + elementId + "' has no " + expected + " event definition");
    }

    public static BpmnCompileException timerSpec(String reason) {
        return new BpmnCompileException(ErrorKind.TIMER_SPEC_ERROR, "Invalid timer spec: " + reason);
    }

    public static BpmnCompileException verification(String reason) {
        return new BpmnCompileException(ErrorKind.VERIFICATION_ERROR, "Verification failed: " + reason);
    }

    public static BpmnCompileException duplicateId(String id) {
        return new BpmnCompileException(ErrorKind.DUPLICATE_ELEMENT_ID, "Duplicate BPMN element id '" + id + "'");
    }

    public static BpmnCompileException schemaViolation(String detail, Throwable cause) {
        return new BpmnCompileException(ErrorKind.SCHEMA_VIOLATION, "BPMN schema violation: " + detail, cause);
    }
}

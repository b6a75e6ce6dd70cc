package org.bpmnlite.compiler.errors;

/**
 * Failure categories reported by the compiler.
 * A condition expression that cannot be parsed is not listed here: the flow simply stays unconditioned.
 */
public enum ErrorKind {
    XML_SYNTAX_ERROR,
    MISSING_REQUIRED_ATTRIBUTE,
    UNRESOLVED_REFERENCE,
    UNSUPPORTED_ELEMENT,
    MISPLACED_EVENT_DEFINITION,
    MISSING_EVENT_DEFINITION,
    TIMER_SPEC_ERROR,
    VERIFICATION_ERROR,
    DUPLICATE_ELEMENT_ID,
    SCHEMA_VIOLATION
}

package org.bpmnlite.compiler.bpmn.models;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Right-hand side of a flag comparison: either a boolean or a signed 64-bit integer.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ConditionLiteral.Bool.class, name = "Bool"),
        @JsonSubTypes.Type(value = ConditionLiteral.I64.class, name = "I64")
})
public interface ConditionLiteral {

    record Bool(boolean value) implements ConditionLiteral {
        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    record I64(long value) implements ConditionLiteral {
        @Override
        public String toString() {
            return Long.toString(value);
        }
    }
}

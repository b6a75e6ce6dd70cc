package org.bpmnlite.compiler.bpmn;

import org.bpmnlite.compiler.errors.BpmnCompileException;
import org.bpmnlite.compiler.errors.ErrorKind;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class BpmnSchemaValidatorTest {
    private static final String VALID_BPMN = "src/test/resources/models/linear_service_task.bpmn";
    private static final String INVALID_BPMN = "src/test/resources/models/unknown_element.bpmn";

    @Test
    void shouldValidateWhenValid() throws IOException {
        String xml = Files.readString(Path.of(VALID_BPMN));

        assertDoesNotThrow(() -> BpmnSchemaValidator.validate(xml));
        assertTrue(BpmnSchemaValidator.isValid(xml));
    }

    @Test
    void shouldThrowWhenInvalid() throws IOException {
        String xml = Files.readString(Path.of(INVALID_BPMN));

        var ex = assertThrows(BpmnCompileException.class, () -> BpmnSchemaValidator.validate(xml));
        assertEquals(ErrorKind.SCHEMA_VIOLATION, ex.getKind());
        assertFalse(BpmnSchemaValidator.isValid(xml));
    }

    @Test
    void shouldRejectDocumentWithoutBpmnNamespace() {
        assertFalse(BpmnSchemaValidator.isValid("<definitions><process id=\"p\"/></definitions>"));
    }
}

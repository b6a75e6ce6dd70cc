package org.bpmnlite.compiler.bpmn;

import org.bpmnlite.compiler.errors.BpmnCompileException;
import org.camunda.bpm.model.bpmn.Bpmn;
import org.camunda.bpm.model.bpmn.BpmnModelInstance;
import org.camunda.bpm.model.xml.ModelException;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Strict pre-check of a document against the BPMN 2.0 XSD, using the Camunda model API.
 * Vendor-only or default-namespace documents that the lightweight parser tolerates are rejected here.
 */
public class BpmnSchemaValidator {

    /**
     * Throws a SCHEMA_VIOLATION error if the document is not schema-valid BPMN.
     */
    public static void validate(String xml) {
        if (xml == null) {
            throw new IllegalArgumentException("BPMN document must not be null");
        }

        InputStream is = new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8));
        try {
            BpmnModelInstance modelInstance = Bpmn.readModelFromStream(is);
            Bpmn.validateModel(modelInstance);
        } catch (ModelException e) {
            throw BpmnCompileException.schemaViolation(e.getMessage(), e);
        }
    }

    /**
     * Boolean-style validation.
     */
    public static boolean isValid(String xml) {
        try {
            validate(xml);
            return true;
        } catch (BpmnCompileException e) {
            return false;
        }
    }
}

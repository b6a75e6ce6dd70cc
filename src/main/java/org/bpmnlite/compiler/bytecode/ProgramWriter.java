package org.bpmnlite.compiler.bytecode;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.bpmnlite.compiler.bytecode.models.Program;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders a {@link Program} as the JSON document loaded by the workflow runtime.
 */
public class ProgramWriter {

    private final ObjectMapper mapper;

    public ProgramWriter(boolean prettyPrint) {
        this.mapper = new ObjectMapper()
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .configure(SerializationFeature.INDENT_OUTPUT, prettyPrint);
    }

    public String toJson(Program program) {
        try {
            return mapper.writeValueAsString(program);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Program cannot be serialized", e);
        }
    }

    public void writeToFile(Program program, Path outputPath) throws IOException {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputPath, toJson(program), StandardCharsets.UTF_8);
    }
}
